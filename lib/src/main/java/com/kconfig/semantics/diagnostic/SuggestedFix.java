package com.kconfig.semantics.diagnostic;

import com.kconfig.semantics.model.SourceRange;
import java.util.List;
import java.util.Objects;

/** A titled set of edits that resolves a diagnostic. */
public final class SuggestedFix {
    private final String title;
    private final boolean preferred;
    private final List<TextEdit> edits;

    public SuggestedFix(String title, boolean preferred, List<TextEdit> edits) {
        this.title = Objects.requireNonNull(title, "title");
        this.preferred = preferred;
        this.edits = List.copyOf(edits);
    }

    /** Deletes the whole of {@code line}, line break included. */
    public static SuggestedFix removeLine(String title, SourceRange line) {
        SourceRange span = new SourceRange(line.getFile(), line.getStartLine(), 1, line.getStartLine() + 1, 1);
        return new SuggestedFix(title, true, List.of(TextEdit.delete(span)));
    }

    public String getTitle() {
        return title;
    }

    public boolean isPreferred() {
        return preferred;
    }

    public List<TextEdit> getEdits() {
        return edits;
    }

    @Override
    public String toString() {
        return title;
    }
}
