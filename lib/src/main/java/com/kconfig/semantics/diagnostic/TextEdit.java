package com.kconfig.semantics.diagnostic;

import com.kconfig.semantics.model.SourceRange;
import java.util.Objects;

/** A single change to a document. Inserted and replacement text carries its own line breaks. */
public final class TextEdit {

    public enum Kind {
        INSERT,
        REPLACE,
        DELETE
    }

    private final Kind kind;
    private final SourceRange range;
    private final String text;

    private TextEdit(Kind kind, SourceRange range, String text) {
        this.kind = kind;
        this.range = Objects.requireNonNull(range, "range");
        this.text = text;
    }

    public static TextEdit insert(SourceRange position, String text) {
        return new TextEdit(Kind.INSERT, position, text);
    }

    public static TextEdit replace(SourceRange range, String text) {
        return new TextEdit(Kind.REPLACE, range, text);
    }

    public static TextEdit delete(SourceRange range) {
        return new TextEdit(Kind.DELETE, range, "");
    }

    public Kind getKind() {
        return kind;
    }

    public SourceRange getRange() {
        return range;
    }

    public String getText() {
        return text;
    }

    @Override
    public String toString() {
        return kind + " " + range + (text.isEmpty() ? "" : " '" + text + "'");
    }
}
