package com.kconfig.semantics.diagnostic;

import com.kconfig.semantics.model.SourceRange;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A problem report produced while parsing Kconfig files or linting override files. Rules build
 * diagnostics up incrementally, so related locations, fixes and the unnecessary tag are mutable.
 */
public final class Diagnostic {
    private final Severity severity;
    private final String message;
    private final SourceRange range;
    private boolean unnecessary;
    private final List<RelatedLocation> related = new ArrayList<>();
    private final List<SuggestedFix> fixes = new ArrayList<>();

    public Diagnostic(Severity severity, String message, SourceRange range) {
        this.severity = Objects.requireNonNull(severity, "severity");
        this.message = Objects.requireNonNull(message, "message");
        this.range = range;
    }

    public static Diagnostic error(String message, SourceRange range) {
        return new Diagnostic(Severity.ERROR, message, range);
    }

    public static Diagnostic warning(String message, SourceRange range) {
        return new Diagnostic(Severity.WARNING, message, range);
    }

    public static Diagnostic hint(String message, SourceRange range) {
        return new Diagnostic(Severity.HINT, message, range);
    }

    public Severity getSeverity() {
        return severity;
    }

    public String getMessage() {
        return message;
    }

    public SourceRange getRange() {
        return range;
    }

    /** Start line of the range, or 0 when the diagnostic has no location. */
    public int getLine() {
        return range == null ? 0 : range.getStartLine();
    }

    public boolean isUnnecessary() {
        return unnecessary;
    }

    public Diagnostic markUnnecessary() {
        this.unnecessary = true;
        return this;
    }

    public List<RelatedLocation> getRelated() {
        return Collections.unmodifiableList(related);
    }

    public Diagnostic addRelated(SourceRange location, String text) {
        if (location != null) {
            related.add(new RelatedLocation(location, text));
        }
        return this;
    }

    public List<SuggestedFix> getFixes() {
        return Collections.unmodifiableList(fixes);
    }

    public Diagnostic addFix(SuggestedFix fix) {
        fixes.add(Objects.requireNonNull(fix, "fix"));
        return this;
    }

    @Override
    public String toString() {
        String where = range == null ? "" : range + ": ";
        return where + severity + " " + message;
    }
}
