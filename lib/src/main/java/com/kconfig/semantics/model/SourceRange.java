package com.kconfig.semantics.model;

import java.nio.file.Path;
import java.util.Objects;

/** A span of source text. Lines and columns are 1-based; the end column is exclusive. */
public final class SourceRange {
    private final Path file;
    private final int startLine;
    private final int startColumn;
    private final int endLine;
    private final int endColumn;

    public SourceRange(Path file, int startLine, int startColumn, int endLine, int endColumn) {
        this.file = file;
        this.startLine = startLine;
        this.startColumn = startColumn;
        this.endLine = endLine;
        this.endColumn = endColumn;
    }

    /** Whole-line range covering {@code startLine..endLine}. */
    public static SourceRange lines(Path file, int startLine, int endLine) {
        return new SourceRange(file, startLine, 1, endLine, Integer.MAX_VALUE);
    }

    public static SourceRange line(Path file, int line) {
        return lines(file, line, line);
    }

    /** Empty range at the start of {@code line}, used as an insertion point. */
    public static SourceRange point(Path file, int line) {
        return new SourceRange(file, line, 1, line, 1);
    }

    public Path getFile() {
        return file;
    }

    public int getStartLine() {
        return startLine;
    }

    public int getStartColumn() {
        return startColumn;
    }

    public int getEndLine() {
        return endLine;
    }

    public int getEndColumn() {
        return endColumn;
    }

    public SourceRange withEndLine(int line) {
        return new SourceRange(file, startLine, startColumn, line, endColumn);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof SourceRange)) {
            return false;
        }
        SourceRange other = (SourceRange) obj;
        return startLine == other.startLine
                && startColumn == other.startColumn
                && endLine == other.endLine
                && endColumn == other.endColumn
                && Objects.equals(file, other.file);
    }

    @Override
    public int hashCode() {
        return Objects.hash(file, startLine, startColumn, endLine, endColumn);
    }

    @Override
    public String toString() {
        String position = startLine + ":" + startColumn;
        if (endLine != startLine) {
            position = position + "-" + endLine;
        }
        return file + ":" + position;
    }
}
