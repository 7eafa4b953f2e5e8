package com.kconfig.semantics.model;

import java.nio.file.Path;

/**
 * Lexical nesting context that gates the entries inside it. Scopes reference their parent by
 * {@link ScopeTable} id and are identified across re-parses by a key derived from their position
 * in the scope tree, so re-creating a scope at the same place yields the same id.
 */
public abstract class Scope {

    public enum Kind {
        ROOT,
        MENU,
        IF,
        CHOICE
    }

    private final String key;
    private final int parentId;
    private final Path file;
    private final int startLine;
    private int endLine;
    private int id = -1;

    protected Scope(String key, int parentId, Path file, int startLine) {
        this.key = key;
        this.parentId = parentId;
        this.file = file;
        this.startLine = startLine;
        this.endLine = startLine;
    }

    public abstract Kind getKind();

    /** Display name: menu prompt, if condition or choice name. */
    public abstract String getName();

    public String getKey() {
        return key;
    }

    public int getId() {
        return id;
    }

    void assignId(int id) {
        this.id = id;
    }

    /** Parent scope id, or -1 for the root. */
    public int getParentId() {
        return parentId;
    }

    public Path getFile() {
        return file;
    }

    public SourceRange getLocation() {
        return SourceRange.lines(file, startLine, endLine);
    }

    public void close(int line) {
        this.endLine = line;
    }

    @Override
    public String toString() {
        return key;
    }
}
