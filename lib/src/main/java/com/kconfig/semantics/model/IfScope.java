package com.kconfig.semantics.model;

import java.nio.file.Path;

public final class IfScope extends Scope {
    private final String condition;

    public IfScope(String key, int parentId, Path file, int line, String condition) {
        super(key, parentId, file, line);
        this.condition = condition;
    }

    @Override
    public Kind getKind() {
        return Kind.IF;
    }

    @Override
    public String getName() {
        return condition;
    }

    public String getCondition() {
        return condition;
    }
}
