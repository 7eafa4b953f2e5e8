package com.kconfig.semantics.model;

public final class RootScope extends Scope {
    public static final String KEY = "root";

    RootScope() {
        super(KEY, -1, null, 0);
    }

    @Override
    public Kind getKind() {
        return Kind.ROOT;
    }

    @Override
    public String getName() {
        return KEY;
    }
}
