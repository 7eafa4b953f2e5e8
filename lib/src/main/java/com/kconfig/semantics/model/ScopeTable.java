package com.kconfig.semantics.model;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Arena of scopes indexed by integer id. Registering a scope whose key is already known replaces
 * the previous scope under the same id, which keeps entries of untouched files valid when an
 * including file is re-parsed.
 */
public final class ScopeTable {
    public static final int ROOT_ID = 0;

    private final List<Scope> scopes = new ArrayList<>();
    private final Map<String, Integer> idsByKey = new HashMap<>();

    ScopeTable() {
        register(new RootScope());
    }

    public int register(Scope scope) {
        Integer id = idsByKey.get(scope.getKey());
        if (id == null) {
            id = scopes.size();
            scopes.add(scope);
            idsByKey.put(scope.getKey(), id);
        } else {
            scopes.set(id, scope);
        }
        scope.assignId(id);
        return id;
    }

    public Scope get(int id) {
        return scopes.get(id);
    }

    public Scope getRoot() {
        return scopes.get(ROOT_ID);
    }

    /** Scopes from {@code id} up to, excluding, the root. */
    public List<Scope> chain(int id) {
        List<Scope> chain = new ArrayList<>();
        int current = id;
        while (current > ROOT_ID) {
            Scope scope = scopes.get(current);
            chain.add(scope);
            current = scope.getParentId();
        }
        return chain;
    }

    /**
     * Builds the key for a scope opened in {@code file} under {@code parentId}; {@code ordinal}
     * separates siblings that would otherwise share a key.
     */
    public String childKey(int parentId, String type, String name, Path file, int ordinal) {
        return scopes.get(parentId).getKey() + "::" + type + "(" + name + ")@" + file + "#" + ordinal;
    }

    public int size() {
        return scopes.size();
    }
}
