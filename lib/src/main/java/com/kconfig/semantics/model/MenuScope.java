package com.kconfig.semantics.model;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class MenuScope extends Scope {
    private final String prompt;
    private final List<String> dependencies = new ArrayList<>();

    public MenuScope(String key, int parentId, Path file, int line, String prompt) {
        super(key, parentId, file, line);
        this.prompt = prompt;
    }

    @Override
    public Kind getKind() {
        return Kind.MENU;
    }

    @Override
    public String getName() {
        return prompt;
    }

    /** {@code depends on} clauses written directly inside the menu, gating all descendants. */
    public List<String> getDependencies() {
        return Collections.unmodifiableList(dependencies);
    }

    public void addDependency(String expression) {
        dependencies.add(expression);
    }
}
