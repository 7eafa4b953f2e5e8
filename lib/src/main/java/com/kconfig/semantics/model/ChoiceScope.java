package com.kconfig.semantics.model;

import java.nio.file.Path;

/**
 * Wraps the entry of a {@code choice} block. Members are only gated by the choice's own
 * dependencies; mutual exclusion between members is not enforced.
 */
public final class ChoiceScope extends Scope {
    private final Entry choice;

    public ChoiceScope(String key, int parentId, Path file, int line, Entry choice) {
        super(key, parentId, file, line);
        this.choice = choice;
    }

    @Override
    public Kind getKind() {
        return Kind.CHOICE;
    }

    @Override
    public String getName() {
        String prompt = choice.getPrompt();
        return prompt != null ? prompt : choice.getSymbol().getName();
    }

    public Entry getChoice() {
        return choice;
    }
}
