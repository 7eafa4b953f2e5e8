package com.kconfig.semantics.evaluation;

import com.kconfig.semantics.model.ConfigOverride;
import java.util.List;

/**
 * Overrides that satisfy a dependency: {@code insertions} are new lines, {@code changes} replace
 * existing lines and keep those lines' locations.
 */
public record DependencyFix(List<ConfigOverride> insertions, List<ConfigOverride> changes) {

    public DependencyFix {
        insertions = List.copyOf(insertions);
        changes = List.copyOf(changes);
    }

    public int size() {
        return insertions.size() + changes.size();
    }
}
