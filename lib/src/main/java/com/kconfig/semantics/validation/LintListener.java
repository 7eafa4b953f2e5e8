package com.kconfig.semantics.validation;

import com.kconfig.semantics.diagnostic.Diagnostic;
import com.kconfig.semantics.overrides.OverrideFile;
import java.util.List;

/** Receives the diagnostics of a completed lint pass. Called on the scheduler's worker thread. */
@FunctionalInterface
public interface LintListener {

    /**
     * @param diagnostics Parse diagnostics of {@code version} followed by its lint diagnostics.
     */
    void published(OverrideFile file, int version, List<Diagnostic> diagnostics);
}
