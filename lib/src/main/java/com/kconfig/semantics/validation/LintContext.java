package com.kconfig.semantics.validation;

import com.kconfig.semantics.diagnostic.SuggestedFix;
import com.kconfig.semantics.evaluation.DependencySolver;
import com.kconfig.semantics.evaluation.EvaluationContext;
import com.kconfig.semantics.model.ConfigOverride;
import com.kconfig.semantics.model.Repository;
import com.kconfig.semantics.overrides.BuildContext;
import com.kconfig.semantics.overrides.OverrideFile;
import java.util.List;

/** Everything a lint pass over one override file reads. */
public final class LintContext {
    private final Repository repository;
    private final OverrideFile file;
    private final List<ConfigOverride> fileOverrides;
    private final List<ConfigOverride> overrides;
    private final EvaluationContext evaluation;
    private final DependencySolver solver;

    LintContext(BuildContext build, OverrideFile file, List<ConfigOverride> fileOverrides) {
        this.repository = build.getRepository();
        this.file = file;
        this.fileOverrides = List.copyOf(fileOverrides);
        this.overrides = build.overrides();
        this.evaluation = new EvaluationContext(repository, overrides);
        this.solver = new DependencySolver(repository);
    }

    public Repository getRepository() {
        return repository;
    }

    public OverrideFile getFile() {
        return file;
    }

    /** Overrides of the file being linted, as of the pass's version. */
    public List<ConfigOverride> getFileOverrides() {
        return fileOverrides;
    }

    /** Overrides of the whole build, in precedence order. */
    public List<ConfigOverride> getOverrides() {
        return overrides;
    }

    public EvaluationContext getEvaluation() {
        return evaluation;
    }

    public DependencySolver getSolver() {
        return solver;
    }

    static SuggestedFix removeFix(ConfigOverride override) {
        return SuggestedFix.removeLine("Remove redundant entry CONFIG_" + override.getSymbol().getName(), override.getLocation());
    }
}
