package com.kconfig.semantics.validation;

import com.kconfig.semantics.diagnostic.Diagnostic;
import com.kconfig.semantics.model.ConfigOverride;
import java.util.List;

/**
 * A check applied to one override line. Rules run in a fixed order and may end the checks for a
 * line once they have explained its outcome.
 */
public interface LintRule {

    enum Verdict {
        /** Later rules still apply to the line. */
        CONTINUE,
        /** The line is explained; later rules are skipped. */
        RESOLVED
    }

    /**
     * @param context State shared by every line of one lint pass.
     * @param override The line being checked.
     * @param out Receives the diagnostics produced for this line.
     */
    Verdict check(LintContext context, ConfigOverride override, List<Diagnostic> out);
}
