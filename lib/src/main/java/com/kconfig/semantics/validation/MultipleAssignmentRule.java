package com.kconfig.semantics.validation;

import com.kconfig.semantics.diagnostic.Diagnostic;
import com.kconfig.semantics.model.ConfigOverride;
import java.util.ArrayList;
import java.util.List;

/** Flags a symbol assigned again after an earlier assignment in the build already took effect. */
final class MultipleAssignmentRule implements LintRule {

    @Override
    public Verdict check(LintContext context, ConfigOverride override, List<Diagnostic> out) {
        List<ConfigOverride> earlier = new ArrayList<>();
        for (ConfigOverride candidate : context.getOverrides()) {
            if (candidate == override) {
                break;
            }
            if (candidate.getSymbol() == override.getSymbol()) {
                earlier.add(candidate);
            }
        }
        if (earlier.isEmpty()) {
            return Verdict.CONTINUE;
        }
        String name = override.getSymbol().getName();
        boolean identical = earlier.stream().allMatch(e -> e.getValue().equals(override.getValue()));
        Diagnostic diagnostic;
        if (identical) {
            diagnostic = Diagnostic.hint("Entry " + name + " is already assigned " + override.getValue(), override.getLocation())
                    .markUnnecessary()
                    .addFix(LintContext.removeFix(override));
        } else {
            diagnostic = Diagnostic.warning(
                    "Entry " + name + " is assigned more than once; the first assignment takes effect", override.getLocation());
        }
        for (ConfigOverride previous : earlier) {
            diagnostic.addRelated(previous.getLocation(), "Assigned " + previous.toLine() + " here");
        }
        out.add(diagnostic);
        return Verdict.CONTINUE;
    }
}
