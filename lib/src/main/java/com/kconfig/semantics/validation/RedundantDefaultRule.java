package com.kconfig.semantics.validation;

import com.kconfig.semantics.diagnostic.Diagnostic;
import com.kconfig.semantics.model.ConfigOverride;
import com.kconfig.semantics.model.Symbol;
import java.util.List;

final class RedundantDefaultRule implements LintRule {

    @Override
    public Verdict check(LintContext context, ConfigOverride override, List<Diagnostic> out) {
        Symbol symbol = override.getSymbol();
        if (!symbol.parseValue(override.getValue()).equals(context.getEvaluation().defaultValue(symbol))) {
            return Verdict.CONTINUE;
        }
        out.add(Diagnostic.hint("Entry " + symbol.getName() + " is redundant (same as default)", override.getLocation())
                .markUnnecessary()
                .addFix(LintContext.removeFix(override)));
        return Verdict.CONTINUE;
    }
}
