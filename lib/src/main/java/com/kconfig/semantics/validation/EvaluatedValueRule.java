package com.kconfig.semantics.validation;

import com.kconfig.semantics.diagnostic.Diagnostic;
import com.kconfig.semantics.expr.ConfigValue;
import com.kconfig.semantics.model.ConfigOverride;
import com.kconfig.semantics.model.Symbol;
import java.util.List;

final class EvaluatedValueRule implements LintRule {

    @Override
    public Verdict check(LintContext context, ConfigOverride override, List<Diagnostic> out) {
        Symbol symbol = override.getSymbol();
        ConfigValue actual = context.getEvaluation().evaluate(symbol);
        if (!symbol.parseValue(override.getValue()).equals(actual)) {
            out.add(Diagnostic.warning(
                    "Entry " + symbol.getName() + " assigned value " + override.getValue()
                            + ", but evaluated to " + symbol.formatValue(actual),
                    override.getLocation()));
        }
        return Verdict.CONTINUE;
    }
}
