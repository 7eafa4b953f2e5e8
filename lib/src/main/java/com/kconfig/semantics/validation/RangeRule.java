package com.kconfig.semantics.validation;

import com.kconfig.semantics.diagnostic.Diagnostic;
import com.kconfig.semantics.expr.ConfigValue;
import com.kconfig.semantics.model.ConfigOverride;
import com.kconfig.semantics.model.Symbol;
import com.kconfig.semantics.model.SymbolType;
import com.kconfig.semantics.model.ValueRange;
import java.util.List;

final class RangeRule implements LintRule {

    @Override
    public Verdict check(LintContext context, ConfigOverride override, List<Diagnostic> out) {
        Symbol symbol = override.getSymbol();
        SymbolType type = symbol.getType();
        if (type == null || !type.isNumeric()) {
            return Verdict.CONTINUE;
        }
        ConfigValue value = symbol.parseValue(override.getValue());
        ValueRange range = context.getEvaluation().getRange(symbol);
        if (!range.contains(value.asNumber("range"))) {
            out.add(Diagnostic.error(
                    "Entry " + override.getValue() + " outside range `"
                            + type.format(ConfigValue.of(range.min())) + "`-`"
                            + type.format(ConfigValue.of(range.max())) + "`",
                    override.getLocation()));
        }
        return Verdict.CONTINUE;
    }
}
