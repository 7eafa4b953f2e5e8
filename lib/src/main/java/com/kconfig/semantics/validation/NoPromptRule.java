package com.kconfig.semantics.validation;

import com.kconfig.semantics.diagnostic.Diagnostic;
import com.kconfig.semantics.diagnostic.SuggestedFix;
import com.kconfig.semantics.diagnostic.TextEdit;
import com.kconfig.semantics.model.ConfigOverride;
import com.kconfig.semantics.model.Symbol;
import java.util.List;

/**
 * Symbols without a prompt cannot be set by the user. Offers the active selectors of the symbol
 * as replacements.
 */
final class NoPromptRule implements LintRule {

    @Override
    public Verdict check(LintContext context, ConfigOverride override, List<Diagnostic> out) {
        Symbol symbol = override.getSymbol();
        if (symbol.hasPrompt()) {
            return Verdict.CONTINUE;
        }
        Diagnostic diagnostic = Diagnostic.warning(
                "Entry " + symbol.getName() + " has no effect (has no prompt)", override.getLocation());
        diagnostic.addFix(LintContext.removeFix(override));
        for (Symbol selector : context.getRepository().selectorsOf(symbol.getName())) {
            if (context.getEvaluation().selects(selector, symbol.getName())) {
                diagnostic.addFix(new SuggestedFix(
                        "Replace with CONFIG_" + selector.getName(),
                        false,
                        List.of(TextEdit.replace(override.getLocation(), "CONFIG_" + selector.getName() + "=y"))));
            }
        }
        out.add(diagnostic);
        return Verdict.CONTINUE;
    }
}
