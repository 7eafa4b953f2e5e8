package com.kconfig.semantics.validation;

import com.kconfig.semantics.diagnostic.Diagnostic;
import com.kconfig.semantics.model.ConfigOverride;
import com.kconfig.semantics.model.Symbol;
import java.util.List;
import java.util.Optional;

/** A symbol forced on by {@code select} or {@code imply} ignores its own override. */
final class SelectedRule implements LintRule {

    @Override
    public Verdict check(LintContext context, ConfigOverride override, List<Diagnostic> out) {
        Symbol symbol = override.getSymbol();
        Optional<Symbol> found = context.getEvaluation().selector(symbol);
        if (found.isEmpty()) {
            return Verdict.CONTINUE;
        }
        Symbol selector = found.get();
        boolean disabling = "n".equals(override.getValue());
        String message = "Entry " + symbol.getName() + " is " + (disabling ? "ignored" : "redundant")
                + " (Already selected by " + selector.getName() + ")";
        Diagnostic diagnostic = disabling
                ? Diagnostic.warning(message, override.getLocation())
                : Diagnostic.hint(message, override.getLocation());
        ConfigOverride selecting = null;
        for (ConfigOverride candidate : context.getOverrides()) {
            if (candidate.getSymbol() == selector && candidate.getLocation() != null) {
                selecting = candidate;
                break;
            }
        }
        if (selecting != null) {
            diagnostic.addRelated(selecting.getLocation(), "Selected by " + selecting.toLine());
        } else {
            diagnostic.addRelated(selector.getLocation(), "Selected by " + selector.getName());
        }
        out.add(diagnostic.markUnnecessary().addFix(LintContext.removeFix(override)));
        return Verdict.RESOLVED;
    }
}
