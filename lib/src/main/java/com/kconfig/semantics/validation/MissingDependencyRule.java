package com.kconfig.semantics.validation;

import com.kconfig.semantics.diagnostic.Diagnostic;
import com.kconfig.semantics.diagnostic.SuggestedFix;
import com.kconfig.semantics.diagnostic.TextEdit;
import com.kconfig.semantics.evaluation.DependencyFix;
import com.kconfig.semantics.model.ConfigOverride;
import com.kconfig.semantics.model.SourceRange;
import com.kconfig.semantics.model.Symbol;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * An override of a symbol whose dependencies are not met has no effect. When the dependency can
 * be satisfied by switching a few bool symbols, the fix adds or rewrites those lines.
 */
final class MissingDependencyRule implements LintRule {

    @Override
    public Verdict check(LintContext context, ConfigOverride override, List<Diagnostic> out) {
        Symbol symbol = override.getSymbol();
        Optional<String> missing = context.getEvaluation().missingDependency(symbol);
        if (missing.isEmpty()) {
            return Verdict.CONTINUE;
        }
        String dependency = missing.get();
        Diagnostic diagnostic;
        if ("n".equals(override.getValue())) {
            diagnostic = Diagnostic.warning("Entry is already disabled by dependency: " + dependency, override.getLocation())
                    .markUnnecessary()
                    .addFix(LintContext.removeFix(override));
        } else {
            diagnostic = Diagnostic.warning(
                    "Entry " + symbol.getName() + " dependency " + dependency + " missing.", override.getLocation());
        }
        Symbol declared = context.getRepository().get(dependency);
        if (declared != null) {
            diagnostic.addRelated(declared.getLocation(), dependency + " declared here");
        }
        context.getSolver()
                .solve(dependency, context.getFileOverrides(), context.getOverrides())
                .ifPresent(fix -> diagnostic.addFix(toFix(fix, override.getLocation())));
        out.add(diagnostic);
        return Verdict.RESOLVED;
    }

    private static SuggestedFix toFix(DependencyFix fix, SourceRange line) {
        List<TextEdit> edits = new ArrayList<>();
        if (!fix.insertions().isEmpty()) {
            StringBuilder text = new StringBuilder();
            for (ConfigOverride insertion : fix.insertions()) {
                text.append(insertion.toLine()).append('\n');
            }
            edits.add(TextEdit.insert(SourceRange.point(line.getFile(), line.getStartLine()), text.toString()));
        }
        for (ConfigOverride change : fix.changes()) {
            edits.add(TextEdit.replace(change.getLocation(), change.toLine()));
        }
        int count = fix.size();
        String title = "Add " + count + " missing " + (count > 1 ? "dependencies" : "dependency");
        return new SuggestedFix(title, true, edits);
    }
}
