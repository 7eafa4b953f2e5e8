package com.kconfig.semantics.evaluation;

import com.kconfig.semantics.expr.CompiledExpression;
import com.kconfig.semantics.expr.ConfigValue;
import com.kconfig.semantics.expr.Expression;
import com.kconfig.semantics.expr.ExpressionEvaluator;
import com.kconfig.semantics.expr.SymbolResolver;
import com.kconfig.semantics.model.ChoiceScope;
import com.kconfig.semantics.model.ConfigOverride;
import com.kconfig.semantics.model.DefaultClause;
import com.kconfig.semantics.model.Entry;
import com.kconfig.semantics.model.IfScope;
import com.kconfig.semantics.model.MenuScope;
import com.kconfig.semantics.model.RangeClause;
import com.kconfig.semantics.model.Repository;
import com.kconfig.semantics.model.Scope;
import com.kconfig.semantics.model.SelectClause;
import com.kconfig.semantics.model.Symbol;
import com.kconfig.semantics.model.ValueRange;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * One evaluation pass over a repository under a fixed override list. Symbol values are memoised
 * for the lifetime of the context, which is safe because neither the repository nor the overrides
 * change while it is in use. A context is confined to the thread that created it.
 *
 * <p>Dependency cycles are cut: a symbol that is re-entered while its own value is being computed
 * contributes its zero value, and the path is recorded in {@link #getCycles()}.
 */
public final class EvaluationContext implements SymbolResolver {
    private static final Logger LOGGER = Logger.getLogger(EvaluationContext.class.getName());
    private static final ExpressionEvaluator EVALUATOR = new ExpressionEvaluator();
    private static final Pattern NUMBER = Pattern.compile("[-+]?(0[xX][0-9a-fA-F]+|\\d+)");

    private final Repository repository;
    private final List<ConfigOverride> overrides;
    private final Map<Symbol, ConfigValue> values = new HashMap<>();
    private final Map<Integer, Optional<String>> scopeFailures = new HashMap<>();
    private final List<Symbol> inProgress = new ArrayList<>();
    private final List<List<String>> cycles = new ArrayList<>();
    private int cuts;

    public EvaluationContext(Repository repository, List<ConfigOverride> overrides) {
        this.repository = Objects.requireNonNull(repository, "repository");
        this.overrides = List.copyOf(overrides);
    }

    /** A fresh context whose override list is {@code first} followed by this context's overrides. */
    public EvaluationContext withLeadingOverrides(List<ConfigOverride> first) {
        List<ConfigOverride> combined = new ArrayList<>(first);
        combined.addAll(overrides);
        return new EvaluationContext(repository, combined);
    }

    public List<ConfigOverride> getOverrides() {
        return overrides;
    }

    @Override
    public ConfigValue resolve(String name) {
        Symbol symbol = repository.get(name);
        return symbol == null ? null : evaluate(symbol);
    }

    public ConfigValue solve(Expression expression) {
        return EVALUATOR.solve(expression, this);
    }

    /**
     * Effective value of {@code symbol}: its zero value when a dependency is missing, otherwise the
     * first matching override, then a selector, then the first applicable default.
     */
    public ConfigValue evaluate(Symbol symbol) {
        ConfigValue known = values.get(symbol);
        if (known != null) {
            return known;
        }
        int index = inProgress.indexOf(symbol);
        if (index >= 0) {
            recordCycle(index, symbol);
            return symbol.zeroValue();
        }
        int cutsBefore = cuts;
        inProgress.add(symbol);
        ConfigValue value;
        try {
            value = compute(symbol);
        } finally {
            inProgress.remove(inProgress.size() - 1);
        }
        // values computed across a cut depend on the point of entry
        if (cuts == cutsBefore) {
            values.put(symbol, value);
        }
        return value;
    }

    private ConfigValue compute(Symbol symbol) {
        if (missingDependency(symbol).isPresent()) {
            return symbol.zeroValue();
        }
        ConfigOverride override = findOverride(symbol);
        if (override != null) {
            return symbol.parseValue(override.getValue());
        }
        if (selector(symbol).isPresent()) {
            return ConfigValue.TRUE;
        }
        return defaultValue(symbol);
    }

    private ConfigOverride findOverride(Symbol symbol) {
        for (ConfigOverride override : overrides) {
            if (override.getSymbol() == symbol) {
                return override;
            }
        }
        return null;
    }

    /**
     * The first unmet condition gating {@code symbol}: a {@code depends on} clause that is not
     * truthy or, when no entry sits in a satisfied scope chain, the first failing scope condition.
     */
    public Optional<String> missingDependency(Symbol symbol) {
        for (String dependency : symbol.getDependencies()) {
            if (!condition(dependency).isTruthy()) {
                return Optional.of(dependency);
            }
        }
        Optional<String> firstFailure = Optional.empty();
        for (Entry entry : symbol.getEntries()) {
            Optional<String> failure = scopeFailure(entry.getScopeId());
            if (failure.isEmpty()) {
                return Optional.empty();
            }
            if (firstFailure.isEmpty()) {
                firstFailure = failure;
            }
        }
        return firstFailure;
    }

    /** Whether every scope around {@code entry} is satisfied. */
    public boolean isActive(Entry entry) {
        return scopeFailure(entry.getScopeId()).isEmpty();
    }

    private Optional<String> scopeFailure(int scopeId) {
        Optional<String> known = scopeFailures.get(scopeId);
        if (known != null) {
            return known;
        }
        int cutsBefore = cuts;
        Optional<String> failure = Optional.empty();
        for (Scope scope : repository.getScopes().chain(scopeId)) {
            failure = scopeCondition(scope);
            if (failure.isPresent()) {
                break;
            }
        }
        if (cuts == cutsBefore) {
            scopeFailures.put(scopeId, failure);
        }
        return failure;
    }

    private Optional<String> scopeCondition(Scope scope) {
        switch (scope.getKind()) {
            case MENU:
                for (String dependency : ((MenuScope) scope).getDependencies()) {
                    if (!condition(dependency).isTruthy()) {
                        return Optional.of(dependency);
                    }
                }
                return Optional.empty();
            case IF: {
                String condition = ((IfScope) scope).getCondition();
                return condition(condition).isTruthy() ? Optional.empty() : Optional.of(condition);
            }
            case CHOICE:
                for (String dependency : ((ChoiceScope) scope).getChoice().getDependencies()) {
                    if (!condition(dependency).isTruthy()) {
                        return Optional.of(dependency);
                    }
                }
                return Optional.empty();
            default:
                return Optional.empty();
        }
    }

    /**
     * A bool/tristate symbol that forces {@code symbol} on through {@code select} or {@code imply}.
     * Symbols switched on by an override are preferred over the rest of the repository.
     */
    public Optional<Symbol> selector(Symbol symbol) {
        if (!symbol.isBooleanTyped()) {
            return Optional.empty();
        }
        String target = symbol.getName();
        for (ConfigOverride override : overrides) {
            Symbol candidate = override.getSymbol();
            if (candidate != symbol
                    && candidate.isEnabledBy(override.getValue())
                    && selects(candidate, target)
                    && evaluate(candidate).isTruthy()) {
                return Optional.of(candidate);
            }
        }
        for (Symbol candidate : repository.selectorsOf(target)) {
            if (candidate != symbol
                    && candidate.isBooleanTyped()
                    && selects(candidate, target)
                    && evaluate(candidate).isTruthy()) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    /** Whether {@code candidate} selects or implies {@code target} under a holding condition. */
    public boolean selects(Symbol candidate, String target) {
        for (SelectClause clause : candidate.reverseDependenciesOn(target)) {
            if (clause.condition() == null || condition(clause.condition()).isTruthy()) {
                return true;
            }
        }
        return false;
    }

    /** Value of the first default, in active entries, whose condition holds; else the zero value. */
    public ConfigValue defaultValue(Symbol symbol) {
        for (Entry entry : symbol.getEntries()) {
            if (!isActive(entry)) {
                continue;
            }
            for (DefaultClause clause : entry.getDefaults()) {
                if (clause.condition() == null || condition(clause.condition()).isTrue()) {
                    CompiledExpression value = repository.getExpressions().get(clause.value());
                    return value.isValid() ? solve(value.getExpression()) : symbol.zeroValue();
                }
            }
        }
        return symbol.zeroValue();
    }

    /** The first applicable {@code range}, searched like defaults; unbounded when none applies. */
    public ValueRange getRange(Symbol symbol) {
        for (Entry entry : symbol.getEntries()) {
            if (!isActive(entry)) {
                continue;
            }
            for (RangeClause clause : entry.getRanges()) {
                if (clause.condition() == null || condition(clause.condition()).isTrue()) {
                    return new ValueRange(bound(clause.min(), Long.MIN_VALUE), bound(clause.max(), Long.MAX_VALUE));
                }
            }
        }
        return ValueRange.UNBOUNDED;
    }

    private long bound(String text, long fallback) {
        String trimmed = text.trim();
        if (NUMBER.matcher(trimmed).matches()) {
            OptionalLong number = ConfigValue.parseNumber(trimmed);
            if (number.isEmpty()) {
                LOGGER.log(Level.FINE, "Range bound {0} is out of range, treating it as open", trimmed);
                return fallback;
            }
            return number.getAsLong();
        }
        ConfigValue value = resolve(trimmed);
        if (value == null || !value.isNumber()) {
            LOGGER.log(Level.FINE, "Range bound {0} is not numeric, treating it as open", trimmed);
            return fallback;
        }
        return value.asNumber("range");
    }

    /** Evaluates a condition source; expressions that do not compile are false. */
    private ConfigValue condition(String source) {
        CompiledExpression compiled = repository.getExpressions().get(source);
        if (!compiled.isValid()) {
            return ConfigValue.FALSE;
        }
        return solve(compiled.getExpression());
    }

    private void recordCycle(int start, Symbol symbol) {
        cuts++;
        List<String> path = new ArrayList<>();
        for (int i = start; i < inProgress.size(); i++) {
            path.add(inProgress.get(i).getName());
        }
        path.add(symbol.getName());
        if (!cycles.contains(path)) {
            cycles.add(path);
            LOGGER.log(Level.FINE, "Dependency cycle cut at {0}: {1}", new Object[] {symbol.getName(), path});
        }
    }

    /** Symbol-name paths of every cycle cut so far, each starting and ending at the same symbol. */
    public List<List<String>> getCycles() {
        return Collections.unmodifiableList(cycles);
    }
}
