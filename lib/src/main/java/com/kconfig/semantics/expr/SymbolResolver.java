package com.kconfig.semantics.expr;

/** Supplies symbol values to the {@link ExpressionEvaluator}. */
@FunctionalInterface
public interface SymbolResolver {

    /**
     * @param name Symbol name as written in the expression.
     * @return The symbol's effective value, or {@code null} when no such symbol is declared.
     */
    ConfigValue resolve(String name);
}
