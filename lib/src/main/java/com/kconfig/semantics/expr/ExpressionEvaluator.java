package com.kconfig.semantics.expr;

import java.util.Objects;

/**
 * Reduces an expression tree to a {@link ConfigValue}. The evaluator holds no state: everything it
 * reads comes from the tree and the supplied {@link SymbolResolver}, so the same instance can be
 * shared freely between threads and hypothetical evaluations.
 */
public final class ExpressionEvaluator {

    public ConfigValue solve(Expression expression, SymbolResolver symbols) {
        Objects.requireNonNull(expression, "expression");
        Objects.requireNonNull(symbols, "symbols");
        switch (expression.getOperator()) {
            case SYMBOL: {
                ConfigValue value = symbols.resolve(expression.getToken().getValue());
                return value == null ? ConfigValue.FALSE : value;
            }
            case LITERAL:
                return literal(expression.getToken());
            case NOT:
                return ConfigValue.of(!solve(expression.operand(0), symbols).asBoolean("!"));
            case AND:
                return ConfigValue.of(
                        solve(expression.operand(0), symbols).asBoolean("&&")
                                && solve(expression.operand(1), symbols).asBoolean("&&"));
            case OR:
                return ConfigValue.of(
                        solve(expression.operand(0), symbols).asBoolean("||")
                                || solve(expression.operand(1), symbols).asBoolean("||"));
            case PARENTHESIS:
                return solve(expression.operand(0), symbols);
            case EQUAL:
                return ConfigValue.of(
                        solve(expression.operand(0), symbols).equals(solve(expression.operand(1), symbols)));
            case NOT_EQUAL:
                return ConfigValue.of(
                        !solve(expression.operand(0), symbols).equals(solve(expression.operand(1), symbols)));
            case GREATER:
                return ConfigValue.of(compare(expression, symbols) > 0);
            case GREATER_EQUAL:
                return ConfigValue.of(compare(expression, symbols) >= 0);
            case LESS:
                return ConfigValue.of(compare(expression, symbols) < 0);
            case LESS_EQUAL:
                return ConfigValue.of(compare(expression, symbols) <= 0);
            default:
                throw new IllegalStateException("Unhandled operator " + expression.getOperator());
        }
    }

    private int compare(Expression expression, SymbolResolver symbols) {
        String operator = expression.getOperator().getSymbol();
        long left = solve(expression.operand(0), symbols).asNumber(operator);
        long right = solve(expression.operand(1), symbols).asNumber(operator);
        return Long.compare(left, right);
    }

    private static ConfigValue literal(Token token) {
        switch (token.getKind()) {
            case STRING:
                return ConfigValue.of(token.getValue());
            case NUMBER:
                // the tokenizer rejects numbers that do not fit in a long
                return ConfigValue.of(ConfigValue.parseNumber(token.getValue())
                        .orElseThrow(() -> new IllegalStateException("Number out of range " + token)));
            case TRISTATE:
                return ConfigValue.ofTristate(token.getValue());
            default:
                throw new IllegalStateException("Unknown literal " + token);
        }
    }
}
