package com.kconfig.semantics.expr;

import java.util.Locale;

/** Raised during evaluation when an operator receives an operand of the wrong kind. */
public final class ExpressionTypeException extends RuntimeException {
    private final String operator;
    private final ConfigValue.Kind actual;

    public ExpressionTypeException(String operator, ConfigValue.Kind actual) {
        super("Invalid type for " + operator + " operator: " + actual.name().toLowerCase(Locale.ROOT));
        this.operator = operator;
        this.actual = actual;
    }

    public String getOperator() {
        return operator;
    }

    public ConfigValue.Kind getActual() {
        return actual;
    }
}
