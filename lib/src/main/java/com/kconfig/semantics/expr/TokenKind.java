package com.kconfig.semantics.expr;

public enum TokenKind {
    VAR(null),
    NUMBER(null),
    STRING(null),
    TRISTATE(null),
    NOT("!"),
    AND("&&"),
    OR("||"),
    OPEN_PAREN("("),
    CLOSE_PAREN(")"),
    EQUAL("="),
    NEQUAL("!="),
    GREATER(">"),
    LESS("<"),
    GREATER_EQUAL(">="),
    LESS_EQUAL("<=");

    private final String operatorText;

    TokenKind(String operatorText) {
        this.operatorText = operatorText;
    }

    /** Fixed source text of an operator or parenthesis, {@code null} for value-carrying tokens. */
    public String getOperatorText() {
        return operatorText;
    }

    public boolean isLiteral() {
        return this == NUMBER || this == STRING || this == TRISTATE;
    }
}
