package com.kconfig.semantics.expr;

public final class ExpressionParseException extends ExpressionException {

    public enum Reason {
        UNMATCHED_PARENTHESIS,
        MISSING_OPERAND,
        MISSING_OPERATOR
    }

    private final Reason reason;
    private final Token token;

    public ExpressionParseException(Reason reason, String message, Token token) {
        super(message);
        this.reason = reason;
        this.token = token;
    }

    public Reason getReason() {
        return reason;
    }

    /** Token the failure was detected at, may be {@code null}. */
    public Token getToken() {
        return token;
    }
}
