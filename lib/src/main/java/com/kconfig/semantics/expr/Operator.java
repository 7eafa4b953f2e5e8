package com.kconfig.semantics.expr;

public enum Operator {
    SYMBOL(0, null),
    LITERAL(0, null),
    NOT(1, "!"),
    AND(2, "&&"),
    OR(2, "||"),
    PARENTHESIS(1, null),
    EQUAL(2, "="),
    NOT_EQUAL(2, "!="),
    GREATER(2, ">"),
    GREATER_EQUAL(2, ">="),
    LESS(2, "<"),
    LESS_EQUAL(2, "<=");

    private final int arity;
    private final String symbol;

    Operator(int arity, String symbol) {
        this.arity = arity;
        this.symbol = symbol;
    }

    public int getArity() {
        return arity;
    }

    public String getSymbol() {
        return symbol;
    }

    static Operator fromToken(TokenKind kind) {
        switch (kind) {
            case VAR:
                return SYMBOL;
            case NUMBER:
            case STRING:
            case TRISTATE:
                return LITERAL;
            case NOT:
                return NOT;
            case AND:
                return AND;
            case OR:
                return OR;
            case OPEN_PAREN:
            case CLOSE_PAREN:
                return PARENTHESIS;
            case EQUAL:
                return EQUAL;
            case NEQUAL:
                return NOT_EQUAL;
            case GREATER:
                return GREATER;
            case GREATER_EQUAL:
                return GREATER_EQUAL;
            case LESS:
                return LESS;
            case LESS_EQUAL:
                return LESS_EQUAL;
            default:
                throw new IllegalArgumentException("No operator for " + kind);
        }
    }
}
