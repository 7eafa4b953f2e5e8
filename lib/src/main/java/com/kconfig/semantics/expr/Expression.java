package com.kconfig.semantics.expr;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/** Immutable expression tree node. Leaves carry the token they were built from. */
public final class Expression {
    private final Operator operator;
    private final List<Expression> operands;
    private final Token token;

    private Expression(Operator operator, List<Expression> operands, Token token) {
        this.operator = operator;
        this.operands = List.copyOf(operands);
        this.token = token;
    }

    public static Expression symbol(Token token) {
        if (token.getKind() != TokenKind.VAR) {
            throw new IllegalArgumentException("Not a symbol token: " + token);
        }
        return new Expression(Operator.SYMBOL, List.of(), token);
    }

    public static Expression literal(Token token) {
        if (!token.getKind().isLiteral()) {
            throw new IllegalArgumentException("Not a literal token: " + token);
        }
        return new Expression(Operator.LITERAL, List.of(), token);
    }

    public static Expression unary(Operator operator, Expression operand) {
        if (operator.getArity() != 1) {
            throw new IllegalArgumentException(operator + " is not unary");
        }
        return new Expression(operator, List.of(operand), null);
    }

    public static Expression binary(Operator operator, Expression left, Expression right) {
        if (operator.getArity() != 2) {
            throw new IllegalArgumentException(operator + " is not binary");
        }
        return new Expression(operator, List.of(left, right), null);
    }

    public Operator getOperator() {
        return operator;
    }

    public List<Expression> getOperands() {
        return operands;
    }

    public Expression operand(int index) {
        return operands.get(index);
    }

    /** Leaf token for {@link Operator#SYMBOL} and {@link Operator#LITERAL}, otherwise {@code null}. */
    public Token getToken() {
        return token;
    }

    /** Names of all referenced symbols, in first-occurrence order. */
    public Set<String> symbolNames() {
        Set<String> names = new LinkedHashSet<>();
        collectSymbols(this, names);
        return names;
    }

    private static void collectSymbols(Expression expression, Set<String> out) {
        if (expression.operator == Operator.SYMBOL) {
            out.add(expression.token.getValue());
            return;
        }
        for (Expression operand : expression.operands) {
            collectSymbols(operand, out);
        }
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Expression)) {
            return false;
        }
        Expression other = (Expression) obj;
        return operator == other.operator
                && operands.equals(other.operands)
                && Objects.equals(token, other.token);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operator, operands, token);
    }

    @Override
    public String toString() {
        switch (operator) {
            case SYMBOL:
            case LITERAL:
                return token.render();
            case PARENTHESIS:
                return "(" + operands.get(0) + ")";
            case NOT:
                return "!" + operands.get(0);
            default:
                List<String> parts = new ArrayList<>(2);
                for (Expression operand : operands) {
                    parts.add(operand.toString());
                }
                return parts.get(0) + " " + operator.getSymbol() + " " + parts.get(1);
        }
    }
}
