package com.kconfig.semantics.expr;

import com.kconfig.semantics.expr.ExpressionParseException.Reason;
import java.util.List;
import java.util.Objects;

/**
 * Builds an expression tree by repeatedly splitting the token list at its loosest-binding
 * top-level token.
 *
 * <p>Among the tokens outside any parentheses, the one with the highest rank in {@link #RANK}
 * becomes the root and the tokens on either side become its operands. Ties go to the leftmost
 * token. {@code &&} ranks above {@code ||}, so {@code A || B && C} splits at {@code &&}; this
 * matches the established behavior of the configuration tooling and is kept for compatibility.
 */
public final class ExpressionParser {

    private static final List<TokenKind> RANK =
            List.of(
                    TokenKind.VAR,
                    TokenKind.STRING,
                    TokenKind.NUMBER,
                    TokenKind.TRISTATE,
                    TokenKind.NOT,
                    TokenKind.OR,
                    TokenKind.AND,
                    TokenKind.GREATER_EQUAL,
                    TokenKind.LESS_EQUAL,
                    TokenKind.GREATER,
                    TokenKind.LESS,
                    TokenKind.NEQUAL,
                    TokenKind.EQUAL);

    public Expression parse(List<Token> tokens) throws ExpressionParseException {
        Objects.requireNonNull(tokens, "tokens");
        if (tokens.isEmpty()) {
            throw new ExpressionParseException(Reason.MISSING_OPERAND, "Missing operand", null);
        }

        int depth = 0;
        int bestIndex = -1;
        int bestRank = -1;
        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            switch (token.getKind()) {
                case OPEN_PAREN:
                    depth++;
                    break;
                case CLOSE_PAREN:
                    depth--;
                    if (depth < 0) {
                        throw new ExpressionParseException(
                                Reason.UNMATCHED_PARENTHESIS, "Unmatched closing parenthesis", token);
                    }
                    break;
                default:
                    if (depth == 0) {
                        int rank = RANK.indexOf(token.getKind());
                        if (rank > bestRank) {
                            bestRank = rank;
                            bestIndex = i;
                        }
                    }
                    break;
            }
        }
        if (depth != 0) {
            throw new ExpressionParseException(
                    Reason.UNMATCHED_PARENTHESIS, "Unmatched opening parenthesis", null);
        }

        if (bestIndex < 0) {
            return parseParenthesized(tokens);
        }

        Token best = tokens.get(bestIndex);
        Operator operator = Operator.fromToken(best.getKind());
        if (operator.getArity() == 0) {
            if (tokens.size() != 1) {
                throw new ExpressionParseException(Reason.MISSING_OPERATOR, "Missing operator", best);
            }
            return operator == Operator.SYMBOL ? Expression.symbol(best) : Expression.literal(best);
        }

        List<Token> left = tokens.subList(0, bestIndex);
        List<Token> right = tokens.subList(bestIndex + 1, tokens.size());
        if (operator.getArity() == 1) {
            if (!left.isEmpty()) {
                throw new ExpressionParseException(Reason.MISSING_OPERATOR, "Missing operator", best);
            }
            if (right.isEmpty()) {
                throw new ExpressionParseException(Reason.MISSING_OPERAND, "Missing operand", best);
            }
            return Expression.unary(operator, parse(right));
        }

        if (left.isEmpty() || right.isEmpty()) {
            throw new ExpressionParseException(Reason.MISSING_OPERAND, "Missing operand", best);
        }
        return Expression.binary(operator, parse(left), parse(right));
    }

    /** Every top-level token is a parenthesis: the list must be one group wrapping everything. */
    private Expression parseParenthesized(List<Token> tokens) throws ExpressionParseException {
        int depth = 0;
        for (int i = 0; i < tokens.size(); i++) {
            TokenKind kind = tokens.get(i).getKind();
            depth += kind == TokenKind.OPEN_PAREN ? 1 : kind == TokenKind.CLOSE_PAREN ? -1 : 0;
            if (depth == 0 && i < tokens.size() - 1) {
                throw new ExpressionParseException(Reason.MISSING_OPERATOR, "Missing operator", tokens.get(i + 1));
            }
        }
        return Expression.unary(Operator.PARENTHESIS, parse(tokens.subList(1, tokens.size() - 1)));
    }
}
