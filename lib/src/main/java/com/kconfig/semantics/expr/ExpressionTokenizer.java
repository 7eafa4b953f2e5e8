package com.kconfig.semantics.expr;

import com.kconfig.semantics.KconfigSettings;
import com.kconfig.semantics.expr.grammar.KconfigExpressionLexer;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.logging.Logger;
import org.antlr.v4.runtime.CharStreams;

/** Splits an expression string into {@link Token}s using the generated ANTLR lexer. */
public final class ExpressionTokenizer {
    private static final Logger LOGGER = Logger.getLogger(ExpressionTokenizer.class.getName());

    public List<Token> tokenize(String expression) throws LexException {
        Objects.requireNonNull(expression, "expression");
        KconfigExpressionLexer lexer = new KconfigExpressionLexer(CharStreams.fromString(expression));
        lexer.removeErrorListeners();
        lexer.addErrorListener(ThrowingErrorListener.INSTANCE);

        List<Token> tokens = new ArrayList<>();
        try {
            for (org.antlr.v4.runtime.Token token = lexer.nextToken();
                    token.getType() != org.antlr.v4.runtime.Token.EOF;
                    token = lexer.nextToken()) {
                if (token.getType() == KconfigExpressionLexer.NUMBER
                        && ConfigValue.parseNumber(token.getText()).isEmpty()) {
                    throw new LexException(
                            "Number out of range: " + token.getText(),
                            expression.substring(token.getStartIndex()),
                            token.getStartIndex());
                }
                tokens.add(new Token(kindOf(token.getType()), valueOf(token), token.getStartIndex()));
            }
        } catch (ThrowingErrorListener.Failure ex) {
            int offset = Math.max(0, Math.min(ex.getOffset(), expression.length()));
            throw new LexException(expression.substring(offset), offset, ex);
        }

        if (KconfigSettings.isTokenDebugEnabled()) {
            logTokens(expression, tokens);
        }
        return tokens;
    }

    /** Renders tokens back to source text with single spaces between them. */
    public static String render(List<Token> tokens) {
        StringBuilder builder = new StringBuilder();
        for (Token token : tokens) {
            if (builder.length() > 0) {
                builder.append(' ');
            }
            builder.append(token.render());
        }
        return builder.toString();
    }

    private static TokenKind kindOf(int type) {
        switch (type) {
            case KconfigExpressionLexer.VAR:
                return TokenKind.VAR;
            case KconfigExpressionLexer.NUMBER:
                return TokenKind.NUMBER;
            case KconfigExpressionLexer.STRING:
                return TokenKind.STRING;
            case KconfigExpressionLexer.TRISTATE:
                return TokenKind.TRISTATE;
            case KconfigExpressionLexer.NOT:
                return TokenKind.NOT;
            case KconfigExpressionLexer.AND:
                return TokenKind.AND;
            case KconfigExpressionLexer.OR:
                return TokenKind.OR;
            case KconfigExpressionLexer.OPEN_PAREN:
                return TokenKind.OPEN_PAREN;
            case KconfigExpressionLexer.CLOSE_PAREN:
                return TokenKind.CLOSE_PAREN;
            case KconfigExpressionLexer.EQUAL:
                return TokenKind.EQUAL;
            case KconfigExpressionLexer.NEQUAL:
                return TokenKind.NEQUAL;
            case KconfigExpressionLexer.GREATER:
                return TokenKind.GREATER;
            case KconfigExpressionLexer.LESS:
                return TokenKind.LESS;
            case KconfigExpressionLexer.GREATER_EQUAL:
                return TokenKind.GREATER_EQUAL;
            case KconfigExpressionLexer.LESS_EQUAL:
                return TokenKind.LESS_EQUAL;
            default:
                throw new IllegalStateException("Unexpected token type " + type);
        }
    }

    private static String valueOf(org.antlr.v4.runtime.Token token) {
        String text = token.getText();
        if (token.getType() == KconfigExpressionLexer.STRING) {
            return text.substring(1, text.length() - 1);
        }
        return text;
    }

    private static void logTokens(String expression, List<Token> tokens) {
        StringBuilder dump = new StringBuilder("Token dump for ").append('\'').append(expression).append('\'');
        for (Token token : tokens) {
            dump.append(System.lineSeparator())
                    .append(String.format(Locale.ROOT, "  %-14s @ %3d -> %s", token.getKind(), token.getOffset(), token.getValue()));
        }
        LOGGER.info(dump.toString());
    }
}
