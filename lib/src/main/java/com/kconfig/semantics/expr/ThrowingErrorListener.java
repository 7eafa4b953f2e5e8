package com.kconfig.semantics.expr;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.Lexer;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.misc.ParseCancellationException;

final class ThrowingErrorListener extends BaseErrorListener {
    static final ThrowingErrorListener INSTANCE = new ThrowingErrorListener();

    private ThrowingErrorListener() {}

    @Override
    public void syntaxError(
            Recognizer<?, ?> recognizer,
            Object offendingSymbol,
            int line,
            int charPositionInLine,
            String msg,
            RecognitionException e) {
        int offset = recognizer instanceof Lexer lexer ? lexer._tokenStartCharIndex : -1;
        throw new Failure("line " + line + ":" + (charPositionInLine + 1) + " " + msg, offset, e);
    }

    /** Carries the input offset of the token that failed to lex. */
    static final class Failure extends ParseCancellationException {
        private final int offset;

        Failure(String message, int offset, Throwable cause) {
            super(message, cause);
            this.offset = offset;
        }

        int getOffset() {
            return offset;
        }
    }
}
