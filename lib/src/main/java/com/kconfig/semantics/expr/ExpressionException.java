package com.kconfig.semantics.expr;

/**
 * Checked exception signalling that an expression string could not be compiled. Subclasses
 * separate lexical failures from structural ones.
 */
public abstract class ExpressionException extends Exception {
    protected ExpressionException(String message) {
        super(message);
    }

    protected ExpressionException(String message, Throwable cause) {
        super(message, cause);
    }
}
