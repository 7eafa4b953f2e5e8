package com.kconfig.semantics.expr;

/** Outcome of compiling one expression string: either a tree or the error that prevented it. */
public final class CompiledExpression {
    private final String source;
    private final Expression expression;
    private final ExpressionException error;

    private CompiledExpression(String source, Expression expression, ExpressionException error) {
        this.source = source;
        this.expression = expression;
        this.error = error;
    }

    static CompiledExpression success(String source, Expression expression) {
        return new CompiledExpression(source, expression, null);
    }

    static CompiledExpression failure(String source, ExpressionException error) {
        return new CompiledExpression(source, null, error);
    }

    public String getSource() {
        return source;
    }

    public boolean isValid() {
        return expression != null;
    }

    /** The parsed tree, {@code null} when compilation failed. */
    public Expression getExpression() {
        return expression;
    }

    /** The compilation error, {@code null} when compilation succeeded. */
    public ExpressionException getError() {
        return error;
    }
}
