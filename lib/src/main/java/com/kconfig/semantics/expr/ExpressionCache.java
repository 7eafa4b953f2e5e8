package com.kconfig.semantics.expr;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Compiles expression strings on first use and remembers the outcome, failures included. Entries
 * keep their expressions as source text; this cache is what turns them into trees.
 */
public final class ExpressionCache {
    private final ExpressionTokenizer tokenizer = new ExpressionTokenizer();
    private final ExpressionParser parser = new ExpressionParser();
    private final Map<String, CompiledExpression> compiled = new ConcurrentHashMap<>();

    public CompiledExpression get(String source) {
        String key = source.trim();
        CompiledExpression existing = compiled.get(key);
        if (existing != null) {
            return existing;
        }
        CompiledExpression result;
        try {
            result = CompiledExpression.success(key, parser.parse(tokenizer.tokenize(key)));
        } catch (ExpressionException ex) {
            result = CompiledExpression.failure(key, ex);
        }
        CompiledExpression raced = compiled.putIfAbsent(key, result);
        return raced != null ? raced : result;
    }

    /** Compiles {@code source}, rethrowing a cached failure. */
    public Expression compile(String source) throws ExpressionException {
        CompiledExpression result = get(source);
        if (!result.isValid()) {
            throw result.getError();
        }
        return result.getExpression();
    }

    public List<Token> tokenize(String source) throws LexException {
        return tokenizer.tokenize(source);
    }

    /** Drops every compiled expression; entries recompile on next use. */
    public void clear() {
        compiled.clear();
    }

    public int size() {
        return compiled.size();
    }
}
