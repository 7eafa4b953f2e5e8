package com.kconfig.semantics.model;

import com.kconfig.semantics.evaluation.EvaluationContext;
import com.kconfig.semantics.expr.ConfigValue;
import com.kconfig.semantics.expr.Expression;
import com.kconfig.semantics.expr.ExpressionCache;
import com.kconfig.semantics.expr.ExpressionException;
import com.kconfig.semantics.loader.ParsedFile;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Owns every symbol, the scope arena and the parsed file tree. The document parser is the only
 * writer and holds {@link #writeLock()} for a whole parse pass; evaluations spanning several calls
 * hold {@link #readLock()}.
 */
public final class Repository {
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, Symbol> symbols = new LinkedHashMap<>();
    private final ScopeTable scopes = new ScopeTable();
    private final ExpressionCache expressions = new ExpressionCache();
    private Map<String, List<Symbol>> selectorIndex;
    private ParsedFile root;
    private String title;

    public Lock readLock() {
        return lock.readLock();
    }

    public Lock writeLock() {
        return lock.writeLock();
    }

    /** Returns the symbol called {@code name}, creating it when this is its first declaration. */
    public Symbol declare(String name, SymbolKind kind) {
        Symbol symbol = symbols.get(name);
        if (symbol == null) {
            symbol = new Symbol(name, kind);
            symbols.put(name, symbol);
        }
        return symbol;
    }

    /** Creates a symbol that is not registered by name, used for anonymous choices. */
    public Symbol detached(String name, SymbolKind kind) {
        return new Symbol(name, kind);
    }

    public Symbol get(String name) {
        return symbols.get(name);
    }

    public Optional<Symbol> find(String name) {
        return Optional.ofNullable(symbols.get(name));
    }

    public Collection<Symbol> getSymbols() {
        return Collections.unmodifiableCollection(symbols.values());
    }

    public Entry addEntry(Symbol symbol, Path file, int line, int scopeId) {
        invalidate();
        return symbol.addEntry(file, line, scopeId);
    }

    /** Detaches an entry; a registered symbol left without entries is pruned. */
    public void removeEntry(Entry entry) {
        Symbol symbol = entry.getSymbol();
        if (!symbol.removeEntry(entry)) {
            return;
        }
        invalidate();
        if (symbol.getEntries().isEmpty() && symbols.get(symbol.getName()) == symbol) {
            symbols.remove(symbol.getName());
        }
    }

    /** Invalidates derived indexes; called whenever an entry's reverse dependencies change. */
    public synchronized void invalidate() {
        selectorIndex = null;
    }

    /** Invalidates derived indexes and drops compiled expressions, whose source text may be gone. */
    public synchronized void invalidateAfterEdit() {
        selectorIndex = null;
        expressions.clear();
    }

    /** Symbols that {@code select} or {@code imply} {@code target}, in repository order. */
    public synchronized List<Symbol> selectorsOf(String target) {
        if (selectorIndex == null) {
            Map<String, List<Symbol>> index = new HashMap<>();
            for (Symbol symbol : symbols.values()) {
                for (SelectClause clause : symbol.getSelects()) {
                    addSelector(index, clause.target(), symbol);
                }
                for (SelectClause clause : symbol.getImplies()) {
                    addSelector(index, clause.target(), symbol);
                }
            }
            selectorIndex = index;
        }
        return selectorIndex.getOrDefault(target, List.of());
    }

    private static void addSelector(Map<String, List<Symbol>> index, String target, Symbol symbol) {
        List<Symbol> selectors = index.computeIfAbsent(target, key -> new ArrayList<>());
        if (!selectors.contains(symbol)) {
            selectors.add(symbol);
        }
    }

    public ScopeTable getScopes() {
        return scopes;
    }

    public ExpressionCache getExpressions() {
        return expressions;
    }

    public ParsedFile getRoot() {
        return root;
    }

    public void setRoot(ParsedFile root) {
        this.root = root;
    }

    /** The root file followed by every file it includes, depth first. */
    public List<ParsedFile> getFiles() {
        if (root == null) {
            return List.of();
        }
        List<ParsedFile> files = new ArrayList<>();
        files.add(root);
        files.addAll(root.children());
        return files;
    }

    /** Directory that plain {@code source} paths are resolved against. */
    public Path getRootDirectory() {
        if (root == null || root.getPath().getParent() == null) {
            return Path.of("").toAbsolutePath();
        }
        return root.getPath().getParent();
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public ConfigValue evaluate(Symbol symbol, List<ConfigOverride> overrides) {
        Lock read = lock.readLock();
        read.lock();
        try {
            return new EvaluationContext(this, overrides).evaluate(symbol);
        } finally {
            read.unlock();
        }
    }

    /** Compiles and evaluates {@code raw} against the current symbols. */
    public ConfigValue resolveExpression(String raw, List<ConfigOverride> overrides) throws ExpressionException {
        Objects.requireNonNull(raw, "raw");
        Expression expression = expressions.compile(raw);
        Lock read = lock.readLock();
        read.lock();
        try {
            return new EvaluationContext(this, overrides).solve(expression);
        } finally {
            read.unlock();
        }
    }

    public Optional<String> missingDependency(Symbol symbol, List<ConfigOverride> overrides) {
        Lock read = lock.readLock();
        read.lock();
        try {
            return new EvaluationContext(this, overrides).missingDependency(symbol);
        } finally {
            read.unlock();
        }
    }

    public Optional<Symbol> selector(Symbol symbol, List<ConfigOverride> overrides) {
        Lock read = lock.readLock();
        read.lock();
        try {
            return new EvaluationContext(this, overrides).selector(symbol);
        } finally {
            read.unlock();
        }
    }

    public ConfigValue defaultValue(Symbol symbol, List<ConfigOverride> overrides) {
        Lock read = lock.readLock();
        read.lock();
        try {
            return new EvaluationContext(this, overrides).defaultValue(symbol);
        } finally {
            read.unlock();
        }
    }

    public ValueRange getRange(Symbol symbol, List<ConfigOverride> overrides) {
        Lock read = lock.readLock();
        read.lock();
        try {
            return new EvaluationContext(this, overrides).getRange(symbol);
        } finally {
            read.unlock();
        }
    }
}
