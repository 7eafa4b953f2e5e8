package com.kconfig.semantics.model;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One textual declaration of a {@link Symbol}. Property lists keep their source order; the
 * enclosing scope is referenced by its {@link ScopeTable} id.
 */
public final class Entry {
    private final Symbol symbol;
    private final Path file;
    private final int scopeId;
    private final int startLine;
    private int endLine;

    private SymbolType type;
    private String prompt;
    private String help;
    private final List<String> dependencies = new ArrayList<>();
    private final List<DefaultClause> defaults = new ArrayList<>();
    private final List<SelectClause> selects = new ArrayList<>();
    private final List<SelectClause> implies = new ArrayList<>();
    private final List<RangeClause> ranges = new ArrayList<>();

    Entry(Symbol symbol, Path file, int line, int scopeId) {
        this.symbol = Objects.requireNonNull(symbol, "symbol");
        this.file = file;
        this.startLine = line;
        this.endLine = line;
        this.scopeId = scopeId;
    }

    public Symbol getSymbol() {
        return symbol;
    }

    public Path getFile() {
        return file;
    }

    public int getScopeId() {
        return scopeId;
    }

    public SourceRange getLocation() {
        return SourceRange.lines(file, startLine, endLine);
    }

    public int getStartLine() {
        return startLine;
    }

    public int getEndLine() {
        return endLine;
    }

    /** Grows the entry to cover {@code line}; entries only ever grow downwards. */
    public void extend(int line) {
        if (line < startLine) {
            throw new IllegalArgumentException("Cannot extend entry upwards to line " + line);
        }
        if (line > endLine) {
            endLine = line;
        }
    }

    public SymbolType getType() {
        return type;
    }

    public void setType(SymbolType type) {
        this.type = type;
    }

    public String getPrompt() {
        return prompt;
    }

    public void setPrompt(String prompt) {
        this.prompt = prompt;
    }

    public String getHelp() {
        return help;
    }

    public void setHelp(String help) {
        this.help = help;
    }

    public List<String> getDependencies() {
        return Collections.unmodifiableList(dependencies);
    }

    public void addDependency(String expression) {
        dependencies.add(expression);
    }

    public List<DefaultClause> getDefaults() {
        return Collections.unmodifiableList(defaults);
    }

    public void addDefault(DefaultClause clause) {
        defaults.add(clause);
    }

    public List<SelectClause> getSelects() {
        return Collections.unmodifiableList(selects);
    }

    public void addSelect(SelectClause clause) {
        selects.add(clause);
    }

    public List<SelectClause> getImplies() {
        return Collections.unmodifiableList(implies);
    }

    public void addImply(SelectClause clause) {
        implies.add(clause);
    }

    public List<RangeClause> getRanges() {
        return Collections.unmodifiableList(ranges);
    }

    public void addRange(RangeClause clause) {
        ranges.add(clause);
    }

    @Override
    public String toString() {
        return symbol.getName() + " @ " + getLocation();
    }
}
