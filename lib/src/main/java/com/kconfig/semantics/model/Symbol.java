package com.kconfig.semantics.model;

import com.kconfig.semantics.expr.ConfigValue;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A uniquely named configuration item. Every property is derived from the symbol's entries, so
 * adding or removing an entry is the only way a symbol changes.
 */
public final class Symbol {
    private final String name;
    private final SymbolKind kind;
    private final List<Entry> entries = new ArrayList<>();

    Symbol(String name, SymbolKind kind) {
        this.name = Objects.requireNonNull(name, "name");
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public String getName() {
        return name;
    }

    public SymbolKind getKind() {
        return kind;
    }

    public List<Entry> getEntries() {
        return Collections.unmodifiableList(entries);
    }

    /** Type from the first entry declaring one, {@code null} when no entry does. */
    public SymbolType getType() {
        for (Entry entry : entries) {
            if (entry.getType() != null) {
                return entry.getType();
            }
        }
        return null;
    }

    public boolean isBooleanTyped() {
        SymbolType type = getType();
        return type != null && type.isBoolean();
    }

    public String getPrompt() {
        for (Entry entry : entries) {
            if (entry.getPrompt() != null) {
                return entry.getPrompt();
            }
        }
        return null;
    }

    public boolean hasPrompt() {
        return getPrompt() != null;
    }

    public String getHelp() {
        return entries.stream()
                .map(Entry::getHelp)
                .filter(help -> help != null && !help.isEmpty())
                .collect(Collectors.joining("\n\n"));
    }

    public List<String> getDependencies() {
        List<String> all = new ArrayList<>();
        entries.forEach(entry -> all.addAll(entry.getDependencies()));
        return all;
    }

    public List<DefaultClause> getDefaults() {
        List<DefaultClause> all = new ArrayList<>();
        entries.forEach(entry -> all.addAll(entry.getDefaults()));
        return all;
    }

    public List<SelectClause> getSelects() {
        List<SelectClause> all = new ArrayList<>();
        entries.forEach(entry -> all.addAll(entry.getSelects()));
        return all;
    }

    public List<SelectClause> getImplies() {
        List<SelectClause> all = new ArrayList<>();
        entries.forEach(entry -> all.addAll(entry.getImplies()));
        return all;
    }

    /** Selects followed by implies whose target is {@code target}. */
    public List<SelectClause> reverseDependenciesOn(String target) {
        List<SelectClause> matching = new ArrayList<>();
        for (SelectClause clause : getSelects()) {
            if (clause.target().equals(target)) {
                matching.add(clause);
            }
        }
        for (SelectClause clause : getImplies()) {
            if (clause.target().equals(target)) {
                matching.add(clause);
            }
        }
        return matching;
    }

    public List<RangeClause> getRanges() {
        List<RangeClause> all = new ArrayList<>();
        entries.forEach(entry -> all.addAll(entry.getRanges()));
        return all;
    }

    /** First declaration location, used when pointing a diagnostic at this symbol. */
    public SourceRange getLocation() {
        return entries.isEmpty() ? null : entries.get(0).getLocation();
    }

    Entry addEntry(Path file, int line, int scopeId) {
        Entry entry = new Entry(this, file, line, scopeId);
        entries.add(entry);
        return entry;
    }

    boolean removeEntry(Entry entry) {
        return entries.remove(entry);
    }

    public ConfigValue zeroValue() {
        SymbolType type = getType();
        return type == null ? ConfigValue.FALSE : type.zeroValue();
    }

    public boolean isValidOverride(String raw) {
        SymbolType type = getType();
        return type != null && type.isValidLiteral(raw);
    }

    /** Converts an override value to this symbol's value space. */
    public ConfigValue parseValue(String value) {
        SymbolType type = getType();
        return type == null ? ConfigValue.FALSE : type.parseValue(value);
    }

    public String formatValue(ConfigValue value) {
        SymbolType type = getType();
        return type == null ? "n" : type.format(value);
    }

    /** Whether an override value switches this symbol on; only meaningful for bool/tristate. */
    public boolean isEnabledBy(String value) {
        return isBooleanTyped() && ("y".equals(value) || "m".equals(value));
    }

    @Override
    public String toString() {
        return kind.keyword() + " " + name;
    }
}
