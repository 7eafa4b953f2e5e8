package com.kconfig.semantics.model;

import java.util.Objects;

/**
 * An externally assigned value for a symbol. String values are stored without their quotes. The
 * location is {@code null} for overrides that do not come from a file.
 */
public final class ConfigOverride {
    private final Symbol symbol;
    private final String value;
    private final SourceRange location;

    public ConfigOverride(Symbol symbol, String value, SourceRange location) {
        this.symbol = Objects.requireNonNull(symbol, "symbol");
        this.value = Objects.requireNonNull(value, "value");
        this.location = location;
    }

    public ConfigOverride(Symbol symbol, String value) {
        this(symbol, value, null);
    }

    public Symbol getSymbol() {
        return symbol;
    }

    public String getValue() {
        return value;
    }

    public SourceRange getLocation() {
        return location;
    }

    /** Source line (1-based), or -1 when the override has no location. */
    public int getLine() {
        return location == null ? -1 : location.getStartLine();
    }

    /** Renders the override as an override-file line. */
    public String toLine() {
        String rendered = symbol.getType() == SymbolType.STRING ? "\"" + value + "\"" : value;
        return "CONFIG_" + symbol.getName() + "=" + rendered;
    }

    @Override
    public String toString() {
        return toLine();
    }
}
