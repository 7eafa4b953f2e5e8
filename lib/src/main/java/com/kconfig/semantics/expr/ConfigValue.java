package com.kconfig.semantics.expr;

import java.util.Objects;
import java.util.OptionalLong;

/**
 * Result of evaluating an expression or a symbol: a boolean, a 64-bit number or a string.
 * Tristate values do not exist at this level; {@link #ofTristate(String)} is the single, lossy
 * conversion that folds {@code y} and {@code m} into {@code true}.
 */
public final class ConfigValue {

    public enum Kind {
        BOOLEAN,
        NUMBER,
        STRING
    }

    public static final ConfigValue TRUE = new ConfigValue(Kind.BOOLEAN, true, 0, null);
    public static final ConfigValue FALSE = new ConfigValue(Kind.BOOLEAN, false, 0, null);

    private final Kind kind;
    private final boolean bool;
    private final long number;
    private final String string;

    private ConfigValue(Kind kind, boolean bool, long number, String string) {
        this.kind = kind;
        this.bool = bool;
        this.number = number;
        this.string = string;
    }

    public static ConfigValue of(boolean value) {
        return value ? TRUE : FALSE;
    }

    public static ConfigValue of(long value) {
        return new ConfigValue(Kind.NUMBER, false, value, null);
    }

    public static ConfigValue of(String value) {
        return new ConfigValue(Kind.STRING, false, 0, Objects.requireNonNull(value, "value"));
    }

    /** Collapses a tristate literal: {@code y} and {@code m} are true, anything else false. */
    public static ConfigValue ofTristate(String literal) {
        String trimmed = literal.trim();
        return of("y".equals(trimmed) || "m".equals(trimmed));
    }

    /**
     * Parses a decimal or {@code 0x}-prefixed hexadecimal literal, with an optional sign. Text that
     * is not a number, or a number that does not fit in 64 bits, yields an empty result.
     */
    public static OptionalLong parseNumber(String literal) {
        String text = literal.trim();
        boolean negative = false;
        if (text.startsWith("-") || text.startsWith("+")) {
            negative = text.charAt(0) == '-';
            text = text.substring(1);
        }
        long value;
        try {
            if (text.startsWith("0x") || text.startsWith("0X")) {
                value = Long.parseUnsignedLong(text.substring(2), 16);
            } else {
                value = Long.parseLong(text);
            }
        } catch (NumberFormatException ex) {
            return OptionalLong.empty();
        }
        return OptionalLong.of(negative ? -value : value);
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isBoolean() {
        return kind == Kind.BOOLEAN;
    }

    public boolean isNumber() {
        return kind == Kind.NUMBER;
    }

    /** Strict truth: only the boolean {@code true}. */
    public boolean isTrue() {
        return kind == Kind.BOOLEAN && bool;
    }

    /** Loose truth used for dependency gating: non-zero numbers and non-empty strings count. */
    public boolean isTruthy() {
        switch (kind) {
            case BOOLEAN:
                return bool;
            case NUMBER:
                return number != 0;
            default:
                return !string.isEmpty();
        }
    }

    public boolean asBoolean(String operator) {
        if (kind != Kind.BOOLEAN) {
            throw new ExpressionTypeException(operator, kind);
        }
        return bool;
    }

    public long asNumber(String operator) {
        if (kind != Kind.NUMBER) {
            throw new ExpressionTypeException(operator, kind);
        }
        return number;
    }

    public String asString() {
        switch (kind) {
            case BOOLEAN:
                return Boolean.toString(bool);
            case NUMBER:
                return Long.toString(number);
            default:
                return string;
        }
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof ConfigValue)) {
            return false;
        }
        ConfigValue other = (ConfigValue) obj;
        if (kind != other.kind) {
            return false;
        }
        switch (kind) {
            case BOOLEAN:
                return bool == other.bool;
            case NUMBER:
                return number == other.number;
            default:
                return string.equals(other.string);
        }
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, bool, number, string);
    }

    @Override
    public String toString() {
        return kind == Kind.STRING ? "\"" + string + "\"" : asString();
    }
}
