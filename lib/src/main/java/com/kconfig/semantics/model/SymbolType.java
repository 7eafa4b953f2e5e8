package com.kconfig.semantics.model;

import com.kconfig.semantics.expr.ConfigValue;
import java.util.Locale;
import java.util.OptionalLong;
import java.util.regex.Pattern;

/** Declared value type of a symbol, with the literal conversions each type supports. */
public enum SymbolType {
    BOOL(Pattern.compile("[yn]")),
    TRISTATE(Pattern.compile("[ynm]")),
    INT(Pattern.compile("[-+]?\\d+")),
    HEX(Pattern.compile("0[xX][0-9a-fA-F]+")),
    STRING(Pattern.compile("\"(?:\\\\.|[^\"\\\\])*\""));

    private final Pattern literal;

    SymbolType(Pattern literal) {
        this.literal = literal;
    }

    public static SymbolType fromKeyword(String keyword) {
        return valueOf(keyword.trim().toUpperCase(Locale.ROOT));
    }

    public String keyword() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isBoolean() {
        return this == BOOL || this == TRISTATE;
    }

    public boolean isNumeric() {
        return this == INT || this == HEX;
    }

    /** Value a disabled or undetermined symbol of this type takes. */
    public ConfigValue zeroValue() {
        switch (this) {
            case INT:
            case HEX:
                return ConfigValue.of(0L);
            case STRING:
                return ConfigValue.of("");
            default:
                return ConfigValue.FALSE;
        }
    }

    /** Whether {@code raw} (strings still quoted) is an acceptable override literal. */
    public boolean isValidLiteral(String raw) {
        if (raw == null || !literal.matcher(raw.trim()).matches()) {
            return false;
        }
        return !isNumeric() || ConfigValue.parseNumber(raw).isPresent();
    }

    /**
     * Converts an override value (strings already unquoted) to a {@link ConfigValue}. Malformed
     * or out-of-range numbers yield the zero value; override files reject them before they get here.
     */
    public ConfigValue parseValue(String value) {
        switch (this) {
            case BOOL:
            case TRISTATE:
                return ConfigValue.ofTristate(value);
            case INT:
            case HEX:
                if (!INT.literal.matcher(value.trim()).matches() && !HEX.literal.matcher(value.trim()).matches()) {
                    return zeroValue();
                }
                OptionalLong number = ConfigValue.parseNumber(value);
                return number.isPresent() ? ConfigValue.of(number.getAsLong()) : zeroValue();
            default:
                return ConfigValue.of(value);
        }
    }

    /** Renders a value the way it would be written in an override file. */
    public String format(ConfigValue value) {
        switch (this) {
            case BOOL:
            case TRISTATE:
                return value.isTruthy() ? "y" : "n";
            case INT:
                return value.isNumber() ? Long.toString(value.asNumber("int")) : "0";
            case HEX:
                return value.isNumber() ? "0x" + Long.toHexString(value.asNumber("hex")) : "0x0";
            default:
                return "\"" + value.asString() + "\"";
        }
    }
}
