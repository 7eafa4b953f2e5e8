package com.kconfig.semantics.model;

/** Evaluated bounds of a numeric symbol, inclusive on both ends. */
public record ValueRange(long min, long max) {
    public static final ValueRange UNBOUNDED = new ValueRange(Long.MIN_VALUE, Long.MAX_VALUE);

    public boolean contains(long value) {
        return value >= min && value <= max;
    }
}
