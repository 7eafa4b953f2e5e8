package com.kconfig.semantics.model;

/** {@code range MIN MAX [if CONDITION]}; bounds are numbers or symbol names. */
public record RangeClause(String min, String max, String condition) {}
