package com.kconfig.semantics.model;

/** {@code default VALUE [if CONDITION]}; the condition is {@code null} when absent. */
public record DefaultClause(String value, String condition) {}
