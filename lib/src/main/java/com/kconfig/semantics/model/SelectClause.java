package com.kconfig.semantics.model;

/** {@code select|imply TARGET [if CONDITION]}; the condition is {@code null} when absent. */
public record SelectClause(String target, String condition) {}
