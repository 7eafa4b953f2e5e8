package com.kconfig.semantics.diagnostic;

public enum Severity {
    ERROR,
    WARNING,
    HINT
}
