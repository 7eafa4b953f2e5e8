package com.kconfig.semantics.model;

import java.util.Locale;

public enum SymbolKind {
    CONFIG,
    MENUCONFIG,
    CHOICE;

    public static SymbolKind fromKeyword(String keyword) {
        return valueOf(keyword.trim().toUpperCase(Locale.ROOT));
    }

    public String keyword() {
        return name().toLowerCase(Locale.ROOT);
    }
}
