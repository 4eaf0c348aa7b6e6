package com.ordo.app.database;

import java.util.Locale;

/**
 * Estado de um registro no ciclo de vida do arquivo.
 */
public enum FileState {
    PENDING,
    CLASSIFIED,
    ORGANIZED,
    DUPLICATE,
    MISSING,
    ERROR,
    REVIEW;

    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static FileState fromDb(String v) {
        if (v == null) return PENDING;
        return valueOf(v.trim().toUpperCase(Locale.ROOT));
    }
}
