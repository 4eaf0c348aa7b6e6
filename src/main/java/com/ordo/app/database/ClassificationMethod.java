package com.ordo.app.database;

import java.util.Locale;

public enum ClassificationMethod {
    ML_MODEL,
    PATTERN,
    MANUAL,
    EXTENSION;

    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ClassificationMethod fromDb(String v) {
        if (v == null || v.isBlank()) return null;
        return valueOf(v.trim().toUpperCase(Locale.ROOT));
    }
}
