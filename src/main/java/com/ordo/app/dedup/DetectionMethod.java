package com.ordo.app.dedup;

import java.util.Locale;

public enum DetectionMethod {
    QUICK_HASH_PREFILTER,
    FULL_HASH_VERIFIED,
    FUZZY_FILENAME;

    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static DetectionMethod fromDb(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
