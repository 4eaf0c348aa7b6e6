package com.ordo.app.migration;

import java.util.Locale;

public enum ActionOutcome {
    PENDING,
    SUCCEEDED,
    FAILED,
    ROLLED_BACK;

    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ActionOutcome fromDb(String value) {
        if (value == null || value.isBlank()) return PENDING;
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
