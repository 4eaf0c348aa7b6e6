package com.ordo.app.migration;

import java.util.Locale;

public enum PlanStatus {
    PENDING,
    APPROVED,
    EXECUTING,
    COMPLETED,
    FAILED,
    ROLLED_BACK;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == ROLLED_BACK;
    }

    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static PlanStatus fromDb(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
