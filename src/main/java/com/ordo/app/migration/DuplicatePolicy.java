package com.ordo.app.migration;

import java.util.Locale;

import com.ordo.app.exception.ConfigurationException;

/** O que a organização inicial faz com duplicatas não canônicas. */
public enum DuplicatePolicy {
    IGNORE,
    QUARANTINE,
    ARCHIVE,
    DELETE;

    public static DuplicatePolicy parse(String value) {
        if (value == null || value.isBlank()) return IGNORE;
        try {
            return valueOf(value.strip().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("duplicatePolicy inválida: " + value, e);
        }
    }
}
