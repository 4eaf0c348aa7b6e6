package com.ordo.app.migration;

import java.util.Locale;

public enum ActionType {
    MOVE,
    COPY,
    /** Grava o destino como fluxo zstd e remove a origem. */
    ARCHIVE,
    /** Move para a lixeira da quarentena; continua reversível. */
    DELETE;

    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ActionType fromDb(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
