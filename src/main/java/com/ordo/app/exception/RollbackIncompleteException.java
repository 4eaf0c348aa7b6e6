package com.ordo.app.exception;

import java.io.Serial;
import java.util.List;

/**
 * Alguns arquivos do checkpoint não puderam ser restaurados. Carrega a lista de divergências.
 */
public class RollbackIncompleteException extends OrdoException {
    @Serial
    private static final long serialVersionUID = 5078612993146045188L;

    private final String checkpointId;
    private final transient List<String> discrepancies;

    public RollbackIncompleteException(String checkpointId, List<String> discrepancies) {
        super("Rollback incompleto para checkpoint " + checkpointId + ": " + discrepancies.size() + " divergência(s)");
        this.checkpointId = checkpointId;
        this.discrepancies = List.copyOf(discrepancies);
    }

    public String getCheckpointId() {
        return checkpointId;
    }

    public List<String> getDiscrepancies() {
        return discrepancies;
    }
}
