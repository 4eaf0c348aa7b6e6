package com.ordo.app.migration;

/**
 * @param reversed        ações desfeitas nesta chamada
 * @param alreadyRestored ações cujo arquivo já estava de volta
 */
public record RollbackResult(String checkpointId, int reversed, int alreadyRestored, int recordsRestored) {}
