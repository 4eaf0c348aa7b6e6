package com.ordo.app.reorg;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import com.ordo.app.migration.ActionOutcome;
import com.ordo.app.migration.ExecutionResult;
import com.ordo.app.migration.MigrationAction;

/**
 * @param plannedActions ações calculadas (em dry-run, só elas)
 * @param execution      ausente em dry-run ou quando não havia nada a mover
 */
public record ReorganizeResult(
        SyncReport sync,
        List<MigrationAction> plannedActions,
        ExecutionResult execution,
        List<Path> removedDirectories
) {

    public ReorganizeResult {
        plannedActions = List.copyOf(plannedActions);
        removedDirectories = List.copyOf(removedDirectories);
    }

    public Optional<ExecutionResult> executionResult() {
        return Optional.ofNullable(execution);
    }

    public int moves() {
        if (execution == null) return 0;
        return execution.succeeded();
    }

    public int errors() {
        int syncErrors = sync.errors();
        if (execution == null) return syncErrors;
        return syncErrors + (int) execution.actions().stream()
                .filter(a -> a.outcome() == ActionOutcome.FAILED)
                .count();
    }
}
