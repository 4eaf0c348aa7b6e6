package com.ordo.app.migration;

import java.util.List;

/**
 * Relatório completo de uma execução: toda ação aparece com seu resultado e motivo.
 *
 * @param rollbackDiscrepancies arquivos que o rollback automático não conseguiu restaurar
 */
public record ExecutionResult(
        String planId,
        PlanStatus status,
        String checkpointId,
        List<MigrationAction> actions,
        int succeeded,
        int failed,
        boolean rolledBack,
        List<String> rollbackDiscrepancies
) {

    public ExecutionResult {
        actions = List.copyOf(actions);
        rollbackDiscrepancies = List.copyOf(rollbackDiscrepancies);
    }

    public int total() {
        return actions.size();
    }

    public List<MigrationAction> failures() {
        return actions.stream().filter(a -> a.outcome() == ActionOutcome.FAILED).toList();
    }

    /** Ações movidas fisicamente (MOVE) que ficaram aplicadas. */
    public long moves() {
        return actions.stream()
                .filter(a -> a.outcome() == ActionOutcome.SUCCEEDED && a.actionType() == ActionType.MOVE)
                .count();
    }
}
