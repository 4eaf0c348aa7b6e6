package com.ordo.app.migration;

import java.util.List;

/**
 * Lote ordenado de ações. Imutável: aprovação e mudanças de status geram novas instâncias.
 */
public record MigrationPlan(
        String planId,
        long createdMillis,
        boolean approved,
        PlanStatus status,
        String purpose,
        List<MigrationAction> actions
) {

    public MigrationPlan {
        actions = List.copyOf(actions);
    }

    public boolean isEmpty() {
        return actions.isEmpty();
    }

    public MigrationPlan withApproval() {
        return new MigrationPlan(planId, createdMillis, true, PlanStatus.APPROVED, purpose, actions);
    }

    public MigrationPlan withStatus(PlanStatus newStatus, List<MigrationAction> newActions) {
        return new MigrationPlan(planId, createdMillis, approved, newStatus, purpose, newActions);
    }
}
