package com.ordo.app.database;

import java.util.List;
import java.util.Optional;

import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.config.RegisterRowMapper;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;
import org.jdbi.v3.sqlobject.transaction.Transaction;

import com.ordo.app.migration.Checkpoint;
import com.ordo.app.migration.MigrationAction;
import com.ordo.app.migration.MigrationPlan;

/**
 * Planos, ações e checkpoints.
 */
public interface MigrationDao {

    // --- Planos --------------------------------------------------------------

    @SqlUpdate("""
        INSERT INTO migration_plans(plan_id, created_millis, approved, status, purpose)
        VALUES (:planId, :created, :approved, :status, :purpose)
        """)
    void insertPlan(@Bind("planId") String planId,
                    @Bind("created") long createdMillis,
                    @Bind("approved") boolean approved,
                    @Bind("status") String status,
                    @Bind("purpose") String purpose);

    @SqlUpdate("""
        INSERT INTO migration_actions(
            plan_id, seq, file_id, source_path, target_path, action_type, reason,
            requires_review, expected_hash, expected_quick_hash, rollback_data, outcome
        ) VALUES (
            :planId, :seq, :fileId, :source, :target, :type, :reason,
            :review, :expectedHash, :expectedQuickHash, :rollbackData, 'pending'
        )
        """)
    void insertAction(@Bind("planId") String planId,
                      @Bind("seq") int seq,
                      @Bind("fileId") long fileId,
                      @Bind("source") String sourcePath,
                      @Bind("target") String targetPath,
                      @Bind("type") String actionType,
                      @Bind("reason") String reason,
                      @Bind("review") boolean requiresReview,
                      @Bind("expectedHash") String expectedHash,
                      @Bind("expectedQuickHash") String expectedQuickHash,
                      @Bind("rollbackData") String rollbackData);

    @Transaction
    default void savePlan(MigrationPlan plan) {
        insertPlan(plan.planId(), plan.createdMillis(), plan.approved(), plan.status().dbValue(), plan.purpose());
        for (MigrationAction a : plan.actions()) {
            insertAction(plan.planId(), a.seq(), a.fileId(), a.sourcePath(), a.targetPath(),
                    a.actionType().dbValue(), a.reason(), a.requiresReview(),
                    a.expectedHash(), a.expectedQuickHash(), a.rollbackData());
        }
    }

    @SqlQuery("""
        SELECT plan_id AS planId,
               created_millis AS createdMillis,
               approved,
               status,
               purpose,
               executed_millis AS executedMillis,
               finished_millis AS finishedMillis,
               message
          FROM migration_plans
         WHERE plan_id = :planId
        """)
    @RegisterConstructorMapper(PlanRow.class)
    Optional<PlanRow> fetchPlan(@Bind("planId") String planId);

    @SqlQuery("""
        SELECT plan_id AS planId,
               created_millis AS createdMillis,
               approved,
               status,
               purpose,
               executed_millis AS executedMillis,
               finished_millis AS finishedMillis,
               message
          FROM migration_plans
         ORDER BY created_millis DESC, plan_id
         LIMIT :limit
        """)
    @RegisterConstructorMapper(PlanRow.class)
    List<PlanRow> fetchRecentPlans(@Bind("limit") int limit);

    @SqlQuery("SELECT * FROM migration_actions WHERE plan_id = :planId ORDER BY seq")
    @RegisterRowMapper(MigrationAction.Mapper.class)
    List<MigrationAction> fetchActions(@Bind("planId") String planId);

    @SqlUpdate("UPDATE migration_plans SET approved = 1, status = 'approved' WHERE plan_id = :planId AND status = 'pending'")
    int approvePlan(@Bind("planId") String planId);

    @SqlUpdate("""
        UPDATE migration_plans
           SET status = 'executing',
               executed_millis = COALESCE(executed_millis, :now)
         WHERE plan_id = :planId
        """)
    int markExecuting(@Bind("planId") String planId, @Bind("now") long now);

    @SqlUpdate("""
        UPDATE migration_plans
           SET status = :status,
               finished_millis = :now,
               message = :message
         WHERE plan_id = :planId
        """)
    int finishPlan(@Bind("planId") String planId,
                   @Bind("status") String status,
                   @Bind("message") String message,
                   @Bind("now") long now);

    @SqlUpdate("""
        UPDATE migration_actions
           SET outcome = :outcome,
               error = :error,
               executed_millis = :now
         WHERE plan_id = :planId
           AND seq = :seq
        """)
    int updateActionOutcome(@Bind("planId") String planId,
                            @Bind("seq") int seq,
                            @Bind("outcome") String outcome,
                            @Bind("error") String error,
                            @Bind("now") long now);

    // --- Checkpoints ---------------------------------------------------------

    @SqlUpdate("INSERT INTO checkpoints(checkpoint_id, plan_id, created_millis) VALUES (:id, :planId, :now)")
    void insertCheckpoint(@Bind("id") String checkpointId, @Bind("planId") String planId, @Bind("now") long now);

    @SqlUpdate("""
        INSERT OR IGNORE INTO checkpoint_entries(
            checkpoint_id, file_id, canonical_path, content_hash, document_type, state, location, stored_path
        ) VALUES (
            :id, :fileId, :canonicalPath, :contentHash, :documentType, :state, :location, :storedPath
        )
        """)
    void insertCheckpointEntry(@Bind("id") String checkpointId,
                               @Bind("fileId") long fileId,
                               @Bind("canonicalPath") String canonicalPath,
                               @Bind("contentHash") String contentHash,
                               @Bind("documentType") String documentType,
                               @Bind("state") String state,
                               @Bind("location") String location,
                               @Bind("storedPath") String storedPath);

    @Transaction
    default void saveCheckpoint(Checkpoint checkpoint) {
        insertCheckpoint(checkpoint.checkpointId(), checkpoint.planId(), checkpoint.createdMillis());
        for (Checkpoint.Entry e : checkpoint.entries()) {
            insertCheckpointEntry(checkpoint.checkpointId(), e.fileId(), e.canonicalPath(), e.contentHash(),
                    e.documentType(), e.state().dbValue(), e.location(), e.storedPath());
        }
    }

    @SqlQuery("""
        SELECT checkpoint_id AS checkpointId,
               plan_id AS planId,
               created_millis AS createdMillis
          FROM checkpoints
         WHERE plan_id = :planId
         ORDER BY created_millis, checkpoint_id
         LIMIT 1
        """)
    @RegisterConstructorMapper(CheckpointRow.class)
    Optional<CheckpointRow> fetchCheckpointForPlan(@Bind("planId") String planId);

    @SqlQuery("""
        SELECT checkpoint_id AS checkpointId,
               plan_id AS planId,
               created_millis AS createdMillis
          FROM checkpoints
         WHERE checkpoint_id = :id
        """)
    @RegisterConstructorMapper(CheckpointRow.class)
    Optional<CheckpointRow> fetchCheckpointRow(@Bind("id") String checkpointId);

    @SqlQuery("SELECT * FROM checkpoint_entries WHERE checkpoint_id = :id ORDER BY file_id")
    @RegisterRowMapper(Checkpoint.EntryMapper.class)
    List<Checkpoint.Entry> fetchCheckpointEntries(@Bind("id") String checkpointId);

    default Optional<Checkpoint> loadCheckpoint(String checkpointId) {
        return fetchCheckpointRow(checkpointId)
                .map(r -> new Checkpoint(r.checkpointId(), r.planId(), r.createdMillis(),
                        fetchCheckpointEntries(r.checkpointId())));
    }

    default Optional<Checkpoint> loadCheckpointForPlan(String planId) {
        return fetchCheckpointForPlan(planId)
                .map(r -> new Checkpoint(r.checkpointId(), r.planId(), r.createdMillis(),
                        fetchCheckpointEntries(r.checkpointId())));
    }

    record PlanRow(String planId, long createdMillis, boolean approved, String status, String purpose,
                   Long executedMillis, Long finishedMillis, String message) {}

    record CheckpointRow(String checkpointId, String planId, long createdMillis) {}
}
