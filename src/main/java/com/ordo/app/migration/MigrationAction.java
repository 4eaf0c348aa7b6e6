package com.ordo.app.migration;

import java.sql.ResultSet;
import java.sql.SQLException;

import org.jdbi.v3.core.mapper.RowMapper;
import org.jdbi.v3.core.statement.StatementContext;

/**
 * Uma operação planejada sobre um arquivo. {@code seq} define a ordem de execução
 * dentro do plano; {@code expectedHash} é o conteúdo que o executor exige na origem.
 */
public record MigrationAction(
        int seq,
        long fileId,
        String sourcePath,
        String targetPath,
        ActionType actionType,
        String reason,
        boolean requiresReview,
        String expectedHash,
        String expectedQuickHash,
        String rollbackData,
        ActionOutcome outcome,
        String error
) {

    public MigrationAction withSeq(int newSeq) {
        return new MigrationAction(newSeq, fileId, sourcePath, targetPath, actionType, reason,
                requiresReview, expectedHash, expectedQuickHash, rollbackData, outcome, error);
    }

    public MigrationAction withOutcome(ActionOutcome newOutcome, String newError) {
        return new MigrationAction(seq, fileId, sourcePath, targetPath, actionType, reason,
                requiresReview, expectedHash, expectedQuickHash, rollbackData, newOutcome, newError);
    }

    public static final class Mapper implements RowMapper<MigrationAction> {
        @Override
        public MigrationAction map(ResultSet rs, StatementContext ctx) throws SQLException {
            return new MigrationAction(
                    rs.getInt("seq"),
                    rs.getLong("file_id"),
                    rs.getString("source_path"),
                    rs.getString("target_path"),
                    ActionType.fromDb(rs.getString("action_type")),
                    rs.getString("reason"),
                    rs.getInt("requires_review") != 0,
                    rs.getString("expected_hash"),
                    rs.getString("expected_quick_hash"),
                    rs.getString("rollback_data"),
                    ActionOutcome.fromDb(rs.getString("outcome")),
                    rs.getString("error")
            );
        }
    }
}
