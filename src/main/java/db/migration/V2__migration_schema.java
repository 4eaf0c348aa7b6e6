package db.migration;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

import org.flywaydb.core.api.migration.BaseJavaMigration;
import org.flywaydb.core.api.migration.Context;

public final class V2__migration_schema extends BaseJavaMigration {

    @Override
    public void migrate(Context context) throws Exception {
        Connection conn = context.getConnection();
        ensureSchema(conn);
    }

    private void ensureSchema(Connection conn) throws SQLException {
        try (Statement st = conn.createStatement()) {
            st.execute("""
                CREATE TABLE IF NOT EXISTS migration_plans (
                    plan_id TEXT PRIMARY KEY,
                    created_millis INTEGER NOT NULL,
                    approved INTEGER NOT NULL DEFAULT 0,
                    status TEXT NOT NULL,
                    purpose TEXT,
                    executed_millis INTEGER,
                    finished_millis INTEGER,
                    message TEXT
                )
                """);

            // target_path único por plano: colisões já resolvidas no planejamento
            st.execute("""
                CREATE TABLE IF NOT EXISTS migration_actions (
                    plan_id TEXT NOT NULL REFERENCES migration_plans(plan_id),
                    seq INTEGER NOT NULL,
                    file_id INTEGER NOT NULL REFERENCES file_registry(file_id),
                    source_path TEXT NOT NULL,
                    target_path TEXT NOT NULL,
                    action_type TEXT NOT NULL,
                    reason TEXT,
                    requires_review INTEGER NOT NULL DEFAULT 0,
                    expected_hash TEXT,
                    expected_quick_hash TEXT,
                    rollback_data TEXT,
                    outcome TEXT NOT NULL DEFAULT 'pending',
                    error TEXT,
                    executed_millis INTEGER,
                    PRIMARY KEY (plan_id, seq),
                    UNIQUE (plan_id, target_path)
                )
                """);

            st.execute("""
                CREATE TABLE IF NOT EXISTS checkpoints (
                    checkpoint_id TEXT PRIMARY KEY,
                    plan_id TEXT NOT NULL REFERENCES migration_plans(plan_id),
                    created_millis INTEGER NOT NULL
                )
                """);

            st.execute("""
                CREATE TABLE IF NOT EXISTS checkpoint_entries (
                    checkpoint_id TEXT NOT NULL REFERENCES checkpoints(checkpoint_id),
                    file_id INTEGER NOT NULL REFERENCES file_registry(file_id),
                    canonical_path TEXT,
                    content_hash TEXT,
                    document_type TEXT,
                    state TEXT,
                    location TEXT,
                    stored_path TEXT,
                    PRIMARY KEY (checkpoint_id, file_id)
                )
                """);

            st.execute("CREATE INDEX IF NOT EXISTS idx_checkpoints_plan ON checkpoints(plan_id)");
        }
    }
}
