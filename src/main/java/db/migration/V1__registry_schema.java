package db.migration;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

import org.flywaydb.core.api.migration.BaseJavaMigration;
import org.flywaydb.core.api.migration.Context;

public final class V1__registry_schema extends BaseJavaMigration {

    @Override
    public void migrate(Context context) throws Exception {
        Connection conn = context.getConnection();
        ensureSchema(conn);
        ensureIndexes(conn);
    }

    private void ensureSchema(Connection conn) throws SQLException {
        try (Statement st = conn.createStatement()) {
            st.execute("""
                CREATE TABLE IF NOT EXISTS file_registry (
                    file_id INTEGER PRIMARY KEY AUTOINCREMENT,
                    content_hash TEXT,
                    quick_hash TEXT,
                    original_path TEXT NOT NULL,
                    file_name TEXT,
                    extension TEXT,
                    first_seen_millis INTEGER NOT NULL,
                    size_bytes INTEGER NOT NULL DEFAULT 0,
                    modified_millis INTEGER NOT NULL DEFAULT 0,
                    accessed_millis INTEGER,
                    canonical_path TEXT,
                    state TEXT NOT NULL DEFAULT 'pending',
                    document_type TEXT,
                    confidence REAL,
                    classification_method TEXT,
                    is_duplicate INTEGER NOT NULL DEFAULT 0,
                    duplicate_of INTEGER REFERENCES file_registry(file_id),
                    move_count INTEGER NOT NULL DEFAULT 0 CHECK (move_count >= 0),
                    last_moved_millis INTEGER,
                    requires_review INTEGER NOT NULL DEFAULT 0,
                    superseded INTEGER NOT NULL DEFAULT 0,
                    stored_path TEXT,
                    last_known_path TEXT,
                    error_message TEXT,
                    updated_millis INTEGER
                )
                """);

            st.execute("""
                CREATE TABLE IF NOT EXISTS file_metadata (
                    file_id INTEGER NOT NULL REFERENCES file_registry(file_id),
                    meta_key TEXT NOT NULL,
                    meta_value TEXT,
                    PRIMARY KEY (file_id, meta_key)
                )
                """);

            st.execute("""
                CREATE TABLE IF NOT EXISTS scans (
                    scan_id INTEGER PRIMARY KEY AUTOINCREMENT,
                    roots TEXT,
                    started_millis INTEGER,
                    finished_millis INTEGER,
                    status TEXT,
                    files_seen INTEGER DEFAULT 0,
                    errors INTEGER DEFAULT 0
                )
                """);

            // MOVE | COPY | ARCHIVE | DELETE | EXTERNAL_MOVE | ROLLBACK | REDISCOVERED
            st.execute("""
                CREATE TABLE IF NOT EXISTS move_history (
                    id INTEGER PRIMARY KEY AUTOINCREMENT,
                    file_id INTEGER NOT NULL REFERENCES file_registry(file_id),
                    from_path TEXT,
                    to_path TEXT,
                    moved_millis INTEGER NOT NULL,
                    reason TEXT,
                    plan_id TEXT,
                    event_type TEXT NOT NULL
                )
                """);

            st.execute("""
                CREATE TABLE IF NOT EXISTS manual_corrections (
                    id INTEGER PRIMARY KEY AUTOINCREMENT,
                    file_id INTEGER NOT NULL REFERENCES file_registry(file_id),
                    wrong_type TEXT,
                    correct_type TEXT NOT NULL,
                    reason TEXT,
                    corrected_millis INTEGER NOT NULL
                )
                """);

            st.execute("""
                CREATE TABLE IF NOT EXISTS duplicate_groups (
                    group_id INTEGER PRIMARY KEY AUTOINCREMENT,
                    canonical_file_id INTEGER NOT NULL REFERENCES file_registry(file_id),
                    detection_method TEXT NOT NULL,
                    content_hash TEXT,
                    size_bytes INTEGER,
                    member_count INTEGER NOT NULL,
                    wasted_bytes INTEGER,
                    created_millis INTEGER NOT NULL
                )
                """);

            st.execute("""
                CREATE TABLE IF NOT EXISTS duplicate_members (
                    group_id INTEGER NOT NULL REFERENCES duplicate_groups(group_id),
                    file_id INTEGER NOT NULL REFERENCES file_registry(file_id),
                    score REAL,
                    is_canonical INTEGER NOT NULL DEFAULT 0,
                    PRIMARY KEY (group_id, file_id)
                )
                """);

            st.execute("""
                CREATE TABLE IF NOT EXISTS near_duplicates (
                    id INTEGER PRIMARY KEY AUTOINCREMENT,
                    file_id_a INTEGER NOT NULL REFERENCES file_registry(file_id),
                    file_id_b INTEGER NOT NULL REFERENCES file_registry(file_id),
                    similarity REAL NOT NULL,
                    normalized_name TEXT,
                    status TEXT NOT NULL DEFAULT 'open',
                    created_millis INTEGER NOT NULL
                )
                """);
        }
    }

    private void ensureIndexes(Connection conn) throws SQLException {
        try (Statement st = conn.createStatement()) {
            st.execute("CREATE INDEX IF NOT EXISTS idx_registry_original ON file_registry(original_path)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_registry_canonical ON file_registry(canonical_path)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_registry_content_hash ON file_registry(content_hash)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_registry_size_ext ON file_registry(size_bytes, extension)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_registry_state ON file_registry(state)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_history_file ON move_history(file_id)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_members_file ON duplicate_members(file_id)");
        }
    }
}
