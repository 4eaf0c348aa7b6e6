package com.ordo.app.database;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.sql.ResultSet;
import java.sql.SQLException;

import org.jdbi.v3.core.mapper.RowMapper;
import org.jdbi.v3.core.statement.StatementContext;

/**
 * Uma entrada por arquivo físico já visto. Nunca é apagada; registros substituídos
 * ficam marcados com {@code superseded}.
 */
public record FileRecord(
        long fileId,
        String contentHash,
        String quickHash,
        String originalPath,
        String fileName,
        String extension,
        long firstSeenMillis,
        long sizeBytes,
        long modifiedMillis,
        Long accessedMillis,
        String canonicalPath,
        FileState state,
        String documentType,
        Double confidence,
        ClassificationMethod classificationMethod,
        boolean duplicate,
        Long duplicateOf,
        int moveCount,
        Long lastMovedMillis,
        boolean requiresReview,
        boolean superseded,
        String storedPath,
        String lastKnownPath,
        String errorMessage
) {

    /**
     * Onde o arquivo deveria estar agora: canônico, depois armazenado (quarentena), depois original.
     */
    public String location() {
        if (canonicalPath != null) return canonicalPath;
        if (storedPath != null) return storedPath;
        return originalPath;
    }

    public Path locationPath() {
        return Paths.get(location());
    }

    public static final class Mapper implements RowMapper<FileRecord> {
        @Override
        public FileRecord map(ResultSet rs, StatementContext ctx) throws SQLException {
            return new FileRecord(
                    rs.getLong("file_id"),
                    rs.getString("content_hash"),
                    rs.getString("quick_hash"),
                    rs.getString("original_path"),
                    rs.getString("file_name"),
                    rs.getString("extension"),
                    rs.getLong("first_seen_millis"),
                    rs.getLong("size_bytes"),
                    rs.getLong("modified_millis"),
                    nullableLong(rs, "accessed_millis"),
                    rs.getString("canonical_path"),
                    FileState.fromDb(rs.getString("state")),
                    rs.getString("document_type"),
                    nullableDouble(rs, "confidence"),
                    ClassificationMethod.fromDb(rs.getString("classification_method")),
                    rs.getInt("is_duplicate") != 0,
                    nullableLong(rs, "duplicate_of"),
                    rs.getInt("move_count"),
                    nullableLong(rs, "last_moved_millis"),
                    rs.getInt("requires_review") != 0,
                    rs.getInt("superseded") != 0,
                    rs.getString("stored_path"),
                    rs.getString("last_known_path"),
                    rs.getString("error_message")
            );
        }

        private static Long nullableLong(ResultSet rs, String col) throws SQLException {
            long v = rs.getLong(col);
            return rs.wasNull() ? null : v;
        }

        private static Double nullableDouble(ResultSet rs, String col) throws SQLException {
            double v = rs.getDouble(col);
            return rs.wasNull() ? null : v;
        }
    }
}
