package com.ordo.app.migration;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import org.jdbi.v3.core.mapper.RowMapper;
import org.jdbi.v3.core.statement.StatementContext;

import com.ordo.app.database.FileState;

/**
 * Fotografia do registro (não dos bytes) tirada antes de executar um plano.
 * Mantida para auditoria depois do uso.
 */
public record Checkpoint(String checkpointId, String planId, long createdMillis, List<Entry> entries) {

    public Checkpoint {
        entries = List.copyOf(entries);
    }

    public Map<Long, Entry> entriesByFileId() {
        return entries.stream().collect(Collectors.toMap(Entry::fileId, Function.identity(), (a, b) -> a));
    }

    /**
     * @param location caminho físico do arquivo antes da execução
     */
    public record Entry(
            long fileId,
            String canonicalPath,
            String contentHash,
            String documentType,
            FileState state,
            String location,
            String storedPath
    ) {}

    public static final class EntryMapper implements RowMapper<Entry> {
        @Override
        public Entry map(ResultSet rs, StatementContext ctx) throws SQLException {
            return new Entry(
                    rs.getLong("file_id"),
                    rs.getString("canonical_path"),
                    rs.getString("content_hash"),
                    rs.getString("document_type"),
                    FileState.fromDb(rs.getString("state")),
                    rs.getString("location"),
                    rs.getString("stored_path")
            );
        }
    }
}
