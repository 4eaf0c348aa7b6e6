package com.ordo.app.migration;

import java.util.List;
import java.util.Map;

import com.ordo.app.database.FileRecord;

/**
 * Leitura consistente do registro usada pelo planejador: todos os registros ativos e seus metadados.
 */
public record RegistrySnapshot(List<FileRecord> records, Map<Long, Map<String, String>> metadata) {

    public RegistrySnapshot {
        records = List.copyOf(records);
        metadata = Map.copyOf(metadata);
    }

    public Map<String, String> metadataOf(long fileId) {
        return metadata.getOrDefault(fileId, Map.of());
    }
}
