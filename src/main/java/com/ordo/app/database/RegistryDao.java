package com.ordo.app.database;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.config.RegisterRowMapper;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.customizer.BindList;
import org.jdbi.v3.sqlobject.statement.GetGeneratedKeys;
import org.jdbi.v3.sqlobject.statement.SqlBatch;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;
import org.jdbi.v3.sqlobject.transaction.Transaction;

/**
 * Acesso ao registro de arquivos, logs de scan, histórico de movimentos e correções.
 * Toda escrita de múltiplas linhas roda dentro de uma transação do chamador
 * ({@code jdbi.inTransaction(h -> h.attach(RegistryDao.class)...)}).
 */
@RegisterRowMapper(FileRecord.Mapper.class)
public interface RegistryDao {

    // --- Scan log ------------------------------------------------------------

    @SqlUpdate("INSERT INTO scans(roots, started_millis, status) VALUES(:roots, :now, 'RUNNING')")
    @GetGeneratedKeys("scan_id")
    long startScanLog(@Bind("roots") String roots, @Bind("now") long now);

    @SqlUpdate("""
        UPDATE scans
           SET finished_millis = :now,
               status = :status,
               files_seen = :filesSeen,
               errors = :errors
         WHERE scan_id = :scanId
           AND status = 'RUNNING'
        """)
    int finishScanLog(@Bind("scanId") long scanId,
                      @Bind("now") long now,
                      @Bind("status") String status,
                      @Bind("filesSeen") long filesSeen,
                      @Bind("errors") long errors);

    @SqlQuery("""
        SELECT scan_id AS scanId,
               roots,
               started_millis AS startedMillis,
               finished_millis AS finishedMillis,
               status,
               files_seen AS filesSeen,
               errors
          FROM scans
         ORDER BY scan_id DESC
         LIMIT 1
        """)
    @RegisterConstructorMapper(ScanLogRow.class)
    Optional<ScanLogRow> fetchLastScan();

    // --- Registro ------------------------------------------------------------

    @SqlQuery("SELECT * FROM file_registry WHERE file_id = :id")
    Optional<FileRecord> findById(@Bind("id") long fileId);

    /** Registros ativos que reivindicam o caminho, como origem ou como posição canônica. */
    @SqlQuery("""
        SELECT *
          FROM file_registry
         WHERE superseded = 0
           AND (original_path = :path OR canonical_path = :path)
         ORDER BY file_id
        """)
    List<FileRecord> findActiveByPath(@Bind("path") String path);

    @SqlQuery("SELECT * FROM file_registry WHERE superseded = 0 ORDER BY file_id")
    List<FileRecord> fetchActive();

    @SqlQuery("SELECT * FROM file_registry ORDER BY file_id")
    List<FileRecord> fetchAll();

    @SqlQuery("""
        SELECT *
          FROM file_registry
         WHERE superseded = 0
           AND state IN (<states>)
         ORDER BY file_id
        """)
    List<FileRecord> fetchByStates(@BindList("states") Collection<String> states);

    @SqlQuery("""
        SELECT *
          FROM file_registry
         WHERE superseded = 0
           AND requires_review = 1
         ORDER BY file_id
         LIMIT :limit
        """)
    List<FileRecord> fetchRequiringReview(@Bind("limit") int limit);

    @SqlUpdate("""
        INSERT INTO file_registry(
            content_hash, quick_hash, original_path, file_name, extension,
            first_seen_millis, size_bytes, modified_millis, accessed_millis,
            state, updated_millis
        ) VALUES (
            :contentHash, :quickHash, :path, :name, :ext,
            :now, :size, :mtime, :atime,
            'pending', :now
        )
        """)
    @GetGeneratedKeys("file_id")
    long insertPending(@Bind("contentHash") String contentHash,
                       @Bind("quickHash") String quickHash,
                       @Bind("path") String path,
                       @Bind("name") String name,
                       @Bind("ext") String ext,
                       @Bind("now") long now,
                       @Bind("size") long size,
                       @Bind("mtime") long mtime,
                       @Bind("atime") Long atime);

    @SqlUpdate("""
        INSERT INTO file_registry(
            original_path, file_name, extension, first_seen_millis,
            size_bytes, modified_millis, state, error_message, updated_millis
        ) VALUES (
            :path, :name, :ext, :now,
            :size, :mtime, 'error', :message, :now
        )
        """)
    @GetGeneratedKeys("file_id")
    long insertError(@Bind("path") String path,
                     @Bind("name") String name,
                     @Bind("ext") String ext,
                     @Bind("now") long now,
                     @Bind("size") long size,
                     @Bind("mtime") long mtime,
                     @Bind("message") String message);

    /** Arquivo achado na raiz canônica sem correspondência no registro. */
    @SqlUpdate("""
        INSERT INTO file_registry(
            content_hash, quick_hash, original_path, file_name, extension,
            first_seen_millis, size_bytes, modified_millis,
            canonical_path, state, requires_review, updated_millis
        ) VALUES (
            :contentHash, :quickHash, :path, :name, :ext,
            :now, :size, :mtime,
            :path, 'organized', 1, :now
        )
        """)
    @GetGeneratedKeys("file_id")
    long insertDiscovered(@Bind("contentHash") String contentHash,
                          @Bind("quickHash") String quickHash,
                          @Bind("path") String path,
                          @Bind("name") String name,
                          @Bind("ext") String ext,
                          @Bind("now") long now,
                          @Bind("size") long size,
                          @Bind("mtime") long mtime);

    @SqlUpdate("UPDATE file_registry SET superseded = 1, updated_millis = :now WHERE file_id = :id")
    int markSuperseded(@Bind("id") long fileId, @Bind("now") long now);

    @SqlUpdate("""
        UPDATE file_registry
           SET state = 'error',
               error_message = :message,
               updated_millis = :now
         WHERE file_id = :id
        """)
    int markError(@Bind("id") long fileId, @Bind("message") String message, @Bind("now") long now);

    @SqlBatch("UPDATE file_registry SET content_hash = :hash, updated_millis = :now WHERE file_id = :id")
    void updateContentHashes(@Bind("id") List<Long> fileIds, @Bind("hash") List<String> hashes, @Bind("now") long now);

    @SqlBatch("UPDATE file_registry SET quick_hash = :hash, updated_millis = :now WHERE file_id = :id")
    void updateQuickHashes(@Bind("id") List<Long> fileIds, @Bind("hash") List<String> hashes, @Bind("now") long now);

    @SqlUpdate("UPDATE file_registry SET content_hash = :hash, updated_millis = :now WHERE file_id = :id")
    int updateContentHash(@Bind("id") long fileId, @Bind("hash") String hash, @Bind("now") long now);

    // --- Duplicatas ----------------------------------------------------------

    @SqlUpdate("DELETE FROM duplicate_members")
    void deleteDuplicateMembers();

    @SqlUpdate("DELETE FROM duplicate_groups")
    void deleteDuplicateGroups();

    @SqlUpdate("DELETE FROM near_duplicates WHERE status = 'open'")
    void deleteOpenNearDuplicates();

    /**
     * Desfaz as marcas da rodada anterior. Registros já arquivados ou na lixeira
     * continuam duplicatas: o conteúdo deles não está mais no disco para reanálise.
     */
    @SqlUpdate("""
        UPDATE file_registry
           SET is_duplicate = 0,
               duplicate_of = NULL,
               state = CASE
                   WHEN state = 'duplicate' AND document_type IS NOT NULL THEN 'classified'
                   WHEN state = 'duplicate' THEN 'pending'
                   ELSE state
               END,
               updated_millis = :now
         WHERE stored_path IS NULL
           AND (is_duplicate = 1 OR duplicate_of IS NOT NULL OR state = 'duplicate')
        """)
    int resetDuplicateFlags(@Bind("now") long now);

    @SqlUpdate("""
        INSERT INTO duplicate_groups(
            canonical_file_id, detection_method, content_hash, size_bytes,
            member_count, wasted_bytes, created_millis
        ) VALUES (
            :canonical, :method, :hash, :size, :members, :wasted, :now
        )
        """)
    @GetGeneratedKeys("group_id")
    long insertGroup(@Bind("canonical") long canonicalFileId,
                     @Bind("method") String detectionMethod,
                     @Bind("hash") String contentHash,
                     @Bind("size") long sizeBytes,
                     @Bind("members") int memberCount,
                     @Bind("wasted") long wastedBytes,
                     @Bind("now") long now);

    @SqlUpdate("""
        INSERT INTO duplicate_members(group_id, file_id, score, is_canonical)
        VALUES (:groupId, :fileId, :score, :canonical)
        """)
    void insertMember(@Bind("groupId") long groupId,
                      @Bind("fileId") long fileId,
                      @Bind("score") double score,
                      @Bind("canonical") boolean canonical);

    @SqlUpdate("""
        UPDATE file_registry
           SET is_duplicate = 1,
               duplicate_of = :canonical,
               state = CASE WHEN state = 'organized' THEN state ELSE 'duplicate' END,
               updated_millis = :now
         WHERE file_id = :id
        """)
    int markDuplicate(@Bind("id") long fileId, @Bind("canonical") long canonicalFileId, @Bind("now") long now);

    /** Duplicatas armazenadas apontam sempre para um registro não duplicado. */
    @SqlUpdate("""
        UPDATE file_registry
           SET duplicate_of = (
                   SELECT d.duplicate_of FROM file_registry d WHERE d.file_id = file_registry.duplicate_of
               ),
               updated_millis = :now
         WHERE stored_path IS NOT NULL
           AND is_duplicate = 1
           AND duplicate_of IN (
                   SELECT file_id FROM file_registry WHERE is_duplicate = 1 AND duplicate_of IS NOT NULL
               )
        """)
    int repointStoredDuplicates(@Bind("now") long now);

    @SqlUpdate("""
        INSERT INTO near_duplicates(file_id_a, file_id_b, similarity, normalized_name, status, created_millis)
        VALUES (:a, :b, :similarity, :name, 'open', :now)
        """)
    void insertNearDuplicate(@Bind("a") long fileIdA,
                             @Bind("b") long fileIdB,
                             @Bind("similarity") double similarity,
                             @Bind("name") String normalizedName,
                             @Bind("now") long now);

    @SqlQuery("""
        SELECT g.group_id AS groupId,
               g.canonical_file_id AS canonicalFileId,
               g.detection_method AS detectionMethod,
               g.content_hash AS contentHash,
               g.size_bytes AS sizeBytes,
               g.member_count AS memberCount,
               g.wasted_bytes AS wastedBytes
          FROM duplicate_groups g
         ORDER BY g.group_id
        """)
    @RegisterConstructorMapper(GroupRow.class)
    List<GroupRow> fetchGroups();

    @SqlQuery("SELECT file_id FROM duplicate_members WHERE group_id = :groupId ORDER BY file_id")
    List<Long> fetchGroupMembers(@Bind("groupId") long groupId);

    @SqlQuery("SELECT COUNT(*) FROM near_duplicates WHERE status = 'open'")
    long countOpenNearDuplicates();

    // --- Classificação e correções ------------------------------------------

    @SqlUpdate("""
        UPDATE file_registry
           SET document_type = :type,
               confidence = :confidence,
               classification_method = :method,
               state = :state,
               requires_review = :review,
               updated_millis = :now
         WHERE file_id = :id
        """)
    int applyClassification(@Bind("id") long fileId,
                            @Bind("type") String documentType,
                            @Bind("confidence") double confidence,
                            @Bind("method") String method,
                            @Bind("state") String state,
                            @Bind("review") boolean requiresReview,
                            @Bind("now") long now);

    @SqlUpdate("""
        INSERT INTO file_metadata(file_id, meta_key, meta_value)
        VALUES (:id, :key, :value)
        ON CONFLICT(file_id, meta_key) DO UPDATE SET meta_value = excluded.meta_value
        """)
    void upsertMetadata(@Bind("id") long fileId, @Bind("key") String key, @Bind("value") String value);

    @SqlQuery("""
        SELECT file_id AS fileId,
               meta_key AS metaKey,
               meta_value AS metaValue
          FROM file_metadata
         ORDER BY file_id, meta_key
        """)
    @RegisterConstructorMapper(MetadataRow.class)
    List<MetadataRow> fetchAllMetadata();

    @SqlQuery("""
        SELECT file_id AS fileId,
               meta_key AS metaKey,
               meta_value AS metaValue
          FROM file_metadata
         WHERE file_id = :id
         ORDER BY meta_key
        """)
    @RegisterConstructorMapper(MetadataRow.class)
    List<MetadataRow> fetchMetadata(@Bind("id") long fileId);

    @SqlUpdate("""
        UPDATE file_registry
           SET document_type = :type,
               classification_method = 'manual',
               confidence = 1.0,
               requires_review = 0,
               state = CASE WHEN state IN ('pending', 'review') THEN 'classified' ELSE state END,
               updated_millis = :now
         WHERE file_id = :id
        """)
    int applyCorrection(@Bind("id") long fileId, @Bind("type") String newType, @Bind("now") long now);

    @SqlUpdate("""
        INSERT INTO manual_corrections(file_id, wrong_type, correct_type, reason, corrected_millis)
        VALUES (:id, :wrong, :correct, :reason, :now)
        """)
    void insertCorrection(@Bind("id") long fileId,
                          @Bind("wrong") String wrongType,
                          @Bind("correct") String correctType,
                          @Bind("reason") String reason,
                          @Bind("now") long now);

    // --- Execução ------------------------------------------------------------

    @SqlUpdate("""
        UPDATE file_registry
           SET canonical_path = :path,
               state = 'organized',
               move_count = move_count + :increment,
               last_moved_millis = :now,
               requires_review = :review,
               last_known_path = NULL,
               updated_millis = :now
         WHERE file_id = :id
        """)
    int markOrganized(@Bind("id") long fileId,
                      @Bind("path") String canonicalPath,
                      @Bind("increment") int moveIncrement,
                      @Bind("review") boolean requiresReview,
                      @Bind("now") long now);

    /** Arquivo já no destino: vira organizado sem contar movimento. */
    @SqlUpdate("""
        UPDATE file_registry
           SET canonical_path = :path,
               state = 'organized',
               requires_review = :review,
               last_known_path = NULL,
               updated_millis = :now
         WHERE file_id = :id
        """)
    int markOrganizedInPlace(@Bind("id") long fileId,
                             @Bind("path") String canonicalPath,
                             @Bind("review") boolean requiresReview,
                             @Bind("now") long now);

    @SqlUpdate("""
        UPDATE file_registry
           SET stored_path = :path,
               move_count = move_count + :increment,
               last_moved_millis = :now,
               updated_millis = :now
         WHERE file_id = :id
        """)
    int markStored(@Bind("id") long fileId,
                   @Bind("path") String storedPath,
                   @Bind("increment") int moveIncrement,
                   @Bind("now") long now);

    @SqlUpdate("""
        UPDATE file_registry
           SET canonical_path = :canonicalPath,
               state = :state,
               content_hash = :contentHash,
               document_type = :documentType,
               stored_path = :storedPath,
               updated_millis = :now
         WHERE file_id = :id
        """)
    int restoreRecord(@Bind("id") long fileId,
                      @Bind("canonicalPath") String canonicalPath,
                      @Bind("state") String state,
                      @Bind("contentHash") String contentHash,
                      @Bind("documentType") String documentType,
                      @Bind("storedPath") String storedPath,
                      @Bind("now") long now);

    // --- Sincronização -------------------------------------------------------

    @SqlUpdate("UPDATE file_registry SET canonical_path = :path, updated_millis = :now WHERE file_id = :id")
    int relocate(@Bind("id") long fileId, @Bind("path") String newPath, @Bind("now") long now);

    @SqlUpdate("""
        UPDATE file_registry
           SET last_known_path = canonical_path,
               canonical_path = NULL,
               state = 'missing',
               updated_millis = :now
         WHERE file_id = :id
        """)
    int markMissing(@Bind("id") long fileId, @Bind("now") long now);

    @SqlUpdate("""
        UPDATE file_registry
           SET canonical_path = :path,
               state = 'organized',
               last_known_path = NULL,
               updated_millis = :now
         WHERE file_id = :id
        """)
    int rediscover(@Bind("id") long fileId, @Bind("path") String path, @Bind("now") long now);

    // --- Histórico -----------------------------------------------------------

    @SqlUpdate("""
        INSERT INTO move_history(file_id, from_path, to_path, moved_millis, reason, plan_id, event_type)
        VALUES (:id, :from, :to, :now, :reason, :planId, :eventType)
        """)
    void insertHistory(@Bind("id") long fileId,
                       @Bind("from") String fromPath,
                       @Bind("to") String toPath,
                       @Bind("now") long now,
                       @Bind("reason") String reason,
                       @Bind("planId") String planId,
                       @Bind("eventType") String eventType);

    @SqlQuery("""
        SELECT id,
               file_id AS fileId,
               from_path AS fromPath,
               to_path AS toPath,
               moved_millis AS movedMillis,
               reason,
               plan_id AS planId,
               event_type AS eventType
          FROM move_history
         WHERE file_id = :id
         ORDER BY id
        """)
    @RegisterConstructorMapper(HistoryRow.class)
    List<HistoryRow> fetchHistory(@Bind("id") long fileId);

    // --- Métricas ------------------------------------------------------------

    @SqlQuery("SELECT COUNT(*) FROM file_registry WHERE superseded = 0")
    long countActive();

    @SqlQuery("SELECT COUNT(*) FROM file_registry WHERE superseded = 0 AND is_duplicate = 1")
    long countDuplicates();

    @SqlQuery("SELECT COALESCE(SUM(size_bytes), 0) FROM file_registry WHERE superseded = 0 AND is_duplicate = 1")
    long sumDuplicateBytes();

    @SqlQuery("SELECT COUNT(*) FROM file_registry WHERE superseded = 0 AND classification_method IS NOT NULL")
    long countClassified();

    @SqlQuery("SELECT COUNT(*) FROM manual_corrections")
    long countCorrections();

    @SqlQuery("SELECT COUNT(*) FROM file_registry WHERE superseded = 0 AND state = 'organized'")
    long countOrganized();

    @SqlQuery("SELECT COUNT(*) FROM file_registry WHERE superseded = 0 AND state = 'organized' AND move_count > 1")
    long countOrganizedMovedMoreThanOnce();

    @SqlQuery("SELECT COALESCE(AVG(move_count), 0) FROM file_registry WHERE superseded = 0 AND state = 'organized'")
    double averageMovesOrganized();

    @SqlQuery("SELECT COUNT(*) FROM file_registry WHERE superseded = 0 AND requires_review = 1")
    long countRequiringReview();

    @SqlQuery("""
        SELECT classification_method AS label,
               COUNT(*) AS total
          FROM file_registry
         WHERE superseded = 0
           AND classification_method IS NOT NULL
         GROUP BY classification_method
         ORDER BY total DESC, label
        """)
    @RegisterConstructorMapper(CountRow.class)
    List<CountRow> countByMethod();

    @SqlQuery("""
        SELECT COALESCE(wrong_type, '(sem tipo)') AS label,
               COUNT(*) AS total
          FROM manual_corrections
         GROUP BY wrong_type
         ORDER BY total DESC, label
         LIMIT :limit
        """)
    @RegisterConstructorMapper(CountRow.class)
    List<CountRow> mostCommonErrors(@Bind("limit") int limit);

    @SqlUpdate("""
        INSERT INTO metrics_snapshots(snapshot_millis, metric_type, metric_value, metric_data)
        VALUES (:now, :type, :value, :data)
        """)
    void insertMetricsSnapshot(@Bind("now") long now,
                               @Bind("type") String metricType,
                               @Bind("value") Double value,
                               @Bind("data") String jsonData);

    @SqlQuery("SELECT COUNT(*) FROM metrics_snapshots WHERE metric_type = :type")
    long countSnapshots(@Bind("type") String metricType);

    /** Correção completa: atualiza o registro e deixa a trilha em manual_corrections. */
    @Transaction
    default void correct(long fileId, String wrongType, String newType, String reason, long now) {
        applyCorrection(fileId, newType, now);
        insertCorrection(fileId, wrongType, newType, reason, now);
    }

    // --- Linhas auxiliares ---------------------------------------------------

    record ScanLogRow(long scanId, String roots, Long startedMillis, Long finishedMillis,
                      String status, long filesSeen, long errors) {}

    record GroupRow(long groupId, long canonicalFileId, String detectionMethod, String contentHash,
                    long sizeBytes, int memberCount, long wastedBytes) {}

    record MetadataRow(long fileId, String metaKey, String metaValue) {}

    record HistoryRow(long id, long fileId, String fromPath, String toPath, long movedMillis,
                      String reason, String planId, String eventType) {}

    record CountRow(String label, long total) {}
}
