package com.ordo.app.migration;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.luben.zstd.ZstdInputStream;
import com.github.luben.zstd.ZstdOutputStream;
import com.ordo.app.AppContext;
import com.ordo.app.database.FileRecord;
import com.ordo.app.database.MigrationDao;
import com.ordo.app.database.RegistryDao;
import com.ordo.app.exception.ConflictException;
import com.ordo.app.exception.IntegrityException;
import com.ordo.app.exception.OrdoException;
import com.ordo.app.exception.PlanNotApprovedException;
import com.ordo.app.exception.RollbackIncompleteException;
import com.ordo.app.exception.SourceChangedException;
import com.ordo.app.hashing.ContentHasher;

/**
 * Aplica planos aprovados em lotes, com checkpoint antes de começar e rollback automático
 * quando a taxa de falhas passa do limite. Cada lote grava o registro em uma transação.
 */
public final class MigrationExecutor {

    private static final Logger logger = LoggerFactory.getLogger(MigrationExecutor.class);

    private final AppContext ctx;

    public MigrationExecutor(AppContext ctx) {
        this.ctx = ctx;
    }

    public ExecutionResult execute(MigrationPlan plan) {
        return execute(plan, new AtomicBoolean(false));
    }

    /**
     * Executa (ou retoma) o plano. Cancelado entre lotes, o plano fica em {@code executing}
     * e uma nova chamada continua do ponto em que parou, com o mesmo checkpoint.
     */
    public ExecutionResult execute(MigrationPlan plan, AtomicBoolean cancel) {
        if (!plan.approved()) {
            throw new PlanNotApprovedException(plan.planId());
        }
        String planId = plan.planId();
        MigrationDao.PlanRow row = ctx.jdbi().withExtension(MigrationDao.class, dao -> dao.fetchPlan(planId))
                .orElseThrow(() -> new IllegalArgumentException("Plano não encontrado: " + planId));
        if (!row.approved()) {
            throw new PlanNotApprovedException(planId);
        }
        if (PlanStatus.fromDb(row.status()).isTerminal()) {
            throw new IllegalStateException("Plano " + planId + " já terminou: " + row.status());
        }

        List<MigrationAction> actions = fetchActions(planId);
        Checkpoint checkpoint = ctx.jdbi().withExtension(MigrationDao.class, dao -> dao.loadCheckpointForPlan(planId))
                .orElseGet(() -> createCheckpoint(planId, actions));
        ctx.jdbi().useExtension(MigrationDao.class, dao -> dao.markExecuting(planId, ctx.nowMillis()));

        List<MigrationAction> pending = actions.stream()
                .filter(a -> a.outcome() == ActionOutcome.PENDING)
                .toList();
        logger.info("Executando plano {}: {} ações pendentes de {}", planId, pending.size(), actions.size());

        int batchSize = Math.max(1, ctx.config().getExecutionBatchSize());
        for (int from = 0; from < pending.size(); from += batchSize) {
            if (cancel.get() || Thread.currentThread().isInterrupted()) {
                logger.info("Plano {} interrompido; retomável", planId);
                return result(planId, PlanStatus.EXECUTING, checkpoint, false, List.of());
            }
            runBatch(planId, pending.subList(from, Math.min(pending.size(), from + batchSize)));
        }

        List<MigrationAction> done = fetchActions(planId);
        long failed = done.stream().filter(a -> a.outcome() == ActionOutcome.FAILED).count();
        int total = done.size();
        double threshold = ctx.config().getFailureThreshold();

        if (total > 0 && (double) failed / total > threshold) {
            String msg = failed + "/" + total + " ações falharam (limite " + threshold + ")";
            logger.error("Plano {} falhou: {}; iniciando rollback", planId, msg);
            finishPlan(planId, PlanStatus.FAILED, msg);
            try {
                rollback(checkpoint);
                finishPlan(planId, PlanStatus.ROLLED_BACK, msg + "; rollback concluído");
                return result(planId, PlanStatus.ROLLED_BACK, checkpoint, true, List.of());
            } catch (RollbackIncompleteException e) {
                logger.error("Rollback do plano {} incompleto: {}", planId, e.getDiscrepancies());
                finishPlan(planId, PlanStatus.FAILED, msg + "; rollback incompleto");
                return result(planId, PlanStatus.FAILED, checkpoint, false, e.getDiscrepancies());
            }
        }

        finishPlan(planId, PlanStatus.COMPLETED, (total - failed) + "/" + total + " ações aplicadas");
        logger.info("Plano {} concluído: {}/{} ações aplicadas", planId, total - failed, total);
        return result(planId, PlanStatus.COMPLETED, checkpoint, false, List.of());
    }

    public Checkpoint checkpointFor(String planId) {
        return ctx.jdbi().withExtension(MigrationDao.class, dao -> dao.loadCheckpointForPlan(planId))
                .orElseThrow(() -> new IllegalArgumentException("Plano sem checkpoint: " + planId));
    }

    // -----------------------------
    // Checkpoint
    // -----------------------------

    private Checkpoint createCheckpoint(String planId, List<MigrationAction> actions) {
        Set<Long> fileIds = new HashSet<>();
        for (MigrationAction a : actions) fileIds.add(a.fileId());

        List<Checkpoint.Entry> entries = new ArrayList<>();
        ctx.jdbi().useExtension(RegistryDao.class, dao -> {
            for (Long id : fileIds.stream().sorted().toList()) {
                dao.findById(id).ifPresent(r -> entries.add(new Checkpoint.Entry(
                        r.fileId(), r.canonicalPath(), r.contentHash(), r.documentType(),
                        r.state(), r.location(), r.storedPath())));
            }
        });

        Checkpoint cp = new Checkpoint(UUID.randomUUID().toString(), planId, ctx.nowMillis(), entries);
        ctx.jdbi().useExtension(MigrationDao.class, dao -> dao.saveCheckpoint(cp));
        logger.debug("Checkpoint {} criado para o plano {} ({} registros)", cp.checkpointId(), planId, entries.size());
        return cp;
    }

    // -----------------------------
    // Lotes
    // -----------------------------

    private record Applied(MigrationAction action, FileRecord record, String computedHash, String error) {
        boolean ok() {
            return error == null;
        }
    }

    private void runBatch(String planId, List<MigrationAction> batch) {
        Map<Long, FileRecord> records = new LinkedHashMap<>();
        ctx.jdbi().useExtension(RegistryDao.class, dao -> {
            for (MigrationAction a : batch) {
                dao.findById(a.fileId()).ifPresent(r -> records.put(r.fileId(), r));
            }
        });

        List<Applied> results = new ArrayList<>(batch.size());
        for (MigrationAction a : batch) {
            FileRecord r = records.get(a.fileId());
            if (r == null) {
                results.add(new Applied(a, null, null, "Registro " + a.fileId() + " não existe"));
                continue;
            }
            try {
                String computed = apply(a);
                results.add(new Applied(a, r, computed, null));
            } catch (OrdoException | IOException e) {
                logger.warn("Ação {} do plano {} falhou: {}", a.seq(), planId, e.toString());
                results.add(new Applied(a, r, null, e.getClass().getSimpleName() + ": " + e.getMessage()));
            }
        }

        long now = ctx.nowMillis();
        ctx.jdbi().useTransaction(handle -> {
            RegistryDao registry = handle.attach(RegistryDao.class);
            MigrationDao migrations = handle.attach(MigrationDao.class);
            for (Applied r : results) {
                MigrationAction a = r.action();
                if (!r.ok()) {
                    migrations.updateActionOutcome(planId, a.seq(), ActionOutcome.FAILED.dbValue(), r.error(), now);
                    continue;
                }
                recordSuccess(registry, planId, r, now);
                migrations.updateActionOutcome(planId, a.seq(), ActionOutcome.SUCCEEDED.dbValue(), null, now);
            }
        });
    }

    private static void recordSuccess(RegistryDao dao, String planId, Applied applied, long now) {
        MigrationAction a = applied.action();
        FileRecord r = applied.record();
        long id = r.fileId();
        if (applied.computedHash() != null) {
            dao.updateContentHash(id, applied.computedHash(), now);
        }
        switch (a.actionType()) {
            case MOVE -> {
                if (r.duplicate()) dao.markStored(id, a.targetPath(), 1, now);
                else dao.markOrganized(id, a.targetPath(), 1, a.requiresReview(), now);
            }
            case COPY -> dao.markOrganized(id, a.targetPath(), 0, a.requiresReview(), now);
            case ARCHIVE -> dao.markStored(id, a.targetPath(), 0, now);
            case DELETE -> dao.markStored(id, a.targetPath(), 1, now);
        }
        dao.insertHistory(id, a.sourcePath(), a.targetPath(), now, a.reason(), planId, a.actionType().name());
    }

    /**
     * Confere a origem, aplica a operação e devolve o hash completo quando ele ainda não
     * era conhecido.
     */
    private String apply(MigrationAction a) throws IOException {
        Path source = Paths.get(a.sourcePath());
        Path target = Paths.get(a.targetPath());

        if (!Files.isRegularFile(source, LinkOption.NOFOLLOW_LINKS)) {
            String adopted = alreadyApplied(a, target);
            if (adopted != null) {
                logger.info("Ação {} já estava aplicada em disco ({}); registrando", a.seq(), target);
                return adopted;
            }
            throw new SourceChangedException("Origem não existe mais: " + source);
        }
        String computed = verifySource(a, source);

        if (Files.exists(target, LinkOption.NOFOLLOW_LINKS)) {
            if (a.actionType() == ActionType.COPY) {
                String adopted = alreadyApplied(a, target);
                if (adopted != null) return adopted;
            }
            throw new ConflictException("Destino já existe: " + target);
        }
        Path parent = target.getParent();
        if (parent != null) Files.createDirectories(parent);

        switch (a.actionType()) {
            case MOVE, DELETE -> moveFile(source, target);
            case COPY -> Files.copy(source, target, StandardCopyOption.COPY_ATTRIBUTES);
            case ARCHIVE -> archive(source, target);
        }
        return computed;
    }

    /**
     * Ação aplicada em disco mas não registrada (queda entre o lote e a transação): o destino
     * já tem o conteúdo esperado. Devolve o hash completo do conteúdo, ou null se não for o caso.
     */
    private static String alreadyApplied(MigrationAction a, Path target) throws IOException {
        if (!Files.isRegularFile(target, LinkOption.NOFOLLOW_LINKS)) return null;
        String actual = a.actionType() == ActionType.ARCHIVE ? archivedContentHash(target) : ContentHasher.fullHash(target);
        return matchesPlanned(a, actual, target) ? actual : null;
    }

    private static boolean matchesPlanned(MigrationAction a, String fullHash, Path file) throws IOException {
        if (a.expectedHash() != null) return a.expectedHash().equals(fullHash);
        if (a.expectedQuickHash() == null || a.actionType() == ActionType.ARCHIVE) return false;
        return a.expectedQuickHash().equals(ContentHasher.quickHash(file));
    }

    private static String archivedContentHash(Path archive) throws IOException {
        try (InputStream in = Files.newInputStream(archive);
             ZstdInputStream zis = new ZstdInputStream(in)) {
            return ContentHasher.fullHash(zis);
        } catch (IOException e) {
            logger.debug("Arquivo compactado ilegível {}: {}", archive, e.toString());
            return null;
        }
    }

    private static String verifySource(MigrationAction a, Path source) throws IOException {
        if (a.expectedHash() != null) {
            String actual = ContentHasher.fullHash(source);
            if (!a.expectedHash().equals(actual)) {
                throw new SourceChangedException("Conteúdo mudou desde o planejamento: " + source);
            }
            return null;
        }
        long size = Files.size(source);
        if (a.expectedQuickHash() != null) {
            String quick = ContentHasher.quickHash(source);
            if (!a.expectedQuickHash().equals(quick)) {
                throw new SourceChangedException("Conteúdo mudou desde o planejamento: " + source);
            }
            if (ContentHasher.quickHashCoversWholeFile(size)) return quick;
        }
        return ContentHasher.fullHash(source);
    }

    private static void moveFile(Path from, Path to) throws IOException {
        try {
            Files.move(from, to, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(from, to);
        }
    }

    private static void archive(Path source, Path target) throws IOException {
        Path tmp = target.resolveSibling(target.getFileName() + ".tmp");
        try {
            try (InputStream in = Files.newInputStream(source);
                 OutputStream base = Files.newOutputStream(tmp);
                 ZstdOutputStream zos = new ZstdOutputStream(base, 3)) {
                in.transferTo(zos);
            }
            Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            Files.deleteIfExists(tmp);
            throw e;
        }
        Files.delete(source);
    }

    // -----------------------------
    // Rollback
    // -----------------------------

    private enum Reversal { REVERSED, ALREADY_RESTORED }

    /**
     * Desfaz as ações aplicadas do plano, da última para a primeira, e restaura os registros
     * do checkpoint. Ações ainda pendentes cujo arquivo já está no destino (queda no meio de
     * um lote) também voltam. Pode ser repetido. Arquivos e registros alterados depois do
     * checkpoint não são sobrescritos: vão para a lista de discrepâncias.
     *
     * @throws RollbackIncompleteException se algum arquivo ou registro não pôde ser restaurado
     */
    public RollbackResult rollback(Checkpoint checkpoint) {
        String planId = checkpoint.planId();
        Map<Long, Checkpoint.Entry> entries = checkpoint.entriesByFileId();

        Map<Long, FileRecord> current = new LinkedHashMap<>();
        ctx.jdbi().useExtension(RegistryDao.class, dao -> {
            for (Checkpoint.Entry e : checkpoint.entries()) {
                dao.findById(e.fileId()).ifPresent(r -> current.put(r.fileId(), r));
            }
        });

        List<MigrationAction> applied = new ArrayList<>();
        for (MigrationAction a : fetchActions(planId)) {
            if (a.outcome() == ActionOutcome.SUCCEEDED) {
                applied.add(a);
            } else if (a.outcome() == ActionOutcome.PENDING && isStranded(a, expectedHash(a, entries, current))) {
                logger.warn("Ação {} do plano {} ficou aplicada sem registro; será desfeita", a.seq(), planId);
                applied.add(a);
            }
        }
        applied.sort(Comparator.comparingInt(MigrationAction::seq).reversed());

        List<MigrationAction> reversed = new ArrayList<>();
        List<String> discrepancies = new ArrayList<>();
        Set<Long> blocked = new HashSet<>();
        int already = 0;

        for (MigrationAction a : applied) {
            String expected = expectedHash(a, entries, current);
            try {
                if (reverse(a, expected) == Reversal.ALREADY_RESTORED) already++;
                reversed.add(a);
            } catch (IntegrityException | IOException e) {
                logger.warn("Rollback da ação {} do plano {}: {}", a.seq(), planId, e.getMessage());
                discrepancies.add(a.targetPath() + ": " + e.getMessage());
                blocked.add(a.fileId());
            }
        }

        // só restaura o que este rollback desfez ou o que continua como o checkpoint deixou
        Set<Long> touched = new HashSet<>();
        for (MigrationAction a : reversed) touched.add(a.fileId());
        List<Checkpoint.Entry> toRestore = new ArrayList<>();
        for (Checkpoint.Entry e : checkpoint.entries()) {
            if (blocked.contains(e.fileId())) continue;
            FileRecord rec = current.get(e.fileId());
            if (touched.contains(e.fileId())) {
                toRestore.add(e);
            } else if (rec != null && !matchesCheckpoint(rec, e)) {
                logger.warn("Registro {} mudou depois do checkpoint do plano {}; mantido", e.fileId(), planId);
                discrepancies.add(rec.location() + ": registro alterado depois do checkpoint (" + rec.state() + ")");
            }
        }

        long now = ctx.nowMillis();
        int restored = ctx.jdbi().inTransaction(handle -> {
            RegistryDao registry = handle.attach(RegistryDao.class);
            MigrationDao migrations = handle.attach(MigrationDao.class);
            for (MigrationAction a : reversed) {
                migrations.updateActionOutcome(planId, a.seq(), ActionOutcome.ROLLED_BACK.dbValue(), null, now);
                registry.insertHistory(a.fileId(), a.targetPath(), a.sourcePath(), now,
                        "rollback do plano " + planId, planId, "ROLLBACK");
            }
            int n = 0;
            for (Checkpoint.Entry e : toRestore) {
                registry.restoreRecord(e.fileId(), e.canonicalPath(), e.state().dbValue(), e.contentHash(),
                        e.documentType(), e.storedPath(), now);
                n++;
            }
            if (discrepancies.isEmpty()) {
                migrations.finishPlan(planId, PlanStatus.ROLLED_BACK.dbValue(), "rollback concluído", now);
            }
            return n;
        });

        if (!discrepancies.isEmpty()) {
            throw new RollbackIncompleteException(checkpoint.checkpointId(), discrepancies);
        }
        logger.info("Rollback do plano {}: {} ações desfeitas, {} já restauradas", planId, reversed.size() - already, already);
        return new RollbackResult(checkpoint.checkpointId(), reversed.size() - already, already, restored);
    }

    private static String expectedHash(MigrationAction a, Map<Long, Checkpoint.Entry> entries,
                                       Map<Long, FileRecord> current) {
        Checkpoint.Entry entry = entries.get(a.fileId());
        if (entry != null && entry.contentHash() != null) return entry.contentHash();
        if (a.expectedHash() != null) return a.expectedHash();
        FileRecord rec = current.get(a.fileId());
        return rec == null ? null : rec.contentHash();
    }

    private static boolean matchesCheckpoint(FileRecord rec, Checkpoint.Entry e) {
        return rec.state() == e.state()
                && Objects.equals(rec.canonicalPath(), e.canonicalPath())
                && Objects.equals(rec.storedPath(), e.storedPath());
    }

    /** Ação pendente cujo efeito já está em disco: origem vazia e destino com o conteúdo esperado. */
    private static boolean isStranded(MigrationAction a, String expectedHash) {
        Path source = Paths.get(a.sourcePath());
        Path target = Paths.get(a.targetPath());
        if (expectedHash == null || !Files.isRegularFile(target, LinkOption.NOFOLLOW_LINKS)) return false;
        if (a.actionType() != ActionType.COPY && Files.exists(source, LinkOption.NOFOLLOW_LINKS)) return false;
        try {
            String actual = a.actionType() == ActionType.ARCHIVE
                    ? archivedContentHash(target)
                    : ContentHasher.fullHash(target);
            return expectedHash.equals(actual);
        } catch (IOException e) {
            logger.warn("Não foi possível ler {} durante o rollback: {}", target, e.toString());
            return false;
        }
    }

    private static Reversal reverse(MigrationAction a, String expectedHash) throws IOException {
        Path source = Paths.get(a.sourcePath());
        Path target = Paths.get(a.targetPath());
        boolean atSource = Files.exists(source, LinkOption.NOFOLLOW_LINKS);
        boolean atTarget = Files.exists(target, LinkOption.NOFOLLOW_LINKS);

        switch (a.actionType()) {
            case MOVE, DELETE -> {
                if (!atTarget && atSource) {
                    requireContent(source, expectedHash);
                    return Reversal.ALREADY_RESTORED;
                }
                if (!atTarget) throw new IntegrityException("Arquivo não encontrado em " + target);
                if (atSource) throw new IntegrityException("Origem ocupada por outro arquivo: " + source);
                requireContent(target, expectedHash);
                Path parent = source.getParent();
                if (parent != null) Files.createDirectories(parent);
                moveFile(target, source);
                return Reversal.REVERSED;
            }
            case COPY -> {
                if (!atTarget) return Reversal.ALREADY_RESTORED;
                requireContent(target, expectedHash);
                Files.delete(target);
                return Reversal.REVERSED;
            }
            case ARCHIVE -> {
                if (atSource) {
                    requireContent(source, expectedHash);
                    if (atTarget) Files.delete(target);
                    return Reversal.ALREADY_RESTORED;
                }
                if (!atTarget) throw new IntegrityException("Arquivo compactado não encontrado em " + target);
                Path parent = source.getParent();
                if (parent != null) Files.createDirectories(parent);
                Path tmp = source.resolveSibling(source.getFileName() + ".restore.tmp");
                try {
                    try (InputStream in = Files.newInputStream(target);
                         ZstdInputStream zis = new ZstdInputStream(in);
                         OutputStream out = Files.newOutputStream(tmp)) {
                        zis.transferTo(out);
                    }
                    requireContent(tmp, expectedHash);
                    Files.move(tmp, source, StandardCopyOption.ATOMIC_MOVE);
                } catch (IOException | IntegrityException e) {
                    Files.deleteIfExists(tmp);
                    throw e;
                }
                Files.delete(target);
                return Reversal.REVERSED;
            }
            default -> throw new IllegalStateException("Tipo de ação desconhecido: " + a.actionType());
        }
    }

    private static void requireContent(Path file, String expectedHash) throws IOException {
        if (expectedHash == null) return;
        String actual = ContentHasher.fullHash(file);
        if (!expectedHash.equals(actual)) {
            throw new IntegrityException("Conteúdo alterado depois do checkpoint: " + file);
        }
    }

    // -----------------------------
    // Util
    // -----------------------------

    private List<MigrationAction> fetchActions(String planId) {
        return ctx.jdbi().withExtension(MigrationDao.class, dao -> dao.fetchActions(planId));
    }

    private void finishPlan(String planId, PlanStatus status, String message) {
        ctx.jdbi().useExtension(MigrationDao.class, dao -> dao.finishPlan(planId, status.dbValue(), message, ctx.nowMillis()));
    }

    private ExecutionResult result(String planId, PlanStatus status, Checkpoint checkpoint, boolean rolledBack,
                                   List<String> discrepancies) {
        List<MigrationAction> actions = fetchActions(planId);
        int ok = (int) actions.stream().filter(a -> a.outcome() == ActionOutcome.SUCCEEDED).count();
        int failed = (int) actions.stream().filter(a -> a.outcome() == ActionOutcome.FAILED).count();
        return new ExecutionResult(planId, status, checkpoint.checkpointId(), actions, ok, failed, rolledBack, discrepancies);
    }
}
