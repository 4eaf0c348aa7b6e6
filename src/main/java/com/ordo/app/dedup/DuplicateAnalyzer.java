package com.ordo.app.dedup;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.ordo.app.AppContext;
import com.ordo.app.config.Config;
import com.ordo.app.database.FileRecord;
import com.ordo.app.database.FileState;
import com.ordo.app.database.RegistryDao;
import com.ordo.app.hashing.ContentHasher;

/**
 * Pipeline de duplicatas: (tamanho, extensão) → hash rápido → hash completo → nome aproximado.
 * Cada estágio só vê o que o anterior deixou passar. Lê o registro sem escrever até o fim;
 * grupos, marcas, hashes calculados e erros entram juntos em uma única transação.
 */
public final class DuplicateAnalyzer {

    private static final Logger logger = LoggerFactory.getLogger(DuplicateAnalyzer.class);

    public record Options(
            long minFileSize,
            boolean fuzzyEnabled,
            double fuzzyThreshold,
            boolean fuzzySameFolderOnly,
            int maxFuzzyBucket,
            List<String> preferredPaths,
            boolean useAccessTime
    ) {
        public Options {
            preferredPaths = preferredPaths == null ? List.of() : List.copyOf(preferredPaths);
        }

        public static Options from(Config config) {
            return new Options(config.getMinDuplicateSize(), config.isFuzzyEnabled(), config.getFuzzyThreshold(),
                    config.isFuzzySameFolderOnly(), 1000, config.getPreferredPaths(), config.isUseAccessTime());
        }
    }

    private final AppContext ctx;

    public DuplicateAnalyzer(AppContext ctx) {
        this.ctx = ctx;
    }

    public AnalysisResult analyze() {
        return analyze(Options.from(ctx.config()));
    }

    public AnalysisResult analyze(Options opts) {
        List<FileRecord> active = ctx.jdbi().withExtension(RegistryDao.class, RegistryDao::fetchActive);
        List<FileRecord> eligible = active.stream()
                .filter(r -> r.state() != FileState.MISSING && r.state() != FileState.ERROR)
                .filter(r -> r.storedPath() == null)
                .filter(r -> r.sizeBytes() >= opts.minFileSize())
                .sorted(Comparator.comparingLong(FileRecord::fileId))
                .toList();

        HashUpdates updates = new HashUpdates();

        // 1. pré-filtro
        List<List<FileRecord>> stage1 = survivors(eligible, r -> r.sizeBytes() + "|" + r.extension());
        int prefilterCandidates = count(stage1);

        // 2. hash rápido
        List<List<FileRecord>> stage2 = new ArrayList<>();
        for (List<FileRecord> bucket : stage1) {
            List<FileRecord> hashed = new ArrayList<>();
            for (FileRecord r : bucket) {
                String quick = r.quickHash();
                if (quick == null) {
                    quick = updates.computeQuick(r);
                    if (quick == null) continue;
                }
                hashed.add(r);
            }
            stage2.addAll(survivors(hashed, r -> updates.quickOf(r)));
        }
        int quickHashCandidates = count(stage2);

        // 3. hash completo
        List<List<FileRecord>> stage3 = new ArrayList<>();
        for (List<FileRecord> bucket : stage2) {
            List<FileRecord> hashed = new ArrayList<>();
            for (FileRecord r : bucket) {
                if (updates.fullOf(r) == null && updates.computeFull(r) == null) continue;
                hashed.add(r);
            }
            stage3.addAll(survivors(hashed, r -> updates.fullOf(r)));
        }

        CanonicalSelector selector = new CanonicalSelector(opts.preferredPaths(), opts.useAccessTime());
        List<DuplicateGroup> groups = new ArrayList<>();
        Set<Long> grouped = new HashSet<>();
        for (List<FileRecord> members : stage3) {
            CanonicalSelector.Selection sel = selector.select(members);
            List<Long> ids = members.stream().map(FileRecord::fileId).sorted().toList();
            groups.add(new DuplicateGroup(0L, sel.winner().fileId(), ids, DetectionMethod.FULL_HASH_VERIFIED,
                    updates.fullOf(sel.winner()), sel.winner().sizeBytes(), sel.scores()));
            grouped.addAll(ids);
        }

        // 4. nome aproximado, só fora dos grupos confirmados
        List<NearDuplicate> suggestions = opts.fuzzyEnabled()
                ? fuzzy(eligible, grouped, updates.failed, opts)
                : List.of();

        List<DuplicateGroup> persisted = persist(groups, suggestions, updates);

        int duplicateFiles = persisted.stream().mapToInt(g -> g.memberFileIds().size() - 1).sum();
        long wasted = persisted.stream().mapToLong(DuplicateGroup::wastedBytes).sum();
        logger.info("Análise: {} grupos, {} duplicatas, {} bytes recuperáveis, {} sugestões, {} erros",
                persisted.size(), duplicateFiles, wasted, suggestions.size(), updates.errors.size());

        return new AnalysisResult(persisted, suggestions, duplicateFiles, wasted,
                prefilterCandidates, quickHashCandidates, updates.errors.size());
    }

    private List<NearDuplicate> fuzzy(List<FileRecord> eligible, Set<Long> grouped, Set<Long> failed, Options opts) {
        Map<String, List<FileRecord>> buckets = new LinkedHashMap<>();
        for (FileRecord r : eligible) {
            if (grouped.contains(r.fileId()) || failed.contains(r.fileId())) continue;
            String key = r.extension();
            if (opts.fuzzySameFolderOnly()) {
                Path parent = r.locationPath().toAbsolutePath().normalize().getParent();
                key = key + "|" + parent;
            }
            buckets.computeIfAbsent(key, k -> new ArrayList<>()).add(r);
        }

        List<NearDuplicate> out = new ArrayList<>();
        for (Map.Entry<String, List<FileRecord>> e : buckets.entrySet()) {
            List<FileRecord> bucket = e.getValue();
            if (bucket.size() < 2) continue;
            if (bucket.size() > opts.maxFuzzyBucket()) {
                logger.warn("Comparação aproximada ignorada para '{}': {} arquivos", e.getKey(), bucket.size());
                continue;
            }
            List<String> names = bucket.stream()
                    .map(r -> FilenameNormalizer.normalize(r.locationPath().getFileName().toString()))
                    .toList();
            for (int i = 0; i < bucket.size(); i++) {
                if (names.get(i).isEmpty()) continue;
                for (int j = i + 1; j < bucket.size(); j++) {
                    if (names.get(j).isEmpty()) continue;
                    double sim = FilenameNormalizer.similarity(names.get(i), names.get(j));
                    if (sim >= opts.fuzzyThreshold()) {
                        out.add(new NearDuplicate(bucket.get(i).fileId(), bucket.get(j).fileId(), sim, names.get(i)));
                    }
                }
            }
        }
        return out;
    }

    private List<DuplicateGroup> persist(List<DuplicateGroup> groups, List<NearDuplicate> suggestions,
                                         HashUpdates updates) {
        long now = ctx.nowMillis();
        return ctx.jdbi().inTransaction(handle -> {
            RegistryDao dao = handle.attach(RegistryDao.class);

            if (!updates.quick.isEmpty()) {
                dao.updateQuickHashes(new ArrayList<>(updates.quick.keySet()), new ArrayList<>(updates.quick.values()), now);
            }
            if (!updates.full.isEmpty()) {
                dao.updateContentHashes(new ArrayList<>(updates.full.keySet()), new ArrayList<>(updates.full.values()), now);
            }
            for (Map.Entry<Long, String> err : updates.errors.entrySet()) {
                dao.markError(err.getKey(), err.getValue(), now);
            }

            dao.deleteDuplicateMembers();
            dao.deleteDuplicateGroups();
            dao.deleteOpenNearDuplicates();
            dao.resetDuplicateFlags(now);

            List<DuplicateGroup> saved = new ArrayList<>(groups.size());
            for (DuplicateGroup g : groups) {
                long groupId = dao.insertGroup(g.canonicalFileId(), g.detectionMethod().dbValue(), g.contentHash(),
                        g.sizeBytes(), g.memberFileIds().size(), g.wastedBytes(), now);
                for (long member : g.memberFileIds()) {
                    boolean canonical = member == g.canonicalFileId();
                    dao.insertMember(groupId, member, g.scores().getOrDefault(member, 0.0), canonical);
                    if (!canonical) dao.markDuplicate(member, g.canonicalFileId(), now);
                }
                saved.add(g.withGroupId(groupId));
            }
            dao.repointStoredDuplicates(now);

            for (NearDuplicate n : suggestions) {
                dao.insertNearDuplicate(n.fileIdA(), n.fileIdB(), n.similarity(), n.normalizedName(), now);
            }
            return saved;
        });
    }

    /** Agrupa preservando a ordem de file_id e descarta grupos unitários. */
    private static List<List<FileRecord>> survivors(List<FileRecord> records, Function<FileRecord, String> key) {
        Map<String, List<FileRecord>> buckets = new LinkedHashMap<>();
        for (FileRecord r : records) {
            buckets.computeIfAbsent(key.apply(r), k -> new ArrayList<>()).add(r);
        }
        List<List<FileRecord>> out = new ArrayList<>();
        for (List<FileRecord> b : buckets.values()) {
            if (b.size() > 1) out.add(b);
        }
        return out;
    }

    private static int count(List<List<FileRecord>> buckets) {
        int n = 0;
        for (List<FileRecord> b : buckets) n += b.size();
        return n;
    }

    /**
     * Hashes calculados e falhas desta rodada, mantidos em memória até a gravação final.
     */
    private static final class HashUpdates {
        final Map<Long, String> quick = new LinkedHashMap<>();
        final Map<Long, String> full = new LinkedHashMap<>();
        final Map<Long, String> errors = new LinkedHashMap<>();
        final Set<Long> failed = new HashSet<>();

        String quickOf(FileRecord r) {
            return r.quickHash() != null ? r.quickHash() : quick.get(r.fileId());
        }

        String fullOf(FileRecord r) {
            if (r.contentHash() != null) return r.contentHash();
            return full.get(r.fileId());
        }

        String computeQuick(FileRecord r) {
            try {
                String h = ContentHasher.quickHash(r.locationPath());
                quick.put(r.fileId(), h);
                if (ContentHasher.quickHashCoversWholeFile(r.sizeBytes()) && r.contentHash() == null) {
                    full.put(r.fileId(), h);
                }
                return h;
            } catch (IOException | RuntimeException e) {
                fail(r, e);
                return null;
            }
        }

        String computeFull(FileRecord r) {
            String quickHash = quickOf(r);
            if (quickHash != null && ContentHasher.quickHashCoversWholeFile(r.sizeBytes())) {
                full.put(r.fileId(), quickHash);
                return quickHash;
            }
            try {
                String h = ContentHasher.fullHash(r.locationPath());
                full.put(r.fileId(), h);
                return h;
            } catch (IOException | RuntimeException e) {
                fail(r, e);
                return null;
            }
        }

        private void fail(FileRecord r, Exception e) {
            failed.add(r.fileId());
            if (r.state() == FileState.ORGANIZED) {
                // posição canônica fica a cargo da sincronização
                logger.warn("Arquivo organizado ilegível na análise: {} ({})", r.location(), e.toString());
                return;
            }
            logger.warn("Falha ao calcular hash de {}: {}", r.location(), e.toString());
            errors.put(r.fileId(), e.toString());
        }
    }
}
