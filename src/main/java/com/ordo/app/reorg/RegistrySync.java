package com.ordo.app.reorg;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.ordo.app.AppContext;
import com.ordo.app.database.FileRecord;
import com.ordo.app.database.FileState;
import com.ordo.app.database.RegistryDao;
import com.ordo.app.exception.TransientIOException;
import com.ordo.app.hashing.ContentHasher;
import com.ordo.app.inventory.FileNames;

/**
 * Reconciliação explícita da raiz canônica com o registro: movimentos externos,
 * arquivos sumidos, reaparecidos e desconhecidos. Hash de tudo primeiro, depois
 * uma única transação.
 */
public final class RegistrySync {

    private static final Logger logger = LoggerFactory.getLogger(RegistrySync.class);

    private final AppContext ctx;

    public RegistrySync(AppContext ctx) {
        this.ctx = ctx;
    }

    private record Found(Path path, String fullHash, String quickHash, long size, long mtime) {}

    public SyncReport sync(Path canonicalRoot) {
        Path root = canonicalRoot.toAbsolutePath().normalize();
        if (!Files.isDirectory(root)) {
            logger.info("Raiz canônica ainda não existe: {}", root);
        }

        int[] errors = {0};
        // ordenado por caminho para escolhas determinísticas
        Map<String, Found> onDisk = new TreeMap<>();
        for (Path file : listFiles(root)) {
            try {
                BasicFileAttributes attrs = Files.readAttributes(file, BasicFileAttributes.class);
                String quick = ContentHasher.quickHash(file);
                String full = ContentHasher.quickHashCoversWholeFile(attrs.size()) ? quick : ContentHasher.fullHash(file);
                onDisk.put(FileNames.key(file), new Found(file, full, quick, attrs.size(), attrs.lastModifiedTime().toMillis()));
            } catch (IOException e) {
                logger.warn("Sincronização: arquivo ilegível {} ({})", file, e.toString());
                errors[0]++;
            }
        }

        long now = ctx.nowMillis();
        SyncReport report = ctx.jdbi().inTransaction(handle -> {
            RegistryDao dao = handle.attach(RegistryDao.class);
            List<FileRecord> active = dao.fetchActive();

            Set<String> claimed = new HashSet<>();
            Set<String> knownHashes = new HashSet<>();
            for (FileRecord r : active) {
                if (r.contentHash() != null) knownHashes.add(r.contentHash());
                if (r.state() != FileState.MISSING) {
                    String loc = FileNames.key(r.locationPath());
                    if (onDisk.containsKey(loc)) claimed.add(loc);
                }
            }

            Map<String, List<String>> unclaimedByHash = new LinkedHashMap<>();
            for (Map.Entry<String, Found> e : onDisk.entrySet()) {
                if (claimed.contains(e.getKey())) continue;
                unclaimedByHash.computeIfAbsent(e.getValue().fullHash(), k -> new ArrayList<>()).add(e.getKey());
            }

            int relocated = 0;
            int missing = 0;
            int rediscovered = 0;

            for (FileRecord r : active) {
                if (r.state() != FileState.ORGANIZED || r.canonicalPath() == null) continue;
                Path canonical = r.locationPath().toAbsolutePath().normalize();
                if (!canonical.startsWith(root)) continue;
                String key = FileNames.key(canonical);
                if (onDisk.containsKey(key)) continue;

                String found = take(unclaimedByHash, r.contentHash());
                if (found != null) {
                    dao.relocate(r.fileId(), found, now);
                    dao.insertHistory(r.fileId(), key, found, now, "movido fora do sistema", null, "EXTERNAL_MOVE");
                    claimed.add(found);
                    relocated++;
                } else {
                    dao.markMissing(r.fileId(), now);
                    missing++;
                }
            }

            for (FileRecord r : active) {
                if (r.state() != FileState.MISSING) continue;
                String found = take(unclaimedByHash, r.contentHash());
                if (found == null) continue;
                dao.rediscover(r.fileId(), found, now);
                dao.insertHistory(r.fileId(), r.lastKnownPath(), found, now, "reapareceu", null, "REDISCOVERED");
                claimed.add(found);
                rediscovered++;
            }

            int discovered = 0;
            int extra = 0;
            for (Map.Entry<String, List<String>> e : unclaimedByHash.entrySet()) {
                for (String path : e.getValue()) {
                    if (knownHashes.contains(e.getKey())) {
                        extra++;
                        continue;
                    }
                    Found f = onDisk.get(path);
                    String name = FileNames.name(f.path());
                    dao.insertDiscovered(f.fullHash(), f.quickHash(), path, name, FileNames.extension(name),
                            now, f.size(), f.mtime());
                    discovered++;
                }
            }

            return new SyncReport(onDisk.size(), relocated, missing, rediscovered, discovered, extra, errors[0]);
        });

        logger.info("Sincronização de {}: {} no disco, {} realocados, {} ausentes, {} reaparecidos, {} novos, {} cópias extras",
                root, report.filesOnDisk(), report.relocated(), report.missing(), report.rediscovered(),
                report.discovered(), report.extraCopies());
        return report;
    }

    private static String take(Map<String, List<String>> unclaimedByHash, String hash) {
        if (hash == null) return null;
        List<String> paths = unclaimedByHash.get(hash);
        if (paths == null || paths.isEmpty()) return null;
        return paths.remove(0);
    }

    private List<Path> listFiles(Path root) {
        if (!Files.isDirectory(root)) return List.of();
        Path quarantine = ctx.config().getQuarantineDir().toAbsolutePath().normalize();
        String dbName = FileNames.name(ctx.config().getDbFilePath());
        try (Stream<Path> s = Files.walk(root)) {
            return s.filter(Files::isRegularFile)
                    .map(p -> p.toAbsolutePath().normalize())
                    .filter(p -> !p.startsWith(quarantine))
                    .filter(p -> !FileNames.name(p).startsWith(dbName))
                    .sorted()
                    .toList();
        } catch (IOException | UncheckedIOException e) {
            throw new TransientIOException("Falha ao listar " + root, e);
        }
    }
}
