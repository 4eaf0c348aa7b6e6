package com.ordo.app.inventory;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitOption;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.Paths;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.ordo.app.AppContext;
import com.ordo.app.database.FileRecord;
import com.ordo.app.database.FileState;
import com.ordo.app.database.RegistryDao;
import com.ordo.app.exception.TransientIOException;
import com.ordo.app.hashing.ContentHasher;

/**
 * Percorre raízes, calcula o hash rápido de cada arquivo em um pool fixo e grava no
 * registro por um único escritor em lotes transacionais.
 */
public final class Scanner {

    private static final Logger logger = LoggerFactory.getLogger(Scanner.class);

    private static final Set<String> FAST_EXCLUDED_DIRS = Set.of(
            ".ordo", ".git", "node_modules", "$Recycle.Bin", "System Volume Information");

    private final AppContext ctx;

    public Scanner(AppContext ctx) {
        this.ctx = ctx;
    }

    public record ScanResult(long scanId, boolean canceled, long filesSeen, long newRecords,
                             long unchanged, long superseded, long errors) {}

    /** Resultado de um worker: o arquivo como foi visto no disco. */
    record ScannedFile(
            Path path,
            long size,
            long mtime,
            Long atime,
            String quickHash,
            String contentHash,
            String error
    ) {
        boolean failed() {
            return error != null;
        }
    }

    public ScanResult scan(List<Path> roots, ScanConfig cfg, ScanMetrics metrics, AtomicBoolean cancel) {
        List<Path> absRoots = roots.stream().map(p -> p.toAbsolutePath().normalize()).toList();
        String rootsText = absRoots.stream().map(Path::toString).collect(Collectors.joining(";"));

        metrics.start = Instant.now();
        metrics.running.set(true);

        long scanId = ctx.jdbi().withExtension(RegistryDao.class,
                dao -> dao.startScanLog(rootsText, ctx.nowMillis()));
        logger.info("Scan {} iniciado em {}", scanId, rootsText);

        List<Path> skipDirs = List.of(ctx.config().getQuarantineDir().toAbsolutePath().normalize());
        String dbName = FileNames.name(ctx.config().getDbFilePath());

        ExecutorService pool = Executors.newFixedThreadPool(cfg.threads(), namedFactory("ordo-scan"));
        Semaphore inFlight = new Semaphore(cfg.threads() * 64);

        try (var writer = new RegistryWriter(cfg.dbBatchSize(), metrics, cancel)) {
            try {
                for (Path root : absRoots) {
                    if (cancel.get()) break;
                    if (!Files.isDirectory(root)) {
                        logger.warn("Raiz ignorada (não é diretório): {}", root);
                        metrics.errors.increment();
                        continue;
                    }
                    walk(root, cfg, skipDirs, dbName, metrics, cancel, path -> submit(pool, inFlight, path, cancel, metrics, writer));
                }
            } finally {
                pool.shutdown();
                awaitPool(pool, cancel);
            }
        } catch (RuntimeException e) {
            cancel.set(true);
            logger.error("Scan {} abortado por erro interno", scanId, e);
            finishLog(scanId, "CANCELED", metrics);
            metrics.running.set(false);
            throw e;
        }

        boolean canceled = cancel.get() || Thread.currentThread().isInterrupted();
        finishLog(scanId, canceled ? "CANCELED" : "DONE", metrics);
        metrics.running.set(false);

        if (canceled) {
            logger.info("Scan {} cancelado; {}", scanId, metrics);
        } else {
            logger.info("Scan {} concluído; {}", scanId, metrics);
        }
        return new ScanResult(scanId, canceled, metrics.filesSeen.sum(), metrics.newRecords.sum(),
                metrics.unchanged.sum(), metrics.superseded.sum(), metrics.errors.sum());
    }

    private void finishLog(long scanId, String status, ScanMetrics metrics) {
        try {
            ctx.jdbi().useExtension(RegistryDao.class, dao -> dao.finishScanLog(
                    scanId, ctx.nowMillis(), status, metrics.filesSeen.sum(), metrics.errors.sum()));
        } catch (RuntimeException e) {
            logger.error("Falha ao fechar log do scan {}", scanId, e);
        }
    }

    // -----------------------------
    // Walk
    // -----------------------------

    interface FileSink {
        void accept(Path file);
    }

    private static void walk(Path root, ScanConfig cfg, List<Path> skipDirs, String dbName, ScanMetrics metrics,
                             AtomicBoolean cancel, FileSink sink) {
        final var matchers = compileMatchers(cfg.excludeGlobs());
        Set<FileVisitOption> options = cfg.followSymlinks()
                ? EnumSet.of(FileVisitOption.FOLLOW_LINKS)
                : EnumSet.noneOf(FileVisitOption.class);

        try {
            Files.walkFileTree(root, options, Integer.MAX_VALUE, new SimpleFileVisitor<>() {

                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    if (cancel.get() || Thread.currentThread().isInterrupted()) return FileVisitResult.TERMINATE;
                    if (dir.equals(root)) return FileVisitResult.CONTINUE;

                    Path dirAbs = dir.normalize();
                    for (Path skip : skipDirs) {
                        if (dirAbs.startsWith(skip)) {
                            metrics.dirsSkipped.increment();
                            return FileVisitResult.SKIP_SUBTREE;
                        }
                    }

                    Path rel = root.relativize(dir);
                    if (isExcluded(rel, matchers)) {
                        metrics.dirsSkipped.increment();
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (cancel.get() || Thread.currentThread().isInterrupted()) return FileVisitResult.TERMINATE;
                    if (!attrs.isRegularFile()) return FileVisitResult.CONTINUE;

                    // o próprio registro (e seus -wal/-shm) nunca entra no inventário
                    if (file.getFileName().toString().startsWith(dbName)) return FileVisitResult.CONTINUE;

                    Path rel = root.relativize(file);
                    if (isExcluded(rel, matchers)) return FileVisitResult.CONTINUE;

                    metrics.filesSeen.increment();
                    sink.accept(file);
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) {
                    if (cancel.get()) return FileVisitResult.TERMINATE;
                    if (Files.isDirectory(file, LinkOption.NOFOLLOW_LINKS)) {
                        logger.warn("Diretório ilegível ignorado: {} ({})", file, exc.toString());
                        metrics.errors.increment();
                    } else {
                        metrics.filesSeen.increment();
                        sink.accept(file);
                    }
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            throw new TransientIOException("Falha ao percorrer " + root, e);
        }
    }

    static boolean isExcluded(Path rel, List<PathMatcher> matchers) {
        for (Path segment : rel) {
            if (FAST_EXCLUDED_DIRS.contains(segment.toString())) return true;
        }
        if (matchers.isEmpty()) return false;

        String rn = rel.toString().replace('\\', '/');
        Path relForMatcher = Paths.get(rn.replace('/', java.io.File.separatorChar));
        for (var m : matchers) {
            if (m.matches(relForMatcher)) return true;
            for (Path segment : rel) {
                if (m.matches(segment)) return true;
            }
        }
        return false;
    }

    static List<PathMatcher> compileMatchers(List<String> globs) {
        var fs = FileSystems.getDefault();
        var out = new ArrayList<PathMatcher>(globs == null ? 0 : globs.size());
        if (globs == null) return out;
        for (String g : globs) {
            if (g == null || g.isBlank()) continue;
            out.add(fs.getPathMatcher("glob:" + g));
        }
        return out;
    }

    // -----------------------------
    // Hash workers
    // -----------------------------

    private static void submit(ExecutorService pool, Semaphore inFlight, Path file, AtomicBoolean cancel,
                               ScanMetrics metrics, RegistryWriter writer) {
        try {
            inFlight.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancel.set(true);
            return;
        }
        try {
            pool.execute(() -> {
                try {
                    if (cancel.get()) return;
                    ScannedFile seen = inspect(file);
                    if (!seen.failed()) metrics.filesHashed.increment();
                    writer.add(seen);
                } finally {
                    inFlight.release();
                }
            });
        } catch (RuntimeException e) {
            inFlight.release();
            throw e;
        }
    }

    static ScannedFile inspect(Path file) {
        Path abs = file.toAbsolutePath().normalize();
        long size = 0L;
        long mtime = 0L;
        try {
            BasicFileAttributes attrs = Files.readAttributes(abs, BasicFileAttributes.class);
            size = attrs.size();
            mtime = attrs.lastModifiedTime().toMillis();
            Long atime = attrs.lastAccessTime() == null ? null : attrs.lastAccessTime().toMillis();

            String quick = ContentHasher.quickHash(abs);
            String full = ContentHasher.quickHashCoversWholeFile(size) ? quick : null;
            return new ScannedFile(abs, size, mtime, atime, quick, full, null);
        } catch (IOException | SecurityException e) {
            logger.warn("Arquivo ilegível: {} ({})", abs, e.toString());
            return new ScannedFile(abs, size, mtime, null, null, null, e.toString());
        }
    }

    private static void awaitPool(ExecutorService pool, AtomicBoolean cancel) {
        try {
            while (!pool.awaitTermination(200, TimeUnit.MILLISECONDS)) {
                if (Thread.currentThread().isInterrupted()) {
                    cancel.set(true);
                    pool.shutdownNow();
                }
            }
        } catch (InterruptedException e) {
            cancel.set(true);
            pool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static ThreadFactory namedFactory(String prefix) {
        AtomicInteger n = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    // -----------------------------
    // RegistryWriter (fila + lotes)
    // -----------------------------

    private final class RegistryWriter implements AutoCloseable {
        private final ScannedFile poison = new ScannedFile(Paths.get(""), -1L, 0L, null, null, null, null);

        private final int batchSize;
        private final ScanMetrics metrics;
        private final AtomicBoolean cancel;
        private final BlockingQueue<ScannedFile> queue;
        private final Thread worker;

        private volatile Exception workerError;

        RegistryWriter(int batchSize, ScanMetrics metrics, AtomicBoolean cancel) {
            this.batchSize = batchSize;
            this.metrics = metrics;
            this.cancel = cancel;
            this.queue = new ArrayBlockingQueue<>(Math.max(1_000, batchSize * 4));
            this.worker = new Thread(this::run, "ordo-registry-writer");
            this.worker.setDaemon(true);
            this.worker.start();
        }

        /**
         * Chamado pelos workers. Mesmo com cancelamento o que já foi hasheado entra no registro.
         */
        void add(ScannedFile f) {
            if (workerError != null || !worker.isAlive()) {
                cancel.set(true);
                throw new IllegalStateException("RegistryWriter falhou; abortando scan", workerError);
            }
            while (true) {
                try {
                    if (queue.offer(f, 200, TimeUnit.MILLISECONDS)) return;
                    if (workerError != null || !worker.isAlive()) {
                        cancel.set(true);
                        throw new IllegalStateException("RegistryWriter falhou durante offer()", workerError);
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    cancel.set(true);
                    return;
                }
            }
        }

        @Override
        public void close() {
            try {
                queue.put(poison);
                worker.join();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            if (workerError != null) {
                throw new IllegalStateException("RegistryWriter failed", workerError);
            }
        }

        private void run() {
            List<ScannedFile> batch = new ArrayList<>(batchSize);
            try {
                while (true) {
                    ScannedFile f = queue.poll(200, TimeUnit.MILLISECONDS);
                    if (f == null) {
                        if (!batch.isEmpty()) commit(batch);
                        continue;
                    }
                    if (f == poison) break;
                    batch.add(f);
                    if (batch.size() >= batchSize) commit(batch);
                }
                if (!batch.isEmpty()) commit(batch);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                workerError = e;
            } catch (Exception e) {
                logger.error("RegistryWriter falhou", e);
                workerError = e;
            }
        }

        private void commit(List<ScannedFile> batch) {
            long now = ctx.nowMillis();
            ctx.jdbi().useTransaction(handle -> {
                RegistryDao dao = handle.attach(RegistryDao.class);
                for (ScannedFile f : batch) {
                    upsert(dao, f, now);
                }
            });
            metrics.dbBatches.increment();
            batch.clear();
        }

        private void upsert(RegistryDao dao, ScannedFile f, long now) {
            String path = f.path().toString();
            String name = FileNames.name(f.path());
            String ext = FileNames.extension(name);
            List<FileRecord> existing = dao.findActiveByPath(path);

            if (f.failed()) {
                metrics.errors.increment();
                boolean known = existing.stream()
                        .anyMatch(r -> r.state() == FileState.ERROR && path.equals(r.originalPath()));
                if (!known) {
                    dao.insertError(path, name, ext, now, f.size(), f.mtime(), f.error());
                }
                return;
            }

            Optional<FileRecord> same = existing.stream()
                    .filter(r -> r.sizeBytes() == f.size() && f.quickHash().equals(r.quickHash()))
                    .findFirst();
            if (same.isPresent()) {
                metrics.unchanged.increment();
                return;
            }

            for (FileRecord old : existing) {
                if (path.equals(old.location())) {
                    dao.markSuperseded(old.fileId(), now);
                    metrics.superseded.increment();
                }
            }
            dao.insertPending(f.contentHash(), f.quickHash(), path, name, ext, now, f.size(), f.mtime(), f.atime());
            metrics.newRecords.increment();
        }
    }
}
