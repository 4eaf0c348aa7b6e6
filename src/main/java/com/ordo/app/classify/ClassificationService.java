package com.ordo.app.classify;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.ordo.app.AppContext;
import com.ordo.app.database.FileRecord;
import com.ordo.app.database.FileState;
import com.ordo.app.database.RegistryDao;

/**
 * Roda o classificador uma vez por registro pendente, sempre atrás de um timeout.
 * Falha ou timeout deixa o registro em {@code pending} para a próxima passada.
 */
public final class ClassificationService {

    private static final Logger logger = LoggerFactory.getLogger(ClassificationService.class);

    private final AppContext ctx;
    private final Classifier classifier;
    private final MetadataExtractor extractor;

    public ClassificationService(AppContext ctx, Classifier classifier, MetadataExtractor extractor) {
        this.ctx = ctx;
        this.classifier = classifier;
        this.extractor = extractor;
    }

    public record Report(int classified, int review, int failed, int timedOut) {
        public int attempted() {
            return classified + review + failed + timedOut;
        }
    }

    public Report classifyPending() {
        List<FileRecord> pending = ctx.jdbi().withExtension(RegistryDao.class,
                dao -> dao.fetchByStates(List.of(FileState.PENDING.dbValue())));
        Duration timeout = ctx.config().getClassifierTimeout();
        double reviewThreshold = ctx.config().getReviewThreshold();

        int classified = 0;
        int review = 0;
        int failed = 0;
        int timedOut = 0;

        ExecutorService executor = newExecutor();
        try {
            for (FileRecord r : pending) {
                if (Thread.currentThread().isInterrupted()) break;
                Path file = r.locationPath();

                Future<ClassificationResult> future = executor.submit(() -> classifier.classify(file));
                ClassificationResult result;
                try {
                    result = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
                } catch (TimeoutException e) {
                    future.cancel(true);
                    // a thread presa é abandonada; as próximas chamadas usam outra
                    executor.shutdownNow();
                    executor = newExecutor();
                    logger.warn("Classificador excedeu {} ms em {}", timeout.toMillis(), file);
                    timedOut++;
                    continue;
                } catch (ExecutionException e) {
                    logger.warn("Classificador falhou em {}: {}", file, String.valueOf(e.getCause()));
                    failed++;
                    continue;
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                }
                if (result == null) {
                    logger.warn("Classificador não devolveu resultado para {}", file);
                    failed++;
                    continue;
                }

                Map<String, String> metadata = extractMetadata(file);
                boolean low = result.confidence() < reviewThreshold;
                FileState state = low ? FileState.REVIEW : FileState.CLASSIFIED;
                long now = ctx.nowMillis();

                ctx.jdbi().useTransaction(handle -> {
                    RegistryDao dao = handle.attach(RegistryDao.class);
                    dao.applyClassification(r.fileId(), result.documentType(), result.confidence(),
                            result.method().dbValue(), state.dbValue(), low, now);
                    for (Map.Entry<String, String> e : metadata.entrySet()) {
                        dao.upsertMetadata(r.fileId(), e.getKey(), e.getValue());
                    }
                });

                if (low) review++;
                else classified++;
            }
        } finally {
            executor.shutdownNow();
        }

        logger.info("Classificação: {} classificados, {} em revisão, {} falhas, {} timeouts",
                classified, review, failed, timedOut);
        return new Report(classified, review, failed, timedOut);
    }

    private Map<String, String> extractMetadata(Path file) {
        try {
            Map<String, String> m = extractor.extract(file);
            return m == null ? Map.of() : m;
        } catch (IOException | RuntimeException e) {
            logger.warn("Extração de metadados falhou em {}: {}", file, e.toString());
            return Map.of();
        }
    }

    private static ExecutorService newExecutor() {
        return Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "ordo-classifier");
            t.setDaemon(true);
            return t;
        });
    }
}
