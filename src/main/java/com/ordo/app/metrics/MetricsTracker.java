package com.ordo.app.metrics;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ordo.app.AppContext;
import com.ordo.app.database.RegistryDao;

/**
 * Estatísticas derivadas do registro e do log de correções. Só leitura, exceto
 * {@link #saveSnapshot()}.
 */
public final class MetricsTracker {

    private static final Logger logger = LoggerFactory.getLogger(MetricsTracker.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final AppContext ctx;

    public MetricsTracker(AppContext ctx) {
        this.ctx = ctx;
    }

    /** Acurácia = (classificados - correções) / classificados; 0 sem classificações. */
    public record Accuracy(long totalClassified, long totalCorrections, double accuracy,
                           Map<String, Long> byMethod, Map<String, Long> commonErrors) {}

    /** Estabilidade = fração dos organizados movidos no máximo uma vez; 1 sem organizados. */
    public record Stability(long totalOrganized, double averageMoves, long movedMoreThanOnce, double stability) {}

    public record Deduplication(long totalFiles, long duplicateFiles, long uniqueFiles, double deduplicationRate,
                                long wastedBytes, int groups) {}

    public record ReviewBacklog(long requiringReview, long openNearDuplicates) {}

    public record Snapshot(long takenMillis, Accuracy classification, Stability stability,
                           Deduplication deduplication, ReviewBacklog review) {}

    public Accuracy accuracy() {
        return ctx.jdbi().withExtension(RegistryDao.class, dao -> {
            long classified = dao.countClassified();
            long corrections = dao.countCorrections();
            double accuracy = classified > 0 ? Math.max(0.0, (double) (classified - corrections) / classified) : 0.0;
            return new Accuracy(classified, corrections, accuracy,
                    toMap(dao.countByMethod()), toMap(dao.mostCommonErrors(10)));
        });
    }

    public Stability stability() {
        return ctx.jdbi().withExtension(RegistryDao.class, dao -> {
            long organized = dao.countOrganized();
            long multi = dao.countOrganizedMovedMoreThanOnce();
            double stability = organized > 0 ? (double) (organized - multi) / organized : 1.0;
            return new Stability(organized, dao.averageMovesOrganized(), multi, stability);
        });
    }

    public Deduplication deduplication() {
        return ctx.jdbi().withExtension(RegistryDao.class, dao -> {
            long total = dao.countActive();
            long duplicates = dao.countDuplicates();
            double rate = total > 0 ? (double) duplicates / total : 0.0;
            return new Deduplication(total, duplicates, total - duplicates, rate,
                    dao.sumDuplicateBytes(), dao.fetchGroups().size());
        });
    }

    public ReviewBacklog reviewBacklog() {
        return ctx.jdbi().withExtension(RegistryDao.class,
                dao -> new ReviewBacklog(dao.countRequiringReview(), dao.countOpenNearDuplicates()));
    }

    public Snapshot snapshot() {
        return new Snapshot(ctx.nowMillis(), accuracy(), stability(), deduplication(), reviewBacklog());
    }

    /**
     * Grava uma linha por tipo de métrica, com o valor principal e o detalhe em JSON.
     */
    public Snapshot saveSnapshot() {
        Snapshot s = snapshot();
        Map<String, Object[]> rows = new LinkedHashMap<>();
        rows.put("classification", new Object[] {s.classification().accuracy(), s.classification()});
        rows.put("stability", new Object[] {s.stability().stability(), s.stability()});
        rows.put("deduplication", new Object[] {s.deduplication().deduplicationRate(), s.deduplication()});
        rows.put("review", new Object[] {(double) s.review().requiringReview(), s.review()});

        Map<String, String> json = new LinkedHashMap<>();
        for (Map.Entry<String, Object[]> e : rows.entrySet()) {
            json.put(e.getKey(), toJson(e.getValue()[1]));
        }

        ctx.jdbi().useTransaction(handle -> {
            RegistryDao dao = handle.attach(RegistryDao.class);
            for (Map.Entry<String, Object[]> e : rows.entrySet()) {
                dao.insertMetricsSnapshot(s.takenMillis(), e.getKey(), (Double) e.getValue()[0], json.get(e.getKey()));
            }
        });
        logger.info("Snapshot de métricas salvo: acurácia={}, estabilidade={}, duplicação={}",
                s.classification().accuracy(), s.stability().stability(), s.deduplication().deduplicationRate());
        return s;
    }

    private static String toJson(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Falha ao serializar métricas", e);
        }
    }

    private static Map<String, Long> toMap(List<RegistryDao.CountRow> rows) {
        Map<String, Long> out = new LinkedHashMap<>();
        for (RegistryDao.CountRow r : rows) {
            out.put(r.label() == null ? "(nenhum)" : r.label(), r.total());
        }
        return out;
    }
}
