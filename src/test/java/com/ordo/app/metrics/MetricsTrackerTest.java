package com.ordo.app.metrics;

import java.nio.file.Path;
import java.util.Map;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.ordo.app.AppContext;
import com.ordo.app.Fixtures;
import com.ordo.app.classify.CorrectionService;
import com.ordo.app.database.FileRecord;
import com.ordo.app.database.RegistryDao;
import com.ordo.app.dedup.DuplicateAnalyzer;
import com.ordo.app.migration.MigrationExecutor;
import com.ordo.app.migration.MigrationPlanner;
import com.ordo.app.migration.PlanOptions;
import com.ordo.app.migration.StructureConfig;

import static org.junit.jupiter.api.Assertions.*;

public class MetricsTrackerTest {

    @TempDir
    Path tmp;

    private AppContext ctx;
    private MetricsTracker tracker;

    @BeforeEach
    void setUp() {
        ctx = AppContext.open(Fixtures.config(tmp));
        tracker = new MetricsTracker(ctx);
    }

    @AfterEach
    void tearDown() {
        ctx.close();
    }

    @Test
    void emptyRegistryHasNeutralValues() {
        MetricsTracker.Snapshot s = tracker.snapshot();

        assertEquals(0, s.classification().totalClassified());
        assertEquals(0.0, s.classification().accuracy());
        assertEquals(0, s.stability().totalOrganized());
        assertEquals(1.0, s.stability().stability());
        assertEquals(0.0, s.stability().averageMoves());
        assertEquals(0.0, s.deduplication().deduplicationRate());
        assertEquals(0, s.review().requiringReview());
    }

    @Test
    void correctionsLowerAccuracy() throws Exception {
        Fixtures.write(tmp.resolve("in/a.txt"), "alpha");
        Fixtures.write(tmp.resolve("in/b.txt"), "beta");
        Fixtures.scan(ctx, tmp.resolve("in"));
        long a = Fixtures.byName(ctx, "a.txt").fileId();
        long b = Fixtures.byName(ctx, "b.txt").fileId();
        Fixtures.classify(ctx, a, "document_text");
        Fixtures.classify(ctx, b, "document_text");

        new CorrectionService(ctx).correct(b, "financial_invoice", "é uma fatura");

        MetricsTracker.Accuracy acc = tracker.accuracy();
        assertEquals(2, acc.totalClassified());
        assertEquals(1, acc.totalCorrections());
        assertEquals(0.5, acc.accuracy(), 1e-9);
        assertEquals(Map.of("manual", 1L, "pattern", 1L), acc.byMethod());
        assertEquals(Map.of("document_text", 1L), acc.commonErrors());
    }

    @Test
    void stabilityDropsWhenFilesMoveTwice() throws Exception {
        Fixtures.write(tmp.resolve("in/a.txt"), "alpha");
        Fixtures.write(tmp.resolve("in/b.txt"), "beta");
        Fixtures.scan(ctx, tmp.resolve("in"));
        for (FileRecord r : Fixtures.active(ctx)) {
            Fixtures.classify(ctx, r.fileId(), "document_text");
        }
        organize(StructureConfig.builder().defaultTemplate("First/{filename}").build());

        assertEquals(1.0, tracker.stability().stability(), 1e-9);
        assertEquals(1.0, tracker.stability().averageMoves(), 1e-9);

        Path root = ctx.config().getCanonicalRoot();
        MigrationPlanner planner = new MigrationPlanner(ctx);
        var plan = planner.approve(planner.createPlan(
                StructureConfig.builder().type("document_text", "Second/{filename}").build(),
                PlanOptions.reorganize(ctx.config(), root)));
        new MigrationExecutor(ctx).execute(plan);

        MetricsTracker.Stability st = tracker.stability();
        assertEquals(2, st.totalOrganized());
        assertEquals(2, st.movedMoreThanOnce());
        assertEquals(0.0, st.stability(), 1e-9);
        assertEquals(2.0, st.averageMoves(), 1e-9);
    }

    @Test
    void deduplicationRateCountsNonCanonicalCopies() throws Exception {
        Fixtures.write(tmp.resolve("in/a.txt"), "same bytes");
        Fixtures.write(tmp.resolve("in/copy/a.txt"), "same bytes");
        Fixtures.write(tmp.resolve("in/b.txt"), "different");
        Fixtures.write(tmp.resolve("in/c.txt"), "unrelated");
        Fixtures.scan(ctx, tmp.resolve("in"));
        new DuplicateAnalyzer(ctx).analyze();

        MetricsTracker.Deduplication d = tracker.deduplication();

        assertEquals(4, d.totalFiles());
        assertEquals(1, d.duplicateFiles());
        assertEquals(3, d.uniqueFiles());
        assertEquals(0.25, d.deduplicationRate(), 1e-9);
        assertEquals(10, d.wastedBytes());
        assertEquals(1, d.groups());
    }

    @Test
    void savedSnapshotWritesOneRowPerMetric() {
        tracker.saveSnapshot();
        tracker.saveSnapshot();

        ctx.jdbi().useExtension(RegistryDao.class, dao -> {
            assertEquals(2, dao.countSnapshots("classification"));
            assertEquals(2, dao.countSnapshots("stability"));
            assertEquals(2, dao.countSnapshots("deduplication"));
            assertEquals(2, dao.countSnapshots("review"));
        });
    }

    private void organize(StructureConfig layout) {
        MigrationPlanner planner = new MigrationPlanner(ctx);
        new MigrationExecutor(ctx).execute(planner.approve(planner.createPlan(layout, PlanOptions.initial(ctx.config()))));
    }
}
