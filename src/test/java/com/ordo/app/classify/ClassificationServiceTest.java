package com.ordo.app.classify;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.LockSupport;
import java.util.stream.Collectors;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.ordo.app.AppContext;
import com.ordo.app.Fixtures;
import com.ordo.app.database.ClassificationMethod;
import com.ordo.app.database.FileRecord;
import com.ordo.app.database.FileState;
import com.ordo.app.database.RegistryDao;

import static org.junit.jupiter.api.Assertions.*;

public class ClassificationServiceTest {

    @TempDir
    Path tmp;

    private AppContext ctx;

    @AfterEach
    void tearDown() {
        if (ctx != null) ctx.close();
    }

    @Test
    void confidentResultsAreClassifiedWithMetadata() throws Exception {
        ctx = AppContext.open(Fixtures.config(tmp));
        Fixtures.write(tmp.resolve("inbox/acme_2024-02-10.pdf"), "invoice body");
        Fixtures.scan(ctx, tmp.resolve("inbox"));

        ClassificationService.Report report = new ClassificationService(ctx,
                file -> new ClassificationResult("financial_invoice", 0.92, ClassificationMethod.PATTERN),
                new FilenameMetadataExtractor()).classifyPending();

        assertEquals(1, report.classified());
        FileRecord r = Fixtures.byName(ctx, "acme_2024-02-10.pdf");
        assertEquals(FileState.CLASSIFIED, r.state());
        assertEquals("financial_invoice", r.documentType());
        assertEquals(ClassificationMethod.PATTERN, r.classificationMethod());
        assertFalse(r.requiresReview());

        Map<String, String> meta = ctx.jdbi().withExtension(RegistryDao.class, dao -> dao.fetchMetadata(r.fileId()))
                .stream().collect(Collectors.toMap(RegistryDao.MetadataRow::metaKey, RegistryDao.MetadataRow::metaValue));
        assertEquals("2024-02-10", meta.get("date"));
        assertEquals("acme", meta.get("vendor_name"));
    }

    @Test
    void lowConfidenceGoesToReview() throws Exception {
        ctx = AppContext.open(Fixtures.config(tmp));
        Fixtures.write(tmp.resolve("inbox/mystery.xyz"), "???");
        Fixtures.scan(ctx, tmp.resolve("inbox"));

        ClassificationService.Report report = new ClassificationService(ctx, new ExtensionClassifier(),
                new FilenameMetadataExtractor()).classifyPending();

        assertEquals(1, report.review());
        FileRecord r = Fixtures.byName(ctx, "mystery.xyz");
        assertEquals(FileState.REVIEW, r.state());
        assertEquals("unknown", r.documentType());
        assertTrue(r.requiresReview());
    }

    @Test
    void timeoutLeavesRecordPendingAndMovesOn() throws Exception {
        ctx = AppContext.open(Fixtures.configBuilder(tmp).classifierTimeout(Duration.ofMillis(200)).build());
        Fixtures.write(tmp.resolve("inbox/slow.bin"), "slow");
        Fixtures.write(tmp.resolve("inbox/fast.txt"), "fast");
        Fixtures.scan(ctx, tmp.resolve("inbox"));

        Classifier classifier = file -> {
            if (file.getFileName().toString().startsWith("slow")) {
                LockSupport.parkNanos(TimeUnit.SECONDS.toNanos(5));
            }
            return new ClassificationResult("document_text", 0.9, ClassificationMethod.ML_MODEL);
        };
        ClassificationService.Report report = new ClassificationService(ctx, classifier, file -> Map.of())
                .classifyPending();

        assertEquals(1, report.timedOut());
        assertEquals(1, report.classified());
        assertEquals(FileState.PENDING, Fixtures.byName(ctx, "slow.bin").state());
        assertEquals(FileState.CLASSIFIED, Fixtures.byName(ctx, "fast.txt").state());
    }

    @Test
    void classifierFailureLeavesRecordPending() throws Exception {
        ctx = AppContext.open(Fixtures.config(tmp));
        Fixtures.write(tmp.resolve("inbox/broken.pdf"), "x");
        Fixtures.scan(ctx, tmp.resolve("inbox"));

        ClassificationService.Report report = new ClassificationService(ctx,
                file -> { throw new IOException("model unavailable"); },
                new FilenameMetadataExtractor()).classifyPending();

        assertEquals(1, report.failed());
        assertEquals(FileState.PENDING, Fixtures.byName(ctx, "broken.pdf").state());
    }

    @Test
    void missingResultCountsAsFailureAndRunContinues() throws Exception {
        ctx = AppContext.open(Fixtures.config(tmp));
        Fixtures.write(tmp.resolve("inbox/silent.pdf"), "a");
        Fixtures.write(tmp.resolve("inbox/answered.pdf"), "b");
        Fixtures.scan(ctx, tmp.resolve("inbox"));

        ClassificationService.Report report = new ClassificationService(ctx,
                file -> file.getFileName().toString().equals("silent.pdf")
                        ? null
                        : new ClassificationResult("document_pdf", 0.9, ClassificationMethod.PATTERN),
                new FilenameMetadataExtractor()).classifyPending();

        assertEquals(1, report.failed());
        assertEquals(1, report.classified());
        assertEquals(FileState.PENDING, Fixtures.byName(ctx, "silent.pdf").state());
        assertEquals(FileState.CLASSIFIED, Fixtures.byName(ctx, "answered.pdf").state());
    }

    @Test
    void resultValidation() {
        assertThrows(IllegalArgumentException.class,
                () -> new ClassificationResult(" ", 0.5, ClassificationMethod.PATTERN));
        assertThrows(IllegalArgumentException.class,
                () -> new ClassificationResult("x", 1.5, ClassificationMethod.PATTERN));
        assertThrows(NullPointerException.class, () -> new ClassificationResult("x", 0.5, null));
    }
}
