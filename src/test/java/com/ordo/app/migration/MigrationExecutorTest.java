package com.ordo.app.migration;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.ordo.app.AppContext;
import com.ordo.app.Fixtures;
import com.ordo.app.config.Config;
import com.ordo.app.database.FileRecord;
import com.ordo.app.database.FileState;
import com.ordo.app.database.MigrationDao;
import com.ordo.app.database.RegistryDao;
import com.ordo.app.dedup.DuplicateAnalyzer;
import com.ordo.app.exception.PlanNotApprovedException;
import com.ordo.app.exception.RollbackIncompleteException;

import static org.junit.jupiter.api.Assertions.*;

public class MigrationExecutorTest {

    private static final StructureConfig CONFIG = StructureConfig.builder()
            .defaultTemplate("Docs/{doc_type}/{filename}")
            .build();

    @TempDir
    Path tmp;

    private AppContext ctx;

    @AfterEach
    void tearDown() {
        if (ctx != null) ctx.close();
    }

    /** Três arquivos classificados e um plano pendente para eles. */
    private MigrationPlan threeFilePlan(Config config) throws Exception {
        ctx = AppContext.open(config);
        Path inbox = tmp.resolve("inbox");
        Fixtures.write(inbox.resolve("one.txt"), "first file");
        Fixtures.write(inbox.resolve("two.txt"), "second file");
        Fixtures.write(inbox.resolve("three.txt"), "third file");
        Fixtures.scan(ctx, inbox);
        for (FileRecord r : Fixtures.active(ctx)) {
            Fixtures.classify(ctx, r.fileId(), "document_text");
        }
        return new MigrationPlanner(ctx).createPlan(CONFIG, PlanOptions.initial(ctx.config()));
    }

    private MigrationPlan approve(MigrationPlan plan) {
        return new MigrationPlanner(ctx).approve(plan);
    }

    private String planStatus(String planId) {
        return ctx.jdbi().withExtension(MigrationDao.class, dao -> dao.fetchPlan(planId)).orElseThrow().status();
    }

    @Test
    void movesFilesAndUpdatesRegistry() throws Exception {
        MigrationPlan plan = approve(threeFilePlan(Fixtures.config(tmp)));

        ExecutionResult result = new MigrationExecutor(ctx).execute(plan);

        assertEquals(PlanStatus.COMPLETED, result.status());
        assertEquals(3, result.succeeded());
        assertEquals(3, result.moves());
        assertNotNull(result.checkpointId());
        assertEquals("completed", planStatus(plan.planId()));

        for (MigrationAction a : plan.actions()) {
            assertFalse(Files.exists(Paths.get(a.sourcePath())));
            assertTrue(Files.exists(Paths.get(a.targetPath())));
            FileRecord r = Fixtures.record(ctx, a.fileId());
            assertEquals(FileState.ORGANIZED, r.state());
            assertEquals(a.targetPath(), r.canonicalPath());
            assertEquals(1, r.moveCount());
            assertNotNull(r.lastMovedMillis());

            List<RegistryDao.HistoryRow> history = ctx.jdbi().withExtension(RegistryDao.class,
                    dao -> dao.fetchHistory(a.fileId()));
            assertEquals(1, history.size());
            assertEquals("MOVE", history.get(0).eventType());
            assertEquals(plan.planId(), history.get(0).planId());
        }
    }

    @Test
    void externallyDeletedSourceFailsOnlyThatAction() throws Exception {
        MigrationPlan plan = approve(threeFilePlan(Fixtures.config(tmp)));
        MigrationAction second = plan.actions().get(1);
        Files.delete(Paths.get(second.sourcePath()));

        ExecutionResult result = new MigrationExecutor(ctx).execute(plan);

        assertEquals(PlanStatus.COMPLETED, result.status());
        assertEquals(2, result.succeeded());
        assertEquals(1, result.failed());
        assertEquals(3, result.total());
        MigrationAction failed = result.failures().get(0);
        assertEquals(second.seq(), failed.seq());
        assertTrue(failed.error().startsWith("SourceChangedException"), failed.error());
        assertTrue(Files.exists(Paths.get(plan.actions().get(0).targetPath())));
        assertTrue(Files.exists(Paths.get(plan.actions().get(2).targetPath())));
        assertEquals(FileState.CLASSIFIED, Fixtures.record(ctx, second.fileId()).state());
    }

    @Test
    void changedContentIsDetectedBeforeMoving() throws Exception {
        MigrationPlan plan = approve(threeFilePlan(Fixtures.config(tmp)));
        MigrationAction first = plan.actions().get(0);
        Files.writeString(Paths.get(first.sourcePath()), "edited after planning");

        ExecutionResult result = new MigrationExecutor(ctx).execute(plan);

        assertEquals(1, result.failed());
        assertTrue(result.failures().get(0).error().startsWith("SourceChangedException"));
        assertTrue(Files.exists(Paths.get(first.sourcePath())));
    }

    @Test
    void occupiedTargetIsAConflict() throws Exception {
        MigrationPlan plan = approve(threeFilePlan(Fixtures.config(tmp)));
        MigrationAction first = plan.actions().get(0);
        Fixtures.write(Paths.get(first.targetPath()), "someone else");

        ExecutionResult result = new MigrationExecutor(ctx).execute(plan);

        assertEquals(1, result.failed());
        assertTrue(result.failures().get(0).error().startsWith("ConflictException"));
        assertEquals("someone else", Files.readString(Paths.get(first.targetPath())));
    }

    @Test
    void unapprovedPlanIsRefused() throws Exception {
        MigrationPlan plan = threeFilePlan(Fixtures.config(tmp));
        MigrationExecutor executor = new MigrationExecutor(ctx);

        assertThrows(PlanNotApprovedException.class, () -> executor.execute(plan));
        // aprovação só em memória não basta
        assertThrows(PlanNotApprovedException.class, () -> executor.execute(plan.withApproval()));
        for (MigrationAction a : plan.actions()) {
            assertTrue(Files.exists(Paths.get(a.sourcePath())));
        }
    }

    @Test
    void tooManyFailuresRollBackEverything() throws Exception {
        MigrationPlan plan = approve(threeFilePlan(Fixtures.config(tmp)));
        Files.delete(Paths.get(plan.actions().get(0).sourcePath()));
        Files.delete(Paths.get(plan.actions().get(1).sourcePath()));
        MigrationAction survivor = plan.actions().get(2);

        ExecutionResult result = new MigrationExecutor(ctx).execute(plan);

        assertEquals(PlanStatus.ROLLED_BACK, result.status());
        assertTrue(result.rolledBack());
        assertEquals("rolled_back", planStatus(plan.planId()));
        assertTrue(Files.exists(Paths.get(survivor.sourcePath())));
        assertFalse(Files.exists(Paths.get(survivor.targetPath())));

        FileRecord r = Fixtures.record(ctx, survivor.fileId());
        assertEquals(FileState.CLASSIFIED, r.state());
        assertNull(r.canonicalPath());
        assertEquals(survivor.sourcePath(), r.location());
    }

    @Test
    void canceledExecutionResumesWithSameCheckpoint() throws Exception {
        MigrationPlan plan = approve(threeFilePlan(Fixtures.configBuilder(tmp).executionBatchSize(1).build()));
        MigrationExecutor executor = new MigrationExecutor(ctx);

        ExecutionResult paused = executor.execute(plan, new AtomicBoolean(true));
        assertEquals(PlanStatus.EXECUTING, paused.status());
        assertEquals(0, paused.succeeded());
        assertEquals("executing", planStatus(plan.planId()));

        ExecutionResult resumed = executor.execute(plan, new AtomicBoolean(false));
        assertEquals(PlanStatus.COMPLETED, resumed.status());
        assertEquals(3, resumed.succeeded());
        assertEquals(paused.checkpointId(), resumed.checkpointId());

        assertThrows(IllegalStateException.class, () -> executor.execute(plan));
    }

    /** Move à mão, como se o processo tivesse caído depois do lote e antes da transação. */
    private static void moveWithoutRegistry(MigrationAction a) throws Exception {
        Path target = Paths.get(a.targetPath());
        Files.createDirectories(target.getParent());
        Files.move(Paths.get(a.sourcePath()), target);
    }

    @Test
    void resumeAfterCrashRecordsFilesAlreadyAtTarget() throws Exception {
        MigrationPlan plan = approve(threeFilePlan(Fixtures.config(tmp)));
        MigrationExecutor executor = new MigrationExecutor(ctx);
        executor.execute(plan, new AtomicBoolean(true));
        moveWithoutRegistry(plan.actions().get(0));
        moveWithoutRegistry(plan.actions().get(1));

        ExecutionResult resumed = executor.execute(plan);

        assertEquals(PlanStatus.COMPLETED, resumed.status());
        assertEquals(3, resumed.succeeded());
        assertEquals(0, resumed.failed());
        for (MigrationAction a : plan.actions()) {
            assertTrue(Files.exists(Paths.get(a.targetPath())));
            FileRecord r = Fixtures.record(ctx, a.fileId());
            assertEquals(FileState.ORGANIZED, r.state());
            assertEquals(a.targetPath(), r.canonicalPath());
        }
    }

    @Test
    void resumeDoesNotAdoptDifferentContentAtTarget() throws Exception {
        MigrationPlan plan = approve(threeFilePlan(Fixtures.config(tmp)));
        MigrationExecutor executor = new MigrationExecutor(ctx);
        executor.execute(plan, new AtomicBoolean(true));
        MigrationAction first = plan.actions().get(0);
        moveWithoutRegistry(first);
        Files.writeString(Paths.get(first.targetPath()), "rewritten meanwhile");

        ExecutionResult resumed = executor.execute(plan);

        assertEquals(1, resumed.failed());
        assertTrue(resumed.failures().get(0).error().startsWith("SourceChangedException"));
        assertEquals(FileState.CLASSIFIED, Fixtures.record(ctx, first.fileId()).state());
    }

    @Test
    void rollbackReturnsFilesLeftAtTargetByACrash() throws Exception {
        MigrationPlan plan = approve(threeFilePlan(Fixtures.config(tmp)));
        MigrationExecutor executor = new MigrationExecutor(ctx);
        executor.execute(plan, new AtomicBoolean(true));
        MigrationAction stranded = plan.actions().get(0);
        moveWithoutRegistry(stranded);

        RollbackResult result = executor.rollback(executor.checkpointFor(plan.planId()));

        assertEquals(1, result.reversed());
        assertTrue(Files.exists(Paths.get(stranded.sourcePath())));
        assertFalse(Files.exists(Paths.get(stranded.targetPath())));
        FileRecord r = Fixtures.record(ctx, stranded.fileId());
        assertEquals(FileState.CLASSIFIED, r.state());
        assertNull(r.canonicalPath());
        assertEquals("rolled_back", planStatus(plan.planId()));
    }

    @Test
    void repeatedRollbackKeepsStateOfALaterPlan() throws Exception {
        MigrationPlan first = approve(threeFilePlan(Fixtures.config(tmp)));
        MigrationExecutor executor = new MigrationExecutor(ctx);
        executor.execute(first);
        Checkpoint checkpoint = executor.checkpointFor(first.planId());
        executor.rollback(checkpoint);

        MigrationPlanner planner = new MigrationPlanner(ctx);
        MigrationPlan second = planner.approve(planner.createPlan(CONFIG, PlanOptions.initial(ctx.config())));
        assertEquals(PlanStatus.COMPLETED, executor.execute(second).status());

        RollbackIncompleteException e = assertThrows(RollbackIncompleteException.class,
                () -> executor.rollback(checkpoint));

        assertEquals(3, e.getDiscrepancies().size());
        for (MigrationAction a : second.actions()) {
            assertTrue(Files.exists(Paths.get(a.targetPath())));
            FileRecord r = Fixtures.record(ctx, a.fileId());
            assertEquals(FileState.ORGANIZED, r.state());
            assertEquals(a.targetPath(), r.canonicalPath());
        }
    }

    @Test
    void manualRollbackRestoresFilesAndIsRepeatable() throws Exception {
        MigrationPlan plan = approve(threeFilePlan(Fixtures.config(tmp)));
        MigrationExecutor executor = new MigrationExecutor(ctx);
        executor.execute(plan);

        RollbackResult first = executor.rollback(executor.checkpointFor(plan.planId()));

        assertEquals(3, first.reversed());
        assertEquals(3, first.recordsRestored());
        for (MigrationAction a : plan.actions()) {
            assertTrue(Files.exists(Paths.get(a.sourcePath())));
            assertFalse(Files.exists(Paths.get(a.targetPath())));
            assertEquals(FileState.CLASSIFIED, Fixtures.record(ctx, a.fileId()).state());
            List<RegistryDao.HistoryRow> history = ctx.jdbi().withExtension(RegistryDao.class,
                    dao -> dao.fetchHistory(a.fileId()));
            assertEquals("ROLLBACK", history.get(history.size() - 1).eventType());
        }
        assertEquals("rolled_back", planStatus(plan.planId()));

        RollbackResult again = executor.rollback(executor.checkpointFor(plan.planId()));
        assertEquals(0, again.reversed());
    }

    @Test
    void rollbackRefusesToOverwriteModifiedFiles() throws Exception {
        MigrationPlan plan = approve(threeFilePlan(Fixtures.config(tmp)));
        MigrationExecutor executor = new MigrationExecutor(ctx);
        executor.execute(plan);
        MigrationAction edited = plan.actions().get(0);
        Files.writeString(Paths.get(edited.targetPath()), "edited after organizing");

        RollbackIncompleteException e = assertThrows(RollbackIncompleteException.class,
                () -> executor.rollback(executor.checkpointFor(plan.planId())));

        assertEquals(1, e.getDiscrepancies().size());
        assertTrue(e.getDiscrepancies().get(0).startsWith(edited.targetPath()));
        assertEquals("edited after organizing", Files.readString(Paths.get(edited.targetPath())));
        assertEquals(FileState.ORGANIZED, Fixtures.record(ctx, edited.fileId()).state());
        assertTrue(Files.exists(Paths.get(plan.actions().get(1).sourcePath())));
    }

    @Test
    void archivedDuplicateIsCompressedAndRestoredByRollback() throws Exception {
        ctx = AppContext.open(Fixtures.config(tmp));
        Path inbox = tmp.resolve("inbox");
        String body = "duplicate body ".repeat(200);
        Fixtures.write(inbox.resolve("a/notes.txt"), body);
        Fixtures.write(inbox.resolve("b/notes.txt"), body);
        Fixtures.scan(ctx, inbox);
        long canonicalId = new DuplicateAnalyzer(ctx).analyze().groups().get(0).canonicalFileId();

        StructureConfig archive = StructureConfig.builder()
                .defaultTemplate("Docs/{filename}")
                .duplicatePolicy(DuplicatePolicy.ARCHIVE)
                .build();
        MigrationPlanner planner = new MigrationPlanner(ctx);
        MigrationPlan plan = planner.approve(planner.createPlan(archive, PlanOptions.initial(ctx.config())));
        assertEquals(1, plan.actions().size(), "canonical is still pending, only the duplicate moves");
        MigrationAction a = plan.actions().get(0);
        assertNotEquals(canonicalId, a.fileId());
        assertEquals(ActionType.ARCHIVE, a.actionType());
        assertTrue(a.targetPath().endsWith("notes.txt.zst"));

        MigrationExecutor executor = new MigrationExecutor(ctx);
        ExecutionResult result = executor.execute(plan);

        assertEquals(PlanStatus.COMPLETED, result.status());
        Path target = Paths.get(a.targetPath());
        assertTrue(Files.exists(target));
        assertFalse(Files.exists(Paths.get(a.sourcePath())));
        assertTrue(Files.size(target) < body.length());
        FileRecord stored = Fixtures.record(ctx, a.fileId());
        assertEquals(a.targetPath(), stored.storedPath());
        assertEquals(0, stored.moveCount());

        executor.rollback(executor.checkpointFor(plan.planId()));

        assertEquals(body, Files.readString(Paths.get(a.sourcePath())));
        assertFalse(Files.exists(target));
        assertNull(Fixtures.record(ctx, a.fileId()).storedPath());
    }
}
