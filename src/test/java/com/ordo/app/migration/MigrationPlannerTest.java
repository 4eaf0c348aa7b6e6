package com.ordo.app.migration;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.ordo.app.AppContext;
import com.ordo.app.Fixtures;
import com.ordo.app.database.FileRecord;
import com.ordo.app.database.FileState;
import com.ordo.app.dedup.DuplicateAnalyzer;
import com.ordo.app.exception.ConfigurationException;
import com.ordo.app.exception.ConflictException;
import com.ordo.app.inventory.FileNames;
import com.ordo.app.reorg.ReorganizeResult;
import com.ordo.app.reorg.Reorganizer;

import static org.junit.jupiter.api.Assertions.*;

public class MigrationPlannerTest {

    private static final Instant DISCOVERED = Instant.parse("2024-03-15T10:00:00Z");

    private static final StructureConfig INVOICES = StructureConfig.builder()
            .type("financial_invoice", "Financial/Invoices/{YYYY}/{MM}/{filename}")
            .build();

    @TempDir
    Path tmp;

    private AppContext ctx;
    private Path inbox;

    @BeforeEach
    void setUp() {
        ctx = AppContext.open(Fixtures.config(tmp), Clock.fixed(DISCOVERED, ZoneOffset.UTC));
        inbox = tmp.resolve("inbox");
    }

    @AfterEach
    void tearDown() {
        ctx.close();
    }

    private Path canonical(String relative) {
        return ctx.config().getCanonicalRoot().resolve(relative);
    }

    @Test
    void missingDateFallsBackToDiscoveryAndAsksForReview() throws Exception {
        Fixtures.write(inbox.resolve("invoice.pdf"), "invoice");
        Fixtures.scan(ctx, inbox);
        FileRecord r = Fixtures.byName(ctx, "invoice.pdf");
        Fixtures.classify(ctx, r.fileId(), "financial_invoice");

        MigrationPlan plan = new MigrationPlanner(ctx).createPlan(INVOICES, PlanOptions.initial(ctx.config()));

        assertEquals(1, plan.actions().size());
        MigrationAction a = plan.actions().get(0);
        assertEquals(FileNames.key(canonical("Financial/Invoices/2024/03/invoice.pdf")), a.targetPath());
        assertTrue(a.requiresReview());
        assertEquals(ActionType.MOVE, a.actionType());
        assertEquals(1, a.seq());
        assertEquals(r.contentHash(), a.expectedHash());
        assertFalse(plan.approved());
        assertEquals(PlanStatus.PENDING, plan.status());
    }

    @Test
    void extractedDateIsUsedWithoutReview() throws Exception {
        Fixtures.write(inbox.resolve("invoice.pdf"), "invoice");
        Fixtures.scan(ctx, inbox);
        long id = Fixtures.byName(ctx, "invoice.pdf").fileId();
        Fixtures.classify(ctx, id, "financial_invoice");
        Fixtures.metadata(ctx, id, "date", "2023-11-02");

        MigrationAction a = new MigrationPlanner(ctx).createPlan(INVOICES, PlanOptions.initial(ctx.config()))
                .actions().get(0);

        assertEquals(FileNames.key(canonical("Financial/Invoices/2023/11/invoice.pdf")), a.targetPath());
        assertFalse(a.requiresReview());
    }

    @Test
    void collidingTargetsAreRenamedAndPlanCanBeApproved() throws Exception {
        Fixtures.write(inbox.resolve("a/doc.pdf"), "first");
        Fixtures.write(inbox.resolve("b/doc.pdf"), "second");
        Fixtures.scan(ctx, inbox);
        for (FileRecord r : Fixtures.active(ctx)) {
            Fixtures.classify(ctx, r.fileId(), "financial_invoice");
            Fixtures.metadata(ctx, r.fileId(), "date", "2025-01-20");
        }

        MigrationPlanner planner = new MigrationPlanner(ctx);
        MigrationPlan plan = planner.createPlan(INVOICES, PlanOptions.initial(ctx.config()));

        Set<String> targets = plan.actions().stream().map(MigrationAction::targetPath).collect(Collectors.toSet());
        assertEquals(Set.of(
                FileNames.key(canonical("Financial/Invoices/2025/01/doc.pdf")),
                FileNames.key(canonical("Financial/Invoices/2025/01/doc_1.pdf"))), targets);

        MigrationPlan approved = planner.approve(plan);
        assertTrue(approved.approved());
        assertEquals(PlanStatus.APPROVED, approved.status());
        MigrationPlan reloaded = planner.load(plan.planId());
        assertTrue(reloaded.approved());
        assertEquals(2, reloaded.actions().size());
    }

    @Test
    void approveRejectsRepeatedTargets() {
        MigrationAction a = new MigrationAction(1, 1, "/x/a.pdf", "/c/doc.pdf", ActionType.MOVE, "r", false,
                null, null, "{}", ActionOutcome.PENDING, null);
        MigrationAction b = new MigrationAction(2, 2, "/x/b.pdf", "/c/doc.pdf", ActionType.MOVE, "r", false,
                null, null, "{}", ActionOutcome.PENDING, null);
        MigrationPlan plan = new MigrationPlan("p-1", 0L, false, PlanStatus.PENDING, "organize", List.of(a, b));

        assertThrows(ConflictException.class, () -> new MigrationPlanner(ctx).approve(plan));
    }

    @Test
    void existingFileAtTargetIsNotOverwrittenInPlan() throws Exception {
        Fixtures.write(inbox.resolve("doc.pdf"), "new one");
        Fixtures.write(canonical("Financial/Invoices/2025/01/doc.pdf"), "already organized");
        Fixtures.scan(ctx, inbox);
        Fixtures.scan(ctx, ctx.config().getCanonicalRoot());
        FileRecord incoming = Fixtures.active(ctx).stream()
                .filter(r -> r.originalPath().startsWith(inbox.toAbsolutePath().toString()))
                .findFirst().orElseThrow();
        Fixtures.classify(ctx, incoming.fileId(), "financial_invoice");
        Fixtures.metadata(ctx, incoming.fileId(), "date", "2025-01-05");

        MigrationPlan plan = new MigrationPlanner(ctx).createPlan(INVOICES, PlanOptions.initial(ctx.config()));

        assertEquals(FileNames.key(canonical("Financial/Invoices/2025/01/doc_1.pdf")),
                plan.actions().get(0).targetPath());
    }

    @Test
    void planningTwiceAfterExecutionIsEmpty() throws Exception {
        Fixtures.write(inbox.resolve("invoice.pdf"), "invoice");
        Fixtures.scan(ctx, inbox);
        Fixtures.classify(ctx, Fixtures.byName(ctx, "invoice.pdf").fileId(), "financial_invoice");

        MigrationPlanner planner = new MigrationPlanner(ctx);
        MigrationPlan plan = planner.approve(planner.createPlan(INVOICES, PlanOptions.initial(ctx.config())));
        new MigrationExecutor(ctx).execute(plan);

        assertTrue(planner.createPlan(INVOICES, PlanOptions.initial(ctx.config())).isEmpty());
        PlanOptions reorg = PlanOptions.reorganize(ctx.config(), ctx.config().getCanonicalRoot());
        assertTrue(planner.plan(INVOICES, planner.snapshot(), reorg).isEmpty());
    }

    @Test
    void fileAlreadyInPlaceIsRegisteredAsOrganized() throws Exception {
        Path placed = Fixtures.write(canonical("Docs/document_text/notes.txt"), "already sorted");
        Fixtures.scan(ctx, ctx.config().getCanonicalRoot());
        FileRecord r = Fixtures.byName(ctx, "notes.txt");
        Fixtures.classify(ctx, r.fileId(), "document_text");
        StructureConfig layout = StructureConfig.builder().defaultTemplate("Docs/{doc_type}/{filename}").build();

        MigrationPlan plan = new MigrationPlanner(ctx).createPlan(layout, PlanOptions.initial(ctx.config()));

        assertTrue(plan.isEmpty());
        FileRecord organized = Fixtures.record(ctx, r.fileId());
        assertEquals(FileState.ORGANIZED, organized.state());
        assertEquals(FileNames.key(placed), organized.canonicalPath());
        assertEquals(0, organized.moveCount());

        StructureConfig changed = StructureConfig.builder().defaultTemplate("Other/{filename}").build();
        ReorganizeResult moved = new Reorganizer(ctx).reorganize(ctx.config().getCanonicalRoot(), changed, false);

        assertEquals(1, moved.moves());
        assertTrue(Files.exists(canonical("Other/notes.txt")));
        assertFalse(Files.exists(placed));
    }

    @Test
    void planningFailureRegistersNothingInPlace() throws Exception {
        Fixtures.write(canonical("Docs/document_text/notes.txt"), "already sorted");
        Fixtures.write(canonical("elsewhere/contract.pdf"), "terms");
        Fixtures.scan(ctx, ctx.config().getCanonicalRoot());
        Fixtures.classify(ctx, Fixtures.byName(ctx, "notes.txt").fileId(), "document_text");
        Fixtures.classify(ctx, Fixtures.byName(ctx, "contract.pdf").fileId(), "legal_contract");
        StructureConfig partial = StructureConfig.builder().type("document_text", "Docs/{doc_type}/{filename}").build();

        assertThrows(ConfigurationException.class,
                () -> new MigrationPlanner(ctx).createPlan(partial, PlanOptions.initial(ctx.config())));

        assertEquals(FileState.CLASSIFIED, Fixtures.byName(ctx, "notes.txt").state());
    }

    @Test
    void unmappedTypeWithoutDefaultAbortsPlan() throws Exception {
        Fixtures.write(inbox.resolve("contract.pdf"), "contract");
        Fixtures.scan(ctx, inbox);
        Fixtures.classify(ctx, Fixtures.byName(ctx, "contract.pdf").fileId(), "legal_contract");

        assertThrows(ConfigurationException.class,
                () -> new MigrationPlanner(ctx).createPlan(INVOICES, PlanOptions.initial(ctx.config())));
    }

    @Test
    void duplicatesFollowThePolicy() throws Exception {
        Fixtures.write(inbox.resolve("a/scan.pdf"), "same", Instant.parse("2024-01-01T00:00:00Z"));
        Fixtures.write(inbox.resolve("b/scan.pdf"), "same", Instant.parse("2024-02-01T00:00:00Z"));
        Fixtures.scan(ctx, inbox);
        long canonicalId = new DuplicateAnalyzer(ctx).analyze().groups().get(0).canonicalFileId();
        Fixtures.classify(ctx, canonicalId, "financial_invoice");

        StructureConfig config = StructureConfig.builder()
                .type("financial_invoice", "Financial/{filename}")
                .duplicatePolicy(DuplicatePolicy.QUARANTINE)
                .build();
        MigrationPlanner planner = new MigrationPlanner(ctx);
        MigrationPlan plan = planner.approve(planner.createPlan(config, PlanOptions.initial(ctx.config())));

        assertEquals(2, plan.actions().size());
        MigrationAction dup = plan.actions().stream().filter(a -> a.fileId() != canonicalId).findFirst().orElseThrow();
        Path quarantined = ctx.config().getQuarantineDir().resolve("Duplicates").resolve("scan.pdf");
        assertEquals(FileNames.key(quarantined), dup.targetPath());

        ExecutionResult result = new MigrationExecutor(ctx).execute(plan);

        assertEquals(PlanStatus.COMPLETED, result.status());
        assertTrue(Files.exists(quarantined));
        FileRecord stored = Fixtures.record(ctx, dup.fileId());
        assertEquals(quarantined.toString(), stored.storedPath());
        assertTrue(stored.duplicate());
        assertEquals(FileState.DUPLICATE, stored.state());
        assertEquals(FileState.ORGANIZED, Fixtures.record(ctx, canonicalId).state());
    }

    @Test
    void subtypeIsDerivedFromDocumentType() {
        assertEquals("Invoice", MigrationPlanner.subtype("financial_invoice"));
        assertEquals("Bank Statement", MigrationPlanner.subtype("financial_bank_statement"));
        assertNull(MigrationPlanner.subtype("unknown"));
    }
}
