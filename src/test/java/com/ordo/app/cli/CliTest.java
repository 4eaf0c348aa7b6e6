package com.ordo.app.cli;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.ordo.app.AppContext;
import com.ordo.app.Fixtures;
import com.ordo.app.config.Config;
import com.ordo.app.database.FileState;
import com.ordo.app.database.MigrationDao;
import com.ordo.app.database.RegistryDao;

import static org.junit.jupiter.api.Assertions.*;

public class CliTest {

    @TempDir
    Path tmp;

    private Config config;
    private Path inbox;
    private Path structure;

    @BeforeEach
    void setUp() throws Exception {
        config = Fixtures.config(tmp);
        inbox = tmp.resolve("inbox");
        Fixtures.write(inbox.resolve("notes.txt"), "meeting notes");
        Fixtures.write(inbox.resolve("photo.jpg"), "jpeg bytes");
        structure = Files.writeString(tmp.resolve("structure.json"), """
                { "defaultTemplate": "Files/{doc_type}/{filename}" }
                """);
    }

    @Test
    void fullWorkflowThroughCommands() {
        assertEquals(0, run("scan", "--root", inbox.toString()));
        assertEquals(0, run("analyze"));
        assertEquals(0, run("classify"));
        assertEquals(0, run("plan", "--config", structure.toString()));

        String planId = latestPlanId();
        assertEquals(0, run("approve", "--plan", planId));
        assertEquals(0, run("execute", "--plan", planId));

        Path root = config.getCanonicalRoot();
        assertTrue(Files.exists(root.resolve("Files/document_text/notes.txt")));
        assertTrue(Files.exists(root.resolve("Files/media_image/photo.jpg")));

        assertEquals(0, run("reorg", "--config", structure.toString()));
        assertEquals(0, run("metrics", "--save"));
        try (AppContext ctx = AppContext.open(config)) {
            assertEquals(1L, ctx.jdbi().<Long, RegistryDao, RuntimeException>withExtension(RegistryDao.class, dao -> dao.countSnapshots("stability")));
        }

        assertEquals(0, run("rollback", "--plan", planId));
        assertTrue(Files.exists(inbox.resolve("notes.txt")));
    }

    @Test
    void correctCommandUpdatesType() {
        assertEquals(0, run("scan", "--root", inbox.toString()));
        assertEquals(0, run("classify"));
        assertEquals(0, run("review"));

        long id;
        try (AppContext ctx = AppContext.open(config)) {
            id = Fixtures.byName(ctx, "notes.txt").fileId();
        }
        assertEquals(0, run("correct", "--file", Long.toString(id), "--type", "legal_contract"));

        try (AppContext ctx = AppContext.open(config)) {
            assertEquals("legal_contract", Fixtures.record(ctx, id).documentType());
            assertEquals(FileState.CLASSIFIED, Fixtures.record(ctx, id).state());
        }
    }

    @Test
    void usageErrorsExitWithTwo() {
        assertEquals(2, run("bogus"));
        assertEquals(2, run("scan"));
        assertEquals(2, run("scan", "--root", tmp.resolve("nope").toString()));
        assertEquals(2, run("approve"));
        assertEquals(2, run("plan"));
        assertEquals(2, run("correct", "--type", "x"));
        assertEquals(2, run("review", "--limit", "abc"));
        assertEquals(2, run("metrics", "--unknown"));
    }

    @Test
    void helpExitsWithZero() {
        assertEquals(0, Cli.execute(new String[] {"--help"}));
        assertEquals(0, run("scan", "--help"));
    }

    @Test
    void failuresExitWithOne() {
        assertEquals(1, run("approve", "--plan", "no-such-plan"));
    }

    private int run(String cmd, String... args) {
        return Cli.execute(config, cmd, args);
    }

    private String latestPlanId() {
        try (AppContext ctx = AppContext.open(config)) {
            List<MigrationDao.PlanRow> plans = ctx.jdbi().withExtension(MigrationDao.class, dao -> dao.fetchRecentPlans(1));
            assertEquals(1, plans.size());
            return plans.get(0).planId();
        }
    }
}
