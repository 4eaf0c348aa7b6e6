package com.ordo.app;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import com.ordo.app.config.Config;
import com.ordo.app.database.ClassificationMethod;
import com.ordo.app.database.FileRecord;
import com.ordo.app.database.FileState;
import com.ordo.app.database.RegistryDao;
import com.ordo.app.inventory.ScanConfig;
import com.ordo.app.inventory.ScanMetrics;
import com.ordo.app.inventory.Scanner;

/**
 * Atalhos compartilhados pelos testes de integração: registro SQLite real em diretório temporário.
 */
public final class Fixtures {

    private Fixtures() {}

    public static Config.Builder configBuilder(Path tmp) {
        return Config.builder()
                .dataDir(tmp.resolve("data"))
                .scanThreads(2)
                .scanBatchSize(10)
                .zone(ZoneOffset.UTC);
    }

    public static Config config(Path tmp) {
        return configBuilder(tmp).build();
    }

    public static Path write(Path file, String content) throws IOException {
        Files.createDirectories(file.getParent());
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }

    public static Path write(Path file, String content, Instant mtime) throws IOException {
        write(file, content);
        Files.setLastModifiedTime(file, FileTime.from(mtime));
        return file;
    }

    public static Scanner.ScanResult scan(AppContext ctx, Path root) {
        return new Scanner(ctx).scan(List.of(root), ScanConfig.from(ctx.config()), new ScanMetrics(),
                new AtomicBoolean(false));
    }

    public static List<FileRecord> active(AppContext ctx) {
        return ctx.jdbi().withExtension(RegistryDao.class, RegistryDao::fetchActive);
    }

    public static FileRecord record(AppContext ctx, long fileId) {
        return ctx.jdbi().withExtension(RegistryDao.class, dao -> dao.findById(fileId)).orElseThrow();
    }

    /** Registro ativo cujo nome de arquivo é {@code name}. */
    public static FileRecord byName(AppContext ctx, String name) {
        return active(ctx).stream()
                .filter(r -> name.equals(r.fileName()))
                .findFirst()
                .orElseThrow(() -> new AssertionError("Sem registro para " + name));
    }

    public static void classify(AppContext ctx, long fileId, String documentType) {
        ctx.jdbi().useExtension(RegistryDao.class, dao -> dao.applyClassification(fileId, documentType, 0.95,
                ClassificationMethod.PATTERN.dbValue(), FileState.CLASSIFIED.dbValue(), false, ctx.nowMillis()));
    }

    public static void metadata(AppContext ctx, long fileId, String key, String value) {
        ctx.jdbi().useExtension(RegistryDao.class, dao -> dao.upsertMetadata(fileId, key, value));
    }
}
