package com.ordo.app.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.github.cdimascio.dotenv.Dotenv;

/**
 * Configuração central do Ordo.
 * Cada valor é resolvido na ordem: system property ({@code ordo.*}),
 * variável de ambiente ({@code ORDO_*}), arquivo {@code .env}, default.
 * A instância é imutável e passada explicitamente via {@link com.ordo.app.AppContext}.
 */
public final class Config {

    private static final Logger logger = LoggerFactory.getLogger(Config.class);

    private static final String APP_NAME = "Ordo";
    private static final String DEFAULT_DB_NAME = "registry.ordo";

    private final Path dataDir;
    private final String dbName;
    private final Path canonicalRoot;
    private final Path structureConfigPath;
    private final Path quarantineDir;
    private final int scanThreads;
    private final int scanBatchSize;
    private final boolean followSymlinks;
    private final int executionBatchSize;
    private final double failureThreshold;
    private final boolean fuzzyEnabled;
    private final double fuzzyThreshold;
    private final boolean fuzzySameFolderOnly;
    private final long minDuplicateSize;
    private final List<String> preferredPaths;
    private final boolean useAccessTime;
    private final Duration classifierTimeout;
    private final double reviewThreshold;
    private final ZoneId zone;

    private Config(Builder b) {
        this.dataDir = b.dataDir.toAbsolutePath().normalize();
        this.dbName = b.dbName;
        this.canonicalRoot = b.canonicalRoot == null ? dataDir.resolve("canonical") : b.canonicalRoot.toAbsolutePath().normalize();
        this.structureConfigPath = b.structureConfigPath;
        this.quarantineDir = b.quarantineDir == null ? dataDir.resolve("quarantine") : b.quarantineDir.toAbsolutePath().normalize();
        this.scanThreads = Math.max(1, b.scanThreads);
        this.scanBatchSize = Math.max(1, b.scanBatchSize);
        this.followSymlinks = b.followSymlinks;
        this.executionBatchSize = Math.max(1, b.executionBatchSize);
        this.failureThreshold = b.failureThreshold;
        this.fuzzyEnabled = b.fuzzyEnabled;
        this.fuzzyThreshold = b.fuzzyThreshold;
        this.fuzzySameFolderOnly = b.fuzzySameFolderOnly;
        this.minDuplicateSize = Math.max(0, b.minDuplicateSize);
        this.preferredPaths = List.copyOf(b.preferredPaths);
        this.useAccessTime = b.useAccessTime;
        this.classifierTimeout = b.classifierTimeout;
        this.reviewThreshold = b.reviewThreshold;
        this.zone = b.zone;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Monta a configuração a partir do ambiente (system properties, env, .env).
     */
    public static Config load() {
        Dotenv dotenv = Dotenv.configure().ignoreIfMissing().load();
        Source src = new Source(dotenv);

        Builder b = builder();
        String dir = src.get("dataDir", "ORDO_DATA_DIR");
        b.dataDir(dir != null ? Paths.get(dir) : defaultDataDir());
        b.dbName(StringUtils.defaultIfBlank(src.get("dbName", "ORDO_DB_NAME"), DEFAULT_DB_NAME));

        String canonical = src.get("canonicalRoot", "ORDO_CANONICAL_ROOT");
        if (canonical != null) b.canonicalRoot(Paths.get(canonical));
        String structure = src.get("structureConfig", "ORDO_STRUCTURE_CONFIG");
        if (structure != null) b.structureConfigPath(Paths.get(structure));
        String quarantine = src.get("quarantineDir", "ORDO_QUARANTINE_DIR");
        if (quarantine != null) b.quarantineDir(Paths.get(quarantine));

        b.scanThreads(src.getInt("scanThreads", "ORDO_SCAN_THREADS", 8));
        b.scanBatchSize(src.getInt("scanBatchSize", "ORDO_SCAN_BATCH_SIZE", 500));
        b.followSymlinks(src.getBool("followSymlinks", "ORDO_FOLLOW_SYMLINKS", false));
        b.executionBatchSize(src.getInt("executionBatchSize", "ORDO_EXECUTION_BATCH_SIZE", 100));
        b.failureThreshold(src.getDouble("failureThreshold", "ORDO_FAILURE_THRESHOLD", 0.5));
        b.fuzzyEnabled(src.getBool("fuzzyEnabled", "ORDO_FUZZY_ENABLED", true));
        b.fuzzyThreshold(src.getDouble("fuzzyThreshold", "ORDO_FUZZY_THRESHOLD", 0.85));
        b.fuzzySameFolderOnly(src.getBool("fuzzySameFolderOnly", "ORDO_FUZZY_SAME_FOLDER_ONLY", false));
        b.minDuplicateSize(src.getInt("minDuplicateSize", "ORDO_MIN_DUPLICATE_SIZE", 0));
        b.preferredPaths(splitList(src.get("preferredPaths", "ORDO_PREFERRED_PATHS")));
        b.useAccessTime(src.getBool("useAccessTime", "ORDO_USE_ACCESS_TIME", false));
        b.classifierTimeout(Duration.ofMillis(src.getInt("classifierTimeoutMs", "ORDO_CLASSIFIER_TIMEOUT_MS", 30_000)));
        b.reviewThreshold(src.getDouble("reviewThreshold", "ORDO_REVIEW_THRESHOLD", 0.70));
        String tz = src.get("timezone", "ORDO_TIMEZONE");
        if (tz != null) b.zone(ZoneId.of(tz));
        return b.build();
    }

    public String getDbUrl() {
        return "jdbc:sqlite:" + getDbFilePath();
    }

    public Path getDbFilePath() {
        return dataDir.resolve(dbName);
    }

    public Path getDataDir() { return dataDir; }
    public Path getCanonicalRoot() { return canonicalRoot; }
    public Path getStructureConfigPath() { return structureConfigPath; }
    public Path getQuarantineDir() { return quarantineDir; }
    public Path getTrashDir() { return quarantineDir.resolve("Trash"); }
    public int getScanThreads() { return scanThreads; }
    public int getScanBatchSize() { return scanBatchSize; }
    public boolean isFollowSymlinks() { return followSymlinks; }
    public int getExecutionBatchSize() { return executionBatchSize; }
    public double getFailureThreshold() { return failureThreshold; }
    public boolean isFuzzyEnabled() { return fuzzyEnabled; }
    public double getFuzzyThreshold() { return fuzzyThreshold; }
    public boolean isFuzzySameFolderOnly() { return fuzzySameFolderOnly; }
    public long getMinDuplicateSize() { return minDuplicateSize; }
    public List<String> getPreferredPaths() { return preferredPaths; }
    public boolean isUseAccessTime() { return useAccessTime; }
    public Duration getClassifierTimeout() { return classifierTimeout; }
    public double getReviewThreshold() { return reviewThreshold; }
    public ZoneId getZone() { return zone; }

    // --- Resolução -----------------------------------------------------------

    private static List<String> splitList(String raw) {
        List<String> out = new ArrayList<>();
        if (raw == null) return out;
        for (String part : raw.split("[,;]")) {
            if (StringUtils.isNotBlank(part)) out.add(part.trim());
        }
        return out;
    }

    /**
     * Diretório de dados padrão por sistema operacional; fallback para o diretório local.
     */
    private static Path defaultDataDir() {
        String os = System.getProperty("os.name", "generic").toLowerCase(Locale.ROOT);
        String userHome = System.getProperty("user.home");
        Path appDataDir;

        if (os.contains("win")) {
            String appDataEnv = System.getenv("APPDATA");
            appDataDir = StringUtils.isNotBlank(appDataEnv)
                    ? Paths.get(appDataEnv, APP_NAME)
                    : Paths.get(userHome, "AppData", "Roaming", APP_NAME);
        } else if (os.contains("mac")) {
            appDataDir = Paths.get(userHome, "Library", "Application Support", APP_NAME);
        } else {
            // Linux/Unix: XDG (~/.local/share/Ordo)
            String xdgData = System.getenv("XDG_DATA_HOME");
            appDataDir = StringUtils.isNotBlank(xdgData)
                    ? Paths.get(xdgData, APP_NAME)
                    : Paths.get(userHome, ".local", "share", APP_NAME);
        }

        try {
            Files.createDirectories(appDataDir);
            logger.info("Registro localizado em: {}", appDataDir.toAbsolutePath());
            return appDataDir;
        } catch (IOException e) {
            Path local = Paths.get("").toAbsolutePath();
            logger.warn("Sem permissão em {}. Usando diretório local como fallback: {}", appDataDir, local);
            return local;
        }
    }

    private static final class Source {
        private final Dotenv dotenv;

        Source(Dotenv dotenv) {
            this.dotenv = dotenv;
        }

        String get(String propSuffix, String envKey) {
            // 0. System properties (testes/CI)
            String propVal = System.getProperty("ordo." + propSuffix);
            if (StringUtils.isNotBlank(propVal)) return propVal.trim();

            // 1. Variável de ambiente
            String envVal = System.getenv(envKey);
            if (StringUtils.isNotBlank(envVal)) return envVal.trim();

            // 2. Arquivo .env
            String fileVal = dotenv.get(envKey);
            return StringUtils.isBlank(fileVal) ? null : fileVal.trim();
        }

        int getInt(String propSuffix, String envKey, int def) {
            String v = get(propSuffix, envKey);
            if (v == null) return def;
            try {
                return Integer.parseInt(v);
            } catch (NumberFormatException e) {
                logger.warn("Valor inválido para {}: '{}'. Usando {}", envKey, v, def);
                return def;
            }
        }

        double getDouble(String propSuffix, String envKey, double def) {
            String v = get(propSuffix, envKey);
            if (v == null) return def;
            try {
                return Double.parseDouble(v);
            } catch (NumberFormatException e) {
                logger.warn("Valor inválido para {}: '{}'. Usando {}", envKey, v, def);
                return def;
            }
        }

        boolean getBool(String propSuffix, String envKey, boolean def) {
            String v = get(propSuffix, envKey);
            if (v == null) return def;
            String norm = v.toLowerCase(Locale.ROOT);
            return norm.equals("1") || norm.equals("true") || norm.equals("yes") || norm.equals("on");
        }
    }

    public static final class Builder {
        private Path dataDir = Paths.get("").toAbsolutePath();
        private String dbName = DEFAULT_DB_NAME;
        private Path canonicalRoot;
        private Path structureConfigPath;
        private Path quarantineDir;
        private int scanThreads = 8;
        private int scanBatchSize = 500;
        private boolean followSymlinks = false;
        private int executionBatchSize = 100;
        private double failureThreshold = 0.5;
        private boolean fuzzyEnabled = true;
        private double fuzzyThreshold = 0.85;
        private boolean fuzzySameFolderOnly = false;
        private long minDuplicateSize = 0;
        private List<String> preferredPaths = List.of();
        private boolean useAccessTime = false;
        private Duration classifierTimeout = Duration.ofSeconds(30);
        private double reviewThreshold = 0.70;
        private ZoneId zone = ZoneId.of("UTC");

        private Builder() {}

        public Builder dataDir(Path v) { this.dataDir = v; return this; }
        public Builder dbName(String v) { this.dbName = v; return this; }
        public Builder canonicalRoot(Path v) { this.canonicalRoot = v; return this; }
        public Builder structureConfigPath(Path v) { this.structureConfigPath = v; return this; }
        public Builder quarantineDir(Path v) { this.quarantineDir = v; return this; }
        public Builder scanThreads(int v) { this.scanThreads = v; return this; }
        public Builder scanBatchSize(int v) { this.scanBatchSize = v; return this; }
        public Builder followSymlinks(boolean v) { this.followSymlinks = v; return this; }
        public Builder executionBatchSize(int v) { this.executionBatchSize = v; return this; }
        public Builder failureThreshold(double v) { this.failureThreshold = v; return this; }
        public Builder fuzzyEnabled(boolean v) { this.fuzzyEnabled = v; return this; }
        public Builder fuzzyThreshold(double v) { this.fuzzyThreshold = v; return this; }
        public Builder fuzzySameFolderOnly(boolean v) { this.fuzzySameFolderOnly = v; return this; }
        public Builder minDuplicateSize(long v) { this.minDuplicateSize = v; return this; }
        public Builder preferredPaths(List<String> v) { this.preferredPaths = v == null ? List.of() : v; return this; }
        public Builder useAccessTime(boolean v) { this.useAccessTime = v; return this; }
        public Builder classifierTimeout(Duration v) { this.classifierTimeout = v; return this; }
        public Builder reviewThreshold(double v) { this.reviewThreshold = v; return this; }
        public Builder zone(ZoneId v) { this.zone = v; return this; }

        public Config build() {
            if (dataDir == null) throw new IllegalStateException("dataDir é obrigatório");
            try {
                Files.createDirectories(dataDir);
            } catch (IOException e) {
                throw new IllegalStateException("Não foi possível criar diretório de dados: " + dataDir, e);
            }
            return new Config(this);
        }
    }
}
