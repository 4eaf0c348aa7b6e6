package com.ordo.app.inventory;

import java.util.ArrayList;
import java.util.List;

import com.ordo.app.config.Config;

/**
 * @param threads      workers de hash
 * @param dbBatchSize  arquivos por transação do escritor
 * @param excludeGlobs globs testados contra o caminho relativo e contra cada segmento
 */
public record ScanConfig(int threads, int dbBatchSize, boolean followSymlinks, List<String> excludeGlobs) {

    public ScanConfig {
        if (threads < 1) throw new IllegalArgumentException("threads must be >= 1");
        if (dbBatchSize < 1) throw new IllegalArgumentException("dbBatchSize must be >= 1");
        excludeGlobs = excludeGlobs == null ? List.of() : List.copyOf(excludeGlobs);
    }

    public static ScanConfig defaults() {
        return new ScanConfig(8, 500, false, defaultExcludes());
    }

    public static ScanConfig from(Config config) {
        return new ScanConfig(config.getScanThreads(), config.getScanBatchSize(), config.isFollowSymlinks(),
                defaultExcludes());
    }

    public ScanConfig withExcludes(List<String> extra) {
        List<String> all = new ArrayList<>(excludeGlobs);
        all.addAll(extra);
        return new ScanConfig(threads, dbBatchSize, followSymlinks, all);
    }

    static List<String> defaultExcludes() {
        List<String> excludes = new ArrayList<>();

        excludes.addAll(List.of(
            "**/.ordo/**",
            "**/.git/**",
            "**/node_modules/**",
            "**/.venv/**",
            "**/__pycache__/**",
            ".DS_Store",
            "Thumbs.db",
            "desktop.ini",
            "~$*",
            "*.tmp",
            "*.part"
        ));

        excludes.addAll(List.of(
            "**/System Volume Information/**",
            "**/$Recycle.Bin/**",
            "**/.local/share/Trash/**"
        ));

        return List.copyOf(excludes);
    }
}
