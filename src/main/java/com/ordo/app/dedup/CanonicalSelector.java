package com.ordo.app.dedup;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import com.ordo.app.database.FileRecord;
import com.ordo.app.inventory.FileNames;

/**
 * Escolhe o arquivo autoritativo de um grupo por pontuação aditiva.
 * Determinística: mesma entrada, mesmo vencedor; empate vai para o menor file_id.
 */
public final class CanonicalSelector {

    static final double NEWEST_BONUS = 10.0;
    static final double PREFERRED_BONUS = 20.0;
    static final double DEPTH_WEIGHT = 10.0;
    static final double CLEAN_NAME_BONUS = 5.0;
    static final double ACCESS_WEIGHT = 15.0;

    private static final Pattern LOW_QUALITY = Pattern.compile("(?i)(copy|backup|\\(\\d+\\)|~)");

    private final List<Path> preferredPrefixes;
    private final boolean useAccessTime;

    public CanonicalSelector(List<String> preferredPaths, boolean useAccessTime) {
        List<Path> prefixes = new ArrayList<>();
        for (String p : preferredPaths) {
            if (p == null || p.isBlank()) continue;
            prefixes.add(Paths.get(p.strip()).toAbsolutePath().normalize());
        }
        this.preferredPrefixes = List.copyOf(prefixes);
        this.useAccessTime = useAccessTime;
    }

    public record Selection(FileRecord winner, Map<Long, Double> scores) {}

    public Selection select(List<FileRecord> members) {
        if (members.isEmpty()) throw new IllegalArgumentException("empty group");

        List<FileRecord> sorted = new ArrayList<>(members);
        sorted.sort(Comparator.comparingLong(FileRecord::fileId));

        Map<Long, Double> scores = new HashMap<>();
        for (FileRecord r : sorted) scores.put(r.fileId(), 0.0);

        // mais recente; empate fica com o primeiro registrado
        FileRecord newest = sorted.get(0);
        for (FileRecord r : sorted) {
            if (r.modifiedMillis() > newest.modifiedMillis()) newest = r;
        }
        scores.merge(newest.fileId(), NEWEST_BONUS, Double::sum);

        int maxDepth = 0;
        for (FileRecord r : sorted) maxDepth = Math.max(maxDepth, depth(r));

        for (FileRecord r : sorted) {
            Path location = r.locationPath().toAbsolutePath().normalize();
            double s = 0.0;
            if (isPreferred(location)) s += PREFERRED_BONUS;
            s += depthScore(depth(r), maxDepth);
            if (!LOW_QUALITY.matcher(FileNames.name(location)).find()) s += CLEAN_NAME_BONUS;
            scores.merge(r.fileId(), s, Double::sum);
        }

        if (useAccessTime && sorted.size() > 1 && sorted.stream().allMatch(r -> r.accessedMillis() != null)) {
            List<FileRecord> byAccess = new ArrayList<>(sorted);
            byAccess.sort(Comparator.comparingLong((FileRecord r) -> r.accessedMillis()).reversed()
                    .thenComparingLong(FileRecord::fileId));
            int n = byAccess.size();
            for (int rank = 0; rank < n; rank++) {
                double bonus = ACCESS_WEIGHT * (n - 1 - rank) / (n - 1);
                scores.merge(byAccess.get(rank).fileId(), bonus, Double::sum);
            }
        }

        FileRecord winner = sorted.get(0);
        for (FileRecord r : sorted) {
            if (scores.get(r.fileId()) > scores.get(winner.fileId())) winner = r;
        }
        return new Selection(winner, scores);
    }

    static double depthScore(int depth, int maxDepth) {
        if (maxDepth == 0) return DEPTH_WEIGHT;
        return Math.max(0.0, DEPTH_WEIGHT * (1.0 - (double) depth / maxDepth));
    }

    /** Número de diretórios acima do arquivo. */
    static int depth(FileRecord r) {
        Path p = r.locationPath().toAbsolutePath().normalize();
        return Math.max(0, p.getNameCount() - 1);
    }

    private boolean isPreferred(Path location) {
        for (Path prefix : preferredPrefixes) {
            if (location.startsWith(prefix)) return true;
        }
        return false;
    }
}
