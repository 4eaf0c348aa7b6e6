package com.ordo.app.dedup;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

import com.ordo.app.inventory.FileNames;

/**
 * Remove do nome os marcadores típicos de cópia (contadores, "copy", "backup",
 * datas, versões, "final") para comparar nomes por similaridade.
 */
public final class FilenameNormalizer {

    private static final List<Pattern> NOISE = List.of(
            Pattern.compile("\\s*\\(\\d+\\)"),
            Pattern.compile("\\s*-\\s*copy\\s*\\d*", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\s*_copy\\s*\\d*", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\s*_backup\\s*\\d*", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\s*\\d{4}-\\d{2}-\\d{2}"),
            Pattern.compile("\\s*\\d{8}"),
            Pattern.compile("\\s*_v\\d+", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\s*\\bv\\d+", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\s*_final\\s*", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\s*\\(final\\)", Pattern.CASE_INSENSITIVE)
    );

    private FilenameNormalizer() {}

    /** Normaliza o nome sem a extensão; a comparação já acontece dentro da mesma extensão. */
    public static String normalize(String fileName) {
        String name = FileNames.stem(fileName);
        for (Pattern p : NOISE) {
            name = p.matcher(name).replaceAll("");
        }
        return name.toLowerCase(Locale.ROOT).strip();
    }

    /**
     * {@code 1 - distância / max(len)}; 1.0 para nomes iguais (inclusive ambos vazios).
     */
    public static double similarity(String a, String b) {
        int max = Math.max(a.length(), b.length());
        if (max == 0) return 1.0;
        return 1.0 - ((double) levenshtein(a, b) / max);
    }

    static int levenshtein(String a, String b) {
        int[] prev = new int[b.length() + 1];
        int[] curr = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) prev[j] = j;

        for (int i = 1; i <= a.length(); i++) {
            curr[0] = i;
            for (int j = 1; j <= b.length(); j++) {
                int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                curr[j] = Math.min(Math.min(curr[j - 1] + 1, prev[j] + 1), prev[j - 1] + cost);
            }
            int[] tmp = prev;
            prev = curr;
            curr = tmp;
        }
        return prev[b.length()];
    }
}
