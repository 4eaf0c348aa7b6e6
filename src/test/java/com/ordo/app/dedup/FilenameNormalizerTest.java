package com.ordo.app.dedup;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class FilenameNormalizerTest {

    @Test
    void stripsCopyMarkers() {
        assertEquals("report", FilenameNormalizer.normalize("Report (1).pdf"));
        assertEquals("report", FilenameNormalizer.normalize("report - Copy.pdf"));
        assertEquals("report", FilenameNormalizer.normalize("report_copy2.pdf"));
        assertEquals("report", FilenameNormalizer.normalize("report_backup.pdf"));
        assertEquals("report", FilenameNormalizer.normalize("report 2024-03-01.pdf"));
        assertEquals("report", FilenameNormalizer.normalize("report_v3.pdf"));
        assertEquals("report", FilenameNormalizer.normalize("report_final.pdf"));
    }

    @Test
    void similarityIsOneMinusNormalizedDistance() {
        assertEquals(1.0, FilenameNormalizer.similarity("abc", "abc"), 1e-9);
        assertEquals(1.0, FilenameNormalizer.similarity("", ""), 1e-9);
        assertEquals(0.75, FilenameNormalizer.similarity("test", "tent"), 1e-9);
        assertEquals(0.0, FilenameNormalizer.similarity("abc", ""), 1e-9);
    }

    @Test
    void levenshteinDistance() {
        assertEquals(3, FilenameNormalizer.levenshtein("kitten", "sitting"));
        assertEquals(0, FilenameNormalizer.levenshtein("", ""));
        assertEquals(4, FilenameNormalizer.levenshtein("", "abcd"));
    }
}
