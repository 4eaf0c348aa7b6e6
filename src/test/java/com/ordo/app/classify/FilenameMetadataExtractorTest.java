package com.ordo.app.classify;

import java.util.Map;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class FilenameMetadataExtractorTest {

    private final FilenameMetadataExtractor extractor = new FilenameMetadataExtractor();

    @Test
    void extractsDateAndVendor() {
        Map<String, String> m = extractor.extract("Acme_statement_2025_01_31.pdf");
        assertEquals("2025-01-31", m.get("date"));
        assertEquals("Acme", m.get("vendor_name"));
    }

    @Test
    void invalidDateIsIgnored() {
        assertFalse(extractor.extract("report_2024-13-45.pdf").containsKey("date"));
    }

    @Test
    void extractsInvoiceNumberAndVin() {
        Map<String, String> inv = extractor.extract("INV-00123.pdf");
        assertEquals("00123", inv.get("invoice_number"));

        Map<String, String> car = extractor.extract("title 1hgcm82633a004352.pdf");
        assertEquals("1HGCM82633A004352", car.get("vin"));
    }

    @Test
    void plainNameHasNoMetadata() {
        assertTrue(extractor.extract("notes.txt").isEmpty());
    }
}
