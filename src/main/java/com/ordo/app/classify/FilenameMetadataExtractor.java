package com.ordo.app.classify;

import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.ordo.app.inventory.FileNames;

/**
 * Extrai entidades só do nome do arquivo: data, número de fatura, fornecedor e VIN.
 */
public final class FilenameMetadataExtractor implements MetadataExtractor {

    private static final Pattern DATE = Pattern.compile("(\\d{4})[-_](\\d{2})[-_](\\d{2})");
    private static final Pattern INVOICE = Pattern.compile("(?:invoice|inv|#)[\\s_-]*([A-Z0-9\\-]+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern VENDOR = Pattern.compile("^([A-Za-z]+)_");
    private static final Pattern VIN = Pattern.compile("\\b([A-HJ-NPR-Z0-9]{17})\\b", Pattern.CASE_INSENSITIVE);

    @Override
    public Map<String, String> extract(Path file) {
        return extract(FileNames.name(file));
    }

    public Map<String, String> extract(String fileName) {
        Map<String, String> out = new LinkedHashMap<>();
        String stem = FileNames.stem(fileName);

        Matcher d = DATE.matcher(stem);
        if (d.find()) {
            LocalDate date = toDate(d);
            if (date != null) out.put("date", date.toString());
        }

        Matcher inv = INVOICE.matcher(stem);
        if (inv.find()) {
            String number = inv.group(1).replaceAll("^-+|-+$", "");
            if (!number.isEmpty()) out.put("invoice_number", number);
        }

        Matcher v = VENDOR.matcher(stem);
        if (v.find()) out.put("vendor_name", v.group(1));

        Matcher vin = VIN.matcher(stem);
        if (vin.find()) out.put("vin", vin.group(1).toUpperCase(java.util.Locale.ROOT));

        return out;
    }

    /** {@code null} para combinações inválidas como 2024-13-45. */
    private static LocalDate toDate(Matcher m) {
        try {
            return LocalDate.of(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)), Integer.parseInt(m.group(3)));
        } catch (DateTimeException e) {
            return null;
        }
    }
}
