package com.ordo.app.classify;

import java.nio.file.Path;
import java.util.Map;

import com.ordo.app.database.ClassificationMethod;
import com.ordo.app.inventory.FileNames;

/**
 * Classificador de referência pela extensão. Extensões desconhecidas saem com
 * confiança baixa e caem em revisão.
 */
public final class ExtensionClassifier implements Classifier {

    private static final double KNOWN_CONFIDENCE = 0.75;
    private static final double UNKNOWN_CONFIDENCE = 0.30;

    private static final Map<String, String> TYPES = Map.ofEntries(
            Map.entry("pdf", "document_pdf"),
            Map.entry("doc", "document_text"),
            Map.entry("docx", "document_text"),
            Map.entry("odt", "document_text"),
            Map.entry("txt", "document_text"),
            Map.entry("md", "document_text"),
            Map.entry("xls", "document_spreadsheet"),
            Map.entry("xlsx", "document_spreadsheet"),
            Map.entry("csv", "document_spreadsheet"),
            Map.entry("ppt", "document_presentation"),
            Map.entry("pptx", "document_presentation"),
            Map.entry("jpg", "media_image"),
            Map.entry("jpeg", "media_image"),
            Map.entry("png", "media_image"),
            Map.entry("gif", "media_image"),
            Map.entry("heic", "media_image"),
            Map.entry("mp4", "media_video"),
            Map.entry("mov", "media_video"),
            Map.entry("mp3", "media_audio"),
            Map.entry("wav", "media_audio"),
            Map.entry("zip", "archive_compressed"),
            Map.entry("7z", "archive_compressed"),
            Map.entry("java", "technical_source"),
            Map.entry("py", "technical_source")
    );

    @Override
    public ClassificationResult classify(Path file) {
        String ext = FileNames.extension(FileNames.name(file));
        String type = TYPES.get(ext);
        if (type == null) {
            return new ClassificationResult("unknown", UNKNOWN_CONFIDENCE, ClassificationMethod.EXTENSION);
        }
        return new ClassificationResult(type, KNOWN_CONFIDENCE, ClassificationMethod.EXTENSION);
    }
}
