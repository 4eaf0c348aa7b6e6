package com.ordo.app.classify;

import java.util.Objects;

import com.ordo.app.database.ClassificationMethod;

/**
 * Saída validada do classificador.
 */
public record ClassificationResult(String documentType, double confidence, ClassificationMethod method) {

    public ClassificationResult {
        if (documentType == null || documentType.isBlank()) {
            throw new IllegalArgumentException("documentType must not be blank");
        }
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be within 0..1: " + confidence);
        }
        Objects.requireNonNull(method, "method");
        documentType = documentType.strip();
    }
}
