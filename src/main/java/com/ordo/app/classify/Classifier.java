package com.ordo.app.classify;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Classificador externo. Pode ser lento ou travar; quem chama impõe o timeout.
 */
@FunctionalInterface
public interface Classifier {
    ClassificationResult classify(Path file) throws IOException;
}
