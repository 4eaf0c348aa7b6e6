package com.ordo.app.classify;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;

/**
 * Fornece entidades (datas, números de fatura, fornecedor...) usadas como variáveis de template.
 */
@FunctionalInterface
public interface MetadataExtractor {
    Map<String, String> extract(Path file) throws IOException;
}
