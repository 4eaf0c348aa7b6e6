package com.ordo.app.inventory;

import java.nio.file.Path;
import java.util.Locale;

/**
 * Regras de nome de arquivo usadas por todo o registro.
 */
public final class FileNames {

    private FileNames() {}

    /** Extensão em minúsculas, sem ponto. Arquivos ocultos sem extensão ({@code .bashrc}) dão "". */
    public static String extension(String fileName) {
        if (fileName == null) return "";
        int idx = fileName.lastIndexOf('.');
        if (idx <= 0 || idx == fileName.length() - 1) return "";
        return fileName.substring(idx + 1).toLowerCase(Locale.ROOT);
    }

    public static String stem(String fileName) {
        if (fileName == null) return "";
        int idx = fileName.lastIndexOf('.');
        if (idx <= 0 || idx == fileName.length() - 1) return fileName;
        return fileName.substring(0, idx);
    }

    /** Sufixo original, com ponto e caixa preservada ("" se não houver). */
    public static String dottedSuffix(String fileName) {
        String stem = stem(fileName);
        return fileName.substring(stem.length());
    }

    public static String name(Path p) {
        Path f = p.getFileName();
        return f == null ? p.toString() : f.toString();
    }

    /** Forma textual usada como chave de caminho no registro. */
    public static String key(Path p) {
        return p.toAbsolutePath().normalize().toString();
    }
}
