package com.ordo.app.hashing;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * SHA-256 em hex minúsculo. Sem estado; leitura sequencial com buffer fixo,
 * então arquivos maiores que a memória são suportados.
 */
public final class ContentHasher {

    /** Tamanho do prefixo coberto pelo hash rápido. */
    public static final int QUICK_HASH_BYTES = 1024 * 1024;

    private static final int BUFFER_SIZE = 64 * 1024;

    private ContentHasher() {}

    /** Hash dos primeiros {@link #QUICK_HASH_BYTES} bytes do fluxo (ou de todo ele, se menor). */
    public static String quickHash(InputStream in) throws IOException {
        return digest(in, QUICK_HASH_BYTES);
    }

    public static String fullHash(InputStream in) throws IOException {
        return digest(in, Long.MAX_VALUE);
    }

    public static String quickHash(Path file) throws IOException {
        try (InputStream in = Files.newInputStream(file)) {
            return quickHash(in);
        }
    }

    public static String fullHash(Path file) throws IOException {
        try (InputStream in = Files.newInputStream(file)) {
            return fullHash(in);
        }
    }

    /** Para arquivos até 1 MiB o hash rápido já é o hash completo. */
    public static boolean quickHashCoversWholeFile(long sizeBytes) {
        return sizeBytes <= QUICK_HASH_BYTES;
    }

    private static String digest(InputStream in, long limit) throws IOException {
        MessageDigest digest = newDigest();
        byte[] buffer = new byte[BUFFER_SIZE];
        long remaining = limit;
        while (remaining > 0) {
            int toRead = (int) Math.min(buffer.length, remaining);
            int n = in.read(buffer, 0, toRead);
            if (n == -1) break;
            digest.update(buffer, 0, n);
            remaining -= n;
        }
        return HexFormat.of().formatHex(digest.digest());
    }

    private static MessageDigest newDigest() throws IOException {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IOException("Algoritmo SHA-256 indisponível.", e);
        }
    }
}
