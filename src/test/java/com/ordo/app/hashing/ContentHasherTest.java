package com.ordo.app.hashing;

import java.io.ByteArrayInputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.*;

public class ContentHasherTest {

    private static final String EMPTY_SHA256 = "e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855";

    @Test
    void emptyInputHasWellDefinedDigest() throws Exception {
        assertEquals(EMPTY_SHA256, ContentHasher.fullHash(new ByteArrayInputStream(new byte[0])));
        assertEquals(EMPTY_SHA256, ContentHasher.quickHash(new ByteArrayInputStream(new byte[0])));
    }

    @Test
    void knownDigestIsLowercaseHex() throws Exception {
        String h = ContentHasher.fullHash(new ByteArrayInputStream("abc".getBytes()));
        assertEquals("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad", h);
    }

    @Test
    void fileOfExactlyOneMebibyteHasSameQuickAndFullHash(@TempDir Path tmp) throws Exception {
        byte[] data = new byte[ContentHasher.QUICK_HASH_BYTES];
        Arrays.fill(data, (byte) 7);
        Path file = Files.write(tmp.resolve("exact.bin"), data);

        assertTrue(ContentHasher.quickHashCoversWholeFile(Files.size(file)));
        assertEquals(ContentHasher.fullHash(file), ContentHasher.quickHash(file));
    }

    @Test
    void quickHashOnlyLooksAtPrefix(@TempDir Path tmp) throws Exception {
        byte[] a = new byte[ContentHasher.QUICK_HASH_BYTES + 10];
        byte[] b = a.clone();
        b[b.length - 1] = 1;
        Path fa = Files.write(tmp.resolve("a.bin"), a);
        Path fb = Files.write(tmp.resolve("b.bin"), b);

        assertFalse(ContentHasher.quickHashCoversWholeFile(Files.size(fa)));
        assertEquals(ContentHasher.quickHash(fa), ContentHasher.quickHash(fb));
        assertNotEquals(ContentHasher.fullHash(fa), ContentHasher.fullHash(fb));
        assertNotEquals(ContentHasher.quickHash(fa), ContentHasher.fullHash(fa));
    }
}
