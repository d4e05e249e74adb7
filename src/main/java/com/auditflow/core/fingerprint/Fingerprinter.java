package com.auditflow.core.fingerprint;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Content fingerprints for change detection. MD5 is sufficient here: the hash
 * only has to notice edits, it is not a security boundary.
 */
public final class Fingerprinter {

    private static final int CHUNK_SIZE = 8192;

    private Fingerprinter() {}

    /**
     * Hex MD5 of the file's bytes, read in 8 KiB chunks.
     *
     * @throws IOException if the file cannot be read
     */
    public static String fingerprint(Path file) throws IOException {
        MessageDigest digest = newDigest();
        byte[] buffer = new byte[CHUNK_SIZE];
        try (InputStream in = Files.newInputStream(file)) {
            int read;
            while ((read = in.read(buffer)) != -1) {
                digest.update(buffer, 0, read);
            }
        }
        return HexFormat.of().formatHex(digest.digest());
    }

    public static String fingerprint(byte[] content) {
        return HexFormat.of().formatHex(newDigest().digest(content));
    }

    private static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance("MD5");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 not available", e);
        }
    }
}
