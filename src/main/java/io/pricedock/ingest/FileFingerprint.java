package io.pricedock.ingest;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Content identity of a received file. Two files with identical bytes share a fingerprint
 * regardless of name.
 */
public record FileFingerprint(String sha256, long sizeBytes, String fileName) {
    static final int CHUNK_SIZE = 8 * 1024;

    public static FileFingerprint of(Path file) {
        try {
            return new FileFingerprint(sha256(file), Files.size(file), file.getFileName().toString());
        } catch (IOException e) {
            throw new RuntimeException("Failed to fingerprint file: " + file, e);
        }
    }

    public static String sha256(Path file) throws IOException {
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

    public static String sha256Hex(String value) {
        MessageDigest digest = newDigest();
        return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
    }

    private static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
