package eu.virtualparadox.helpindex.util;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * SHA-256 content fingerprints, rendered as lowercase hex.
 */
public final class Fingerprints {

    private static final String ALGORITHM = "SHA-256";
    private static final int BUFFER_SIZE = 64 * 1024;

    private Fingerprints() {
        // prevent instantiation
    }

    public static String sha256(final byte[] bytes) {
        return HexFormat.of().formatHex(newDigest().digest(bytes));
    }

    public static String sha256(final String text) {
        return sha256(text.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Streams the file through the digest, so large structure documents are not held in memory.
     *
     * @param file file to fingerprint
     * @return hex digest of the file bytes
     * @throws IOException if the file cannot be read
     */
    public static String sha256(final Path file) throws IOException {
        final MessageDigest digest = newDigest();
        try (InputStream in = Files.newInputStream(file)) {
            final byte[] buffer = new byte[BUFFER_SIZE];
            int read;
            while ((read = in.read(buffer)) != -1) {
                digest.update(buffer, 0, read);
            }
        }
        return HexFormat.of().formatHex(digest.digest());
    }

    private static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance(ALGORITHM);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(ALGORITHM + " is not available", e);
        }
    }
}
