package com.provenant.core.storage;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.regex.Pattern;

/**
 * SHA-256 helpers. Every digest Provenant hands out is {@code sha256:} followed by 64
 * lowercase hex characters.
 */
public final class ArtifactDigests {

    public static final String PREFIX = "sha256:";

    private static final Pattern DIGEST = Pattern.compile("^sha256:[0-9a-f]{64}$");

    private ArtifactDigests() {}

    public static String of(byte[] bytes) {
        return PREFIX + sha256Hex(bytes);
    }

    public static String of(Path file) {
        MessageDigest md = newSha256();
        byte[] buffer = new byte[64 * 1024];
        try (InputStream in = Files.newInputStream(file)) {
            int read;
            while ((read = in.read(buffer)) != -1) {
                md.update(buffer, 0, read);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to hash " + file, e);
        }
        return PREFIX + HexFormat.of().formatHex(md.digest());
    }

    public static String sha256Hex(byte[] bytes) {
        return HexFormat.of().formatHex(newSha256().digest(bytes));
    }

    public static boolean isValid(String digest) {
        return digest != null && DIGEST.matcher(digest).matches();
    }

    /** Hex part of a well-formed digest. */
    public static String hex(String digest) {
        if (!isValid(digest)) {
            throw new IllegalArgumentException("Malformed digest: " + digest);
        }
        return digest.substring(PREFIX.length());
    }

    public static MessageDigest newSha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
