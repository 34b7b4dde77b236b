package vn.com.fecredit.videoupload.model.util;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

public class ChecksumUtil {
    private static final int BUFFER_SIZE = 64 * 1024;

    /**
     * Generates a SHA-256 checksum from the given byte array.
     * @param data the byte array to checksum
     * @return the checksum as a lowercase hex string
     */
    public static String generateChecksum(byte[] data) {
        return bytesToHex(newDigest().digest(data));
    }

    /**
     * Generates a SHA-256 checksum of the UTF-8 bytes of a string.
     */
    public static String generateChecksum(String text) {
        return generateChecksum(text.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Generates a SHA-256 checksum from the file at the given path, streaming it so
     * large video files are never loaded whole.
     * @param filePath the path to the file
     * @return the checksum as a lowercase hex string
     */
    public static String generateChecksum(Path filePath) {
        MessageDigest digest = newDigest();
        byte[] buffer = new byte[BUFFER_SIZE];
        try (InputStream in = Files.newInputStream(filePath)) {
            int read;
            while ((read = in.read(buffer)) != -1) {
                digest.update(buffer, 0, read);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read file for checksum: " + filePath, e);
        }
        return bytesToHex(digest.digest());
    }

    /**
     * Compares two hex checksums ignoring case.
     */
    public static boolean matches(String expected, String actual) {
        return expected != null && actual != null && expected.equalsIgnoreCase(actual);
    }

    private static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }

    private static String bytesToHex(byte[] bytes) {
        StringBuilder sb = new StringBuilder(bytes.length * 2);
        for (byte b : bytes) {
            sb.append(String.format("%02x", b));
        }
        return sb.toString();
    }
}
