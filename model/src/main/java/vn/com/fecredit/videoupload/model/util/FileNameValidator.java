package vn.com.fecredit.videoupload.model.util;

import java.util.Locale;

/**
 * Checks client supplied filenames and derives storage-safe names from them.
 *
 * <p>
 * Declared filenames are only metadata: they never become a path on their own. The
 * stored artifact uses a generated name plus the declared extension.
 */
public class FileNameValidator {
    private static final int MAX_EXTENSION_LENGTH = 10;

    public static boolean isValidFileName(String fileName) {
        if (fileName == null || fileName.trim().isEmpty() || fileName.length() > 255) {
            return false;
        }
        if (fileName.equals(".") || fileName.equals("..")) {
            return false;
        }
        // Separators of either platform and NUL are never part of a bare filename
        return fileName.indexOf('/') < 0 && fileName.indexOf('\\') < 0 && fileName.indexOf('\0') < 0;
    }

    /**
     * Returns the lowercase extension including the dot (".mp4"), or an empty string
     * when the name has none or it is not plain alphanumeric.
     */
    public static String extensionOf(String fileName) {
        if (fileName == null) {
            return "";
        }
        int dot = fileName.lastIndexOf('.');
        if (dot <= 0 || dot == fileName.length() - 1) {
            return "";
        }
        String ext = fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
        if (ext.length() > MAX_EXTENSION_LENGTH || !ext.chars().allMatch(Character::isLetterOrDigit)) {
            return "";
        }
        return "." + ext;
    }

    /**
     * Maps an arbitrary identifier (an owner id, for instance) to a single safe path
     * segment: letters, digits, '-', '_' and '.' are kept, anything else becomes '_'.
     */
    public static String toPathSegment(String value) {
        if (value == null || value.isEmpty()) {
            return "_";
        }
        StringBuilder sb = new StringBuilder(value.length());
        for (char c : value.toCharArray()) {
            boolean safe = (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9')
                    || c == '-' || c == '_' || c == '.';
            sb.append(safe ? c : '_');
        }
        String segment = sb.toString();
        return segment.chars().allMatch(c -> c == '.') ? "_" : segment;
    }
}
