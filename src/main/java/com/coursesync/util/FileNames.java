package com.coursesync.util;

import java.util.Locale;

/**
 * Helpers for turning portal-provided names into safe local path segments.
 */
public final class FileNames {

    private static final String FORBIDDEN = "<>:\"/\\|?*";

    private FileNames() {
        // Utility class
    }

    /**
     * Last segment of a {@code /} or {@code \} separated path.
     */
    public static String extractFilename(String path) {
        int lastSep = Math.max(path.lastIndexOf('/'), path.lastIndexOf('\\'));
        return lastSep >= 0 ? path.substring(lastSep + 1) : path;
    }

    /**
     * Extension of a file name without the dot, lower case, {@code ""} if there is none.
     * Leading dots of hidden files do not count.
     */
    public static String extensionOf(String fileName) {
        String name = extractFilename(fileName);
        int dot = name.lastIndexOf('.');
        if (dot <= 0 || dot == name.length() - 1) {
            return "";
        }
        return name.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    public static String normalizeExtension(String extension) {
        if (extension == null) {
            return "";
        }
        String trimmed = extension.trim();
        while (trimmed.startsWith(".")) {
            trimmed = trimmed.substring(1);
        }
        return trimmed.toLowerCase(Locale.ROOT);
    }

    /**
     * Replaces characters that are invalid in file names on common filesystems.
     */
    public static String sanitize(String name) {
        StringBuilder out = new StringBuilder(name.length());
        for (char c : name.trim().toCharArray()) {
            out.append(c < 0x20 || FORBIDDEN.indexOf(c) >= 0 ? '_' : c);
        }
        // Windows drops trailing dots and spaces
        int end = out.length();
        while (end > 0 && (out.charAt(end - 1) == '.' || out.charAt(end - 1) == ' ')) {
            end--;
        }
        String result = out.substring(0, end);
        if (result.isEmpty()) {
            return "_";
        }
        return result;
    }

    /**
     * Sanitizes each segment of a relative directory, dropping empty and {@code .} segments.
     */
    public static String sanitizeDirectory(String directory) {
        if (directory == null || directory.isBlank()) {
            return "";
        }
        StringBuilder out = new StringBuilder();
        for (String segment : directory.split("[/\\\\]")) {
            if (segment.isBlank() || segment.equals(".")) {
                continue;
            }
            if (out.length() > 0) {
                out.append('/');
            }
            out.append(sanitize(segment));
        }
        return out.toString();
    }

    /**
     * {@code report.pdf} with n = 2 becomes {@code report (2).pdf}.
     */
    public static String withCounter(String fileName, int n) {
        int dot = fileName.lastIndexOf('.');
        if (dot <= 0) {
            return fileName + " (" + n + ")";
        }
        return fileName.substring(0, dot) + " (" + n + ")" + fileName.substring(dot);
    }
}
