package com.coursesync.fingerprint;

import com.coursesync.util.FileNames;

import java.util.HashMap;
import java.util.Map;

/**
 * Maps a file extension to the byte window used for fingerprinting.
 * Unknown extensions resolve to the default window; a lookup never fails.
 * <p>
 * Fingerprints computed under different tables are not comparable. An index written
 * before the table changed has to be deleted or rebuilt.
 */
public final class ExtensionPolicyTable {

    /**
     * Bytes {@code [skipBytes, skipBytes + readBytes)} are hashed.
     */
    public record Window(long skipBytes, int readBytes) {
        public Window {
            if (skipBytes < 0) {
                throw new IllegalArgumentException("skipBytes cannot be negative: " + skipBytes);
            }
            if (readBytes <= 0) {
                throw new IllegalArgumentException("readBytes must be positive: " + readBytes);
            }
        }
    }

    private final Map<String, Window> windows;
    private final Window defaultWindow;

    public ExtensionPolicyTable(Map<String, Window> windows, Window defaultWindow) {
        if (defaultWindow == null) {
            throw new IllegalArgumentException("defaultWindow cannot be null");
        }
        Map<String, Window> normalized = new HashMap<>();
        if (windows != null) {
            windows.forEach((extension, window) -> {
                String key = FileNames.normalizeExtension(extension);
                if (key.isEmpty()) {
                    throw new IllegalArgumentException("Extension key cannot be blank");
                }
                if (window == null) {
                    throw new IllegalArgumentException("Window for ." + key + " cannot be null");
                }
                normalized.put(key, window);
            });
        }
        this.windows = Map.copyOf(normalized);
        this.defaultWindow = defaultWindow;
    }

    public static ExtensionPolicyTable of(Window defaultWindow) {
        return new ExtensionPolicyTable(Map.of(), defaultWindow);
    }

    public Window windowFor(String extension) {
        return windows.getOrDefault(FileNames.normalizeExtension(extension), defaultWindow);
    }

    public Window defaultWindow() {
        return defaultWindow;
    }

    public Map<String, Window> windows() {
        return windows;
    }

    @Override
    public String toString() {
        return "ExtensionPolicyTable" + windows + " default=" + defaultWindow;
    }
}
