package com.coursesync.config;

import com.coursesync.fingerprint.ExtensionPolicyTable;
import com.coursesync.fingerprint.ExtensionPolicyTable.Window;
import com.coursesync.orchestration.RetryPolicy;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Immutable settings built once at startup and handed to every component.
 */
public record SyncSettings(
        Path downloadDir,
        Path indexDir,
        int workers,
        int maxWorkers,
        int queueCapacity,
        RetryPolicy retry,
        Http http,
        int bufferSize,
        ExtensionPolicyTable extensionPolicy,
        Path manifest
) {
    public record Http(Duration connectTimeout, Duration readTimeout, String userAgent) {
        public static Http defaults() {
            return new Http(Duration.ofSeconds(10), Duration.ofSeconds(30), "course-sync/1.0");
        }
    }

    public SyncSettings {
        if (downloadDir == null || indexDir == null) {
            throw new IllegalArgumentException("downloadDir and indexDir are required");
        }
        if (maxWorkers < 1) {
            throw new IllegalArgumentException("maxWorkers must be at least 1: " + maxWorkers);
        }
        if (workers < 1 || workers > maxWorkers) {
            throw new IllegalArgumentException("workers must be between 1 and " + maxWorkers + ": " + workers);
        }
        if (queueCapacity < 1) {
            throw new IllegalArgumentException("queueCapacity must be at least 1: " + queueCapacity);
        }
        if (bufferSize < 512) {
            throw new IllegalArgumentException("bufferSize must be at least 512: " + bufferSize);
        }
        if (retry == null || http == null || extensionPolicy == null) {
            throw new IllegalArgumentException("retry, http and extensionPolicy are required");
        }
    }

    public static SyncSettings from(SyncConfig config) {
        Map<String, Window> windows = new HashMap<>();
        config.fingerprint().extensions()
                .forEach((ext, w) -> windows.put(ext, new Window(w.skip(), w.read())));
        SyncConfig.Window defaults = config.fingerprint().defaultWindow();

        return new SyncSettings(
                Paths.get(config.downloadDir()),
                Paths.get(config.indexDir()),
                config.workers(),
                config.maxWorkers(),
                config.queueCapacity(),
                new RetryPolicy(
                        config.retry().maxAttempts(),
                        config.retry().initialBackoff(),
                        config.retry().maxBackoff(),
                        config.retry().multiplier()
                ),
                new Http(
                        config.http().connectTimeout(),
                        config.http().readTimeout(),
                        config.http().userAgent()
                ),
                config.sink().bufferSize(),
                new ExtensionPolicyTable(windows, new Window(defaults.skip(), defaults.read())),
                config.manifest().map(Paths::get).orElse(null)
        );
    }

    /**
     * Settings rooted at one directory, with downloads in {@code courses/} and the
     * index in {@code .index/}. Used for embedding and tests.
     */
    public static SyncSettings rootedAt(Path root, ExtensionPolicyTable extensionPolicy) {
        return new SyncSettings(
                root.resolve("courses"),
                root.resolve(".index"),
                4,
                16,
                64,
                RetryPolicy.defaults(),
                Http.defaults(),
                8192,
                extensionPolicy,
                null
        );
    }

    public SyncSettings withWorkers(int newWorkers) {
        return new SyncSettings(downloadDir, indexDir, newWorkers, Math.max(maxWorkers, newWorkers),
                queueCapacity, retry, http, bufferSize, extensionPolicy, manifest);
    }

    public SyncSettings withQueueCapacity(int newCapacity) {
        return new SyncSettings(downloadDir, indexDir, workers, maxWorkers,
                newCapacity, retry, http, bufferSize, extensionPolicy, manifest);
    }

    public SyncSettings withRetry(RetryPolicy newRetry) {
        return new SyncSettings(downloadDir, indexDir, workers, maxWorkers,
                queueCapacity, newRetry, http, bufferSize, extensionPolicy, manifest);
    }
}
