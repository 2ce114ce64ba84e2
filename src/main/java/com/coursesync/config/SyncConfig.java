package com.coursesync.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * Raw {@code sync.*} configuration. Converted once into {@link SyncSettings}.
 */
@ConfigMapping(prefix = "sync")
public interface SyncConfig {

    String downloadDir();

    String indexDir();

    @WithDefault("4")
    int workers();

    @WithDefault("16")
    int maxWorkers();

    @WithDefault("64")
    int queueCapacity();

    Optional<String> manifest();

    Retry retry();

    Http http();

    SinkConfig sink();

    FingerprintPolicy fingerprint();

    interface Retry {
        @WithDefault("3")
        int maxAttempts();

        @WithDefault("1S")
        Duration initialBackoff();

        @WithDefault("30S")
        Duration maxBackoff();

        @WithDefault("2.0")
        double multiplier();
    }

    interface Http {
        @WithDefault("10S")
        Duration connectTimeout();

        @WithDefault("30S")
        Duration readTimeout();

        @WithDefault("course-sync/1.0")
        String userAgent();
    }

    interface SinkConfig {
        @WithDefault("8192")
        int bufferSize();
    }

    interface FingerprintPolicy {
        @WithName("default")
        Window defaultWindow();

        Map<String, Window> extensions();
    }

    interface Window {
        @WithDefault("0")
        long skip();

        @WithDefault("512")
        int read();
    }
}
