package com.coursesync.domain;

/**
 * Lifecycle of a single job inside a worker.
 */
public enum JobState {
    PENDING,
    FINGERPRINTING,
    SKIPPING,
    DOWNLOADING,
    COMPLETED,
    FAILED
}
