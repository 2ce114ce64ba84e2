package com.coursesync.domain;

import java.nio.file.Path;

/**
 * Outcome of one job. Exactly one is produced per claimed job.
 */
public record JobResult(
        RemoteFile job,
        Outcome outcome,
        FailureReason failureReason,
        String message,
        Path savedTo,
        long bytesTransferred,
        Fingerprint fingerprint
) {
    public enum Outcome {
        DOWNLOADED,
        SKIPPED_DUPLICATE,
        FAILED
    }

    public enum FailureReason {
        FETCH,
        STORAGE,
        CANCELLED
    }

    public static JobResult downloaded(RemoteFile job, Fingerprint fingerprint, Path savedTo, long bytes) {
        return new JobResult(job, Outcome.DOWNLOADED, null, null, savedTo, bytes, fingerprint);
    }

    public static JobResult skipped(RemoteFile job, Fingerprint fingerprint, String reason) {
        return new JobResult(job, Outcome.SKIPPED_DUPLICATE, null, reason, null, 0, fingerprint);
    }

    public static JobResult failed(RemoteFile job, Fingerprint fingerprint, FailureReason reason, String error) {
        return new JobResult(job, Outcome.FAILED, reason, error, null, 0, fingerprint);
    }

    public boolean isFailure() {
        return outcome == Outcome.FAILED;
    }
}
