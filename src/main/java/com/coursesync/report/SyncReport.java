package com.coursesync.report;

import com.coursesync.domain.JobResult;
import com.coursesync.domain.JobState;
import com.coursesync.domain.RemoteFile;
import com.coursesync.orchestration.JobListener;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.LongAdder;

/**
 * Aggregates job outcomes of one run. Results may arrive from any worker in any order.
 */
public class SyncReport implements JobListener {

    private static final Logger LOG = Logger.getLogger(SyncReport.class);

    private final LongAdder downloaded = new LongAdder();
    private final LongAdder skipped = new LongAdder();
    private final LongAdder failed = new LongAdder();
    private final LongAdder bytesTransferred = new LongAdder();
    private final Map<JobState, LongAdder> entered = new EnumMap<>(JobState.class);
    private final Queue<JobResult> failures = new ConcurrentLinkedQueue<>();

    private final Instant startedAt = Instant.now();
    private volatile Instant finishedAt;
    private volatile Throwable enumerationFailure;

    public SyncReport() {
        for (JobState state : JobState.values()) {
            entered.put(state, new LongAdder());
        }
    }

    @Override
    public void onTransition(RemoteFile job, JobState from, JobState to) {
        entered.get(to).increment();
    }

    @Override
    public void onResult(JobResult result) {
        switch (result.outcome()) {
            case DOWNLOADED -> {
                downloaded.increment();
                bytesTransferred.add(result.bytesTransferred());
            }
            case SKIPPED_DUPLICATE -> skipped.increment();
            case FAILED -> {
                failed.increment();
                failures.add(result);
            }
        }
    }

    public void enumerationFailed(Throwable cause) {
        this.enumerationFailure = cause;
    }

    public void finish() {
        this.finishedAt = Instant.now();
    }

    public long downloaded() {
        return downloaded.sum();
    }

    public long skipped() {
        return skipped.sum();
    }

    public long failed() {
        return failed.sum();
    }

    public long total() {
        return downloaded() + skipped() + failed();
    }

    public long bytesTransferred() {
        return bytesTransferred.sum();
    }

    /**
     * How many jobs entered the given state, for example {@link JobState#DOWNLOADING}.
     */
    public long transitionsInto(JobState state) {
        return entered.get(state).sum();
    }

    public List<JobResult> failures() {
        return new ArrayList<>(failures);
    }

    public Throwable enumerationFailure() {
        return enumerationFailure;
    }

    public boolean hasFailures() {
        return failed() > 0 || enumerationFailure != null;
    }

    public Duration elapsed() {
        Instant end = finishedAt != null ? finishedAt : Instant.now();
        return Duration.between(startedAt, end);
    }

    public String summary() {
        return String.format("%d downloaded, %d skipped, %d failed", downloaded(), skipped(), failed());
    }

    public void log() {
        LOG.infof("Sync finished in %d ms: %s (%d bytes transferred)",
                elapsed().toMillis(), summary(), bytesTransferred());
        for (JobResult failure : failures) {
            LOG.warnf("  failed %s [%s]: %s", failure.job(), failure.failureReason(), failure.message());
        }
        if (enumerationFailure != null) {
            LOG.errorf(enumerationFailure, "File enumeration aborted early");
        }
    }

    @Override
    public String toString() {
        return summary();
    }
}
