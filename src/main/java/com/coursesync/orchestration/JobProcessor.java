package com.coursesync.orchestration;

import com.coursesync.domain.Fingerprint;
import com.coursesync.domain.JobResult;
import com.coursesync.domain.JobResult.FailureReason;
import com.coursesync.domain.JobState;
import com.coursesync.domain.RemoteFile;
import com.coursesync.error.CancelledException;
import com.coursesync.error.FetchException;
import com.coursesync.error.IndexException;
import com.coursesync.error.StorageException;
import com.coursesync.fingerprint.FingerprintEngine;
import com.coursesync.index.FingerprintIndex;
import com.coursesync.sink.Sink;
import com.coursesync.sink.Sink.StoredFile;
import com.coursesync.source.LocalFileSource;
import com.coursesync.util.FileNames;
import com.coursesync.util.StopSignal;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Runs one job through fingerprint, index check and download-or-skip.
 * Every failure is contained in the returned {@link JobResult}; nothing escapes to the worker.
 */
public class JobProcessor {

    private static final Logger LOG = Logger.getLogger(JobProcessor.class);

    private final FingerprintEngine engine;
    private final FingerprintIndex index;
    private final Sink sink;
    private final RetryPolicy retry;

    public JobProcessor(FingerprintEngine engine, FingerprintIndex index, Sink sink, RetryPolicy retry) {
        this.engine = engine;
        this.index = index;
        this.sink = sink;
        this.retry = retry;
    }

    public JobResult process(RemoteFile job, StopSignal stop, JobListener listener) {
        Tracker tracker = new Tracker(job, listener);
        Fingerprint fingerprint = null;
        try {
            tracker.moveTo(JobState.FINGERPRINTING);
            LOG.debugf("Fingerprinting %s", job);
            Fingerprint fp = retry.execute("fingerprint of " + job, () -> engine.fingerprint(job, stop), stop);
            fingerprint = fp;

            if (index.contains(job.course(), fp)) {
                return skip(tracker, fp, "Already downloaded");
            }
            if (presentLocally(job, fp, stop)) {
                index.insert(job.course(), fp);
                return skip(tracker, fp, "Present locally");
            }

            tracker.moveTo(JobState.DOWNLOADING);
            StoredFile stored = retry.execute("download of " + job, () -> download(job, stop), stop);

            // only a durably written file may enter the index
            index.insert(job.course(), fp);
            tracker.moveTo(JobState.COMPLETED);

            LOG.infof("Downloaded %s → %s (%d bytes)", job.source().describe(), stored.path(), stored.bytes());
            return JobResult.downloaded(job, fp, stored.path(), stored.bytes());

        } catch (CancelledException e) {
            LOG.infof("Cancelled %s while %s", job, tracker.state());
            return fail(tracker, fingerprint, FailureReason.CANCELLED, e.getMessage());
        } catch (StorageException | IndexException e) {
            LOG.errorf(e, "Storage failure for %s", job);
            return fail(tracker, fingerprint, FailureReason.STORAGE, e.getMessage());
        } catch (FetchException e) {
            LOG.errorf("Failed to fetch %s: %s", job, e.getMessage());
            return fail(tracker, fingerprint, FailureReason.FETCH, e.getMessage());
        } catch (IOException | RuntimeException e) {
            LOG.errorf(e, "Unexpected failure for %s", job);
            return fail(tracker, fingerprint, FailureReason.FETCH, String.valueOf(e.getMessage()));
        }
    }

    private StoredFile download(RemoteFile job, StopSignal stop) throws IOException {
        try (InputStream in = job.source().openFull(stop)) {
            return sink.write(job.destinationPath(), in, stop);
        }
    }

    /**
     * True if the destination, or one of the {@code name (n).ext} copies the sink creates on
     * name collisions, already holds content with the same fingerprint. Happens after the
     * index was lost or the file was downloaded by hand. Copies are checked up to the first
     * missing counter.
     */
    private boolean presentLocally(RemoteFile job, Fingerprint fp, StopSignal stop) throws CancelledException {
        Path existing = sink.resolve(job.destinationPath());
        String fileName = existing.getFileName().toString();
        for (int n = 1; Files.isRegularFile(existing); n++) {
            if (sameContent(existing, job, fp, stop)) {
                return true;
            }
            existing = existing.resolveSibling(FileNames.withCounter(fileName, n));
        }
        return false;
    }

    private boolean sameContent(Path existing, RemoteFile job, Fingerprint fp, StopSignal stop)
            throws CancelledException {
        try {
            return engine.fingerprint(new LocalFileSource(existing), job.extension(), stop).equals(fp);
        } catch (CancelledException e) {
            throw e;
        } catch (IOException e) {
            LOG.debugf("Cannot fingerprint local %s: %s", existing, e.getMessage());
            return false;
        }
    }

    private JobResult skip(Tracker tracker, Fingerprint fp, String reason) {
        tracker.moveTo(JobState.SKIPPING);
        tracker.moveTo(JobState.COMPLETED);
        LOG.debugf("Skipping %s: %s", tracker.job, reason);
        return JobResult.skipped(tracker.job, fp, reason);
    }

    private JobResult fail(Tracker tracker, Fingerprint fp, FailureReason reason, String message) {
        tracker.moveTo(JobState.FAILED);
        return JobResult.failed(tracker.job, fp, reason, message);
    }

    /**
     * Current state of one job, announcing every change to the listener.
     */
    private static final class Tracker {

        private final RemoteFile job;
        private final JobListener listener;
        private JobState state = JobState.PENDING;

        Tracker(RemoteFile job, JobListener listener) {
            this.job = job;
            this.listener = listener;
        }

        JobState state() {
            return state;
        }

        void moveTo(JobState next) {
            JobState previous = state;
            state = next;
            try {
                listener.onTransition(job, previous, next);
            } catch (RuntimeException e) {
                LOG.warnf(e, "Job listener failed on %s → %s for %s", previous, next, job);
            }
        }
    }
}
