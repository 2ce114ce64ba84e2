package com.coursesync.orchestration;

import com.coursesync.config.SyncSettings;
import com.coursesync.domain.RemoteFile;
import com.coursesync.fingerprint.FingerprintEngine;
import com.coursesync.index.FingerprintIndex;
import com.coursesync.report.SyncReport;
import com.coursesync.sink.Sink;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;

/**
 * Entry point of the core: takes the enumerated jobs and drives them through a fixed
 * pool of workers. Handles the main flow: fingerprint → index check → download or skip → index update.
 */
@ApplicationScoped
public class DownloadScheduler {

    private static final Logger LOG = Logger.getLogger(DownloadScheduler.class);

    private final SyncSettings settings;
    private final FingerprintIndex index;
    private final JobProcessor processor;
    private final Set<SyncRun> activeRuns = ConcurrentHashMap.newKeySet();

    @Inject
    public DownloadScheduler(SyncSettings settings, FingerprintEngine engine, FingerprintIndex index, Sink sink) {
        this.settings = settings;
        this.index = index;
        this.processor = new JobProcessor(engine, index, sink, settings.retry());
    }

    /**
     * Starts processing in the background. The stream is consumed lazily by a producer
     * thread and closed when exhausted.
     *
     * @throws com.coursesync.error.IndexException if the index storage cannot be opened
     */
    public SyncRun start(Stream<RemoteFile> jobs, JobListener listener) {
        index.open();

        SyncRun run = new SyncRun(jobs, settings.workers(), settings.queueCapacity(), processor,
                listener, activeRuns::remove);
        activeRuns.add(run);
        run.start();
        return run;
    }

    /**
     * Processes all jobs and blocks until every claimed job has a result.
     */
    public SyncReport run(Stream<RemoteFile> jobs) throws InterruptedException {
        SyncRun run = start(jobs, JobListener.noop());
        try {
            return run.await();
        } catch (InterruptedException e) {
            run.cancel();
            throw e;
        }
    }

    int activeRunCount() {
        return activeRuns.size();
    }

    @PreDestroy
    void shutdown() {
        if (!activeRuns.isEmpty()) {
            LOG.infof("Shutting down with %d active sync runs", activeRuns.size());
            activeRuns.forEach(SyncRun::cancel);
        }
    }
}
