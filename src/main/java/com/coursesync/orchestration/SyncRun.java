package com.coursesync.orchestration;

import com.coursesync.domain.JobResult;
import com.coursesync.domain.RemoteFile;
import com.coursesync.report.SyncReport;
import com.coursesync.util.StopSignal;
import org.jboss.logging.Logger;

import java.util.Iterator;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.stream.Stream;

/**
 * One execution of the scheduler: a producer thread feeding a bounded queue and a fixed
 * pool of workers draining it. Each queued job is taken by exactly one worker.
 */
public final class SyncRun {

    private static final Logger LOG = Logger.getLogger(SyncRun.class);

    private static final Optional<RemoteFile> END = Optional.empty();
    private static final long POLL_MILLIS = 50;
    private static final AtomicInteger RUN_COUNTER = new AtomicInteger();

    private final Stream<RemoteFile> jobs;
    private final int workers;
    private final JobProcessor processor;
    private final JobListener listener;
    private final SyncReport report = new SyncReport();
    private final StopSignal stop = new StopSignal();
    private final BlockingQueue<Optional<RemoteFile>> queue;
    private final CountDownLatch workersDone;
    private final ExecutorService pool;
    private final Thread producer;
    private final Consumer<SyncRun> onFinish;
    private final AtomicBoolean finished = new AtomicBoolean(false);

    SyncRun(Stream<RemoteFile> jobs, int workers, int queueCapacity, JobProcessor processor,
            JobListener listener, Consumer<SyncRun> onFinish) {
        this.jobs = jobs;
        this.workers = workers;
        this.processor = processor;
        this.listener = JobListener.compose(report, listener);
        this.onFinish = onFinish;
        this.queue = new ArrayBlockingQueue<>(queueCapacity);
        this.workersDone = new CountDownLatch(workers);

        int runId = RUN_COUNTER.incrementAndGet();
        AtomicInteger workerIds = new AtomicInteger();
        this.pool = Executors.newFixedThreadPool(workers, r -> {
            Thread t = new Thread(r, "sync-" + runId + "-worker-" + workerIds.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        this.producer = new Thread(this::produce, "sync-" + runId + "-producer");
        this.producer.setDaemon(true);
    }

    void start() {
        LOG.infof("Starting sync with %d workers", workers);
        producer.start();
        for (int i = 0; i < workers; i++) {
            pool.execute(this::work);
        }
        pool.shutdown();
    }

    /**
     * Issues the global stop: idle workers exit without claiming further jobs, in-flight
     * jobs abort their transfer and report {@code CANCELLED}.
     */
    public void cancel() {
        if (!stop.isStopped()) {
            LOG.info("Cancelling sync run");
        }
        stop.stop();
        producer.interrupt();
    }

    public boolean isCancelled() {
        return stop.isStopped();
    }

    /**
     * Blocks until every worker has exited and returns the final report.
     */
    public SyncReport await() throws InterruptedException {
        workersDone.await();
        complete();
        return report;
    }

    /**
     * Waits at most the given time. Once every worker has exited the run is finished
     * exactly as by {@link #await()}.
     *
     * @return true if the run finished in time
     */
    public boolean await(long timeout, TimeUnit unit) throws InterruptedException {
        if (!workersDone.await(timeout, unit)) {
            return false;
        }
        complete();
        return true;
    }

    private void complete() throws InterruptedException {
        if (stop.isStopped()) {
            producer.interrupt();
        } else {
            producer.join();
        }
        if (finished.compareAndSet(false, true)) {
            report.finish();
            onFinish.accept(this);
            report.log();
        }
    }

    public SyncReport report() {
        return report;
    }

    private void produce() {
        try (jobs) {
            Iterator<RemoteFile> it = jobs.iterator();
            while (!stop.isStopped() && it.hasNext()) {
                RemoteFile job = it.next();
                while (!queue.offer(Optional.of(job), POLL_MILLIS, TimeUnit.MILLISECONDS)) {
                    if (stop.isStopped()) {
                        return;
                    }
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (RuntimeException e) {
            LOG.errorf(e, "File enumeration failed");
            report.enumerationFailed(e);
        } finally {
            enqueueEndMarkers();
        }
    }

    private void enqueueEndMarkers() {
        try {
            for (int i = 0; i < workers; i++) {
                while (!queue.offer(END, POLL_MILLIS, TimeUnit.MILLISECONDS)) {
                    if (stop.isStopped()) {
                        return;
                    }
                }
            }
        } catch (InterruptedException e) {
            // stopped workers do not need end markers
            Thread.currentThread().interrupt();
        }
    }

    private void work() {
        try {
            while (!stop.isStopped()) {
                Optional<RemoteFile> next = queue.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
                if (next == null) {
                    continue;
                }
                if (next.isEmpty() || stop.isStopped()) {
                    break;
                }
                JobResult result = processor.process(next.get(), stop, listener);
                try {
                    listener.onResult(result);
                } catch (RuntimeException e) {
                    LOG.warnf(e, "Job listener failed on result for %s", result.job());
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            workersDone.countDown();
        }
    }
}
