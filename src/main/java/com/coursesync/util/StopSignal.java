package com.coursesync.util;

import com.coursesync.error.CancelledException;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Run-wide cooperative stop. Blocking operations register a hook that aborts them
 * (for example cancelling an HTTP call); sleeps wait on the signal instead of the clock.
 */
public final class StopSignal {

    private static final Logger LOG = Logger.getLogger(StopSignal.class);

    private final AtomicBoolean stopped = new AtomicBoolean(false);
    private final CountDownLatch latch = new CountDownLatch(1);
    private final Set<Runnable> hooks = ConcurrentHashMap.newKeySet();

    public void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        latch.countDown();
        for (Runnable hook : hooks) {
            runHook(hook);
        }
    }

    public boolean isStopped() {
        return stopped.get();
    }

    public void throwIfStopped(String what) throws CancelledException {
        if (stopped.get()) {
            throw new CancelledException("Cancelled: " + what);
        }
    }

    /**
     * Registers a hook run once on stop. If the signal already fired the hook runs immediately.
     * A hook may run twice when registration races with {@link #stop()}, so it must be idempotent.
     */
    public Registration onStop(Runnable hook) {
        hooks.add(hook);
        if (stopped.get()) {
            runHook(hook);
        }
        return () -> hooks.remove(hook);
    }

    /**
     * Sleeps for the given duration or until stopped.
     *
     * @return true if the signal fired while waiting
     */
    public boolean sleep(Duration duration) throws InterruptedException {
        return latch.await(duration.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void runHook(Runnable hook) {
        try {
            hook.run();
        } catch (RuntimeException e) {
            LOG.warnf(e, "Stop hook failed");
        }
    }

    @FunctionalInterface
    public interface Registration extends AutoCloseable {
        @Override
        void close();
    }
}
