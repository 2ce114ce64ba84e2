package com.coursesync.source;

import com.coursesync.error.CancelledException;
import com.coursesync.error.FetchException;
import com.coursesync.util.StopSignal;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory source with scriptable failures, records every request it serves.
 */
public class FakeSource implements ByteRangeSource {

    private final String name;
    private final byte[] content;
    private final AtomicInteger fetchFailuresLeft = new AtomicInteger();
    private final AtomicInteger fetchCalls = new AtomicInteger();
    private final AtomicInteger openCalls = new AtomicInteger();
    private final List<Long> requestedOffsets = new CopyOnWriteArrayList<>();
    private volatile boolean blockTransfer;
    private volatile CountDownLatch transferStarted = new CountDownLatch(0);

    public FakeSource(String name, byte[] content) {
        this.name = name;
        this.content = content;
    }

    /**
     * The next {@code n} range requests fail with a retryable error.
     */
    public FakeSource failingFetches(int n) {
        fetchFailuresLeft.set(n);
        return this;
    }

    /**
     * Full transfers hang until the run is stopped.
     */
    public FakeSource blockingTransfer(CountDownLatch started) {
        this.blockTransfer = true;
        this.transferStarted = started;
        return this;
    }

    @Override
    public RangeSlice fetchRange(long offset, int length, StopSignal stop) throws IOException {
        stop.throwIfStopped("fetch of " + name);
        fetchCalls.incrementAndGet();
        requestedOffsets.add(offset);
        if (fetchFailuresLeft.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
            throw new FetchException("Simulated failure for " + name, true);
        }
        if (offset >= content.length) {
            return RangeSlice.empty(offset, content.length);
        }
        int end = (int) Math.min(content.length, offset + length);
        return new RangeSlice(offset, Arrays.copyOfRange(content, (int) offset, end), content.length);
    }

    @Override
    public InputStream openFull(StopSignal stop) throws IOException {
        stop.throwIfStopped("download of " + name);
        openCalls.incrementAndGet();
        if (!blockTransfer) {
            return new ByteArrayInputStream(content);
        }
        return new InputStream() {
            @Override
            public int read() throws IOException {
                transferStarted.countDown();
                try {
                    while (!stop.sleep(Duration.ofMillis(10))) {
                        // wait for cancellation
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                throw new CancelledException("Transfer of " + name + " cancelled");
            }
        };
    }

    @Override
    public String describe() {
        return "fake:" + name;
    }

    public int fetchCalls() {
        return fetchCalls.get();
    }

    public int openCalls() {
        return openCalls.get();
    }

    public List<Long> requestedOffsets() {
        return requestedOffsets;
    }
}
