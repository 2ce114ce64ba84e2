package com.coursesync.source;

import com.coursesync.util.StopSignal;

import java.io.IOException;
import java.io.InputStream;

/**
 * Read access to the content of one remote file.
 * Implementations throw {@link com.coursesync.error.FetchException} for transport problems
 * and {@link com.coursesync.error.CancelledException} once the stop signal fired.
 */
public interface ByteRangeSource {

    /**
     * Reads up to {@code length} bytes starting at {@code offset}.
     */
    RangeSlice fetchRange(long offset, int length, StopSignal stop) throws IOException;

    /**
     * Opens the whole content. The caller closes the stream.
     */
    InputStream openFull(StopSignal stop) throws IOException;

    /**
     * Human readable location, used in logs.
     */
    String describe();
}
