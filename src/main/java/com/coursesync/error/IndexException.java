package com.coursesync.error;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * The fingerprint index could not be loaded or flushed.
 */
public class IndexException extends UncheckedIOException {

    public IndexException(String message, IOException cause) {
        super(message, cause);
    }
}
