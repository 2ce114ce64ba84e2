package com.coursesync.error;

import java.io.IOException;

/**
 * Raised inside a job when the run's stop signal fires.
 */
public class CancelledException extends IOException {

    public CancelledException(String message) {
        super(message);
    }

    public CancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
