package com.coursesync.error;

import java.io.IOException;

/**
 * Local filesystem write failure. Never retried.
 */
public class StorageException extends IOException {

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
