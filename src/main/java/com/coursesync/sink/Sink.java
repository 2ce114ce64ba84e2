package com.coursesync.sink;

import com.coursesync.util.StopSignal;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;

public interface Sink {

    /**
     * Where a file for {@code destPath} lives when stored under its own name.
     */
    Path resolve(String destPath);

    /**
     * Stores the stream under {@code destPath}, choosing a free name if that path is
     * already taken. Returns only after the content is durably on disk.
     *
     * @throws com.coursesync.error.StorageException   local write failure
     * @throws com.coursesync.error.FetchException     reading {@code in} failed
     * @throws com.coursesync.error.CancelledException the stop signal fired
     */
    StoredFile write(String destPath, InputStream in, StopSignal stop) throws IOException;

    record StoredFile(Path path, long bytes) {
    }
}
