package com.coursesync.source;

import com.coursesync.error.FetchException;
import com.coursesync.util.StopSignal;

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Source backed by a file on the local filesystem.
 */
public class LocalFileSource implements ByteRangeSource {

    private final Path path;

    public LocalFileSource(Path path) {
        if (path == null) {
            throw new IllegalArgumentException("path cannot be null");
        }
        this.path = path;
    }

    public Path path() {
        return path;
    }

    @Override
    public RangeSlice fetchRange(long offset, int length, StopSignal stop) throws IOException {
        stop.throwIfStopped("read of " + path);
        try (FileChannel channel = FileChannel.open(path, StandardOpenOption.READ)) {
            long size = channel.size();
            if (offset >= size) {
                return RangeSlice.empty(offset, size);
            }

            int toRead = (int) Math.min(length, size - offset);
            ByteBuffer buffer = ByteBuffer.allocate(toRead);
            long position = offset;
            while (buffer.hasRemaining()) {
                int read = channel.read(buffer, position);
                if (read < 0) {
                    break;
                }
                position += read;
            }

            byte[] data = new byte[buffer.position()];
            buffer.flip();
            buffer.get(data);
            return new RangeSlice(offset, data, size);
        } catch (IOException e) {
            throw new FetchException("Failed to read " + path + " [" + offset + "+" + length + "]", e, false);
        }
    }

    @Override
    public InputStream openFull(StopSignal stop) throws IOException {
        stop.throwIfStopped("read of " + path);
        try {
            return Files.newInputStream(path);
        } catch (IOException e) {
            throw new FetchException("Failed to open " + path, e, false);
        }
    }

    @Override
    public String describe() {
        return path.toString();
    }
}
