package com.coursesync.sink;

import com.coursesync.config.SyncSettings;
import com.coursesync.error.CancelledException;
import com.coursesync.error.FetchException;
import com.coursesync.error.StorageException;
import com.coursesync.util.FileNames;
import com.coursesync.util.StopSignal;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Writes downloads below the configured download directory.
 * Content goes to a {@code .part} sibling first and is renamed into place only after
 * it was forced to disk, so a visible file is always complete.
 */
@ApplicationScoped
public class LocalFsSink implements Sink {

    private static final Logger LOG = Logger.getLogger(LocalFsSink.class);

    static final String PART_SUFFIX = ".part";

    private final Path basePath;
    private final int bufferSize;

    // targets claimed by in-flight writes, so two jobs never pick the same free name
    private final Set<Path> reserved = ConcurrentHashMap.newKeySet();

    @Inject
    public LocalFsSink(SyncSettings settings) {
        this(settings.downloadDir(), settings.bufferSize());
    }

    public LocalFsSink(Path basePath, int bufferSize) {
        this.basePath = basePath;
        this.bufferSize = bufferSize;
    }

    @Override
    public Path resolve(String destPath) {
        return basePath.resolve(destPath).normalize();
    }

    @Override
    public StoredFile write(String destPath, InputStream in, StopSignal stop) throws IOException {
        Path requested = resolve(destPath);
        if (!requested.startsWith(basePath.normalize())) {
            throw new StorageException("Destination escapes download directory: " + destPath, null);
        }

        try {
            Files.createDirectories(requested.getParent());
        } catch (IOException e) {
            throw new StorageException("Cannot create directory " + requested.getParent(), e);
        }

        Path target = reserveFreeTarget(requested);
        Path temp = target.resolveSibling(target.getFileName() + PART_SUFFIX);
        try {
            long written = writeToFile(temp, in, stop);
            stop.throwIfStopped("write of " + target);
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE);
            } catch (IOException e) {
                throw new StorageException("Cannot move " + temp + " to " + target, e);
            }
            // the rename must survive a crash before the index records it
            syncDirectory(target.getParent());
            return new StoredFile(target, written);
        } catch (IOException e) {
            deletePartial(temp);
            throw e;
        } finally {
            reserved.remove(target);
        }
    }

    private Path reserveFreeTarget(Path requested) {
        Path candidate = requested;
        String fileName = requested.getFileName().toString();
        for (int n = 1; ; n++) {
            if (!Files.exists(candidate) && reserved.add(candidate)) {
                if (n > 1) {
                    LOG.debugf("%s is taken, storing as %s", requested, candidate.getFileName());
                }
                return candidate;
            }
            candidate = requested.resolveSibling(FileNames.withCounter(fileName, n));
        }
    }

    private long writeToFile(Path target, InputStream in, StopSignal stop) throws IOException {
        FileChannel channel;
        try {
            channel = FileChannel.open(target, StandardOpenOption.CREATE,
                    StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING);
        } catch (IOException e) {
            throw new StorageException("Cannot open " + target + " for writing", e);
        }

        try (channel) {
            byte[] buffer = new byte[bufferSize];
            long totalWritten = 0;

            while (true) {
                stop.throwIfStopped("write of " + target);
                int bytesRead = read(in, buffer, stop);
                if (bytesRead == -1) {
                    break;
                }
                try {
                    ByteBuffer chunk = ByteBuffer.wrap(buffer, 0, bytesRead);
                    while (chunk.hasRemaining()) {
                        channel.write(chunk);
                    }
                } catch (IOException e) {
                    throw new StorageException("Write to " + target + " failed", e);
                }
                totalWritten += bytesRead;
            }

            try {
                channel.force(true);
            } catch (IOException e) {
                throw new StorageException("Cannot sync " + target + " to disk", e);
            }
            return totalWritten;
        }
    }

    private static int read(InputStream in, byte[] buffer, StopSignal stop) throws IOException {
        try {
            return in.read(buffer);
        } catch (FetchException | CancelledException e) {
            throw e;
        } catch (IOException e) {
            if (stop.isStopped()) {
                throw new CancelledException("Cancelled during transfer", e);
            }
            throw new FetchException("Transfer interrupted: " + e.getMessage(), e, true);
        }
    }

    /**
     * Forces a directory entry change to disk. Some platforms cannot open directories for
     * syncing; there the rename is only as durable as the filesystem makes it.
     *
     * @return false if the platform does not support syncing directories
     */
    static boolean syncDirectory(Path directory) throws StorageException {
        FileChannel channel;
        try {
            channel = FileChannel.open(directory, StandardOpenOption.READ);
        } catch (NoSuchFileException e) {
            throw new StorageException("Directory vanished before sync: " + directory, e);
        } catch (IOException e) {
            LOG.debugf("Cannot open %s for syncing, relying on the filesystem: %s", directory, e.getMessage());
            return false;
        }
        try (channel) {
            channel.force(true);
            return true;
        } catch (IOException e) {
            throw new StorageException("Cannot sync directory " + directory, e);
        }
    }

    private static void deletePartial(Path temp) {
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            LOG.warnf(e, "Could not delete partial file %s", temp);
        }
    }
}
