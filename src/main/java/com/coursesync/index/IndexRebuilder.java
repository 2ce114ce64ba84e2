package com.coursesync.index;

import com.coursesync.config.SyncSettings;
import com.coursesync.domain.Course;
import com.coursesync.domain.Fingerprint;
import com.coursesync.error.FetchException;
import com.coursesync.fingerprint.FingerprintEngine;
import com.coursesync.source.LocalFileSource;
import com.coursesync.util.FileNames;
import com.coursesync.util.StopSignal;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.stream.Stream;

/**
 * Recreates index entries from files already present in a course directory, using the
 * current extension policy. Recovers a lost index, or one made stale by a policy change,
 * without downloading anything.
 */
@ApplicationScoped
public class IndexRebuilder {

    private static final Logger LOG = Logger.getLogger(IndexRebuilder.class);

    private final FingerprintEngine engine;
    private final FingerprintIndex index;
    private final Path downloadDir;

    @Inject
    public IndexRebuilder(SyncSettings settings, FingerprintEngine engine, FingerprintIndex index) {
        this(settings.downloadDir(), engine, index);
    }

    public IndexRebuilder(Path downloadDir, FingerprintEngine engine, FingerprintIndex index) {
        this.downloadDir = downloadDir;
        this.engine = engine;
        this.index = index;
    }

    /**
     * @return number of fingerprints that were not in the index before
     */
    public int rebuild(Course course) throws IOException {
        Path courseDir = downloadDir.resolve(course.directoryName());
        if (!Files.isDirectory(courseDir)) {
            LOG.debugf("No local files for course %s at %s", course.id(), courseDir);
            return 0;
        }
        index.open();

        StopSignal stop = new StopSignal();
        int added = 0;
        int seen = 0;
        try (Stream<Path> files = Files.walk(courseDir)) {
            Iterator<Path> it = files.filter(Files::isRegularFile).iterator();
            while (it.hasNext()) {
                Path file = it.next();
                String name = file.getFileName().toString();
                if (name.endsWith(".part")) {
                    continue;
                }
                seen++;
                try {
                    Fingerprint fp = engine.fingerprint(new LocalFileSource(file), FileNames.extensionOf(name), stop);
                    if (index.insert(course, fp)) {
                        added++;
                    }
                } catch (FetchException e) {
                    LOG.warnf("Could not read %s, ignoring it: %s", file, e.getMessage());
                }
            }
        }

        LOG.infof("Rebuilt index for course %s: %d files, %d new fingerprints", course.id(), seen, added);
        return added;
    }
}
