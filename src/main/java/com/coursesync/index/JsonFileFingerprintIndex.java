package com.coursesync.index;

import com.coursesync.config.SyncSettings;
import com.coursesync.domain.Course;
import com.coursesync.domain.Fingerprint;
import com.coursesync.error.IndexException;
import com.coursesync.util.FileNames;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Durable index with one JSON file per course in the index directory.
 * <p>
 * A course file is loaded on first use and rewritten after every insert that adds a
 * fingerprint (temp file, fsync, atomic rename). A crash therefore loses at most the
 * insert that was in progress, which costs one re-download on the next run.
 */
@ApplicationScoped
public class JsonFileFingerprintIndex implements FingerprintIndex {

    private static final Logger LOG = Logger.getLogger(JsonFileFingerprintIndex.class);

    static final String SUFFIX = ".fingerprints.json";

    private final Path indexDir;
    private final ObjectMapper mapper;
    private final Map<String, CourseIndex> courses = new ConcurrentHashMap<>();

    @Inject
    public JsonFileFingerprintIndex(SyncSettings settings, ObjectMapper mapper) {
        this(settings.indexDir(), mapper);
    }

    public JsonFileFingerprintIndex(Path indexDir, ObjectMapper mapper) {
        this.indexDir = indexDir;
        this.mapper = mapper;
    }

    @Override
    public void open() {
        try {
            Files.createDirectories(indexDir);
        } catch (IOException e) {
            throw new IndexException("Cannot create index directory " + indexDir, e);
        }
    }

    @Override
    public boolean contains(Course course, Fingerprint fingerprint) {
        return courseIndex(course).contains(fingerprint);
    }

    @Override
    public boolean insert(Course course, Fingerprint fingerprint) {
        return courseIndex(course).insert(fingerprint);
    }

    @Override
    public int size(Course course) {
        return courseIndex(course).size();
    }

    Path fileFor(Course course) {
        return indexDir.resolve(FileNames.sanitize(course.id()) + SUFFIX);
    }

    private CourseIndex courseIndex(Course course) {
        return courses.computeIfAbsent(course.id(), id -> load(course));
    }

    private CourseIndex load(Course course) {
        Path file = fileFor(course);
        Set<Fingerprint> known = new HashSet<>();

        if (Files.exists(file)) {
            try {
                IndexFile stored = mapper.readValue(file.toFile(), IndexFile.class);
                if (stored.courseId() != null && !stored.courseId().equals(course.id())) {
                    LOG.warnf("Index file %s belongs to course %s, not %s", file, stored.courseId(), course.id());
                }
                if (stored.fingerprints() != null) {
                    for (String hex : stored.fingerprints()) {
                        known.add(Fingerprint.fromHex(hex));
                    }
                }
            } catch (IOException e) {
                throw new IndexException("Cannot read index file " + file, e);
            } catch (IllegalArgumentException e) {
                throw new IndexException("Corrupt index file " + file, new IOException(e.getMessage(), e));
            }
        }

        LOG.debugf("Loaded %d fingerprints for course %s from %s", known.size(), course.id(), file);
        return new CourseIndex(course.id(), file, known);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record IndexFile(String courseId, List<String> fingerprints) {
    }

    private final class CourseIndex {

        private final String courseId;
        private final Path file;
        private final Set<Fingerprint> known;

        CourseIndex(String courseId, Path file, Set<Fingerprint> known) {
            this.courseId = courseId;
            this.file = file;
            this.known = known;
        }

        synchronized boolean contains(Fingerprint fingerprint) {
            return known.contains(fingerprint);
        }

        synchronized int size() {
            return known.size();
        }

        synchronized boolean insert(Fingerprint fingerprint) {
            if (!known.add(fingerprint)) {
                return false;
            }
            try {
                flush();
            } catch (IOException e) {
                // keep memory in step with disk
                known.remove(fingerprint);
                throw new IndexException("Cannot write index file " + file, e);
            }
            return true;
        }

        private void flush() throws IOException {
            List<String> hex = new ArrayList<>(known.size());
            for (Fingerprint fp : known) {
                hex.add(fp.toHex());
            }
            hex.sort(null);
            byte[] json = mapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(new IndexFile(courseId, hex));

            Files.createDirectories(file.getParent());
            Path temp = file.resolveSibling(file.getFileName() + ".tmp");
            try (FileChannel channel = FileChannel.open(temp, StandardOpenOption.CREATE,
                    StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
                ByteBuffer buffer = ByteBuffer.wrap(json);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            }
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            LOG.debugf("Flushed %d fingerprints for course %s", known.size(), courseId);
        }
    }
}
