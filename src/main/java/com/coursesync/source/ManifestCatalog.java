package com.coursesync.source;

import com.coursesync.domain.Course;
import com.coursesync.domain.RemoteFile;
import com.coursesync.util.FileNames;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import okhttp3.HttpUrl;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.net.URI;
import java.nio.file.FileSystemNotFoundException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Reads the file listing produced by portal enumeration.
 * <pre>
 * {"courses": [{"id": "4711", "name": "Algorithms",
 *               "files": [{"name": "sheet1.pdf", "url": "https://...", "path": "Exercises", "size": 1234}]}]}
 * </pre>
 * {@code http(s)} URLs are read with range requests, {@code file:} URLs from the local filesystem.
 */
@ApplicationScoped
public class ManifestCatalog {

    private static final Logger LOG = Logger.getLogger(ManifestCatalog.class);

    private final ObjectMapper mapper;
    private final HttpSourceFactory httpSources;

    @Inject
    public ManifestCatalog(ObjectMapper mapper, HttpSourceFactory httpSources) {
        this.mapper = mapper;
        this.httpSources = httpSources;
    }

    public List<Course> courses(Path manifest) throws IOException {
        List<Course> courses = new ArrayList<>();
        for (CourseEntry entry : read(manifest).courses()) {
            courses.add(entry.toCourse());
        }
        return courses;
    }

    /**
     * Jobs for every file in the manifest. Every entry is validated when the manifest is read,
     * so a bad URL rejects the whole manifest instead of cutting enumeration short.
     */
    public Stream<RemoteFile> list(Path manifest) throws IOException {
        Manifest parsed = read(manifest);
        LOG.infof("Manifest %s lists %d courses", manifest, parsed.courses().size());
        return parsed.courses().stream()
                .flatMap(entry -> {
                    Course course = entry.toCourse();
                    return entry.files().stream().map(file -> toRemoteFile(course, file));
                });
    }

    Manifest read(Path manifest) throws IOException {
        Manifest parsed = mapper.readValue(manifest.toFile(), Manifest.class);
        for (CourseEntry course : parsed.courses()) {
            if (course.id() == null || course.id().isBlank()) {
                throw new IOException("Course without id in " + manifest);
            }
            for (FileEntry file : course.files()) {
                if (file.url() == null || file.url().isBlank()) {
                    throw new IOException("File without url in course " + course.id() + " of " + manifest);
                }
                checkUrl(file.url(), course.id(), manifest);
                if ((file.name() == null || file.name().isBlank()) && nameFromUrl(file.url()).isBlank()) {
                    throw new IOException("No file name for " + file.url() + " in course " + course.id()
                            + " of " + manifest);
                }
            }
        }
        return parsed;
    }

    private RemoteFile toRemoteFile(Course course, FileEntry file) {
        String name = file.name() != null && !file.name().isBlank()
                ? file.name()
                : nameFromUrl(file.url());
        return new RemoteFile(
                course,
                name,
                file.path(),
                null,
                file.size() != null ? file.size() : -1,
                openSource(file.url())
        );
    }

    private static void checkUrl(String url, String courseId, Path manifest) throws IOException {
        try {
            if (url.startsWith("file:")) {
                Paths.get(URI.create(url));
                return;
            }
        } catch (IllegalArgumentException | FileSystemNotFoundException e) {
            throw new IOException("Invalid file URL " + url + " in course " + courseId + " of " + manifest, e);
        }
        if (HttpUrl.parse(url) == null) {
            throw new IOException("URL must be HTTP, HTTPS or file: " + url + " in course " + courseId
                    + " of " + manifest);
        }
    }

    private static String nameFromUrl(String url) {
        if (!url.startsWith("file:")) {
            HttpUrl parsed = HttpUrl.parse(url);
            List<String> segments = parsed != null ? parsed.pathSegments() : List.of();
            return segments.isEmpty() ? "" : segments.get(segments.size() - 1);
        }
        String path = URI.create(url).getPath();
        return FileNames.extractFilename(path != null ? path : url);
    }

    private ByteRangeSource openSource(String url) {
        if (url.startsWith("file:")) {
            return new LocalFileSource(Paths.get(URI.create(url)));
        }
        return httpSources.open(url);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Manifest(List<CourseEntry> courses) {
        Manifest {
            courses = courses != null ? List.copyOf(courses) : List.of();
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record CourseEntry(String id, String name, List<FileEntry> files) {
        CourseEntry {
            files = files != null ? List.copyOf(files) : List.of();
        }

        Course toCourse() {
            return new Course(id, name);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record FileEntry(String name, String url, String path, Long size) {
    }
}
