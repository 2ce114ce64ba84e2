package com.coursesync.source;

import com.coursesync.domain.Course;
import com.coursesync.domain.RemoteFile;
import jakarta.enterprise.context.ApplicationScoped;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Enumerates a local directory tree (for example a mounted share) as the files of one course.
 */
@ApplicationScoped
public class LocalFsCatalog {

    /**
     * Lazily lists regular files below {@code root}. Patterns are globs relative to the root;
     * {@code **}{@code /} matches any number of directories including none.
     * The caller closes the stream.
     */
    public Stream<RemoteFile> list(Course course, Path root, List<String> includePatterns,
                                   List<String> excludePatterns) throws IOException {
        if (!Files.isDirectory(root)) {
            throw new IOException("Source path does not exist: " + root);
        }
        List<Pattern> includes = compile(includePatterns);
        List<Pattern> excludes = compile(excludePatterns);

        return Files.walk(root)
                .filter(Files::isRegularFile)
                .filter(p -> matchesPatterns(relativePath(root, p), includes, excludes))
                .map(p -> toRemoteFile(course, root, p));
    }

    private boolean matchesPatterns(String relativePath, List<Pattern> includes, List<Pattern> excludes) {
        // Check excludes first
        for (Pattern exclude : excludes) {
            if (exclude.matcher(relativePath).matches()) {
                return false;
            }
        }

        // If no includes specified, accept all (that aren't excluded)
        if (includes.isEmpty()) {
            return true;
        }

        for (Pattern include : includes) {
            if (include.matcher(relativePath).matches()) {
                return true;
            }
        }
        return false;
    }

    private static List<Pattern> compile(List<String> globs) {
        return globs == null ? List.of() : globs.stream().map(LocalFsCatalog::globToRegex).toList();
    }

    static Pattern globToRegex(String glob) {
        StringBuilder regex = new StringBuilder();
        int i = 0;
        while (i < glob.length()) {
            char c = glob.charAt(i);
            if (glob.startsWith("**/", i)) {
                regex.append("(?:.*/)?");
                i += 3;
            } else if (glob.startsWith("**", i)) {
                regex.append(".*");
                i += 2;
            } else if (c == '*') {
                regex.append("[^/]*");
                i++;
            } else if (c == '?') {
                regex.append("[^/]");
                i++;
            } else {
                regex.append(Pattern.quote(String.valueOf(c)));
                i++;
            }
        }
        return Pattern.compile(regex.toString());
    }

    private static String relativePath(Path root, Path file) {
        return root.relativize(file).toString().replace('\\', '/');
    }

    private static RemoteFile toRemoteFile(Course course, Path root, Path file) {
        Path parent = root.relativize(file.getParent());
        try {
            return new RemoteFile(
                    course,
                    file.getFileName().toString(),
                    parent.toString().replace('\\', '/'),
                    null,
                    Files.size(file),
                    new LocalFileSource(file)
            );
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read file attributes: " + file, e);
        }
    }
}
