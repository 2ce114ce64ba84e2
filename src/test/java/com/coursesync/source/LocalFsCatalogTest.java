package com.coursesync.source;

import com.coursesync.TestFiles;
import com.coursesync.domain.Course;
import com.coursesync.domain.RemoteFile;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LocalFsCatalogTest {

    private final LocalFsCatalog catalog = new LocalFsCatalog();
    private final Course course = new Course("4711", "Algorithms");
    private Path root;

    @BeforeEach
    void setup() throws IOException {
        root = Files.createTempDirectory("catalog-test-");
        Files.createDirectories(root.resolve("Week 1/Slides"));
        Files.writeString(root.resolve("syllabus.pdf"), "syllabus");
        Files.writeString(root.resolve("Week 1/sheet.pdf"), "sheet");
        Files.writeString(root.resolve("Week 1/Slides/intro.pdf"), "intro");
        Files.writeString(root.resolve("Week 1/notes.tmp"), "scratch");
    }

    @AfterEach
    void cleanup() throws IOException {
        TestFiles.deleteRecursively(root);
    }

    @Test
    void shouldListAllFilesWithoutPatterns() throws IOException {
        assertEquals(Set.of("Algorithms/syllabus.pdf", "Algorithms/Week 1/sheet.pdf",
                        "Algorithms/Week 1/Slides/intro.pdf", "Algorithms/Week 1/notes.tmp"),
                destinations(List.of(), List.of()));
    }

    @Test
    void shouldRespectExcludePatterns() throws IOException {
        Set<String> listed = destinations(List.of("**/*.pdf", "**/*.tmp"), List.of("**/*.tmp"));

        assertEquals(3, listed.size());
        assertFalse(listed.contains("Algorithms/Week 1/notes.tmp"), "Excludes win over includes");
        assertTrue(listed.contains("Algorithms/syllabus.pdf"), "**/ also matches the root directory");
    }

    @Test
    void shouldNotCrossDirectoriesWithSingleStar() throws IOException {
        assertEquals(Set.of("Algorithms/Week 1/sheet.pdf"), destinations(List.of("Week 1/*.pdf"), List.of()));
    }

    @Test
    void shouldCarryMetadata() throws IOException {
        try (Stream<RemoteFile> files = catalog.list(course, root, List.of("syllabus.pdf"), List.of())) {
            RemoteFile file = files.findFirst().orElseThrow();
            assertEquals("pdf", file.extension());
            assertEquals(8, file.declaredSize());
            assertEquals("", file.relativeDirectory());
        }
    }

    @Test
    void shouldFailForMissingRoot() {
        assertThrows(IOException.class,
                () -> catalog.list(course, root.resolve("missing"), List.of(), List.of()));
    }

    @Test
    void shouldEscapeRegexCharactersInGlobs() {
        assertTrue(LocalFsCatalog.globToRegex("a+b (1).pdf").matcher("a+b (1).pdf").matches());
        assertFalse(LocalFsCatalog.globToRegex("*.pdf").matcher("xpdf").matches());
        assertTrue(LocalFsCatalog.globToRegex("sheet?.pdf").matcher("sheet1.pdf").matches());
    }

    private Set<String> destinations(List<String> includes, List<String> excludes) throws IOException {
        try (Stream<RemoteFile> files = catalog.list(course, root, includes, excludes)) {
            return files.map(RemoteFile::destinationPath).collect(Collectors.toSet());
        }
    }
}
