package com.coursesync.index;

import com.coursesync.TestFiles;
import com.coursesync.domain.Course;
import com.coursesync.fingerprint.ExtensionPolicyTable;
import com.coursesync.fingerprint.ExtensionPolicyTable.Window;
import com.coursesync.fingerprint.FingerprintEngine;
import com.coursesync.source.LocalFileSource;
import com.coursesync.util.StopSignal;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class IndexRebuilderTest {

    private final Course course = new Course("4711", "Algorithms");
    private final FingerprintEngine engine = new FingerprintEngine(new ExtensionPolicyTable(
            Map.of("zip", new Window(512, 512)), new Window(0, 512)));
    private Path root;
    private Path downloadDir;
    private JsonFileFingerprintIndex index;
    private IndexRebuilder rebuilder;

    @BeforeEach
    void setup() throws IOException {
        root = Files.createTempDirectory("rebuild-test-");
        downloadDir = root.resolve("courses");
        index = new JsonFileFingerprintIndex(root.resolve(".index"), new ObjectMapper());
        rebuilder = new IndexRebuilder(downloadDir, engine, index);
    }

    @AfterEach
    void cleanup() throws IOException {
        TestFiles.deleteRecursively(root);
    }

    @Test
    void shouldIndexExistingFiles() throws IOException {
        Path courseDir = Files.createDirectories(downloadDir.resolve("Algorithms/Week 1"));
        Path sheet = Files.write(courseDir.resolve("sheet.pdf"), TestFiles.content(1, 2000));
        Path archive = Files.write(courseDir.resolve("code.zip"), TestFiles.content(2, 2000));

        int added = rebuilder.rebuild(course);

        assertEquals(2, added);
        assertTrue(index.contains(course, engine.fingerprint(new LocalFileSource(sheet), "pdf", new StopSignal())));
        assertTrue(index.contains(course, engine.fingerprint(new LocalFileSource(archive), "zip", new StopSignal())),
                "Archive is indexed with its extension window");
    }

    @Test
    void shouldIgnorePartialDownloads() throws IOException {
        Path courseDir = Files.createDirectories(downloadDir.resolve("Algorithms"));
        Path partial = Files.write(courseDir.resolve("big.pdf.part"), TestFiles.content(3, 1000));

        assertEquals(0, rebuilder.rebuild(course));
        assertFalse(index.contains(course, engine.fingerprint(new LocalFileSource(partial), "pdf", new StopSignal())));
    }

    @Test
    void shouldCountOnlyNewFingerprints() throws IOException {
        Path courseDir = Files.createDirectories(downloadDir.resolve("Algorithms"));
        byte[] content = TestFiles.content(4, 600);
        Files.write(courseDir.resolve("a.pdf"), content);
        Files.write(courseDir.resolve("a (1).pdf"), content);

        assertEquals(1, rebuilder.rebuild(course));
        assertEquals(0, rebuilder.rebuild(course), "Second rebuild finds nothing new");
    }

    @Test
    void shouldHandleMissingCourseDirectory() throws IOException {
        assertEquals(0, rebuilder.rebuild(Course.of("never-synced")));
    }
}
