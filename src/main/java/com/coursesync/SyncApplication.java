package com.coursesync;

import com.coursesync.config.SyncSettings;
import com.coursesync.domain.Course;
import com.coursesync.domain.RemoteFile;
import com.coursesync.index.IndexRebuilder;
import com.coursesync.orchestration.DownloadScheduler;
import com.coursesync.report.SyncReport;
import com.coursesync.source.ManifestCatalog;
import io.quarkus.runtime.QuarkusApplication;
import io.quarkus.runtime.annotations.QuarkusMain;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

/**
 * Syncs the files listed in {@code sync.manifest}, or rebuilds the index from local files
 * when started with {@code rebuild-index}.
 * Exit codes: 0 success, 1 some jobs failed, 2 manifest missing or unreadable.
 */
@QuarkusMain
public class SyncApplication implements QuarkusApplication {

    private static final Logger LOG = Logger.getLogger(SyncApplication.class);

    static final String REBUILD_INDEX = "rebuild-index";

    @Inject
    SyncSettings settings;

    @Inject
    ManifestCatalog catalog;

    @Inject
    DownloadScheduler scheduler;

    @Inject
    IndexRebuilder rebuilder;

    @Override
    public int run(String... args) throws Exception {
        Path manifest = settings.manifest();
        if (manifest == null || !Files.isRegularFile(manifest)) {
            LOG.errorf("No manifest to sync, set sync.manifest (currently %s)", manifest);
            return 2;
        }

        try {
            if (args.length > 0 && REBUILD_INDEX.equals(args[0])) {
                return rebuildIndex(manifest);
            }
            return sync(manifest);
        } catch (IOException e) {
            LOG.errorf(e, "Cannot read manifest %s", manifest);
            return 2;
        }
    }

    private int sync(Path manifest) throws IOException, InterruptedException {
        Stream<RemoteFile> jobs = catalog.list(manifest);
        SyncReport report = scheduler.run(jobs);
        return report.hasFailures() ? 1 : 0;
    }

    private int rebuildIndex(Path manifest) throws IOException {
        List<Course> courses = catalog.courses(manifest);
        int added = 0;
        for (Course course : courses) {
            added += rebuilder.rebuild(course);
        }
        LOG.infof("Index rebuild finished: %d courses, %d new fingerprints", courses.size(), added);
        return 0;
    }
}
