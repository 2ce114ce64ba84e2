package com.coursesync.report;

import com.coursesync.domain.Course;
import com.coursesync.domain.JobResult;
import com.coursesync.domain.JobResult.FailureReason;
import com.coursesync.domain.JobState;
import com.coursesync.domain.RemoteFile;
import com.coursesync.fingerprint.FingerprintEngine;
import com.coursesync.source.FakeSource;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SyncReportTest {

    private final Course course = Course.of("c1");

    @Test
    void shouldCountOutcomes() {
        SyncReport report = new SyncReport();

        report.onResult(JobResult.downloaded(job("a.pdf"), FingerprintEngine.digest(new byte[]{1}),
                Path.of("c1/a.pdf"), 100));
        report.onResult(JobResult.downloaded(job("b.pdf"), FingerprintEngine.digest(new byte[]{2}),
                Path.of("c1/b.pdf"), 50));
        report.onResult(JobResult.skipped(job("c.pdf"), FingerprintEngine.digest(new byte[]{1}), "Already downloaded"));
        report.onResult(JobResult.failed(job("d.pdf"), null, FailureReason.FETCH, "HTTP 404"));
        report.finish();

        assertEquals(2, report.downloaded());
        assertEquals(1, report.skipped());
        assertEquals(1, report.failed());
        assertEquals(4, report.total());
        assertEquals(150, report.bytesTransferred());
        assertEquals("2 downloaded, 1 skipped, 1 failed", report.summary());
        assertEquals("d.pdf", report.failures().get(0).job().displayName());
        assertTrue(report.hasFailures());
    }

    @Test
    void shouldCountTransitions() {
        SyncReport report = new SyncReport();
        RemoteFile job = job("a.pdf");

        report.onTransition(job, JobState.PENDING, JobState.FINGERPRINTING);
        report.onTransition(job, JobState.FINGERPRINTING, JobState.SKIPPING);
        report.onTransition(job, JobState.SKIPPING, JobState.COMPLETED);

        assertEquals(1, report.transitionsInto(JobState.SKIPPING));
        assertEquals(0, report.transitionsInto(JobState.DOWNLOADING));
        assertFalse(report.hasFailures());
    }

    @Test
    void shouldTreatEnumerationFailureAsFailure() {
        SyncReport report = new SyncReport();

        report.enumerationFailed(new IllegalStateException("portal down"));

        assertTrue(report.hasFailures());
        assertEquals(0, report.total());
    }

    private RemoteFile job(String name) {
        return RemoteFile.of(course, name, new FakeSource(name, new byte[0]));
    }
}
