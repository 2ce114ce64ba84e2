package com.coursesync.orchestration;

import com.coursesync.domain.JobResult;
import com.coursesync.domain.JobState;
import com.coursesync.domain.RemoteFile;

/**
 * Observer for job progress. Called from worker threads, in no particular order across jobs.
 */
public interface JobListener {

    void onTransition(RemoteFile job, JobState from, JobState to);

    default void onResult(JobResult result) {
    }

    static JobListener noop() {
        return (job, from, to) -> {
        };
    }

    static JobListener compose(JobListener first, JobListener second) {
        return new JobListener() {
            @Override
            public void onTransition(RemoteFile job, JobState from, JobState to) {
                first.onTransition(job, from, to);
                second.onTransition(job, from, to);
            }

            @Override
            public void onResult(JobResult result) {
                first.onResult(result);
                second.onResult(result);
            }
        };
    }
}
