package com.coursesync.index;

import com.coursesync.domain.Course;
import com.coursesync.domain.Fingerprint;

/**
 * Per-course set of fingerprints whose content is known to be present locally.
 * Implementations are safe for concurrent use by all workers.
 * <p>
 * A fingerprint may only be inserted after its content was durably written or
 * confirmed to exist locally, never ahead of that.
 */
public interface FingerprintIndex {

    /**
     * Prepares the backing storage. Failure here aborts the run.
     */
    default void open() {
    }

    boolean contains(Course course, Fingerprint fingerprint);

    /**
     * Adds a fingerprint. Inserting a known fingerprint is a no-op.
     *
     * @return true if the fingerprint was not present before
     */
    boolean insert(Course course, Fingerprint fingerprint);

    int size(Course course);
}
