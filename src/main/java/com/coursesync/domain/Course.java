package com.coursesync.domain;

import com.coursesync.util.FileNames;

/**
 * A course as handed over by enumeration. Owns one slice of the fingerprint index.
 */
public record Course(
        String id,
        String displayName
) {
    public Course {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Course id cannot be blank");
        }
        displayName = displayName == null || displayName.isBlank() ? id : displayName;
    }

    /**
     * Folder name of this course below the download directory.
     */
    public String directoryName() {
        return FileNames.sanitize(displayName);
    }

    public static Course of(String id) {
        return new Course(id, id);
    }
}
