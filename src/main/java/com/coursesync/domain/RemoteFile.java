package com.coursesync.domain;

import com.coursesync.source.ByteRangeSource;
import com.coursesync.util.FileNames;

/**
 * One candidate file for download. A job is claimed and processed by exactly one worker.
 *
 * @param course            owning course
 * @param displayName       file name as presented by the portal, sanitized for the local filesystem
 * @param relativeDirectory folder below the course directory, {@code ""} for the course root
 * @param extension         normalized extension without dot, {@code ""} if none
 * @param declaredSize      advisory size in bytes, {@code -1} if unknown
 * @param source            byte-range capable reader for the content
 */
public record RemoteFile(
        Course course,
        String displayName,
        String relativeDirectory,
        String extension,
        long declaredSize,
        ByteRangeSource source
) {
    public RemoteFile {
        if (course == null) {
            throw new IllegalArgumentException("course cannot be null");
        }
        if (displayName == null || displayName.isBlank()) {
            throw new IllegalArgumentException("displayName cannot be blank");
        }
        if (source == null) {
            throw new IllegalArgumentException("source cannot be null");
        }
        displayName = FileNames.sanitize(displayName);
        relativeDirectory = FileNames.sanitizeDirectory(relativeDirectory);
        extension = extension == null || extension.isBlank()
                ? FileNames.extensionOf(displayName)
                : FileNames.normalizeExtension(extension);
        declaredSize = declaredSize < 0 ? -1 : declaredSize;
    }

    public static RemoteFile of(Course course, String displayName, ByteRangeSource source) {
        return new RemoteFile(course, displayName, "", null, -1, source);
    }

    /**
     * Path of the file below the download root, using {@code /} separators.
     */
    public String destinationPath() {
        String courseDir = course.directoryName();
        if (relativeDirectory.isEmpty()) {
            return courseDir + "/" + displayName;
        }
        return courseDir + "/" + relativeDirectory + "/" + displayName;
    }

    @Override
    public String toString() {
        return course.id() + ":" + destinationPath();
    }
}
