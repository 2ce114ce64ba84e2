package com.coursesync.index;

import com.coursesync.domain.Course;
import com.coursesync.domain.Fingerprint;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Simple in-memory index for tests.
 * Not persistent - state is lost on restart.
 */
public class InMemoryFingerprintIndex implements FingerprintIndex {

    private final Map<String, Set<Fingerprint>> byCourse = new ConcurrentHashMap<>();

    @Override
    public boolean contains(Course course, Fingerprint fingerprint) {
        Set<Fingerprint> known = byCourse.get(course.id());
        return known != null && known.contains(fingerprint);
    }

    @Override
    public boolean insert(Course course, Fingerprint fingerprint) {
        return byCourse.computeIfAbsent(course.id(), id -> ConcurrentHashMap.newKeySet()).add(fingerprint);
    }

    @Override
    public int size(Course course) {
        Set<Fingerprint> known = byCourse.get(course.id());
        return known != null ? known.size() : 0;
    }
}
