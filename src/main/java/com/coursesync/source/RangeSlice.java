package com.coursesync.source;

/**
 * Bytes returned for a range request. May be shorter than requested when the
 * resource ends inside the range, and empty when the range starts past the end.
 *
 * @param offset      first byte position of {@code bytes}
 * @param bytes       the data
 * @param totalLength total resource length if the source reported it, otherwise {@code -1}
 */
public record RangeSlice(
        long offset,
        byte[] bytes,
        long totalLength
) {
    public RangeSlice {
        if (offset < 0) {
            throw new IllegalArgumentException("offset cannot be negative");
        }
        bytes = bytes != null ? bytes : new byte[0];
    }

    public static RangeSlice empty(long offset, long totalLength) {
        return new RangeSlice(offset, new byte[0], totalLength);
    }

    public int length() {
        return bytes.length;
    }

    public boolean isShorterThan(int requested) {
        return bytes.length < requested;
    }
}
