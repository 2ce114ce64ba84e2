package com.coursesync.domain;

import java.util.Arrays;
import java.util.HexFormat;

/**
 * Content identity derived from a policy window of a file. Equality is the only
 * operation that matters; there is no ordering.
 */
public final class Fingerprint {

    public static final int LENGTH = 32;

    private static final HexFormat HEX = HexFormat.of();

    private final byte[] digest;

    private Fingerprint(byte[] digest) {
        this.digest = digest;
    }

    public static Fingerprint of(byte[] digest) {
        if (digest == null || digest.length != LENGTH) {
            throw new IllegalArgumentException("Fingerprint must be " + LENGTH + " bytes");
        }
        return new Fingerprint(digest.clone());
    }

    public static Fingerprint fromHex(String hex) {
        if (hex == null || hex.length() != LENGTH * 2) {
            throw new IllegalArgumentException("Fingerprint hex must be " + (LENGTH * 2) + " characters: " + hex);
        }
        return new Fingerprint(HEX.parseHex(hex));
    }

    public String toHex() {
        return HEX.formatHex(digest);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof Fingerprint other && Arrays.equals(digest, other.digest);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(digest);
    }

    @Override
    public String toString() {
        return toHex().substring(0, 12);
    }
}
