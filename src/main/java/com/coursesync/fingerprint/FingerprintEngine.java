package com.coursesync.fingerprint;

import com.coursesync.config.SyncSettings;
import com.coursesync.domain.Fingerprint;
import com.coursesync.domain.RemoteFile;
import com.coursesync.fingerprint.ExtensionPolicyTable.Window;
import com.coursesync.source.ByteRangeSource;
import com.coursesync.source.RangeSlice;
import com.coursesync.util.StopSignal;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Computes content fingerprints from a small byte window instead of the whole file.
 * <p>
 * The window is {@code [skip, skip + read)} as configured for the file's extension.
 * The skip hides headers that differ between otherwise identical copies. When the file
 * is too short for the window, the first {@code read} bytes are hashed instead, so a short
 * file never fails to fingerprint.
 */
@ApplicationScoped
public class FingerprintEngine {

    private static final Logger LOG = Logger.getLogger(FingerprintEngine.class);

    private final ExtensionPolicyTable policy;

    @Inject
    public FingerprintEngine(SyncSettings settings) {
        this(settings.extensionPolicy());
    }

    public FingerprintEngine(ExtensionPolicyTable policy) {
        if (policy == null) {
            throw new IllegalArgumentException("policy cannot be null");
        }
        this.policy = policy;
    }

    public ExtensionPolicyTable policy() {
        return policy;
    }

    public Fingerprint fingerprint(RemoteFile file, StopSignal stop) throws IOException {
        return fingerprint(file.source(), file.extension(), stop);
    }

    public Fingerprint fingerprint(ByteRangeSource source, String extension, StopSignal stop) throws IOException {
        Window window = policy.windowFor(extension);
        RangeSlice slice = source.fetchRange(window.skipBytes(), window.readBytes(), stop);

        if (slice.isShorterThan(window.readBytes()) && window.skipBytes() > 0) {
            LOG.debugf("%s is shorter than window %d+%d, hashing from offset 0",
                    source.describe(), window.skipBytes(), window.readBytes());
            slice = source.fetchRange(0, window.readBytes(), stop);
        }
        return digest(slice.bytes());
    }

    /**
     * SHA-256 of the window bytes.
     */
    public static Fingerprint digest(byte[] window) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return Fingerprint.of(digest.digest(window));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
