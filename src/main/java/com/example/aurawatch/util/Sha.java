package com.example.aurawatch.util;

import com.example.aurawatch.model.Fingerprint;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

public final class Sha {

    // One SHA-256 instance per thread; MessageDigest is not thread-safe.
    private static final ThreadLocal<MessageDigest> SHA256_THREAD_LOCAL = ThreadLocal.withInitial(() -> {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    });

    private Sha() {
    }

    /**
     * SHA-256 over the concatenation of {@code parts}, in order.
     */
    public static Fingerprint sha256(Iterable<byte[]> parts) {
        MessageDigest digest = SHA256_THREAD_LOCAL.get();
        digest.reset();
        for (byte[] part : parts) {
            digest.update(part);
        }
        return new Fingerprint(digest.digest());
    }
}
