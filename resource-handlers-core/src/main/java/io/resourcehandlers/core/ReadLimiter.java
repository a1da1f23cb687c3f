package io.resourcehandlers.core;

import java.io.IOException;
import java.io.InputStream;

/**
 * Reads whole resources up to a size limit.
 */
final class ReadLimiter {

    // Largest array the JDK reliably allocates.
    private static final int MAX_ARRAY = Integer.MAX_VALUE - 8;

    private ReadLimiter() {}

    /**
     * Reads {@code in} to the end.
     *
     * @param in the resource content
     * @param maxBytes maximum resource size in bytes, must be positive
     * @return every byte of {@code in}
     * @throws LimitExceededException if {@code in} holds more than {@code maxBytes} bytes
     */
    static byte[] readAll(InputStream in, long maxBytes) throws IOException {
        if (maxBytes <= 0) {
            throw new IllegalArgumentException("maxBytes must be positive: " + maxBytes);
        }
        int cap = (int) Math.min(maxBytes, MAX_ARRAY);
        byte[] data = in.readNBytes(cap);
        if (data.length == cap && in.read() >= 0) {
            throw new LimitExceededException(maxBytes);
        }
        return data;
    }

    /**
     * Thrown when a resource is larger than the read limit.
     */
    static final class LimitExceededException extends IOException {
        private final long maxBytes;

        LimitExceededException(long maxBytes) {
            super("Resource exceeds maximum size of " + maxBytes + " bytes");
            this.maxBytes = maxBytes;
        }

        long maxBytes() {
            return maxBytes;
        }
    }
}
