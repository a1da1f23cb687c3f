package io.resourcehandlers.spi;

import java.io.IOException;
import java.util.Objects;

/**
 * Failure raised by a {@link ResourceUrlHandler}.
 *
 * <p>There are exactly two cases:
 * <ul>
 *   <li>{@link Unsupported}: the handler does not handle this URL; a dispatching handler
 *       moves on to the next handler.</li>
 *   <li>{@link ReadFailed}: the handler owns the URL but could not read it. This is terminal
 *       for the whole resolution attempt.</li>
 * </ul>
 */
public abstract class ResourceException extends IOException {

    private ResourceException(String message) {
        super(message);
    }

    private ResourceException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Whether this failure only signals that the URL is outside the handler's domain.
     *
     * @return {@code true} for {@link Unsupported}
     */
    public abstract boolean isUnsupported();

    /**
     * Raised when a handler does not know how to read a URL.
     */
    public static final class Unsupported extends ResourceException {
        public Unsupported(String message) {
            super(message);
        }

        public Unsupported(String message, Throwable cause) {
            super(message, cause);
        }

        @Override
        public boolean isUnsupported() {
            return true;
        }
    }

    /**
     * Raised when a handler recognized a URL but reading it failed.
     */
    public static final class ReadFailed extends ResourceException {
        private final Reason reason;

        public ReadFailed(Reason reason, String message) {
            super(message);
            this.reason = Objects.requireNonNull(reason, "reason");
        }

        public ReadFailed(Reason reason, String message, Throwable cause) {
            super(message, cause);
            this.reason = Objects.requireNonNull(reason, "reason");
        }

        public Reason reason() {
            return reason;
        }

        @Override
        public boolean isUnsupported() {
            return false;
        }
    }

    /**
     * Classification of a {@link ReadFailed}.
     */
    public enum Reason {
        NOT_FOUND,
        PERMISSION_DENIED,
        /** The resource exists but its content is malformed. */
        INVALID_DATA,
        /** The resource exceeds the configured read limit. */
        TOO_LARGE,
        IO
    }
}
