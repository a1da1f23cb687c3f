package io.resourcehandlers.spi;

import java.net.URI;

/**
 * A resource handler which doesn't read anything.
 *
 * <p>Useful for sandboxed rendering where no resource access is allowed.
 */
public enum NoopResourceHandler implements ResourceUrlHandler {
    INSTANCE;

    /**
     * Always throws {@link ResourceException.Unsupported}.
     */
    @Override
    public MimeData readResource(URI url) throws ResourceException {
        throw new ResourceException.Unsupported("Reading from resource " + url + " is not supported");
    }
}
