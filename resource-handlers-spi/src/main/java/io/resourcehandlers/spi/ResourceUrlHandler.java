package io.resourcehandlers.spi;

import java.net.URI;
import java.util.List;

/**
 * Reads the resources behind URLs referenced from a document.
 *
 * <p>An implementation either returns the data, throws {@link ResourceException.Unsupported}
 * to say the URL is not in its domain, or throws {@link ResourceException.ReadFailed} when it
 * owns the URL but reading failed. Only {@code Unsupported} lets a
 * {@link DispatchingResourceHandler} try another handler.
 *
 * <p>Implementations must be thread-safe; the same instance may serve concurrent reads.
 *
 * <p>Example usage:
 * <pre>{@code
 * ResourceUrlHandler handler = ResourceUrlHandler.dispatching(
 *         new FileResourceHandler(ResourceHandlers.DEFAULT_READ_LIMIT),
 *         NoopResourceHandler.INSTANCE);
 * MimeData image = handler.readResource(URI.create("file:///tmp/logo.png"));
 * }</pre>
 */
@FunctionalInterface
public interface ResourceUrlHandler {

    /**
     * Reads the resource at {@code url}.
     *
     * @param url an absolute URL
     * @return the data and its mime type if known
     * @throws ResourceException.Unsupported if this handler does not handle {@code url}
     * @throws ResourceException.ReadFailed if reading a supported {@code url} failed
     */
    MimeData readResource(URI url) throws ResourceException;

    /**
     * A handler which supports nothing.
     */
    static ResourceUrlHandler noop() {
        return NoopResourceHandler.INSTANCE;
    }

    /**
     * A handler which tries {@code handlers} in the given order.
     */
    static DispatchingResourceHandler dispatching(ResourceUrlHandler... handlers) {
        return new DispatchingResourceHandler(List.of(handlers));
    }
}
