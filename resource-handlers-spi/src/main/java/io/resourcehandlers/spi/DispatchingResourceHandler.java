package io.resourcehandlers.spi;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.List;
import java.util.Objects;

/**
 * A resource handler which dispatches reading among a list of inner handlers.
 *
 * <p>Handlers are tried in list order, so earlier handlers take precedence. The list is
 * fixed at construction. A dispatcher is itself a handler and can be nested in another one.
 */
public final class DispatchingResourceHandler implements ResourceUrlHandler {

    private static final Logger log = LoggerFactory.getLogger(DispatchingResourceHandler.class);

    private final List<ResourceUrlHandler> handlers;

    public DispatchingResourceHandler(List<? extends ResourceUrlHandler> handlers) {
        Objects.requireNonNull(handlers, "handlers");
        this.handlers = List.copyOf(handlers);
    }

    public static DispatchingResourceHandler of(ResourceUrlHandler... handlers) {
        return new DispatchingResourceHandler(List.of(handlers));
    }

    public List<ResourceUrlHandler> handlers() {
        return handlers;
    }

    /**
     * Reads {@code url} with the first handler that supports it.
     *
     * <p>Moves on to the next handler while handlers throw
     * {@link ResourceException.Unsupported}. Any other failure is rethrown as is, without
     * consulting later handlers.
     *
     * @throws ResourceException.Unsupported if no handler supports {@code url}
     */
    @Override
    public MimeData readResource(URI url) throws ResourceException {
        Objects.requireNonNull(url, "url");
        for (ResourceUrlHandler handler : handlers) {
            try {
                MimeData data = Objects.requireNonNull(handler.readResource(url), () -> handler + " returned null");
                log.debug("Read {} bytes from {} with {}", data.size(), url, handler);
                return data;
            } catch (ResourceException e) {
                if (!e.isUnsupported()) {
                    log.debug("Reading {} with {} failed: {}", url, handler, e.getMessage());
                    throw e;
                }
                log.trace("{} declined {}: {}", handler, url, e.getMessage());
            }
        }
        throw new ResourceException.Unsupported("No handler supported reading from " + url);
    }

    @Override
    public String toString() {
        return "DispatchingResourceHandler" + handlers;
    }
}
