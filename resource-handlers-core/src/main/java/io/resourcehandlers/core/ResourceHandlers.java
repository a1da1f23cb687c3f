package io.resourcehandlers.core;

import io.resourcehandlers.spi.DispatchingResourceHandler;
import io.resourcehandlers.spi.NoopResourceHandler;
import io.resourcehandlers.spi.ResourceUrlHandler;
import io.resourcehandlers.spi.ResourceUrlHandlerProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.ServiceLoader;

/**
 * Entry point for assembling resource handlers.
 *
 * <p>Use {@link #builder()} to compose handlers explicitly:
 * <pre>{@code
 * ResourceUrlHandler handler = ResourceHandlers.builder()
 *     .readLimit(10 * 1024 * 1024)
 *     .fileHandler()
 *     .dataUrlHandler()
 *     .handler(myHttpHandler)
 *     .build();
 * }</pre>
 *
 * <p>Handlers are dispatched in the order they were added to the builder.
 */
public final class ResourceHandlers {
    private ResourceHandlers() {}

    private static final Logger log = LoggerFactory.getLogger(ResourceHandlers.class);

    /** Default maximum size of a single resource: 100 MiB. */
    public static final long DEFAULT_READ_LIMIT = 104_857_600L;

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Handlers for local resources only: files, then {@code data:} URLs.
     */
    public static DispatchingResourceHandler localDefaults() {
        return builder().fileHandler().dataUrlHandler().build();
    }

    /**
     * A handler which reads nothing, for sandboxed rendering.
     */
    public static ResourceUrlHandler none() {
        return NoopResourceHandler.INSTANCE;
    }

    /**
     * Loads all handlers published through {@link ResourceUrlHandlerProvider}.
     *
     * @param cl the class loader to search
     * @return handlers in provider discovery order
     */
    public static List<ResourceUrlHandler> discover(ClassLoader cl) {
        Objects.requireNonNull(cl, "cl");
        List<ResourceUrlHandler> handlers = new ArrayList<>();
        ServiceLoader<ResourceUrlHandlerProvider> loader = ServiceLoader.load(ResourceUrlHandlerProvider.class, cl);
        for (ResourceUrlHandlerProvider p : loader) {
            List<ResourceUrlHandler> provided = p.handlers();
            if (provided == null) continue;
            for (ResourceUrlHandler h : provided) {
                if (h != null) handlers.add(h);
            }
            log.debug("Discovered {} resource handler(s) from {}", provided.size(), p.getClass().getName());
        }
        return handlers;
    }

    /**
     * Builder for a {@link DispatchingResourceHandler}.
     */
    public static final class Builder {
        private final List<ResourceUrlHandler> handlers = new ArrayList<>();
        private long readLimit = DEFAULT_READ_LIMIT;

        private Builder() {}

        /**
         * Maximum size of a single resource for handlers added after this call.
         *
         * @param readLimit limit in bytes, must be positive
         * @return this builder
         */
        public Builder readLimit(long readLimit) {
            if (readLimit <= 0) {
                throw new IllegalArgumentException("readLimit must be positive: " + readLimit);
            }
            this.readLimit = readLimit;
            return this;
        }

        public Builder fileHandler() {
            return handler(new FileResourceHandler(readLimit));
        }

        public Builder dataUrlHandler() {
            return handler(new DataUrlResourceHandler(readLimit));
        }

        public Builder handler(ResourceUrlHandler handler) {
            handlers.add(Objects.requireNonNull(handler, "handler"));
            return this;
        }

        public Builder handlers(Iterable<? extends ResourceUrlHandler> handlers) {
            for (ResourceUrlHandler handler : handlers) {
                handler(handler);
            }
            return this;
        }

        /**
         * Appends every handler published through {@link ResourceUrlHandlerProvider}.
         */
        public Builder discover(ClassLoader cl) {
            return handlers(ResourceHandlers.discover(cl));
        }

        public Builder discover() {
            return discover(Thread.currentThread().getContextClassLoader());
        }

        public DispatchingResourceHandler build() {
            log.debug("Resource handlers: {}", handlers);
            return new DispatchingResourceHandler(handlers);
        }
    }
}
