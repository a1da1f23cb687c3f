package io.resourcehandlers.spi;

import java.util.List;

/**
 * ServiceLoader provider for {@link ResourceUrlHandler}.
 *
 * <p>Modules which ship handlers for additional schemes register implementations
 * via {@code META-INF/services}.
 */
public interface ResourceUrlHandlerProvider {
    List<ResourceUrlHandler> handlers();
}
