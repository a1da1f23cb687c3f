package io.resourcehandlers.spring_boot_starter;

import io.resourcehandlers.core.ResourceHandlers;
import io.resourcehandlers.spi.DispatchingResourceHandler;
import io.resourcehandlers.spi.ResourceUrlHandler;
import io.resourcehandlers.spi.ResourceUrlHandlerProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for resource handlers.
 *
 * <p>Provides a default {@link ResourceUrlHandler} bean which dispatches, in order, to:
 * <ol>
 *   <li>handlers from {@link ResourceUrlHandlerProvider} beans, in {@code @Order}</li>
 *   <li>the file handler, unless {@code resource-handlers.file.enabled=false}</li>
 *   <li>the {@code data:} URL handler, unless {@code resource-handlers.data.enabled=false}</li>
 *   <li>ServiceLoader providers, if {@code resource-handlers.discover=true}</li>
 * </ol>
 *
 * <p>Override by defining your own ResourceUrlHandler bean. Contribute handlers for other
 * schemes, for example HTTP, by defining a provider bean:
 * <pre>{@code
 * @Bean
 * @Order(1)
 * public ResourceUrlHandlerProvider httpResources(MyHttpResourceHandler handler) {
 *     return () -> List.of(handler);
 * }
 * }</pre>
 */
@AutoConfiguration
@ConditionalOnClass({ResourceHandlers.class, DispatchingResourceHandler.class})
@EnableConfigurationProperties(ResourceHandlersProperties.class)
public class ResourceHandlersAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(ResourceHandlersAutoConfiguration.class);

    /**
     * Provides the default {@link ResourceUrlHandler}.
     * Override by defining your own ResourceUrlHandler bean.
     */
    @Bean
    @ConditionalOnMissingBean
    public ResourceUrlHandler resourceUrlHandler(ResourceHandlersProperties properties,
                                                 ObjectProvider<ResourceUrlHandlerProvider> providers) {
        if (!properties.isEnabled()) {
            log.info("Resource handlers disabled; no resources will be read");
            return ResourceHandlers.none();
        }

        ResourceHandlers.Builder builder = ResourceHandlers.builder().readLimit(properties.getReadLimit());
        providers.orderedStream().forEach(p -> builder.handlers(p.handlers()));
        if (properties.getFile().isEnabled()) {
            builder.fileHandler();
        }
        if (properties.getData().isEnabled()) {
            builder.dataUrlHandler();
        }
        if (properties.isDiscover()) {
            builder.discover(ResourceHandlersAutoConfiguration.class.getClassLoader());
        }
        return builder.build();
    }
}
