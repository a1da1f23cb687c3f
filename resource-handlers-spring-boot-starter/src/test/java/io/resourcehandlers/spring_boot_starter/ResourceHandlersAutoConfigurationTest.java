package io.resourcehandlers.spring_boot_starter;

import io.resourcehandlers.core.DataUrlResourceHandler;
import io.resourcehandlers.core.FileResourceHandler;
import io.resourcehandlers.spi.DispatchingResourceHandler;
import io.resourcehandlers.spi.MimeData;
import io.resourcehandlers.spi.NoopResourceHandler;
import io.resourcehandlers.spi.ResourceException;
import io.resourcehandlers.spi.ResourceUrlHandler;
import io.resourcehandlers.spi.ResourceUrlHandlerProvider;
import io.resourcehandlers.spi.Schemes;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.URI;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResourceHandlersAutoConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(ResourceHandlersAutoConfiguration.class));

    @Test
    void defaultHandlerDispatchesToFileThenData() {
        runner.run(context -> {
            assertThat(context).hasSingleBean(ResourceUrlHandler.class);
            DispatchingResourceHandler handler = context.getBean(DispatchingResourceHandler.class);
            assertThat(handler.handlers()).hasSize(2);
            assertThat(handler.handlers().get(0)).isInstanceOf(FileResourceHandler.class);
            assertThat(handler.handlers().get(1)).isInstanceOf(DataUrlResourceHandler.class);
            assertThat(handler.readResource(URI.create("data:,ok")).size()).isEqualTo(2);
        });
    }

    @Test
    void readLimitIsApplied() {
        runner.withPropertyValues("resource-handlers.read-limit=3").run(context -> {
            ResourceUrlHandler handler = context.getBean(ResourceUrlHandler.class);
            assertThatThrownBy(() -> handler.readResource(URI.create("data:,toolong")))
                    .isInstanceOfSatisfying(ResourceException.ReadFailed.class,
                            e -> assertThat(e.reason()).isEqualTo(ResourceException.Reason.TOO_LARGE));
        });
    }

    @Test
    void individualHandlersCanBeDisabled() {
        runner.withPropertyValues("resource-handlers.file.enabled=false").run(context -> {
            DispatchingResourceHandler handler = context.getBean(DispatchingResourceHandler.class);
            assertThat(handler.handlers()).singleElement().isInstanceOf(DataUrlResourceHandler.class);
        });
    }

    @Test
    void disabledYieldsNoopHandler() {
        runner.withPropertyValues("resource-handlers.enabled=false").run(context ->
                assertThat(context.getBean(ResourceUrlHandler.class)).isSameAs(NoopResourceHandler.INSTANCE));
    }

    @Test
    void providerBeansComeFirst() {
        runner.withUserConfiguration(ProviderConfig.class).run(context -> {
            DispatchingResourceHandler handler = context.getBean(DispatchingResourceHandler.class);
            assertThat(handler.handlers()).hasSize(3);
            assertThat(handler.readResource(URI.create("test:anything")).data()).containsExactly(42);
        });
    }

    @Test
    void userHandlerWins() {
        runner.withUserConfiguration(CustomHandlerConfig.class).run(context -> {
            assertThat(context).hasSingleBean(ResourceUrlHandler.class);
            assertThat(context.getBean(ResourceUrlHandler.class)).isSameAs(CustomHandlerConfig.HANDLER);
        });
    }

    @Configuration(proxyBeanMethods = false)
    static class ProviderConfig {
        @Bean
        ResourceUrlHandlerProvider testSchemeProvider() {
            ResourceUrlHandler handler = url -> {
                Schemes.filterSchemes(url, "test");
                return MimeData.of(new byte[] {42});
            };
            return () -> List.of(handler);
        }
    }

    @Configuration(proxyBeanMethods = false)
    static class CustomHandlerConfig {
        static final ResourceUrlHandler HANDLER = NoopResourceHandler.INSTANCE;

        @Bean
        ResourceUrlHandler customHandler() {
            return HANDLER;
        }
    }
}
