package io.resourcehandlers.core;

import io.resourcehandlers.spi.DispatchingResourceHandler;
import io.resourcehandlers.spi.MimeData;
import io.resourcehandlers.spi.NoopResourceHandler;
import io.resourcehandlers.spi.ResourceException;
import io.resourcehandlers.spi.ResourceUrlHandler;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResourceHandlersTest {

    @TempDir
    Path dir;

    @Test
    void localDefaultsReadFilesAndDataUrls() throws Exception {
        Path file = Files.write(dir.resolve("notes.md"), "# hi".getBytes(StandardCharsets.UTF_8));
        DispatchingResourceHandler handler = ResourceHandlers.localDefaults();

        assertThat(handler.handlers()).hasSize(2);
        assertThat(handler.handlers().get(0)).isInstanceOf(FileResourceHandler.class);
        assertThat(handler.handlers().get(1)).isInstanceOf(DataUrlResourceHandler.class);
        assertThat(handler.readResource(file.toUri()).mimeTypeEssence()).contains("text/markdown");
        assertThat(handler.readResource(URI.create("data:,x")).data()).containsExactly('x');
    }

    @Test
    void localDefaultsServeConcurrentReaders() throws Exception {
        DispatchingResourceHandler handler = ResourceHandlers.localDefaults();
        List<URI> urls = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            urls.add(Files.write(dir.resolve("f" + i + ".txt"), ("file-" + i).getBytes(StandardCharsets.UTF_8)).toUri());
            urls.add(URI.create("data:,data-" + i));
        }

        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Callable<String>> reads = new ArrayList<>();
            for (int round = 0; round < 25; round++) {
                for (URI url : urls) {
                    reads.add(() -> new String(handler.readResource(url).data(), StandardCharsets.UTF_8));
                }
            }
            List<Future<String>> results = pool.invokeAll(reads);
            for (int i = 0; i < results.size(); i++) {
                int index = i % urls.size();
                String expected = (index % 2 == 0 ? "file-" : "data-") + index / 2;
                assertThat(results.get(i).get(10, TimeUnit.SECONDS)).isEqualTo(expected);
            }
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void localDefaultsDoNotSupportRemoteUrls() {
        assertThatThrownBy(() -> ResourceHandlers.localDefaults().readResource(URI.create("https://example.com/a.png")))
                .isInstanceOf(ResourceException.Unsupported.class);
    }

    @Test
    void localDefaultsPropagateFileFailures() {
        URI missing = dir.resolve("missing.png").toUri();

        assertThatThrownBy(() -> ResourceHandlers.localDefaults().readResource(missing))
                .isInstanceOfSatisfying(ResourceException.ReadFailed.class,
                        e -> assertThat(e.reason()).isEqualTo(ResourceException.Reason.NOT_FOUND));
    }

    @Test
    void builderKeepsCallOrder() throws Exception {
        List<String> calls = new ArrayList<>();
        ResourceUrlHandler first = url -> {
            calls.add("first");
            throw new ResourceException.Unsupported("no");
        };
        ResourceUrlHandler second = url -> {
            calls.add("second");
            return MimeData.of(new byte[] {2});
        };

        DispatchingResourceHandler handler = ResourceHandlers.builder()
                .handler(first)
                .dataUrlHandler()
                .handler(second)
                .build();

        assertThat(handler.readResource(URI.create("custom:thing")).data()).containsExactly(2);
        assertThat(calls).containsExactly("first", "second");
        assertThat(handler.handlers().get(1)).isInstanceOf(DataUrlResourceHandler.class);
    }

    @Test
    void readLimitAppliesToHandlersAddedAfterIt() {
        DispatchingResourceHandler handler = ResourceHandlers.builder()
                .fileHandler()
                .readLimit(10)
                .dataUrlHandler()
                .build();

        assertThat(((FileResourceHandler) handler.handlers().get(0)).readLimit())
                .isEqualTo(ResourceHandlers.DEFAULT_READ_LIMIT);
        assertThat(((DataUrlResourceHandler) handler.handlers().get(1)).readLimit()).isEqualTo(10);
    }

    @Test
    void discoverLoadsRegisteredProviders() throws Exception {
        DispatchingResourceHandler handler = ResourceHandlers.builder()
                .dataUrlHandler()
                .discover(getClass().getClassLoader())
                .build();

        MimeData data = handler.readResource(URI.create("memo:remember-me"));

        assertThat(data.mimeType()).contains(MemoSchemeHandlerProvider.TEXT);
        assertThat(new String(data.data(), StandardCharsets.UTF_8)).isEqualTo("remember-me");
    }

    @Test
    void noneSupportsNothing() {
        assertThat(ResourceHandlers.none()).isSameAs(NoopResourceHandler.INSTANCE);
        assertThatThrownBy(() -> ResourceHandlers.none().readResource(URI.create("data:,x")))
                .isInstanceOf(ResourceException.Unsupported.class);
    }

    @Test
    void builderRejectsNonPositiveReadLimit() {
        assertThatThrownBy(() -> ResourceHandlers.builder().readLimit(-1))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
