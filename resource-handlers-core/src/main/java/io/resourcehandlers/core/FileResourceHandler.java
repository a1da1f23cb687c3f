package io.resourcehandlers.core;

import io.resourcehandlers.spi.MimeData;
import io.resourcehandlers.spi.MimeType;
import io.resourcehandlers.spi.ResourceException;
import io.resourcehandlers.spi.ResourceUrlHandler;
import io.resourcehandlers.spi.Schemes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.AccessDeniedException;
import java.nio.file.FileSystemNotFoundException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * {@link ResourceUrlHandler} for {@code file:} URLs on the local file system.
 *
 * <p>Reads at most {@link #readLimit()} bytes; larger files fail with
 * {@link ResourceException.Reason#TOO_LARGE}. The mime type is guessed from the file name.
 */
public final class FileResourceHandler implements ResourceUrlHandler {

    private static final Logger log = LoggerFactory.getLogger(FileResourceHandler.class);

    private static final List<String> SCHEMES = List.of("file");

    private final long readLimit;

    /**
     * @param readLimit maximum number of bytes to read from a single file
     */
    public FileResourceHandler(long readLimit) {
        if (readLimit <= 0) {
            throw new IllegalArgumentException("readLimit must be positive: " + readLimit);
        }
        this.readLimit = readLimit;
    }

    public long readLimit() {
        return readLimit;
    }

    @Override
    public MimeData readResource(URI url) throws ResourceException {
        Path path = toPath(Schemes.filterSchemes(SCHEMES, url));
        log.debug("Reading {} from file {}", url, path);

        if (Files.isDirectory(path)) {
            throw new ResourceException.ReadFailed(ResourceException.Reason.IO, "Cannot read directory " + path);
        }

        byte[] data;
        try (InputStream in = Files.newInputStream(path)) {
            data = ReadLimiter.readAll(in, readLimit);
        } catch (NoSuchFileException e) {
            throw new ResourceException.ReadFailed(ResourceException.Reason.NOT_FOUND, "File not found: " + path, e);
        } catch (AccessDeniedException e) {
            throw new ResourceException.ReadFailed(
                    ResourceException.Reason.PERMISSION_DENIED, "Permission denied: " + path, e);
        } catch (ReadLimiter.LimitExceededException e) {
            throw new ResourceException.ReadFailed(ResourceException.Reason.TOO_LARGE,
                    "File " + path + " exceeds read limit of " + readLimit + " bytes", e);
        } catch (IOException e) {
            throw new ResourceException.ReadFailed(
                    ResourceException.Reason.IO, "Failed to read " + path + ": " + e.getMessage(), e);
        }

        Optional<MimeType> mimeType = MimeTypes.guess(path);
        if (mimeType.isEmpty()) {
            log.debug("Failed to guess mime type of {}", path);
        }
        return MimeData.of(mimeType.orElse(null), data);
    }

    private static Path toPath(URI url) throws ResourceException.Unsupported {
        String authority = url.getAuthority();
        if (authority != null && !"localhost".equalsIgnoreCase(authority)) {
            throw unsupportedPath(url, null);
        }
        if (url.getPath() == null || url.getPath().isEmpty()) {
            throw unsupportedPath(url, null);
        }
        // Only the path names the file; query and fragment are ignored.
        try {
            return Path.of(new URI("file", null, url.getPath(), null, null));
        } catch (URISyntaxException | IllegalArgumentException | FileSystemNotFoundException e) {
            throw unsupportedPath(url, e);
        }
    }

    private static ResourceException.Unsupported unsupportedPath(URI url, Exception cause) {
        return new ResourceException.Unsupported("Cannot convert URL " + url + " to file path", cause);
    }

    @Override
    public String toString() {
        return "FileResourceHandler{readLimit=" + readLimit + "}";
    }
}
