package io.resourcehandlers.core;

import io.resourcehandlers.spi.MimeType;

import java.net.URLConnection;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Guesses mime types from file names.
 *
 * <p>Image formats come from a built-in table since the JDK file name map misses several of
 * them (webp, avif, svg on some platforms). Anything else falls back to
 * {@link URLConnection#getFileNameMap()}.
 */
public final class MimeTypes {
    private MimeTypes() {}

    private static final Map<String, String> BY_EXTENSION = Map.ofEntries(
            Map.entry("png", "image/png"),
            Map.entry("jpg", "image/jpeg"),
            Map.entry("jpeg", "image/jpeg"),
            Map.entry("gif", "image/gif"),
            Map.entry("webp", "image/webp"),
            Map.entry("avif", "image/avif"),
            Map.entry("svg", "image/svg+xml"),
            Map.entry("bmp", "image/bmp"),
            Map.entry("ico", "image/x-icon"),
            Map.entry("tif", "image/tiff"),
            Map.entry("tiff", "image/tiff"),
            Map.entry("pdf", "application/pdf"),
            Map.entry("txt", "text/plain"),
            Map.entry("md", "text/markdown"),
            Map.entry("markdown", "text/markdown"),
            Map.entry("html", "text/html"),
            Map.entry("htm", "text/html"),
            Map.entry("css", "text/css"),
            Map.entry("js", "text/javascript"),
            Map.entry("json", "application/json"),
            Map.entry("xml", "application/xml")
    );

    public static Optional<MimeType> guess(Path path) {
        if (path == null) return Optional.empty();
        Path fileName = path.getFileName();
        return fileName == null ? Optional.empty() : guess(fileName.toString());
    }

    public static Optional<MimeType> guess(String fileName) {
        if (fileName == null) return Optional.empty();
        int dot = fileName.lastIndexOf('.');
        if (dot < 0 || dot == fileName.length() - 1) return Optional.empty();

        String ext = fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
        String known = BY_EXTENSION.get(ext);
        if (known != null) {
            return Optional.of(MimeType.parse(known));
        }
        return MimeType.tryParse(URLConnection.getFileNameMap().getContentTypeFor(fileName));
    }
}
