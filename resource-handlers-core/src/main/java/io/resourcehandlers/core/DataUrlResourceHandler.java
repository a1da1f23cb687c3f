package io.resourcehandlers.core;

import io.resourcehandlers.spi.MimeData;
import io.resourcehandlers.spi.MimeType;
import io.resourcehandlers.spi.ResourceException;
import io.resourcehandlers.spi.ResourceUrlHandler;
import io.resourcehandlers.spi.Schemes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.List;
import java.util.Locale;

/**
 * {@link ResourceUrlHandler} for {@code data:} URLs (RFC 2397).
 *
 * <p>Format: {@code data:[<mediatype>][;base64],<data>}. Without a media type the data is
 * {@code text/plain;charset=US-ASCII}. Malformed URLs fail with
 * {@link ResourceException.Reason#INVALID_DATA}.
 */
public final class DataUrlResourceHandler implements ResourceUrlHandler {

    private static final Logger log = LoggerFactory.getLogger(DataUrlResourceHandler.class);

    private static final List<String> SCHEMES = List.of("data");
    private static final String BASE64_SUFFIX = ";base64";
    static final String DEFAULT_MEDIA_TYPE = "text/plain;charset=US-ASCII";

    private final long readLimit;

    public DataUrlResourceHandler() {
        this(Long.MAX_VALUE);
    }

    /**
     * @param readLimit maximum number of decoded bytes
     */
    public DataUrlResourceHandler(long readLimit) {
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
        Schemes.filterSchemes(SCHEMES, url);

        String body = url.getRawSchemeSpecificPart();
        if (body == null) {
            throw invalid(url, "empty data URL");
        }
        int comma = body.indexOf(',');
        if (comma < 0) {
            throw invalid(url, "missing ',' separator");
        }

        String header = new String(percentDecode(url, body.substring(0, comma)), StandardCharsets.UTF_8).trim();
        String payload = body.substring(comma + 1);

        boolean base64 = header.toLowerCase(Locale.ROOT).endsWith(BASE64_SUFFIX);
        if (base64) {
            header = header.substring(0, header.length() - BASE64_SUFFIX.length());
        }

        MimeType mimeType;
        try {
            mimeType = MimeType.parse(mediaType(header));
        } catch (IllegalArgumentException e) {
            throw new ResourceException.ReadFailed(ResourceException.Reason.INVALID_DATA,
                    "Invalid media type in data URL: " + e.getMessage(), e);
        }

        byte[] data = base64 ? decodeBase64(url, payload) : percentDecode(url, payload);
        if (data.length > readLimit) {
            throw new ResourceException.ReadFailed(ResourceException.Reason.TOO_LARGE,
                    "Data URL exceeds read limit of " + readLimit + " bytes");
        }
        log.debug("Decoded {} bytes of {} from data URL", data.length, mimeType.essence());
        return MimeData.of(mimeType, data);
    }

    private static String mediaType(String header) {
        if (header.isEmpty()) return DEFAULT_MEDIA_TYPE;
        // "data:;charset=utf-8,..." keeps the parameters but defaults the type.
        if (header.startsWith(";")) return "text/plain" + header;
        return header;
    }

    private static byte[] decodeBase64(URI url, String payload) throws ResourceException {
        String text = new String(percentDecode(url, payload), StandardCharsets.US_ASCII);
        StringBuilder compact = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (!Character.isWhitespace(c)) compact.append(c);
        }
        try {
            return Base64.getDecoder().decode(compact.toString());
        } catch (IllegalArgumentException e) {
            throw new ResourceException.ReadFailed(ResourceException.Reason.INVALID_DATA,
                    "Invalid base64 in data URL: " + e.getMessage(), e);
        }
    }

    private static byte[] percentDecode(URI url, String s) throws ResourceException {
        ByteArrayOutputStream out = new ByteArrayOutputStream(s.length());
        int i = 0;
        while (i < s.length()) {
            int c = s.codePointAt(i);
            if (c == '%') {
                if (i + 2 >= s.length()) {
                    throw invalid(url, "truncated percent escape");
                }
                int hi = Character.digit(s.charAt(i + 1), 16);
                int lo = Character.digit(s.charAt(i + 2), 16);
                if (hi < 0 || lo < 0) {
                    throw invalid(url, "invalid percent escape");
                }
                out.write((hi << 4) | lo);
                i += 3;
            } else {
                byte[] bytes = new String(Character.toChars(c)).getBytes(StandardCharsets.UTF_8);
                out.write(bytes, 0, bytes.length);
                i += Character.charCount(c);
            }
        }
        return out.toByteArray();
    }

    private static ResourceException.ReadFailed invalid(URI url, String detail) {
        return new ResourceException.ReadFailed(ResourceException.Reason.INVALID_DATA,
                "Malformed data URL " + abbreviate(url) + ": " + detail);
    }

    private static String abbreviate(URI url) {
        String s = url.toString();
        return s.length() <= 64 ? s : s.substring(0, 61) + "...";
    }

    @Override
    public String toString() {
        return "DataUrlResourceHandler{readLimit=" + readLimit + "}";
    }
}
