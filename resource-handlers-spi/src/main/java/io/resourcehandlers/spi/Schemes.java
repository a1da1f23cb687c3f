package io.resourcehandlers.spi;

import java.net.URI;
import java.util.Arrays;
import java.util.Collection;
import java.util.Objects;

/**
 * Scheme guard for {@link ResourceUrlHandler} implementations.
 */
public final class Schemes {
    private Schemes() {}

    /**
     * Returns {@code url} if its scheme is one of {@code schemes}.
     *
     * <p>URI schemes are case-insensitive, so {@code FILE:/x} matches {@code "file"}.
     * A URL without a scheme never matches.
     *
     * @param schemes accepted schemes, in any case
     * @param url the URL to check
     * @return {@code url}, unchanged
     * @throws ResourceException.Unsupported if the scheme is not accepted
     */
    public static URI filterSchemes(Collection<String> schemes, URI url) throws ResourceException.Unsupported {
        Objects.requireNonNull(schemes, "schemes");
        Objects.requireNonNull(url, "url");
        String scheme = url.getScheme();
        if (scheme != null && schemes.stream().anyMatch(scheme::equalsIgnoreCase)) {
            return url;
        }
        throw new ResourceException.Unsupported("Unsupported scheme in " + url + ", expected one of " + schemes);
    }

    public static URI filterSchemes(URI url, String... schemes) throws ResourceException.Unsupported {
        return filterSchemes(Arrays.asList(schemes), url);
    }
}
