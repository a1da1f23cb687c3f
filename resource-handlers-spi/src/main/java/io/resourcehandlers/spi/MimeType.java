package io.resourcehandlers.spi;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A parsed media type such as {@code image/svg+xml} or {@code text/plain; charset=utf-8}.
 *
 * <p>Type, subtype and parameter names are lower-cased; parameter values keep their case
 * and are unquoted.
 */
public final class MimeType {

    private final String type;
    private final String subtype;
    private final Map<String, String> parameters;

    private MimeType(String type, String subtype, Map<String, String> parameters) {
        this.type = type;
        this.subtype = subtype;
        this.parameters = Collections.unmodifiableMap(parameters);
    }

    /**
     * Parses a media type.
     *
     * <p>Parameters without a name or a {@code =}, such as the {@code utf8} in
     * {@code image/svg+xml;utf8}, are ignored.
     *
     * @param value the media type, e.g. {@code "image/png; charset=binary"}
     * @return the parsed media type
     * @throws IllegalArgumentException if {@code value} is not a valid media type
     */
    public static MimeType parse(String value) {
        Objects.requireNonNull(value, "value");
        List<String> parts = splitParameters(value);
        String essence = parts.get(0).trim();
        int slash = essence.indexOf('/');
        if (slash <= 0 || slash == essence.length() - 1) {
            throw new IllegalArgumentException("Invalid media type: " + value);
        }
        String type = essence.substring(0, slash).trim().toLowerCase(Locale.ROOT);
        String subtype = essence.substring(slash + 1).trim().toLowerCase(Locale.ROOT);
        if (!isToken(type) || !isToken(subtype)) {
            throw new IllegalArgumentException("Invalid media type: " + value);
        }

        Map<String, String> params = new LinkedHashMap<>();
        for (String part : parts.subList(1, parts.size())) {
            String p = part.trim();
            int eq = p.indexOf('=');
            if (eq <= 0) continue;
            String name = p.substring(0, eq).trim().toLowerCase(Locale.ROOT);
            if (!isToken(name)) continue;
            String v = p.substring(eq + 1).trim();
            if (v.length() >= 2 && v.startsWith("\"") && v.endsWith("\"")) {
                v = v.substring(1, v.length() - 1);
            }
            params.put(name, v);
        }
        return new MimeType(type, subtype, params);
    }

    // Splits on ';' outside of quoted strings.
    private static List<String> splitParameters(String value) {
        List<String> parts = new ArrayList<>();
        boolean quoted = false;
        int start = 0;
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == '"') {
                quoted = !quoted;
            } else if (c == '\\' && quoted) {
                i++;
            } else if (c == ';' && !quoted) {
                parts.add(value.substring(start, i));
                start = i + 1;
            }
        }
        parts.add(value.substring(start));
        return parts;
    }

    /**
     * Parses a media type, returning empty for {@code null} or malformed input.
     */
    public static Optional<MimeType> tryParse(String value) {
        if (value == null || value.isBlank()) return Optional.empty();
        try {
            return Optional.of(parse(value));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    public String type() { return type; }
    public String subtype() { return subtype; }
    public Map<String, String> parameters() { return parameters; }

    /**
     * The media type without parameters, e.g. {@code image/png}.
     */
    public String essence() {
        return type + "/" + subtype;
    }

    public Optional<String> parameter(String name) {
        if (name == null) return Optional.empty();
        return Optional.ofNullable(parameters.get(name.toLowerCase(Locale.ROOT)));
    }

    private static boolean isToken(String s) {
        if (s.isEmpty()) return false;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c <= ' ' || c >= 127 || "()<>@,;:\\\"/[]?=".indexOf(c) >= 0) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MimeType other)) return false;
        return type.equals(other.type) && subtype.equals(other.subtype) && parameters.equals(other.parameters);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, subtype, parameters);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(essence());
        parameters.forEach((k, v) -> sb.append("; ").append(k).append('=').append(v));
        return sb.toString();
    }
}
