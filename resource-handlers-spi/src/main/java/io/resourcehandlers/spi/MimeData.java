package io.resourcehandlers.spi;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * Data of a resource with its mime type, if known.
 *
 * <p>This is an immutable value type. The data is copied on construction and on access,
 * so the caller owns whatever {@link #data()} returns.
 */
public final class MimeData {

    private final MimeType mimeType;
    private final byte[] data;

    private MimeData(MimeType mimeType, byte[] data) {
        this.mimeType = mimeType;
        this.data = Objects.requireNonNull(data, "data").clone();
    }

    /**
     * Creates data with a known mime type.
     *
     * @param mimeType the mime type, or {@code null} if unknown
     * @param data the bytes, possibly empty
     */
    public static MimeData of(MimeType mimeType, byte[] data) {
        return new MimeData(mimeType, data);
    }

    /**
     * Creates data whose mime type could not be determined.
     */
    public static MimeData of(byte[] data) {
        return new MimeData(null, data);
    }

    public Optional<MimeType> mimeType() {
        return Optional.ofNullable(mimeType);
    }

    public byte[] data() {
        return data.clone();
    }

    public int size() {
        return data.length;
    }

    public InputStream openStream() {
        return new ByteArrayInputStream(data);
    }

    /**
     * The essence of the mime type, roughly the mime type without parameters.
     *
     * @return e.g. {@code "image/png"}, or empty if no mime type is known
     */
    public Optional<String> mimeTypeEssence() {
        return mimeType().map(MimeType::essence);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MimeData other)) return false;
        return Objects.equals(mimeType, other.mimeType) && Arrays.equals(data, other.data);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hashCode(mimeType) + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return "MimeData{mimeType=" + mimeType + ", size=" + data.length + "}";
    }
}
