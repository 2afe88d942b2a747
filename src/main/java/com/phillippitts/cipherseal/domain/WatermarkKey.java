package com.phillippitts.cipherseal.domain;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Secret key that seeds the keyed traversal order. Opaque bytes, derived from a UTF-8 string.
 *
 * <p>The same key must be supplied for embedding and extraction. {@link #toString()} never
 * reveals the key material.
 */
public final class WatermarkKey {

    private final byte[] bytes;

    private WatermarkKey(byte[] bytes) {
        this.bytes = bytes;
    }

    /**
     * Creates a key from its UTF-8 string form.
     *
     * @param value key string (must not be null or empty)
     * @return key over the UTF-8 bytes of {@code value}
     * @throws IllegalArgumentException if value is null or empty
     */
    public static WatermarkKey of(String value) {
        if (value == null || value.isEmpty()) {
            throw new IllegalArgumentException("Secret key must not be null or empty");
        }
        return new WatermarkKey(value.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Creates a key from raw bytes. The array is copied.
     *
     * @param bytes key bytes (must not be null or empty)
     * @return key over a copy of {@code bytes}
     */
    static WatermarkKey ofBytes(byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            throw new IllegalArgumentException("Secret key must not be null or empty");
        }
        return new WatermarkKey(bytes.clone());
    }

    /** Returns a copy of the key bytes in source order. */
    public byte[] bytes() {
        return bytes.clone();
    }

    public int length() {
        return bytes.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof WatermarkKey other)) {
            return false;
        }
        return Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return "WatermarkKey[" + bytes.length + " bytes]";
    }
}
