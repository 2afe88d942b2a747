package com.phillippitts.cipherseal.service.codec;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Conversions between payload text and the bit stream written into an image.
 *
 * <p>Text is encoded as UTF-8, each byte most-significant bit first, followed by the fixed
 * 16-bit {@link #DELIMITER}. Fifteen consecutive one bits cannot occur inside well-formed
 * UTF-8, so the delimiter never matches early. Bits are held one per array element (0 or 1).
 */
public final class BinaryPayload {

    /** End-of-payload marker: fifteen 1 bits then a 0. */
    public static final String DELIMITER = "1111111111111110";

    /** Delimiter length in bits. */
    public static final int DELIMITER_BITS = DELIMITER.length();

    /** The delimiter as a right-aligned 16-bit pattern, for rolling-window matching. */
    static final int DELIMITER_PATTERN = 0xFFFE;

    static final int DELIMITER_MASK = 0xFFFF;

    private BinaryPayload() {}

    /**
     * Encodes text as bits without the delimiter.
     */
    static byte[] toBits(String text) {
        Objects.requireNonNull(text, "text must not be null");
        byte[] utf8 = text.getBytes(StandardCharsets.UTF_8);
        byte[] bits = new byte[utf8.length * 8];
        writeBytes(utf8, bits, 0);
        return bits;
    }

    /**
     * Encodes text as bits followed by the delimiter. This is exactly what gets embedded.
     */
    public static byte[] withDelimiter(String text) {
        Objects.requireNonNull(text, "text must not be null");
        byte[] utf8 = text.getBytes(StandardCharsets.UTF_8);
        byte[] bits = new byte[utf8.length * 8 + DELIMITER_BITS];
        writeBytes(utf8, bits, 0);
        for (int i = 0; i < DELIMITER_BITS; i++) {
            bits[utf8.length * 8 + i] = (byte) (DELIMITER.charAt(i) - '0');
        }
        return bits;
    }

    /**
     * Number of bits {@link #withDelimiter(String)} produces.
     */
    public static long requiredBits(String text) {
        Objects.requireNonNull(text, "text must not be null");
        return (long) text.getBytes(StandardCharsets.UTF_8).length * 8 + DELIMITER_BITS;
    }

    /**
     * Decodes the first {@code length} bits as UTF-8 text.
     * A trailing partial byte is dropped; malformed sequences become U+FFFD.
     */
    public static String toText(byte[] bits, int length) {
        Objects.requireNonNull(bits, "bits must not be null");
        Objects.checkFromToIndex(0, length, bits.length);
        byte[] bytes = new byte[length / 8];
        for (int i = 0; i < bytes.length; i++) {
            int value = 0;
            for (int b = 0; b < 8; b++) {
                value = (value << 1) | (bits[i * 8 + b] & 1);
            }
            bytes[i] = (byte) value;
        }
        return new String(bytes, StandardCharsets.UTF_8);
    }

    /** Renders bits as a {@code 0}/{@code 1} string, for diagnostics and tests. */
    static String toBitString(byte[] bits) {
        StringBuilder sb = new StringBuilder(bits.length);
        for (byte bit : bits) {
            sb.append(bit == 0 ? '0' : '1');
        }
        return sb.toString();
    }

    private static void writeBytes(byte[] source, byte[] bits, int offset) {
        for (int i = 0; i < source.length; i++) {
            int value = source[i] & 0xFF;
            for (int b = 0; b < 8; b++) {
                bits[offset + i * 8 + b] = (byte) ((value >>> (7 - b)) & 1);
            }
        }
    }
}
