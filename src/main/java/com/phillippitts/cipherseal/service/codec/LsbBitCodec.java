package com.phillippitts.cipherseal.service.codec;

import com.phillippitts.cipherseal.domain.CapacityReport;
import com.phillippitts.cipherseal.domain.RgbImageBuffer;
import com.phillippitts.cipherseal.domain.WatermarkKey;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;
import java.util.Optional;

/**
 * Keyed least-significant-bit codec: writes or reads one payload bit per slot, visiting slots in
 * the order {@link KeyedLocationGenerator} derives from the secret key.
 *
 * <p>Embedding mutates the given buffer in place. The codec performs no I/O and holds no state,
 * so concurrent calls over different buffers need no synchronization. Concurrent calls over the
 * same buffer must be serialized by the caller.
 */
public class LsbBitCodec {

    private static final Logger LOG = LogManager.getLogger(LsbBitCodec.class);

    /** Bits reserved per expected character: 8 bits times a 2x allowance for multi-byte UTF-8. */
    static final int BITS_PER_EXPECTED_CHAR = 8 * 2;

    private final KeyedLocationGenerator generator;

    public LsbBitCodec(KeyedLocationGenerator generator) {
        this.generator = Objects.requireNonNull(generator, "generator must not be null");
    }

    /** Number of bit slots in a {@code width x height} image. */
    public static long capacity(int width, int height) {
        return (long) width * height * RgbImageBuffer.CHANNELS;
    }

    /**
     * Reports whether a payload fits, without touching any pixel.
     */
    public CapacityReport check(int width, int height, String payload) {
        return new CapacityReport(width, height, capacity(width, height), BinaryPayload.requiredBits(payload));
    }

    /**
     * Embeds {@code payload} followed by the delimiter into {@code image}.
     *
     * <p>Capacity is checked before any pixel is changed: either every bit is written or the
     * image is left untouched and {@link EncodeResult.Status#INSUFFICIENT_CAPACITY} is returned.
     *
     * @param image   buffer to mutate
     * @param payload text to embed (may be empty; the delimiter is still written)
     * @param key     secret key
     * @return outcome with the capacity figures
     */
    public EncodeResult encode(RgbImageBuffer image, String payload, WatermarkKey key) {
        Objects.requireNonNull(image, "image must not be null");
        Objects.requireNonNull(payload, "payload must not be null");
        Objects.requireNonNull(key, "key must not be null");

        CapacityReport report = check(image.width(), image.height(), payload);
        if (!report.fits()) {
            LOG.debug("Payload does not fit: required={} bits, capacity={} bits",
                    report.requiredBits(), report.capacityBits());
            return EncodeResult.insufficientCapacity(report);
        }

        byte[] bits = BinaryPayload.withDelimiter(payload);
        LocationSequence sequence = generator.generate(image.width(), image.height(), key);
        for (int i = 0; i < bits.length; i++) {
            image.setLsb(sequence.x(i), sequence.y(i), sequence.channel(i), bits[i]);
        }

        LOG.debug("Embedded {} bits into {}x{} image ({} slots)",
                bits.length, image.width(), image.height(), report.capacityBits());
        return EncodeResult.embedded(report);
    }

    /**
     * Extracts a payload, reading slots in keyed order until the delimiter appears or the
     * search window is exhausted.
     *
     * <p>The window is {@code expectedMaxLenChars * 16 + 16} bits. Payloads made of 3- or 4-byte
     * characters may need a larger hint than their character count.
     *
     * @param image               buffer to read (not modified)
     * @param key                 secret key used at embed time
     * @param expectedMaxLenChars upper bound on the payload length in characters, positive
     * @return the payload (possibly empty), or empty if no delimiter was found or reading failed
     */
    public Optional<String> decode(RgbImageBuffer image, WatermarkKey key, int expectedMaxLenChars) {
        Objects.requireNonNull(image, "image must not be null");
        Objects.requireNonNull(key, "key must not be null");
        if (expectedMaxLenChars <= 0) {
            throw new IllegalArgumentException("expectedMaxLenChars must be positive, got: " + expectedMaxLenChars);
        }

        try {
            LocationSequence sequence = generator.generate(image.width(), image.height(), key);
            long maxBits = maxBitsToExtract(expectedMaxLenChars);
            int limit = (int) Math.min(maxBits, sequence.size());

            byte[] bits = new byte[limit];
            int window = 0;
            for (int i = 0; i < limit; i++) {
                int bit = image.lsb(sequence.x(i), sequence.y(i), sequence.channel(i));
                bits[i] = (byte) bit;
                window = ((window << 1) | bit) & BinaryPayload.DELIMITER_MASK;
                if (i + 1 >= BinaryPayload.DELIMITER_BITS && window == BinaryPayload.DELIMITER_PATTERN) {
                    int payloadBits = i + 1 - BinaryPayload.DELIMITER_BITS;
                    LOG.debug("Delimiter found after {} bits", i + 1);
                    return Optional.of(BinaryPayload.toText(bits, payloadBits));
                }
            }
            LOG.debug("No delimiter within {} bits (window={}, slots={})", limit, maxBits, sequence.size());
            return Optional.empty();
        } catch (RuntimeException e) {
            LOG.warn("Watermark extraction failed on {}x{} image; treating as not found",
                    image.width(), image.height(), e);
            return Optional.empty();
        }
    }

    /** Size of the decode search window in bits. */
    public static long maxBitsToExtract(int expectedMaxLenChars) {
        return (long) expectedMaxLenChars * BITS_PER_EXPECTED_CHAR + BinaryPayload.DELIMITER_BITS;
    }
}
