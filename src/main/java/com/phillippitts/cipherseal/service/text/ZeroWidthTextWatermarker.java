package com.phillippitts.cipherseal.service.text;

import com.phillippitts.cipherseal.domain.WatermarkKey;
import com.phillippitts.cipherseal.service.codec.KeyedLocationGenerator;
import com.phillippitts.cipherseal.service.codec.MersenneTwister;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.Optional;
import java.util.zip.CRC32;

/**
 * Hides the payload as a run of invisible characters inserted into the text.
 *
 * <p>Frame layout: {@code U+2060, bits..., U+2060} where each bit is U+200B (0) or U+200C (1).
 * The framed bytes are the UTF-8 payload followed by the low 16 bits of its CRC-32, all XOR-masked
 * with a keystream from a {@link MersenneTwister} seeded by the key fold. The insertion point is the
 * next draw from the same stream, taken between code points. A wrong key fails the CRC and yields
 * nothing.
 */
public class ZeroWidthTextWatermarker implements TextWatermarker {

    private static final Logger LOG = LogManager.getLogger(ZeroWidthTextWatermarker.class);

    static final char ZERO = '\u200B';
    static final char ONE = '\u200C';
    static final char FRAME = '\u2060';

    private static final int CHECK_BYTES = 2;

    @Override
    public String embed(String text, String payload, WatermarkKey key) {
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(payload, "payload must not be null");
        Objects.requireNonNull(key, "key must not be null");

        byte[] body = payload.getBytes(StandardCharsets.UTF_8);
        byte[] framed = new byte[body.length + CHECK_BYTES];
        System.arraycopy(body, 0, framed, 0, body.length);
        int check = checksum(body, body.length);
        framed[body.length] = (byte) (check >>> 8);
        framed[body.length + 1] = (byte) check;

        MersenneTwister keystream = keystream(key);
        mask(framed, keystream);

        StringBuilder mark = new StringBuilder(framed.length * 8 + 2).append(FRAME);
        for (byte b : framed) {
            for (int i = 7; i >= 0; i--) {
                mark.append(((b >>> i) & 1) == 0 ? ZERO : ONE);
            }
        }
        mark.append(FRAME);

        int codePoints = text.codePointCount(0, text.length());
        int insertAt = text.offsetByCodePoints(0, keystream.nextBelow(codePoints + 1));
        LOG.debug("Embedding {} payload bytes at offset {} of {}", body.length, insertAt, text.length());
        return new StringBuilder(text.length() + mark.length())
                .append(text, 0, insertAt)
                .append(mark)
                .append(text, insertAt, text.length())
                .toString();
    }

    @Override
    public Optional<String> extract(String watermarkedText, WatermarkKey key) {
        Objects.requireNonNull(watermarkedText, "watermarkedText must not be null");
        Objects.requireNonNull(key, "key must not be null");

        int open = watermarkedText.indexOf(FRAME);
        while (open >= 0) {
            int close = watermarkedText.indexOf(FRAME, open + 1);
            if (close < 0) {
                break;
            }
            Optional<String> payload = decodeFrame(watermarkedText, open + 1, close, key);
            if (payload.isPresent()) {
                return payload;
            }
            open = close;
        }
        return Optional.empty();
    }

    private Optional<String> decodeFrame(String text, int from, int to, WatermarkKey key) {
        int bitCount = to - from;
        if (bitCount < CHECK_BYTES * 8 || bitCount % 8 != 0) {
            return Optional.empty();
        }
        byte[] framed = new byte[bitCount / 8];
        for (int i = 0; i < bitCount; i++) {
            char c = text.charAt(from + i);
            int bit;
            if (c == ZERO) {
                bit = 0;
            } else if (c == ONE) {
                bit = 1;
            } else {
                return Optional.empty();
            }
            framed[i / 8] = (byte) ((framed[i / 8] << 1) | bit);
        }

        mask(framed, keystream(key));
        int bodyLength = framed.length - CHECK_BYTES;
        int expected = checksum(framed, bodyLength);
        int actual = ((framed[bodyLength] & 0xFF) << 8) | (framed[bodyLength + 1] & 0xFF);
        if (expected != actual) {
            LOG.debug("Zero-width frame found but checksum does not match this key");
            return Optional.empty();
        }
        return Optional.of(new String(framed, 0, bodyLength, StandardCharsets.UTF_8));
    }

    private static MersenneTwister keystream(WatermarkKey key) {
        return new MersenneTwister(KeyedLocationGenerator.seedOf(key));
    }

    private static void mask(byte[] data, MersenneTwister keystream) {
        for (int i = 0; i < data.length; i++) {
            data[i] ^= (byte) keystream.nextBits(8);
        }
    }

    private static int checksum(byte[] data, int length) {
        CRC32 crc = new CRC32();
        crc.update(data, 0, length);
        return (int) (crc.getValue() & 0xFFFF);
    }
}
