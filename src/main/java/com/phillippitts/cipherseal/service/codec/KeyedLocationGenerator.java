package com.phillippitts.cipherseal.service.codec;

import com.phillippitts.cipherseal.domain.RgbImageBuffer;
import com.phillippitts.cipherseal.domain.WatermarkKey;

import java.util.Objects;

/**
 * Derives the keyed traversal order over all bit slots of an image.
 *
 * <p>Three steps, all part of the watermark format:
 * <ol>
 *   <li>Fold the key bytes into a 32-bit seed: {@code seed = (seed * 31 + b) mod 2^32}.</li>
 *   <li>Seed a {@link MersenneTwister}.</li>
 *   <li>Shuffle the slots, initially in row-major, channel-minor order, with that generator.</li>
 * </ol>
 *
 * <p>The fold is a plain polynomial hash and is trivially invertible. Secrecy rests on the size of
 * the permutation space, not on the hash: this is obscurity, not encryption. It cannot be
 * strengthened without invalidating every image watermarked so far.
 *
 * <p>Stateless and thread-safe.
 */
public final class KeyedLocationGenerator {

    /** Largest slot count a Java array can hold. */
    static final int MAX_SLOTS = Integer.MAX_VALUE - 8;

    /**
     * Folds the key bytes (unsigned, in source order) into an unsigned 32-bit seed.
     */
    public static long seedOf(WatermarkKey key) {
        Objects.requireNonNull(key, "key must not be null");
        long seed = 0;
        for (byte b : key.bytes()) {
            seed = (seed * 31 + (b & 0xFF)) & 0xFFFFFFFFL;
        }
        return seed;
    }

    /**
     * Generates the traversal order for a {@code width x height} image.
     *
     * @param width  image width, non-negative
     * @param height image height, non-negative
     * @param key    secret key
     * @return permutation of all {@code width * height * 3} slots; empty for an empty image
     */
    public LocationSequence generate(int width, int height, WatermarkKey key) {
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException("Dimensions must be non-negative, got: " + width + "x" + height);
        }
        long total = (long) width * height * RgbImageBuffer.CHANNELS;
        if (total > MAX_SLOTS) {
            throw new IllegalArgumentException("Image too large for keyed traversal: " + width + "x" + height);
        }

        int[] slots = new int[(int) total];
        for (int i = 0; i < slots.length; i++) {
            slots[i] = i;
        }
        new MersenneTwister(seedOf(key)).shuffle(slots);
        return new LocationSequence(width, height, slots);
    }
}
