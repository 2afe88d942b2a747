package com.phillippitts.cipherseal.service.codec;

/**
 * MT19937 pseudo-random generator, seeded and sampled exactly as CPython's {@code random.Random}.
 *
 * <p>The keyed traversal order is part of the watermark format: images watermarked by earlier
 * releases can only be read back if this generator reproduces the same 32-bit output stream,
 * the same bounded sampling and the same shuffle. Concretely:
 * <ul>
 *   <li>Seeding: {@code init_genrand(19650218)} followed by {@code init_by_array(key)}, where
 *       {@code key} is the unsigned seed split into little-endian 32-bit words ({@code [0]} for 0).</li>
 *   <li>{@link #nextBelow(int)}: draw {@code bitLength(n)} bits, reject values {@code >= n}.</li>
 *   <li>{@link #shuffle(int[])}: Fisher-Yates from the last index down to 1.</li>
 * </ul>
 *
 * <p>Not thread-safe; create one instance per traversal.
 */
public final class MersenneTwister {

    private static final int N = 624;
    private static final int M = 397;
    private static final int MATRIX_A = 0x9908b0df;
    private static final int UPPER_MASK = 0x80000000;
    private static final int LOWER_MASK = 0x7fffffff;

    private final int[] mt = new int[N];
    private int mti;

    /**
     * Seeds the generator from an unsigned 32-bit value.
     *
     * @param seed seed in {@code [0, 2^32)}
     */
    public MersenneTwister(long seed) {
        if (seed < 0 || seed > 0xFFFFFFFFL) {
            throw new IllegalArgumentException("Seed must be an unsigned 32-bit value, got: " + seed);
        }
        initByArray(new int[]{(int) seed});
    }

    /**
     * Seeds the generator from a key array ({@code init_by_array} of the reference MT19937).
     *
     * @param key seed words (must not be empty)
     */
    public MersenneTwister(int[] key) {
        if (key == null || key.length == 0) {
            throw new IllegalArgumentException("Seed key must not be empty");
        }
        initByArray(key.clone());
    }

    private void initGenrand(int s) {
        mt[0] = s;
        for (mti = 1; mti < N; mti++) {
            mt[mti] = 1812433253 * (mt[mti - 1] ^ (mt[mti - 1] >>> 30)) + mti;
        }
    }

    private void initByArray(int[] key) {
        initGenrand(19650218);
        int i = 1;
        int j = 0;
        for (int k = Math.max(N, key.length); k > 0; k--) {
            mt[i] = (mt[i] ^ ((mt[i - 1] ^ (mt[i - 1] >>> 30)) * 1664525)) + key[j] + j;
            i++;
            j++;
            if (i >= N) {
                mt[0] = mt[N - 1];
                i = 1;
            }
            if (j >= key.length) {
                j = 0;
            }
        }
        for (int k = N - 1; k > 0; k--) {
            mt[i] = (mt[i] ^ ((mt[i - 1] ^ (mt[i - 1] >>> 30)) * 1566083941)) - i;
            i++;
            if (i >= N) {
                mt[0] = mt[N - 1];
                i = 1;
            }
        }
        mt[0] = UPPER_MASK;
    }

    /**
     * Next raw 32-bit output. Interpret as unsigned ({@link Integer#toUnsignedLong(int)}).
     */
    public int nextInt() {
        if (mti >= N) {
            twist();
        }
        int y = mt[mti++];
        y ^= y >>> 11;
        y ^= (y << 7) & 0x9d2c5680;
        y ^= (y << 15) & 0xefc60000;
        y ^= y >>> 18;
        return y;
    }

    /**
     * Next {@code bits} random bits as a non-negative value ({@code getrandbits} for up to 32 bits).
     *
     * @param bits number of bits, {@code 1..32}
     */
    public long nextBits(int bits) {
        if (bits < 1 || bits > 32) {
            throw new IllegalArgumentException("bits must be in 1..32, got: " + bits);
        }
        return Integer.toUnsignedLong(nextInt()) >>> (32 - bits);
    }

    /**
     * Uniform value in {@code [0, bound)} by rejection sampling.
     *
     * @param bound exclusive upper bound, positive
     */
    public int nextBelow(int bound) {
        if (bound <= 0) {
            throw new IllegalArgumentException("bound must be positive, got: " + bound);
        }
        int bits = 32 - Integer.numberOfLeadingZeros(bound);
        long r = nextBits(bits);
        while (r >= bound) {
            r = nextBits(bits);
        }
        return (int) r;
    }

    /** Shuffles {@code values} in place. */
    public void shuffle(int[] values) {
        for (int i = values.length - 1; i > 0; i--) {
            int j = nextBelow(i + 1);
            int tmp = values[i];
            values[i] = values[j];
            values[j] = tmp;
        }
    }

    private void twist() {
        int kk;
        int y;
        for (kk = 0; kk < N - M; kk++) {
            y = (mt[kk] & UPPER_MASK) | (mt[kk + 1] & LOWER_MASK);
            mt[kk] = mt[kk + M] ^ (y >>> 1) ^ ((y & 1) != 0 ? MATRIX_A : 0);
        }
        for (; kk < N - 1; kk++) {
            y = (mt[kk] & UPPER_MASK) | (mt[kk + 1] & LOWER_MASK);
            mt[kk] = mt[kk + (M - N)] ^ (y >>> 1) ^ ((y & 1) != 0 ? MATRIX_A : 0);
        }
        y = (mt[N - 1] & UPPER_MASK) | (mt[0] & LOWER_MASK);
        mt[N - 1] = mt[M - 1] ^ (y >>> 1) ^ ((y & 1) != 0 ? MATRIX_A : 0);
        mti = 0;
    }
}
