package com.phillippitts.cipherseal.service.codec;

import com.phillippitts.cipherseal.domain.BitLocation;
import com.phillippitts.cipherseal.domain.WatermarkKey;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class KeyedLocationGeneratorTest {

    private KeyedLocationGenerator generator;

    @BeforeEach
    void setUp() {
        generator = new KeyedLocationGenerator();
    }

    @Test
    void foldsKeyBytesIntoSeed() {
        assertThat(KeyedLocationGenerator.seedOf(WatermarkKey.of("k1"))).isEqualTo(3366L);
        assertThat(KeyedLocationGenerator.seedOf(WatermarkKey.of("k2"))).isEqualTo(3367L);
        assertThat(KeyedLocationGenerator.seedOf(WatermarkKey.of("secret"))).isEqualTo(3388690096L);
    }

    @Test
    void foldsMultiByteKeysOverUtf8Bytes() {
        assertThat(KeyedLocationGenerator.seedOf(WatermarkKey.of("ключ"))).isEqualTo(1138220872L);
    }

    @Test
    void seedStaysUnsigned32Bit() {
        WatermarkKey longKey = WatermarkKey.of("x".repeat(500));

        assertThat(KeyedLocationGenerator.seedOf(longKey)).isBetween(0L, 0xFFFFFFFFL);
    }

    @Test
    void producesPinnedOrderForSmallImage() {
        LocationSequence sequence = generator.generate(2, 2, WatermarkKey.of("k1"));

        assertThat(sequence.toSlotArray()).containsExactly(2, 5, 6, 4, 1, 7, 3, 11, 8, 9, 0, 10);
    }

    @Test
    void producesPinnedOrderForSingleRow() {
        LocationSequence sequence = generator.generate(3, 1, WatermarkKey.of("abc"));

        assertThat(sequence.toSlotArray()).containsExactly(0, 2, 5, 7, 4, 3, 1, 8, 6);
    }

    @Test
    void mapsSlotsToCoordinates() {
        LocationSequence sequence = generator.generate(10, 10, WatermarkKey.of("k1"));

        assertThat(IntStream.range(0, 8).mapToObj(sequence::get)).containsExactly(
                new BitLocation(8, 7, 0),
                new BitLocation(8, 4, 0),
                new BitLocation(4, 4, 1),
                new BitLocation(5, 7, 1),
                new BitLocation(3, 2, 0),
                new BitLocation(1, 2, 2),
                new BitLocation(3, 4, 2),
                new BitLocation(3, 5, 0));
        assertThat(sequence.x(0)).isEqualTo(8);
        assertThat(sequence.y(0)).isEqualTo(7);
        assertThat(sequence.channel(2)).isEqualTo(1);
    }

    @Test
    void coversEverySlotExactlyOnce() {
        LocationSequence sequence = generator.generate(17, 9, WatermarkKey.of("secret"));

        int[] sorted = sequence.toSlotArray();
        Arrays.sort(sorted);
        assertThat(sequence.size()).isEqualTo(17 * 9 * 3);
        assertThat(sorted).isEqualTo(IntStream.range(0, 17 * 9 * 3).toArray());
    }

    @Test
    void isDeterministicPerKey() {
        LocationSequence first = generator.generate(20, 15, WatermarkKey.of("secret"));
        LocationSequence second = generator.generate(20, 15, WatermarkKey.of("secret"));

        assertThat(first).isEqualTo(second);
    }

    @Test
    void differentKeysGiveDifferentOrders() {
        LocationSequence k1 = generator.generate(20, 15, WatermarkKey.of("k1"));
        LocationSequence k2 = generator.generate(20, 15, WatermarkKey.of("k2"));

        assertThat(k1).isNotEqualTo(k2);
    }

    @Test
    void emptyImageGivesEmptySequence() {
        assertThat(generator.generate(0, 5, WatermarkKey.of("k1")).isEmpty()).isTrue();
        assertThat(generator.generate(5, 0, WatermarkKey.of("k1")).size()).isZero();
    }

    @Test
    void rejectsNegativeDimensions() {
        assertThatThrownBy(() -> generator.generate(-1, 5, WatermarkKey.of("k1")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("non-negative");
    }

    @Test
    void rejectsImagesBeyondArrayLimits() {
        assertThatThrownBy(() -> generator.generate(100_000, 100_000, WatermarkKey.of("k1")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("too large");
    }
}
