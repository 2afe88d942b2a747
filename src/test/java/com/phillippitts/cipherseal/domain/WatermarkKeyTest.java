package com.phillippitts.cipherseal.domain;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WatermarkKeyTest {

    @Test
    void usesUtf8Bytes() {
        WatermarkKey key = WatermarkKey.of("ключ");

        assertThat(key.bytes()).isEqualTo("ключ".getBytes(StandardCharsets.UTF_8));
        assertThat(key.length()).isEqualTo(8);
    }

    @Test
    void bytesAreDefensivelyCopied() {
        byte[] raw = {1, 2, 3};
        WatermarkKey key = WatermarkKey.ofBytes(raw);

        raw[0] = 9;
        key.bytes()[1] = 9;

        assertThat(key.bytes()).containsExactly(1, 2, 3);
    }

    @Test
    void equalKeysAreEqual() {
        assertThat(WatermarkKey.of("abc")).isEqualTo(WatermarkKey.ofBytes(new byte[]{'a', 'b', 'c'}));
        assertThat(WatermarkKey.of("abc")).hasSameHashCodeAs(WatermarkKey.of("abc"));
        assertThat(WatermarkKey.of("abc")).isNotEqualTo(WatermarkKey.of("abd"));
    }

    @Test
    void toStringDoesNotRevealKey() {
        assertThat(WatermarkKey.of("top-secret").toString())
                .doesNotContain("top-secret")
                .isEqualTo("WatermarkKey[10 bytes]");
    }

    @Test
    void rejectsEmptyKeys() {
        assertThatThrownBy(() -> WatermarkKey.of("")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> WatermarkKey.of(null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> WatermarkKey.ofBytes(new byte[0])).isInstanceOf(IllegalArgumentException.class);
    }
}
