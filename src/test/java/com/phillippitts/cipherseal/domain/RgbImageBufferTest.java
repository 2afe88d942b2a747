package com.phillippitts.cipherseal.domain;

import org.junit.jupiter.api.Test;

import java.awt.image.BufferedImage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RgbImageBufferTest {

    @Test
    void readsAndWritesChannels() {
        RgbImageBuffer image = new RgbImageBuffer(3, 2);

        image.setRgb(1, 1, 0x123456);

        assertThat(image.channel(1, 1, 0)).isEqualTo(0x12);
        assertThat(image.channel(1, 1, 1)).isEqualTo(0x34);
        assertThat(image.channel(1, 1, 2)).isEqualTo(0x56);
    }

    @Test
    void setLsbChangesOnlyTheLowBit() {
        RgbImageBuffer image = new RgbImageBuffer(1, 1);
        image.setRgb(0, 0, 0xFEFEFE);

        image.setLsb(0, 0, 1, 1);

        assertThat(image.rgb(0, 0)).isEqualTo(0xFEFFFE);
        image.setLsb(new BitLocation(0, 0, 1), 0);
        assertThat(image.rgb(0, 0)).isEqualTo(0xFEFEFE);
        assertThat(image.lsb(new BitLocation(0, 0, 1))).isZero();
    }

    @Test
    void reportsCapacityAsThreeBitsPerPixel() {
        assertThat(new RgbImageBuffer(10, 10).capacityBits()).isEqualTo(300);
        assertThat(new RgbImageBuffer(0, 7).capacityBits()).isZero();
    }

    @Test
    void dropsAlphaWhenImporting() {
        BufferedImage argb = new BufferedImage(2, 1, BufferedImage.TYPE_INT_ARGB);
        argb.setRGB(0, 0, 0x80FF0000);
        argb.setRGB(1, 0, 0xFF00FF00);

        RgbImageBuffer image = RgbImageBuffer.fromBufferedImage(argb);

        assertThat(image.width()).isEqualTo(2);
        assertThat(image.height()).isEqualTo(1);
        assertThat(image.rgb(1, 0)).isEqualTo(0x00FF00);
        assertThat(image.rgb(0, 0) >>> 24).isZero();
    }

    @Test
    void exportsAsRgbImage() {
        RgbImageBuffer image = new RgbImageBuffer(2, 2);
        image.setRgb(1, 0, 0xABCDEF);

        BufferedImage out = image.toBufferedImage();

        assertThat(out.getType()).isEqualTo(BufferedImage.TYPE_INT_RGB);
        assertThat(out.getRGB(1, 0) & 0xFFFFFF).isEqualTo(0xABCDEF);
    }

    @Test
    void copyIsIndependent() {
        RgbImageBuffer image = new RgbImageBuffer(1, 1);
        RgbImageBuffer copy = image.copy();

        copy.setRgb(0, 0, 0xFFFFFF);

        assertThat(image.rgb(0, 0)).isZero();
    }

    @Test
    void rejectsOutOfRangeAccess() {
        RgbImageBuffer image = new RgbImageBuffer(2, 2);

        assertThatThrownBy(() -> image.rgb(2, 0)).isInstanceOf(IndexOutOfBoundsException.class);
        assertThatThrownBy(() -> image.channel(0, 0, 3)).isInstanceOf(IndexOutOfBoundsException.class);
        assertThatThrownBy(() -> image.setLsb(0, 0, 0, 2)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> image.setChannel(0, 0, 0, 256)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RgbImageBuffer(-1, 2)).isInstanceOf(IllegalArgumentException.class);
    }
}
