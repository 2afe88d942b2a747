package com.phillippitts.cipherseal.domain;

/**
 * One bit-storage slot: the least-significant bit of a color channel of one pixel.
 *
 * @param x       column, {@code 0 <= x < width}
 * @param y       row, {@code 0 <= y < height}
 * @param channel 0 = red, 1 = green, 2 = blue
 */
public record BitLocation(int x, int y, int channel) {

    public BitLocation {
        if (x < 0 || y < 0) {
            throw new IllegalArgumentException("Coordinates must be non-negative, got: (" + x + ", " + y + ")");
        }
        if (channel < 0 || channel >= RgbImageBuffer.CHANNELS) {
            throw new IllegalArgumentException("Channel must be 0, 1 or 2, got: " + channel);
        }
    }
}
