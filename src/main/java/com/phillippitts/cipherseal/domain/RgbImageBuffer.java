package com.phillippitts.cipherseal.domain;

import java.awt.image.BufferedImage;
import java.util.Objects;

/**
 * Mutable raster of 8-bit red, green and blue channels, indexed by pixel coordinate.
 *
 * <p>Pixels are stored packed as {@code 0xRRGGBB}. Every accessor is bounds-checked.
 * Instances are not thread-safe: the operation that owns a buffer has exclusive access to it.
 */
public final class RgbImageBuffer {

    /** Channels per pixel (red, green, blue). */
    public static final int CHANNELS = 3;

    private final int width;
    private final int height;
    private final int[] pixels;

    /**
     * Creates a black image.
     *
     * @param width  width in pixels, non-negative
     * @param height height in pixels, non-negative
     */
    public RgbImageBuffer(int width, int height) {
        this(width, height, new int[checkedArea(width, height)]);
    }

    private RgbImageBuffer(int width, int height, int[] pixels) {
        this.width = width;
        this.height = height;
        this.pixels = pixels;
    }

    /**
     * Copies a decoded image into a new buffer, normalizing to RGB.
     * Alpha and any other extra channels are dropped; color values are taken as the
     * default sRGB rendition {@link BufferedImage#getRGB(int, int)} produces.
     *
     * @param image decoded image (must not be null)
     * @return a new buffer with the same dimensions
     */
    public static RgbImageBuffer fromBufferedImage(BufferedImage image) {
        Objects.requireNonNull(image, "image must not be null");
        int w = image.getWidth();
        int h = image.getHeight();
        int[] argb = image.getRGB(0, 0, w, h, null, 0, w);
        for (int i = 0; i < argb.length; i++) {
            argb[i] &= 0xFFFFFF;
        }
        return new RgbImageBuffer(w, h, argb);
    }

    /**
     * Renders this buffer as a {@link BufferedImage#TYPE_INT_RGB} image.
     *
     * @return a new image; later changes to this buffer are not reflected
     */
    public BufferedImage toBufferedImage() {
        BufferedImage out = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        if (pixels.length > 0) {
            out.setRGB(0, 0, width, height, pixels, 0, width);
        }
        return out;
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    /** Number of bit-storage slots: one least-significant bit per channel per pixel. */
    public long capacityBits() {
        return (long) width * height * CHANNELS;
    }

    /** Packed {@code 0xRRGGBB} value of a pixel. */
    public int rgb(int x, int y) {
        return pixels[index(x, y)];
    }

    public void setRgb(int x, int y, int rgb) {
        pixels[index(x, y)] = rgb & 0xFFFFFF;
    }

    /** Value {@code 0..255} of one channel (0 = red, 1 = green, 2 = blue). */
    public int channel(int x, int y, int channel) {
        int shift = shiftFor(channel);
        return (pixels[index(x, y)] >>> shift) & 0xFF;
    }

    public void setChannel(int x, int y, int channel, int value) {
        if (value < 0 || value > 0xFF) {
            throw new IllegalArgumentException("Channel value must be 0..255, got: " + value);
        }
        int shift = shiftFor(channel);
        int i = index(x, y);
        pixels[i] = (pixels[i] & ~(0xFF << shift)) | (value << shift);
    }

    /** Least-significant bit of one channel. */
    public int lsb(int x, int y, int channel) {
        return channel(x, y, channel) & 1;
    }

    /** Replaces the least-significant bit of one channel: {@code value = (value & ~1) | bit}. */
    public void setLsb(int x, int y, int channel, int bit) {
        if (bit != 0 && bit != 1) {
            throw new IllegalArgumentException("Bit must be 0 or 1, got: " + bit);
        }
        setChannel(x, y, channel, (channel(x, y, channel) & ~1) | bit);
    }

    public int lsb(BitLocation location) {
        return lsb(location.x(), location.y(), location.channel());
    }

    public void setLsb(BitLocation location, int bit) {
        setLsb(location.x(), location.y(), location.channel(), bit);
    }

    /** Deep copy. */
    public RgbImageBuffer copy() {
        return new RgbImageBuffer(width, height, pixels.clone());
    }

    private int index(int x, int y) {
        Objects.checkIndex(x, width);
        Objects.checkIndex(y, height);
        return y * width + x;
    }

    private static int shiftFor(int channel) {
        Objects.checkIndex(channel, CHANNELS);
        return (2 - channel) * 8;
    }

    private static int checkedArea(int width, int height) {
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException("Dimensions must be non-negative, got: " + width + "x" + height);
        }
        long area = (long) width * height;
        if (area > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Image too large: " + width + "x" + height);
        }
        return (int) area;
    }
}
