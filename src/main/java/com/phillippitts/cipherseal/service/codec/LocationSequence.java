package com.phillippitts.cipherseal.service.codec;

import com.phillippitts.cipherseal.domain.BitLocation;
import com.phillippitts.cipherseal.domain.RgbImageBuffer;

import java.util.Arrays;
import java.util.Objects;

/**
 * Ordered permutation of every bit slot of a {@code width x height} RGB image.
 *
 * <p>Slots are stored as indices {@code slot = (y * width + x) * 3 + channel}, which keeps a
 * multi-megapixel traversal at four bytes per slot instead of one object per slot.
 * Instances are immutable.
 */
public final class LocationSequence {

    private final int width;
    private final int height;
    private final int[] slots;

    LocationSequence(int width, int height, int[] slots) {
        this.width = width;
        this.height = height;
        this.slots = Objects.requireNonNull(slots, "slots");
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    public int size() {
        return slots.length;
    }

    public boolean isEmpty() {
        return slots.length == 0;
    }

    /** Slot index visited at position {@code i}. */
    public int slot(int i) {
        return slots[Objects.checkIndex(i, slots.length)];
    }

    public int x(int i) {
        return (slot(i) / RgbImageBuffer.CHANNELS) % width;
    }

    public int y(int i) {
        return (slot(i) / RgbImageBuffer.CHANNELS) / width;
    }

    public int channel(int i) {
        return slot(i) % RgbImageBuffer.CHANNELS;
    }

    public BitLocation get(int i) {
        int s = slot(i);
        int pixel = s / RgbImageBuffer.CHANNELS;
        return new BitLocation(pixel % width, pixel / width, s % RgbImageBuffer.CHANNELS);
    }

    /** Copy of the slot order. */
    public int[] toSlotArray() {
        return slots.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof LocationSequence other)) {
            return false;
        }
        return width == other.width && height == other.height && Arrays.equals(slots, other.slots);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * width + height) + Arrays.hashCode(slots);
    }

    @Override
    public String toString() {
        return "LocationSequence[" + width + "x" + height + ", " + slots.length + " slots]";
    }
}
