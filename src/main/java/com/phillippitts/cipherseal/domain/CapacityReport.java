package com.phillippitts.cipherseal.domain;

/**
 * Pre-flight answer to "does this payload fit this image?". Computing it never touches pixels.
 *
 * @param width        image width in pixels
 * @param height       image height in pixels
 * @param capacityBits available bit slots ({@code width * height * 3})
 * @param requiredBits payload bits including the end delimiter
 */
public record CapacityReport(int width, int height, long capacityBits, long requiredBits) {

    public CapacityReport {
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException("Dimensions must be non-negative");
        }
        if (capacityBits < 0 || requiredBits < 0) {
            throw new IllegalArgumentException("Bit counts must be non-negative");
        }
    }

    public boolean fits() {
        return requiredBits <= capacityBits;
    }

    /** Bits left over after embedding; negative when the payload does not fit. */
    public long remainingBits() {
        return capacityBits - requiredBits;
    }
}
