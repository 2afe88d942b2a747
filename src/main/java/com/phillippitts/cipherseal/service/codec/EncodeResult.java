package com.phillippitts.cipherseal.service.codec;

import com.phillippitts.cipherseal.domain.CapacityReport;

import java.util.Objects;

/**
 * Outcome of {@link LsbBitCodec#encode}. On {@link Status#INSUFFICIENT_CAPACITY} the image was not touched.
 *
 * @param status      whether the payload was written
 * @param capacity    required versus available bits
 * @param bitsWritten bits written, equal to {@code capacity.requiredBits()} when embedded, else 0
 */
public record EncodeResult(Status status, CapacityReport capacity, long bitsWritten) {

    public enum Status {
        EMBEDDED,
        INSUFFICIENT_CAPACITY
    }

    public EncodeResult {
        Objects.requireNonNull(status, "status must not be null");
        Objects.requireNonNull(capacity, "capacity must not be null");
    }

    static EncodeResult embedded(CapacityReport capacity) {
        return new EncodeResult(Status.EMBEDDED, capacity, capacity.requiredBits());
    }

    static EncodeResult insufficientCapacity(CapacityReport capacity) {
        return new EncodeResult(Status.INSUFFICIENT_CAPACITY, capacity, 0);
    }

    public boolean isEmbedded() {
        return status == Status.EMBEDDED;
    }
}
