package com.phillippitts.cipherseal.service;

import java.util.UUID;

/** Supplies the watermark text when the caller does not provide one. */
public final class WatermarkIdGenerator {

    private WatermarkIdGenerator() {}

    /** Random UUID string. */
    public static String generate() {
        return UUID.randomUUID().toString();
    }

    /** Returns {@code requested} unless it is null or blank, otherwise a fresh UUID. */
    public static String orGenerate(String requested) {
        return requested == null || requested.isBlank() ? generate() : requested;
    }
}
