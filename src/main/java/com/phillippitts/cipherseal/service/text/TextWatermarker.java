package com.phillippitts.cipherseal.service.text;

import com.phillippitts.cipherseal.domain.WatermarkKey;

import java.util.Optional;

/**
 * Contract for blind text watermarking: the payload is hidden in the text itself and recovered
 * with the same key, without access to the original text.
 */
public interface TextWatermarker {

    /**
     * Returns {@code text} carrying {@code payload}. The visible content is unchanged.
     *
     * @param text    carrier text (may be empty)
     * @param payload watermark to hide
     * @param key     secret key
     * @return watermarked text
     */
    String embed(String text, String payload, WatermarkKey key);

    /**
     * Recovers a payload previously embedded with the same key.
     *
     * @param watermarkedText text to inspect
     * @param key             secret key
     * @return the payload, or empty if none is found for this key
     */
    Optional<String> extract(String watermarkedText, WatermarkKey key);
}
