package com.phillippitts.cipherseal.service.health;

import com.phillippitts.cipherseal.config.properties.WatermarkProperties;
import com.phillippitts.cipherseal.service.image.ImageFormats;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the watermark service.
 *
 * <p>Verifies that:
 * <ul>
 *   <li>The master secret key is configured</li>
 *   <li>PNG (the lossless default output) can be read and written</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health endpoint. Never reveals the key.
 */
@Component
public class WatermarkHealthIndicator implements HealthIndicator {

    private final WatermarkProperties properties;

    public WatermarkHealthIndicator(WatermarkProperties properties) {
        this.properties = properties;
    }

    @Override
    public Health health() {
        boolean keyConfigured = properties.isSecretKeyConfigured();
        boolean pngReadable = ImageFormats.canRead(ImageFormats.DEFAULT_FORMAT);
        boolean pngWritable = ImageFormats.canWrite(ImageFormats.DEFAULT_FORMAT);

        Health.Builder builder = keyConfigured && pngReadable && pngWritable
                ? Health.up().withDetail("status", "Watermark service ready")
                : Health.down().withDetail("status", "Watermark service degraded");

        return builder
                .withDetail("secretKey", keyConfigured ? "configured" : "NOT CONFIGURED")
                .withDetail("pngCodec", formatCodecStatus(pngReadable, pngWritable))
                .build();
    }

    private String formatCodecStatus(boolean readable, boolean writable) {
        if (readable && writable) {
            return "readable and writable";
        }
        if (!readable && !writable) {
            return "NOT AVAILABLE";
        }
        return readable ? "readable only" : "writable only";
    }
}
