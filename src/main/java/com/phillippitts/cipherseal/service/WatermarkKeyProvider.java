package com.phillippitts.cipherseal.service;

import com.phillippitts.cipherseal.config.properties.WatermarkProperties;
import com.phillippitts.cipherseal.domain.WatermarkKey;
import com.phillippitts.cipherseal.exception.ServiceNotConfiguredException;
import org.springframework.stereotype.Component;

/**
 * Hands out the process-wide master key and gates every watermark operation on its presence.
 */
@Component
public class WatermarkKeyProvider {

    private final WatermarkProperties properties;

    public WatermarkKeyProvider(WatermarkProperties properties) {
        this.properties = properties;
    }

    public boolean isConfigured() {
        return properties.isSecretKeyConfigured();
    }

    /**
     * @return the configured key
     * @throws ServiceNotConfiguredException if no key is configured
     */
    public WatermarkKey requireKey() {
        if (!isConfigured()) {
            throw new ServiceNotConfiguredException(WatermarkProperties.SECRET_KEY_ENV_VAR);
        }
        return WatermarkKey.of(properties.getSecretKey());
    }
}
