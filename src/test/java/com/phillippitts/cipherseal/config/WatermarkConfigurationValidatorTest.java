package com.phillippitts.cipherseal.config;

import com.phillippitts.cipherseal.config.properties.WatermarkProperties;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThatCode;

class WatermarkConfigurationValidatorTest {

    @Test
    void missingKeyDoesNotAbortStartup() {
        WatermarkConfigurationValidator validator = new WatermarkConfigurationValidator(new WatermarkProperties());

        assertThatCode(validator::validateOnStartup).doesNotThrowAnyException();
    }

    @Test
    void configuredKeyPasses() {
        WatermarkProperties properties = new WatermarkProperties();
        properties.setSecretKey("s3cr3t");

        assertThatCode(new WatermarkConfigurationValidator(properties)::validateOnStartup)
                .doesNotThrowAnyException();
    }
}
