package com.phillippitts.cipherseal.config.properties;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class WatermarkPropertiesValidationTest {

    private static ValidatorFactory factory;
    private static Validator validator;

    @BeforeAll
    static void setUpValidator() {
        factory = Validation.buildDefaultValidatorFactory();
        validator = factory.getValidator();
    }

    @AfterAll
    static void closeValidator() {
        factory.close();
    }

    @Test
    void defaultsAreValid() {
        WatermarkProperties p = new WatermarkProperties();

        assertThat(validator.validate(p)).isEmpty();
        assertThat(p.getDefaultMaxLength()).isEqualTo(200);
        assertThat(p.getUpload().getMaxFileSizeBytes()).isEqualTo(25L * 1024 * 1024);
        assertThat(p.isSecretKeyConfigured()).isFalse();
    }

    @Test
    void rejectsNonPositiveDefaultMaxLength() {
        WatermarkProperties p = new WatermarkProperties();
        p.setDefaultMaxLength(0);

        Set<ConstraintViolation<WatermarkProperties>> violations = validator.validate(p);

        assertThat(violations).extracting(ConstraintViolation::getMessage)
                .containsExactly("Default max length must be positive");
    }

    @Test
    void validatesNestedUploadLimits() {
        WatermarkProperties p = new WatermarkProperties();
        p.getUpload().setMaxFileSizeBytes(-1);

        assertThat(validator.validate(p)).extracting(ConstraintViolation::getMessage)
                .containsExactly("Maximum image upload size must be positive");
    }

    @Test
    void emptyKeyIsNotConfigured() {
        WatermarkProperties p = new WatermarkProperties();
        p.setSecretKey("");
        assertThat(p.isSecretKeyConfigured()).isFalse();

        p.setSecretKey("s3cr3t");
        assertThat(p.isSecretKeyConfigured()).isTrue();
    }
}
