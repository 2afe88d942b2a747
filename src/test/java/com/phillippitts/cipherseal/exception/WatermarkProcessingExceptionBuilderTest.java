package com.phillippitts.cipherseal.exception;

import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WatermarkProcessingExceptionBuilderTest {

    @Test
    void buildsWithOperationCauseAndMetadata() {
        IOException cause = new IOException("disk full");

        WatermarkProcessingException ex = WatermarkProcessingExceptionBuilder.create("Failed to write")
                .operation("add_image_watermark")
                .cause(cause)
                .metadata("format", "png")
                .metadata("file", "out.png")
                .build();

        assertThat(ex.getOperation()).isEqualTo("add_image_watermark");
        assertThat(ex.getCause()).isSameAs(cause);
        assertThat(ex.getMessage())
                .contains("Failed to write")
                .contains("format=png, file=out.png")
                .contains("add_image_watermark");
    }

    @Test
    void ignoresNullMetadata() {
        WatermarkProcessingException ex = WatermarkProcessingExceptionBuilder.create("Failed")
                .metadata("file", null)
                .metadata(null, "x")
                .build();

        assertThat(ex.getMessage()).doesNotContain("file=");
        assertThat(ex.getOperation()).isEqualTo("unknown");
    }

    @Test
    void rejectsEmptyMessage() {
        assertThatThrownBy(() -> WatermarkProcessingExceptionBuilder.create(""))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
