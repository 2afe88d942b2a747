package com.phillippitts.cipherseal.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LogSanitizerTest {

    @Test
    void shouldReturnEmptyStringForNull() {
        assertThat(LogSanitizer.truncate(null, 10)).isEmpty();
        assertThat(LogSanitizer.preview(null)).isEmpty();
        assertThat(LogSanitizer.singleLine(null)).isEmpty();
    }

    @Test
    void shouldReturnEmptyStringForNonPositiveMax() {
        assertThat(LogSanitizer.truncate("hello world", 0)).isEmpty();
        assertThat(LogSanitizer.truncate("hello world", -1)).isEmpty();
    }

    @Test
    void shouldTruncateWhenLongerThanMax() {
        assertThat(LogSanitizer.truncate("hello world", 5)).isEqualTo("hello");
        assertThat(LogSanitizer.truncate("hello", 5)).isEqualTo("hello");
    }

    @Test
    void shouldPreviewFiftyCharacters() {
        String fifty = "a".repeat(50);

        assertThat(LogSanitizer.preview(fifty)).isEqualTo(fifty);
        assertThat(LogSanitizer.preview(fifty + "b")).isEqualTo(fifty + "...");
    }

    @Test
    void shouldStripLineBreaks() {
        assertThat(LogSanitizer.singleLine("photo.png\r\nINFO forged")).isEqualTo("photo.png__INFO forged");
    }
}
