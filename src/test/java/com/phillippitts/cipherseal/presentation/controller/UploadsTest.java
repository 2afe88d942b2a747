package com.phillippitts.cipherseal.presentation.controller;

import com.phillippitts.cipherseal.exception.InvalidWatermarkRequestException;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockMultipartFile;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class UploadsTest {

    @Test
    void rejectsEmptyUpload() {
        MockMultipartFile empty = new MockMultipartFile("file", "a.png", "image/png", new byte[0]);

        assertThatThrownBy(() -> Uploads.requireUsable(empty, 100))
                .isInstanceOf(InvalidWatermarkRequestException.class)
                .hasMessageContaining("empty");
    }

    @Test
    void rejectsOversizedUpload() {
        MockMultipartFile big = new MockMultipartFile("file", "a.png", "image/png", new byte[101]);

        assertThatThrownBy(() -> Uploads.requireUsable(big, 100))
                .isInstanceOf(InvalidWatermarkRequestException.class)
                .hasMessageContaining("101 bytes");
        assertThatCode(() -> Uploads.requireUsable(big, 101)).doesNotThrowAnyException();
    }

    @Test
    void prefixesDownloadName() {
        MockMultipartFile file = new MockMultipartFile("file", "cover.png", "image/png", new byte[1]);

        assertThat(Uploads.attachment(file, "image.png").getFilename()).isEqualTo("watermarked_cover.png");
        assertThat(Uploads.attachment(file, "image.png").isAttachment()).isTrue();
    }

    @Test
    void renamesDownloadToTheWrittenFormat() {
        MockMultipartFile gif = new MockMultipartFile("file", "anim.gif", "image/gif", new byte[1]);
        MockMultipartFile jpeg = new MockMultipartFile("file", "photo.JPG", "image/jpeg", new byte[1]);

        assertThat(Uploads.attachment(gif, "image.png", "png").getFilename()).isEqualTo("watermarked_anim.png");
        assertThat(Uploads.attachment(jpeg, "image.png", "jpg").getFilename()).isEqualTo("watermarked_photo.JPG");
    }

    @Test
    void dropsClientDirectoriesFromDownloadName() {
        MockMultipartFile file = new MockMultipartFile("file", "C:\\Users\\me\\cover.png", "image/png", new byte[1]);

        assertThat(Uploads.attachment(file, "image.png").getFilename()).isEqualTo("watermarked_cover.png");
    }

    @Test
    void usesFallbackNameWhenMissing() {
        MockMultipartFile file = new MockMultipartFile("file", "", "image/png", new byte[1]);

        assertThat(Uploads.displayName(file, "image.png")).isEqualTo("image.png");
        assertThat(Uploads.attachment(file, "image.png").getFilename()).isEqualTo("watermarked_image.png");
    }
}
