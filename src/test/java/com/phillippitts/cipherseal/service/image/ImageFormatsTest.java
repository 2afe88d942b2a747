package com.phillippitts.cipherseal.service.image;

import org.junit.jupiter.api.Test;

import java.awt.image.BufferedImage;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class ImageFormatsTest {

    @Test
    void extractsLowercaseExtension() {
        assertThat(ImageFormats.extensionOf(Path.of("dir", "Photo.PNG"))).contains("png");
        assertThat(ImageFormats.extensionOf("archive.tar.gz")).contains("gz");
        assertThat(ImageFormats.extensionOf("noext")).isEmpty();
        assertThat(ImageFormats.extensionOf("trailing.")).isEmpty();
        assertThat(ImageFormats.extensionOf((String) null)).isEmpty();
    }

    @Test
    void flagsJpegFamilyAsLossy() {
        assertThat(ImageFormats.isLossy("jpg")).isTrue();
        assertThat(ImageFormats.isLossy("JPEG")).isTrue();
        assertThat(ImageFormats.isLossy("png")).isFalse();
        assertThat(ImageFormats.isLossy(null)).isFalse();
    }

    @Test
    void pngIsAlwaysAvailable() {
        assertThat(ImageFormats.canRead("png")).isTrue();
        assertThat(ImageFormats.canWrite("png")).isTrue();
        assertThat(ImageFormats.canWrite("no-such-format")).isFalse();
    }

    @Test
    void fallsBackToPngForUnknownOutputExtensions() {
        BufferedImage rgb = new BufferedImage(4, 4, BufferedImage.TYPE_INT_RGB);

        assertThat(ImageFormats.outputFormatFor(Path.of("out.bmp"), rgb)).isEqualTo("bmp");
        assertThat(ImageFormats.outputFormatFor(Path.of("out.JPG"), rgb)).isEqualTo("jpg");
        assertThat(ImageFormats.outputFormatFor(Path.of("out.xyz"), rgb)).isEqualTo("png");
        assertThat(ImageFormats.outputFormatFor(Path.of("out"), rgb)).isEqualTo("png");
    }

    @Test
    void neverWritesRgbPixelsToPaletteFormats() {
        BufferedImage rgb = new BufferedImage(4, 4, BufferedImage.TYPE_INT_RGB);

        assertThat(ImageFormats.isPalette("GIF")).isTrue();
        assertThat(ImageFormats.isPalette("wbmp")).isTrue();
        assertThat(ImageFormats.isPalette("png")).isFalse();
        assertThat(ImageFormats.outputFormatFor(Path.of("out.gif"), rgb)).isEqualTo("png");
        assertThat(ImageFormats.outputFormatFor(Path.of("out.wbmp"), rgb)).isEqualTo("png");
    }

    @Test
    void checksWriterAgainstTheImageType() {
        assertThat(ImageFormats.canWrite("wbmp", new BufferedImage(4, 4, BufferedImage.TYPE_INT_RGB))).isFalse();
        assertThat(ImageFormats.canWrite("wbmp", new BufferedImage(4, 4, BufferedImage.TYPE_BYTE_BINARY))).isTrue();
        assertThat(ImageFormats.canWrite("png", new BufferedImage(4, 4, BufferedImage.TYPE_INT_RGB))).isTrue();
    }
}
