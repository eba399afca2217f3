package net.assetdownloader.service.image;

import net.assetdownloader.exception.ImageProcessingException;
import net.assetdownloader.model.image.NormalizedImage;
import net.assetdownloader.testutil.TestImages;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.awt.Color;
import java.awt.image.BufferedImage;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ImageNormalizerTest {

    private final ImageNormalizer normalizer = new ImageNormalizer();

    @Test
    void should_NotFlatten_When_PngDeclaresAlphaButIsOpaque() {
        NormalizedImage result = normalizer.toJpeg(TestImages.opaquePngWithAlphaChannel(40, 30), 95);

        assertThat(result.wasFlattened()).isFalse();
        assertThat(result.sourceFormat()).isEqualTo("png");
        BufferedImage decoded = TestImages.decode(result.jpegBytes());
        assertThat(decoded.getWidth()).isEqualTo(40);
        assertThat(decoded.getHeight()).isEqualTo(30);
        assertThat(decoded.getColorModel().hasAlpha()).isFalse();
    }

    @Test
    void should_FlattenOntoWhite_When_PngHasTransparentCorner() {
        NormalizedImage result = normalizer.toJpeg(TestImages.pngWithTransparentCorner(40, 40), 95);

        assertThat(result.wasFlattened()).isTrue();
        BufferedImage decoded = TestImages.decode(result.jpegBytes());
        assertThat(decoded.getColorModel().hasAlpha()).isFalse();
        Color corner = new Color(decoded.getRGB(2, 2));
        assertThat(corner.getRed()).isGreaterThan(240);
        assertThat(corner.getGreen()).isGreaterThan(240);
        assertThat(corner.getBlue()).isGreaterThan(240);
    }

    @Test
    void should_StillCompositeOntoWhite_When_ProcessingDisabled() {
        NormalizedImage result = normalizer.toJpeg(TestImages.pngWithTransparentCorner(40, 40), 95, false, "test");

        assertThat(result.wasFlattened()).isFalse();
        Color corner = new Color(TestImages.decode(result.jpegBytes()).getRGB(2, 2));
        assertThat(corner.getRed()).isGreaterThan(240);
        assertThat(corner.getGreen()).isGreaterThan(240);
        assertThat(corner.getBlue()).isGreaterThan(240);
    }

    @ParameterizedTest
    @ValueSource(strings = {TestImages.LOSSY_WEBP_BASE64, TestImages.LOSSLESS_WEBP_BASE64})
    void should_DecodeWebp_When_InputIsWebp(String base64) {
        NormalizedImage result = normalizer.toJpeg(TestImages.webp(base64), 95, true, "webp");

        assertThat(result.sourceFormat()).isEqualTo("webp");
        BufferedImage decoded = TestImages.decode(result.jpegBytes());
        assertThat(decoded.getWidth()).isEqualTo(1);
        assertThat(decoded.getHeight()).isEqualTo(1);
        assertThat(decoded.getColorModel().hasAlpha()).isFalse();
    }

    @Test
    void should_ProduceJpeg_When_InputIsAlreadyJpeg() {
        NormalizedImage result = normalizer.toJpeg(TestImages.rgbJpeg(16, 16), 80);

        assertThat(result.wasFlattened()).isFalse();
        assertThat(result.jpegBytes()[0]).isEqualTo((byte) 0xFF);
        assertThat(result.jpegBytes()[1]).isEqualTo((byte) 0xD8);
    }

    @Test
    void should_Throw_When_BytesAreNotAnImage() {
        byte[] html = "<html><body>error</body></html>".getBytes(StandardCharsets.UTF_8);

        assertThatThrownBy(() -> normalizer.toJpeg(html, 95))
            .isInstanceOf(ImageProcessingException.class)
            .hasMessageContaining("Unsupported or corrupt image data");
    }

    @Test
    void should_Throw_When_BytesAreEmpty() {
        assertThatThrownBy(() -> normalizer.toJpeg(new byte[0], 95))
            .isInstanceOf(ImageProcessingException.class);
    }

    @Test
    void should_ClampQuality_When_OutOfRange() {
        assertThat(ImageNormalizer.clampQuality(10)).isEqualTo(60);
        assertThat(ImageNormalizer.clampQuality(150)).isEqualTo(100);
        assertThat(ImageNormalizer.clampQuality(85)).isEqualTo(85);
    }
}
