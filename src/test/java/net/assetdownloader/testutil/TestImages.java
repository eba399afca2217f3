package net.assetdownloader.testutil;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Base64;

/** Builds small encoded images for tests. */
public final class TestImages {
    private TestImages() {}

    /** 1x1 lossy (VP8) WebP. */
    public static final String LOSSY_WEBP_BASE64 = "UklGRiIAAABXRUJQVlA4IBYAAAAwAQCdASoBAAEADsD+JaQAA3AAAAAA";

    /** 1x1 lossless (VP8L) WebP. */
    public static final String LOSSLESS_WEBP_BASE64 = "UklGRhoAAABXRUJQVlA4TA0AAAAvAAAAEAcQERGIiP4HAA==";

    public static byte[] webp(String base64) {
        return Base64.getDecoder().decode(base64);
    }

    /** ARGB PNG whose pixels are all fully opaque. */
    public static byte[] opaquePngWithAlphaChannel(int width, int height) {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
        fill(image, new Color(200, 30, 30, 255));
        return encode(image, "png");
    }

    /** ARGB PNG with a fully transparent top-left corner. */
    public static byte[] pngWithTransparentCorner(int width, int height) {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
        fill(image, new Color(30, 30, 200, 255));
        for (int y = 0; y < height / 4; y++) {
            for (int x = 0; x < width / 4; x++) {
                image.setRGB(x, y, 0x00000000);
            }
        }
        return encode(image, "png");
    }

    public static byte[] rgbJpeg(int width, int height) {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        fill(image, Color.GREEN);
        return encode(image, "jpeg");
    }

    public static BufferedImage decode(byte[] bytes) {
        try {
            return ImageIO.read(new ByteArrayInputStream(bytes));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static void fill(BufferedImage image, Color color) {
        for (int y = 0; y < image.getHeight(); y++) {
            for (int x = 0; x < image.getWidth(); x++) {
                image.setRGB(x, y, color.getRGB());
            }
        }
    }

    private static byte[] encode(BufferedImage image, String format) {
        try (ByteArrayOutputStream baos = new ByteArrayOutputStream()) {
            ImageIO.write(image, format, baos);
            return baos.toByteArray();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
