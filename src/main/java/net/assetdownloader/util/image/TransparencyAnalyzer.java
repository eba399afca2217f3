package net.assetdownloader.util.image;

import java.awt.Transparency;
import java.awt.image.BufferedImage;
import java.awt.image.DataBufferInt;

/**
 * Detects whether an image actually contains non-opaque pixels.
 *
 * <p>A declared alpha channel is not enough: many PNGs carry one while every pixel is
 * fully opaque, so every pixel is scanned once the color model allows transparency.</p>
 */
public final class TransparencyAnalyzer {

    private static final int OPAQUE_ALPHA = 0xFF;

    private TransparencyAnalyzer() {
    }

    /** Returns {@code true} when the color model declares alpha or bitmask transparency. */
    public static boolean declaresAlpha(BufferedImage image) {
        return image != null && image.getColorModel().getTransparency() != Transparency.OPAQUE;
    }

    /**
     * Returns {@code true} when at least one pixel has alpha below 255.
     *
     * @param image the image to analyze; {@code null} returns {@code false}
     */
    public static boolean hasTransparentPixels(BufferedImage image) {
        if (!declaresAlpha(image)) {
            return false;
        }
        int width = image.getWidth();
        int height = image.getHeight();

        boolean directAccess = image.getType() == BufferedImage.TYPE_INT_ARGB
                && image.getRaster().getDataBuffer() instanceof DataBufferInt;
        if (directAccess) {
            int[] pixels = ((DataBufferInt) image.getRaster().getDataBuffer()).getData();
            for (int argb : pixels) {
                if ((argb >>> 24) != OPAQUE_ALPHA) {
                    return true;
                }
            }
            return false;
        }

        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                if ((image.getRGB(x, y) >>> 24) != OPAQUE_ALPHA) {
                    return true;
                }
            }
        }
        return false;
    }
}
