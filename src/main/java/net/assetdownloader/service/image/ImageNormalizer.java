package net.assetdownloader.service.image;

import net.assetdownloader.config.DownloaderProperties;
import net.assetdownloader.exception.ImageProcessingException;
import net.assetdownloader.model.image.NormalizedImage;
import net.assetdownloader.util.ImageContentDetector;
import net.assetdownloader.util.image.TransparencyAnalyzer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageOutputStream;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Iterator;

/**
 * Re-encodes downloaded images as JPEG, flattening real transparency onto white
 *
 * Features:
 * - Decodes any format ImageIO can read, WebP included through the TwelveMonkeys plugin
 * - Scans every pixel to tell declared alpha apart from actual transparency
 * - Always composites over an opaque white canvas; flattening only reports it
 * - Encodes JPEG at an explicit quality between 60 and 100
 * - Throws instead of returning the original bytes when decoding fails
 */
@Service
public class ImageNormalizer {

    private static final Logger logger = LoggerFactory.getLogger(ImageNormalizer.class);
    private static final String DEFAULT_LOG_LABEL = "image";

    /**
     * Converts image bytes to JPEG, flattening transparency onto white.
     *
     * @param rawBytes encoded image data
     * @param quality JPEG quality, clamped to 60-100
     * @return the JPEG bytes and whether flattening was applied
     * @throws ImageProcessingException when the bytes cannot be decoded or encoded
     */
    public NormalizedImage toJpeg(byte[] rawBytes, int quality) {
        return toJpeg(rawBytes, quality, true, DEFAULT_LOG_LABEL);
    }

    /**
     * Converts image bytes to JPEG.
     *
     * @param rawBytes encoded image data
     * @param quality JPEG quality, clamped to 60-100
     * @param flattenTransparency report transparent images as flattened; the white
     *                            canvas is applied either way
     * @param labelForLog identifier used in log lines
     * @return the JPEG bytes and whether flattening was applied
     * @throws ImageProcessingException when the bytes cannot be decoded or encoded
     */
    public NormalizedImage toJpeg(byte[] rawBytes, int quality, boolean flattenTransparency, String labelForLog) {
        if (rawBytes == null || rawBytes.length == 0) {
            throw new ImageProcessingException("Image data is empty");
        }
        String sourceFormat = ImageContentDetector.detectFormat(rawBytes);

        BufferedImage decoded;
        try (ByteArrayInputStream bais = new ByteArrayInputStream(rawBytes)) {
            decoded = ImageIO.read(bais);
        } catch (IOException | RuntimeException e) {
            logger.warn("{}: Failed to decode {} bytes (format: {}): {}", labelForLog, rawBytes.length, sourceFormat, e.getMessage());
            throw new ImageProcessingException("Failed to decode image (format: " + sourceFormat + "): " + e.getMessage(), e);
        }
        if (decoded == null) {
            logger.warn("{}: No ImageIO reader could decode {} bytes (format: {}).", labelForLog, rawBytes.length, sourceFormat);
            throw new ImageProcessingException("Unsupported or corrupt image data (format: " + sourceFormat + ")");
        }

        boolean transparent = TransparencyAnalyzer.hasTransparentPixels(decoded);
        boolean flatten = transparent && flattenTransparency;
        if (transparent) {
            logger.debug("{}: Image has transparent pixels; compositing onto white (processing {}).",
                labelForLog, flattenTransparency ? "enabled" : "disabled");
        } else if (TransparencyAnalyzer.declaresAlpha(decoded)) {
            logger.debug("{}: Image declares alpha but every pixel is opaque.", labelForLog);
        }

        // JPEG has no alpha channel; transparent areas become white, never black
        BufferedImage rgb = new BufferedImage(decoded.getWidth(), decoded.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D g = rgb.createGraphics();
        try {
            g.setColor(Color.WHITE);
            g.fillRect(0, 0, rgb.getWidth(), rgb.getHeight());
            g.drawImage(decoded, 0, 0, null);
        } finally {
            g.dispose();
        }

        byte[] jpeg = encodeJpeg(rgb, clampQuality(quality), labelForLog);
        logger.info("{}: Normalized {} image to JPEG ({}x{}, {} bytes, flattened={}).",
            labelForLog, sourceFormat, rgb.getWidth(), rgb.getHeight(), jpeg.length, flatten);
        return new NormalizedImage(jpeg, flatten, sourceFormat);
    }

    private byte[] encodeJpeg(BufferedImage image, int quality, String labelForLog) {
        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName("jpeg");
        if (!writers.hasNext()) {
            logger.error("{}: No JPEG ImageWriters found. Cannot encode image.", labelForLog);
            throw new ImageProcessingException("No JPEG ImageWriters available");
        }
        ImageWriter writer = writers.next();
        try (ByteArrayOutputStream baos = new ByteArrayOutputStream()) {
            ImageWriteParam jpegParams = writer.getDefaultWriteParam();
            jpegParams.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
            jpegParams.setCompressionQuality(quality / 100f);

            try (ImageOutputStream ios = ImageIO.createImageOutputStream(baos)) {
                writer.setOutput(ios);
                writer.write(null, new IIOImage(image, null, null), jpegParams);
            }
            return baos.toByteArray();
        } catch (IOException e) {
            logger.error("{}: IOException during JPEG encoding: {}", labelForLog, e.getMessage(), e);
            throw new ImageProcessingException("Failed to encode JPEG: " + e.getMessage(), e);
        } finally {
            writer.dispose();
        }
    }

    static int clampQuality(int quality) {
        return Math.max(DownloaderProperties.MIN_JPEG_QUALITY, Math.min(DownloaderProperties.MAX_JPEG_QUALITY, quality));
    }
}
