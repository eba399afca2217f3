/**
 * JPEG output of image normalization
 *
 * @param jpegBytes encoded JPEG data
 * @param wasFlattened whether transparent pixels were composited onto white
 * @param sourceFormat format sniffed from the input bytes, for logging
 */

package net.assetdownloader.model.image;

import java.util.Arrays;

public record NormalizedImage(byte[] jpegBytes, boolean wasFlattened, String sourceFormat) {

    public NormalizedImage {
        if (jpegBytes != null) {
            jpegBytes = Arrays.copyOf(jpegBytes, jpegBytes.length);
        }
    }

    @Override
    public byte[] jpegBytes() {
        return jpegBytes == null ? null : Arrays.copyOf(jpegBytes, jpegBytes.length);
    }

    public int size() {
        return jpegBytes == null ? 0 : jpegBytes.length;
    }
}
