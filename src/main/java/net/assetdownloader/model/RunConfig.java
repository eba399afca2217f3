package net.assetdownloader.model;

import jakarta.annotation.Nullable;
import org.springframework.util.StringUtils;

import java.util.List;

/**
 * Immutable input for one download run.
 *
 * <p>Column names refer to keys of the row maps. Network paths are recorded in the
 * audit log only and never used for file I/O.</p>
 */
public record RunConfig(
        String partNumberColumn,
        List<String> imageColumns,
        @Nullable String pdfColumn,
        @Nullable String customFilenameColumn,
        @Nullable String imageFolder,
        @Nullable String pdfFolder,
        @Nullable String sourceSearchFolder,
        @Nullable String imageNetworkPath,
        @Nullable String pdfNetworkPath,
        @Nullable Integer maxWorkers,
        @Nullable ImageProcessingConfig imageProcessing) {

    public RunConfig {
        imageColumns = imageColumns == null
            ? List.of()
            : imageColumns.stream().filter(StringUtils::hasText).toList();
        if (imageProcessing == null) {
            imageProcessing = ImageProcessingConfig.defaults();
        }
    }

    public boolean hasImageColumns() {
        return !imageColumns.isEmpty();
    }

    public boolean hasPdfColumn() {
        return StringUtils.hasText(pdfColumn);
    }

    /** Returns the configured worker count, or {@code defaultWorkers} when unset. */
    public int workersOrDefault(int defaultWorkers) {
        return maxWorkers == null ? defaultWorkers : maxWorkers;
    }
}
