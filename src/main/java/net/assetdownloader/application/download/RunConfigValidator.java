package net.assetdownloader.application.download;

import net.assetdownloader.config.DownloaderProperties;
import net.assetdownloader.exception.PathSecurityException;
import net.assetdownloader.exception.RunConfigValidationException;
import net.assetdownloader.model.ImageProcessingConfig;
import net.assetdownloader.model.RunConfig;
import net.assetdownloader.support.path.SafePathResolver;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks a run configuration before any job is prepared, collecting every problem at once.
 */
@Component
public class RunConfigValidator {

    private final SafePathResolver pathResolver;
    private final DownloaderProperties properties;

    public RunConfigValidator(SafePathResolver pathResolver, DownloaderProperties properties) {
        this.pathResolver = pathResolver;
        this.properties = properties;
    }

    /**
     * @throws RunConfigValidationException listing every violation found
     */
    public void validate(RunConfig config) {
        List<String> errors = new ArrayList<>();
        if (config == null) {
            throw new RunConfigValidationException(List.of("Download configuration is required"));
        }

        if (!StringUtils.hasText(config.partNumberColumn())) {
            errors.add("Part number column is required");
        }
        if (!config.hasImageColumns() && !config.hasPdfColumn()) {
            errors.add("At least one image column or a PDF column is required");
        }
        if (config.hasImageColumns()) {
            checkFolder(errors, "Image folder", config.imageFolder(), true);
        }
        if (config.hasPdfColumn()) {
            checkFolder(errors, "PDF folder", config.pdfFolder(), true);
        }
        checkFolder(errors, "Source search folder", config.sourceSearchFolder(), false);

        int workers = config.workersOrDefault(properties.getDefaultWorkers());
        if (workers < DownloaderProperties.MIN_WORKERS || workers > DownloaderProperties.MAX_WORKERS) {
            errors.add("Max workers must be between " + DownloaderProperties.MIN_WORKERS
                + " and " + DownloaderProperties.MAX_WORKERS);
        }

        ImageProcessingConfig processing = config.imageProcessing();
        if (processing.enabled()) {
            int quality = processing.qualityOrDefault(properties.getDefaultJpegQuality());
            if (quality < DownloaderProperties.MIN_JPEG_QUALITY || quality > DownloaderProperties.MAX_JPEG_QUALITY) {
                errors.add("Image quality must be between " + DownloaderProperties.MIN_JPEG_QUALITY
                    + " and " + DownloaderProperties.MAX_JPEG_QUALITY);
            }
            int edgeThreshold = processing.edgeThreshold() == null
                ? properties.getDefaultEdgeThreshold()
                : processing.edgeThreshold();
            if (edgeThreshold < DownloaderProperties.MIN_EDGE_THRESHOLD
                    || edgeThreshold > DownloaderProperties.MAX_EDGE_THRESHOLD) {
                errors.add("Edge threshold must be between " + DownloaderProperties.MIN_EDGE_THRESHOLD
                    + " and " + DownloaderProperties.MAX_EDGE_THRESHOLD);
            }
        }

        if (!errors.isEmpty()) {
            throw new RunConfigValidationException(errors);
        }
    }

    private void checkFolder(List<String> errors, String label, String folder, boolean required) {
        if (!StringUtils.hasText(folder)) {
            if (required) {
                errors.add(label + " is required");
            }
            return;
        }
        try {
            pathResolver.resolveSafe(folder.trim(), null);
        } catch (PathSecurityException e) {
            errors.add(label + " is not a safe path: " + e.getMessage());
        }
    }
}
