package net.assetdownloader.application.download;

import jakarta.annotation.Nullable;
import net.assetdownloader.exception.PathSecurityException;
import net.assetdownloader.model.AssetKind;
import net.assetdownloader.model.DownloadJob;
import net.assetdownloader.model.RunConfig;
import net.assetdownloader.support.path.SafePathResolver;
import net.assetdownloader.util.FilenameSanitizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Expands spreadsheet rows into concrete download jobs.
 *
 * <p>Each row with a part number yields one image job per non-empty image column, named
 * {@code <stem>.jpg}, plus one {@code <stem>.pdf} job when the PDF column has a value. Rows
 * without a part number, or whose part number sanitizes to nothing, are skipped. A target whose
 * path fails the safety checks is dropped on its own; the rest of the build continues.</p>
 */
@Component
public class JobBuilder {

    private static final Logger log = LoggerFactory.getLogger(JobBuilder.class);

    private final SafePathResolver pathResolver;

    public JobBuilder(SafePathResolver pathResolver) {
        this.pathResolver = pathResolver;
    }

    /**
     * Builds the flat job list for a run, preserving row order.
     *
     * @param config run configuration
     * @param rows parsed spreadsheet rows keyed by column name
     * @return jobs in row order, image jobs before the PDF job within a row
     */
    public List<DownloadJob> build(RunConfig config, List<Map<String, String>> rows) {
        List<DownloadJob> jobs = new ArrayList<>();
        if (rows == null) {
            return jobs;
        }

        for (int i = 0; i < rows.size(); i++) {
            int rowNumber = i + 1;
            Map<String, String> row = rows.get(i);
            if (row == null) {
                continue;
            }
            String partNumber = trimToNull(row.get(config.partNumberColumn()));
            if (partNumber == null) {
                log.debug("Row {}: No part number in column '{}'; skipping.", rowNumber, config.partNumberColumn());
                continue;
            }
            String stem = FilenameSanitizer.sanitize(partNumber);
            if (stem.isEmpty()) {
                log.warn("Row {}: Part number '{}' has no filename-safe characters; skipping.", rowNumber, partNumber);
                continue;
            }
            String customFilename = config.customFilenameColumn() == null
                ? null
                : trimToNull(row.get(config.customFilenameColumn()));

            for (String imageColumn : config.imageColumns()) {
                String locator = trimToNull(row.get(imageColumn));
                if (locator != null) {
                    addTarget(jobs, config, rowNumber, partNumber, stem, AssetKind.IMAGE, locator, customFilename,
                        config.imageFolder(), config.imageNetworkPath());
                }
            }

            if (config.hasPdfColumn()) {
                String locator = trimToNull(row.get(config.pdfColumn()));
                if (locator != null) {
                    addTarget(jobs, config, rowNumber, partNumber, stem, AssetKind.PDF, locator, customFilename,
                        config.pdfFolder(), config.pdfNetworkPath());
                }
            }
        }

        log.info("Prepared {} download job(s) from {} row(s).", jobs.size(), rows.size());
        return jobs;
    }

    private void addTarget(List<DownloadJob> jobs,
                           RunConfig config,
                           int rowNumber,
                           String partNumber,
                           String stem,
                           AssetKind kind,
                           String locator,
                           @Nullable String customFilename,
                           @Nullable String folder,
                           @Nullable String networkBase) {
        if (!StringUtils.hasText(folder)) {
            log.warn("Row {}: No {} folder configured; dropping target {}.", rowNumber, kind.name().toLowerCase(Locale.ROOT), locator);
            return;
        }
        String fileName = stem + kind.extension();
        try {
            Path localPath = pathResolver.joinSafe(pathResolver.resolveSafe(folder.trim(), null), fileName);
            String networkPath = pathResolver.joinDisplayPath(networkBase, fileName);
            jobs.add(new DownloadJob(rowNumber, partNumber, kind, locator, customFilename,
                config.sourceSearchFolder(), localPath, networkPath));
        } catch (PathSecurityException e) {
            log.warn("Row {}: Dropping {} target for part {}: {} (path: {})",
                rowNumber, kind, partNumber, e.getMessage(), e.getAttemptedPath());
        }
    }

    @Nullable
    private static String trimToNull(@Nullable String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
