package net.assetdownloader.model;

import jakarta.annotation.Nullable;

import java.nio.file.Path;

/**
 * One concrete asset acquisition: a single image or PDF target for one spreadsheet row.
 *
 * @param rowNumber 1-based row index in the input
 * @param partNumber raw part number, used for source-folder matching
 * @param kind target kind
 * @param locator URL or local path to resolve
 * @param customFilename optional filename hint for source-folder matching
 * @param sourceSearchFolder optional folder searched before any other strategy
 * @param localPath destination written on success
 * @param networkPath audit-only destination; empty when no network path is configured
 */
public record DownloadJob(
        int rowNumber,
        String partNumber,
        AssetKind kind,
        String locator,
        @Nullable String customFilename,
        @Nullable String sourceSearchFolder,
        Path localPath,
        String networkPath) {

    public DownloadJob {
        networkPath = networkPath == null ? "" : networkPath;
    }

    public String fileName() {
        return localPath.getFileName().toString();
    }

    public boolean isImage() {
        return kind == AssetKind.IMAGE;
    }
}
