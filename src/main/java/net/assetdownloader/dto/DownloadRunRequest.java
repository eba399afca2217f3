package net.assetdownloader.dto;

import jakarta.validation.constraints.NotNull;
import net.assetdownloader.model.RunConfig;

import java.util.List;
import java.util.Map;

/**
 * Request body for starting a download run: the configuration plus already-parsed spreadsheet rows.
 */
public record DownloadRunRequest(
        @NotNull RunConfig config,
        @NotNull List<Map<String, String>> rows) {
}
