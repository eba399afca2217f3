package net.assetdownloader.service.fetch;

import jakarta.annotation.Nullable;
import net.assetdownloader.exception.AssetDownloadException;
import net.assetdownloader.exception.PathSecurityException;
import net.assetdownloader.model.AssetKind;
import net.assetdownloader.model.DownloadJob;
import net.assetdownloader.support.cancel.CancellationToken;
import net.assetdownloader.support.path.SafePathResolver;
import net.assetdownloader.util.ImageContentDetector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Resolves a job's locator to bytes using three ordered strategies:
 * <ol>
 *   <li>search the run's source folder for a file matching the custom filename or part number</li>
 *   <li>read the locator as a local file, or the first image inside a local directory</li>
 *   <li>download the locator over HTTP with retries</li>
 * </ol>
 * The first strategy that produces bytes wins.
 */
@Service
public class AssetFetcher {

    private static final Logger log = LoggerFactory.getLogger(AssetFetcher.class);

    private static final Pattern URL_SCHEME = Pattern.compile("^[a-zA-Z][a-zA-Z0-9+.-]*://");

    static final String SOURCE_FOLDER_MESSAGE = "File copied and processed from source folder";
    static final String LOCAL_FILE_MESSAGE = "File copied and processed from local path";
    static final String EMPTY_DIRECTORY_MESSAGE = "No image files found in directory";

    private final SafePathResolver pathResolver;
    private final HttpAssetClient httpAssetClient;

    public AssetFetcher(SafePathResolver pathResolver, HttpAssetClient httpAssetClient) {
        this.pathResolver = pathResolver;
        this.httpAssetClient = httpAssetClient;
    }

    /**
     * Resolves the bytes for {@code job}.
     *
     * @param job job to resolve
     * @param cancellation run cancellation token
     * @return the outcome of the first strategy that applied
     */
    public FetchOutcome resolve(DownloadJob job, CancellationToken cancellation) {
        if (cancellation.isCancelled()) {
            return FetchOutcome.cancelled(ResolutionStrategy.NONE, 0);
        }

        Optional<FetchOutcome> fromSourceFolder = searchSourceFolder(job);
        if (fromSourceFolder.isPresent()) {
            return fromSourceFolder.get();
        }

        Optional<FetchOutcome> fromLocalPath = readLocalPath(job);
        if (fromLocalPath.isPresent()) {
            return fromLocalPath.get();
        }

        return httpAssetClient.fetch(job.locator(), cancellation);
    }

    // ── Source folder ───────────────────────────────────────────────────

    Optional<FetchOutcome> searchSourceFolder(DownloadJob job) {
        if (!StringUtils.hasText(job.sourceSearchFolder())) {
            return Optional.empty();
        }
        String needle = StringUtils.hasText(job.customFilename())
            ? job.customFilename().trim().toLowerCase(Locale.ROOT)
            : job.partNumber().trim().toLowerCase(Locale.ROOT);
        if (needle.isEmpty()) {
            return Optional.empty();
        }

        List<Path> candidates;
        try {
            Path folder = pathResolver.resolveSafe(job.sourceSearchFolder(), null);
            if (!Files.isDirectory(folder)) {
                log.warn("Row {}: Source folder {} does not exist; skipping source search.", job.rowNumber(), folder);
                return Optional.empty();
            }
            candidates = pathResolver.listFilesRecursively(folder, folder);
        } catch (AssetDownloadException e) {
            log.warn("Row {}: Source folder search unavailable: {}", job.rowNumber(), e.getMessage());
            return Optional.empty();
        }

        for (Path candidate : candidates) {
            String fileName = candidate.getFileName().toString();
            if (!matchesKind(fileName, job.kind())) {
                continue;
            }
            if (fileName.toLowerCase(Locale.ROOT).contains(needle)) {
                try {
                    byte[] bytes = Files.readAllBytes(candidate);
                    log.info("Row {}: Found {} in source folder for '{}'.", job.rowNumber(), candidate, needle);
                    return Optional.of(FetchOutcome.local(bytes, ResolutionStrategy.SOURCE_FOLDER, SOURCE_FOLDER_MESSAGE, candidate.toString()));
                } catch (IOException e) {
                    log.warn("Row {}: Could not read source folder match {}: {}", job.rowNumber(), candidate, e.getMessage());
                }
            }
        }
        log.debug("Row {}: No source folder match for '{}'.", job.rowNumber(), needle);
        return Optional.empty();
    }

    // ── Local file or directory ─────────────────────────────────────────

    Optional<FetchOutcome> readLocalPath(DownloadJob job) {
        String locator = job.locator();
        if (!StringUtils.hasText(locator) || URL_SCHEME.matcher(locator.trim()).find()) {
            return Optional.empty();
        }

        Path path;
        try {
            path = pathResolver.resolveSafe(locator.trim(), null);
        } catch (PathSecurityException e) {
            log.warn("Row {}: Rejected local locator {}: {}", job.rowNumber(), e.getAttemptedPath(), e.getMessage());
            return Optional.of(FetchOutcome.failure(ResolutionStrategy.LOCAL_PATH, 0, "",
                "Path security violation: " + e.getMessage(), 0));
        }

        if (Files.isRegularFile(path)) {
            return Optional.of(readFile(path, LOCAL_FILE_MESSAGE));
        }
        if (Files.isDirectory(path)) {
            return Optional.of(readFirstImageInDirectory(job, path));
        }
        return Optional.empty();
    }

    private FetchOutcome readFirstImageInDirectory(DownloadJob job, Path directory) {
        List<Path> images;
        try {
            images = pathResolver.listSafe(directory, directory).stream()
                .filter(Files::isRegularFile)
                .filter(entry -> ImageContentDetector.isImageFileName(entry.getFileName().toString()))
                .toList();
        } catch (AssetDownloadException e) {
            return FetchOutcome.failure(ResolutionStrategy.LOCAL_PATH, 0, "", e.getMessage(), 0);
        }
        if (images.isEmpty()) {
            log.warn("Row {}: Directory {} contains no image files.", job.rowNumber(), directory);
            return FetchOutcome.failure(ResolutionStrategy.LOCAL_PATH, 0, "", EMPTY_DIRECTORY_MESSAGE, 0);
        }
        String message = "File copied and processed from directory (" + images.size() + " images found)";
        return readFile(images.get(0), message);
    }

    private FetchOutcome readFile(Path file, String message) {
        try {
            return FetchOutcome.local(Files.readAllBytes(file), ResolutionStrategy.LOCAL_PATH, message, file.toString());
        } catch (IOException e) {
            log.warn("Failed to read local file {}: {}", file, e.getMessage());
            return FetchOutcome.failure(ResolutionStrategy.LOCAL_PATH, 0, "",
                "Error reading local file: " + e.getMessage(), 0);
        }
    }

    private static boolean matchesKind(String fileName, @Nullable AssetKind kind) {
        if (kind == AssetKind.PDF) {
            return fileName.toLowerCase(Locale.ROOT).endsWith(".pdf");
        }
        return ImageContentDetector.isImageFileName(fileName);
    }
}
