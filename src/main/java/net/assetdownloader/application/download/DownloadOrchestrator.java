package net.assetdownloader.application.download;

import jakarta.annotation.Nullable;
import net.assetdownloader.config.DownloaderProperties;
import net.assetdownloader.exception.AssetDownloadException;
import net.assetdownloader.exception.AssetFileSystemException;
import net.assetdownloader.exception.DownloadCancelledException;
import net.assetdownloader.exception.ImageProcessingException;
import net.assetdownloader.exception.RunAlreadyActiveException;
import net.assetdownloader.model.BackgroundProcessingMethod;
import net.assetdownloader.model.DownloadJob;
import net.assetdownloader.model.ImageProcessingConfig;
import net.assetdownloader.model.JobResult;
import net.assetdownloader.model.RunCompletion;
import net.assetdownloader.model.RunConfig;
import net.assetdownloader.model.RunProgress;
import net.assetdownloader.model.RunState;
import net.assetdownloader.model.image.NormalizedImage;
import net.assetdownloader.service.audit.CsvAuditLogger;
import net.assetdownloader.service.audit.CsvAuditLogger.AuditLogSession;
import net.assetdownloader.service.fetch.AssetFetcher;
import net.assetdownloader.service.fetch.FetchOutcome;
import net.assetdownloader.service.image.ImageNormalizer;
import net.assetdownloader.support.cancel.CancellationToken;
import net.assetdownloader.support.path.SafePathResolver;
import net.assetdownloader.util.ImageContentDetector;
import net.assetdownloader.util.LoggingUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Owns the download run lifecycle: {@code IDLE → RUNNING → COMPLETED | CANCELLED | FAILED}.
 *
 * <p>A run prepares its jobs, opens the audit log and then works through the rows in batches of
 * {@code min(maxBatchSize, workers * 2)}. Rows in a batch run in parallel on a pool of
 * {@code workers} threads; the jobs of one row run one after another. Every job failure is
 * isolated to that job. Only one run can be active; {@link #cancelRun()} never waits on it.</p>
 */
@Service
public class DownloadOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(DownloadOrchestrator.class);

    private static final String WORKER_THREAD_PREFIX = "DownloadWorker-";
    private static final String NOT_AN_IMAGE_MESSAGE = "Resolved content is not a recognized image";

    private final JobBuilder jobBuilder;
    private final RunConfigValidator validator;
    private final AssetFetcher assetFetcher;
    private final ImageNormalizer imageNormalizer;
    private final CsvAuditLogger auditLogger;
    private final SafePathResolver pathResolver;
    private final DownloaderProperties properties;
    private final List<DownloadRunListener> listeners;
    private final TaskExecutor runExecutor;

    /** Token of the active run; {@code null} when idle. Doubles as the run lock. */
    private final AtomicReference<CancellationToken> activeRun = new AtomicReference<>();
    private volatile RunState state = RunState.IDLE;
    @Nullable
    private volatile RunProgressTracker progressTracker;
    @Nullable
    private volatile RunCompletion lastCompletion;
    @Nullable
    private volatile String lastError;

    public DownloadOrchestrator(JobBuilder jobBuilder,
                                RunConfigValidator validator,
                                AssetFetcher assetFetcher,
                                ImageNormalizer imageNormalizer,
                                CsvAuditLogger auditLogger,
                                SafePathResolver pathResolver,
                                DownloaderProperties properties,
                                List<DownloadRunListener> listeners,
                                @Qualifier("downloadRunExecutor") TaskExecutor runExecutor) {
        this.jobBuilder = jobBuilder;
        this.validator = validator;
        this.assetFetcher = assetFetcher;
        this.imageNormalizer = imageNormalizer;
        this.auditLogger = auditLogger;
        this.pathResolver = pathResolver;
        this.properties = properties;
        this.listeners = List.copyOf(listeners);
        this.runExecutor = runExecutor;
    }

    /**
     * Starts a run asynchronously.
     *
     * @param config run configuration
     * @param rows parsed spreadsheet rows
     * @throws RunAlreadyActiveException when a run is active
     * @throws net.assetdownloader.exception.RunConfigValidationException when the configuration is invalid
     */
    public void startRun(RunConfig config, List<Map<String, String>> rows) {
        CancellationToken token = new CancellationToken();
        if (!activeRun.compareAndSet(null, token)) {
            throw new RunAlreadyActiveException();
        }
        try {
            validator.validate(config);
            progressTracker = new RunProgressTracker(0);
            lastCompletion = null;
            lastError = null;
            state = RunState.RUNNING;
            List<Map<String, String>> rowSnapshot = rows == null
                ? List.of()
                : rows.stream().filter(Objects::nonNull).toList();
            runExecutor.execute(() -> executeRun(config, rowSnapshot, token));
        } catch (RejectedExecutionException e) {
            state = RunState.FAILED;
            activeRun.compareAndSet(token, null);
            throw new IllegalStateException("Download run executor rejected the run", e);
        } catch (RuntimeException e) {
            activeRun.compareAndSet(token, null);
            throw e;
        }
    }

    /**
     * Requests cancellation of the active run. In-flight HTTP requests are aborted at once.
     *
     * @return {@code true} when a run was active
     */
    public boolean cancelRun() {
        CancellationToken token = activeRun.get();
        if (token == null) {
            return false;
        }
        log.info("Cancellation requested for active download run.");
        token.cancel();
        return true;
    }

    public boolean isRunning() {
        return activeRun.get() != null;
    }

    /** Returns the current state; a terminal state is kept until the next run starts. */
    public RunState state() {
        return state;
    }

    public RunProgress currentProgress() {
        RunProgressTracker tracker = progressTracker;
        return tracker == null ? RunProgress.initial(0) : tracker.snapshot();
    }

    @Nullable
    public RunCompletion lastCompletion() {
        return lastCompletion;
    }

    @Nullable
    public String lastError() {
        return lastError;
    }

    // ── Run execution ───────────────────────────────────────────────────

    void executeRun(RunConfig config, List<Map<String, String>> rows, CancellationToken token) {
        AuditLogSession auditLog = null;
        try {
            List<DownloadJob> jobs;
            RunProgressTracker tracker;
            try {
                jobs = jobBuilder.build(config, rows);
                tracker = new RunProgressTracker(jobs.size());
                progressTracker = tracker;
                auditLog = auditLogger.initialize(auditLogger.logFileIn(resolveLogFolder(config)));
            } catch (RuntimeException e) {
                failRun(e);
                return;
            }

            logReservedMethod(config.imageProcessing());
            processJobs(config, jobs, tracker, auditLog, token);

            RunProgress finalProgress = tracker.snapshot();
            boolean cancelled = token.isCancelled();
            RunCompletion completion = new RunCompletion(
                finalProgress.successful(),
                finalProgress.failed(),
                finalProgress.total(),
                finalProgress.backgroundProcessed(),
                auditLog.getLogFile().toString(),
                cancelled);
            lastCompletion = completion;
            state = cancelled ? RunState.CANCELLED : RunState.COMPLETED;
            log.info("Download run {}: {} succeeded, {} failed of {} (log: {}).",
                cancelled ? "cancelled" : "completed",
                completion.successful(), completion.failed(), completion.total(), completion.logFile());
            notifyListeners(listener -> listener.onComplete(completion));
        } catch (RuntimeException e) {
            failRun(e);
        } finally {
            if (auditLog != null) {
                auditLog.close();
            }
            activeRun.compareAndSet(token, null);
        }
    }

    private void processJobs(RunConfig config,
                             List<DownloadJob> jobs,
                             RunProgressTracker tracker,
                             AuditLogSession auditLog,
                             CancellationToken token) {
        List<List<DownloadJob>> rowGroups = groupByRow(jobs);
        int workers = config.workersOrDefault(properties.getDefaultWorkers());
        int batchSize = Math.max(1, Math.min(properties.getMaxBatchSize(), workers * 2));
        log.info("Starting download run: {} job(s) across {} row(s), {} worker(s), batch size {}.",
            jobs.size(), rowGroups.size(), workers, batchSize);

        ExecutorService pool = Executors.newFixedThreadPool(workers, new CustomizableThreadFactory(WORKER_THREAD_PREFIX));
        try {
            for (int start = 0; start < rowGroups.size() && !token.isCancelled(); start += batchSize) {
                List<List<DownloadJob>> batch = rowGroups.subList(start, Math.min(start + batchSize, rowGroups.size()));
                List<Future<?>> futures = new ArrayList<>(batch.size());
                for (List<DownloadJob> rowJobs : batch) {
                    futures.add(pool.submit(() -> processRow(config, rowJobs, tracker, auditLog, token)));
                }
                for (Future<?> future : futures) {
                    awaitQuietly(future, token);
                }
            }
        } finally {
            pool.shutdownNow();
        }
    }

    private void processRow(RunConfig config,
                            List<DownloadJob> rowJobs,
                            RunProgressTracker tracker,
                            AuditLogSession auditLog,
                            CancellationToken token) {
        for (DownloadJob job : rowJobs) {
            if (token.isCancelled()) {
                return;
            }
            JobResult result = processJob(config, job, token);
            if (result.cancelled()) {
                return;
            }
            auditLog.append(result);
            tracker.record(result, job.fileName(), progress -> notifyListeners(listener -> listener.onProgress(progress)));
        }
    }

    /**
     * Resolves, normalizes and writes one job. Never throws; every failure becomes a failed result.
     */
    JobResult processJob(RunConfig config, DownloadJob job, CancellationToken token) {
        FetchOutcome outcome;
        try {
            outcome = assetFetcher.resolve(job, token);
        } catch (RuntimeException e) {
            LoggingUtils.error(log, e, "Row {}: Unexpected error resolving {}", job.rowNumber(), job.locator());
            return JobResult.failure(job, 0, "", "Unexpected error: " + LoggingUtils.summarize(e));
        }
        if (outcome.cancelled()) {
            return JobResult.cancelled(job);
        }
        if (!outcome.success()) {
            log.warn("Row {}: Failed to resolve {} for part {}: {}", job.rowNumber(), job.locator(), job.partNumber(), outcome.message());
            return JobResult.failure(job, outcome.httpStatus(), outcome.contentType(), outcome.message());
        }

        try {
            byte[] content = outcome.bytes();
            boolean flattened = false;
            if (job.isImage()) {
                if (!ImageContentDetector.isImageContent(outcome.origin(), outcome.contentType(), content)) {
                    throw new ImageProcessingException(NOT_AN_IMAGE_MESSAGE);
                }
                ImageProcessingConfig processing = config.imageProcessing();
                NormalizedImage normalized = imageNormalizer.toJpeg(content,
                    processing.qualityOrDefault(properties.getDefaultJpegQuality()),
                    processing.enabled(),
                    "Row " + job.rowNumber() + " (" + job.partNumber() + ")");
                content = normalized.jpegBytes();
                flattened = normalized.wasFlattened();
            }

            token.throwIfCancelled(job.locator());
            writeFile(job.localPath(), content);
            log.info("Row {}: Saved {} ({} bytes, via {}).", job.rowNumber(), job.localPath(), content.length, outcome.strategy());
            return JobResult.success(job, outcome.httpStatus(), outcome.contentType(), content.length, flattened, outcome.message());
        } catch (DownloadCancelledException e) {
            return JobResult.cancelled(job);
        } catch (ImageProcessingException e) {
            log.warn("Row {}: Image processing failed for {}: {}", job.rowNumber(), job.locator(), e.getMessage());
            return JobResult.failure(job, outcome.httpStatus(), outcome.contentType(), "Image processing failed: " + e.getMessage());
        } catch (AssetDownloadException e) {
            log.warn("Row {}: Failed to store {}: {}", job.rowNumber(), job.localPath(), e.getMessage());
            return JobResult.failure(job, outcome.httpStatus(), outcome.contentType(), e.getMessage());
        } catch (RuntimeException e) {
            LoggingUtils.error(log, e, "Row {}: Unexpected error processing {}", job.rowNumber(), job.locator());
            return JobResult.failure(job, outcome.httpStatus(), outcome.contentType(), "Unexpected error: " + LoggingUtils.summarize(e));
        }
    }

    private void writeFile(Path target, byte[] content) {
        try {
            Path parent = target.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.write(target, content);
        } catch (IOException e) {
            throw new AssetFileSystemException(target.toString(), "Error writing file: " + e.getMessage(), e);
        }
    }

    private Path resolveLogFolder(RunConfig config) {
        String folder = StringUtils.hasText(config.imageFolder()) ? config.imageFolder() : config.pdfFolder();
        if (!StringUtils.hasText(folder)) {
            throw new AssetFileSystemException("", "No output folder configured for the audit log", null);
        }
        return pathResolver.resolveSafe(folder.trim(), null);
    }

    private static List<List<DownloadJob>> groupByRow(List<DownloadJob> jobs) {
        Map<Integer, List<DownloadJob>> byRow = new LinkedHashMap<>();
        for (DownloadJob job : jobs) {
            byRow.computeIfAbsent(job.rowNumber(), ignored -> new ArrayList<>()).add(job);
        }
        return new ArrayList<>(byRow.values());
    }

    private static void awaitQuietly(Future<?> future, CancellationToken token) {
        try {
            future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Download run thread interrupted; treating as cancellation.");
            token.cancel();
        } catch (ExecutionException e) {
            LoggingUtils.error(log, e.getCause(), "Row worker failed unexpectedly");
        }
    }

    private void failRun(RuntimeException e) {
        String message = e instanceof AssetDownloadException ? e.getMessage() : "Run setup failed: " + LoggingUtils.summarize(e);
        LoggingUtils.error(log, e, "Download run failed: {}", message);
        lastError = message;
        state = RunState.FAILED;
        notifyListeners(listener -> listener.onError(message));
    }

    private static void logReservedMethod(ImageProcessingConfig processing) {
        BackgroundProcessingMethod method = processing.method();
        if (processing.enabled() && !method.isImplemented()) {
            log.info("Background method '{}' is reserved; applying transparency flattening instead.", method.value());
        }
    }

    private void notifyListeners(Consumer<DownloadRunListener> callback) {
        for (DownloadRunListener listener : listeners) {
            try {
                callback.accept(listener);
            } catch (RuntimeException e) {
                LoggingUtils.warn(log, e, "Download run listener {} failed", listener.getClass().getSimpleName());
            }
        }
    }
}
