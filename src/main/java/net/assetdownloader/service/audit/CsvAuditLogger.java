package net.assetdownloader.service.audit;

import net.assetdownloader.exception.AssetFileSystemException;
import net.assetdownloader.model.JobResult;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Writes the per-run CSV audit log with Apache Commons CSV.
 *
 * <p>{@link #initialize(Path)} creates the file and writes the header; the returned
 * {@link AuditLogSession} appends one row per job result.</p>
 */
@Component
public class CsvAuditLogger {

    private static final Logger log = LoggerFactory.getLogger(CsvAuditLogger.class);

    public static final String[] HEADERS = {
        "Row",
        "Product Code",
        "URL",
        "Status",
        "HTTP Status",
        "Content-Type",
        "File Size (Bytes)",
        "Message",
        "Local File Path",
        "Photo File Path",
        "Background Processed"
    };

    private static final String LOG_FILE_PREFIX = "DownloadLog_";
    private static final DateTimeFormatter LOG_TIMESTAMP =
        DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH-mm-ss").withZone(ZoneOffset.UTC);

    private final Clock clock;

    public CsvAuditLogger() {
        this(Clock.systemUTC());
    }

    CsvAuditLogger(Clock clock) {
        this.clock = clock;
    }

    /**
     * Returns {@code DownloadLog_<timestamp>.csv} inside {@code folder}, where the timestamp is the
     * current UTC time with {@code :} replaced by {@code -}.
     */
    public Path logFileIn(Path folder) {
        return folder.resolve(LOG_FILE_PREFIX + LOG_TIMESTAMP.format(clock.instant()) + ".csv");
    }

    /**
     * Creates the log file, along with missing parent directories, and writes the header row.
     *
     * @throws AssetFileSystemException when the file cannot be created
     */
    public AuditLogSession initialize(Path logFile) {
        try {
            Path parent = logFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Writer writer = Files.newBufferedWriter(logFile, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
            CSVPrinter printer = new CSVPrinter(writer, CSVFormat.DEFAULT.builder().setHeader(HEADERS).build());
            printer.flush();
            log.info("Audit log initialized at {}", logFile);
            return new AuditLogSession(logFile, printer);
        } catch (IOException e) {
            log.error("Failed to create audit log {}: {}", logFile, e.getMessage(), e);
            throw new AssetFileSystemException(logFile.toString(), "Cannot create audit log " + logFile + ": " + e.getMessage(), e);
        }
    }

    /**
     * Open audit log for one run. Appends are serialized and never throw.
     */
    public static final class AuditLogSession implements AutoCloseable {

        private final Path logFile;
        private final CSVPrinter printer;
        private int rowsWritten;

        AuditLogSession(Path logFile, CSVPrinter printer) {
            this.logFile = logFile;
            this.printer = printer;
        }

        public Path getLogFile() {
            return logFile;
        }

        /**
         * Appends one row for {@code result}. Local and network paths are only written for
         * successful results. Write failures are logged and swallowed.
         */
        public synchronized void append(JobResult result) {
            try {
                printer.printRecord(
                    result.rowNumber(),
                    result.partNumber(),
                    result.locator(),
                    result.success() ? "Success" : "Failure",
                    result.httpStatus(),
                    result.contentType(),
                    result.sizeBytes(),
                    result.success() ? JobResult.SUCCESS_MESSAGE : result.message(),
                    result.success() ? result.localPath() : "",
                    result.success() ? result.networkPath() : "",
                    result.backgroundProcessed() ? "Yes" : "No");
                printer.flush();
                rowsWritten++;
            } catch (IOException e) {
                log.warn("Failed to write audit log row {} to {}: {}", result.rowNumber(), logFile, e.getMessage());
            }
        }

        public synchronized int getRowsWritten() {
            return rowsWritten;
        }

        @Override
        public synchronized void close() {
            try {
                printer.close(true);
            } catch (IOException e) {
                log.warn("Failed to close audit log {}: {}", logFile, e.getMessage());
            }
        }
    }
}
