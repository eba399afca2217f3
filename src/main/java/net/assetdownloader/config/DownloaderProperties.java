package net.assetdownloader.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Typed configuration for download runs and the HTTP fetch client.
 */
@Component
@ConfigurationProperties(prefix = "downloader")
public class DownloaderProperties {

    public static final int MIN_WORKERS = 1;
    public static final int MAX_WORKERS = 20;
    public static final int MIN_JPEG_QUALITY = 60;
    public static final int MAX_JPEG_QUALITY = 100;
    public static final int MIN_EDGE_THRESHOLD = 10;
    public static final int MAX_EDGE_THRESHOLD = 100;
    public static final int MAX_RETRY_ATTEMPTS = 10;

    private int defaultWorkers = 5;
    private int defaultJpegQuality = 95;
    private int defaultEdgeThreshold = 30;
    private int maxBatchSize = 10;
    private String runThreadPrefix = "DownloadRun-";
    private Http http = new Http();

    /**
     * Worker count used when a run does not specify one.
     */
    public int getDefaultWorkers() {
        return defaultWorkers;
    }

    public void setDefaultWorkers(int defaultWorkers) {
        this.defaultWorkers = defaultWorkers;
    }

    /**
     * JPEG quality used when a run does not specify one.
     */
    public int getDefaultJpegQuality() {
        return defaultJpegQuality;
    }

    public void setDefaultJpegQuality(int defaultJpegQuality) {
        this.defaultJpegQuality = defaultJpegQuality;
    }

    public int getDefaultEdgeThreshold() {
        return defaultEdgeThreshold;
    }

    public void setDefaultEdgeThreshold(int defaultEdgeThreshold) {
        this.defaultEdgeThreshold = defaultEdgeThreshold;
    }

    /**
     * Upper bound on rows grouped into one batch; the effective size is {@code min(maxBatchSize, workers * 2)}.
     */
    public int getMaxBatchSize() {
        return maxBatchSize;
    }

    public void setMaxBatchSize(int maxBatchSize) {
        this.maxBatchSize = maxBatchSize;
    }

    public String getRunThreadPrefix() {
        return runThreadPrefix;
    }

    public void setRunThreadPrefix(String runThreadPrefix) {
        this.runThreadPrefix = runThreadPrefix;
    }

    public Http getHttp() {
        return http;
    }

    public void setHttp(Http http) {
        this.http = http;
    }

    /**
     * HTTP client settings for remote asset fetches.
     */
    public static class Http {

        private static final String DEFAULT_USER_AGENT =
            "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36";

        private int retryAttempts = 3;
        private Duration backoffBase = Duration.ofSeconds(1);
        private Duration timeout = Duration.ofSeconds(60);
        private Duration connectTimeout = Duration.ofSeconds(5);
        private int maxInMemorySize = 50 * 1024 * 1024;
        private String userAgent = DEFAULT_USER_AGENT;

        /**
         * Total attempts per remote fetch, including the first one. Capped at {@value DownloaderProperties#MAX_RETRY_ATTEMPTS}.
         */
        public int getRetryAttempts() {
            return retryAttempts;
        }

        public void setRetryAttempts(int retryAttempts) {
            this.retryAttempts = Math.max(1, Math.min(retryAttempts, MAX_RETRY_ATTEMPTS));
        }

        /**
         * Delay unit for exponential backoff; attempt {@code n} waits {@code 2^n * backoffBase}.
         */
        public Duration getBackoffBase() {
            return backoffBase;
        }

        public void setBackoffBase(Duration backoffBase) {
            this.backoffBase = backoffBase;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public Duration getConnectTimeout() {
            return connectTimeout;
        }

        public void setConnectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
        }

        public int getMaxInMemorySize() {
            return maxInMemorySize;
        }

        public void setMaxInMemorySize(int maxInMemorySize) {
            this.maxInMemorySize = maxInMemorySize;
        }

        public String getUserAgent() {
            return userAgent;
        }

        public void setUserAgent(String userAgent) {
            this.userAgent = userAgent;
        }
    }
}
