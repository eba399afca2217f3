package net.assetdownloader.service.fetch;

import net.assetdownloader.config.DownloaderProperties;
import net.assetdownloader.exception.AssetFetchException;
import net.assetdownloader.exception.DownloadCancelledException;
import net.assetdownloader.support.cancel.CancellationToken;
import net.assetdownloader.util.LoggingUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.net.URI;
import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fetches remote assets over HTTP with bounded exponential-backoff retries.
 *
 * <p>Attempt {@code n} (0-based) is followed by a {@code 2^n * backoffBase} delay. Every
 * failure is retried, whatever its status; the final attempt's status and message are
 * reported. A cancelled token disposes the in-flight request and any pending backoff
 * immediately.</p>
 */
@Component
public class HttpAssetClient {

    private static final Logger log = LoggerFactory.getLogger(HttpAssetClient.class);

    static final String TIMEOUT_MESSAGE = "Timeout error";

    private final WebClient webClient;
    private final int maxAttempts;
    private final Duration backoffBase;
    private final Duration timeout;

    public HttpAssetClient(WebClient.Builder webClientBuilder, DownloaderProperties properties) {
        this.webClient = webClientBuilder.build();
        this.maxAttempts = properties.getHttp().getRetryAttempts();
        this.backoffBase = properties.getHttp().getBackoffBase();
        this.timeout = properties.getHttp().getTimeout();
    }

    /**
     * Downloads {@code url}, retrying transient failures.
     *
     * @param url absolute http or https URL
     * @param cancellation run cancellation token
     * @return a successful outcome with the body, or the final attempt's error
     */
    public FetchOutcome fetch(String url, CancellationToken cancellation) {
        URI uri = parseHttpUri(url);
        if (uri == null) {
            return FetchOutcome.failure(ResolutionStrategy.HTTP, 0, "",
                "Unsupported locator: not an existing local path or http(s) URL", 0);
        }

        AtomicInteger attempts = new AtomicInteger();
        Mono<ResponseEntity<byte[]>> request = Mono.defer(() -> {
                cancellation.throwIfCancelled(url);
                int attempt = attempts.incrementAndGet();
                log.debug("GET {} (attempt {}/{})", url, attempt, maxAttempts);
                return webClient.get()
                    .uri(uri)
                    .retrieve()
                    .toEntity(byte[].class)
                    .timeout(timeout)
                    .onErrorMap(error -> !(error instanceof DownloadCancelledException),
                        error -> toFetchException(url, error));
            })
            .retryWhen(buildRetrySpec(url))
            .takeUntilOther(cancellation.onCancel());

        try {
            ResponseEntity<byte[]> response = request.block();
            if (response == null) {
                log.info("HTTP fetch of {} cancelled after {} attempt(s).", url, attempts.get());
                return FetchOutcome.cancelled(ResolutionStrategy.HTTP, attempts.get());
            }
            int status = response.getStatusCode().value();
            String contentType = response.getHeaders().getFirst(HttpHeaders.CONTENT_TYPE);
            byte[] body = response.getBody();
            if (body == null || body.length == 0) {
                return FetchOutcome.failure(ResolutionStrategy.HTTP, status, contentType, "Empty response body", attempts.get());
            }
            log.debug("Fetched {} bytes from {} (status {}, type {}).", body.length, url, status, contentType);
            return FetchOutcome.http(body, contentType, status, attempts.get(), url);
        } catch (DownloadCancelledException e) {
            return FetchOutcome.cancelled(ResolutionStrategy.HTTP, attempts.get());
        } catch (AssetFetchException e) {
            log.warn("HTTP fetch of {} failed after {} attempt(s): {}", url, attempts.get(), e.getMessage());
            return FetchOutcome.failure(ResolutionStrategy.HTTP, e.getHttpStatus(), "", e.getMessage(), attempts.get());
        } catch (RuntimeException e) {
            LoggingUtils.warn(log, e, "Unexpected error fetching {}", url);
            return FetchOutcome.failure(ResolutionStrategy.HTTP, 0, "",
                "Unexpected error: " + LoggingUtils.summarize(e), attempts.get());
        }
    }

    private Retry buildRetrySpec(String url) {
        return Retry.backoff(Math.max(0, maxAttempts - 1), backoffBase)
            .jitter(0d)
            .filter(throwable -> throwable instanceof AssetFetchException fetchException
                && fetchException.isRetryable())
            .doBeforeRetry(retrySignal -> log.info("Retry attempt {} for {}: reason={}",
                retrySignal.totalRetries() + 1,
                url,
                LoggingUtils.summarize(retrySignal.failure())))
            .onRetryExhaustedThrow((spec, retrySignal) -> retrySignal.failure());
    }

    static AssetFetchException toFetchException(String url, Throwable error) {
        if (error instanceof AssetFetchException fetchException) {
            return fetchException;
        }
        if (error instanceof WebClientResponseException responseException) {
            int status = responseException.getStatusCode().value();
            return new AssetFetchException(url, "Request failed with status code " + status, status, responseException);
        }
        if (isTimeout(error)) {
            return new AssetFetchException(url, TIMEOUT_MESSAGE, error);
        }
        if (error instanceof WebClientException) {
            return new AssetFetchException(url, LoggingUtils.summarize(error), error);
        }
        return new AssetFetchException(url, "Unexpected error: " + LoggingUtils.summarize(error), error);
    }

    static boolean isTimeout(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof TimeoutException
                    || current instanceof io.netty.handler.timeout.TimeoutException) {
                return true;
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return false;
    }

    private static URI parseHttpUri(String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        try {
            URI uri = URI.create(url.trim());
            String scheme = uri.getScheme();
            if (scheme == null || uri.getHost() == null) {
                return null;
            }
            String normalized = scheme.toLowerCase(Locale.ROOT);
            return normalized.equals("http") || normalized.equals("https") ? uri : null;
        } catch (IllegalArgumentException e) {
            log.debug("Locator {} is not a valid URI: {}", url, e.getMessage());
            return null;
        }
    }
}
