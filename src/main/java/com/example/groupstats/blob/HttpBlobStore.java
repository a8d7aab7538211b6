package com.example.groupstats.blob;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Optional;

/**
 * Reads blobs over HTTP using byte-range requests.
 *
 * <p>A blob at {@code baseUrl/key} is downloaded in consecutive ranges of
 * {@code rangeSize} bytes ({@code Range: bytes=start-end}); the
 * {@code Content-Range} of each response tells when the last range has arrived.
 * A server that ignores the Range header and answers 200 with the whole body is
 * handled as a single range.
 *
 * <p>Includes retry logic with exponential backoff for resilience.
 */
public class HttpBlobStore implements BlobStore {

    private static final Logger log = LoggerFactory.getLogger(HttpBlobStore.class);

    public static final long DEFAULT_RANGE_SIZE = 10L * 1024 * 1024;
    static final long DEFAULT_RETRY_AFTER_SECONDS = 1;

    private final HttpClient httpClient;
    private final String baseUrl;
    private final long rangeSize;
    private final RetryConfig retryConfig;

    /**
     * Creates a store with 10 MiB ranges and default retries.
     *
     * @param baseUrl URL under which blobs are addressed by key
     */
    public HttpBlobStore(String baseUrl) {
        this(baseUrl, DEFAULT_RANGE_SIZE, RetryConfig.defaults());
    }

    /**
     * Creates a store with custom range size and retry configuration.
     */
    public HttpBlobStore(String baseUrl, long rangeSize, RetryConfig retryConfig) {
        this(HttpClient.newBuilder()
                        .connectTimeout(Duration.ofSeconds(10))
                        .build(),
                baseUrl, rangeSize, retryConfig);
    }

    /**
     * Creates a store with a pre-configured HttpClient.
     */
    public HttpBlobStore(HttpClient httpClient, String baseUrl, long rangeSize, RetryConfig retryConfig) {
        if (rangeSize <= 0) {
            throw new IllegalArgumentException("rangeSize must be positive: " + rangeSize);
        }
        this.httpClient = httpClient;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.rangeSize = rangeSize;
        this.retryConfig = retryConfig;
    }

    @Override
    public InputStream open(String key) {
        URI uri = URI.create(baseUrl + "/" + encodePath(key));
        return new RangedBlobInputStream((start, end) -> fetchRange(uri, start, end), rangeSize);
    }

    /**
     * Fetches one byte range of a blob, retrying transient failures.
     *
     * @param uri the blob URI
     * @param start first byte offset
     * @param end last byte offset, inclusive
     * @return the fetched range
     */
    public BlobRange fetchRange(URI uri, long start, long end) throws IOException {
        return executeWithRetry(() -> doFetch(uri, start, end));
    }

    private BlobRange doFetch(URI uri, long start, long end) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(uri)
                .header("Range", "bytes=" + start + "-" + end)
                .timeout(Duration.ofSeconds(60))
                .GET()
                .build();

        HttpResponse<byte[]> response = httpClient.send(request, HttpResponse.BodyHandlers.ofByteArray());
        int statusCode = response.statusCode();

        if (statusCode == 429) {
            throw new RateLimitedException(retryAfterSeconds(response));
        }

        if (statusCode == 416 && start == 0) {
            // Range not satisfiable on the first request means the blob is empty
            return BlobRange.empty();
        }

        if (statusCode >= 400) {
            throw new HttpException(statusCode, "HTTP error " + statusCode + " for " + uri);
        }

        byte[] body = response.body();
        if (statusCode == 206) {
            Optional<String> contentRange = response.headers().firstValue("Content-Range");
            if (contentRange.isEmpty()) {
                throw new IOException("Partial response without Content-Range from " + uri);
            }
            try {
                return BlobRange.parse(contentRange.get(), body);
            } catch (IllegalArgumentException e) {
                throw new IOException(e.getMessage(), e);
            }
        }

        if (start != 0) {
            throw new IOException("Server ignored Range header for offset " + start + " of " + uri);
        }
        return new BlobRange(body, 0, body.length - 1L, body.length);
    }

    /**
     * Reads {@code Retry-After} as delay-seconds. HTTP-date and malformed values fall back
     * to {@value #DEFAULT_RETRY_AFTER_SECONDS} second.
     */
    static long retryAfterSeconds(HttpResponse<?> response) {
        Optional<String> retryAfter = response.headers().firstValue("Retry-After");
        if (retryAfter.isEmpty()) {
            return DEFAULT_RETRY_AFTER_SECONDS;
        }
        try {
            return Math.max(0, Long.parseLong(retryAfter.get().trim()));
        } catch (NumberFormatException e) {
            log.debug("Ignoring non-numeric Retry-After '{}'", retryAfter.get());
            return DEFAULT_RETRY_AFTER_SECONDS;
        }
    }

    private <R> R executeWithRetry(RetryableSupplier<R> action) throws IOException {
        int attempts = 0;
        IOException lastException = null;

        while (attempts < retryConfig.maxRetries()) {
            try {
                return action.get();
            } catch (RateLimitedException e) {
                lastException = e;
                attempts++;
                sleep(e.getRetryAfterSeconds() * 1000);
            } catch (HttpException e) {
                if (e.getStatusCode() < 500) {
                    throw e;
                }
                lastException = e;
                attempts++;
                backoff(attempts, e);
            } catch (IOException e) {
                lastException = e;
                attempts++;
                backoff(attempts, e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new InterruptedIOException("Interrupted while reading blob range");
            }
        }

        throw new IOException("Failed after " + attempts + " attempts", lastException);
    }

    private void backoff(int attempts, IOException cause) throws InterruptedIOException {
        if (attempts < retryConfig.maxRetries()) {
            long backoffMs = retryConfig.backoffMillis() * (1L << (attempts - 1));
            backoffMs = Math.min(backoffMs, retryConfig.maxBackoffMillis());
            log.warn("Blob range read failed (attempt {}), retrying in {} ms: {}", attempts, backoffMs, cause.toString());
            sleep(backoffMs);
        }
    }

    private void sleep(long millis) throws InterruptedIOException {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted during backoff");
        }
    }

    private static String encodePath(String key) {
        String[] segments = key.split("/", -1);
        StringBuilder path = new StringBuilder();
        for (int i = 0; i < segments.length; i++) {
            if (i > 0) {
                path.append('/');
            }
            path.append(URLEncoder.encode(segments[i], StandardCharsets.UTF_8).replace("+", "%20"));
        }
        return path.toString();
    }

    @FunctionalInterface
    private interface RetryableSupplier<T> {
        T get() throws IOException, InterruptedException;
    }

    /**
     * Configuration for retry behavior.
     */
    public record RetryConfig(
            int maxRetries,
            long backoffMillis,
            long maxBackoffMillis
    ) {
        public static RetryConfig defaults() {
            return new RetryConfig(3, 100, 5000);
        }

        public static RetryConfig noRetry() {
            return new RetryConfig(1, 0, 0);
        }
    }

    /**
     * Exception thrown when an HTTP request fails.
     */
    public static class HttpException extends IOException {
        private final int statusCode;

        public HttpException(int statusCode, String message) {
            super(message);
            this.statusCode = statusCode;
        }

        public int getStatusCode() {
            return statusCode;
        }
    }

    /**
     * Exception thrown when rate limited (HTTP 429).
     */
    public static class RateLimitedException extends IOException {
        private final long retryAfterSeconds;

        public RateLimitedException(long retryAfterSeconds) {
            super("Rate limited. Retry after " + retryAfterSeconds + " seconds");
            this.retryAfterSeconds = retryAfterSeconds;
        }

        public long getRetryAfterSeconds() {
            return retryAfterSeconds;
        }
    }
}
