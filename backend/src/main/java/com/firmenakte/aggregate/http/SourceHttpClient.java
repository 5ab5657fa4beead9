package com.firmenakte.aggregate.http;

import com.firmenakte.config.AggregatorProperties;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Semaphore;

/**
 * Single-attempt HTTP access for source adapters. Retries belong to the pipeline, so this client only
 * paces requests per host and reports failures as error codes instead of throwing.
 */
@Service
public class SourceHttpClient {
    public static final String ERROR_INVALID_URL = "invalid_url";
    public static final String ERROR_TIMEOUT = "timeout";
    public static final String ERROR_IO = "io_error";
    public static final String ERROR_INTERRUPTED = "interrupted";
    public static final String ERROR_HTTP = "http_error";

    private static final Duration BACKOFF_DURATION = Duration.ofSeconds(30);

    private final AggregatorProperties properties;
    private final HttpClient client;
    private final Semaphore globalLimiter;
    private final Map<String, Object> hostLocks = new ConcurrentHashMap<>();
    private final Map<String, Instant> hostNextAllowed = new ConcurrentHashMap<>();

    public SourceHttpClient(
        AggregatorProperties properties,
        @Qualifier("httpExecutor") ExecutorService httpExecutor
    ) {
        this.properties = properties;
        this.client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1)
            .executor(httpExecutor)
            .build();
        this.globalLimiter = new Semaphore(properties.getGlobalConcurrency());
    }

    public HttpFetchResult get(String url, String acceptHeader) {
        return get(url, acceptHeader, Map.of());
    }

    public HttpFetchResult get(String url, String acceptHeader, Map<String, String> extraHeaders) {
        Instant startedAt = Instant.now();
        URI uri = normalizeUri(url);
        if (uri == null || uri.getHost() == null) {
            return errorResult(url, startedAt, ERROR_INVALID_URL, "URL missing host or malformed");
        }

        String host = uri.getHost().toLowerCase(Locale.ROOT);
        boolean acquired = false;
        try {
            globalLimiter.acquire();
            acquired = true;
            enforcePerHostDelay(host);

            String safeAccept = (acceptHeader == null || acceptHeader.isBlank()) ? "*/*" : acceptHeader;
            HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
                .timeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
                .header("User-Agent", properties.getUserAgent())
                .header("Accept", safeAccept)
                .header("Accept-Language", "de-DE,de;q=0.9,en;q=0.7");
            if (extraHeaders != null) {
                extraHeaders.forEach((name, value) -> {
                    if (name != null && value != null && !value.isBlank()) {
                        builder.header(name, value);
                    }
                });
            }

            HttpResponse<byte[]> response = client.send(builder.GET().build(), HttpResponse.BodyHandlers.ofByteArray());
            if (response.statusCode() == 403 || response.statusCode() == 429) {
                extendBackoff(host, BACKOFF_DURATION);
            }
            return new HttpFetchResult(
                url,
                response.uri(),
                response.statusCode(),
                response.body(),
                response.headers().firstValue("Content-Type").orElse(null),
                Instant.now(),
                Duration.between(startedAt, Instant.now()),
                null,
                null
            );
        } catch (HttpTimeoutException e) {
            return errorResult(url, startedAt, ERROR_TIMEOUT, e.getMessage());
        } catch (IOException e) {
            return errorResult(url, startedAt, ERROR_IO, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return errorResult(url, startedAt, ERROR_INTERRUPTED, e.getMessage());
        } catch (Exception e) {
            return errorResult(url, startedAt, ERROR_HTTP, e.getMessage());
        } finally {
            if (acquired) {
                globalLimiter.release();
            }
        }
    }

    public String resolve(String baseUrl, String href) {
        if (href == null || href.isBlank()) {
            return null;
        }
        URI base = normalizeUri(baseUrl);
        try {
            return base == null ? href : base.resolve(href.trim()).toString();
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    private void enforcePerHostDelay(String host) throws InterruptedException {
        Object lock = hostLocks.computeIfAbsent(host, ignored -> new Object());
        synchronized (lock) {
            Instant now = Instant.now();
            Instant allowedAt = hostNextAllowed.getOrDefault(host, now);
            if (allowedAt.isAfter(now)) {
                long sleepMs = Duration.between(now, allowedAt).toMillis();
                if (sleepMs > 0) {
                    Thread.sleep(sleepMs);
                }
            }
            hostNextAllowed.put(host, Instant.now().plusMillis(properties.getPerHostDelayMs()));
        }
    }

    private void extendBackoff(String host, Duration duration) {
        Object lock = hostLocks.computeIfAbsent(host, ignored -> new Object());
        synchronized (lock) {
            Instant candidate = Instant.now().plus(duration);
            Instant current = hostNextAllowed.getOrDefault(host, Instant.now());
            if (candidate.isAfter(current)) {
                hostNextAllowed.put(host, candidate);
            }
        }
    }

    private HttpFetchResult errorResult(String url, Instant startedAt, String code, String message) {
        return new HttpFetchResult(
            url,
            null,
            0,
            null,
            null,
            Instant.now(),
            Duration.between(startedAt, Instant.now()),
            code,
            message
        );
    }

    private URI normalizeUri(String input) {
        if (input == null || input.isBlank()) {
            return null;
        }
        String value = input.trim();
        if (!value.startsWith("http://") && !value.startsWith("https://")) {
            value = "https://" + value;
        }
        try {
            return new URI(value);
        } catch (URISyntaxException e) {
            return null;
        }
    }
}
