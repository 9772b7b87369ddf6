package com.okazje.scanner.scan.http;

import com.okazje.scanner.config.ScannerProperties;
import com.okazje.scanner.scan.model.HttpFetchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.CookieManager;
import java.net.CookiePolicy;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Browser-like HTTP access for marketplace pages and internal endpoints.
 * <p>
 * Requests to one host are spaced by {@code scanner.http.per-host-delay-ms}; transient failures (408, 429,
 * 5xx, timeouts and I/O errors) are retried with jittered exponential backoff. Cookies are kept per process
 * so a session obtained from a site root is replayed on later calls. Failures are reported through
 * {@link HttpFetchResult#errorCode()}, never thrown.
 */
@Service
public class PoliteHttpClient {
    private static final Logger log = LoggerFactory.getLogger(PoliteHttpClient.class);

    public static final String ACCEPT_HTML = "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8";
    public static final String ACCEPT_JSON = "application/json";

    private static final String FORM = "application/x-www-form-urlencoded";
    private static final Set<Integer> RETRYABLE_STATUSES = Set.of(408, 429);
    private static final Set<String> FINAL_ERRORS = Set.of("invalid_url", "interrupted");

    private final ScannerProperties.Http settings;
    private final CookieManager cookies = new CookieManager(null, CookiePolicy.ACCEPT_ALL);
    private final HttpClient client;
    private final Map<String, HostSlot> slots = new ConcurrentHashMap<>();

    public PoliteHttpClient(
        ScannerProperties properties,
        @Qualifier("httpExecutor") ExecutorService httpExecutor
    ) {
        this.settings = properties.getHttp();
        this.client = HttpClient.newBuilder()
            .version(HttpClient.Version.HTTP_1_1)
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(settings.getRequestTimeoutSeconds()))
            .cookieHandler(cookies)
            .executor(httpExecutor)
            .build();
    }

    public HttpFetchResult getHtml(String url) {
        return get(url, ACCEPT_HTML);
    }

    public HttpFetchResult getJson(String url) {
        return get(url, ACCEPT_JSON);
    }

    public HttpFetchResult get(String url, String accept) {
        return execute(new Outgoing(url, "GET", accept, null, null));
    }

    public HttpFetchResult postForm(String url, String form, String accept) {
        return execute(new Outgoing(url, "POST", accept, form, FORM));
    }

    private HttpFetchResult execute(Outgoing outgoing) {
        URI uri = toUri(outgoing.url());
        if (uri == null || uri.getHost() == null) {
            return HttpFetchResult.error(outgoing.url(), Instant.now(), "invalid_url", "URL missing host or malformed");
        }
        int attempts = 1 + Math.max(0, settings.getRequestMaxRetries());
        HttpFetchResult result = attempt(outgoing, uri);
        for (int retry = 1; retry < attempts && isTransient(result); retry++) {
            log.debug("{} {} -> {}, retry {}/{}", outgoing.method(), outgoing.url(), result.describeFailure(),
                retry, attempts - 1);
            if (!sleep(backoffMillis(retry))) {
                break;
            }
            result = attempt(outgoing, uri);
        }
        if (!result.isSuccessful()) {
            log.debug("{} {} gave up: {}", outgoing.method(), outgoing.url(), result.describeFailure());
        }
        return result;
    }

    private HttpFetchResult attempt(Outgoing outgoing, URI uri) {
        Instant startedAt = Instant.now();
        try {
            slotFor(uri.getHost()).acquire(settings.getPerHostDelayMs());
            HttpResponse<byte[]> response = client.send(outgoing.toRequest(uri, settings),
                HttpResponse.BodyHandlers.ofByteArray());
            byte[] bytes = response.body();
            return HttpFetchResult.response(
                outgoing.url(),
                response.uri(),
                response.statusCode(),
                bytes == null ? null : new String(bytes, StandardCharsets.UTF_8),
                response.headers().firstValue("Content-Type").orElse(null),
                startedAt
            );
        } catch (HttpTimeoutException e) {
            return HttpFetchResult.error(outgoing.url(), startedAt, "timeout", e.getMessage());
        } catch (IOException e) {
            return HttpFetchResult.error(outgoing.url(), startedAt, "io_error", e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return HttpFetchResult.error(outgoing.url(), startedAt, "interrupted", e.getMessage());
        } catch (IllegalArgumentException e) {
            return HttpFetchResult.error(outgoing.url(), startedAt, "http_error", e.getMessage());
        }
    }

    private static boolean isTransient(HttpFetchResult result) {
        if (result.errorCode() != null) {
            return !FINAL_ERRORS.contains(result.errorCode());
        }
        return RETRYABLE_STATUSES.contains(result.statusCode()) || result.statusCode() >= 500;
    }

    private long backoffMillis(int retry) {
        long base = settings.getRequestRetryBaseDelayMs();
        if (base <= 0) {
            return 0;
        }
        long exponential = base << Math.min(retry - 1, 16);
        long capped = settings.getRequestRetryMaxDelayMs() > 0
            ? Math.min(exponential, settings.getRequestRetryMaxDelayMs())
            : exponential;
        long half = Math.max(1L, capped / 2);
        return half + ThreadLocalRandom.current().nextLong(half);
    }

    private static boolean sleep(long millis) {
        if (millis <= 0) {
            return true;
        }
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private HostSlot slotFor(String host) {
        return slots.computeIfAbsent(host.toLowerCase(Locale.ROOT), ignored -> new HostSlot());
    }

    private static URI toUri(String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        String candidate = url.trim();
        if (!candidate.startsWith("http://") && !candidate.startsWith("https://")) {
            candidate = "https://" + candidate;
        }
        try {
            return new URI(candidate);
        } catch (URISyntaxException e) {
            return null;
        }
    }

    private record Outgoing(String url, String method, String accept, String body, String contentType) {
        HttpRequest toRequest(URI uri, ScannerProperties.Http settings) {
            HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
                .timeout(Duration.ofSeconds(settings.getRequestTimeoutSeconds()))
                .header("User-Agent", settings.getUserAgent())
                .header("Accept", accept == null || accept.isBlank() ? "*/*" : accept)
                .header("Accept-Language", settings.getAcceptLanguage());
            if (!"POST".equals(method)) {
                return builder.GET().build();
            }
            return builder
                .header("Content-Type", contentType)
                .POST(HttpRequest.BodyPublishers.ofString(body == null ? "" : body, StandardCharsets.UTF_8))
                .build();
        }
    }

    /**
     * Earliest moment the next request to one host may start.
     */
    private static final class HostSlot {
        private long nextAllowedNanos;

        synchronized void acquire(long spacingMs) throws InterruptedException {
            long waitNanos = nextAllowedNanos - System.nanoTime();
            if (waitNanos > 0) {
                Thread.sleep(waitNanos / 1_000_000L, (int) (waitNanos % 1_000_000L));
            }
            nextAllowedNanos = System.nanoTime() + spacingMs * 1_000_000L;
        }
    }
}
