package com.delta.jobharvest.crawl.http;

import com.delta.jobharvest.config.HarvestProperties;
import com.delta.jobharvest.crawl.identity.CookieJar;
import com.delta.jobharvest.crawl.model.FetchRequest;
import com.delta.jobharvest.crawl.model.FetchResult;
import com.delta.jobharvest.crawl.util.UrlNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ProxySelector;
import java.net.URI;
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

/**
 * {@link PageTransport} on top of {@link HttpClient}. Requests to the same host are spaced by
 * the configured per-host delay. Blocking statuses come back as data; how long a blocked task
 * waits before its next attempt is decided by the crawl's backoff controller, not here.
 */
@Service
public class HttpPageTransport implements PageTransport {
    private static final Logger log = LoggerFactory.getLogger(HttpPageTransport.class);
    // HttpClient rejects these as restricted headers
    private static final Set<String> RESTRICTED_HEADERS = Set.of("connection", "content-length", "host", "upgrade", "expect");

    private final HarvestProperties properties;
    private final HttpClient client;
    private final Map<String, Object> hostLocks = new ConcurrentHashMap<>();
    private final Map<String, Instant> hostNextAllowed = new ConcurrentHashMap<>();

    public HttpPageTransport(HarvestProperties properties, @Qualifier("httpExecutor") ExecutorService httpExecutor) {
        this.properties = properties;
        HttpClient.Builder builder = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1)
            .executor(httpExecutor);
        ProxySelector proxy = proxySelector(properties.getTransport().getProxyUrl());
        if (proxy != null) {
            builder.proxy(proxy);
        }
        this.client = builder.build();
    }

    @Override
    public FetchResult fetch(FetchRequest fetchRequest) {
        Instant startedAt = Instant.now();
        URI uri = UrlNormalizer.safeUri(fetchRequest.url());
        if (uri == null || uri.getHost() == null) {
            return FetchResult.error(fetchRequest.url(), "invalid_url", "URL missing host or malformed", elapsed(startedAt));
        }
        String host = uri.getHost().toLowerCase(Locale.ROOT);
        try {
            awaitHostSlot(host);
            HttpResponse<byte[]> response = client.send(buildRequest(uri, fetchRequest), HttpResponse.BodyHandlers.ofByteArray());
            byte[] bytes = response.body();
            return new FetchResult(
                fetchRequest.url(),
                response.uri().toString(),
                response.statusCode(),
                bytes == null ? "" : new String(bytes, StandardCharsets.UTF_8),
                response.headers().map(),
                elapsed(startedAt),
                null,
                null
            );
        } catch (HttpTimeoutException e) {
            return FetchResult.error(fetchRequest.url(), "timeout", e.getMessage(), elapsed(startedAt));
        } catch (IOException e) {
            return FetchResult.error(fetchRequest.url(), "io_error", e.getMessage(), elapsed(startedAt));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return FetchResult.error(fetchRequest.url(), "interrupted", e.getMessage(), elapsed(startedAt));
        } catch (IllegalArgumentException e) {
            return FetchResult.error(fetchRequest.url(), "invalid_url", e.getMessage(), elapsed(startedAt));
        } catch (Exception e) {
            log.debug("Unexpected transport failure for {}", fetchRequest.url(), e);
            return FetchResult.error(fetchRequest.url(), "http_error", e.getMessage(), elapsed(startedAt));
        }
    }

    private HttpRequest buildRequest(URI uri, FetchRequest fetchRequest) {
        HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
            .timeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
            .header("Accept-Language", properties.getTransport().getAcceptLanguage());
        for (Map.Entry<String, String> header : fetchRequest.headers().entrySet()) {
            String name = header.getKey();
            if (name == null || header.getValue() == null || RESTRICTED_HEADERS.contains(name.toLowerCase(Locale.ROOT))) {
                continue;
            }
            if ("accept-language".equalsIgnoreCase(name)) {
                builder.setHeader("Accept-Language", header.getValue());
            } else {
                builder.header(name, header.getValue());
            }
        }
        if (fetchRequest.referer() != null && !fetchRequest.referer().isBlank()) {
            builder.header("Referer", fetchRequest.referer());
        }
        String cookieHeader = CookieJar.toHeaderValue(fetchRequest.cookies());
        if (cookieHeader != null) {
            builder.header("Cookie", cookieHeader);
        }
        return builder.GET().build();
    }

    /**
     * Reserves the host's next request slot under the host lock and sleeps outside it, so a
     * waiting worker never blocks others from taking later slots.
     */
    private void awaitHostSlot(String host) throws InterruptedException {
        long delayMs = properties.getTransport().getPerHostDelayMs();
        if (delayMs == 0) {
            return;
        }
        Instant slot;
        Object lock = hostLocks.computeIfAbsent(host, ignored -> new Object());
        synchronized (lock) {
            Instant now = Instant.now();
            Instant allowedAt = hostNextAllowed.getOrDefault(host, now);
            slot = allowedAt.isAfter(now) ? allowedAt : now;
            hostNextAllowed.put(host, slot.plusMillis(delayMs));
        }
        long sleepMs = Duration.between(Instant.now(), slot).toMillis();
        if (sleepMs > 0) {
            Thread.sleep(sleepMs);
        }
    }

    private static ProxySelector proxySelector(String proxyUrl) {
        if (proxyUrl == null || proxyUrl.isBlank()) {
            return null;
        }
        URI uri = UrlNormalizer.safeUri(proxyUrl.trim());
        if (uri == null || uri.getHost() == null) {
            log.warn("Ignoring malformed proxy url {}", proxyUrl);
            return null;
        }
        int port = uri.getPort() > 0 ? uri.getPort() : ("https".equalsIgnoreCase(uri.getScheme()) ? 443 : 80);
        return ProxySelector.of(new InetSocketAddress(uri.getHost(), port));
    }

    private static Duration elapsed(Instant startedAt) {
        return Duration.between(startedAt, Instant.now());
    }
}
