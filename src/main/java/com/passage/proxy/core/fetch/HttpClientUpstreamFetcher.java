package com.passage.proxy.core.fetch;

import java.net.ConnectException;
import java.net.URI;
import java.net.UnknownHostException;
import java.net.http.HttpClient;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import javax.net.ssl.SSLException;

import com.passage.proxy.config.UpstreamConfig;
import com.passage.proxy.core.constants.HeaderConstants;
import com.passage.proxy.core.exceptions.UpstreamException;
import com.passage.proxy.core.http.HttpHeader;
import com.passage.proxy.core.utils.SslUtils;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link UpstreamFetcher} backed by the JDK {@link HttpClient}.
 * <p>
 * Redirects are followed manually so the effective URL is known and the
 * {@code Referer} can be set on each hop. Bodies are fully buffered up to
 * {@link UpstreamConfig#getMaxBodyBytes()} and decompressed. The
 * {@code upstream.timeout} budget runs from the first request until the
 * last body byte.
 * </p>
 */
public class HttpClientUpstreamFetcher implements UpstreamFetcher {

    private static final Logger log = LoggerFactory.getLogger(HttpClientUpstreamFetcher.class);

    private static final String ACCEPTED_ENCODINGS = "gzip, deflate";

    private final UpstreamConfig config;
    private final HttpClient httpClient;

    /**
     * Builds the HTTP client from the upstream configuration.
     *
     * @param config Timeouts, redirect limit and TLS policy.
     */
    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public HttpClientUpstreamFetcher(UpstreamConfig config) {
        this.config = config;

        HttpClient.Builder builder = HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NEVER)
                .version(HttpClient.Version.HTTP_1_1);

        if (config.getConnectTimeout() > 0) {
            builder.connectTimeout(Duration.ofMillis(config.getConnectTimeout()));
        }

        if (config.isInsecureSkipVerify()) {
            log.warn("Upstream certificate verification is DISABLED (upstream.insecureSkipVerify=true)");
            SslUtils.disableHostnameVerification();
            builder.sslContext(SslUtils.createTrustAllContext());
        }

        this.httpClient = builder.build();
    }

    @Override
    public FetchResult fetch(FetchRequest request) {
        long deadline = config.getTimeout() > 0
                ? System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(config.getTimeout())
                : 0;
        String currentUrl = request.getTarget().withoutFragment();
        String referer = null;
        int redirects = 0;

        while (true) {
            HttpRequest httpRequest = buildRequest(currentUrl, request, referer);
            HttpResponse<byte[]> response = send(httpRequest, currentUrl, deadline);

            String location = isRedirect(response) && redirects < config.getMaxRedirects()
                    ? response.headers().firstValue(HeaderConstants.LOCATION.getValue()).orElse(null)
                    : null;

            if (location == null) {
                return toResult(response, currentUrl);
            }

            referer = currentUrl;
            currentUrl = resolveRedirect(currentUrl, location.trim());
            redirects++;
            log.debug("Following redirect {} -> {}", referer, currentUrl);
        }
    }

    private HttpRequest buildRequest(String url, FetchRequest request, String referer) {
        HttpRequest.Builder rb;
        try {
            rb = HttpRequest.newBuilder().uri(toUri(url)).GET();
        } catch (IllegalArgumentException e) {
            throw new UpstreamException("Invalid upstream URL " + url + ": " + e.getMessage(), e);
        }

        if (config.getTimeout() > 0) {
            rb.timeout(Duration.ofMillis(config.getTimeout()));
        }

        List<String> forwarded = config.getForwardedHeaders() != null ? config.getForwardedHeaders() : List.of();
        for (String name : forwarded) {
            String value = request.clientHeader(name);
            if (value != null) {
                setHeader(rb, name, value);
            }
        }
        if (request.clientHeader(HeaderConstants.USER_AGENT.getValue()) == null
                || !containsIgnoreCase(forwarded, HeaderConstants.USER_AGENT.getValue())) {
            setHeader(rb, HeaderConstants.USER_AGENT.getValue(), config.getUserAgent());
        }
        setHeader(rb, HeaderConstants.ACCEPT_ENCODING.getValue(), ACCEPTED_ENCODINGS);
        if (referer != null) {
            setHeader(rb, HeaderConstants.REFERER.getValue(), referer);
        }
        return rb.build();
    }

    private void setHeader(HttpRequest.Builder rb, String name, String value) {
        if (value == null) {
            return;
        }
        try {
            rb.setHeader(name, value);
        } catch (IllegalArgumentException e) {
            // Restricted (Host, Connection...) or malformed; the client supplies its own
            log.debug("Not forwarding header {}: {}", name, e.getMessage());
        }
    }

    /**
     * Sends one request and buffers its body. The deadline covers the whole
     * fetch, body download and redirects included, not just the headers.
     *
     * @param deadline {@link System#nanoTime()} value to finish by, or 0 for none.
     */
    private HttpResponse<byte[]> send(HttpRequest request, String url, long deadline) {
        CompletableFuture<HttpResponse<byte[]>> future = httpClient.sendAsync(request,
                info -> new LimitedBodySubscriber(config.getMaxBodyBytes()));
        try {
            if (deadline == 0) {
                return future.get();
            }
            return future.get(Math.max(0, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new UpstreamException("Request to " + url + " timed out", e);
        } catch (ExecutionException e) {
            throw translate(e.getCause(), url);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new UpstreamException("Upstream request interrupted", e);
        }
    }

    private static UpstreamException translate(Throwable failure, String url) {
        for (Throwable t = failure; t != null; t = t.getCause()) {
            if (t instanceof UpstreamException) {
                return (UpstreamException) t;
            }
        }
        Throwable cause = failure;
        while (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause == null) {
            return new UpstreamException("Upstream request to " + url + " failed");
        }
        if (cause instanceof HttpConnectTimeoutException) {
            return new UpstreamException("Connection to " + hostOf(url) + " timed out", cause);
        } else if (cause instanceof HttpTimeoutException) {
            return new UpstreamException("Request to " + url + " timed out", cause);
        } else if (cause instanceof UnknownHostException) {
            return new UpstreamException("Could not resolve host " + hostOf(url), cause);
        } else if (cause instanceof ConnectException) {
            return new UpstreamException("Failed to connect to " + hostOf(url) + ": " + describe(cause), cause);
        } else if (cause instanceof SSLException) {
            return new UpstreamException("TLS handshake with " + hostOf(url) + " failed: " + describe(cause),
                    cause);
        }
        return new UpstreamException(describe(cause), cause);
    }

    private FetchResult toResult(HttpResponse<byte[]> response, String effectiveUrl) {
        String contentEncoding = response.headers().firstValue(HeaderConstants.CONTENT_ENCODING.getValue())
                .orElse(null);
        byte[] body = BodyDecoder.decode(response.body(), contentEncoding, config.getMaxBodyBytes());

        // HttpHeaders.map() is sorted by name; values of one name keep their order
        List<HttpHeader> headers = new ArrayList<>();
        response.headers().map().forEach((name, values) -> values.forEach(v -> headers.add(new HttpHeader(name, v))));

        String contentType = response.headers().firstValue(HeaderConstants.CONTENT_TYPE.getValue()).orElse(null);
        log.debug("Fetched {} -> {} ({} bytes, {})", effectiveUrl, response.statusCode(), body.length, contentType);
        return new FetchResult(response.statusCode(), headers, body, effectiveUrl, contentType);
    }

    /**
     * Checks if the response is a redirect (3xx status code with a Location
     * header).
     */
    private static boolean isRedirect(HttpResponse<?> response) {
        int status = response.statusCode();
        return status >= 300 && status < 400 && status != 304
                && response.headers().firstValue(HeaderConstants.LOCATION.getValue()).isPresent();
    }

    static String resolveRedirect(String currentUrl, String location) {
        try {
            return toUri(currentUrl).resolve(toUri(location)).toString();
        } catch (IllegalArgumentException e) {
            return location;
        }
    }

    /**
     * Builds a {@link URI}, percent-encoding characters that are illegal in URIs
     * but common in hand-written links (spaces, non-ASCII, {@code |}).
     */
    static URI toUri(String url) {
        try {
            return URI.create(url);
        } catch (IllegalArgumentException e) {
            return URI.create(escapeIllegal(url));
        }
    }

    private static String escapeIllegal(String url) {
        StringBuilder sb = new StringBuilder(url.length() + 16);
        for (byte b : url.getBytes(StandardCharsets.UTF_8)) {
            int c = b & 0xFF;
            if (c > 0x20 && c < 0x7F && "\"<>\\^`{|}".indexOf(c) == -1) {
                sb.append((char) c);
            } else {
                sb.append('%').append(String.format("%02X", c));
            }
        }
        return sb.toString();
    }

    private static boolean containsIgnoreCase(List<String> names, String name) {
        return names.stream().anyMatch(name::equalsIgnoreCase);
    }

    private static String hostOf(String url) {
        try {
            String host = toUri(url).getHost();
            return host != null ? host : url;
        } catch (IllegalArgumentException e) {
            return url;
        }
    }

    private static String describe(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
