package com.passage.proxy.core.proxy;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.passage.proxy.config.ServerConfig;
import com.passage.proxy.core.constants.HeaderConstants;
import com.passage.proxy.core.exceptions.ConfigException;
import com.passage.proxy.core.exceptions.ProtocolException;
import com.passage.proxy.core.exceptions.ProxyException;
import com.passage.proxy.core.http.ContentTypes;
import com.passage.proxy.core.http.HttpHeader;
import com.passage.proxy.core.services.LoggingService;
import com.passage.proxy.core.utils.IoUtils;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

/**
 * HTTP/1.1 front end of the rewriting proxy.
 * <p>
 * Requests carrying a {@code url} parameter go to the {@link ProxyOrchestrator};
 * everything else gets the landing page. Responses are always fully buffered
 * and framed with {@code Content-Length}, so connections can be kept alive.
 * </p>
 */
public class RewritingProxyServer extends AbstractProxyServer {

    private static final int MAX_HTTP_HEADERS = 100;

    private static final String ALLOWED_METHODS = "GET, HEAD";
    private static final String LANDING_PAGE = "landing.html";

    /** Standard HTTP reason phrases. */
    private static final Map<Integer, String> REASON_PHRASES = Map.ofEntries(
            Map.entry(200, "OK"), Map.entry(201, "Created"), Map.entry(202, "Accepted"),
            Map.entry(204, "No Content"), Map.entry(206, "Partial Content"),
            Map.entry(301, "Moved Permanently"), Map.entry(302, "Found"), Map.entry(303, "See Other"),
            Map.entry(304, "Not Modified"), Map.entry(307, "Temporary Redirect"),
            Map.entry(308, "Permanent Redirect"), Map.entry(400, "Bad Request"),
            Map.entry(401, "Unauthorized"), Map.entry(403, "Forbidden"), Map.entry(404, "Not Found"),
            Map.entry(405, "Method Not Allowed"), Map.entry(408, "Request Timeout"),
            Map.entry(410, "Gone"), Map.entry(429, "Too Many Requests"),
            Map.entry(500, "Internal Server Error"), Map.entry(502, "Bad Gateway"),
            Map.entry(503, "Service Unavailable"), Map.entry(504, "Gateway Timeout"));

    private final ProxyOrchestrator orchestrator;
    private final byte[] landingPage;
    private final Counter requestsTotal;

    /**
     * @param config         Listener configuration.
     * @param orchestrator   Pipeline for proxied requests.
     * @param loggingService Access log.
     * @param registry       Micrometer registry.
     */
    public RewritingProxyServer(ServerConfig config, ProxyOrchestrator orchestrator, LoggingService loggingService,
            MeterRegistry registry) {
        super(config, loggingService, registry);
        this.orchestrator = orchestrator;
        this.landingPage = loadLandingPage();
        this.requestsTotal = Counter.builder("proxy.http.requests.total")
                .description("Total number of HTTP requests")
                .register(registry);
    }

    private static byte[] loadLandingPage() {
        try (InputStream is = RewritingProxyServer.class.getClassLoader().getResourceAsStream(LANDING_PAGE)) {
            if (is == null) {
                throw new ConfigException("Classpath resource " + LANDING_PAGE + " is missing");
            }
            return is.readAllBytes();
        } catch (IOException e) {
            throw new ConfigException("Failed to read " + LANDING_PAGE, e);
        }
    }

    @Override
    protected String getProxyName() {
        return "HTTP";
    }

    /**
     * Serves requests on one connection until the client closes it, asks for
     * {@code Connection: close}, or keep-alive is disabled.
     */
    @Override
    protected void handleClient(Socket client) {
        String remoteAddr = client.getInetAddress().getHostAddress();
        try (client) {
            InputStream in = new BufferedInputStream(client.getInputStream());
            OutputStream out = new BufferedOutputStream(client.getOutputStream());

            while (!client.isClosed() && processNextRequest(in, out, remoteAddr)) {
                // Loop continues as long as the connection is kept alive
            }
        } catch (ProtocolException e) {
            log.warn("HTTP protocol error from {}: {}", remoteAddr, e.getMessage());
        } catch (ProxyException e) {
            log.error("HTTP proxy error for {}: {}", remoteAddr, e.getMessage());
        } catch (IOException e) {
            log.debug("Connection from {} ended: {}", remoteAddr, e.getMessage());
        }
    }

    private boolean processNextRequest(InputStream in, OutputStream out, String remoteAddr) throws IOException {
        String requestLine = readRequestLine(in, remoteAddr);
        if (requestLine == null) {
            return false;
        }

        requestsTotal.increment();

        String[] parts = requestLine.split(" ");
        if (parts.length != 3 || !parts[2].startsWith("HTTP/")) {
            log.debug("Malformed request line from {}: {}", remoteAddr, requestLine);
            send(out, ProxyResponse.text(400, "Malformed request line."), false, false);
            loggingService.logRequest(remoteAddr, "-", requestLine, 400, 0);
            return false;
        }
        String method = parts[0];
        String target = parts[1];
        String version = parts[2];

        List<HttpHeader> headers;
        try {
            headers = readHeaders(in);
        } catch (ProtocolException e) {
            log.warn("Rejecting request from {}: {}", remoteAddr, e.getMessage());
            send(out, ProxyResponse.text(400, e.getMessage()), false, false);
            loggingService.logRequest(remoteAddr, method, target, 400, 0);
            return false;
        }

        ProxyRequest request = new ProxyRequest(method, target, headers, remoteAddr);
        boolean keepAlive = isKeepAlive(request, version);

        if (request.header(HeaderConstants.TRANSFER_ENCODING.getValue()) != null) {
            // Chunked request bodies are never read, so the connection cannot be reused
            keepAlive = false;
        } else {
            IoUtils.skipBody(in, parseContentLength(request));
        }

        ProxyResponse response = dispatch(request);
        send(out, response, keepAlive, request.isHead());
        loggingService.logRequest(remoteAddr, method, target, response.getStatus(),
                request.isHead() ? 0 : response.getBody().length);
        return keepAlive;
    }

    private ProxyResponse dispatch(ProxyRequest request) {
        String method = request.getMethod();
        if (!"GET".equals(method) && !"HEAD".equals(method)) {
            List<HttpHeader> headers = new ArrayList<>(ProxyResponse.text(405, "").getHeaders());
            headers.add(new HttpHeader(HeaderConstants.ALLOW.getValue(), ALLOWED_METHODS));
            return new ProxyResponse(405, headers,
                    ("Method " + method + " is not supported.").getBytes(StandardCharsets.UTF_8));
        }

        if (request.getTargetUrl() == null) {
            return new ProxyResponse(200,
                    List.of(new HttpHeader(HeaderConstants.CONTENT_TYPE.getValue(),
                            ContentTypes.TEXT_HTML + "; charset=UTF-8")),
                    landingPage);
        }

        return orchestrator.handle(request);
    }

    private boolean isKeepAlive(ProxyRequest request, String version) {
        if (!config.isKeepAlive()) {
            return false;
        }
        String connection = request.header(HeaderConstants.CONNECTION.getValue());
        if ("HTTP/1.0".equals(version)) {
            return "keep-alive".equalsIgnoreCase(connection);
        }
        return !"close".equalsIgnoreCase(connection);
    }

    private void send(OutputStream out, ProxyResponse response, boolean keepAlive, boolean head)
            throws IOException {
        int status = response.getStatus();
        byte[] body = response.getBody();

        StringBuilder sb = new StringBuilder(256);
        sb.append("HTTP/1.1 ").append(status).append(' ').append(REASON_PHRASES.getOrDefault(status, ""))
                .append("\r\n");
        for (HttpHeader header : response.getHeaders()) {
            sb.append(header.getName()).append(": ").append(sanitize(header.getValue())).append("\r\n");
        }
        sb.append(HeaderConstants.CONTENT_LENGTH.getValue()).append(": ").append(body.length).append("\r\n");
        sb.append(HeaderConstants.CONNECTION.getValue()).append(": ").append(keepAlive ? "keep-alive" : "close")
                .append("\r\n\r\n");

        out.write(sb.toString().getBytes(StandardCharsets.ISO_8859_1));
        if (!head) {
            out.write(body);
        }
        out.flush();
    }

    private static String sanitize(String value) {
        return value.indexOf('\r') == -1 && value.indexOf('\n') == -1 ? value : value.replaceAll("[\r\n]+", " ");
    }

    private String readRequestLine(InputStream in, String remoteAddr) throws IOException {
        String line = IoUtils.readLine(in);
        // Tolerate a stray CRLF between pipelined requests
        while (line != null && line.isEmpty()) {
            line = IoUtils.readLine(in);
        }
        if (line == null) {
            log.debug("Connection from {} closed before a request line", remoteAddr);
        }
        return line;
    }

    private List<HttpHeader> readHeaders(InputStream in) throws IOException {
        List<HttpHeader> headers = new ArrayList<>();
        String line;
        int headerCount = 0;
        while ((line = IoUtils.readLine(in)) != null && !line.isEmpty()) {
            if (++headerCount > MAX_HTTP_HEADERS) {
                throw new ProtocolException("Too many HTTP headers (exceeds limit of " + MAX_HTTP_HEADERS + ")");
            }
            int idx = line.indexOf(':');
            if (idx > 0) {
                headers.add(new HttpHeader(line.substring(0, idx).trim(), line.substring(idx + 1).trim()));
            }
        }
        return headers;
    }

    private long parseContentLength(ProxyRequest request) {
        String clStr = request.header(HeaderConstants.CONTENT_LENGTH.getValue());
        if (clStr != null) {
            try {
                return Long.parseLong(clStr.trim());
            } catch (NumberFormatException e) {
                throw new ProtocolException("Invalid Content-Length: " + clStr);
            }
        }
        return 0;
    }

    @Override
    public void stop() {
        super.stop();
        orchestrator.shutdown();
    }
}
