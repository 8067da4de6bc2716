package com.passage.proxy.core.proxy;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.passage.proxy.config.PassageProperties;
import com.passage.proxy.core.fetch.HttpClientUpstreamFetcher;
import com.passage.proxy.core.services.LoggingService;
import com.passage.proxy.core.url.ProxyLinkEncoder;
import com.passage.proxy.core.utils.IoUtils;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.wireMockConfig;
import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;

class RewritingProxyServerTest {

    private RewritingProxyServer proxyServer;
    private WireMockServer wireMockServer;
    private LoggingService loggingService;
    private MeterRegistry registry;
    private int proxyPort;
    private String upstream;

    @BeforeEach
    void setUp() {
        wireMockServer = new WireMockServer(wireMockConfig().dynamicPort().gzipDisabled(true));
        wireMockServer.start();
        upstream = "http://localhost:" + wireMockServer.port();

        loggingService = Mockito.mock(LoggingService.class);
        registry = new SimpleMeterRegistry();

        PassageProperties props = new PassageProperties();
        props.getServer().setPort(0);
        props.getServer().setBindAddress("127.0.0.1");

        ProxyOrchestrator orchestrator = new ProxyOrchestrator(props,
                new HttpClientUpstreamFetcher(props.getUpstream()), registry);
        proxyServer = new RewritingProxyServer(props.getServer(), orchestrator, loggingService, registry);
        Thread t = new Thread(proxyServer::start);
        t.setDaemon(true);
        t.start();

        assertThat(proxyServer.awaitBind(10, TimeUnit.SECONDS)).isTrue();
        proxyPort = proxyServer.getLocalPort();
    }

    @AfterEach
    void tearDown() {
        if (proxyServer != null) {
            proxyServer.stop();
        }
        if (wireMockServer != null) {
            wireMockServer.stop();
        }
    }

    /** A response read off the wire. */
    private static final class RawResponse {
        final String statusLine;
        final Map<String, String> headers = new LinkedHashMap<>();
        byte[] body = new byte[0];

        RawResponse(String statusLine) {
            this.statusLine = statusLine;
        }

        String header(String name) {
            return headers.get(name.toLowerCase(Locale.ROOT));
        }

        String bodyText() {
            return new String(body, StandardCharsets.UTF_8);
        }
    }

    private static RawResponse readResponse(InputStream in, boolean head) throws IOException {
        RawResponse response = new RawResponse(IoUtils.readLine(in));
        String line;
        while ((line = IoUtils.readLine(in)) != null && !line.isEmpty()) {
            int colon = line.indexOf(':');
            response.headers.put(line.substring(0, colon).trim().toLowerCase(Locale.ROOT),
                    line.substring(colon + 1).trim());
        }
        if (!head) {
            response.body = in.readNBytes(Integer.parseInt(response.header("Content-Length")));
        }
        return response;
    }

    private RawResponse exchange(String request) throws IOException {
        try (Socket socket = new Socket("127.0.0.1", proxyPort)) {
            socket.setSoTimeout(10000);
            OutputStream out = socket.getOutputStream();
            out.write(request.getBytes(StandardCharsets.UTF_8));
            out.flush();
            return readResponse(socket.getInputStream(), request.startsWith("HEAD"));
        }
    }

    @Test
    void requestWithoutUrl_servesLandingPage() throws IOException {
        RawResponse response = exchange("GET / HTTP/1.1\r\nHost: proxy\r\nConnection: close\r\n\r\n");

        assertThat(response.statusLine).isEqualTo("HTTP/1.1 200 OK");
        assertThat(response.header("Content-Type")).startsWith("text/html");
        assertThat(response.header("Connection")).isEqualTo("close");
        assertThat(response.bodyText()).contains("name=\"url\"");
        Mockito.verify(loggingService).logRequest(anyString(), eq("GET"), eq("/"), eq(200), anyLong());
    }

    @Test
    void proxiedPage_isFetchedAndRewritten() throws IOException {
        wireMockServer.stubFor(get(urlEqualTo("/docs/index.html")).willReturn(aResponse()
                .withHeader("Content-Type", "text/html; charset=UTF-8")
                .withHeader("X-Frame-Options", "DENY")
                .withBody("<html><body><a href=\"guide.html\">Guide</a>"
                        + "<div style=\"background:url(bg.png)\"></div></body></html>")));

        String target = new ProxyLinkEncoder("/go").encode(upstream + "/docs/index.html");
        RawResponse response = exchange("GET " + target + " HTTP/1.1\r\nHost: proxy\r\nConnection: close\r\n\r\n");

        ProxyLinkEncoder encoder = new ProxyLinkEncoder("/go");
        assertThat(response.statusLine).isEqualTo("HTTP/1.1 200 OK");
        assertThat(response.header("X-Frame-Options")).isNull();
        assertThat(response.header("Content-Type")).isEqualTo("text/html; charset=UTF-8");
        assertThat(response.bodyText())
                .contains("href=\"" + encoder.encode(upstream + "/docs/guide.html") + "\"")
                .contains(encoder.encode(upstream + "/docs/bg.png"));
    }

    @Test
    void upstreamRedirect_isFollowedAndLinksUseFinalUrl() throws IOException {
        wireMockServer.stubFor(get(urlEqualTo("/old")).willReturn(aResponse()
                .withStatus(301).withHeader("Location", "/new/")));
        wireMockServer.stubFor(get(urlEqualTo("/new/")).willReturn(aResponse()
                .withHeader("Content-Type", "text/css")
                .withBody("a { background: url('img/x.png') }")));

        String target = new ProxyLinkEncoder("/").encode(upstream + "/old");
        RawResponse response = exchange("GET " + target + " HTTP/1.1\r\nConnection: close\r\n\r\n");

        assertThat(response.statusLine).isEqualTo("HTTP/1.1 200 OK");
        assertThat(response.bodyText())
                .isEqualTo("a { background: url(\"" + new ProxyLinkEncoder("/").encode(upstream + "/new/img/x.png")
                        + "\") }");
    }

    @Test
    void unreachableUpstream_returns502() throws IOException {
        wireMockServer.stop();

        String target = new ProxyLinkEncoder("/").encode(upstream + "/");
        RawResponse response = exchange("GET " + target + " HTTP/1.1\r\nConnection: close\r\n\r\n");

        assertThat(response.statusLine).isEqualTo("HTTP/1.1 502 Bad Gateway");
        assertThat(response.bodyText()).startsWith(ProxyOrchestrator.FETCH_FAILED_PREFIX);
    }

    @Test
    void unsupportedMethod_returns405WithAllow() throws IOException {
        RawResponse response = exchange(
                "POST /?url=a.test HTTP/1.1\r\nContent-Length: 3\r\nConnection: close\r\n\r\nabc");

        assertThat(response.statusLine).isEqualTo("HTTP/1.1 405 Method Not Allowed");
        assertThat(response.header("Allow")).isEqualTo("GET, HEAD");
    }

    @Test
    void malformedRequestLine_returns400AndCloses() throws IOException {
        try (Socket socket = new Socket("127.0.0.1", proxyPort)) {
            socket.setSoTimeout(10000);
            socket.getOutputStream().write("GARBAGE\r\n\r\n".getBytes(StandardCharsets.US_ASCII));
            InputStream in = socket.getInputStream();

            RawResponse response = readResponse(in, false);

            assertThat(response.statusLine).isEqualTo("HTTP/1.1 400 Bad Request");
            assertThat(response.header("Connection")).isEqualTo("close");
            assertThat(in.read()).isEqualTo(-1);
        }
    }

    @Test
    void keepAlive_servesSeveralRequestsOnOneConnection() throws IOException {
        try (Socket socket = new Socket("127.0.0.1", proxyPort)) {
            socket.setSoTimeout(10000);
            OutputStream out = socket.getOutputStream();
            InputStream in = socket.getInputStream();

            out.write("HEAD / HTTP/1.1\r\nHost: proxy\r\n\r\n".getBytes(StandardCharsets.US_ASCII));
            out.flush();
            RawResponse first = readResponse(in, true);

            out.write("GET / HTTP/1.1\r\nHost: proxy\r\n\r\n".getBytes(StandardCharsets.US_ASCII));
            out.flush();
            RawResponse second = readResponse(in, false);

            assertThat(first.header("Connection")).isEqualTo("keep-alive");
            assertThat(Integer.parseInt(first.header("Content-Length"))).isEqualTo(second.body.length);
            assertThat(second.statusLine).isEqualTo("HTTP/1.1 200 OK");
        }
    }

    @Test
    void http10_closesByDefault() throws IOException {
        try (Socket socket = new Socket("127.0.0.1", proxyPort)) {
            socket.setSoTimeout(10000);
            socket.getOutputStream().write("GET / HTTP/1.0\r\n\r\n".getBytes(StandardCharsets.US_ASCII));
            InputStream in = socket.getInputStream();

            RawResponse response = readResponse(in, false);

            assertThat(response.header("Connection")).isEqualTo("close");
            ByteArrayOutputStream rest = new ByteArrayOutputStream();
            in.transferTo(rest);
            assertThat(rest.size()).isZero();
        }
    }

    @Test
    void stop_releasesMetersAndRefusesConnections() {
        assertThat(registry.find("proxy.connections.total").counter()).isNotNull();

        proxyServer.stop();

        assertThat(registry.find("proxy.connections.total").counter()).isNull();
        await().atMost(Duration.ofSeconds(10)).until(() -> {
            try (Socket s = new Socket("127.0.0.1", proxyPort)) {
                return false;
            } catch (IOException e) {
                return true;
            }
        });
    }
}
