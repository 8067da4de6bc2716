package com.passage.proxy.core.rewrite;

import java.util.List;

import com.passage.proxy.core.http.HttpHeader;
import com.passage.proxy.core.url.ProxyLinkEncoder;
import com.passage.proxy.core.url.UrlResolver;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

class HeaderPipelineTest {

    private static final String EFFECTIVE_URL = "http://site.test/dir/page.html";

    private final HeaderPipeline pipeline = new HeaderPipeline(new UrlResolver());
    private final ProxyLinkEncoder encoder = new ProxyLinkEncoder("/proxy");

    @Test
    void process_dropsRewritesAndForwards() {
        List<HttpHeader> raw = List.of(
                new HttpHeader("Content-Length", "1234"),
                new HttpHeader("X-Frame-Options", "DENY"),
                new HttpHeader("Set-Cookie", "a=1"),
                new HttpHeader("Location", "/p"),
                new HttpHeader("Set-Cookie", "b=2"),
                new HttpHeader("Location", "/q"),
                new HttpHeader("Content-Encoding", "gzip"),
                new HttpHeader("Content-Type", "text/html"),
                new HttpHeader("X-Custom", "v"));

        List<HttpHeader> out = pipeline.process(raw, EFFECTIVE_URL, "text/html; charset=UTF-8", encoder);

        assertThat(out).extracting(HttpHeader::getName, HttpHeader::getValue).containsExactly(
                tuple("Set-Cookie", "a=1"),
                tuple("Location", "/proxy?url=http%3A%2F%2Fsite.test%2Fp"),
                tuple("Set-Cookie", "b=2"),
                tuple("X-Custom", "v"),
                tuple("Content-Type", "text/html; charset=UTF-8"));
    }

    @Test
    void process_absoluteLocationIsEncoded() {
        List<HttpHeader> out = pipeline.process(List.of(new HttpHeader("location", "https://other.test/x")),
                EFFECTIVE_URL, null, encoder);

        assertThat(out).extracting(HttpHeader::getName, HttpHeader::getValue)
                .containsExactly(tuple("Location", "/proxy?url=https%3A%2F%2Fother.test%2Fx"));
    }

    @Test
    void process_withoutDeclaredType_emitsNoContentType() {
        List<HttpHeader> out = pipeline.process(
                List.of(new HttpHeader("Cache-Control", "no-cache"), new HttpHeader("content-type", "image/png")),
                EFFECTIVE_URL, null, encoder);

        assertThat(out).extracting(HttpHeader::getName).containsExactly("Cache-Control");
    }

    @Test
    void decide_classifiesByLowerCaseName() {
        assertThat(pipeline.decide("CONTENT-SECURITY-POLICY")).isEqualTo(HeaderDecision.DROP);
        assertThat(pipeline.decide("Strict-Transport-Security")).isEqualTo(HeaderDecision.DROP);
        assertThat(pipeline.decide("transfer-encoding")).isEqualTo(HeaderDecision.DROP);
        assertThat(pipeline.decide("Keep-Alive")).isEqualTo(HeaderDecision.DROP);
        assertThat(pipeline.decide(":status")).isEqualTo(HeaderDecision.DROP);
        assertThat(pipeline.decide("HTTP/1.1 200 OK")).isEqualTo(HeaderDecision.DROP);
        assertThat(pipeline.decide("LOCATION")).isEqualTo(HeaderDecision.REWRITE);
        assertThat(pipeline.decide("Cache-Control")).isEqualTo(HeaderDecision.FORWARD);
        assertThat(pipeline.decide("Set-Cookie")).isEqualTo(HeaderDecision.FORWARD);
    }

    @Test
    void parseHeaderBlock_handlesMixedLineEndings() {
        String block = "HTTP/1.1 302 Found\r\nLocation: /next\r\nSet-Cookie: a=1\nX-Empty:\rno colon here\r\n"
                + "X-Spaced :  padded value  \r\n\r\n";

        List<HttpHeader> headers = HeaderPipeline.parseHeaderBlock(block);

        assertThat(headers).extracting(HttpHeader::getName, HttpHeader::getValue).containsExactly(
                tuple("Location", "/next"),
                tuple("Set-Cookie", "a=1"),
                tuple("X-Empty", ""),
                tuple("X-Spaced", "padded value"));
    }

    @Test
    void parseHeaderBlock_splitsOnFirstColonOnly() {
        List<HttpHeader> headers = HeaderPipeline.parseHeaderBlock("Location: http://h/x?a=b:c");
        assertThat(headers).extracting(HttpHeader::getValue).containsExactly("http://h/x?a=b:c");
        assertThat(HeaderPipeline.parseHeaderBlock(null)).isEmpty();
    }
}
