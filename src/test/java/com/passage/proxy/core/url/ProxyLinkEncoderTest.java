package com.passage.proxy.core.url;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class ProxyLinkEncoderTest {

    private final ProxyLinkEncoder encoder = new ProxyLinkEncoder("/proxy");

    @Test
    void encode_percentEncodesEverythingButUnreserved() {
        assertThat(encoder.encode("http://site.test/dir/pic.png"))
                .isEqualTo("/proxy?url=http%3A%2F%2Fsite.test%2Fdir%2Fpic.png");
        assertThat(encoder.encode("http://h/a b~c-d_e.f"))
                .isEqualTo("/proxy?url=http%3A%2F%2Fh%2Fa%20b~c-d_e.f");
    }

    @Test
    void encode_usesUtf8Bytes() {
        assertThat(encoder.encode("http://h/ü")).isEqualTo("/proxy?url=http%3A%2F%2Fh%2F%C3%BC");
    }

    @Test
    void blankScriptPath_defaultsToRoot() {
        assertThat(new ProxyLinkEncoder("").encode("http://h/")).isEqualTo("/?url=http%3A%2F%2Fh%2F");
        assertThat(new ProxyLinkEncoder(null).encode("http://h/")).startsWith("/?url=");
    }

    @ParameterizedTest
    @ValueSource(strings = { "http://h/a b?x=1&y=2#f", "https://h.test/p+q/%41?u=http://x", "http://h/日本語",
            "data:text/plain,hi there", "" })
    void decode_reversesEncode(String target) {
        assertThat(ProxyLinkEncoder.decode(encoder.encode(target))).isEqualTo(target);
    }

    @Test
    void decode_withoutUrlParameter_returnsNull() {
        assertThat(ProxyLinkEncoder.decode("/proxy")).isNull();
        assertThat(ProxyLinkEncoder.decode("/proxy?other=1")).isNull();
        assertThat(ProxyLinkEncoder.decode(null)).isNull();
    }
}
