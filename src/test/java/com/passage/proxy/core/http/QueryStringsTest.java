package com.passage.proxy.core.http;

import java.nio.charset.StandardCharsets;
import java.util.Map;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

class QueryStringsTest {

    @Test
    void parse_decodesPairsInOrder() {
        Map<String, String> params = QueryStrings.parse("url=http%3A%2F%2Fh%2F&flag&x=a+b");
        assertThat(params).containsExactly(entry("url", "http://h/"), entry("flag", ""), entry("x", "a b"));
    }

    @Test
    void parse_firstOccurrenceWins() {
        assertThat(QueryStrings.parse("url=first&url=second")).containsEntry("url", "first");
    }

    @Test
    void parse_keepsMalformedEscapes() {
        assertThat(QueryStrings.parse("url=100%")).containsEntry("url", "100%");
    }

    @Test
    void parse_emptyOrNull() {
        assertThat(QueryStrings.parse(null)).isEmpty();
        assertThat(QueryStrings.parse("")).isEmpty();
        assertThat(QueryStrings.parse("&&")).isEmpty();
    }

    @Test
    void contentTypes_primaryTypeAndCharset() {
        assertThat(ContentTypes.primaryType(" Text/HTML ; charset=UTF-8")).isEqualTo("text/html");
        assertThat(ContentTypes.primaryType(null)).isEmpty();
        assertThat(ContentTypes.charset("text/html; charset=\"ISO-8859-1\"")).isEqualTo(StandardCharsets.ISO_8859_1);
        assertThat(ContentTypes.charset("text/css")).isNull();
        assertThat(ContentTypes.charset("text/css; charset=no-such-charset")).isNull();
    }
}
