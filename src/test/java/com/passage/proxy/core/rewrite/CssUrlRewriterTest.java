package com.passage.proxy.core.rewrite;

import java.nio.charset.StandardCharsets;

import com.passage.proxy.core.url.ProxyLinkEncoder;
import com.passage.proxy.core.url.UrlResolver;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CssUrlRewriterTest {

    private final RewriteContext context = new RewriteContext("http://site.test/css/main.css",
            new ProxyLinkEncoder("/proxy"), new UrlResolver(), false);

    @Test
    void rewrite_onlyChangesUrlArgument() {
        assertThat(CssUrlRewriter.rewrite("body{background:url(/img/a.png)}", context))
                .isEqualTo("body{background:url(\"/proxy?url=http%3A%2F%2Fsite.test%2Fimg%2Fa.png\")}");
    }

    @Test
    void rewrite_stripsQuotesAndWhitespaceAndIgnoresCase() {
        String css = "a{b:URL( 'x.png' )} c{d:url(\"../y.png\")} e{f:url(\n z.png\t)}";

        assertThat(CssUrlRewriter.rewrite(css, context)).isEqualTo(
                "a{b:url(\"/proxy?url=http%3A%2F%2Fsite.test%2Fcss%2Fx.png\")} "
                        + "c{d:url(\"/proxy?url=http%3A%2F%2Fsite.test%2Fy.png\")} "
                        + "e{f:url(\"/proxy?url=http%3A%2F%2Fsite.test%2Fcss%2Fz.png\")}");
    }

    @Test
    void rewrite_leavesDataUrisAlone() {
        String css = "i{background:url(data:image/png;base64,AAAA)}";
        assertThat(CssUrlRewriter.rewrite(css, context)).isEqualTo(css);
    }

    @Test
    void rewrite_replacementTextIsLiteral() {
        assertThat(CssUrlRewriter.rewrite("a{b:url($1.png)}", context))
                .isEqualTo("a{b:url(\"/proxy?url=http%3A%2F%2Fsite.test%2Fcss%2F%241.png\")}");
    }

    @Test
    void rewrite_nullAndEmpty() {
        assertThat(CssUrlRewriter.rewrite(null, context)).isNull();
        assertThat(CssUrlRewriter.rewrite("", context)).isEmpty();
        assertThat(CssUrlRewriter.rewrite("p{color:red}", context)).isEqualTo("p{color:red}");
    }

    @Test
    void trim_stripsOnlyTheConfiguredCharacters() {
        assertThat(CssUrlRewriter.trim(" \t'\"a b\"' \n")).isEqualTo("a b");
        assertThat(CssUrlRewriter.trim("\r")).isEqualTo("\r");
    }

    @Test
    void cssContentRewriter_usesDeclaredCharset() {
        CssContentRewriter rewriter = new CssContentRewriter();
        byte[] body = "/* é */ a{b:url(x.png)}".getBytes(StandardCharsets.ISO_8859_1);

        byte[] out = rewriter.rewrite(body, "text/css; charset=ISO-8859-1", context);

        assertThat(rewriter.supports("text/css")).isTrue();
        assertThat(new String(out, StandardCharsets.ISO_8859_1))
                .isEqualTo("/* é */ a{b:url(\"/proxy?url=http%3A%2F%2Fsite.test%2Fcss%2Fx.png\")}");
    }

    @Test
    void srcset_keepsDescriptors() {
        assertThat(SrcsetRewriter.rewrite(" a.png   1.5x ,b.png,", context))
                .isEqualTo("/proxy?url=http%3A%2F%2Fsite.test%2Fcss%2Fa.png 1.5x, "
                        + "/proxy?url=http%3A%2F%2Fsite.test%2Fcss%2Fb.png");
    }
}
