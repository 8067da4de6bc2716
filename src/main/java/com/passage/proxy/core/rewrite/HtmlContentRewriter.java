package com.passage.proxy.core.rewrite;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.passage.proxy.core.http.ContentTypes;
import org.jsoup.Jsoup;
import org.jsoup.nodes.DataNode;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rewrites link-bearing attributes, {@code srcset} lists and inline CSS of
 * HTML documents with jsoup.
 */
public class HtmlContentRewriter implements ContentRewriter {

    private static final Logger log = LoggerFactory.getLogger(HtmlContentRewriter.class);

    private static final Map<String, List<String>> LINK_ATTRIBUTES = new LinkedHashMap<>();

    static {
        LINK_ATTRIBUTES.put("a", List.of("href"));
        LINK_ATTRIBUTES.put("area", List.of("href"));
        LINK_ATTRIBUTES.put("link", List.of("href"));
        LINK_ATTRIBUTES.put("img", List.of("src", "longdesc"));
        LINK_ATTRIBUTES.put("script", List.of("src"));
        LINK_ATTRIBUTES.put("iframe", List.of("src"));
        LINK_ATTRIBUTES.put("form", List.of("action"));
        LINK_ATTRIBUTES.put("video", List.of("poster"));
        LINK_ATTRIBUTES.put("audio", List.of("src"));
        LINK_ATTRIBUTES.put("source", List.of("src"));
    }

    @Override
    public boolean supports(String primaryType) {
        return ContentTypes.TEXT_HTML.equals(primaryType);
    }

    @Override
    public byte[] rewrite(byte[] body, String contentType, RewriteContext context) {
        if (body.length == 0) {
            return body;
        }

        Charset declared = ContentTypes.charset(contentType);
        Document doc;
        try {
            doc = Jsoup.parse(new ByteArrayInputStream(body), declared != null ? declared.name() : null,
                    context.getBaseUrl() != null ? context.getBaseUrl() : "");
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        doc.outputSettings().prettyPrint(false);

        RewriteContext ctx = applyBase(doc, context);
        int rewritten = rewriteLinkAttributes(doc, ctx);
        rewritten += rewriteSrcsets(doc, ctx);
        rewritten += rewriteStyles(doc, ctx);
        log.debug("Rewrote {} references in HTML from {}", rewritten, context.getBaseUrl());

        return doc.outerHtml().getBytes(doc.charset());
    }

    /**
     * Picks up the first {@code <base href>} and strips the attribute, since the
     * rewritten links are root-relative to the proxy.
     */
    private RewriteContext applyBase(Document doc, RewriteContext context) {
        Element base = doc.selectFirst("base");
        if (base == null || !base.hasAttr("href")) {
            return context;
        }
        String resolved = context.getResolver().resolve(base.attr("href"), context.getBaseUrl());
        base.removeAttr("href");
        log.debug("Document base set to {}", resolved);
        return context.withBase(resolved);
    }

    private int rewriteLinkAttributes(Document doc, RewriteContext ctx) {
        int count = 0;
        for (Map.Entry<String, List<String>> entry : LINK_ATTRIBUTES.entrySet()) {
            for (Element el : doc.getElementsByTag(entry.getKey())) {
                for (String attr : entry.getValue()) {
                    if (el.hasAttr(attr)) {
                        el.attr(attr, ctx.rewriteReference(el.attr(attr)));
                        count++;
                    }
                }
            }
        }
        return count;
    }

    private int rewriteSrcsets(Document doc, RewriteContext ctx) {
        int count = 0;
        for (Element el : doc.select("img[srcset], source[srcset]")) {
            el.attr("srcset", SrcsetRewriter.rewrite(el.attr("srcset"), ctx));
            count++;
        }
        return count;
    }

    private int rewriteStyles(Document doc, RewriteContext ctx) {
        int count = 0;
        for (Element style : doc.getElementsByTag("style")) {
            for (DataNode node : style.dataNodes()) {
                node.setWholeData(CssUrlRewriter.rewrite(node.getWholeData(), ctx));
                count++;
            }
        }
        for (Element el : doc.select("[style]")) {
            el.attr("style", CssUrlRewriter.rewrite(el.attr("style"), ctx));
            count++;
        }
        return count;
    }
}
