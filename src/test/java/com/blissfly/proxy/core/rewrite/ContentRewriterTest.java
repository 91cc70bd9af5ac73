package com.blissfly.proxy.core.rewrite;

import com.blissfly.proxy.core.codec.UrlCodec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ContentRewriterTest {

    private final UrlCodec codec = new UrlCodec();
    private ContentRewriter rewriter;
    private RewriteContext context;

    @BeforeEach
    void setUp() {
        CssRewriter css = new CssRewriter();
        ScriptRewriter script = new ScriptRewriter(ScriptStrategy.SHIM_FIRST, null);
        rewriter = new ContentRewriter(new HtmlRewriter(css, script, null), css, script);
        context = new RewriteContext("https://site.test/", null, codec);
    }

    @Test
    void transform_rewritesHtml() {
        RewrittenContent out = rewriter.transform(bytes("<a href='/x'>x</a>"), "text/html", context);

        assertThat(out.rewritten()).isTrue();
        assertThat(out.contentType()).isEqualTo("text/html; charset=utf-8");
        assertThat(new String(out.body(), StandardCharsets.UTF_8)).contains(codec.encode("https://site.test/x"));
    }

    @Test
    void transform_decodesDeclaredCharset() {
        byte[] latin1 = "p { content: 'caf\u00e9'; background: url(a.png) }".getBytes(StandardCharsets.ISO_8859_1);

        RewrittenContent out = rewriter.transform(latin1, "text/css; charset=ISO-8859-1", context);

        assertThat(out.contentType()).isEqualTo("text/css; charset=utf-8");
        assertThat(new String(out.body(), StandardCharsets.UTF_8)).contains("caf\u00e9");
    }

    @Test
    void transform_passesThroughOtherTypes() {
        byte[] png = new byte[] { (byte) 0x89, 'P', 'N', 'G' };

        RewrittenContent out = rewriter.transform(png, "image/png", context);

        assertThat(out.rewritten()).isFalse();
        assertThat(out.body()).isSameAs(png);
        assertThat(out.contentType()).isEqualTo("image/png");
    }

    @Test
    void transform_fallsBackToOriginalWhenRewriterFails() {
        HtmlRewriter failing = mock(HtmlRewriter.class);
        when(failing.rewrite(anyString(), any())).thenThrow(new IllegalStateException("boom"));
        rewriter = new ContentRewriter(failing, new CssRewriter(), new ScriptRewriter(ScriptStrategy.SHIM_FIRST, null));
        byte[] html = bytes("<p>x</p>");

        RewrittenContent out = rewriter.transform(html, "text/html", context);

        assertThat(out.rewritten()).isFalse();
        assertThat(out.body()).isSameAs(html);
    }

    @Test
    void contentKind_classifiesMimeTypes() {
        assertThat(ContentKind.of("TEXT/HTML; charset=utf-8")).isEqualTo(ContentKind.HTML);
        assertThat(ContentKind.of("application/xhtml+xml")).isEqualTo(ContentKind.HTML);
        assertThat(ContentKind.of("text/css")).isEqualTo(ContentKind.CSS);
        assertThat(ContentKind.of("application/javascript")).isEqualTo(ContentKind.SCRIPT);
        assertThat(ContentKind.of("application/json")).isEqualTo(ContentKind.OTHER);
        assertThat(ContentKind.of(null)).isEqualTo(ContentKind.OTHER);
    }

    @Test
    void charsetOf_fallsBackToUtf8() {
        assertThat(ContentRewriter.charsetOf("text/html; charset=\"windows-1252\"").name()).isEqualTo("windows-1252");
        assertThat(ContentRewriter.charsetOf("text/html; charset=bogus-1")).isEqualTo(StandardCharsets.UTF_8);
        assertThat(ContentRewriter.charsetOf(null)).isEqualTo(StandardCharsets.UTF_8);
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }
}
