package com.blissfly.proxy.core.rewrite;

import com.blissfly.proxy.core.codec.UrlCodec;
import com.blissfly.proxy.core.exceptions.RewriteException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RewriteContextTest {

    private final RewriteContext context = new RewriteContext("https://ex.com/a/page.html?x=1", null, new UrlCodec());

    @Test
    void resolve_encodesCharactersBrowsersTolerate() {
        assertThat(context.resolve("my image.png")).isEqualTo("https://ex.com/a/my%20image.png");
        assertThat(context.resolve("/a|b")).isEqualTo("https://ex.com/a%7Cb");
        assertThat(context.resolve("/t/{id}^")).isEqualTo("https://ex.com/t/%7Bid%7D%5E");
        assertThat(context.resolve("/café")).isEqualTo("https://ex.com/caf%C3%A9");
    }

    @Test
    void resolve_keepsExistingEscapesAndEncodesStrayPercent() {
        assertThat(context.resolve("/x%20y")).isEqualTo("https://ex.com/x%20y");
        assertThat(context.resolve("/100%")).isEqualTo("https://ex.com/100%25");
    }

    @Test
    void resolve_dropsDotSegmentsAboveRoot() {
        assertThat(context.resolve("../../../x")).isEqualTo("https://ex.com/x");
        assertThat(context.resolve("https://ex.com/../y?q=1")).isEqualTo("https://ex.com/y?q=1");
        assertThat(context.resolve("../b/./c")).isEqualTo("https://ex.com/b/c");
    }

    @Test
    void resolve_queryOnlyKeepsPath() {
        assertThat(context.resolve("?page=2")).isEqualTo("https://ex.com/a/page.html?page=2");
    }

    @Test
    void resolve_rejectsUnusableReferences() {
        assertThatThrownBy(() -> context.resolve("http://[broken")).isInstanceOf(RewriteException.class);
        assertThatThrownBy(() -> context.resolve("ftp://ex.com/file")).isInstanceOf(RewriteException.class);
    }

    @Test
    void rewrite_prefixesProxyOriginWhenKnown() {
        UrlCodec codec = new UrlCodec();
        RewriteContext withOrigin = new RewriteContext("https://ex.com/", "http://proxy.test/", codec);

        assertThat(withOrigin.rewrite("p")).isEqualTo("http://proxy.test" + codec.proxyPath("https://ex.com/p"));
        assertThat(context.rewrite("/p")).isEqualTo(codec.proxyPath("https://ex.com/p"));
    }
}
