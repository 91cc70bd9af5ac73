package com.blissfly.proxy.core.codec;

import com.blissfly.proxy.core.exceptions.InvalidTokenException;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class UrlCodecTest {

    private final UrlCodec codec = new UrlCodec();

    @Test
    void encode_producesPathSafeTokens() {
        String token = codec.encode("https://example.com/a?b=c&d=e~f#frag");

        assertThat(token).matches("[A-Za-z0-9_-]+");
        assertThat(codec.decode(token)).isEqualTo("https://example.com/a?b=c&d=e~f#frag");
    }

    @Test
    void encode_isDeterministic() {
        assertThat(codec.encode("https://example.com/"))
                .isEqualTo(codec.encode("https://example.com/"));
    }

    @Test
    void encode_handlesNonAsciiUrls() {
        String url = "https://example.com/café?q=日本";
        assertThat(codec.decode(codec.encode(url))).isEqualTo(url);
    }

    @Test
    void decode_rejectsBlankToken() {
        assertThatThrownBy(() -> codec.decode(""))
                .isInstanceOf(InvalidTokenException.class);
        assertThatThrownBy(() -> codec.decode(null))
                .isInstanceOf(InvalidTokenException.class);
    }

    @Test
    void decode_rejectsCharactersOutsideAlphabet() {
        assertThatThrownBy(() -> codec.decode("aGVsbG8=+/"))
                .isInstanceOf(InvalidTokenException.class)
                .hasMessageContaining("alphabet");
    }

    @Test
    void decode_rejectsNonUrlPayload() {
        String token = Base64.getUrlEncoder().withoutPadding()
                .encodeToString("not a url".getBytes(StandardCharsets.UTF_8));

        assertThatThrownBy(() -> codec.decode(token))
                .isInstanceOf(InvalidTokenException.class);
    }

    @Test
    void decode_rejectsUnsupportedScheme() {
        assertThatThrownBy(() -> codec.decode(codec.encode("ftp://example.com/file")))
                .isInstanceOf(InvalidTokenException.class)
                .hasMessageContaining("Unsupported scheme");
        assertThatThrownBy(() -> codec.decode(codec.encode("javascript:alert(1)")))
                .isInstanceOf(InvalidTokenException.class);
    }

    @Test
    void decode_rejectsInvalidUtf8() {
        String token = Base64.getUrlEncoder().withoutPadding()
                .encodeToString(new byte[] { (byte) 0xff, (byte) 0xfe, 0x41 });

        assertThatThrownBy(() -> codec.decode(token))
                .isInstanceOf(InvalidTokenException.class);
    }

    @Test
    void decodeTunnelTarget_acceptsWebSocketSchemes() {
        assertThat(codec.decodeTunnelTarget(codec.encode("wss://echo.example/socket")))
                .isEqualTo("wss://echo.example/socket");
        assertThatThrownBy(() -> codec.decode(codec.encode("wss://echo.example/socket")))
                .isInstanceOf(InvalidTokenException.class);
    }

    @Test
    void proxyPath_buildsWatchUrl() {
        String url = "http://example.com/";
        assertThat(codec.proxyPath(url)).isEqualTo("/watch?url=" + codec.encode(url));
        assertThat(codec.tunnelPath("ws://example.com/ws")).startsWith("/tunnel/");
    }

    @Test
    void normalizeTarget_defaultsToHttps() {
        assertThat(UrlCodec.normalizeTarget("example.com/page")).isEqualTo("https://example.com/page");
        assertThat(UrlCodec.normalizeTarget("  http://example.com  ")).isEqualTo("http://example.com");
        assertThat(UrlCodec.normalizeTarget("HTTPS://Example.com/")).isEqualTo("HTTPS://Example.com/");
    }

    @Test
    void normalizeTarget_rejectsEmptyInput() {
        assertThatThrownBy(() -> UrlCodec.normalizeTarget("   "))
                .isInstanceOf(InvalidTokenException.class);
    }

    @Test
    void isProxyTarget_checksAbsoluteHttpUrls() {
        assertThat(UrlCodec.isProxyTarget("https://example.com")).isTrue();
        assertThat(UrlCodec.isProxyTarget("/relative/path")).isFalse();
        assertThat(UrlCodec.isProxyTarget("mailto:someone@example.com")).isFalse();
        assertThat(UrlCodec.isProxyTarget("http:///nohost")).isFalse();
    }
}
