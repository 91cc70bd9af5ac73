package com.blissfly.proxy.core.rewrite;

import com.blissfly.proxy.core.codec.UrlCodec;
import com.blissfly.proxy.core.exceptions.ConfigException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ClientRuntimeShimTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void render_embedsDocumentConfiguration() {
        ClientRuntimeShim shim = new ClientRuntimeShim("var cfg = " + ClientRuntimeShim.CONFIG_PLACEHOLDER + ";", mapper);
        RewriteContext context = new RewriteContext("https://site.test:8443/a/b", "https://proxy.example", new UrlCodec());

        String js = shim.render(context);

        assertThat(js).startsWith("var cfg = {");
        assertThat(js).contains("\"documentUrl\":\"https://site.test:8443/a/b\"")
                .contains("\"origin\":\"https://site.test:8443\"")
                .contains("\"proxyOrigin\":\"https://proxy.example\"")
                .contains("\"watchPath\":\"/watch\"")
                .contains("\"tunnelPrefix\":\"/tunnel/\"");
    }

    @Test
    void render_cannotCloseTheScriptElement() {
        ClientRuntimeShim shim = new ClientRuntimeShim(ClientRuntimeShim.CONFIG_PLACEHOLDER, mapper);
        RewriteContext context = new RewriteContext("https://site.test/", "https://proxy.example/</script>", new UrlCodec());

        String js = shim.render(context);

        assertThat(js).doesNotContain("</script>").contains("\\u003c/script\\u003e");
    }

    @Test
    void escapeForScript_escapesLineSeparators() {
        assertThat(ClientRuntimeShim.escapeForScript("\"a\u2028b\u2029&\""))
                .isEqualTo("\"a\\u2028b\\u2029\\u0026\"");
    }

    @Test
    void classpathTemplate_isLoaded() {
        String js = new ClientRuntimeShim(mapper).render(new RewriteContext("http://site.test/", null, new UrlCodec()));

        assertThat(js).doesNotContain(ClientRuntimeShim.CONFIG_PLACEHOLDER).contains("__bf");
    }

    @Test
    void template_requiresPlaceholder() {
        assertThatThrownBy(() -> new ClientRuntimeShim("console.log(1)", mapper))
                .isInstanceOf(ConfigException.class);
    }
}
