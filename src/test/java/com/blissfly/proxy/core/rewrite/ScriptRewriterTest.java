package com.blissfly.proxy.core.rewrite;

import com.blissfly.proxy.core.codec.UrlCodec;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScriptRewriterTest {

    private final RewriteContext context = new RewriteContext("https://site.test/app.js", null, new UrlCodec());

    @Test
    void shimFirst_prependsRuntimeAndKeepsScript() {
        ClientRuntimeShim shim = new ClientRuntimeShim(new ObjectMapper());
        ScriptRewriter rewriter = new ScriptRewriter(ScriptStrategy.SHIM_FIRST, shim);

        String out = rewriter.rewrite("window.foo = 1;", context);

        assertThat(out).startsWith(shim.render(context));
        assertThat(out).endsWith("\nwindow.foo = 1;");
    }

    @Test
    void shimFirst_leavesInlineScriptsUntouched() {
        ScriptRewriter rewriter = new ScriptRewriter(ScriptStrategy.SHIM_FIRST, null);

        assertThat(rewriter.rewriteInline("document.write('x')", context)).isEqualTo("document.write('x')");
    }

    @Test
    void identifierSubstitution_replacesBareGlobals() {
        ScriptRewriter rewriter = new ScriptRewriter(ScriptStrategy.IDENTIFIER_SUBSTITUTION, null);

        String out = rewriter.rewriteInline("var t = document.title; window.location.href = t; obj.location = 2;", context);

        assertThat(out).isEqualTo("var t = __bf.document.title; __bf.window.location.href = t; obj.location = 2;");
    }

    @Test
    void identifierSubstitution_ignoresLongerIdentifiers() {
        ScriptRewriter rewriter = new ScriptRewriter(ScriptStrategy.IDENTIFIER_SUBSTITUTION, null);

        assertThat(rewriter.rewriteInline("mywindow.documents = $location;", context))
                .isEqualTo("mywindow.documents = $location;");
    }

    @Test
    void withoutShim_standaloneScriptIsOnlyPrefixedWithNewline() {
        ScriptRewriter rewriter = new ScriptRewriter(ScriptStrategy.SHIM_FIRST, null);

        assertThat(rewriter.rewrite("x()", context)).isEqualTo("\nx()");
        assertThat(rewriter.getStrategy()).isEqualTo(ScriptStrategy.SHIM_FIRST);
    }

    @Test
    void strategy_parsesConfigValues() {
        assertThat(ScriptStrategy.fromConfig(null)).isEqualTo(ScriptStrategy.SHIM_FIRST);
        assertThat(ScriptStrategy.fromConfig("identifier-substitution"))
                .isEqualTo(ScriptStrategy.IDENTIFIER_SUBSTITUTION);
        assertThatThrownBy(() -> ScriptStrategy.fromConfig("eval-everything"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
