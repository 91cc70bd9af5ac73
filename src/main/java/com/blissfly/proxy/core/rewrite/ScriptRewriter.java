package com.blissfly.proxy.core.rewrite;

import java.util.regex.Pattern;

/**
 * Makes script bodies proxy-aware according to the configured {@link ScriptStrategy}.
 * <p>
 * Standalone scripts get the client runtime prepended, guarded so it installs once per
 * global. Inline scripts in an HTML document rely on the runtime injected into its head.
 * Identifier substitution is a textual heuristic and may touch occurrences inside
 * strings or comments.
 */
public class ScriptRewriter {

    private static final Pattern GLOBAL_IDENTIFIER = Pattern.compile(
            "(?<![\\w$.])(window|document|location)(?![\\w$])");

    private final ScriptStrategy strategy;
    private final ClientRuntimeShim shim;

    public ScriptRewriter(ScriptStrategy strategy, ClientRuntimeShim shim) {
        this.strategy = strategy;
        this.shim = shim;
    }

    /**
     * Rewrites a standalone script resource.
     *
     * @param script  Script source.
     * @param context Rewrite context of the script URL.
     * @return Prelude followed by the (possibly substituted) script.
     */
    public String rewrite(String script, RewriteContext context) {
        String body = script == null ? "" : script;
        String prelude = shim != null ? shim.render(context) : "";
        return prelude + "\n" + substitute(body);
    }

    /**
     * Rewrites the body of an inline {@code <script>} element.
     *
     * @param script  Script source.
     * @param context Rewrite context of the owning document.
     * @return The script, substituted when that strategy is active.
     */
    public String rewriteInline(String script, RewriteContext context) {
        return substitute(script);
    }

    public ScriptStrategy getStrategy() {
        return strategy;
    }

    private String substitute(String script) {
        if (strategy != ScriptStrategy.IDENTIFIER_SUBSTITUTION || script == null) {
            return script;
        }
        return GLOBAL_IDENTIFIER.matcher(script).replaceAll("__bf.$1");
    }
}
