package com.blissfly.proxy.config;

/**
 * Content rewriting switches.
 */
public class RewriteConfig {
    /** SHIM_FIRST or IDENTIFIER_SUBSTITUTION; see {@code ScriptStrategy}. */
    private String scriptStrategy = "SHIM_FIRST";

    /** Whether the client runtime is injected into HTML documents and scripts. */
    private boolean injectShim = true;

    public String getScriptStrategy() {
        return scriptStrategy;
    }

    public void setScriptStrategy(String scriptStrategy) {
        this.scriptStrategy = scriptStrategy;
    }

    public boolean isInjectShim() {
        return injectShim;
    }

    public void setInjectShim(boolean injectShim) {
        this.injectShim = injectShim;
    }
}
