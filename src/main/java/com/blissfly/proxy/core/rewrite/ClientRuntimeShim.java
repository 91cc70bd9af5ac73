package com.blissfly.proxy.core.rewrite;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

import com.blissfly.proxy.core.codec.UrlCodec;
import com.blissfly.proxy.core.exceptions.ConfigException;
import com.blissfly.proxy.core.exceptions.RewriteException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Renders the browser-side runtime injected into proxied documents and scripts.
 * <p>
 * The runtime is a classpath template containing a single {@value #CONFIG_PLACEHOLDER}
 * marker, replaced by a JSON object describing the current document. String values are
 * escaped so they can never close the surrounding {@code <script>} element.
 */
public class ClientRuntimeShim {

    /** Classpath location of the runtime template. */
    public static final String TEMPLATE_RESOURCE = "shim/client-runtime.js";

    /** Marker replaced by the per-document configuration object. */
    public static final String CONFIG_PLACEHOLDER = "__BLISSFLY_CONFIG__";

    private final String template;
    private final ObjectMapper mapper;

    /**
     * Loads the runtime template from the classpath.
     *
     * @param mapper JSON mapper used to serialize the configuration object.
     * @throws ConfigException if the template is missing.
     */
    public ClientRuntimeShim(ObjectMapper mapper) {
        this(loadTemplate(), mapper);
    }

    ClientRuntimeShim(String template, ObjectMapper mapper) {
        if (!template.contains(CONFIG_PLACEHOLDER)) {
            throw new ConfigException("Client runtime template lacks the " + CONFIG_PLACEHOLDER + " marker");
        }
        this.template = template;
        this.mapper = mapper;
    }

    /**
     * Renders the runtime for one document.
     *
     * @param context Rewrite context of the document.
     * @return JavaScript source, safe to embed in an inline script element.
     */
    public String render(RewriteContext context) {
        Map<String, Object> config = new LinkedHashMap<>();
        config.put("baseUrl", context.getBaseUrl().toString());
        config.put("documentUrl", context.getDocumentUrl().toString());
        config.put("origin", context.getOrigin());
        config.put("proxyOrigin", context.getProxyOrigin());
        config.put("watchPath", UrlCodec.WATCH_PATH);
        config.put("urlParam", UrlCodec.URL_PARAM);
        config.put("tunnelPrefix", UrlCodec.TUNNEL_PREFIX);

        String json;
        try {
            json = mapper.writeValueAsString(config);
        } catch (JsonProcessingException e) {
            throw new RewriteException("Unable to serialize client runtime configuration", e);
        }
        return template.replace(CONFIG_PLACEHOLDER, escapeForScript(json));
    }

    /**
     * Makes a JSON literal safe inside an HTML script element.
     *
     * @param json Serialized JSON.
     * @return The JSON with {@code <}, {@code >}, {@code &} and line separators escaped.
     */
    static String escapeForScript(String json) {
        StringBuilder sb = new StringBuilder(json.length() + 16);
        for (int i = 0; i < json.length(); i++) {
            char c = json.charAt(i);
            switch (c) {
                case '<' -> sb.append("\\u003c");
                case '>' -> sb.append("\\u003e");
                case '&' -> sb.append("\\u0026");
                case '\u2028' -> sb.append("\\u2028");
                case '\u2029' -> sb.append("\\u2029");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }

    private static String loadTemplate() {
        try (InputStream is = ClientRuntimeShim.class.getClassLoader().getResourceAsStream(TEMPLATE_RESOURCE)) {
            if (is == null) {
                throw new ConfigException("Client runtime template not found: " + TEMPLATE_RESOURCE);
            }
            return new String(is.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ConfigException("Unable to read client runtime template", e);
        }
    }
}
