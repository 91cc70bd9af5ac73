package com.blissfly.proxy.core.services;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Supplier;

import com.blissfly.proxy.config.AdminConfig;
import com.blissfly.proxy.config.BlissflyProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Application metrics via Micrometer, exposed together with a health report on a
 * separate admin HTTP server.
 */
public class MetricsService {
    private static final Logger log = LoggerFactory.getLogger(MetricsService.class);

    private final PrometheusMeterRegistry registry;
    private final AdminConfig config;
    private final ObjectMapper mapper = new ObjectMapper();
    private final long startedAt = System.currentTimeMillis();
    private volatile Supplier<Map<String, Object>> healthDetails = Map::of;
    private HttpServer adminServer;
    private ExecutorService adminExecutor;

    public MetricsService(BlissflyProperties properties) {
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        this.config = properties.getAdmin();
        setupAdminServer();
    }

    private void setupAdminServer() {
        if (!config.isEnabled()) {
            return;
        }

        try {
            this.adminServer = HttpServer.create(new InetSocketAddress(config.getBindAddress(), config.getPort()), 0);

            adminServer.createContext("/health", exchange -> {
                Map<String, Object> report = new LinkedHashMap<>();
                report.put("status", "UP");
                report.put("uptime", System.currentTimeMillis() - startedAt);
                report.putAll(healthDetails.get());
                exchange.getResponseHeaders().set("Content-Type", "application/json");
                send(exchange, mapper.writeValueAsBytes(report));
            });

            adminServer.createContext("/metrics", exchange -> {
                exchange.getResponseHeaders().set("Content-Type", "text/plain; version=0.0.4; charset=utf-8");
                send(exchange, registry.scrape().getBytes(StandardCharsets.UTF_8));
            });

            adminExecutor = Executors.newCachedThreadPool(r -> {
                Thread t = new Thread(r, "admin-http");
                t.setDaemon(true);
                return t;
            });
            adminServer.setExecutor(adminExecutor);
            adminServer.start();
            log.info("Admin server started on port {} (/health, /metrics)", adminServer.getAddress().getPort());
        } catch (IOException e) {
            log.error("Failed to start admin server: {}", e.getMessage());
        }
    }

    private static void send(HttpExchange exchange, byte[] body) throws IOException {
        exchange.sendResponseHeaders(200, body.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(body);
        }
    }

    @SuppressFBWarnings("EI_EXPOSE_REP")
    public MeterRegistry getRegistry() {
        return registry;
    }

    /**
     * Sets the source of the extra fields reported by {@code /health}.
     *
     * @param healthDetails Supplier called on every health request.
     */
    public void setHealthDetails(Supplier<Map<String, Object>> healthDetails) {
        this.healthDetails = healthDetails;
    }

    /**
     * @return The bound admin port, or -1 when the admin server is not running.
     */
    public int getAdminPort() {
        HttpServer server = adminServer;
        return server != null ? server.getAddress().getPort() : -1;
    }

    public void shutdown() {
        if (adminServer != null) {
            log.info("Stopping admin server...");
            adminServer.stop(0);
            adminServer = null;
        }
        if (adminExecutor != null) {
            adminExecutor.shutdownNow();
            adminExecutor = null;
        }
    }
}
