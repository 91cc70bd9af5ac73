package com.blissfly.proxy;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import ch.qos.logback.classic.Level;
import com.blissfly.proxy.config.BlissflyProperties;
import com.blissfly.proxy.config.CacheConfig;
import com.blissfly.proxy.config.FetchConfig;
import com.blissfly.proxy.config.ServerConfig;
import com.blissfly.proxy.core.cache.CacheStats;
import com.blissfly.proxy.core.cache.SizingMode;
import com.blissfly.proxy.core.engine.ProxyEngine;
import com.blissfly.proxy.core.exceptions.ConfigException;
import com.blissfly.proxy.core.exceptions.ProxyException;
import com.blissfly.proxy.core.proxy.impl.http.RewritingProxyServer;
import com.blissfly.proxy.core.rewrite.ScriptStrategy;
import com.blissfly.proxy.core.services.AccessLogService;
import com.blissfly.proxy.core.services.FatalErrorHandler;
import com.blissfly.proxy.core.services.MetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Main entry point for the Blissfly proxy.
 * Handles command-line arguments, configuration loading, and application lifecycle.
 */
@Command(name = "blissfly-proxy", mixinStandardHelpOptions = true, version = "1.0.0", description = "Content-rewriting reverse proxy.")
public class BlissflyProxyApplication implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(BlissflyProxyApplication.class);

    /** Root logger of the application packages. */
    static final String APP_LOGGER = "com.blissfly";

    @Option(names = { "-c", "--config" }, description = "Path to config file (YAML)", defaultValue = "application.yml")
    private String configPath;

    @Option(names = { "-p", "--port" }, description = "Port of the inbound server (overrides config and PORT)")
    private Integer port;

    @Option(names = { "-d", "--debug" }, description = "Debug logging; unhandled errors do not terminate the process")
    private boolean debug;

    private final Map<String, String> environment;

    private ProxyEngine engine;
    private RewritingProxyServer server;
    private MetricsService metricsService;

    /** Latch to block the main thread until shutdown is triggered. */
    private final CountDownLatch shutdownLatch = new CountDownLatch(1);

    /** Flag to signal background threads to stop. */
    private final AtomicBoolean running = new AtomicBoolean(true);

    /** Reference to the registered shutdown hook for cleanup. */
    private Thread shutdownHook;

    private long shutdownGracePeriod = 10_000;

    public BlissflyProxyApplication() {
        this(System.getenv());
    }

    BlissflyProxyApplication(Map<String, String> environment) {
        this.environment = environment;
    }

    /**
     * Main method to launch the application.
     *
     * @param args Command-line arguments.
     */
    public static void main(String[] args) {
        int exitCode = new CommandLine(new BlissflyProxyApplication()).execute(args);
        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }

    /**
     * Bootstraps the engine, the admin server and the inbound server, then blocks
     * until {@link #stop()} is called.
     *
     * @return Exit code (0 for success, 1 for failure).
     */
    @Override
    public Integer call() {
        try {
            log.info("Starting Blissfly Proxy...");

            BlissflyProperties props = loadConfig(configPath);
            applyOverrides(props);
            validate(props);
            if (props.isDebug()) {
                enableDebugLogging();
            }
            this.shutdownGracePeriod = props.getShutdownGracePeriod();
            if (System.getProperty("blissfly.no-fatal-handler") == null) {
                Thread.setDefaultUncaughtExceptionHandler(new FatalErrorHandler(props.isDebug()));
            }

            this.metricsService = new MetricsService(props);
            this.engine = new ProxyEngine(props, metricsService.getRegistry());
            metricsService.setHealthDetails(this::healthDetails);
            this.server = new RewritingProxyServer(props, engine, new AccessLogService(props.getLogging()),
                    metricsService.getRegistry());

            Thread serverThread = new Thread(server::start, "blissfly-acceptor");
            serverThread.start();
            if (!server.awaitBind(10, TimeUnit.SECONDS)) {
                throw new ProxyException("Inbound server failed to bind port " + props.getServer().getPort());
            }

            if (System.getProperty("blissfly.no-shutdown-hook") == null) {
                this.shutdownHook = new Thread(this::stop, "ShutdownHook");
                Runtime.getRuntime().addShutdownHook(shutdownHook);
            }

            shutdownLatch.await();
            return 0;
        } catch (ConfigException e) {
            log.error("Configuration Error: {}", e.getMessage());
            return 1;
        } catch (ProxyException e) {
            log.error("Fatal proxy error: {}", e.getMessage());
            return 1;
        } catch (InterruptedException e) {
            log.warn("Application interrupted");
            Thread.currentThread().interrupt();
            return 0;
        } catch (Exception e) {
            log.error("Unexpected fatal error", e);
            return 1;
        } finally {
            stop();
        }
    }

    /**
     * Stops accepting, closes client connections and tunnels, cancels the cache sweep
     * and stops the admin server. If that takes longer than the grace period, the
     * process is halted.
     */
    public void stop() {
        if (running.compareAndSet(true, false)) {
            log.info("Shutting down Blissfly Proxy...");

            unregisterShutdownHook();
            Thread watchdog = startHaltWatchdog();

            if (server != null) {
                server.stop();
            }
            if (engine != null) {
                engine.close();
            }
            if (metricsService != null) {
                metricsService.shutdown();
            }
            watchdog.interrupt();
            shutdownLatch.countDown();
        }
    }

    /**
     * @return The inbound server's bound port, or -1 while it is not running.
     */
    public int getServerPort() {
        return server != null ? server.getLocalPort() : -1;
    }

    /**
     * @return true once the inbound server accepts connections.
     */
    public boolean isStarted() {
        return getServerPort() > 0;
    }

    private Thread startHaltWatchdog() {
        long grace = shutdownGracePeriod;
        Thread watchdog = new Thread(() -> {
            try {
                Thread.sleep(grace);
                log.error("Shutdown exceeded {} ms, halting", grace);
                Runtime.getRuntime().halt(1);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "shutdown-watchdog");
        watchdog.setDaemon(true);
        watchdog.start();
        return watchdog;
    }

    private void unregisterShutdownHook() {
        if (shutdownHook != null) {
            try {
                Runtime.getRuntime().removeShutdownHook(shutdownHook);
            } catch (IllegalStateException ignored) {
                // shutdown already in progress: stop() is running inside the hook
            } catch (Exception e) {
                log.debug("Failed to remove shutdown hook: {}", e.getMessage());
            }
        }
    }

    private Map<String, Object> healthDetails() {
        Map<String, Object> details = new LinkedHashMap<>();
        CacheStats stats = engine.cacheStats();
        if (stats != null) {
            details.put("cache", stats);
        }
        details.put("sessions", engine.getSessionManager().sessionCount());
        details.put("tunnels", engine.getTunnel().activeCount());
        return details;
    }

    /**
     * Applies environment variables ({@code PORT}, {@code DEBUG}) and then command-line
     * options, so the command line wins.
     */
    void applyOverrides(BlissflyProperties props) {
        String envPort = environment.get("PORT");
        if (envPort != null && !envPort.isBlank()) {
            try {
                props.getServer().setPort(Integer.parseInt(envPort.trim()));
            } catch (NumberFormatException e) {
                throw new ConfigException("PORT is not a number: " + envPort);
            }
        }
        if ("true".equals(environment.get("DEBUG"))) {
            props.setDebug(true);
        }
        if (port != null) {
            props.getServer().setPort(port);
        }
        if (debug) {
            props.setDebug(true);
        }
    }

    /**
     * Rejects configuration values the proxy cannot run with.
     *
     * @param props Loaded configuration.
     * @throws ConfigException describing the first invalid value.
     */
    static void validate(BlissflyProperties props) {
        ServerConfig server = props.getServer();
        requireThat(server.getPort() >= 0 && server.getPort() <= 65535, "server.port must be within 0-65535");
        requireThat(server.getMaxConnections() > 0, "server.maxConnections must be positive");
        requireThat(server.getTimeout() >= 0, "server.timeout must not be negative");
        requireThat(server.getMaxRequestBody() > 0, "server.maxRequestBody must be positive");

        CacheConfig cache = props.getCache();
        requireThat(cache.getMaxSize() > 0, "cache.maxSize must be positive");
        requireThat(cache.getMaxMemory() > 0, "cache.maxMemory must be positive");
        requireThat(cache.getTtl() > 0, "cache.ttl must be positive");
        requireThat(cache.getEvictionRatio() > 0 && cache.getEvictionRatio() <= 1,
                "cache.evictionRatio must be within (0, 1]");
        try {
            SizingMode.fromConfig(cache.getSizingMode());
        } catch (IllegalArgumentException e) {
            throw new ConfigException("cache.sizingMode must be EXACT or ESTIMATED: " + cache.getSizingMode());
        }

        FetchConfig fetch = props.getFetch();
        requireThat(fetch.getMaxRedirects() >= 0, "fetch.maxRedirects must not be negative");
        requireThat(fetch.getRetryCount() >= 1, "fetch.retryCount must be at least 1");
        requireThat(fetch.getTimeout() > 0, "fetch.timeout must be positive");
        requireThat(fetch.getRetryBaseDelay() >= 0, "fetch.retryBaseDelay must not be negative");

        try {
            ScriptStrategy.fromConfig(props.getRewrite().getScriptStrategy());
        } catch (IllegalArgumentException e) {
            throw new ConfigException("rewrite.scriptStrategy is not supported: "
                    + props.getRewrite().getScriptStrategy());
        }

        String sessionPath = props.getSession().getPath();
        requireThat(sessionPath != null && sessionPath.startsWith("/"), "session.path must start with '/'");
        requireThat(props.getSession().getMaxMessageSize() > 0, "session.maxMessageSize must be positive");

        requireThat(props.getShutdownGracePeriod() > 0, "shutdownGracePeriod must be positive");
        if (props.getAdmin().isEnabled()) {
            requireThat(props.getAdmin().getPort() != server.getPort() || server.getPort() == 0,
                    "admin.port must differ from server.port");
        }
    }

    private static void requireThat(boolean condition, String message) {
        if (!condition) {
            throw new ConfigException(message);
        }
    }

    private static void enableDebugLogging() {
        Logger appLogger = LoggerFactory.getLogger(APP_LOGGER);
        if (appLogger instanceof ch.qos.logback.classic.Logger) {
            ((ch.qos.logback.classic.Logger) appLogger).setLevel(Level.DEBUG);
            log.debug("Debug logging enabled");
        }
    }

    /**
     * Loads the configuration from the specified path or classpath.
     *
     * @param path Path to the configuration file.
     * @return Loaded properties.
     * @throws ConfigException if configuration cannot be loaded.
     */
    BlissflyProperties loadConfig(String path) {
        Yaml yaml = new Yaml(new Constructor(BlissflyProperties.class, new LoaderOptions()));

        BlissflyProperties fromFile = tryLoadFromFile(yaml, path);
        if (fromFile != null) {
            return fromFile;
        }

        BlissflyProperties fromClasspath = tryLoadFromClasspath(yaml, path);
        if (fromClasspath != null) {
            return fromClasspath;
        }

        throw new ConfigException("Configuration file not found: " + path);
    }

    private BlissflyProperties tryLoadFromFile(Yaml yaml, String path) {
        File file = new File(path);
        if (file.exists()) {
            try (InputStream is = new FileInputStream(file)) {
                return orDefaults(yaml.load(is));
            } catch (YAMLException e) {
                throw new ConfigException("Invalid YAML in " + path + ": " + e.getMessage());
            } catch (IOException e) {
                throw new ConfigException("Error reading config file: " + path, e);
            }
        }
        return null;
    }

    private BlissflyProperties tryLoadFromClasspath(Yaml yaml, String path) {
        try (InputStream is = getClass().getClassLoader().getResourceAsStream(path)) {
            if (is != null) {
                return orDefaults(yaml.load(is));
            }
        } catch (YAMLException e) {
            throw new ConfigException("Invalid YAML in classpath resource " + path + ": " + e.getMessage());
        } catch (IOException e) {
            log.debug("Classpath resource lookup failed for {}", path);
        }
        return null;
    }

    /**
     * An empty document loads as null.
     */
    private static BlissflyProperties orDefaults(BlissflyProperties loaded) {
        return loaded != null ? loaded : new BlissflyProperties();
    }
}
