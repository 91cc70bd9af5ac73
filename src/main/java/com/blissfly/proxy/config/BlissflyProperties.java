package com.blissfly.proxy.config;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;

/**
 * Root configuration object for the Blissfly proxy.
 * Maps to the top-level structure of application.yml.
 */
public class BlissflyProperties {
    /**
     * Inbound listener settings.
     */
    private ServerConfig server = new ServerConfig();

    /**
     * Response cache settings.
     */
    private CacheConfig cache = new CacheConfig();

    /**
     * Outbound fetch settings.
     */
    private FetchConfig fetch = new FetchConfig();

    /**
     * Content rewriting settings.
     */
    private RewriteConfig rewrite = new RewriteConfig();

    /**
     * Shared session sub-protocol settings.
     */
    private SessionConfig session = new SessionConfig();

    /**
     * Access log settings.
     */
    private LoggingConfig logging = new LoggingConfig();

    /**
     * Administration and metrics configuration.
     */
    private AdminConfig admin = new AdminConfig();

    /**
     * Verbose logging with stack traces; unhandled errors do not terminate the process.
     */
    private boolean debug = false;

    /**
     * Milliseconds a clean shutdown may take before the process is halted.
     */
    private long shutdownGracePeriod = 10_000;

    @SuppressFBWarnings("EI_EXPOSE_REP")
    public ServerConfig getServer() {
        return server;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public void setServer(ServerConfig server) {
        this.server = server;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP")
    public CacheConfig getCache() {
        return cache;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public void setCache(CacheConfig cache) {
        this.cache = cache;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP")
    public FetchConfig getFetch() {
        return fetch;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public void setFetch(FetchConfig fetch) {
        this.fetch = fetch;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP")
    public RewriteConfig getRewrite() {
        return rewrite;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public void setRewrite(RewriteConfig rewrite) {
        this.rewrite = rewrite;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP")
    public SessionConfig getSession() {
        return session;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public void setSession(SessionConfig session) {
        this.session = session;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP")
    public LoggingConfig getLogging() {
        return logging;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public void setLogging(LoggingConfig logging) {
        this.logging = logging;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP")
    public AdminConfig getAdmin() {
        return admin;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public void setAdmin(AdminConfig admin) {
        this.admin = admin;
    }

    public boolean isDebug() {
        return debug;
    }

    public void setDebug(boolean debug) {
        this.debug = debug;
    }

    public long getShutdownGracePeriod() {
        return shutdownGracePeriod;
    }

    public void setShutdownGracePeriod(long shutdownGracePeriod) {
        this.shutdownGracePeriod = shutdownGracePeriod;
    }
}
