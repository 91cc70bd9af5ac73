package com.blissfly.proxy.core.proxy;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import com.blissfly.proxy.config.ServerConfig;
import com.blissfly.proxy.core.utils.IoUtils;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base class for thread-per-connection servers.
 * Owns the listening socket, the accept loop, the worker pool and the connection limit.
 */
public abstract class AbstractProxyServer implements ProxyServer {
    protected final Logger log = LoggerFactory.getLogger(getClass());

    /** Configuration for this server instance. */
    protected final ServerConfig config;

    /** Micrometer registry for metrics. */
    protected final MeterRegistry registry;

    /** Worker pool running one task per client connection. */
    protected final ExecutorService executor;

    /** Semaphore to enforce the maximum number of concurrent connections. */
    protected final Semaphore connectionSemaphore;

    /** Set of active client sockets for graceful shutdown. */
    protected final Set<Socket> activeSockets = ConcurrentHashMap.newKeySet();

    /** The main server socket listening for incoming connections. */
    protected ServerSocket serverSocket;

    private final Counter totalConnections;
    private final Counter connectionErrors;
    private final Meter activeGauge;

    /**
     * Released once the bind attempt has completed, successfully or not.
     */
    private final CountDownLatch bindLatch = new CountDownLatch(1);
    private volatile boolean bindSuccess = false;

    /**
     * @param config   The server configuration.
     * @param registry The Micrometer meter registry.
     */
    protected AbstractProxyServer(ServerConfig config, MeterRegistry registry) {
        this.config = config;
        this.registry = registry;
        String name = (config.getName() != null ? config.getName() : "unnamed").replace(" ", "_")
                .toLowerCase(Locale.ROOT);
        AtomicInteger threadCounter = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, name + "-worker-" + threadCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        this.connectionSemaphore = new Semaphore(config.getMaxConnections());

        this.totalConnections = Counter.builder("proxy.connections.total")
                .tag("name", name)
                .description("Total number of accepted connections")
                .register(registry);

        this.connectionErrors = Counter.builder("proxy.connections.errors")
                .tag("name", name)
                .description("Total number of connection errors")
                .register(registry);

        this.activeGauge = Gauge.builder("proxy.connections.active", activeSockets, Set::size)
                .tag("name", name)
                .description("Current number of active connections")
                .register(registry);
    }

    /**
     * Binds to the configured port and enters the accept loop. Blocks until the
     * server socket is closed.
     */
    @Override
    public void start() {
        try {
            serverSocket = new ServerSocket();
            serverSocket.setReuseAddress(true);
            InetSocketAddress bindAddr = config.getBindAddress() != null
                    ? new InetSocketAddress(config.getBindAddress(), config.getPort())
                    : new InetSocketAddress(config.getPort());
            serverSocket.bind(bindAddr);
            bindSuccess = true;
            bindLatch.countDown();
            log.info("{} started on {}:{}", getProxyName(),
                    config.getBindAddress() != null ? config.getBindAddress() : "0.0.0.0",
                    serverSocket.getLocalPort());

            while (!serverSocket.isClosed()) {
                if (!acceptAndProcessNextClient()) {
                    break;
                }
            }
        } catch (IOException e) {
            bindLatch.countDown();
            connectionErrors.increment();
            log.error("{} server error on port {}: {}", getProxyName(), config.getPort(), e.getMessage(), e);
        }
    }

    private boolean acceptAndProcessNextClient() {
        try {
            Socket client = serverSocket.accept();
            processClient(client);
            return true;
        } catch (SocketException e) {
            if (serverSocket.isClosed()) {
                return false;
            }
            connectionErrors.increment();
            log.error("{} accept error on port {}: {}", getProxyName(), config.getPort(), e.getMessage());
            return true;
        } catch (IOException e) {
            connectionErrors.increment();
            log.error("{} I/O error during accept on port {}: {}", getProxyName(), config.getPort(),
                    e.getMessage());
            return true;
        }
    }

    /**
     * Waits for the server to finish binding to its port.
     *
     * @param timeout Maximum time to wait.
     * @param unit    Unit for the timeout.
     * @return {@code true} if the bind completed successfully within the timeout.
     */
    public boolean awaitBind(long timeout, TimeUnit unit) {
        try {
            return bindLatch.await(timeout, unit) && bindSuccess;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * @return The bound port, or -1 before a successful bind.
     */
    public int getLocalPort() {
        ServerSocket socket = serverSocket;
        return bindSuccess && socket != null ? socket.getLocalPort() : -1;
    }

    private void processClient(Socket client) {
        String remoteAddr = client.getInetAddress().getHostAddress();
        totalConnections.increment();
        try {
            client.setTcpNoDelay(true);
            client.setSoTimeout(config.getTimeout() > 0 ? config.getTimeout() : 60000);
        } catch (SocketException e) {
            log.debug("{} failed to configure client socket: {}", getProxyName(), e.getMessage());
        }

        if (connectionSemaphore.tryAcquire()) {
            activeSockets.add(client);
            executor.submit(() -> {
                try {
                    handleClient(client);
                } catch (Exception e) {
                    connectionErrors.increment();
                    log.error("{} unexpected error handling client {}: {}", getProxyName(), remoteAddr,
                            e.getMessage(), e);
                } finally {
                    activeSockets.remove(client);
                    connectionSemaphore.release();
                    IoUtils.closeQuietly(client, "client socket");
                }
            });
        } else {
            log.warn("{} connection limit reached ({})", getProxyName(), config.getMaxConnections());
            IoUtils.closeQuietly(client, "limit reached client socket");
        }
    }

    /**
     * Stops accepting, closes all active client connections and waits briefly for the
     * workers to finish.
     */
    @Override
    public void stop() {
        log.info("Stopping {} server on port {}...", getProxyName(), config.getPort());
        try {
            if (serverSocket != null) {
                serverSocket.close();
            }
        } catch (IOException e) {
            log.error("{} failed to close server socket: {}", getProxyName(), e.getMessage(), e);
        }

        for (Socket s : activeSockets) {
            IoUtils.closeQuietly(s);
        }
        activeSockets.clear();

        registry.remove(totalConnections);
        registry.remove(connectionErrors);
        registry.remove(activeGauge);

        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("{} executor did not terminate cleanly after 5 s", getProxyName());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Override
    @SuppressFBWarnings("EI_EXPOSE_REP")
    public ServerConfig getConfig() {
        return config;
    }

    /**
     * @return Descriptive name of the server, used in log lines.
     */
    protected abstract String getProxyName();

    /**
     * Serves one client connection on a worker thread. The socket is closed by the
     * caller once this returns.
     *
     * @param client The accepted client socket.
     */
    protected abstract void handleClient(Socket client);
}
