package com.passage.proxy.core.proxy;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import com.passage.proxy.config.ServerConfig;
import com.passage.proxy.core.services.LoggingService;
import com.passage.proxy.core.utils.IoUtils;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base class for socket listeners.
 * Handles server lifecycle, the connection limit and executor management.
 * Each accepted connection is served on its own pooled daemon thread.
 */
public abstract class AbstractProxyServer implements ProxyServer {
    protected final Logger log = LoggerFactory.getLogger(getClass());

    /** Listener configuration. */
    protected final ServerConfig config;

    /** Service for the access log. */
    protected final LoggingService loggingService;

    /** Micrometer registry for metrics. */
    protected final MeterRegistry registry;

    /** Executor running one task per client connection. */
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
     * Latch released once {@code serverSocket.bind()} has completed (successfully
     * or not), so callers starting the server on another thread can wait for it.
     */
    private final CountDownLatch bindLatch = new CountDownLatch(1);
    private volatile boolean bindSuccess = false;

    /**
     * @param config         The listener configuration.
     * @param loggingService The access log.
     * @param registry       The Micrometer meter registry.
     */
    protected AbstractProxyServer(ServerConfig config, LoggingService loggingService, MeterRegistry registry) {
        this.config = config;
        this.loggingService = loggingService;
        this.registry = registry;
        this.executor = Executors.newCachedThreadPool(new ConnectionThreadFactory(getProxyName()));
        this.connectionSemaphore = new Semaphore(config.getMaxConnections());

        String type = getProxyName().toLowerCase();

        this.totalConnections = Counter.builder("proxy.connections.total")
                .tag("type", type)
                .description("Total number of accepted connections")
                .register(registry);

        this.connectionErrors = Counter.builder("proxy.connections.errors")
                .tag("type", type)
                .description("Total number of connection errors")
                .register(registry);

        this.activeGauge = Gauge.builder("proxy.connections.active", activeSockets, Set::size)
                .tag("type", type)
                .description("Current number of active connections")
                .register(registry);
    }

    /**
     * Binds to the configured port and enters the accept loop.
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
            log.info("{} listener started on {}:{}", getProxyName(),
                    config.getBindAddress() != null ? config.getBindAddress() : "0.0.0.0", getLocalPort());

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

    /**
     * Accepts and processes the next incoming client connection.
     *
     * @return {@code true} to continue the accept loop, {@code false} if the loop
     *         should terminate.
     */
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
     * @return The bound port, which differs from the configured one when that is 0;
     *         -1 before binding.
     */
    public int getLocalPort() {
        ServerSocket socket = serverSocket;
        return socket != null ? socket.getLocalPort() : -1;
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
     * Stops the server. Closes the server socket and all active client
     * connections.
     */
    @Override
    public void stop() {
        log.info("Stopping {} listener on port {}...", getProxyName(), getLocalPort());
        try {
            if (serverSocket != null) {
                serverSocket.close();
            }
        } catch (IOException e) {
            log.error("{} failed to close server socket: {}", getProxyName(), e.getMessage(), e);
        }

        // Closing the sockets unblocks handler threads stuck in read()
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
     * @return Short protocol name used in logs and metric tags.
     */
    protected abstract String getProxyName();

    /**
     * Serves one client connection until it is closed. Runs on a pooled
     * connection thread; the socket is closed by the caller afterwards.
     *
     * @param client The accepted client socket.
     */
    protected abstract void handleClient(Socket client);

    private static final class ConnectionThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger counter = new AtomicInteger();

        ConnectionThreadFactory(String name) {
            this.prefix = name.toLowerCase() + "-conn-";
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, prefix + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
