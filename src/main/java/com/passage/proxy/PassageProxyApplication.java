package com.passage.proxy;

import com.passage.proxy.config.PassageProperties;
import com.passage.proxy.core.exceptions.ConfigException;
import com.passage.proxy.core.exceptions.ProxyException;
import com.passage.proxy.core.fetch.HttpClientUpstreamFetcher;
import com.passage.proxy.core.proxy.ProxyOrchestrator;
import com.passage.proxy.core.proxy.RewritingProxyServer;
import com.passage.proxy.core.services.LoggingService;
import com.passage.proxy.core.services.MetricsService;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Main entry point for Passage Proxy.
 * Handles command-line arguments, configuration loading, and application
 * lifecycle.
 */
@Command(name = "passage-proxy", mixinStandardHelpOptions = true, version = "1.0.0", description = "Web proxy that rewrites pages so every link keeps going through it.")
public class PassageProxyApplication implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(PassageProxyApplication.class);

    /**
     * Path to the YAML configuration file.
     */
    @Option(names = { "-c", "--config" }, description = "Path to config file (YAML)", defaultValue = "application.yml")
    private String configPath;

    /**
     * Overrides {@code server.port}.
     */
    @Option(names = { "-p", "--port" }, description = "Listen port (overrides server.port)")
    private Integer port;

    private RewritingProxyServer server;
    private MetricsService metricsService;

    /** Latch to block the main thread until shutdown is triggered. */
    private final CountDownLatch shutdownLatch = new CountDownLatch(1);

    /** Flag guarding against a second shutdown. */
    private final AtomicBoolean running = new AtomicBoolean(true);

    /** Reference to the registered shutdown hook for cleanup. */
    private Thread shutdownHook;

    /**
     * Main method to launch the application.
     *
     * @param args Command-line arguments.
     */
    public static void main(String[] args) {
        System.exit(new CommandLine(new PassageProxyApplication()).execute(args));
    }

    /**
     * Loads the configuration, starts the listener and blocks until stopped.
     *
     * @return Exit code (0 for success, 1 for failure).
     */
    @Override
    public Integer call() {
        try {
            log.info("Starting Passage Proxy...");

            PassageProperties props = loadConfig(configPath);
            if (port != null) {
                props.getServer().setPort(port);
            }

            this.metricsService = new MetricsService(props.getAdmin());
            LoggingService loggingService = new LoggingService(props.getLogging());
            ProxyOrchestrator orchestrator = new ProxyOrchestrator(props,
                    new HttpClientUpstreamFetcher(props.getUpstream()), metricsService.getRegistry());
            this.server = new RewritingProxyServer(props.getServer(), orchestrator, loggingService,
                    metricsService.getRegistry());

            Thread listener = new Thread(server::start, "http-listener");
            listener.setDaemon(true);
            listener.start();
            if (!server.awaitBind(10, TimeUnit.SECONDS)) {
                throw new ProxyException("Could not bind listener on port " + props.getServer().getPort());
            }

            if (System.getProperty("passage.no-shutdown-hook") == null) {
                this.shutdownHook = new Thread(this::stop, "ShutdownHook");
                Runtime.getRuntime().addShutdownHook(shutdownHook);
            }

            log.info("Passage Proxy ready: http://localhost:{}/?url=<target>", server.getLocalPort());
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
     * Stops the listener and the admin server and releases {@link #call()}.
     */
    public void stop() {
        if (running.compareAndSet(true, false)) {
            log.info("Shutting down Passage Proxy...");

            unregisterShutdownHook();

            if (server != null) {
                server.stop();
            }
            if (metricsService != null) {
                metricsService.shutdown();
            }
            shutdownLatch.countDown();
        }
    }

    /**
     * @return The bound listener port, or -1 before start-up completes.
     */
    int getListenPort() {
        RewritingProxyServer current = server;
        return current != null ? current.getLocalPort() : -1;
    }

    private void unregisterShutdownHook() {
        if (shutdownHook != null) {
            try {
                Runtime.getRuntime().removeShutdownHook(shutdownHook);
            } catch (IllegalStateException e) {
                // Already shutting down; stop() is running from the hook itself
                log.trace("Shutdown hook not removed: {}", e.getMessage());
            }
        }
    }

    /**
     * Loads the configuration from the specified path or classpath.
     *
     * @param path Path to the configuration file.
     * @return Loaded properties; an empty document yields the defaults.
     * @throws ConfigException if configuration cannot be loaded.
     */
    static PassageProperties loadConfig(String path) {
        Yaml yaml = new Yaml(new Constructor(PassageProperties.class, new LoaderOptions()));

        // 1. Try absolute/relative path
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

        // 2. Try classpath
        try (InputStream is = PassageProxyApplication.class.getClassLoader().getResourceAsStream(path)) {
            if (is != null) {
                return orDefaults(yaml.load(is));
            }
        } catch (YAMLException e) {
            throw new ConfigException("Invalid YAML in classpath resource " + path + ": " + e.getMessage());
        } catch (IOException e) {
            log.debug("Classpath resource lookup failed for {}", path);
        }

        throw new ConfigException("Configuration file not found: " + path);
    }

    private static PassageProperties orDefaults(PassageProperties loaded) {
        return loaded != null ? loaded : new PassageProperties();
    }
}
