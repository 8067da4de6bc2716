package com.passage.proxy.core.proxy;

import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import com.passage.proxy.config.PassageProperties;
import com.passage.proxy.core.exceptions.InvalidTargetException;
import com.passage.proxy.core.exceptions.UpstreamException;
import com.passage.proxy.core.fetch.FetchRequest;
import com.passage.proxy.core.fetch.FetchResult;
import com.passage.proxy.core.fetch.UpstreamFetcher;
import com.passage.proxy.core.http.ContentTypes;
import com.passage.proxy.core.http.HttpHeader;
import com.passage.proxy.core.rewrite.ContentRewritePipeline;
import com.passage.proxy.core.rewrite.HeaderPipeline;
import com.passage.proxy.core.rewrite.RewriteContext;
import com.passage.proxy.core.url.AbsoluteUrl;
import com.passage.proxy.core.url.ProxyLinkEncoder;
import com.passage.proxy.core.url.UrlResolver;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one proxied request end to end: validate the target, fetch it, filter
 * the headers and rewrite the body.
 * <p>
 * Each request runs on a bounded worker pool so a wall-clock ceiling can be
 * applied on top of the upstream timeouts.
 * </p>
 */
public class ProxyOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ProxyOrchestrator.class);

    static final String FETCH_FAILED_PREFIX = "Failed to fetch the upstream URL: ";

    private final PassageProperties props;
    private final UpstreamFetcher fetcher;
    private final UrlResolver resolver;
    private final HeaderPipeline headerPipeline;
    private final ContentRewritePipeline contentPipeline;
    private final MeterRegistry registry;
    private final ExecutorService workers;
    private final Counter upstreamErrors;
    private final Counter invalidTargets;

    /**
     * @param props    Global configuration.
     * @param fetcher  Upstream client.
     * @param registry Micrometer registry.
     */
    public ProxyOrchestrator(PassageProperties props, UpstreamFetcher fetcher, MeterRegistry registry) {
        this(props, fetcher, new ContentRewritePipeline(), registry);
    }

    /**
     * @param props           Global configuration.
     * @param fetcher         Upstream client.
     * @param contentPipeline Body rewriters.
     * @param registry        Micrometer registry.
     */
    public ProxyOrchestrator(PassageProperties props, UpstreamFetcher fetcher, ContentRewritePipeline contentPipeline,
            MeterRegistry registry) {
        this.props = props;
        this.fetcher = fetcher;
        this.resolver = new UrlResolver(props.getRewrite().isPreserveQuery());
        this.headerPipeline = new HeaderPipeline(resolver);
        this.contentPipeline = contentPipeline;
        this.registry = registry;

        int threads = Math.max(1, props.getServer().getWorkerThreads());
        this.workers = Executors.newFixedThreadPool(threads, new WorkerThreadFactory());

        this.upstreamErrors = Counter.builder("proxy.upstream.errors")
                .description("Upstream fetches that failed")
                .register(registry);
        this.invalidTargets = Counter.builder("proxy.requests.invalid")
                .description("Requests rejected for an unusable target URL")
                .register(registry);
    }

    /**
     * Handles a request under the {@code server.requestTimeout} ceiling.
     *
     * @param request A request carrying a {@code url} parameter.
     * @return The response to send; never null.
     */
    public ProxyResponse handle(ProxyRequest request) {
        Future<ProxyResponse> future;
        try {
            future = workers.submit(() -> process(request));
        } catch (RejectedExecutionException e) {
            return ProxyResponse.text(503, "Proxy is shutting down.");
        }

        long ceiling = props.getServer().getRequestTimeout();
        try {
            return ceiling > 0 ? future.get(ceiling, TimeUnit.MILLISECONDS) : future.get();
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Request for {} exceeded {} ms", request.getTargetUrl(), ceiling);
            return ProxyResponse.text(504, "Gateway Timeout: no complete response within " + ceiling + " ms.");
        } catch (ExecutionException e) {
            log.error("Unexpected error proxying {}: {}", request.getTargetUrl(), e.getCause().getMessage(),
                    e.getCause());
            return ProxyResponse.text(500, "Internal Server Error");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return ProxyResponse.text(503, "Proxy is shutting down.");
        }
    }

    /**
     * The pipeline itself, run on the caller's thread.
     *
     * @param request Inbound request.
     * @return The response.
     */
    ProxyResponse process(ProxyRequest request) {
        AbsoluteUrl target;
        try {
            target = AbsoluteUrl.fromUserInput(request.getTargetUrl());
        } catch (InvalidTargetException e) {
            invalidTargets.increment();
            log.debug("Rejected target {} from {}: {}", request.getTargetUrl(), request.getRemoteAddress(),
                    e.getMessage());
            return ProxyResponse.text(400, e.getMessage());
        }

        FetchResult result;
        try {
            result = fetcher.fetch(new FetchRequest(target, request.getHeaders()));
        } catch (UpstreamException e) {
            upstreamErrors.increment();
            log.warn("Upstream fetch of {} for {} failed: {}", target, request.getRemoteAddress(), e.getMessage());
            return ProxyResponse.text(502, FETCH_FAILED_PREFIX + e.getMessage());
        }

        ProxyLinkEncoder encoder = new ProxyLinkEncoder(request.getPath());
        String effectiveUrl = result.getEffectiveUrl();

        List<HttpHeader> headers = headerPipeline.process(result.getHeaders(), effectiveUrl,
                result.getContentType(), encoder);

        if (request.isHead()) {
            return new ProxyResponse(result.getStatus(), headers, new byte[0]);
        }

        RewriteContext context = new RewriteContext(effectiveUrl, encoder, resolver,
                props.getRewrite().isEncodeNonRoutable());
        byte[] body = contentPipeline.rewrite(result.getBody(), result.getContentType(), context);
        if (contentPipeline.isRewritable(result.getContentType())) {
            Counter.builder("proxy.rewrite.documents")
                    .tag("type", ContentTypes.primaryType(result.getContentType()))
                    .description("Response bodies passed through a rewriter")
                    .register(registry)
                    .increment();
        }

        return new ProxyResponse(result.getStatus(), headers, body);
    }

    /**
     * Stops accepting work and interrupts in-flight pipelines.
     */
    public void shutdown() {
        workers.shutdownNow();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Proxy workers did not terminate cleanly after 5 s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "proxy-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
