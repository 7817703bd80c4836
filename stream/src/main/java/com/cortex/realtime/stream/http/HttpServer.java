package com.cortex.realtime.stream.http;

import com.cortex.realtime.core.util.JsonUtils;
import com.cortex.realtime.stream.config.StreamConfig;
import com.cortex.realtime.stream.metrics.PrometheusMetricsExporter;
import com.cortex.realtime.stream.registry.IConnectionRegistry;
import com.cortex.realtime.stream.stats.StatsService;
import io.netty.channel.ChannelOption;
import io.netty.handler.codec.http.HttpHeaderNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.DisposableServer;

import java.time.Duration;
import java.util.function.Function;

/**
 * HTTP server for the stream endpoints, stats, health checks and metrics.
 */
public class HttpServer {
    private static final Logger log = LoggerFactory.getLogger(HttpServer.class);

    private final StreamConfig config;
    private final IConnectionRegistry registry;
    private final SseStreamHandler streamHandler;
    private final StatsService statsService;
    private final PrometheusMetricsExporter metricsExporter;
    private DisposableServer server;

    /**
     * @param metricsExporter may be null, {@code /metrics} then answers 404
     */
    public HttpServer(StreamConfig config, IConnectionRegistry registry, SseStreamHandler streamHandler,
                      StatsService statsService, PrometheusMetricsExporter metricsExporter) {
        this.config = config;
        this.registry = registry;
        this.streamHandler = streamHandler;
        this.statsService = statsService;
        this.metricsExporter = metricsExporter;
    }

    /**
     * Binds the server; blocks until the port is open.
     */
    public DisposableServer start() {
        server = reactor.netty.http.server.HttpServer.create()
            .port(config.getHttpPort())
            .option(ChannelOption.SO_REUSEADDR, true)
            .metrics(true, Function.identity())
            .route(routes -> routes
                .get("/healthz", (req, res) -> res.status(200).sendString(Mono.just("OK")))
                // Readiness fails once shutdown started so no new streams are routed here
                .get("/readyz", (req, res) -> {
                    if (registry.isShutdown()) {
                        return res.status(503).sendString(Mono.just("Not Ready - Shutting down"));
                    }
                    return res.status(200).sendString(Mono.just("Ready"));
                })
                .get("/metrics", (req, res) -> {
                    if (metricsExporter == null) {
                        return res.status(404).send();
                    }
                    return res.header(HttpHeaderNames.CONTENT_TYPE, "text/plain; version=0.0.4; charset=utf-8")
                        .sendString(Mono.just(metricsExporter.scrape()));
                })
                // Fixed paths first: the template below would match them too
                .get("/v1/stats", (req, res) -> statsService.snapshot()
                    .flatMap(stats -> res.header(HttpHeaderNames.CONTENT_TYPE, "application/json")
                        .sendString(Mono.just(JsonUtils.writeValueAsString(stats)))
                        .then()))
                .get("/v1/global", streamHandler::handleGlobal)
                .get("/v1/{channelType}/{resourceId}", streamHandler::handleChannel)
            )
            .bindNow(Duration.ofSeconds(45));

        log.info("HTTP server started on port {}", server.port());
        return server;
    }

    public int port() {
        return server.port();
    }

    public void stop() {
        if (server != null) {
            server.disposeNow(Duration.ofSeconds(30));
            log.info("HTTP server stopped");
        }
    }
}
