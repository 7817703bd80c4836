package com.cortex.realtime.stream.http;

import com.cortex.realtime.core.model.ChannelKey;
import com.cortex.realtime.core.model.ChannelType;
import com.cortex.realtime.core.msg.SseFrames;
import com.cortex.realtime.core.msg.StreamFrame;
import com.cortex.realtime.core.msg.Topics;
import com.cortex.realtime.core.util.BytesUtils;
import com.cortex.realtime.core.util.JsonUtils;
import com.cortex.realtime.stream.config.StreamConfig;
import com.cortex.realtime.stream.metrics.MetricsService;
import com.cortex.realtime.stream.registry.IConnectionRegistry;
import com.cortex.realtime.stream.security.AuthorizationDeniedException;
import com.cortex.realtime.stream.security.TokenAuthenticator;
import com.cortex.realtime.stream.session.StreamingSession;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.QueryStringDecoder;
import io.netty.handler.timeout.WriteTimeoutHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.netty.channel.AbortedException;
import reactor.netty.http.server.HttpServerRequest;
import reactor.netty.http.server.HttpServerResponse;

import java.util.Collection;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

/**
 * Serves {@code text/event-stream} responses for channel subscriptions.
 * <p>
 * Request checks, in order: node shutting down (503), channel type (400), token present (422),
 * token valid (401), access policy (403).
 * </p>
 * <p>
 * Stream layout: a {@code connect} frame, then every frame of the session queue. Each write is
 * bounded by a Netty {@link WriteTimeoutHandler}; a write failure or disconnect unregisters the
 * session.
 * </p>
 */
public class SseStreamHandler {
    private static final Logger log = LoggerFactory.getLogger(SseStreamHandler.class);

    private static final String WRITE_TIMEOUT_HANDLER = "streamWriteTimeout";

    private final StreamConfig config;
    private final IConnectionRegistry registry;
    private final TokenAuthenticator authenticator;
    private final MetricsService metricsService;

    public SseStreamHandler(StreamConfig config, IConnectionRegistry registry,
                            TokenAuthenticator authenticator, MetricsService metricsService) {
        this.config = config;
        this.registry = registry;
        this.authenticator = authenticator;
        this.metricsService = metricsService;
    }

    /**
     * {@code GET /v1/global}
     */
    public Mono<Void> handleGlobal(HttpServerRequest req, HttpServerResponse res) {
        return stream(req, res, ChannelType.GLOBAL.wireName(), ChannelKey.GLOBAL_RESOURCE_ID);
    }

    /**
     * {@code GET /v1/{channelType}/{resourceId}}
     */
    public Mono<Void> handleChannel(HttpServerRequest req, HttpServerResponse res) {
        return stream(req, res, req.param("channelType"), req.param("resourceId"));
    }

    private Mono<Void> stream(HttpServerRequest req, HttpServerResponse res,
                              String channelTypeName, String resourceId) {
        if (registry.isShutdown()) {
            return reject(res, HttpResponseStatus.SERVICE_UNAVAILABLE, "Shutting down");
        }

        ChannelKey channelKey;
        try {
            channelKey = ChannelKey.of(ChannelType.fromWireName(channelTypeName), resourceId);
        } catch (IllegalArgumentException e) {
            return reject(res, HttpResponseStatus.BAD_REQUEST, e.getMessage());
        }

        Optional<String> token = queryParam(req, "token");
        if (token.isEmpty()) {
            return reject(res, HttpResponseStatus.UNPROCESSABLE_ENTITY, "Missing token");
        }

        Optional<String> ownerUserId = authenticator.authenticate(token.get());
        if (ownerUserId.isEmpty()) {
            log.warn("Rejected stream request for {}: invalid token", channelKey);
            return reject(res, HttpResponseStatus.UNAUTHORIZED, "Invalid token");
        }

        return registry.register(channelKey, ownerUserId.get())
            .flatMap(session -> serve(res, session))
            .onErrorResume(AuthorizationDeniedException.class,
                err -> reject(res, HttpResponseStatus.FORBIDDEN, "Access denied"))
            .onErrorResume(IllegalStateException.class,
                err -> reject(res, HttpResponseStatus.SERVICE_UNAVAILABLE, "Shutting down"));
    }

    private Mono<Void> serve(HttpServerResponse res, StreamingSession session) {
        String connectionId = session.getId();
        try (MDC.MDCCloseable ignored = MDC.putCloseable("connectionId", connectionId)) {
            log.info("Stream opened for user {} on {}", session.getOwnerUserId(), session.getChannelKey());
        }

        res.status(HttpResponseStatus.OK)
            .header(HttpHeaderNames.CONTENT_TYPE, "text/event-stream; charset=utf-8")
            .header(HttpHeaderNames.CACHE_CONTROL, "no-cache")
            .header("X-Accel-Buffering", "no");

        res.withConnection(connection -> {
            connection.addHandlerLast(WRITE_TIMEOUT_HANDLER,
                new WriteTimeoutHandler(config.getWriteTimeout().toMillis(), TimeUnit.MILLISECONDS));
            session.bindTransport(connection);
            connection.onDispose(() -> registry.unregister(connectionId));
        });

        Flux<String> body = Flux.concat(Mono.just(connectFrame()), session.frames())
            .map(SseFrames::encode)
            .doOnNext(chunk -> metricsService.recordNetworkOutboundSse(BytesUtils.getBytesLength(chunk)));

        return res.sendString(body)
            .then()
            .onErrorResume(err -> {
                session.markClosing();
                if (err instanceof AbortedException) {
                    log.debug("Client of connection {} went away", connectionId);
                } else {
                    log.debug("Write to connection {} failed: {}", connectionId, err.toString());
                }
                return Mono.empty();
            })
            .doFinally(signal -> {
                if (registry.unregister(connectionId)) {
                    log.info("Stream closed for connection {} ({})", connectionId, signal);
                }
            });
    }

    private static StreamFrame connectFrame() {
        return StreamFrame.of(Topics.CONNECT, JsonUtils.objectNode().put("connected", true));
    }

    private static Optional<String> queryParam(HttpServerRequest req, String name) {
        QueryStringDecoder decoder = new QueryStringDecoder(req.uri());
        return Stream.ofNullable(decoder.parameters().get(name))
            .flatMap(Collection::stream)
            .filter(value -> !value.isBlank())
            .findFirst();
    }

    private static Mono<Void> reject(HttpServerResponse res, HttpResponseStatus status, String message) {
        return res.status(status)
            .header(HttpHeaderNames.CONTENT_TYPE, "text/plain; charset=utf-8")
            .sendString(Mono.just(message))
            .then();
    }
}
