package com.cortex.realtime.stream.heartbeat;

import com.cortex.realtime.core.msg.StreamFrame;
import com.cortex.realtime.core.msg.Topics;
import com.cortex.realtime.core.util.JsonUtils;
import com.cortex.realtime.stream.config.StreamConfig;
import com.cortex.realtime.stream.metrics.MetricsService;
import com.cortex.realtime.stream.registry.IConnectionRegistry;
import com.cortex.realtime.stream.session.OfferResult;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Keeps idle streams alive and reclaims dead ones.
 * <p>
 * Every check period each OPEN session is inspected under its channel lock:
 * <ul>
 *   <li>transport disposed (client went away): the session is reclaimed</li>
 *   <li>nothing written for the heartbeat interval: a {@code heartbeat} frame is enqueued,
 *   unless the previous one is still queued; if the queue refuses it the session is treated
 *   as failed and reclaimed</li>
 * </ul>
 * Reclaimed sessions are unregistered after the traversal.
 * </p>
 */
public class HeartbeatMonitor {
    private static final Logger log = LoggerFactory.getLogger(HeartbeatMonitor.class);

    private final IConnectionRegistry registry;
    private final MetricsService metricsService;
    private final Clock clock;
    private final Duration interval;
    private final Duration checkPeriod;

    private volatile Disposable ticker;

    public HeartbeatMonitor(IConnectionRegistry registry, StreamConfig config,
                            MetricsService metricsService, Clock clock) {
        this.registry = registry;
        this.metricsService = metricsService;
        this.clock = clock;
        this.interval = config.getHeartbeatInterval();
        this.checkPeriod = config.getHeartbeatCheckPeriod();
    }

    public synchronized void start() {
        if (ticker != null && !ticker.isDisposed()) {
            return;
        }
        ticker = Flux.interval(checkPeriod, checkPeriod)
            .subscribe(
                tick -> tick(),
                err -> log.error("Heartbeat monitor stopped unexpectedly", err)
            );
        log.info("Heartbeat monitor started (interval={}, check every {})", interval, checkPeriod);
    }

    public synchronized void stop() {
        if (ticker != null) {
            ticker.dispose();
            ticker = null;
            log.info("Heartbeat monitor stopped");
        }
    }

    /**
     * Runs one inspection pass.
     */
    public TickSummary tick() {
        Instant now = clock.instant();
        List<String> reclaim = new ArrayList<>();
        int[] sent = {0};

        try {
            registry.forEachOpenSession(session -> {
                if (session.isClientGone()) {
                    reclaim.add(session.getId());
                    return;
                }
                if (!session.isHeartbeatDue(now, interval)) {
                    return;
                }
                OfferResult result = session.offerHeartbeat(heartbeatFrame(now));
                if (result == OfferResult.ACCEPTED) {
                    sent[0]++;
                    metricsService.recordHeartbeat();
                } else {
                    log.debug("Heartbeat for connection {} refused: {}", session.getId(), result);
                    reclaim.add(session.getId());
                }
            });
        } catch (RuntimeException e) {
            log.error("Heartbeat pass failed", e);
        }

        int reclaimed = 0;
        for (String connectionId : reclaim) {
            if (registry.unregister(connectionId)) {
                reclaimed++;
                metricsService.recordReclaimed();
                log.info("Reclaimed connection {}", connectionId);
            }
        }

        if (sent[0] > 0 || reclaimed > 0) {
            log.debug("Heartbeat pass: {} heartbeats, {} reclaimed", sent[0], reclaimed);
        }
        return new TickSummary(sent[0], reclaimed);
    }

    private static StreamFrame heartbeatFrame(Instant now) {
        ObjectNode data = JsonUtils.objectNode();
        data.put("timestamp_utc", now.toString());
        return new StreamFrame(Topics.HEARTBEAT, data, now.toEpochMilli());
    }

    public boolean isRunning() {
        Disposable current = ticker;
        return current != null && !current.isDisposed();
    }

    /**
     * Outcome of one {@link #tick()}.
     */
    @Value
    public static class TickSummary {
        int heartbeats;
        int reclaimed;
    }
}
