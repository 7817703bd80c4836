package com.cortex.realtime.stream.registry;

import com.cortex.realtime.core.model.ChannelKey;
import com.cortex.realtime.core.model.ChannelType;
import com.cortex.realtime.core.msg.StreamFrame;
import com.cortex.realtime.stream.metrics.MetricsService;
import com.cortex.realtime.stream.security.AccessPolicy;
import com.cortex.realtime.stream.security.AuthorizationDeniedException;
import com.cortex.realtime.stream.session.SessionFactory;
import com.cortex.realtime.stream.session.StreamingSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Connection table partitioned into one bucket per channel key.
 * <p>
 * <b>Locking:</b> each bucket is its own monitor. Adding or removing a session, pushing a frame
 * to the channel and heartbeat enqueueing all happen inside it, so a session and its queue
 * enter and leave the table together, and emissions into a session's queue never overlap.
 * Different channels never contend.
 * </p>
 * <p>
 * <b>Retirement:</b> an emptied non-global bucket is marked retired and removed from the map
 * under its own lock. A registration that raced with the removal sees the flag and retries
 * with a fresh bucket.
 * </p>
 * <p>
 * <b>Slow consumers:</b> a full queue drops the frame for that connection only and the
 * connection is evicted once the bucket lock is released. Other connections on the channel
 * still receive the frame.
 * </p>
 */
public class ConnectionRegistry implements IConnectionRegistry {
    private static final Logger log = LoggerFactory.getLogger(ConnectionRegistry.class);

    private final SessionFactory sessionFactory;
    private final AccessPolicy accessPolicy;
    private final MetricsService metricsService;

    private final ConcurrentMap<ChannelKey, Bucket> buckets = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, StreamingSession> sessionsById = new ConcurrentHashMap<>();
    private final List<ConnectionListener> listeners = new CopyOnWriteArrayList<>();

    private final AtomicLong framesDelivered = new AtomicLong();
    private final AtomicLong framesDropped = new AtomicLong();
    private final AtomicLong evictions = new AtomicLong();

    private volatile boolean shutdown;

    public ConnectionRegistry(SessionFactory sessionFactory, AccessPolicy accessPolicy,
                              MetricsService metricsService) {
        this.sessionFactory = sessionFactory;
        this.accessPolicy = accessPolicy;
        this.metricsService = metricsService;
    }

    @Override
    public Mono<StreamingSession> register(ChannelKey channelKey, String ownerUserId) {
        return Mono.defer(() -> {
            if (shutdown) {
                return Mono.error(new IllegalStateException("Connection registry is shut down"));
            }

            return accessPolicy.verifyAccess(ownerUserId, channelKey.getChannelType(), channelKey.getResourceId())
                .defaultIfEmpty(false)
                .flatMap(allowed -> {
                    if (!allowed) {
                        metricsService.recordAuthDenied(channelKey.getChannelType());
                        log.warn("Access denied: user {} on {}", ownerUserId, channelKey);
                        return Mono.error(new AuthorizationDeniedException(ownerUserId, channelKey));
                    }
                    return Mono.fromCallable(() -> addSession(channelKey, ownerUserId));
                });
        });
    }

    private StreamingSession addSession(ChannelKey channelKey, String ownerUserId) {
        StreamingSession session = sessionFactory.createSession(channelKey, ownerUserId);

        while (true) {
            Bucket bucket = buckets.computeIfAbsent(channelKey, Bucket::new);
            synchronized (bucket) {
                if (shutdown) {
                    throw new IllegalStateException("Connection registry is shut down");
                }
                if (bucket.retired) {
                    continue;
                }
                bucket.sessions.put(session.getId(), session);
                sessionsById.put(session.getId(), session);
                session.open();
                break;
            }
        }

        metricsService.recordSessionOpened();
        for (ConnectionListener listener : listeners) {
            listener.onRegistered(session);
        }
        log.info("Registered connection {} on {} for user {}", session.getId(), channelKey, ownerUserId);
        return session;
    }

    @Override
    public boolean unregister(String connectionId) {
        StreamingSession session = sessionsById.get(connectionId);
        if (session == null) {
            return false;
        }

        ChannelKey channelKey = session.getChannelKey();
        Bucket bucket = buckets.get(channelKey);
        if (bucket == null) {
            // Removed concurrently together with its bucket
            return false;
        }

        synchronized (bucket) {
            if (!bucket.sessions.remove(connectionId, session)) {
                return false;
            }
            sessionsById.remove(connectionId, session);
            session.close();
            retireIfEmpty(bucket);
        }

        metricsService.recordSessionClosed();
        for (ConnectionListener listener : listeners) {
            listener.onUnregistered(session);
        }
        log.info("Unregistered connection {} on {}", connectionId, channelKey);
        return true;
    }

    // Caller holds the bucket lock
    private void retireIfEmpty(Bucket bucket) {
        if (bucket.sessions.isEmpty() && !bucket.retired
            && bucket.channelKey.getChannelType() != ChannelType.GLOBAL) {
            bucket.retired = true;
            buckets.remove(bucket.channelKey, bucket);
        }
    }

    @Override
    public int push(ChannelKey channelKey, StreamFrame frame) {
        Bucket bucket = buckets.get(channelKey);
        if (bucket == null) {
            return 0;
        }

        int delivered = 0;
        List<StreamingSession> stale = null;
        synchronized (bucket) {
            if (bucket.retired) {
                return 0;
            }
            // Copy: a failing write may unregister re-entrantly on this thread
            for (StreamingSession session : new ArrayList<>(bucket.sessions.values())) {
                switch (session.offer(frame)) {
                    case ACCEPTED -> delivered++;
                    case QUEUE_FULL -> {
                        framesDropped.incrementAndGet();
                        metricsService.recordDropQueueFull();
                        log.warn("Queue full for connection {} on {}, dropping {}",
                            session.getId(), channelKey, frame.getEvent());
                        stale = addStale(stale, session);
                    }
                    case NOT_OPEN -> stale = addStale(stale, session);
                }
            }
        }

        framesDelivered.addAndGet(delivered);
        if (stale != null) {
            for (StreamingSession session : stale) {
                if (unregister(session.getId())) {
                    evictions.incrementAndGet();
                    metricsService.recordEviction();
                    log.warn("Evicted connection {} on {}", session.getId(), channelKey);
                }
            }
        }
        return delivered;
    }

    private static List<StreamingSession> addStale(List<StreamingSession> stale, StreamingSession session) {
        List<StreamingSession> list = stale != null ? stale : new ArrayList<>();
        list.add(session);
        return list;
    }

    @Override
    public void forEachOpenSession(Consumer<StreamingSession> visitor) {
        for (Bucket bucket : buckets.values()) {
            synchronized (bucket) {
                // Copy: the visitor may unregister sessions of this bucket
                for (StreamingSession session : new ArrayList<>(bucket.sessions.values())) {
                    if (!session.isOpen()) {
                        continue;
                    }
                    try {
                        visitor.accept(session);
                    } catch (RuntimeException e) {
                        log.error("Visitor failed for connection {}", session.getId(), e);
                    }
                }
            }
        }
    }

    @Override
    public Optional<StreamingSession> getSession(String connectionId) {
        return Optional.ofNullable(sessionsById.get(connectionId));
    }

    @Override
    public int countByType(ChannelType channelType) {
        int count = 0;
        for (StreamingSession session : sessionsById.values()) {
            if (session.getChannelKey().getChannelType() == channelType && session.isOpen()) {
                count++;
            }
        }
        return count;
    }

    @Override
    public ConnectionStats stats() {
        Map<String, Integer> byType = new LinkedHashMap<>();
        for (ChannelType type : ChannelType.values()) {
            byType.put(type.wireName(), 0);
        }
        Map<String, Integer> byChannel = new TreeMap<>();
        Map<String, Integer> byUser = new TreeMap<>();
        int total = 0;

        for (Bucket bucket : buckets.values()) {
            synchronized (bucket) {
                int size = bucket.sessions.size();
                if (size == 0) {
                    continue;
                }
                total += size;
                byType.merge(bucket.channelKey.getChannelType().wireName(), size, Integer::sum);
                byChannel.put(bucket.channelKey.toString(), size);
                for (StreamingSession session : bucket.sessions.values()) {
                    byUser.merge(session.getOwnerUserId(), 1, Integer::sum);
                }
            }
        }

        return ConnectionStats.builder()
            .totalConnections(total)
            .connectionsByType(Collections.unmodifiableMap(byType))
            .connectionsByChannel(Collections.unmodifiableMap(byChannel))
            .connectionsByUser(Collections.unmodifiableMap(byUser))
            .framesDelivered(framesDelivered.get())
            .framesDropped(framesDropped.get())
            .evictions(evictions.get())
            .build();
    }

    @Override
    public void addListener(ConnectionListener listener) {
        listeners.add(listener);
    }

    @Override
    public void shutdown() {
        shutdown = true;

        int closed = 0;
        for (Bucket bucket : buckets.values()) {
            List<StreamingSession> removed;
            synchronized (bucket) {
                removed = new ArrayList<>(bucket.sessions.values());
                bucket.sessions.clear();
                bucket.retired = true;
                buckets.remove(bucket.channelKey, bucket);
                for (StreamingSession session : removed) {
                    sessionsById.remove(session.getId(), session);
                    session.close();
                }
            }

            for (StreamingSession session : removed) {
                metricsService.recordSessionClosed();
                for (ConnectionListener listener : listeners) {
                    listener.onUnregistered(session);
                }
            }
            closed += removed.size();
        }

        log.info("Connection registry shut down, closed {} sessions", closed);
    }

    @Override
    public boolean isShutdown() {
        return shutdown;
    }

    /**
     * Sessions of one channel key, in registration order. Guarded by its own monitor.
     */
    private static final class Bucket {
        private final ChannelKey channelKey;
        private final Map<String, StreamingSession> sessions = new LinkedHashMap<>();
        private boolean retired;

        private Bucket(ChannelKey channelKey) {
            this.channelKey = channelKey;
        }
    }
}
