package com.cortex.realtime.stream.cluster;

import com.cortex.realtime.core.model.ChannelKey;
import com.cortex.realtime.core.msg.FanoutEnvelope;
import com.cortex.realtime.core.msg.StreamFrame;
import com.cortex.realtime.core.msg.Topics;
import com.cortex.realtime.core.util.JsonUtils;
import com.cortex.realtime.stream.config.StreamConfig;
import com.cortex.realtime.stream.metrics.MetricsService;
import com.cortex.realtime.stream.registry.IConnectionRegistry;
import org.apache.kafka.clients.admin.AdminClient;
import org.apache.kafka.clients.admin.AdminClientConfig;
import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.errors.TopicExistsException;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.kafka.receiver.KafkaReceiver;
import reactor.kafka.receiver.ReceiverOptions;
import reactor.kafka.sender.KafkaSender;
import reactor.kafka.sender.SenderOptions;
import reactor.kafka.sender.SenderRecord;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Cross-node channel fan-out over a shared Kafka topic.
 * <p>
 * Every node publishes its channel pushes to {@link Topics#STREAM_FANOUT}, keyed by channel key,
 * and consumes the topic with a node-specific group id so that each node sees every envelope.
 * Envelopes a node published itself are skipped; it already delivered them locally.
 * </p>
 * <p>
 * Fan-out is best effort: a send failure is logged and counted, never propagated to the publisher.
 * </p>
 */
public class KafkaClusterBroadcaster implements ClusterBroadcaster {
    private static final Logger log = LoggerFactory.getLogger(KafkaClusterBroadcaster.class);

    private static final int DEFAULT_PARTITIONS = 3;
    private static final short REPLICATION_FACTOR = 1;    // 1 for dev, 3+ for prod

    private final StreamConfig config;
    private final MetricsService metricsService;
    private final FanoutReceiver receiver;

    private final KafkaSender<String, String> sender;
    private final AdminClient adminClient;
    private volatile Disposable consumer;

    public KafkaClusterBroadcaster(StreamConfig config, IConnectionRegistry registry,
                                   MetricsService metricsService) {
        this.config = config;
        this.metricsService = metricsService;
        this.receiver = new FanoutReceiver(config.getNodeId(), registry, metricsService);

        Map<String, Object> producerProps = new HashMap<>();
        producerProps.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, config.getKafkaBootstrap());
        producerProps.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        producerProps.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        // Live stream data: a lost frame is preferable to a late one
        producerProps.put(ProducerConfig.ACKS_CONFIG, "1");
        producerProps.put(ProducerConfig.LINGER_MS_CONFIG, 5);

        this.sender = KafkaSender.create(SenderOptions.create(producerProps));

        Map<String, Object> adminProps = new HashMap<>();
        adminProps.put(AdminClientConfig.BOOTSTRAP_SERVERS_CONFIG, config.getKafkaBootstrap());
        this.adminClient = AdminClient.create(adminProps);

        log.info("Kafka fan-out producer and admin client initialized ({})", config.getKafkaBootstrap());
    }

    @Override
    public Mono<Void> start() {
        String nodeId = config.getNodeId();

        return createTopicIfNotExists(Topics.STREAM_FANOUT, DEFAULT_PARTITIONS, REPLICATION_FACTOR)
            .publishOn(Schedulers.boundedElastic())
            .doOnSuccess(v -> {
                Map<String, Object> consumerProps = new HashMap<>();
                consumerProps.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, config.getKafkaBootstrap());
                consumerProps.put(ConsumerConfig.GROUP_ID_CONFIG, "stream-fanout-" + nodeId);
                consumerProps.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
                consumerProps.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
                // Frames for streams opened before this node started are of no use
                consumerProps.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "latest");
                consumerProps.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, "false");

                ReceiverOptions<String, String> receiverOptions = ReceiverOptions.<String, String>create(consumerProps)
                    .subscription(Collections.singleton(Topics.STREAM_FANOUT));

                consumer = listen(KafkaReceiver.create(receiverOptions)).subscribe();
                log.info("Node {} consuming fan-out topic {}", nodeId, Topics.STREAM_FANOUT);
            });
    }

    private Flux<Integer> listen(KafkaReceiver<String, String> kafkaReceiver) {
        return kafkaReceiver.receive()
            .map(record -> {
                try {
                    FanoutEnvelope envelope = JsonUtils.readValue(record.value(), FanoutEnvelope.class);
                    int delivered = receiver.apply(envelope);
                    record.receiverOffset().acknowledge();
                    return delivered;
                } catch (RuntimeException e) {
                    log.error("Failed to process fan-out envelope at offset {}", record.offset(), e);
                    record.receiverOffset().acknowledge(); // Skip bad messages
                    return 0;
                }
            })
            .onErrorContinue((err, obj) -> log.error("Error in fan-out consumer loop", err));
    }

    @Override
    public Mono<Void> broadcast(ChannelKey channelKey, StreamFrame frame) {
        return Mono.defer(() -> {
                FanoutEnvelope envelope = envelope(config.getNodeId(), channelKey, frame);

                ProducerRecord<String, String> record = new ProducerRecord<>(
                    Topics.STREAM_FANOUT,
                    channelKey.toString(),  // Same channel, same partition: preserves order per channel
                    JsonUtils.writeValueAsString(envelope)
                );
                return sender.send(Mono.just(SenderRecord.create(record, null))).then();
            })
            .doOnSuccess(v -> metricsService.recordFanoutPublished())
            .onErrorResume(err -> {
                log.warn("Failed to publish fan-out for {} ({}): {}", channelKey, frame.getEvent(), err.getMessage(), err);
                return Mono.empty();
            });
    }

    static FanoutEnvelope envelope(String originNodeId, ChannelKey channelKey, StreamFrame frame) {
        return FanoutEnvelope.builder()
            .originNodeId(originNodeId)
            .channelType(channelKey.getChannelType())
            .resourceId(channelKey.getResourceId())
            .frame(frame)
            .build();
    }

    /**
     * Creates a Kafka topic if it doesn't already exist. Idempotent.
     */
    private Mono<Void> createTopicIfNotExists(String topicName, int partitions, short replicationFactor) {
        return Mono.fromFuture(() -> adminClient.listTopics().names().toCompletionStage().toCompletableFuture())
            .flatMap(names -> {
                if (names.contains(topicName)) {
                    return Mono.empty();
                }

                return Mono.fromFuture(() -> {
                    log.info("Creating Kafka topic: {} (partitions={}, replication={})",
                        topicName, partitions, replicationFactor);
                    return adminClient.createTopics(Collections.singleton(new NewTopic(topicName, partitions, replicationFactor)))
                        .all()
                        .toCompletionStage()
                        .toCompletableFuture();
                });
            })
            .onErrorResume(error -> {
                if (error.getCause() instanceof TopicExistsException || error instanceof TopicExistsException) {
                    log.info("Kafka topic already exists: {}", topicName);
                    return Mono.empty();
                }
                log.error("Failed to create Kafka topic {}: {}", topicName, error.getMessage(), error);
                return Mono.error(error);
            })
            .then();
    }

    @Override
    public Mono<Void> stop() {
        Disposable current = consumer;
        if (current != null) {
            current.dispose();
        }
        sender.close();
        adminClient.close();
        log.info("Kafka fan-out stopped");
        return Mono.empty();
    }
}
