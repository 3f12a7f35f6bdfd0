package me.matthew.flink.csmoneyscraper.sink;

import dev.failsafe.Failsafe;
import dev.failsafe.RetryPolicy;
import lombok.extern.slf4j.Slf4j;
import me.matthew.flink.csmoneyscraper.config.KafkaConfiguration;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.common.KafkaException;

import java.time.Duration;
import java.util.Properties;
import java.util.function.Supplier;

/**
 * Establishes a Kafka producer connection with a bounded number of retries.
 * A connection counts as established once the producer can fetch metadata for the target topic.
 */
@Slf4j
public class KafkaProducerConnector {

    /**
     * Connects using the environment configuration.
     *
     * @return a connected producer
     * @throws IllegalArgumentException if required Kafka configuration is missing
     * @throws KafkaException if the broker stays unreachable after all retries
     */
    public static Producer<String, String> connect() {
        Properties properties = KafkaConfiguration.getAllProducerProperties();
        return connect(() -> new KafkaProducer<>(properties),
                KafkaConfiguration.getKafkaTopic(),
                KafkaConfiguration.getConnectMaxRetries(),
                Duration.ofMillis(KafkaConfiguration.getConnectRetryDelayMs()));
    }

    /**
     * Creates producers until one can see the topic, waiting {@code retryDelay} between attempts.
     * Producers from failed attempts are closed.
     *
     * @param producerFactory creates a fresh producer per attempt
     * @param topic topic the producer must be able to see
     * @param maxRetries retries after the first attempt
     * @param retryDelay fixed delay between attempts
     * @return a connected producer
     * @throws KafkaException the last connection error once retries are exhausted
     */
    public static Producer<String, String> connect(Supplier<Producer<String, String>> producerFactory,
                                                   String topic,
                                                   int maxRetries,
                                                   Duration retryDelay) {
        RetryPolicy<Producer<String, String>> retryPolicy = RetryPolicy.<Producer<String, String>>builder()
                .handle(KafkaException.class)
                .withDelay(retryDelay)
                .withMaxRetries(maxRetries)
                .onRetry(e -> log.warn("Failed to connect to Kafka (attempt {}/{}). Retrying in {} ms: {}",
                        e.getAttemptCount(),
                        maxRetries,
                        retryDelay.toMillis(),
                        e.getLastException().getMessage()))
                .onRetriesExceeded(e -> log.error("Failed to connect to Kafka after {} attempts: {}",
                        e.getAttemptCount(),
                        e.getException().getMessage()))
                .build();

        return Failsafe.with(retryPolicy).get(() -> attemptConnect(producerFactory, topic));
    }

    private static Producer<String, String> attemptConnect(Supplier<Producer<String, String>> producerFactory,
                                                           String topic) {
        Producer<String, String> producer = producerFactory.get();
        try {
            int partitions = producer.partitionsFor(topic).size();
            log.info("Connected to Kafka, topic '{}' has {} partitions", topic, partitions);
            return producer;
        } catch (KafkaException e) {
            producer.close(Duration.ZERO);
            throw e;
        }
    }
}
