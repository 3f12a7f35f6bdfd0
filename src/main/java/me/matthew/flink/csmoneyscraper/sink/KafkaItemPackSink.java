package me.matthew.flink.csmoneyscraper.sink;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import me.matthew.flink.csmoneyscraper.model.CsmoneyItemPack;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.KafkaException;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.ExecutionException;

/**
 * Publishes item batches as JSON messages to a Kafka topic.
 * Each {@link #put} waits for the broker acknowledgement so failures reach the caller.
 */
@Slf4j
public class KafkaItemPackSink implements CsmoneyItemSink, AutoCloseable {

    private final Producer<String, String> producer;
    private final String topic;
    private final ObjectMapper objectMapper;

    public KafkaItemPackSink(Producer<String, String> producer, String topic) {
        if (producer == null) {
            throw new IllegalArgumentException("Kafka producer cannot be null");
        }
        if (topic == null || topic.trim().isEmpty()) {
            throw new IllegalArgumentException("Kafka topic cannot be null or empty");
        }
        this.producer = producer;
        this.topic = topic.trim();
        this.objectMapper = createObjectMapper();
    }

    static ObjectMapper createObjectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Override
    public void put(CsmoneyItemPack pack) throws IOException, InterruptedException {
        String json;
        try {
            json = objectMapper.writeValueAsString(pack);
        } catch (JsonProcessingException e) {
            throw new IOException("Failed to serialize item pack", e);
        }

        try {
            RecordMetadata metadata = producer.send(new ProducerRecord<>(topic, json)).get();
            log.info("Published {} items to {}-{}@{}", pack.getItems().size(),
                    metadata.topic(), metadata.partition(), metadata.offset());
        } catch (ExecutionException e) {
            log.error("Failed to publish item pack to topic {}: {}", topic, e.getCause().getMessage());
            throw new IOException("Failed to publish item pack to topic " + topic, e.getCause());
        } catch (KafkaException e) {
            log.error("Kafka producer rejected item pack for topic {}: {}", topic, e.getMessage());
            throw new IOException("Failed to publish item pack to topic " + topic, e);
        }
    }

    @Override
    public void close() {
        producer.close(Duration.ofSeconds(10));
    }
}
