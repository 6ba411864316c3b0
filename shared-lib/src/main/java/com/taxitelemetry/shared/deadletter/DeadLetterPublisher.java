package com.taxitelemetry.shared.deadletter;

import com.taxitelemetry.shared.util.KafkaTopics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.springframework.kafka.core.KafkaTemplate;

import java.nio.charset.StandardCharsets;

/**
 * Forwards a message a stage gave up on to that stage's dead-letter topic, verbatim,
 * with the reason in the {@code dlq-reason} header. A blank topic means dead-lettering
 * is off for the stage and the message is only logged.
 *
 * Forwarding is best effort: a failed send is logged and reported as {@code false},
 * never thrown into the batch.
 */
@Slf4j
@RequiredArgsConstructor
public class DeadLetterPublisher {

    private final KafkaTemplate<String, String> kafkaTemplate;

    public boolean forward(String topic, String key, String payload, String reason) {
        if (topic == null || topic.isBlank()) {
            log.warn("Dropping message key={} ({}): no dead-letter topic configured", key, reason);
            return false;
        }
        ProducerRecord<String, String> record = new ProducerRecord<>(topic, key, payload);
        record.headers().add(KafkaTopics.DEAD_LETTER_REASON_HEADER, reason.getBytes(StandardCharsets.UTF_8));
        try {
            kafkaTemplate.send(record).get();
            log.info("Dead-lettered key={} to {}: {}", key, topic, reason);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Interrupted while dead-lettering key={} to {}", key, topic, e);
            return false;
        } catch (Exception e) {
            log.error("Failed to dead-letter key={} to {}: {}", key, topic, e.getMessage(), e);
            return false;
        }
    }
}
