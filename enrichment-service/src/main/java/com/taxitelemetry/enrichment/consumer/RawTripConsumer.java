package com.taxitelemetry.enrichment.consumer;

import com.taxitelemetry.enrichment.service.TripEnrichmentService;
import com.taxitelemetry.shared.result.BatchResult;
import com.taxitelemetry.shared.util.KafkaTopics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Slf4j
@Component
@RequiredArgsConstructor
public class RawTripConsumer {

    static final Duration CONFIGURATION_RETRY_PAUSE = Duration.ofSeconds(30);

    private final TripEnrichmentService enrichmentService;

    @KafkaListener(
            topics = "${pipeline.enrichment.stream-name:" + KafkaTopics.TAXI_TRIP_STREAM + "}",
            groupId = "enrichment-service",
            containerFactory = "kafkaListenerContainerFactory"
    )
    public void consume(List<ConsumerRecord<String, String>> records, Acknowledgment ack) {
        List<String> messages = new ArrayList<>(records.size());
        for (ConsumerRecord<String, String> record : records) {
            messages.add(record.value());
        }

        BatchResult result = enrichmentService.enrich(messages);
        if (result.isConfigurationError()) {
            // Do NOT ack; seek back and redeliver the whole batch after a pause
            log.error("Batch of {} left unacknowledged: {}", records.size(), result.message());
            ack.nack(0, CONFIGURATION_RETRY_PAUSE);
            return;
        }
        ack.acknowledge();
    }
}
