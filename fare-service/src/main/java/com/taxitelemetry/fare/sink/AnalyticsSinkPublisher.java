package com.taxitelemetry.fare.sink;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.taxitelemetry.shared.model.TripRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.util.concurrent.ExecutionException;

import static com.taxitelemetry.shared.model.TripFields.*;

/**
 * Appends finalized trips to the analytics topic as newline-terminated JSON.
 *
 * Document = the finalized record plus warehouse column aliases, each set only when
 * the record does not already carry that name:
 *   dropoff_datetime  → null
 *   pickup_latitude   → pickup_lat
 *   pickup_longitude  → pickup_long
 *   dropoff_latitude  → drop_lat
 *   dropoff_longitude → drop_long
 *
 * Batching is left to the Kafka producer (linger.ms / batch.size).
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AnalyticsSinkPublisher {

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;

    public void publish(String topic, TripRecord record)
            throws JsonProcessingException, ExecutionException, InterruptedException {
        kafkaTemplate.send(topic, record.getTripId(), toAnalyticsLine(record)).get();
        log.debug("Analytics copy appended trip={} topic={}", record.getTripId(), topic);
    }

    public String toAnalyticsLine(TripRecord record) throws JsonProcessingException {
        ObjectNode document = objectMapper.valueToTree(record);
        if (!document.has(DROPOFF_DATETIME)) {
            document.putNull(DROPOFF_DATETIME);
        }
        aliasIfAbsent(document, PICKUP_LATITUDE, PICKUP_LAT);
        aliasIfAbsent(document, PICKUP_LONGITUDE, PICKUP_LONG);
        aliasIfAbsent(document, DROPOFF_LATITUDE, DROP_LAT);
        aliasIfAbsent(document, DROPOFF_LONGITUDE, DROP_LONG);
        return objectMapper.writeValueAsString(document) + "\n";
    }

    private static void aliasIfAbsent(ObjectNode document, String alias, String source) {
        if (document.has(alias)) {
            return;
        }
        JsonNode value = document.get(source);
        if (value == null) {
            document.putNull(alias);
        } else {
            document.set(alias, value.deepCopy());
        }
    }
}
