package com.taxitelemetry.fare.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.taxitelemetry.fare.config.FareSettings;
import com.taxitelemetry.fare.entity.TripRecordEntity;
import com.taxitelemetry.fare.exception.TripDecodeException;
import com.taxitelemetry.fare.metrics.FareMetrics;
import com.taxitelemetry.fare.repository.TripRecordRepository;
import com.taxitelemetry.fare.sink.AnalyticsSinkPublisher;
import com.taxitelemetry.shared.deadletter.DeadLetterPublisher;
import com.taxitelemetry.shared.model.TripRecord;
import com.taxitelemetry.shared.result.BatchResult;
import com.taxitelemetry.shared.result.RecordOutcome;
import com.taxitelemetry.shared.util.NumericParsing;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.taxitelemetry.shared.model.TripFields.TRIP_ID;

/**
 * Finalizes queued trips: validate → default → fare and total → store row → analytics copy.
 *
 * Per record:
 *   undecodable or invalid       → rejected, nothing written
 *   fare or total not computable → failed, nothing written
 *   store write fails            → failed, analytics copy skipped
 *   analytics write fails        → failed, the stored row stays
 * No outcome stops the batch. Rejected and failed messages go to the dead-letter
 * topic when one is configured.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TripFinalizationService {

    private static final TypeReference<LinkedHashMap<String, Object>> TRIP_MAP = new TypeReference<>() {};

    private final ObjectMapper objectMapper;
    private final TripValidator validator;
    private final TripRecordReader reader;
    private final TripDefaults defaults;
    private final FareCalculatorService fareCalculator;
    private final TripRecordRepository repository;
    private final AnalyticsSinkPublisher analyticsSink;
    private final DeadLetterPublisher deadLetters;
    private final FareSettings settings;
    private final FareMetrics metrics;

    public BatchResult finalizeBatch(List<String> messages) {
        List<String> missing = settings.missing();
        if (!missing.isEmpty()) {
            log.error("Fare stage not configured, {} records left unprocessed; missing {}", messages.size(), missing);
            return BatchResult.configurationError(messages.size(), missing);
        }

        List<RecordOutcome> outcomes = new ArrayList<>(messages.size());
        for (String message : messages) {
            RecordOutcome outcome = finalizeOne(message);
            if (!outcome.isProcessed()) {
                deadLetters.forward(settings.getDeadLetterTopic(), outcome.tripId(), message, outcome.reason());
            }
            outcomes.add(outcome);
        }

        BatchResult result = BatchResult.of(outcomes);
        log.info("Batch complete: processed={} failed={} total={}", result.processed(), result.failed(), result.total());
        return result;
    }

    RecordOutcome finalizeOne(String message) {
        Map<String, Object> trip;
        try {
            trip = parse(message);
        } catch (TripDecodeException e) {
            log.warn("Skipping undecodable message [{}]: {}", e.getCode(), e.getMessage());
            metrics.recordRejected();
            return RecordOutcome.rejected(null, e.getMessage());
        }

        Object rawTripId = trip.get(TRIP_ID);
        String tripId = rawTripId == null ? null : rawTripId.toString();

        ValidationResult validation = validator.validate(trip);
        if (!validation.valid()) {
            log.warn("Validation failed for trip {}: {}", tripId, validation.error());
            metrics.recordRejected();
            return RecordOutcome.rejected(tripId, validation.error());
        }

        TripRecord record;
        BigDecimal fare;
        try {
            record = defaults.apply(reader.read(trip));
            fare = fareCalculator.calculate(NumericParsing.exact(record.getDistanceKm()), record.getZoneName());
            record.setFareAmount(fare);
            record.setTotalAmount(fareCalculator.total(
                    fare, record.getExtraCharges(), record.getTipAmount(), record.getTollsAmount()));
        } catch (RuntimeException e) {
            log.error("Fare calculation failed for trip {}: {}", tripId, e.getMessage(), e);
            metrics.recordFailed();
            return RecordOutcome.failed(tripId, "fare calculation failed: " + e.getMessage());
        }

        try {
            repository.save(TripRecordEntity.fromRecord(record));
        } catch (Exception e) {
            log.error("Store write failed for trip {}: {}", tripId, e.getMessage(), e);
            metrics.recordFailed();
            return RecordOutcome.failed(tripId, "store write failed: " + e.getMessage());
        }

        try {
            analyticsSink.publish(settings.getAnalyticsTopic(), record);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Interrupted while writing analytics copy for trip {}", tripId, e);
            metrics.recordFailed();
            return RecordOutcome.failed(tripId, "analytics write interrupted");
        } catch (Exception e) {
            log.error("Analytics write failed for trip {}: {}", tripId, e.getMessage(), e);
            metrics.recordFailed();
            return RecordOutcome.failed(tripId, "analytics write failed: " + e.getMessage());
        }

        log.info("Successfully processed Trip ID {} fare={} total={}", tripId, fare, record.getTotalAmount());
        metrics.recordProcessed(record.getTotalAmount());
        return RecordOutcome.processed(tripId);
    }

    private Map<String, Object> parse(String message) {
        if (message == null) {
            throw new TripDecodeException("EMPTY_MESSAGE", "Message has no body", null);
        }
        try {
            Map<String, Object> trip = objectMapper.readValue(message, TRIP_MAP);
            if (trip == null) {
                throw new TripDecodeException("MALFORMED_TRIP", "Message body is null", null);
            }
            return trip;
        } catch (JsonProcessingException e) {
            throw new TripDecodeException("MALFORMED_TRIP", "Message body is not a JSON object: " + e.getOriginalMessage(), e);
        }
    }
}
