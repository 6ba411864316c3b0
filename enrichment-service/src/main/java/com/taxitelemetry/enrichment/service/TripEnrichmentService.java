package com.taxitelemetry.enrichment.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.taxitelemetry.enrichment.config.EnrichmentSettings;
import com.taxitelemetry.enrichment.exception.MissingCoordinatesException;
import com.taxitelemetry.enrichment.exception.TripDecodeException;
import com.taxitelemetry.enrichment.geocoding.PlaceCandidate;
import com.taxitelemetry.enrichment.geocoding.PlaceSearchRequest;
import com.taxitelemetry.enrichment.geocoding.ReverseGeocoder;
import com.taxitelemetry.enrichment.metrics.EnrichmentMetrics;
import com.taxitelemetry.shared.deadletter.DeadLetterPublisher;
import com.taxitelemetry.shared.result.BatchResult;
import com.taxitelemetry.shared.result.RecordOutcome;
import com.taxitelemetry.shared.util.NumericParsing;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static com.taxitelemetry.shared.model.TripFields.*;

/**
 * Attaches a zone to each trip on the stream and forwards it to the work queue.
 *
 * The zone is the label of the single nearest place to the pickup point in the
 * configured place index, or "Unknown" when nothing is in range. The pickup point is
 * pickup_long/pickup_lat, or the legacy longitude/latitude pair when those are absent.
 *
 * Records are handled one at a time; a bad or failing record is logged and counted
 * and never stops the rest of the batch.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TripEnrichmentService {

    private final TripEnvelopeDecoder decoder;
    private final ReverseGeocoder geocoder;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final DeadLetterPublisher deadLetters;
    private final ObjectMapper objectMapper;
    private final EnrichmentSettings settings;
    private final EnrichmentMetrics metrics;

    public BatchResult enrich(List<String> messages) {
        List<String> missing = settings.missing();
        if (!missing.isEmpty()) {
            log.error("Enrichment stage not configured, {} records left unprocessed; missing {}", messages.size(), missing);
            return BatchResult.configurationError(messages.size(), missing);
        }

        List<RecordOutcome> outcomes = new ArrayList<>(messages.size());
        for (String message : messages) {
            outcomes.add(enrichOne(message));
        }
        BatchResult result = BatchResult.of(outcomes);
        log.info("Successfully processed {} records ({} failed, {} received)",
                result.processed(), result.failed(), result.total());
        return result;
    }

    RecordOutcome enrichOne(String message) {
        ObjectNode trip;
        try {
            trip = decoder.decode(message);
        } catch (TripDecodeException e) {
            log.warn("Skipping undecodable record [{}]: {}", e.getCode(), e.getMessage());
            metrics.recordRejected();
            deadLetters.forward(settings.getDeadLetterTopic(), null, message, e.getCode());
            return RecordOutcome.rejected(null, e.getMessage());
        }

        String tripId = trip.path(TRIP_ID).asText("");
        if (tripId.isBlank()) {
            log.warn("Skipping record without trip_id");
            metrics.recordRejected();
            return RecordOutcome.rejected(null, "missing trip_id");
        }

        try {
            String zone = lookupZone(tripId, trip);
            trip.put(ZONE_NAME, zone);
            kafkaTemplate.send(settings.getQueueTopic(), tripId, objectMapper.writeValueAsString(trip)).get();

            log.info("Enriched trip={} zone={}", tripId, zone);
            metrics.recordProcessed();
            return RecordOutcome.processed(tripId);

        } catch (MissingCoordinatesException e) {
            log.warn("Skipping trip={}: {}", tripId, e.getMessage());
            metrics.recordRejected();
            return RecordOutcome.rejected(tripId, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Interrupted while publishing trip={}", tripId, e);
            metrics.recordFailed();
            return RecordOutcome.failed(tripId, "interrupted");
        } catch (Exception e) {
            log.error("Error processing trip {}: {}", tripId, e.getMessage(), e);
            metrics.recordFailed();
            return RecordOutcome.failed(tripId, e.getMessage());
        }
    }

    private String lookupZone(String tripId, ObjectNode trip) {
        double[] point = pickupPoint(tripId, trip);
        PlaceSearchRequest request = PlaceSearchRequest.bestMatch(settings.getPlaceIndexName(), point[0], point[1]);

        Timer.Sample sample = Timer.start();
        List<PlaceCandidate> places;
        try {
            places = geocoder.searchPlaceIndexForPosition(request);
        } finally {
            sample.stop(metrics.getGeocodeTimer());
        }

        if (places == null || places.isEmpty()) {
            metrics.recordUnknownZone();
            return UNKNOWN_ZONE;
        }
        return places.get(0).label();
    }

    /** {longitude, latitude} */
    private double[] pickupPoint(String tripId, ObjectNode trip) {
        JsonNode lon = trip.get(PICKUP_LONG);
        JsonNode lat = trip.get(PICKUP_LAT);
        if (isAbsent(lon) || isAbsent(lat)) {
            lon = trip.get(LONGITUDE);
            lat = trip.get(LATITUDE);
        }
        Optional<BigDecimal> longitude = NumericParsing.tryDecimal(scalar(lon));
        Optional<BigDecimal> latitude = NumericParsing.tryDecimal(scalar(lat));
        if (longitude.isEmpty() || latitude.isEmpty()) {
            throw new MissingCoordinatesException(tripId, "no numeric pickup coordinates");
        }
        return new double[] { longitude.get().doubleValue(), latitude.get().doubleValue() };
    }

    private static boolean isAbsent(JsonNode node) {
        return node == null || node.isNull();
    }

    private static Object scalar(JsonNode node) {
        if (isAbsent(node)) {
            return null;
        }
        if (node.isNumber()) {
            return node.decimalValue();
        }
        return node.isTextual() ? node.asText() : null;
    }
}
