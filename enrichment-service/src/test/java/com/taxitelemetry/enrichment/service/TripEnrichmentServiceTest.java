package com.taxitelemetry.enrichment.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.taxitelemetry.enrichment.config.EnrichmentSettings;
import com.taxitelemetry.enrichment.geocoding.PlaceCandidate;
import com.taxitelemetry.enrichment.geocoding.PlaceSearchRequest;
import com.taxitelemetry.enrichment.geocoding.ReverseGeocoder;
import com.taxitelemetry.enrichment.metrics.EnrichmentMetrics;
import com.taxitelemetry.shared.deadletter.DeadLetterPublisher;
import com.taxitelemetry.shared.events.TripStreamEnvelope;
import com.taxitelemetry.shared.result.BatchResult;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.apache.kafka.common.KafkaException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Enrichment stage: decode → reverse geocode pickup point → attach zone_name → publish to queue.
 */
@ExtendWith(MockitoExtension.class)
class TripEnrichmentServiceTest {

    private static final String QUEUE = "taxi-trip-enriched";

    @Mock private ReverseGeocoder geocoder;
    @Mock private KafkaTemplate<String, String> kafkaTemplate;
    @Mock private DeadLetterPublisher deadLetters;

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
    private EnrichmentSettings settings;
    private TripEnrichmentService service;

    @BeforeEach
    void setUp() {
        settings = new EnrichmentSettings();
        settings.setPlaceIndexName("city-places");
        settings.setQueueTopic(QUEUE);
        settings.setRegion("ap-south-1");
        settings.setDeadLetterTopic("");
        service = new TripEnrichmentService(new TripEnvelopeDecoder(objectMapper), geocoder, kafkaTemplate,
                deadLetters, objectMapper, settings, new EnrichmentMetrics(new SimpleMeterRegistry()));
    }

    private String message(String tripJson) throws Exception {
        return objectMapper.writeValueAsString(
                TripStreamEnvelope.wrap("T", tripJson.getBytes(StandardCharsets.UTF_8), "ap-south-1"));
    }

    private static String trip(String tripId) {
        return "{\"trip_id\":\"" + tripId + "\",\"taxi_id\":\"X9\",\"pickup_datetime\":\"2024-01-01T08:00:00\","
                + "\"pickup_lat\":12.9,\"pickup_long\":77.6,\"drop_lat\":12.95,\"drop_long\":77.65,"
                + "\"distance_km\":8.2,\"zone_name\":\"\",\"dropoff_datetime\":\"2024-01-01T08:30:00\"}";
    }

    private void queueAccepts() {
        CompletableFuture<SendResult<String, String>> sent = CompletableFuture.completedFuture(null);
        when(kafkaTemplate.send(eq(QUEUE), anyString(), anyString())).thenReturn(sent);
    }

    private JsonNode published(String tripId) throws Exception {
        ArgumentCaptor<String> body = ArgumentCaptor.forClass(String.class);
        verify(kafkaTemplate).send(eq(QUEUE), eq(tripId), body.capture());
        return objectMapper.readTree(body.getValue());
    }

    @Test
    @DisplayName("Nearest place label becomes zone_name; other attributes pass through unchanged")
    void enrich_attachesZone() throws Exception {
        queueAccepts();
        when(geocoder.searchPlaceIndexForPosition(PlaceSearchRequest.bestMatch("city-places", 77.6, 12.9)))
                .thenReturn(List.of(new PlaceCandidate("Downtown Plaza", 0.3)));

        BatchResult result = service.enrich(List.of(message(trip("T1"))));

        assertThat(result.processed()).isEqualTo(1);
        JsonNode enriched = published("T1");
        assertThat(enriched.get("zone_name").asText()).isEqualTo("Downtown Plaza");
        assertThat(enriched.get("distance_km").asDouble()).isEqualTo(8.2);
        assertThat(enriched.get("dropoff_datetime").asText()).isEqualTo("2024-01-01T08:30:00");
    }

    @Test
    @DisplayName("Empty geocoding result gives zone_name \"Unknown\"")
    void enrich_unknownZone() throws Exception {
        queueAccepts();
        when(geocoder.searchPlaceIndexForPosition(any())).thenReturn(List.of());

        service.enrich(List.of(message(trip("T1"))));

        assertThat(published("T1").get("zone_name").asText()).isEqualTo("Unknown");
    }

    @Test
    @DisplayName("Legacy longitude/latitude are used when the pickup pair is absent")
    void enrich_legacyCoordinates() throws Exception {
        queueAccepts();
        when(geocoder.searchPlaceIndexForPosition(PlaceSearchRequest.bestMatch("city-places", 77.5, 13.0)))
                .thenReturn(List.of(new PlaceCandidate("Hebbal", 1.2)));

        service.enrich(List.of(message("{\"trip_id\":\"T7\",\"latitude\":\"13.0\",\"longitude\":77.5}")));

        assertThat(published("T7").get("zone_name").asText()).isEqualTo("Hebbal");
    }

    @Test
    @DisplayName("Undecodable message is skipped and offered to the dead-letter publisher; the batch continues")
    void enrich_decodeFailureIsolated() throws Exception {
        queueAccepts();
        when(geocoder.searchPlaceIndexForPosition(any())).thenReturn(List.of(new PlaceCandidate("MG Road", 0.1)));

        BatchResult result = service.enrich(List.of("garbage", message(trip("T2"))));

        assertThat(result.processed()).isEqualTo(1);
        assertThat(result.failed()).isEqualTo(1);
        assertThat(result.total()).isEqualTo(2);
        verify(deadLetters).forward(eq(""), isNull(), eq("garbage"), eq("MALFORMED_ENVELOPE"));
        published("T2");
    }

    @Test
    @DisplayName("Geocoder failure for one trip does not stop the next")
    void enrich_geocoderFailureIsolated() throws Exception {
        queueAccepts();
        when(geocoder.searchPlaceIndexForPosition(any()))
                .thenThrow(new IllegalStateException("index unavailable"))
                .thenReturn(List.of(new PlaceCandidate("Koramangala", 0.5)));

        BatchResult result = service.enrich(List.of(message(trip("T1")), message(trip("T2"))));

        assertThat(result.processed()).isEqualTo(1);
        assertThat(result.failed()).isEqualTo(1);
        verify(kafkaTemplate, never()).send(eq(QUEUE), eq("T1"), anyString());
        assertThat(published("T2").get("zone_name").asText()).isEqualTo("Koramangala");
    }

    @Test
    @DisplayName("Failed queue publish is counted as a failure for that trip")
    void enrich_publishFailureCounted() throws Exception {
        when(geocoder.searchPlaceIndexForPosition(any())).thenReturn(List.of());
        CompletableFuture<SendResult<String, String>> refused = CompletableFuture.failedFuture(new KafkaException("timeout"));
        when(kafkaTemplate.send(eq(QUEUE), anyString(), anyString())).thenReturn(refused);

        BatchResult result = service.enrich(List.of(message(trip("T1"))));

        assertThat(result.processed()).isZero();
        assertThat(result.failed()).isEqualTo(1);
    }

    @Test
    @DisplayName("Trip without usable pickup coordinates is rejected without a lookup")
    void enrich_missingCoordinates() throws Exception {
        BatchResult result = service.enrich(List.of(message("{\"trip_id\":\"T3\",\"pickup_lat\":\"abc\"}")));

        assertThat(result.failed()).isEqualTo(1);
        verifyNoInteractions(geocoder, kafkaTemplate);
    }

    @Test
    @DisplayName("Missing place index name is a configuration error; nothing is processed")
    void enrich_configurationError() throws Exception {
        settings.setPlaceIndexName("");

        BatchResult result = service.enrich(List.of(message(trip("T1"))));

        assertThat(result.isConfigurationError()).isTrue();
        assertThat(result.processed()).isZero();
        verifyNoInteractions(geocoder, kafkaTemplate, deadLetters);
    }
}
