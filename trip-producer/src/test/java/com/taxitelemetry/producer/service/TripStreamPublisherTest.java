package com.taxitelemetry.producer.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.taxitelemetry.producer.config.ProducerSettings;
import com.taxitelemetry.producer.csv.TripCsvReader;
import com.taxitelemetry.producer.metrics.ProducerMetrics;
import com.taxitelemetry.shared.events.TripStreamEnvelope;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.apache.kafka.common.KafkaException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TripStreamPublisherTest {

    private static final String STREAM = "taxi-trip-stream";
    private static final String HEADER =
            "trip_id,taxi_id,pickup_datetime,pickup_lat,pickup_long,drop_lat,drop_long,distance_km,zone_name";

    @Mock private KafkaTemplate<String, String> kafkaTemplate;

    @TempDir Path dir;

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
    private TripStreamPublisher publisher;

    @BeforeEach
    void setUp() {
        ProducerSettings settings = new ProducerSettings();
        settings.setRegion("ap-south-1");
        settings.setBatchPauseMs(0);
        publisher = new TripStreamPublisher(kafkaTemplate, objectMapper, new TripCsvReader(),
                new TripRowNormalizer(), new ProducerMetrics(new SimpleMeterRegistry()), settings);
    }

    private Path csvWithTrips(int count) throws Exception {
        List<String> lines = new ArrayList<>();
        lines.add(HEADER);
        for (int i = 1; i <= count; i++) {
            lines.add("T" + i + ",X1,2024-01-01T08:00:00,12.9,77.6,12.95,77.65,8.2,Downtown");
        }
        Path csv = dir.resolve("trips.csv");
        Files.write(csv, lines);
        return csv;
    }

    private static CompletableFuture<SendResult<String, String>> delivered() {
        return CompletableFuture.completedFuture(null);
    }

    @Test
    @DisplayName("250 rows with batch size 100 go out as 100 + 100 + 50, every row keyed by trip_id")
    void sendAll_batchesAndFlushesTail() throws Exception {
        when(kafkaTemplate.send(eq(STREAM), anyString(), anyString())).thenReturn(delivered());

        ProducerRunSummary summary = publisher.sendAll(csvWithTrips(250), STREAM, 100);

        assertThat(summary.status()).isEqualTo(ProducerRunSummary.Status.COMPLETED);
        assertThat(summary.rowsRead()).isEqualTo(250);
        assertThat(summary.sent()).isEqualTo(250);
        assertThat(summary.batches()).isEqualTo(3);
        verify(kafkaTemplate).send(eq(STREAM), eq("T1"), anyString());
        verify(kafkaTemplate).send(eq(STREAM), eq("T250"), anyString());
        verify(kafkaTemplate, times(250)).send(eq(STREAM), anyString(), anyString());
    }

    @Test
    @DisplayName("Envelope data decodes back to the typed trip JSON")
    void sendAll_wrapsRecordInEnvelope() throws Exception {
        when(kafkaTemplate.send(eq(STREAM), anyString(), anyString())).thenReturn(delivered());

        publisher.sendAll(csvWithTrips(1), STREAM, 100);

        ArgumentCaptor<String> value = ArgumentCaptor.forClass(String.class);
        verify(kafkaTemplate).send(eq(STREAM), eq("T1"), value.capture());
        TripStreamEnvelope envelope = objectMapper.readValue(value.getValue(), TripStreamEnvelope.class);
        assertThat(envelope.getPartitionKey()).isEqualTo("T1");
        assertThat(envelope.getRegion()).isEqualTo("ap-south-1");

        JsonNode trip = objectMapper.readTree(new String(envelope.decodeData(), StandardCharsets.UTF_8));
        assertThat(trip.get("trip_id").asText()).isEqualTo("T1");
        assertThat(trip.get("distance_km").asDouble()).isEqualTo(8.2);
        assertThat(trip.get("pickup_long").asDouble()).isEqualTo(77.6);
    }

    @Test
    @DisplayName("Rows missing pickup_datetime are skipped and never published")
    void sendAll_skipsInadmissibleRows() throws Exception {
        Path csv = dir.resolve("trips.csv");
        Files.write(csv, List.of(HEADER,
                "T1,X1,2024-01-01T08:00:00,12.9,77.6,12.95,77.65,8.2,Downtown",
                "T2,X1,,12.9,77.6,12.95,77.65,8.2,Downtown"));
        when(kafkaTemplate.send(eq(STREAM), anyString(), anyString())).thenReturn(delivered());

        ProducerRunSummary summary = publisher.sendAll(csv, STREAM, 100);

        assertThat(summary.skipped()).isEqualTo(1);
        assertThat(summary.sent()).isEqualTo(1);
        verify(kafkaTemplate, times(1)).send(eq(STREAM), anyString(), anyString());
    }

    @Test
    @DisplayName("Missing source file sends nothing and reports SOURCE_NOT_FOUND")
    void sendAll_missingSource() {
        ProducerRunSummary summary = publisher.sendAll(dir.resolve("absent.csv"), STREAM, 100);

        assertThat(summary.status()).isEqualTo(ProducerRunSummary.Status.SOURCE_NOT_FOUND);
        assertThat(summary.succeeded()).isFalse();
        verifyNoInteractions(kafkaTemplate);
    }

    @Test
    @DisplayName("Records the broker refuses are counted as failed; the rest of the batch is sent")
    void sendAll_partialBatchFailure() throws Exception {
        when(kafkaTemplate.send(eq(STREAM), anyString(), anyString())).thenReturn(delivered());
        when(kafkaTemplate.send(eq(STREAM), eq("T2"), anyString()))
                .thenReturn(CompletableFuture.failedFuture(new KafkaException("record too large")));

        ProducerRunSummary summary = publisher.sendAll(csvWithTrips(3), STREAM, 100);

        assertThat(summary.sent()).isEqualTo(2);
        assertThat(summary.failed()).isEqualTo(1);
        assertThat(summary.status()).isEqualTo(ProducerRunSummary.Status.COMPLETED);
    }

    @Test
    @DisplayName("A batch the client rejects outright is dropped whole; later batches still go out")
    void sendAll_wholeBatchFailure() throws Exception {
        when(kafkaTemplate.send(eq(STREAM), anyString(), anyString())).thenReturn(delivered());
        when(kafkaTemplate.send(eq(STREAM), eq("T1"), anyString())).thenThrow(new KafkaException("broker down"));

        ProducerRunSummary summary = publisher.sendAll(csvWithTrips(4), STREAM, 2);

        assertThat(summary.batches()).isEqualTo(2);
        assertThat(summary.failed()).isEqualTo(2);
        assertThat(summary.sent()).isEqualTo(2);
    }
}
