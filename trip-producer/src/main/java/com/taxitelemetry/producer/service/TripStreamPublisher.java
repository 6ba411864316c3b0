package com.taxitelemetry.producer.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.taxitelemetry.producer.config.ProducerSettings;
import com.taxitelemetry.producer.csv.TripCsvReader;
import com.taxitelemetry.producer.metrics.ProducerMetrics;
import com.taxitelemetry.shared.events.TripStreamEnvelope;
import com.taxitelemetry.shared.model.TripRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * Reads trip rows from a CSV file and publishes them to the trip stream in bulk.
 *
 * Each admitted row is wrapped in a TripStreamEnvelope keyed by trip_id. Rows are
 * buffered up to batchSize; every full batch is sent, awaited, and followed by a
 * short pause. The trailing partial batch is flushed at end of input.
 *
 * A batch that cannot be handed to the client at all is logged with its size and
 * dropped. Individual records the broker refuses are counted and reported as a
 * warning for the batch. Nothing is retried.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TripStreamPublisher {

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final TripCsvReader csvReader;
    private final TripRowNormalizer normalizer;
    private final ProducerMetrics metrics;
    private final ProducerSettings settings;

    public ProducerRunSummary sendAll(Path sourcePath, String streamName, int batchSize) {
        if (!Files.isRegularFile(sourcePath)) {
            log.error("File not found: {}", sourcePath);
            metrics.recordSourceMissing();
            return ProducerRunSummary.sourceNotFound();
        }

        Tally tally = new Tally();
        List<TripRecord> buffer = new ArrayList<>(batchSize);
        ProducerRunSummary.Status status = ProducerRunSummary.Status.COMPLETED;

        try (MappingIterator<Map<String, String>> rows = csvReader.open(sourcePath)) {
            while (rows.hasNext()) {
                Map<String, String> row = rows.next();
                tally.rowsRead++;

                RowAdmission admission = normalizer.normalize(row);
                if (!admission.admitted()) {
                    log.warn(admission.skipReason());
                    tally.skipped++;
                    metrics.recordSkipped();
                    continue;
                }

                buffer.add(admission.record());
                if (buffer.size() >= batchSize) {
                    if (publishBatch(streamName, buffer, tally)) {
                        pause();
                    }
                    buffer.clear();
                }
            }
        } catch (IOException | RuntimeException e) {
            log.error("Unexpected error reading {} after {} rows: {}", sourcePath, tally.rowsRead, e.getMessage(), e);
            status = ProducerRunSummary.Status.READ_ERROR;
        }

        if (!buffer.isEmpty()) {
            publishBatch(streamName, buffer, tally);
        }

        ProducerRunSummary summary = new ProducerRunSummary(
                status, tally.rowsRead, tally.skipped, tally.sent, tally.failed, tally.batches);
        log.info("Producer finished: status={} read={} skipped={} sent={} failed={} batches={}",
                summary.status(), summary.rowsRead(), summary.skipped(), summary.sent(),
                summary.failed(), summary.batches());
        return summary;
    }

    /**
     * @return true when the batch reached the client, even if some records were refused
     */
    private boolean publishBatch(String streamName, List<TripRecord> batch, Tally tally) {
        tally.batches++;
        metrics.recordBatch();

        List<CompletableFuture<SendResult<String, String>>> sends = new ArrayList<>(batch.size());
        try {
            List<String> payloads = new ArrayList<>(batch.size());
            for (TripRecord record : batch) {
                payloads.add(toEnvelopeJson(record));
            }
            for (int i = 0; i < batch.size(); i++) {
                sends.add(kafkaTemplate.send(streamName, batch.get(i).getTripId(), payloads.get(i)));
            }
        } catch (Exception e) {
            log.error("Error sending batch of {} records to {}: {}", batch.size(), streamName, e.getMessage(), e);
            tally.failed += batch.size();
            metrics.recordFailed(batch.size());
            return false;
        }

        int failed = 0;
        for (CompletableFuture<SendResult<String, String>> send : sends) {
            try {
                send.get();
            } catch (ExecutionException e) {
                failed++;
                log.debug("Record rejected by broker: {}", e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                failed++;
            }
        }

        int sent = batch.size() - failed;
        tally.sent += sent;
        tally.failed += failed;
        metrics.recordSent(sent);
        if (failed > 0) {
            metrics.recordFailed(failed);
            log.warn("Failed to send {} of {} records in batch to {}", failed, batch.size(), streamName);
        }
        log.info("Sent batch of {} records to {}", sent, streamName);
        return true;
    }

    private String toEnvelopeJson(TripRecord record) throws JsonProcessingException {
        byte[] payload = objectMapper.writeValueAsBytes(record);
        return objectMapper.writeValueAsString(
                TripStreamEnvelope.wrap(record.getTripId(), payload, settings.getRegion()));
    }

    private void pause() {
        if (settings.getBatchPauseMs() <= 0) {
            return;
        }
        try {
            Thread.sleep(settings.getBatchPauseMs());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static final class Tally {
        int rowsRead;
        int skipped;
        int sent;
        int failed;
        int batches;
    }
}
