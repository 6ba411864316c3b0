package com.taxitelemetry.producer.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

/**
 * Producer run counters:
 *   producer_rows_total{outcome="sent|skipped|failed"}
 *   producer_batches_total
 *   producer_source_missing_total
 */
@Component
public class ProducerMetrics {

    private final Counter sentCounter;
    private final Counter skippedCounter;
    private final Counter failedCounter;
    private final Counter batchCounter;
    private final Counter sourceMissingCounter;

    public ProducerMetrics(MeterRegistry registry) {
        this.sentCounter = rows(registry, "sent", "Rows delivered to the trip stream");
        this.skippedCounter = rows(registry, "skipped", "Rows rejected by the admission rule");
        this.failedCounter = rows(registry, "failed", "Rows whose publish failed");

        this.batchCounter = Counter.builder("producer.batches")
                .description("Bulk publishes attempted")
                .register(registry);

        this.sourceMissingCounter = Counter.builder("producer.source.missing")
                .description("Runs aborted because the source file was absent")
                .register(registry);
    }

    private static Counter rows(MeterRegistry registry, String outcome, String description) {
        return Counter.builder("producer.rows")
                .tag("outcome", outcome)
                .description(description)
                .register(registry);
    }

    public void recordSent(int rows)          { sentCounter.increment(rows); }
    public void recordSkipped()               { skippedCounter.increment(); }
    public void recordFailed(int rows)        { failedCounter.increment(rows); }
    public void recordBatch()                 { batchCounter.increment(); }
    public void recordSourceMissing()         { sourceMissingCounter.increment(); }
}
