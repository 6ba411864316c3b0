package com.taxitelemetry.fare.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Metrics at /actuator/prometheus:
 *   fare_records_total{outcome="processed|rejected|failed"}
 *   fare_amount                 distribution of computed total_amount
 */
@Component
public class FareMetrics {

    private final Counter processedCounter;
    private final Counter rejectedCounter;
    private final Counter failedCounter;
    private final DistributionSummary totalAmountSummary;

    public FareMetrics(MeterRegistry registry) {
        this.processedCounter = records(registry, "processed");
        this.rejectedCounter = records(registry, "rejected");
        this.failedCounter = records(registry, "failed");

        this.totalAmountSummary = DistributionSummary.builder("fare.amount")
                .description("Total charge of persisted trips")
                .publishPercentiles(0.5, 0.95)
                .register(registry);
    }

    private static Counter records(MeterRegistry registry, String outcome) {
        return Counter.builder("fare.records")
                .tag("outcome", outcome)
                .description("Queued trips handled by the fare stage")
                .register(registry);
    }

    public void recordProcessed(BigDecimal total) {
        processedCounter.increment();
        totalAmountSummary.record(total.doubleValue());
    }

    public void recordRejected()    { rejectedCounter.increment(); }
    public void recordFailed()      { failedCounter.increment(); }
}
