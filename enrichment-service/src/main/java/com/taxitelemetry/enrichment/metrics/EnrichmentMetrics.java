package com.taxitelemetry.enrichment.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

/**
 * Metrics at /actuator/prometheus:
 *   enrichment_records_total{outcome="processed|rejected|failed"}
 *   enrichment_zone_unknown_total  (lookups with no place in range)
 *   enrichment_geocode_latency_seconds
 */
@Component
public class EnrichmentMetrics {

    private final Counter processedCounter;
    private final Counter rejectedCounter;
    private final Counter failedCounter;
    private final Counter unknownZoneCounter;
    private final Timer geocodeTimer;

    public EnrichmentMetrics(MeterRegistry registry) {
        this.processedCounter = records(registry, "processed");
        this.rejectedCounter = records(registry, "rejected");
        this.failedCounter = records(registry, "failed");

        this.unknownZoneCounter = Counter.builder("enrichment.zone.unknown")
                .description("Trips whose pickup point matched no place")
                .register(registry);

        this.geocodeTimer = Timer.builder("enrichment.geocode.latency")
                .description("Reverse geocoding lookup latency")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
    }

    private static Counter records(MeterRegistry registry, String outcome) {
        return Counter.builder("enrichment.records")
                .tag("outcome", outcome)
                .description("Stream records handled by the enrichment stage")
                .register(registry);
    }

    public void recordProcessed()     { processedCounter.increment(); }
    public void recordRejected()      { rejectedCounter.increment(); }
    public void recordFailed()        { failedCounter.increment(); }
    public void recordUnknownZone()   { unknownZoneCounter.increment(); }
    public Timer getGeocodeTimer()    { return geocodeTimer; }
}
