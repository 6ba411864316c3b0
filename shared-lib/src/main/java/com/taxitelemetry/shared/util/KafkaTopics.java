package com.taxitelemetry.shared.util;

/**
 * Default names of the topics the listeners consume when no override is configured.
 */
public final class KafkaTopics {

    private KafkaTopics() {}

    public static final String TAXI_TRIP_STREAM     = "taxi-trip-stream";
    public static final String TRIP_ENRICHED_QUEUE  = "taxi-trip-enriched";

    public static final String DEAD_LETTER_REASON_HEADER = "dlq-reason";
}
