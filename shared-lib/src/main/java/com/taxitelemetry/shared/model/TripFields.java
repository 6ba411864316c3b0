package com.taxitelemetry.shared.model;

import java.util.List;

/**
 * Wire names of TripRecord attributes, shared by CSV headers, queue JSON and the analytics document.
 */
public final class TripFields {

    private TripFields() {}

    public static final String TRIP_ID           = "trip_id";
    public static final String TAXI_ID           = "taxi_id";
    public static final String PICKUP_DATETIME   = "pickup_datetime";
    public static final String DROPOFF_DATETIME  = "dropoff_datetime";

    public static final String LATITUDE          = "latitude";
    public static final String LONGITUDE         = "longitude";
    public static final String PICKUP_LAT        = "pickup_lat";
    public static final String PICKUP_LONG       = "pickup_long";
    public static final String DROP_LAT          = "drop_lat";
    public static final String DROP_LONG         = "drop_long";
    public static final String DISTANCE_KM       = "distance_km";

    public static final String ZONE_NAME         = "zone_name";

    public static final String PASSENGER_COUNT   = "passenger_count";
    public static final String FARE_AMOUNT       = "fare_amount";
    public static final String EXTRA_CHARGES     = "extra_charges";
    public static final String LEGACY_EXTRA      = "extra";
    public static final String TIP_AMOUNT        = "tip_amount";
    public static final String TOLLS_AMOUNT      = "tolls_amount";
    public static final String TOTAL_AMOUNT      = "total_amount";
    public static final String PAYMENT_TYPE      = "payment_type";

    // Analytics warehouse column names
    public static final String PICKUP_LATITUDE   = "pickup_latitude";
    public static final String PICKUP_LONGITUDE  = "pickup_longitude";
    public static final String DROPOFF_LATITUDE  = "dropoff_latitude";
    public static final String DROPOFF_LONGITUDE = "dropoff_longitude";

    public static final String UNKNOWN_ZONE         = "Unknown";
    public static final String DEFAULT_PAYMENT_TYPE = "CASH";

    /** Required before persistence, in reporting order. */
    public static final List<String> REQUIRED_FOR_PERSISTENCE = List.of(
            TRIP_ID, TAXI_ID, PICKUP_DATETIME,
            PICKUP_LAT, PICKUP_LONG, DROP_LAT, DROP_LONG, DISTANCE_KM);

    /** Must parse as numbers before persistence, in checking order. */
    public static final List<String> NUMERIC_FOR_PERSISTENCE = List.of(
            PICKUP_LAT, PICKUP_LONG, DROP_LAT, DROP_LONG, DISTANCE_KM);
}
