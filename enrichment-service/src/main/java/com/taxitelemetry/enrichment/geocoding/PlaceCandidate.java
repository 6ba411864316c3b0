package com.taxitelemetry.enrichment.geocoding;

/**
 * A named place returned by a position search, with its distance from the query point.
 */
public record PlaceCandidate(String label, double distanceKm) {}
