package com.taxitelemetry.enrichment.geocoding;

/**
 * One entry of a place catalog file: {@code {"label": ..., "latitude": ..., "longitude": ...}}.
 */
public record CatalogPlace(String label, double latitude, double longitude) {}
