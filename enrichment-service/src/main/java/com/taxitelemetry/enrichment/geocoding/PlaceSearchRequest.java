package com.taxitelemetry.enrichment.geocoding;

public record PlaceSearchRequest(String indexName, double longitude, double latitude, int maxResults) {

    public static PlaceSearchRequest bestMatch(String indexName, double longitude, double latitude) {
        return new PlaceSearchRequest(indexName, longitude, latitude, 1);
    }
}
