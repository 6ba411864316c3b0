package com.taxitelemetry.enrichment.geocoding;

import java.util.List;

/**
 * Resolves a coordinate to named places in a place index.
 */
public interface ReverseGeocoder {

    /**
     * @return up to {@code maxResults} places, nearest first; empty when nothing matches
     */
    List<PlaceCandidate> searchPlaceIndexForPosition(PlaceSearchRequest request);

    /**
     * Adds or repositions places in the named index.
     *
     * @return number of places written
     */
    int indexPlaces(String indexName, List<CatalogPlace> places);
}
