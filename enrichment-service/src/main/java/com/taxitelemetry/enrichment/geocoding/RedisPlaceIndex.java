package com.taxitelemetry.enrichment.geocoding;

import com.taxitelemetry.enrichment.config.EnrichmentSettings;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.geo.Circle;
import org.springframework.data.geo.Distance;
import org.springframework.data.geo.GeoResult;
import org.springframework.data.geo.GeoResults;
import org.springframework.data.geo.Metrics;
import org.springframework.data.geo.Point;
import org.springframework.data.redis.connection.RedisGeoCommands;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Place index kept in a Redis GEO set, one set per region and index:
 * {@code places:{region}:{indexName}}. Members are place labels.
 *
 * A position search is a radius query around the point, nearest first, capped at
 * maxResults. Places farther than the configured search radius never match.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RedisPlaceIndex implements ReverseGeocoder {

    private static final String KEY_PREFIX = "places:";

    private final RedisTemplate<String, String> redisTemplate;
    private final EnrichmentSettings settings;

    String indexKey(String indexName) {
        return KEY_PREFIX + settings.getRegion() + ":" + indexName;
    }

    @Override
    public List<PlaceCandidate> searchPlaceIndexForPosition(PlaceSearchRequest request) {
        Circle area = new Circle(
                new Point(request.longitude(), request.latitude()),
                new Distance(settings.getSearchRadiusKm(), Metrics.KILOMETERS)
        );
        GeoResults<RedisGeoCommands.GeoLocation<String>> results = redisTemplate.opsForGeo().radius(
                indexKey(request.indexName()),
                area,
                RedisGeoCommands.GeoRadiusCommandArgs.newGeoRadiusArgs()
                        .includeDistance()
                        .sortAscending()
                        .limit(request.maxResults())
        );
        if (results == null) {
            return List.of();
        }

        List<PlaceCandidate> candidates = new ArrayList<>();
        for (GeoResult<RedisGeoCommands.GeoLocation<String>> result : results.getContent()) {
            candidates.add(new PlaceCandidate(result.getContent().getName(), result.getDistance().getValue()));
        }
        log.debug("Place search index={} point=({}, {}) -> {}",
                request.indexName(), request.longitude(), request.latitude(), candidates);
        return candidates;
    }

    @Override
    public int indexPlaces(String indexName, List<CatalogPlace> places) {
        if (places.isEmpty()) {
            return 0;
        }
        Map<String, Point> members = new LinkedHashMap<>();
        for (CatalogPlace place : places) {
            members.put(place.label(), new Point(place.longitude(), place.latitude()));
        }
        redisTemplate.opsForGeo().add(indexKey(indexName), members);
        return members.size();
    }
}
