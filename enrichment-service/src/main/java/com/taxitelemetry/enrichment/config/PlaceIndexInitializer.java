package com.taxitelemetry.enrichment.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.taxitelemetry.enrichment.geocoding.CatalogPlace;
import com.taxitelemetry.enrichment.geocoding.ReverseGeocoder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.List;

@Slf4j
@Configuration
@RequiredArgsConstructor
public class PlaceIndexInitializer {

    private final EnrichmentSettings settings;
    private final ReverseGeocoder geocoder;
    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper;

    @Bean
    public ApplicationRunner seedPlaceIndex() {
        return args -> {
            String catalog = settings.getPlaceCatalog();
            if (catalog == null || catalog.isBlank() || settings.getPlaceIndexName().isBlank()) {
                log.info("No place catalog configured, place index left as is");
                return;
            }
            int written = geocoder.indexPlaces(settings.getPlaceIndexName(), readCatalog(catalog));
            log.info("Place index {} seeded with {} places from {}", settings.getPlaceIndexName(), written, catalog);
        };
    }

    List<CatalogPlace> readCatalog(String location) {
        Resource resource = resourceLoader.getResource(location);
        try (InputStream in = resource.getInputStream()) {
            return objectMapper.readValue(in, new TypeReference<List<CatalogPlace>>() {});
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read place catalog " + location, e);
        }
    }
}
