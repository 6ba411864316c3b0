package com.taxitelemetry.enrichment.config;

import com.taxitelemetry.shared.util.RequiredSettings;
import lombok.Data;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;

@Data
@Component
public class EnrichmentSettings {

    @Value("${pipeline.enrichment.place-index-name:}")
    private String placeIndexName;

    @Value("${pipeline.enrichment.queue-topic:}")
    private String queueTopic;

    @Value("${pipeline.enrichment.dead-letter-topic:}")
    private String deadLetterTopic;

    @Value("${pipeline.enrichment.search-radius-km:25}")
    private double searchRadiusKm;

    @Value("${pipeline.enrichment.place-catalog:}")
    private String placeCatalog;

    @Value("${pipeline.region:}")
    private String region;

    public List<String> missing() {
        return RequiredSettings.check()
                .require("pipeline.enrichment.place-index-name", placeIndexName)
                .require("pipeline.enrichment.queue-topic", queueTopic)
                .require("pipeline.region", region)
                .missing();
    }
}
