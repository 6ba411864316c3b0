package com.taxitelemetry.fare.config;

import com.taxitelemetry.shared.util.RequiredSettings;
import lombok.Data;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;

@Data
@Component
public class FareSettings {

    @Value("${pipeline.fare.table-name:}")
    private String tableName;

    @Value("${pipeline.fare.analytics-topic:}")
    private String analyticsTopic;

    @Value("${pipeline.fare.dead-letter-topic:}")
    private String deadLetterTopic;

    public List<String> missing() {
        return RequiredSettings.check()
                .require("pipeline.fare.table-name", tableName)
                .require("pipeline.fare.analytics-topic", analyticsTopic)
                .missing();
    }
}
