package com.taxitelemetry.producer.config;

import com.taxitelemetry.shared.util.RequiredSettings;
import lombok.Data;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;

@Data
@Component
public class ProducerSettings {

    @Value("${pipeline.producer.source-path:}")
    private String sourcePath;

    @Value("${pipeline.producer.stream-name:}")
    private String streamName;

    @Value("${pipeline.producer.batch-size:100}")
    private int batchSize;

    @Value("${pipeline.producer.batch-pause-ms:100}")
    private long batchPauseMs;

    @Value("${pipeline.region:}")
    private String region;

    public List<String> missing() {
        List<String> missing = RequiredSettings.check()
                .require("pipeline.producer.source-path", sourcePath)
                .require("pipeline.producer.stream-name", streamName)
                .require("pipeline.region", region)
                .missing();
        if (batchSize <= 0) {
            missing.add("pipeline.producer.batch-size");
        }
        return missing;
    }
}
