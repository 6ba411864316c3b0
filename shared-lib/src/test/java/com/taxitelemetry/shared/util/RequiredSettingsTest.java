package com.taxitelemetry.shared.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RequiredSettingsTest {

    @Test
    @DisplayName("Null and blank settings are reported by property name, in declaration order")
    void missing_reportsBlankAndNull() {
        var missing = RequiredSettings.check()
                .require("pipeline.fare.table-name", "  ")
                .require("pipeline.fare.analytics-topic", "taxi-trip-analytics")
                .require("pipeline.region", null)
                .missing();

        assertThat(missing).containsExactly("pipeline.fare.table-name", "pipeline.region");
    }

    @Test
    @DisplayName("Fully configured stage has nothing missing")
    void missing_emptyWhenConfigured() {
        assertThat(RequiredSettings.check().require("a", "x").missing()).isEmpty();
    }
}
