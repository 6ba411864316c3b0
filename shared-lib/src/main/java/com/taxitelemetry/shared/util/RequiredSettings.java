package com.taxitelemetry.shared.util;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collects stage settings by property name and reports the blank ones.
 */
public final class RequiredSettings {

    private final Map<String, String> values = new LinkedHashMap<>();

    private RequiredSettings() {}

    public static RequiredSettings check() {
        return new RequiredSettings();
    }

    public RequiredSettings require(String property, String value) {
        values.put(property, value);
        return this;
    }

    public List<String> missing() {
        List<String> missing = new ArrayList<>();
        values.forEach((property, value) -> {
            if (value == null || value.isBlank()) {
                missing.add(property);
            }
        });
        return missing;
    }
}
