package io.surfworks.sparklaunch.request;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A provider-side configuration entry, e.g. {@code spark-defaults} properties.
 *
 * @param classification configuration classification (e.g. "spark", "spark-env")
 * @param properties     key/value settings for the classification
 * @param configurations nested entries (e.g. "export" under "spark-env")
 */
public record EmrConfig(
        String classification,
        Map<String, String> properties,
        List<EmrConfig> configurations
) {

    public EmrConfig {
        Objects.requireNonNull(classification, "classification cannot be null");

        if (classification.isBlank()) {
            throw new IllegalArgumentException("classification cannot be blank");
        }

        properties = properties == null ?
                Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(properties));
        configurations = configurations == null ? List.of() : List.copyOf(configurations);
    }

    /**
     * Creates an entry without nested configurations.
     */
    public static EmrConfig of(String classification, Map<String, String> properties) {
        return new EmrConfig(classification, properties, List.of());
    }
}
