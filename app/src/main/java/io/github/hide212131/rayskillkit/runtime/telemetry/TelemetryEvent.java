package io.github.hide212131.rayskillkit.runtime.telemetry;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One retained telemetry record.
 *
 * @param attributes ordered attribute values (strings, numbers, booleans)
 * @param metrics numeric measurements, possibly empty
 */
public record TelemetryEvent(Instant timestamp, String event, Map<String, Object> attributes,
        Map<String, Number> metrics) {

    public TelemetryEvent {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(event, "event");
        attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes == null ? Map.of() : attributes));
        metrics = Collections.unmodifiableMap(new LinkedHashMap<>(metrics == null ? Map.of() : metrics));
    }

    public Optional<Object> attribute(String key) {
        return Optional.ofNullable(attributes.get(key));
    }

    public Optional<Double> metric(String key) {
        Number value = metrics.get(key);
        return value == null ? Optional.empty() : Optional.of(value.doubleValue());
    }
}
