package io.github.hide212131.rayskillkit.runtime.telemetry;

import java.nio.file.Path;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * サンプリング付きのイベント記録。 Retained events are written to the store before {@code record} returns.
 */
public final class Telemetry {

    public static final String ROUTER_SUCCESS_PREFIX = "router.success.";
    public static final String ROUTER_FAILURE_PREFIX = "router.failure.";
    public static final String TTS_EVENT = "tts.performance";
    public static final String SHARE_IN_EVENT = "share_in.funnel";

    private final TelemetryStore store;
    private final SamplingConfig sampling;
    private final Clock clock;
    private final DoubleSupplier random;

    public Telemetry(TelemetryStore store, SamplingConfig sampling) {
        this(store, sampling, Clock.systemUTC(), () -> ThreadLocalRandom.current().nextDouble());
    }

    public Telemetry(TelemetryStore store, SamplingConfig sampling, Clock clock, DoubleSupplier random) {
        this.store = Objects.requireNonNull(store, "store");
        this.sampling = Objects.requireNonNull(sampling, "sampling");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.random = Objects.requireNonNull(random, "random");
    }

    public static Telemetry jsonLines(Path directory, SamplingConfig sampling) {
        return new Telemetry(new JsonLinesTelemetryStore(directory), sampling);
    }

    public static Telemetry inMemory() {
        return new Telemetry(new InMemoryTelemetryStore(), SamplingConfig.keepAll());
    }

    /**
     * @return {@code true} when the event was retained
     */
    public boolean record(String event, Map<String, ?> attributes, Map<String, ? extends Number> metrics) {
        Objects.requireNonNull(event, "event");
        if (!sampling.shouldSample(event, random.getAsDouble())) {
            return false;
        }
        store.append(new TelemetryEvent(clock.instant(), event, copy(attributes), copyMetrics(metrics)));
        return true;
    }

    public boolean record(String event, Map<String, ?> attributes) {
        return record(event, attributes, Map.of());
    }

    public boolean recordRouterSuccess(String skillId, double latencyMs) {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("skill", skillId);
        attributes.put("outcome", "success");
        Map<String, Number> metrics = new LinkedHashMap<>();
        metrics.put("router.success", 1);
        metrics.put("router.latency_ms", latencyMs);
        return record(ROUTER_SUCCESS_PREFIX + skillId, attributes, metrics);
    }

    public boolean recordRouterFailure(String skillId, String category, String error, double latencyMs) {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("skill", skillId);
        attributes.put("outcome", "failure");
        attributes.put("category", category);
        attributes.put("error", error == null ? "" : error);
        Map<String, Number> metrics = new LinkedHashMap<>();
        metrics.put("router.failure", 1);
        metrics.put("router.latency_ms", latencyMs);
        return record(ROUTER_FAILURE_PREFIX + skillId, attributes, metrics);
    }

    public boolean recordTts(long durationMs, int characters, boolean success) {
        Map<String, Number> metrics = new LinkedHashMap<>();
        metrics.put("tts.ms", Math.max(0L, durationMs));
        metrics.put("tts.characters", characters);
        return record(TTS_EVENT, Map.of("success", success), metrics);
    }

    public boolean recordShareInEvent(String stage, Map<String, ?> attributes) {
        Map<String, Object> merged = copy(attributes);
        merged.put("stage", stage);
        return record(SHARE_IN_EVENT, merged, Map.of());
    }

    public List<TelemetryEvent> events() {
        return store.readAll();
    }

    public void clear() {
        store.clear();
    }

    public SamplingConfig sampling() {
        return sampling;
    }

    private static Map<String, Object> copy(Map<String, ?> attributes) {
        Map<String, Object> copy = new LinkedHashMap<>();
        if (attributes != null) {
            attributes.forEach((key, value) -> copy.put(key, value instanceof CharSequence text
                    ? text.toString() : value));
        }
        return copy;
    }

    private static Map<String, Number> copyMetrics(Map<String, ? extends Number> metrics) {
        return metrics == null ? Map.of() : new LinkedHashMap<>(metrics);
    }
}
