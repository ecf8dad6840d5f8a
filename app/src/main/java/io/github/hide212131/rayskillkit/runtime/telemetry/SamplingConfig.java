package io.github.hide212131.rayskillkit.runtime.telemetry;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * プレフィックスごとのサンプリング率。 An event uses the rate of the longest rule prefix it starts with, the default rate
 * otherwise.
 */
public record SamplingConfig(Map<String, Double> rules, double defaultRate) {

    public SamplingConfig {
        Objects.requireNonNull(rules, "rules");
        checkRate("defaultRate", defaultRate);
        Map<String, Double> copy = new LinkedHashMap<>();
        rules.forEach((prefix, rate) -> {
            Objects.requireNonNull(prefix, "prefix");
            Objects.requireNonNull(rate, "rate for " + prefix);
            checkRate(prefix, rate);
            copy.put(prefix, rate);
        });
        rules = Collections.unmodifiableMap(copy);
    }

    public static SamplingConfig keepAll() {
        return new SamplingConfig(Map.of(), 1.0);
    }

    public double rateFor(String event) {
        String matched = null;
        for (String prefix : rules.keySet()) {
            if (event.startsWith(prefix) && (matched == null || prefix.length() > matched.length())) {
                matched = prefix;
            }
        }
        return matched == null ? defaultRate : rules.get(matched);
    }

    /**
     * @param draw uniform value in [0, 1)
     */
    public boolean shouldSample(String event, double draw) {
        double rate = rateFor(event);
        if (rate >= 1.0) {
            return true;
        }
        if (rate <= 0.0) {
            return false;
        }
        return draw < rate;
    }

    private static void checkRate(String name, double rate) {
        if (Double.isNaN(rate) || rate < 0.0 || rate > 1.0) {
            throw new IllegalArgumentException("Sampling rate for " + name + " must be within [0, 1]: " + rate);
        }
    }
}
