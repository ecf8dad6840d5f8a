package io.github.hide212131.rayskillkit.runtime.feature;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 正規化済みシグナルを順に積み上げる。 Every appended value is finite and lies in [-1, 1].
 */
public final class FeatureSignals {

    static final int FORMULA_SIGNALS = 4;

    private static final Pattern NUMBER = Pattern.compile("[-+]?\\d*\\.?\\d+");
    private static final float FORMULA_COEFFICIENT_SCALE = 100f;
    private static final float FORMULA_MAGNITUDE_SCALE = 400f;

    private final List<Float> values = new ArrayList<>();

    FeatureSignals() {
    }

    public FeatureSignals add(float value) {
        values.add(clamp(value));
        return this;
    }

    /** {@code value / scale} clamped to [-1, 1]; 0 when the value is missing. */
    public FeatureSignals scaled(Optional<Float> value, float scale) {
        return add(value.map(v -> normalize(v, scale)).orElse(0f));
    }

    public FeatureSignals ratio(Optional<Float> part, Optional<Float> total) {
        if (part.isEmpty() || total.isEmpty() || total.get() == 0f) {
            return add(0f);
        }
        return add(clamp(part.get() / total.get()));
    }

    /** Relative change of {@code current} against {@code reference}, scaled. */
    public FeatureSignals delta(Optional<Float> current, Optional<Float> reference, float scale) {
        if (current.isEmpty() || reference.isEmpty()) {
            return add(0f);
        }
        float divisor = reference.get() == 0f ? 1f : Math.abs(reference.get());
        return add(normalize(clean((current.get() - reference.get()) / divisor), scale));
    }

    public FeatureSignals count(Optional<Float> count, float max) {
        if (count.isEmpty() || max <= 0f) {
            return add(0f);
        }
        return add(Math.max(0f, Math.min(1f, count.get() / max)));
    }

    public FeatureSignals length(Optional<String> text, int maxLength) {
        if (text.isEmpty() || text.get().isEmpty() || maxLength <= 0) {
            return add(0f);
        }
        int bounded = Math.min(text.get().length(), maxLength);
        return add((float) bounded / maxLength);
    }

    public FeatureSignals flag(float flag) {
        return add(flag);
    }

    /** One 0/1 flag per keyword, case-insensitive substring match. */
    public FeatureSignals keywords(Optional<String> text, List<String> keywords) {
        String source = text.map(value -> value.toLowerCase(Locale.ROOT)).orElse("");
        for (String keyword : keywords) {
            add(!source.isBlank() && source.contains(keyword.toLowerCase(Locale.ROOT)) ? 1f : 0f);
        }
        return this;
    }

    /**
     * Coefficients of a simple formula: the first three numbers found, each divided by 100, followed by the
     * total magnitude of all numbers divided by 400.
     */
    public FeatureSignals formula(Optional<String> formula) {
        float[] coefficients = new float[FORMULA_SIGNALS];
        if (formula.isPresent() && !formula.get().isBlank()) {
            Matcher matcher = NUMBER.matcher(formula.get());
            int index = 0;
            float magnitude = 0f;
            while (matcher.find()) {
                float number;
                try {
                    number = Float.parseFloat(matcher.group());
                } catch (NumberFormatException ex) {
                    continue;
                }
                if (index < FORMULA_SIGNALS - 1) {
                    coefficients[index] = normalize(number, FORMULA_COEFFICIENT_SCALE);
                }
                index++;
                magnitude += Math.abs(number);
            }
            coefficients[FORMULA_SIGNALS - 1] = normalize(magnitude, FORMULA_MAGNITUDE_SCALE);
        }
        for (float coefficient : coefficients) {
            add(coefficient);
        }
        return this;
    }

    int size() {
        return values.size();
    }

    /**
     * Sizes the signals to {@code dimension}: surplus signals are folded into slot {@code index % dimension} and
     * the slot is clamped again; missing slots stay zero.
     */
    float[] compose(int dimension) {
        float[] vector = new float[dimension];
        for (int index = 0; index < values.size(); index++) {
            int slot = index % dimension;
            vector[slot] = index < dimension ? values.get(index) : clamp(vector[slot] + values.get(index));
        }
        return vector;
    }

    static float normalize(float value, float scale) {
        if (scale == 0f) {
            return 0f;
        }
        return clamp(value / scale);
    }

    static float clamp(float value) {
        float cleaned = clean(value);
        return Math.max(-1f, Math.min(1f, cleaned));
    }

    static float clean(float value) {
        if (Float.isNaN(value)) {
            return 0f;
        }
        if (Float.isInfinite(value)) {
            return Math.signum(value);
        }
        return value;
    }
}
