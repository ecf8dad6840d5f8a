package io.github.hide212131.rayskillkit.runtime.feature;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Immutable, insertion-ordered key/value payload handed to feature builders.
 * <p>
 * Accessors are lenient: absent keys and values of an unexpected kind read as empty, never as an exception.
 */
public final class FeaturePayload {

    private static final FeaturePayload EMPTY = new FeaturePayload(Map.of());

    private final Map<String, FeatureValue> values;

    private FeaturePayload(Map<String, FeatureValue> values) {
        this.values = values;
    }

    public static FeaturePayload empty() {
        return EMPTY;
    }

    /**
     * Converts a loosely typed map. Entries with null keys or unsupported values are dropped.
     */
    public static FeaturePayload of(Map<String, ?> raw) {
        Objects.requireNonNull(raw, "raw");
        Builder builder = builder();
        raw.forEach((key, value) -> {
            if (key != null) {
                FeatureValue.from(value).ifPresent(converted -> builder.put(key, converted));
            }
        });
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<FeatureValue> get(String key) {
        return Optional.ofNullable(values.get(key));
    }

    public Optional<Float> number(String key) {
        FeatureValue value = values.get(key);
        if (value instanceof FeatureValue.NumberValue number) {
            return Optional.of((float) number.value());
        }
        if (value instanceof FeatureValue.BooleanValue bool) {
            return Optional.of(bool.value() ? 1f : 0f);
        }
        if (value instanceof FeatureValue.TextValue text) {
            return parseFloat(text.value());
        }
        return Optional.empty();
    }

    public Optional<String> text(String key) {
        FeatureValue value = values.get(key);
        if (value instanceof FeatureValue.TextValue text) {
            return Optional.of(text.value());
        }
        if (value instanceof FeatureValue.NumberValue number) {
            return Optional.of(String.valueOf(number.value()));
        }
        if (value instanceof FeatureValue.BooleanValue bool) {
            return Optional.of(String.valueOf(bool.value()));
        }
        return Optional.empty();
    }

    /**
     * Joins the non-blank text of the given keys with single spaces, in argument order.
     */
    public Optional<String> joinedText(String... keys) {
        String joined = Stream.of(keys)
                .map(this::text)
                .flatMap(Optional::stream)
                .filter(text -> !text.isBlank())
                .collect(Collectors.joining(" "));
        return joined.isEmpty() ? Optional.empty() : Optional.of(joined);
    }

    /** Number of elements of a list value, or the length of a text value. */
    public Optional<Float> size(String key) {
        FeatureValue value = values.get(key);
        if (value instanceof FeatureValue.TextListValue list) {
            return Optional.of((float) list.values().size());
        }
        if (value instanceof FeatureValue.TextValue text) {
            return Optional.of((float) text.value().length());
        }
        return Optional.empty();
    }

    public float flag(String key) {
        FeatureValue value = values.get(key);
        if (value instanceof FeatureValue.BooleanValue bool) {
            return bool.value() ? 1f : 0f;
        }
        if (value instanceof FeatureValue.NumberValue number) {
            return number.value() != 0d ? 1f : 0f;
        }
        if (value instanceof FeatureValue.TextValue text) {
            return "true".equalsIgnoreCase(text.value().trim()) ? 1f : 0f;
        }
        return 0f;
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public int size() {
        return values.size();
    }

    public Map<String, FeatureValue> asMap() {
        return values;
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof FeaturePayload payload && values.equals(payload.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "FeaturePayload" + values.keySet();
    }

    private static Optional<Float> parseFloat(String text) {
        try {
            return Optional.of(Float.parseFloat(text.trim()));
        } catch (NumberFormatException ex) {
            return Optional.empty();
        }
    }

    public static final class Builder {

        private final Map<String, FeatureValue> values = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder put(String key, FeatureValue value) {
            values.put(Objects.requireNonNull(key, "key"), Objects.requireNonNull(value, "value"));
            return this;
        }

        public Builder number(String key, double value) {
            return put(key, FeatureValue.number(value));
        }

        public Builder text(String key, String value) {
            return put(key, FeatureValue.text(value));
        }

        public Builder flag(String key, boolean value) {
            return put(key, FeatureValue.bool(value));
        }

        public Builder texts(String key, List<String> value) {
            return put(key, FeatureValue.textList(value));
        }

        public Builder texts(String key, String... value) {
            return put(key, FeatureValue.textList(List.of(value)));
        }

        public FeaturePayload build() {
            if (values.isEmpty()) {
                return EMPTY;
            }
            return new FeaturePayload(Collections.unmodifiableMap(new LinkedHashMap<>(values)));
        }
    }
}
