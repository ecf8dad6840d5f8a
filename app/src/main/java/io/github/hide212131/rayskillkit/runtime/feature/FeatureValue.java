package io.github.hide212131.rayskillkit.runtime.feature;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Value carried by a {@link FeaturePayload}. Payloads arrive from UI and backend collaborators as loosely typed
 * maps; converting them once into this closed set lets feature builders read fields without unchecked casts.
 */
public sealed interface FeatureValue
        permits FeatureValue.NumberValue, FeatureValue.TextValue, FeatureValue.BooleanValue,
        FeatureValue.TextListValue {

    static FeatureValue number(double value) {
        return new NumberValue(value);
    }

    static FeatureValue text(String value) {
        return new TextValue(value);
    }

    static FeatureValue bool(boolean value) {
        return new BooleanValue(value);
    }

    static FeatureValue textList(List<String> values) {
        return new TextListValue(values);
    }

    /**
     * Converts a plain Java value. Nulls and unsupported types yield an empty result so that payload conversion
     * never fails on unexpected input.
     */
    static Optional<FeatureValue> from(Object raw) {
        if (raw == null) {
            return Optional.empty();
        }
        if (raw instanceof FeatureValue value) {
            return Optional.of(value);
        }
        if (raw instanceof Number number) {
            return Optional.of(new NumberValue(number.doubleValue()));
        }
        if (raw instanceof Boolean bool) {
            return Optional.of(new BooleanValue(bool));
        }
        if (raw instanceof CharSequence text) {
            return Optional.of(new TextValue(text.toString()));
        }
        if (raw instanceof Collection<?> collection) {
            return Optional.of(new TextListValue(toTexts(collection)));
        }
        if (raw instanceof Object[] array) {
            return Optional.of(new TextListValue(toTexts(Arrays.asList(array))));
        }
        return Optional.empty();
    }

    private static List<String> toTexts(Collection<?> collection) {
        List<String> texts = new ArrayList<>(collection.size());
        for (Object element : collection) {
            if (element != null) {
                texts.add(element.toString());
            }
        }
        return texts;
    }

    record NumberValue(double value) implements FeatureValue {
    }

    record TextValue(String value) implements FeatureValue {

        public TextValue {
            Objects.requireNonNull(value, "value");
        }
    }

    record BooleanValue(boolean value) implements FeatureValue {
    }

    record TextListValue(List<String> values) implements FeatureValue {

        public TextListValue {
            Objects.requireNonNull(values, "values");
            values = List.copyOf(values);
        }
    }
}
