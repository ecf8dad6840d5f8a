package io.github.hide212131.rayskillkit.runtime.feature;

import java.util.Objects;

/**
 * Base class for domain builders: subclasses append their ordered signals, this class sizes the vector.
 */
public abstract class AbstractFeatureBuilder implements FeatureBuilder {

    private final String name;

    protected AbstractFeatureBuilder(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    @Override
    public final String name() {
        return name;
    }

    @Override
    public final float[] build(FeaturePayload payload, int dimension) {
        Objects.requireNonNull(payload, "payload");
        if (dimension <= 0) {
            throw new IllegalArgumentException("dimension must be positive: " + dimension);
        }
        FeatureSignals signals = new FeatureSignals();
        collect(payload, signals);
        return signals.compose(dimension);
    }

    protected abstract void collect(FeaturePayload payload, FeatureSignals signals);

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + name + "]";
    }
}
