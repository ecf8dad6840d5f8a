package io.github.hide212131.rayskillkit.runtime.inference;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * 一度だけ初期化されるセル。 Concurrent first readers block until the single initialization finishes and all observe
 * the same value. A failed initialization is retried by the next reader.
 */
final class Memoized<T> {

    private final Supplier<T> initializer;
    private volatile T value;

    Memoized(Supplier<T> initializer) {
        this.initializer = Objects.requireNonNull(initializer, "initializer");
    }

    T get() {
        T result = value;
        if (result == null) {
            synchronized (this) {
                result = value;
                if (result == null) {
                    result = Objects.requireNonNull(initializer.get(), "initializer returned null");
                    value = result;
                }
            }
        }
        return result;
    }

    boolean isInitialized() {
        return value != null;
    }
}
