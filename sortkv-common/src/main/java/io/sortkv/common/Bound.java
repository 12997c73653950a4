package io.sortkv.common;

import java.util.Objects;

/**
 * One end of a {@link Range}.
 */
public sealed interface Bound<T> permits Bound.Included, Bound.Excluded, Bound.Unbounded {

    static <T> Bound<T> included(T value) {
        return new Included<>(value);
    }

    static <T> Bound<T> excluded(T value) {
        return new Excluded<>(value);
    }

    static <T> Bound<T> unbounded() {
        return new Unbounded<>();
    }

    record Included<T>(T value) implements Bound<T> {
        public Included {
            Objects.requireNonNull(value, "value cannot be null");
        }
    }

    record Excluded<T>(T value) implements Bound<T> {
        public Excluded {
            Objects.requireNonNull(value, "value cannot be null");
        }
    }

    record Unbounded<T>() implements Bound<T> {}
}
