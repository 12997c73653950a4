package io.sortkv.codec.tuple;

import java.util.Objects;

public record Tuple3<A, B, C>(A first, B second, C third) {

    public Tuple3 {
        Objects.requireNonNull(first, "first cannot be null");
        Objects.requireNonNull(second, "second cannot be null");
        Objects.requireNonNull(third, "third cannot be null");
    }

    public static <A, B, C> Tuple3<A, B, C> of(A first, B second, C third) {
        return new Tuple3<>(first, second, third);
    }
}
