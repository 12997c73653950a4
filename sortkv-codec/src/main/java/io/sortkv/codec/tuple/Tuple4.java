package io.sortkv.codec.tuple;

import java.util.Objects;

public record Tuple4<A, B, C, D>(A first, B second, C third, D fourth) {

    public Tuple4 {
        Objects.requireNonNull(first, "first cannot be null");
        Objects.requireNonNull(second, "second cannot be null");
        Objects.requireNonNull(third, "third cannot be null");
        Objects.requireNonNull(fourth, "fourth cannot be null");
    }

    public static <A, B, C, D> Tuple4<A, B, C, D> of(A first, B second, C third, D fourth) {
        return new Tuple4<>(first, second, third, fourth);
    }
}
