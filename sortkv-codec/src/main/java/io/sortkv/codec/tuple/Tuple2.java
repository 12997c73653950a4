package io.sortkv.codec.tuple;

import java.util.Objects;

public record Tuple2<A, B>(A first, B second) {

    public Tuple2 {
        Objects.requireNonNull(first, "first cannot be null");
        Objects.requireNonNull(second, "second cannot be null");
    }

    public static <A, B> Tuple2<A, B> of(A first, B second) {
        return new Tuple2<>(first, second);
    }
}
