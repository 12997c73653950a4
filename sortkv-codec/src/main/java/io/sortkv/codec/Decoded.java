package io.sortkv.codec;

import io.sortkv.common.ByteArray;

import java.util.Objects;

public record Decoded<T>(T value, ByteArray remaining) {

    public Decoded {
        Objects.requireNonNull(value, "value cannot be null");
        Objects.requireNonNull(remaining, "remaining cannot be null");
    }
}
