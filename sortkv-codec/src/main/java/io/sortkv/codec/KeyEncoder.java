package io.sortkv.codec;

import io.sortkv.common.ByteArray;

@FunctionalInterface
public interface KeyEncoder<T> {

    void encode(T value, KeyWriter writer);

    default ByteArray encode(T value) {
        KeyWriter writer = new KeyWriter();
        encode(value, writer);
        return writer.toByteArray();
    }
}
