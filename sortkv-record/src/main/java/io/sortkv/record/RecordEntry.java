package io.sortkv.record;

import io.sortkv.common.ByteArray;

import java.util.Objects;

public record RecordEntry<K>(K key, ByteArray value) {

    public RecordEntry {
        Objects.requireNonNull(key, "key cannot be null");
        Objects.requireNonNull(value, "value cannot be null");
    }
}
