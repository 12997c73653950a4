package io.sortkv.record;

import io.sortkv.codec.InclusiveEnd;

import java.util.Objects;

public record RecordTableConfig(InclusiveEnd inclusiveEnd) {

    public static final InclusiveEnd DEFAULT_INCLUSIVE_END = InclusiveEnd.NESTED;

    public RecordTableConfig {
        Objects.requireNonNull(inclusiveEnd, "inclusiveEnd must not be null");
    }

    public static RecordTableConfig defaults() {
        return new RecordTableConfig(DEFAULT_INCLUSIVE_END);
    }

    public RecordTableConfig withInclusiveEnd(InclusiveEnd inclusiveEnd) {
        return new RecordTableConfig(inclusiveEnd);
    }
}
