package io.sortkv.record;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of reading one entry during a scan. A failed entry does not end the scan; the caller decides
 * whether to skip it or stop.
 */
public sealed interface ReadResult<R> permits ReadResult.Success, ReadResult.Failure {

    record Success<R>(R record) implements ReadResult<R> {
        public Success {
            Objects.requireNonNull(record, "record cannot be null");
        }
    }

    record Failure<R>(RecordReadException error) implements ReadResult<R> {
        public Failure {
            Objects.requireNonNull(error, "error cannot be null");
        }
    }

    default boolean isSuccess() {
        return this instanceof Success;
    }

    default Optional<R> toOptional() {
        return this instanceof Success<R> success ? Optional.of(success.record()) : Optional.empty();
    }

    /**
     * @throws RecordReadException if this entry failed to read
     */
    default R orElseThrow() {
        if (this instanceof Failure<R> failure) {
            throw failure.error();
        }
        return ((Success<R>) this).record();
    }
}
