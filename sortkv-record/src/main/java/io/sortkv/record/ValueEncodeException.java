package io.sortkv.record;

/**
 * Thrown by a {@link RecordMapper} that cannot encode a record.
 */
public class ValueEncodeException extends RuntimeException {

    public ValueEncodeException(String message) {
        super(message);
    }

    public ValueEncodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
