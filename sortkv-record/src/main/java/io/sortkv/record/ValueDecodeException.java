package io.sortkv.record;

/**
 * Thrown by a {@link RecordMapper} that cannot rebuild a record from a stored value.
 */
public class ValueDecodeException extends RuntimeException {

    public ValueDecodeException(String message) {
        super(message);
    }

    public ValueDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
