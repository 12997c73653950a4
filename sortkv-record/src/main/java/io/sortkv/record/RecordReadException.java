package io.sortkv.record;

import io.sortkv.codec.KeyDecodeException;
import io.sortkv.storage.StoreException;

/**
 * Failure to read a record. The cause is always the original store or decode error.
 */
public abstract sealed class RecordReadException extends RuntimeException
    permits RecordReadException.StoreFailure,
            RecordReadException.KeyDecodeFailure,
            RecordReadException.ValueDecodeFailure {

    private RecordReadException(String message, Throwable cause) {
        super(message, cause);
    }

    public static final class StoreFailure extends RecordReadException {
        public StoreFailure(StoreException cause) {
            super(cause.getMessage(), cause);
        }

        @Override
        public synchronized StoreException getCause() {
            return (StoreException) super.getCause();
        }
    }

    public static final class KeyDecodeFailure extends RecordReadException {
        public KeyDecodeFailure(KeyDecodeException cause) {
            super(cause.getMessage(), cause);
        }

        @Override
        public synchronized KeyDecodeException getCause() {
            return (KeyDecodeException) super.getCause();
        }
    }

    public static final class ValueDecodeFailure extends RecordReadException {
        public ValueDecodeFailure(ValueDecodeException cause) {
            super(cause.getMessage(), cause);
        }

        @Override
        public synchronized ValueDecodeException getCause() {
            return (ValueDecodeException) super.getCause();
        }
    }
}
