package io.sortkv.record;

import io.sortkv.storage.StoreException;

/**
 * Failure to persist or remove a record. The cause is always the original store or encode error.
 */
public abstract sealed class RecordWriteException extends RuntimeException
    permits RecordWriteException.StoreFailure,
            RecordWriteException.EncodeFailure {

    private RecordWriteException(String message, Throwable cause) {
        super(message, cause);
    }

    public static final class StoreFailure extends RecordWriteException {
        public StoreFailure(StoreException cause) {
            super(cause.getMessage(), cause);
        }

        @Override
        public synchronized StoreException getCause() {
            return (StoreException) super.getCause();
        }
    }

    /**
     * The record could not be turned into bytes: either the mapper rejected the value or the key codec
     * rejected the key.
     */
    public static final class EncodeFailure extends RecordWriteException {
        private final boolean keyRejected;

        public EncodeFailure(ValueEncodeException cause) {
            super(cause.getMessage(), cause);
            this.keyRejected = false;
        }

        public EncodeFailure(IllegalArgumentException keyCause) {
            super("Key cannot be encoded: " + keyCause.getMessage(), keyCause);
            this.keyRejected = true;
        }

        public boolean keyRejected() {
            return keyRejected;
        }

        @Override
        public synchronized RuntimeException getCause() {
            return (RuntimeException) super.getCause();
        }
    }
}
