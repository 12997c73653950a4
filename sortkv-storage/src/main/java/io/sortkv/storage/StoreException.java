package io.sortkv.storage;

/**
 * Failure reported by a {@link Store}. Backends subclass it or wrap their own errors as the cause.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * The store realization does not offer the requested operation. This is distinct from an empty result.
     */
    public static final class Unsupported extends StoreException {
        private final String operation;

        public Unsupported(String operation, String reason) {
            super("Operation '%s' not supported: %s".formatted(operation, reason));
            this.operation = operation;
        }

        public String operation() {
            return operation;
        }
    }
}
