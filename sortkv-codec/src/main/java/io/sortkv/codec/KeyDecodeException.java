package io.sortkv.codec;

/**
 * Raised when bytes cannot be decoded back into a key.
 * <p>
 * The subclasses form a closed set so callers can tell a truncated key from malformed text or from a
 * failure nested inside a composite key.
 */
public abstract sealed class KeyDecodeException extends RuntimeException
    permits KeyDecodeException.DataTooShort,
            KeyDecodeException.MalformedText,
            KeyDecodeException.MissingTerminator,
            KeyDecodeException.FieldFailure,
            KeyDecodeException.ElementFailure {

    protected KeyDecodeException(String message) {
        super(message);
    }

    protected KeyDecodeException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Fewer bytes were available than a fixed-width or length-declared field requires.
     * {@link #expected()} is the declared byte count, read as unsigned.
     */
    public static final class DataTooShort extends KeyDecodeException {
        private final long expected;
        private final long actual;

        public DataTooShort(long expected, long actual) {
            super("Expected data to be at least %s bytes long, was actually only %d"
                .formatted(Long.toUnsignedString(expected), actual));
            this.expected = expected;
            this.actual = actual;
        }

        public long expected() {
            return expected;
        }

        public long actual() {
            return actual;
        }
    }

    public static final class MalformedText extends KeyDecodeException {
        public MalformedText(String message, Throwable cause) {
            super(message, cause);
        }
    }

    public static final class MissingTerminator extends KeyDecodeException {
        public MissingTerminator(int scanned) {
            super("No NUL terminator in %d bytes".formatted(scanned));
        }
    }

    /**
     * A tuple field failed to decode. {@link #position()} is zero-based.
     */
    public static final class FieldFailure extends KeyDecodeException {
        private final int position;

        public FieldFailure(int position, KeyDecodeException cause) {
            super("Failed to decode field %d: %s".formatted(position, cause.getMessage()), cause);
            this.position = position;
        }

        public int position() {
            return position;
        }

        @Override
        public synchronized KeyDecodeException getCause() {
            return (KeyDecodeException) super.getCause();
        }
    }

    public static final class ElementFailure extends KeyDecodeException {
        private final long index;

        public ElementFailure(long index, KeyDecodeException cause) {
            super("Failed to decode element %d: %s".formatted(index, cause.getMessage()), cause);
            this.index = index;
        }

        public long index() {
            return index;
        }

        @Override
        public synchronized KeyDecodeException getCause() {
            return (KeyDecodeException) super.getCause();
        }
    }
}
