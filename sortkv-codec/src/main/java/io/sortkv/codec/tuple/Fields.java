package io.sortkv.codec.tuple;

import io.sortkv.codec.Decoded;
import io.sortkv.codec.KeyCodec;
import io.sortkv.codec.KeyDecodeException;
import io.sortkv.codec.KeyDecoder;
import io.sortkv.common.ByteArray;

import java.util.Objects;

/**
 * Field bookkeeping shared by the tuple codecs.
 */
final class Fields {

    private Fields() {}

    static void checkLayout(KeyCodec<?>... codecs) {
        for (int i = 0; i < codecs.length; i++) {
            Objects.requireNonNull(codecs[i], "codec for field " + i + " cannot be null");
            if (i < codecs.length - 1 && codecs[i].consumesRemainder()) {
                throw new IllegalArgumentException(
                    "Field %d consumes the remaining bytes and must be the last field".formatted(i)
                );
            }
        }
    }

    static boolean orderPreserving(KeyCodec<?>... codecs) {
        for (KeyCodec<?> codec : codecs) {
            if (!codec.orderPreserving()) {
                return false;
            }
        }
        return true;
    }

    /**
     * Decodes fields front to back. The first failure is rethrown tagged with its field position.
     */
    static final class Cursor {

        private ByteArray remaining;
        private int position;

        Cursor(ByteArray bytes) {
            this.remaining = bytes;
        }

        <T> T next(KeyDecoder<T> decoder) {
            Decoded<T> decoded;
            try {
                decoded = decoder.decode(remaining);
            } catch (KeyDecodeException e) {
                throw new KeyDecodeException.FieldFailure(position, e);
            }
            remaining = decoded.remaining();
            position++;
            return decoded.value();
        }

        ByteArray remaining() {
            return remaining;
        }
    }
}
