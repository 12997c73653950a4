package io.sortkv.codec;

import io.sortkv.common.ByteArray;

@FunctionalInterface
public interface KeyDecoder<T> {

    /**
     * Decodes one value from the front of {@code bytes}.
     *
     * @return the value and the bytes that were not consumed
     * @throws KeyDecodeException if {@code bytes} does not start with a valid encoding
     */
    Decoded<T> decode(ByteArray bytes);
}
