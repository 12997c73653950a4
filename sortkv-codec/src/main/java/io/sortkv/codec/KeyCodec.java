package io.sortkv.codec;

import java.util.function.Function;

/**
 * Encodes and decodes values of {@code T} as keys of a sorted byte-keyed store.
 * <p>
 * Encoding is deterministic: the same value always produces the same bytes.
 * A codec that reports {@link #orderPreserving()} additionally guarantees that comparing two
 * encodings as unsigned bytes gives the same result as comparing the values themselves.
 * <p>
 * Implementations hold no mutable state and are safe to share between threads.
 */
public interface KeyCodec<T> extends KeyEncoder<T>, KeyDecoder<T> {

    boolean orderPreserving();

    /**
     * Whether decoding consumes every remaining byte. Such a codec can only be the last field of a
     * composite key.
     */
    default boolean consumesRemainder() {
        return false;
    }

    /**
     * Adapts this codec to a type that wraps {@code T}. The wrapper encodes exactly as the wrapped
     * value does and keeps its ordering and prefix properties.
     */
    default <U> KeyCodec<U> map(Function<? super T, ? extends U> wrap, Function<? super U, ? extends T> unwrap) {
        return new MappedCodec<>(this, wrap, unwrap);
    }
}
