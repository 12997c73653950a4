package io.sortkv.codec;

import io.sortkv.common.ByteArray;

import java.util.Objects;
import java.util.function.Function;

final class MappedCodec<T, U> implements KeyCodec<U> {

    private final KeyCodec<T> delegate;
    private final Function<? super T, ? extends U> wrap;
    private final Function<? super U, ? extends T> unwrap;

    MappedCodec(KeyCodec<T> delegate, Function<? super T, ? extends U> wrap, Function<? super U, ? extends T> unwrap) {
        this.delegate = Objects.requireNonNull(delegate, "delegate cannot be null");
        this.wrap = Objects.requireNonNull(wrap, "wrap cannot be null");
        this.unwrap = Objects.requireNonNull(unwrap, "unwrap cannot be null");
    }

    @Override
    public void encode(U value, KeyWriter writer) {
        delegate.encode(unwrap.apply(value), writer);
    }

    @Override
    public Decoded<U> decode(ByteArray bytes) {
        Decoded<T> decoded = delegate.decode(bytes);
        return new Decoded<>(wrap.apply(decoded.value()), decoded.remaining());
    }

    @Override
    public boolean orderPreserving() {
        return delegate.orderPreserving();
    }

    @Override
    public boolean consumesRemainder() {
        return delegate.consumesRemainder();
    }
}
