package io.sortkv.codec.tuple;

import io.sortkv.codec.Decoded;
import io.sortkv.codec.KeyCodec;
import io.sortkv.codec.KeyPrefix;
import io.sortkv.codec.KeyWriter;
import io.sortkv.common.ByteArray;

public final class Tuple2Codec<A, B> implements KeyCodec<Tuple2<A, B>> {

    private final KeyCodec<A> first;
    private final KeyCodec<B> second;

    private Tuple2Codec(KeyCodec<A> first, KeyCodec<B> second) {
        Fields.checkLayout(first, second);
        this.first = first;
        this.second = second;
    }

    public static <A, B> Tuple2Codec<A, B> of(KeyCodec<A> first, KeyCodec<B> second) {
        return new Tuple2Codec<>(first, second);
    }

    /** The first field alone as a prefix of the pair. */
    public KeyPrefix<A, Tuple2<A, B>> first() {
        return KeyPrefix.declare(first);
    }

    @Override
    public void encode(Tuple2<A, B> value, KeyWriter writer) {
        first.encode(value.first(), writer);
        second.encode(value.second(), writer);
    }

    @Override
    public Decoded<Tuple2<A, B>> decode(ByteArray bytes) {
        Fields.Cursor cursor = new Fields.Cursor(bytes);
        A a = cursor.next(first);
        B b = cursor.next(second);
        return new Decoded<>(new Tuple2<>(a, b), cursor.remaining());
    }

    @Override
    public boolean orderPreserving() {
        return Fields.orderPreserving(first, second);
    }

    @Override
    public boolean consumesRemainder() {
        return second.consumesRemainder();
    }
}
