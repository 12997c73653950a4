package io.sortkv.codec.tuple;

import io.sortkv.codec.Decoded;
import io.sortkv.codec.KeyCodec;
import io.sortkv.codec.KeyPrefix;
import io.sortkv.codec.KeyWriter;
import io.sortkv.common.ByteArray;

public final class Tuple3Codec<A, B, C> implements KeyCodec<Tuple3<A, B, C>> {

    private final KeyCodec<A> first;
    private final KeyCodec<B> second;
    private final KeyCodec<C> third;

    private Tuple3Codec(KeyCodec<A> first, KeyCodec<B> second, KeyCodec<C> third) {
        Fields.checkLayout(first, second, third);
        this.first = first;
        this.second = second;
        this.third = third;
    }

    public static <A, B, C> Tuple3Codec<A, B, C> of(KeyCodec<A> first, KeyCodec<B> second, KeyCodec<C> third) {
        return new Tuple3Codec<>(first, second, third);
    }

    public KeyPrefix<A, Tuple3<A, B, C>> first() {
        return KeyPrefix.declare(first);
    }

    public KeyPrefix<Tuple2<A, B>, Tuple3<A, B, C>> prefix2() {
        return KeyPrefix.declare(Tuple2Codec.of(first, second));
    }

    @Override
    public void encode(Tuple3<A, B, C> value, KeyWriter writer) {
        first.encode(value.first(), writer);
        second.encode(value.second(), writer);
        third.encode(value.third(), writer);
    }

    @Override
    public Decoded<Tuple3<A, B, C>> decode(ByteArray bytes) {
        Fields.Cursor cursor = new Fields.Cursor(bytes);
        A a = cursor.next(first);
        B b = cursor.next(second);
        C c = cursor.next(third);
        return new Decoded<>(new Tuple3<>(a, b, c), cursor.remaining());
    }

    @Override
    public boolean orderPreserving() {
        return Fields.orderPreserving(first, second, third);
    }

    @Override
    public boolean consumesRemainder() {
        return third.consumesRemainder();
    }
}
