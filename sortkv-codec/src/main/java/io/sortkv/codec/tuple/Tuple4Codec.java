package io.sortkv.codec.tuple;

import io.sortkv.codec.Decoded;
import io.sortkv.codec.KeyCodec;
import io.sortkv.codec.KeyPrefix;
import io.sortkv.codec.KeyWriter;
import io.sortkv.common.ByteArray;

public final class Tuple4Codec<A, B, C, D> implements KeyCodec<Tuple4<A, B, C, D>> {

    private final KeyCodec<A> first;
    private final KeyCodec<B> second;
    private final KeyCodec<C> third;
    private final KeyCodec<D> fourth;

    private Tuple4Codec(KeyCodec<A> first, KeyCodec<B> second, KeyCodec<C> third, KeyCodec<D> fourth) {
        Fields.checkLayout(first, second, third, fourth);
        this.first = first;
        this.second = second;
        this.third = third;
        this.fourth = fourth;
    }

    public static <A, B, C, D> Tuple4Codec<A, B, C, D> of(
        KeyCodec<A> first,
        KeyCodec<B> second,
        KeyCodec<C> third,
        KeyCodec<D> fourth
    ) {
        return new Tuple4Codec<>(first, second, third, fourth);
    }

    public KeyPrefix<A, Tuple4<A, B, C, D>> first() {
        return KeyPrefix.declare(first);
    }

    public KeyPrefix<Tuple2<A, B>, Tuple4<A, B, C, D>> prefix2() {
        return KeyPrefix.declare(Tuple2Codec.of(first, second));
    }

    public KeyPrefix<Tuple3<A, B, C>, Tuple4<A, B, C, D>> prefix3() {
        return KeyPrefix.declare(Tuple3Codec.of(first, second, third));
    }

    @Override
    public void encode(Tuple4<A, B, C, D> value, KeyWriter writer) {
        first.encode(value.first(), writer);
        second.encode(value.second(), writer);
        third.encode(value.third(), writer);
        fourth.encode(value.fourth(), writer);
    }

    @Override
    public Decoded<Tuple4<A, B, C, D>> decode(ByteArray bytes) {
        Fields.Cursor cursor = new Fields.Cursor(bytes);
        A a = cursor.next(first);
        B b = cursor.next(second);
        C c = cursor.next(third);
        D d = cursor.next(fourth);
        return new Decoded<>(new Tuple4<>(a, b, c, d), cursor.remaining());
    }

    @Override
    public boolean orderPreserving() {
        return Fields.orderPreserving(first, second, third, fourth);
    }

    @Override
    public boolean consumesRemainder() {
        return fourth.consumesRemainder();
    }
}
