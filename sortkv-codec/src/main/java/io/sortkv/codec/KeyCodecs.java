package io.sortkv.codec;

import io.sortkv.codec.tuple.Tuple2Codec;
import io.sortkv.codec.tuple.Tuple3Codec;
import io.sortkv.codec.tuple.Tuple4Codec;
import io.sortkv.common.ByteArray;

import java.util.List;

/**
 * Entry point for the built-in key codecs.
 *
 * <table>
 *   <caption>Encodings</caption>
 *   <tr><th>Codec</th><th>Bytes</th><th>Order-preserving</th></tr>
 *   <tr><td>uint8..uint64</td><td>big-endian</td><td>yes</td></tr>
 *   <tr><td>int8..int64</td><td>big-endian, first byte XOR 0x80</td><td>yes</td></tr>
 *   <tr><td>float32, float64</td><td>sign bit set if non-negative, all bits inverted if negative</td><td>yes</td></tr>
 *   <tr><td>fixedBytes(n)</td><td>identity</td><td>yes</td></tr>
 *   <tr><td>bytes, string, listOf</td><td>8-byte big-endian length, then content</td><td>no</td></tr>
 *   <tr><td>greedyBytes, greedyString</td><td>content only, consumes the remainder</td><td>yes</td></tr>
 *   <tr><td>nulTerminatedString</td><td>UTF-8 then 0x00</td><td>yes</td></tr>
 *   <tr><td>tuple</td><td>field encodings concatenated</td><td>if every field is</td></tr>
 * </table>
 * <p>
 * Tuple codecs exist for two to four fields, and each declares its leading fields as prefixes. A key
 * with more fields nests tuples, for example {@code tuple(a, tuple(b, c, d, e))}, and then only the
 * outer codec's prefixes are declared. Leading groups that cross into the nested tuple need an explicit
 * {@link KeyPrefix#declare(KeyEncoder)} over a codec of the same leading fields.
 */
public final class KeyCodecs {

    private KeyCodecs() {}

    public static KeyCodec<Integer> uint8() {
        return IntegerCodecs.UINT8;
    }

    public static KeyCodec<Integer> uint16() {
        return IntegerCodecs.UINT16;
    }

    public static KeyCodec<Long> uint32() {
        return IntegerCodecs.UINT32;
    }

    public static KeyCodec<Long> uint64() {
        return IntegerCodecs.UINT64;
    }

    public static KeyCodec<Byte> int8() {
        return IntegerCodecs.INT8;
    }

    public static KeyCodec<Short> int16() {
        return IntegerCodecs.INT16;
    }

    public static KeyCodec<Integer> int32() {
        return IntegerCodecs.INT32;
    }

    public static KeyCodec<Long> int64() {
        return IntegerCodecs.INT64;
    }

    public static KeyCodec<Float> float32() {
        return FloatCodecs.FLOAT32;
    }

    public static KeyCodec<Double> float64() {
        return FloatCodecs.FLOAT64;
    }

    public static KeyCodec<ByteArray> fixedBytes(int width) {
        return new FixedBytesCodec(width);
    }

    public static KeyCodec<ByteArray> bytes() {
        return LengthPrefixedCodecs.BYTES;
    }

    public static KeyCodec<String> string() {
        return LengthPrefixedCodecs.STRING;
    }

    public static KeyCodec<String> nulTerminatedString() {
        return NulTerminatedStringCodec.INSTANCE;
    }

    public static KeyCodec<ByteArray> greedyBytes() {
        return GreedyCodecs.BYTES;
    }

    public static KeyCodec<String> greedyString() {
        return GreedyCodecs.STRING;
    }

    public static <T> KeyCodec<List<T>> listOf(KeyCodec<T> element) {
        return new ListCodec<>(element);
    }

    public static <A, B> Tuple2Codec<A, B> tuple(KeyCodec<A> first, KeyCodec<B> second) {
        return Tuple2Codec.of(first, second);
    }

    public static <A, B, C> Tuple3Codec<A, B, C> tuple(KeyCodec<A> first, KeyCodec<B> second, KeyCodec<C> third) {
        return Tuple3Codec.of(first, second, third);
    }

    public static <A, B, C, D> Tuple4Codec<A, B, C, D> tuple(
        KeyCodec<A> first,
        KeyCodec<B> second,
        KeyCodec<C> third,
        KeyCodec<D> fourth
    ) {
        return Tuple4Codec.of(first, second, third, fourth);
    }
}
