package io.sortkv.codec;

import io.sortkv.common.ByteArray;

/**
 * Codecs without a length header that take every remaining byte on decode. Their byte order matches
 * the natural order of the content, which makes them the right last field for string prefix scans.
 */
final class GreedyCodecs {

    static final KeyCodec<ByteArray> BYTES = new Greedy<>() {
        @Override
        public void encode(ByteArray value, KeyWriter writer) {
            writer.writeBytes(value);
        }

        @Override
        public Decoded<ByteArray> decode(ByteArray bytes) {
            return new Decoded<>(bytes, ByteArray.empty());
        }
    };

    static final KeyCodec<String> STRING = new Greedy<>() {
        @Override
        public void encode(String value, KeyWriter writer) {
            writer.writeBytes(Utf8.encode(value));
        }

        @Override
        public Decoded<String> decode(ByteArray bytes) {
            return new Decoded<>(Utf8.decode(bytes), ByteArray.empty());
        }
    };

    private GreedyCodecs() {}

    private abstract static class Greedy<T> implements KeyCodec<T> {

        @Override
        public boolean orderPreserving() {
            return true;
        }

        @Override
        public boolean consumesRemainder() {
            return true;
        }
    }
}
