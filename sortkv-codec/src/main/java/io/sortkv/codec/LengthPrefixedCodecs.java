package io.sortkv.codec;

import io.sortkv.common.ByteArray;

/**
 * Variable-length codecs: an 8-byte big-endian length header followed by the content.
 * <p>
 * The header compares before the content, so these encodings do not preserve the natural order
 * of strings or byte sequences. Use a greedy codec as the last key field when ordering matters.
 */
final class LengthPrefixedCodecs {

    static final int HEADER_BYTES = Long.BYTES;

    static final KeyCodec<ByteArray> BYTES = new KeyCodec<>() {
        @Override
        public void encode(ByteArray value, KeyWriter writer) {
            writer.writeLong(value.size());
            writer.writeBytes(value);
        }

        @Override
        public Decoded<ByteArray> decode(ByteArray bytes) {
            int length = readLength(bytes);
            ByteArray body = bytes.slice(HEADER_BYTES);
            return new Decoded<>(body.slice(0, length), body.slice(length));
        }

        @Override
        public boolean orderPreserving() {
            return false;
        }
    };

    static final KeyCodec<String> STRING = new KeyCodec<>() {
        @Override
        public void encode(String value, KeyWriter writer) {
            byte[] utf8 = Utf8.encode(value);
            writer.writeLong(utf8.length);
            writer.writeBytes(utf8);
        }

        @Override
        public Decoded<String> decode(ByteArray bytes) {
            int length = readLength(bytes);
            ByteArray body = bytes.slice(HEADER_BYTES);
            return new Decoded<>(Utf8.decode(body.slice(0, length)), body.slice(length));
        }

        @Override
        public boolean orderPreserving() {
            return false;
        }
    };

    private LengthPrefixedCodecs() {}

    /**
     * Reads the header and checks that the declared number of bytes follows it.
     */
    static int readLength(ByteArray bytes) {
        long declared = readHeader(bytes);
        long available = bytes.size() - HEADER_BYTES;
        if (declared < 0 || declared > available) {
            throw new KeyDecodeException.DataTooShort(declared, available);
        }
        return (int) declared;
    }

    static long readHeader(ByteArray bytes) {
        if (bytes.size() < HEADER_BYTES) {
            throw new KeyDecodeException.DataTooShort(HEADER_BYTES, bytes.size());
        }
        return FixedWidthCodec.readBigEndian(bytes.slice(0, HEADER_BYTES));
    }
}
