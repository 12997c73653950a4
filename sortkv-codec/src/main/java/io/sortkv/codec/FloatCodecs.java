package io.sortkv.codec;

import io.sortkv.common.ByteArray;

/**
 * IEEE-754 codecs. The raw big-endian bit pattern of a non-negative number gets its sign bit set; a
 * negative number has every bit inverted. Non-negatives then sort above negatives, and the inversion
 * puts negatives back in ascending numeric order. The relative order of NaNs is unspecified.
 */
final class FloatCodecs {

    static final KeyCodec<Float> FLOAT32 = new FixedWidthCodec<>(Float.BYTES) {
        @Override
        void write(Float value, KeyWriter writer) {
            int bits = Float.floatToRawIntBits(value);
            writer.writeInt(bits < 0 ? ~bits : bits ^ Integer.MIN_VALUE);
        }

        @Override
        Float read(ByteArray bytes) {
            int bits = (int) readBigEndian(bytes);
            return Float.intBitsToFloat(bits < 0 ? bits ^ Integer.MIN_VALUE : ~bits);
        }
    };

    static final KeyCodec<Double> FLOAT64 = new FixedWidthCodec<>(Double.BYTES) {
        @Override
        void write(Double value, KeyWriter writer) {
            long bits = Double.doubleToRawLongBits(value);
            writer.writeLong(bits < 0 ? ~bits : bits ^ Long.MIN_VALUE);
        }

        @Override
        Double read(ByteArray bytes) {
            long bits = readBigEndian(bytes);
            return Double.longBitsToDouble(bits < 0 ? bits ^ Long.MIN_VALUE : ~bits);
        }
    };

    private FloatCodecs() {}
}
