package io.sortkv.codec;

import io.sortkv.common.ByteArray;

/**
 * Fixed-width integer codecs. Unsigned values are written big-endian as is; signed values are written
 * big-endian with the sign bit flipped so that negatives sort below non-negatives.
 */
final class IntegerCodecs {

    static final KeyCodec<Integer> UINT8 = new FixedWidthCodec<>(Byte.BYTES) {
        @Override
        void write(Integer value, KeyWriter writer) {
            writer.writeByte(checkUnsigned(value, 0xFFL, "uint8"));
        }

        @Override
        Integer read(ByteArray bytes) {
            return bytes.getUnsigned(0);
        }
    };

    static final KeyCodec<Integer> UINT16 = new FixedWidthCodec<>(Short.BYTES) {
        @Override
        void write(Integer value, KeyWriter writer) {
            writer.writeShort(checkUnsigned(value, 0xFFFFL, "uint16"));
        }

        @Override
        Integer read(ByteArray bytes) {
            return (int) readBigEndian(bytes);
        }
    };

    static final KeyCodec<Long> UINT32 = new FixedWidthCodec<>(Integer.BYTES) {
        @Override
        void write(Long value, KeyWriter writer) {
            if (value < 0 || value > 0xFFFF_FFFFL) {
                throw new IllegalArgumentException("Value %d out of range for uint32".formatted(value));
            }
            writer.writeInt(value.intValue());
        }

        @Override
        Long read(ByteArray bytes) {
            return readBigEndian(bytes);
        }
    };

    /** Every {@code long} is accepted and interpreted as unsigned, as {@link Long#compareUnsigned} does. */
    static final KeyCodec<Long> UINT64 = new FixedWidthCodec<>(Long.BYTES) {
        @Override
        void write(Long value, KeyWriter writer) {
            writer.writeLong(value);
        }

        @Override
        Long read(ByteArray bytes) {
            return readBigEndian(bytes);
        }
    };

    static final KeyCodec<Byte> INT8 = new FixedWidthCodec<>(Byte.BYTES) {
        @Override
        void write(Byte value, KeyWriter writer) {
            writer.writeByte(value ^ 0x80);
        }

        @Override
        Byte read(ByteArray bytes) {
            return (byte) (bytes.get(0) ^ 0x80);
        }
    };

    static final KeyCodec<Short> INT16 = new FixedWidthCodec<>(Short.BYTES) {
        @Override
        void write(Short value, KeyWriter writer) {
            writer.writeShort(value ^ 0x8000);
        }

        @Override
        Short read(ByteArray bytes) {
            return (short) (readBigEndian(bytes) ^ 0x8000);
        }
    };

    static final KeyCodec<Integer> INT32 = new FixedWidthCodec<>(Integer.BYTES) {
        @Override
        void write(Integer value, KeyWriter writer) {
            writer.writeInt(value ^ Integer.MIN_VALUE);
        }

        @Override
        Integer read(ByteArray bytes) {
            return (int) readBigEndian(bytes) ^ Integer.MIN_VALUE;
        }
    };

    static final KeyCodec<Long> INT64 = new FixedWidthCodec<>(Long.BYTES) {
        @Override
        void write(Long value, KeyWriter writer) {
            writer.writeLong(value ^ Long.MIN_VALUE);
        }

        @Override
        Long read(ByteArray bytes) {
            return readBigEndian(bytes) ^ Long.MIN_VALUE;
        }
    };

    private IntegerCodecs() {}

    private static int checkUnsigned(int value, long max, String type) {
        if (value < 0 || value > max) {
            throw new IllegalArgumentException("Value %d out of range for %s".formatted(value, type));
        }
        return value;
    }
}
