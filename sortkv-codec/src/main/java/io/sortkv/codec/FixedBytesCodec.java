package io.sortkv.codec;

import io.sortkv.common.ByteArray;

final class FixedBytesCodec extends FixedWidthCodec<ByteArray> {

    FixedBytesCodec(int width) {
        super(width);
        if (width < 0) {
            throw new IllegalArgumentException("width must be non-negative");
        }
    }

    @Override
    void write(ByteArray value, KeyWriter writer) {
        if (value.size() != width()) {
            throw new IllegalArgumentException(
                "Expected exactly %d bytes, got %d".formatted(width(), value.size())
            );
        }
        writer.writeBytes(value);
    }

    @Override
    ByteArray read(ByteArray bytes) {
        return bytes;
    }
}
