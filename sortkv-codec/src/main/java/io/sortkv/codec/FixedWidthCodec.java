package io.sortkv.codec;

import io.sortkv.common.ByteArray;

abstract class FixedWidthCodec<T> implements KeyCodec<T> {

    private final int width;

    FixedWidthCodec(int width) {
        this.width = width;
    }

    abstract void write(T value, KeyWriter writer);

    /** {@code bytes} is exactly {@link #width()} long. */
    abstract T read(ByteArray bytes);

    final int width() {
        return width;
    }

    @Override
    public final void encode(T value, KeyWriter writer) {
        write(value, writer);
    }

    @Override
    public ByteArray encode(T value) {
        KeyWriter writer = new KeyWriter(width);
        write(value, writer);
        return writer.toByteArray();
    }

    @Override
    public final Decoded<T> decode(ByteArray bytes) {
        if (bytes.size() < width) {
            throw new KeyDecodeException.DataTooShort(width, bytes.size());
        }
        return new Decoded<>(read(bytes.slice(0, width)), bytes.slice(width));
    }

    @Override
    public boolean orderPreserving() {
        return true;
    }

    static long readBigEndian(ByteArray bytes) {
        long result = 0;
        for (int i = 0; i < bytes.size(); i++) {
            result = (result << 8) | bytes.getUnsigned(i);
        }
        return result;
    }
}
