package io.sortkv.codec;

import io.sortkv.common.ByteArray;

import java.util.Arrays;

/**
 * Growable big-endian byte sink used while encoding a key.
 */
public final class KeyWriter {

    private static final int DEFAULT_CAPACITY = 32;

    private byte[] buffer;
    private int position;

    public KeyWriter() {
        this(DEFAULT_CAPACITY);
    }

    public KeyWriter(int initialCapacity) {
        if (initialCapacity < 0) {
            throw new IllegalArgumentException("initialCapacity must be non-negative");
        }
        this.buffer = new byte[initialCapacity];
    }

    public KeyWriter writeByte(int value) {
        ensureCapacity(1);
        buffer[position++] = (byte) value;
        return this;
    }

    public KeyWriter writeShort(int value) {
        ensureCapacity(Short.BYTES);
        buffer[position++] = (byte) (value >>> 8);
        buffer[position++] = (byte) value;
        return this;
    }

    public KeyWriter writeInt(int value) {
        ensureCapacity(Integer.BYTES);
        for (int shift = 24; shift >= 0; shift -= 8) {
            buffer[position++] = (byte) (value >>> shift);
        }
        return this;
    }

    public KeyWriter writeLong(long value) {
        ensureCapacity(Long.BYTES);
        for (int shift = 56; shift >= 0; shift -= 8) {
            buffer[position++] = (byte) (value >>> shift);
        }
        return this;
    }

    public KeyWriter writeBytes(byte[] bytes) {
        ensureCapacity(bytes.length);
        System.arraycopy(bytes, 0, buffer, position, bytes.length);
        position += bytes.length;
        return this;
    }

    public KeyWriter writeBytes(ByteArray bytes) {
        ensureCapacity(bytes.size());
        bytes.copyTo(buffer, position);
        position += bytes.size();
        return this;
    }

    public int size() {
        return position;
    }

    public ByteArray toByteArray() {
        return ByteArray.wrap(Arrays.copyOf(buffer, position));
    }

    private void ensureCapacity(int additional) {
        int required = position + additional;
        if (required < 0) {
            throw new IllegalStateException("Encoded key exceeds maximum array size");
        }
        if (required > buffer.length) {
            buffer = Arrays.copyOf(buffer, Math.max(required, buffer.length * 2));
        }
    }
}
