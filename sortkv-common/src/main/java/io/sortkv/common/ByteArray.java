package io.sortkv.common;

import java.nio.ByteBuffer;
import java.util.Arrays;
import java.util.HexFormat;

/**
 * Immutable view over a range of a byte array.
 * <p>
 * Ordering is unsigned byte-lexicographic, the order every sorted key-value engine uses for its keys.
 * {@link #slice(int, int)} shares the underlying array, so decoding a composite key never copies.
 */
public final class ByteArray implements Comparable<ByteArray> {

    private static final ByteArray EMPTY = new ByteArray(new byte[0], 0, 0);

    private final byte[] data;
    private final int offset;
    private final int length;

    private ByteArray(byte[] data, int offset, int length) {
        this.data = data;
        this.offset = offset;
        this.length = length;
    }

    public static ByteArray of(byte... bytes) {
        return copyOf(bytes);
    }

    public static ByteArray copyOf(byte[] bytes) {
        if (bytes.length == 0) {
            return EMPTY;
        }
        return new ByteArray(bytes.clone(), 0, bytes.length);
    }

    public static ByteArray copyOf(byte[] bytes, int offset, int length) {
        checkRange(bytes.length, offset, length);
        if (length == 0) {
            return EMPTY;
        }
        return new ByteArray(Arrays.copyOfRange(bytes, offset, offset + length), 0, length);
    }

    /**
     * Wraps without copying. The caller must not modify {@code bytes} afterwards.
     */
    public static ByteArray wrap(byte[] bytes) {
        if (bytes.length == 0) {
            return EMPTY;
        }
        return new ByteArray(bytes, 0, bytes.length);
    }

    /**
     * Wraps a range without copying. The caller must not modify {@code bytes} afterwards.
     */
    public static ByteArray wrap(byte[] bytes, int offset, int length) {
        checkRange(bytes.length, offset, length);
        if (length == 0) {
            return EMPTY;
        }
        return new ByteArray(bytes, offset, length);
    }

    public static ByteArray empty() {
        return EMPTY;
    }

    public int size() {
        return length;
    }

    public boolean isEmpty() {
        return length == 0;
    }

    public byte get(int index) {
        if (index < 0 || index >= length) {
            throw new IndexOutOfBoundsException("Index %d out of bounds for size %d".formatted(index, length));
        }
        return data[offset + index];
    }

    public int getUnsigned(int index) {
        return Byte.toUnsignedInt(get(index));
    }

    public ByteArray slice(int from, int length) {
        checkRange(this.length, from, length);
        if (length == 0) {
            return EMPTY;
        }
        return new ByteArray(data, offset + from, length);
    }

    public ByteArray slice(int from) {
        return slice(from, length - from);
    }

    public boolean startsWith(ByteArray prefix) {
        if (prefix.length > length) {
            return false;
        }
        return Arrays.equals(
            data, offset, offset + prefix.length,
            prefix.data, prefix.offset, prefix.offset + prefix.length
        );
    }

    public ByteArray concat(ByteArray other) {
        if (other.isEmpty()) {
            return this;
        }
        if (isEmpty()) {
            return other;
        }
        byte[] joined = new byte[length + other.length];
        copyTo(joined, 0);
        other.copyTo(joined, length);
        return new ByteArray(joined, 0, joined.length);
    }

    public void copyTo(byte[] target, int targetOffset) {
        System.arraycopy(data, offset, target, targetOffset, length);
    }

    public ByteBuffer asByteBuffer() {
        return ByteBuffer.wrap(data, offset, length).asReadOnlyBuffer();
    }

    public byte[] toByteArray() {
        return Arrays.copyOfRange(data, offset, offset + length);
    }

    @Override
    public int compareTo(ByteArray other) {
        return Arrays.compareUnsigned(
            data, offset, offset + length,
            other.data, other.offset, other.offset + other.length
        );
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        return obj instanceof ByteArray other
            && Arrays.equals(data, offset, offset + length, other.data, other.offset, other.offset + other.length);
    }

    @Override
    public int hashCode() {
        int h = 1;
        for (int i = offset; i < offset + length; i++) {
            h = 31 * h + data[i];
        }
        return h;
    }

    @Override
    public String toString() {
        if (length == 0) {
            return "ByteArray[]";
        }
        String hex = HexFormat.of().formatHex(data, offset, offset + length);
        if (hex.length() > 32) {
            return "ByteArray[" + hex.substring(0, 32) + "... (" + length + " bytes)]";
        }
        return "ByteArray[" + hex + "]";
    }

    private static void checkRange(int size, int offset, int length) {
        if (offset < 0 || length < 0 || offset + length > size) {
            throw new IndexOutOfBoundsException(
                "Invalid offset=%d, length=%d for array of size %d".formatted(offset, length, size)
            );
        }
    }
}
