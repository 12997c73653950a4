package io.sortkv.codec;

import io.sortkv.common.ByteArray;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A sequence of elements: 8-byte big-endian element count, then each element's encoding.
 * <p>
 * Every element must encode to at least one byte, so a count larger than the bytes that follow it is
 * rejected before any element is decoded.
 */
final class ListCodec<T> implements KeyCodec<List<T>> {

    private final KeyCodec<T> element;

    ListCodec(KeyCodec<T> element) {
        this.element = Objects.requireNonNull(element, "element cannot be null");
        if (element.consumesRemainder()) {
            throw new IllegalArgumentException("A codec that consumes the remainder cannot be a list element");
        }
        if (element instanceof FixedWidthCodec<?> fixed && fixed.width() == 0) {
            throw new IllegalArgumentException("List elements must encode to at least one byte");
        }
    }

    @Override
    public void encode(List<T> value, KeyWriter writer) {
        writer.writeLong(value.size());
        for (T item : value) {
            int before = writer.size();
            element.encode(item, writer);
            if (writer.size() == before) {
                throw new IllegalArgumentException("List elements must encode to at least one byte");
            }
        }
    }

    @Override
    public Decoded<List<T>> decode(ByteArray bytes) {
        long count = LengthPrefixedCodecs.readHeader(bytes);
        ByteArray remaining = bytes.slice(LengthPrefixedCodecs.HEADER_BYTES);

        if (Long.compareUnsigned(count, remaining.size()) > 0) {
            throw new KeyDecodeException.DataTooShort(count, remaining.size());
        }

        List<T> items = new ArrayList<>((int) count);
        for (long i = 0; Long.compareUnsigned(i, count) < 0; i++) {
            try {
                Decoded<T> decoded = element.decode(remaining);
                items.add(decoded.value());
                remaining = decoded.remaining();
            } catch (KeyDecodeException e) {
                throw new KeyDecodeException.ElementFailure(i, e);
            }
        }
        return new Decoded<>(Collections.unmodifiableList(items), remaining);
    }

    @Override
    public boolean orderPreserving() {
        return false;
    }
}
