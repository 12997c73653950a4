package io.sortkv.codec;

import io.sortkv.common.Bound;
import io.sortkv.common.ByteArray;
import io.sortkv.common.Range;

import java.util.Objects;
import java.util.Optional;

/**
 * Turns prefixes and typed range bounds into the byte ranges a sorted store scans.
 */
public final class KeyBounds {

    private static final int MAX_BYTE = 0xFF;

    private KeyBounds() {}

    /**
     * The smallest byte string greater than every string starting with {@code prefix}: the rightmost
     * byte below {@code 0xFF} is incremented and everything after it dropped.
     *
     * @return the exclusive upper bound, or empty when the prefix is empty or all {@code 0xFF}
     */
    public static Optional<ByteArray> upperBound(ByteArray prefix) {
        for (int i = prefix.size() - 1; i >= 0; i--) {
            int b = prefix.getUnsigned(i);
            if (b < MAX_BYTE) {
                byte[] bound = prefix.slice(0, i + 1).toByteArray();
                bound[i] = (byte) (b + 1);
                return Optional.of(ByteArray.wrap(bound));
            }
        }
        return Optional.empty();
    }

    /**
     * {@code [prefix, upperBound(prefix))}, or {@code [prefix, +inf)} when there is no finite bound.
     */
    public static Range<ByteArray> prefixRange(ByteArray prefix) {
        Bound<ByteArray> end = upperBound(prefix)
            .<Bound<ByteArray>>map(Bound::excluded)
            .orElse(Bound.unbounded());
        return new Range<>(Bound.included(prefix), end);
    }

    public static <P> Range<ByteArray> prefixRange(KeyPrefix<P, ?> prefix, P value) {
        return prefixRange(prefix.encode(value));
    }

    /**
     * Encodes both bounds of a typed range. The start bound and an excluded end bound carry over
     * unchanged; an included end bound follows {@code inclusiveEnd}.
     */
    public static <P> Range<ByteArray> encodeRange(Range<P> range, KeyPrefix<P, ?> prefix, InclusiveEnd inclusiveEnd) {
        Objects.requireNonNull(range, "range cannot be null");
        Objects.requireNonNull(prefix, "prefix cannot be null");
        Objects.requireNonNull(inclusiveEnd, "inclusiveEnd cannot be null");

        Bound<ByteArray> start = encodeBound(range.start(), prefix);
        Bound<ByteArray> end = encodeBound(range.end(), prefix);

        if (inclusiveEnd == InclusiveEnd.NESTED && end instanceof Bound.Included<ByteArray> included) {
            end = upperBound(included.value())
                .<Bound<ByteArray>>map(Bound::excluded)
                .orElse(Bound.unbounded());
        }
        return new Range<>(start, end);
    }

    private static <P> Bound<ByteArray> encodeBound(Bound<P> bound, KeyPrefix<P, ?> prefix) {
        if (bound instanceof Bound.Included<P> included) {
            return Bound.included(prefix.encode(included.value()));
        }
        if (bound instanceof Bound.Excluded<P> excluded) {
            return Bound.excluded(prefix.encode(excluded.value()));
        }
        return Bound.unbounded();
    }
}
