package io.sortkv.common;

import java.util.Comparator;
import java.util.Objects;

public record Range<T>(Bound<T> start, Bound<T> end) {

    public Range {
        Objects.requireNonNull(start, "start cannot be null");
        Objects.requireNonNull(end, "end cannot be null");
    }

    public static <T> Range<T> all() {
        return new Range<>(Bound.unbounded(), Bound.unbounded());
    }

    /** {@code [from, to]} */
    public static <T> Range<T> closed(T from, T to) {
        return new Range<>(Bound.included(from), Bound.included(to));
    }

    /** {@code [from, to)} */
    public static <T> Range<T> closedOpen(T from, T to) {
        return new Range<>(Bound.included(from), Bound.excluded(to));
    }

    /** {@code (from, to)} */
    public static <T> Range<T> open(T from, T to) {
        return new Range<>(Bound.excluded(from), Bound.excluded(to));
    }

    public static <T> Range<T> atLeast(T from) {
        return new Range<>(Bound.included(from), Bound.unbounded());
    }

    public static <T> Range<T> greaterThan(T from) {
        return new Range<>(Bound.excluded(from), Bound.unbounded());
    }

    public static <T> Range<T> atMost(T to) {
        return new Range<>(Bound.unbounded(), Bound.included(to));
    }

    public static <T> Range<T> lessThan(T to) {
        return new Range<>(Bound.unbounded(), Bound.excluded(to));
    }

    public boolean contains(T value, Comparator<? super T> comparator) {
        if (start instanceof Bound.Included<T> included && comparator.compare(value, included.value()) < 0) {
            return false;
        }
        if (start instanceof Bound.Excluded<T> excluded && comparator.compare(value, excluded.value()) <= 0) {
            return false;
        }
        if (end instanceof Bound.Included<T> included && comparator.compare(value, included.value()) > 0) {
            return false;
        }
        return !(end instanceof Bound.Excluded<T> excluded && comparator.compare(value, excluded.value()) >= 0);
    }

    /**
     * True when no value can satisfy both bounds.
     */
    public boolean isEmpty(Comparator<? super T> comparator) {
        T from = valueOf(start);
        T to = valueOf(end);
        if (from == null || to == null) {
            return false;
        }
        int cmp = comparator.compare(from, to);
        if (cmp > 0) {
            return true;
        }
        return cmp == 0 && !(start instanceof Bound.Included && end instanceof Bound.Included);
    }

    private static <T> T valueOf(Bound<T> bound) {
        if (bound instanceof Bound.Included<T> included) {
            return included.value();
        }
        if (bound instanceof Bound.Excluded<T> excluded) {
            return excluded.value();
        }
        return null;
    }
}
