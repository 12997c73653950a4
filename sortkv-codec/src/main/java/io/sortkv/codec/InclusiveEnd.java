package io.sortkv.codec;

/**
 * How an included end bound of a typed range becomes a byte bound.
 */
public enum InclusiveEnd {

    /**
     * Include keys whose encoding equals the end value's encoding. Keys nested under a composite end
     * value (longer keys sharing its bytes) fall outside the range.
     */
    EXACT,

    /**
     * Include every key whose encoding starts with the end value's encoding, by turning the bound into
     * the exclusive carry-increment of the encoding. For fixed-width keys this selects the same keys as
     * {@link #EXACT}.
     */
    NESTED
}
