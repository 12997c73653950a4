package io.sortkv.storage;

import io.sortkv.common.ByteArray;
import io.sortkv.common.CloseableIterator;
import io.sortkv.common.KVPair;
import io.sortkv.common.Range;

import java.util.List;
import java.util.Optional;

/**
 * Minimal capability contract of an ordered byte-keyed container.
 * <p>
 * Keys are ordered by unsigned byte-lexicographic comparison. Every method may throw a
 * {@link StoreException}; its cause is backend specific and callers pass it through untouched.
 * Opening, closing and durability belong to the backend and are not part of this contract.
 */
public interface Store {

    Optional<ByteArray> fetch(ByteArray key);

    /**
     * Inserts or overwrites the value stored under {@code key}.
     */
    void insert(ByteArray key, ByteArray value);

    void remove(ByteArray key);

    /**
     * Entries whose keys fall in {@code range}, in ascending key order without duplicates.
     * <p>
     * The iterator's {@code next()} may throw a {@link StoreException} for a single entry. Whether
     * iteration sees a snapshot or live data is defined by each implementation. Closing an iterator
     * early must release everything it holds.
     *
     * @throws StoreException.Unsupported if this realization cannot scan
     */
    CloseableIterator<KVPair> range(Range<ByteArray> range);

    /**
     * Applies mutations in order. Implementations that can apply them atomically should override this.
     */
    default void write(List<Mutation> mutations) {
        for (Mutation mutation : mutations) {
            if (mutation instanceof Mutation.Put put) {
                insert(put.key(), put.value());
            } else {
                remove(mutation.key());
            }
        }
    }
}
