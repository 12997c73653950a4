package io.sortkv.storage;

import io.sortkv.common.Bound;
import io.sortkv.common.ByteArray;
import io.sortkv.common.CloseableIterator;
import io.sortkv.common.KVPair;
import io.sortkv.common.Range;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Reference {@link Store}: a sorted map behind a single lock.
 * <p>
 * {@link #range(Range)} copies the matching entries while holding the lock and returns an iterator over
 * that copy, so a scan is an atomic snapshot taken at call time and never blocks writers while it is
 * consumed.
 */
public final class InMemoryStore implements Store {

    private final NavigableMap<ByteArray, ByteArray> entries = new TreeMap<>();
    private final ReentrantLock lock = new ReentrantLock();

    @Override
    public Optional<ByteArray> fetch(ByteArray key) {
        Objects.requireNonNull(key, "key cannot be null");
        lock.lock();
        try {
            return Optional.ofNullable(entries.get(key));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void insert(ByteArray key, ByteArray value) {
        Objects.requireNonNull(key, "key cannot be null");
        Objects.requireNonNull(value, "value cannot be null");
        lock.lock();
        try {
            entries.put(key, value);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void remove(ByteArray key) {
        Objects.requireNonNull(key, "key cannot be null");
        lock.lock();
        try {
            entries.remove(key);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public CloseableIterator<KVPair> range(Range<ByteArray> range) {
        Objects.requireNonNull(range, "range cannot be null");
        if (range.isEmpty(Comparator.naturalOrder())) {
            return CloseableIterator.empty();
        }

        List<KVPair> snapshot;
        lock.lock();
        try {
            NavigableMap<ByteArray, ByteArray> view = select(range);
            snapshot = new ArrayList<>(view.size());
            for (var entry : view.entrySet()) {
                snapshot.add(new KVPair(entry.getKey(), entry.getValue()));
            }
        } finally {
            lock.unlock();
        }
        return CloseableIterator.wrap(snapshot.iterator());
    }

    /**
     * Applies every mutation under one lock acquisition, so readers observe all of them or none.
     */
    @Override
    public void write(List<Mutation> mutations) {
        lock.lock();
        try {
            for (Mutation mutation : mutations) {
                if (mutation instanceof Mutation.Put put) {
                    entries.put(put.key(), put.value());
                } else {
                    entries.remove(mutation.key());
                }
            }
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    private NavigableMap<ByteArray, ByteArray> select(Range<ByteArray> range) {
        NavigableMap<ByteArray, ByteArray> view = entries;
        if (range.start() instanceof Bound.Included<ByteArray> included) {
            view = view.tailMap(included.value(), true);
        } else if (range.start() instanceof Bound.Excluded<ByteArray> excluded) {
            view = view.tailMap(excluded.value(), false);
        }
        if (range.end() instanceof Bound.Included<ByteArray> included) {
            view = view.headMap(included.value(), true);
        } else if (range.end() instanceof Bound.Excluded<ByteArray> excluded) {
            view = view.headMap(excluded.value(), false);
        }
        return view;
    }
}
