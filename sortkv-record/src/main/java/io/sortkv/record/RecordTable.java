package io.sortkv.record;

import io.sortkv.codec.KeyBounds;
import io.sortkv.codec.KeyCodec;
import io.sortkv.codec.KeyPrefix;
import io.sortkv.common.ByteArray;
import io.sortkv.common.CloseableIterator;
import io.sortkv.common.KVPair;
import io.sortkv.common.Range;
import io.sortkv.storage.Store;
import io.sortkv.storage.StoreException;

import java.util.Objects;
import java.util.Optional;

/**
 * Typed fetch, scan, persist and remove of one record type over any {@link Store}.
 * <p>
 * Keys are encoded with the mapper's {@link KeyCodec}, so scans come back in the key's natural order
 * when the codec preserves order. The table holds no state besides its mapper and config; the store is
 * passed to every call and is never opened or closed here.
 * <p>
 * Read failures surface as {@link RecordReadException}, write failures as {@link RecordWriteException}.
 * Scans report per-entry failures as {@link ReadResult.Failure} items and keep going.
 */
public final class RecordTable<R, K> {

    private final RecordMapper<R, K> mapper;
    private final RecordTableConfig config;
    private final KeyPrefix<K, K> identity;

    private RecordTable(RecordMapper<R, K> mapper, RecordTableConfig config) {
        this.mapper = Objects.requireNonNull(mapper, "mapper cannot be null");
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.identity = KeyPrefix.identity(mapper.keyCodec());
    }

    public static <R, K> RecordTable<R, K> of(RecordMapper<R, K> mapper) {
        return new RecordTable<>(mapper, RecordTableConfig.defaults());
    }

    public static <R, K> RecordTable<R, K> of(RecordMapper<R, K> mapper, RecordTableConfig config) {
        return new RecordTable<>(mapper, config);
    }

    public RecordTableConfig config() {
        return config;
    }

    /**
     * @return the record stored under {@code key}, or empty if there is none
     * @throws RecordReadException.StoreFailure if the store fails
     * @throws RecordReadException.ValueDecodeFailure if the stored value cannot be decoded
     */
    public Optional<R> fetch(Store store, K key) {
        Objects.requireNonNull(key, "key cannot be null");
        ByteArray encoded = mapper.keyCodec().encode(key);

        Optional<ByteArray> value;
        try {
            value = store.fetch(encoded);
        } catch (StoreException e) {
            throw new RecordReadException.StoreFailure(e);
        }
        if (value.isEmpty()) {
            return Optional.empty();
        }

        try {
            return Optional.of(mapper.decode(key, value.get()));
        } catch (ValueDecodeException e) {
            throw new RecordReadException.ValueDecodeFailure(e);
        }
    }

    /**
     * Every entry in the store, in ascending key order.
     *
     * @throws RecordReadException.StoreFailure if the store cannot start the scan
     */
    public CloseableIterator<ReadResult<R>> scan(Store store) {
        return scanBytes(store, Range.all());
    }

    public CloseableIterator<ReadResult<R>> scanRange(Store store, Range<K> range) {
        return scanRange(store, identity, range);
    }

    /**
     * Entries between two prefix values. An included end bound follows {@link RecordTableConfig#inclusiveEnd()}.
     */
    public <P> CloseableIterator<ReadResult<R>> scanRange(Store store, KeyPrefix<P, K> prefix, Range<P> range) {
        return scanBytes(store, KeyBounds.encodeRange(range, prefix, config.inclusiveEnd()));
    }

    public CloseableIterator<ReadResult<R>> scanPrefix(Store store, K prefix) {
        return scanPrefix(store, identity, prefix);
    }

    /**
     * Entries whose encoded key starts with the encoding of {@code value}.
     */
    public <P> CloseableIterator<ReadResult<R>> scanPrefix(Store store, KeyPrefix<P, K> prefix, P value) {
        Objects.requireNonNull(value, "value cannot be null");
        return scanBytes(store, KeyBounds.prefixRange(prefix, value));
    }

    /**
     * Inserts the record, replacing any record with the same key. Nothing reaches the store if the
     * record or its key cannot be encoded.
     *
     * @throws RecordWriteException.EncodeFailure if the mapper or the key codec rejects the record
     * @throws RecordWriteException.StoreFailure if the store fails
     */
    public void persist(Store store, R record) {
        Objects.requireNonNull(record, "record cannot be null");
        RecordEntry<K> entry;
        try {
            entry = mapper.encode(record);
        } catch (ValueEncodeException e) {
            throw new RecordWriteException.EncodeFailure(e);
        }

        ByteArray key = encodeKeyForWrite(entry.key());
        try {
            store.insert(key, entry.value());
        } catch (StoreException e) {
            throw new RecordWriteException.StoreFailure(e);
        }
    }

    public void remove(Store store, K key) {
        Objects.requireNonNull(key, "key cannot be null");
        ByteArray encoded = encodeKeyForWrite(key);
        try {
            store.remove(encoded);
        } catch (StoreException e) {
            throw new RecordWriteException.StoreFailure(e);
        }
    }

    private ByteArray encodeKeyForWrite(K key) {
        try {
            return mapper.keyCodec().encode(key);
        } catch (IllegalArgumentException e) {
            throw new RecordWriteException.EncodeFailure(e);
        }
    }

    private CloseableIterator<ReadResult<R>> scanBytes(Store store, Range<ByteArray> range) {
        Objects.requireNonNull(store, "store cannot be null");
        CloseableIterator<KVPair> source;
        try {
            source = store.range(range);
        } catch (StoreException e) {
            throw new RecordReadException.StoreFailure(e);
        }
        return new RecordIterator<>(mapper, source);
    }
}
