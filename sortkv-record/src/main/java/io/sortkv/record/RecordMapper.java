package io.sortkv.record;

import io.sortkv.codec.KeyCodec;
import io.sortkv.common.ByteArray;

/**
 * Maps an application record to a typed key and an opaque value, and back.
 *
 * @param <R> the record type
 * @param <K> the key type
 */
public interface RecordMapper<R, K> {

    KeyCodec<K> keyCodec();

    /**
     * @throws ValueEncodeException if the record cannot be written
     */
    RecordEntry<K> encode(R record);

    /**
     * Rebuilds a record from its key and stored value. Called for every fetch and scan; nothing is cached.
     *
     * @throws ValueDecodeException if {@code value} is not a valid payload
     */
    R decode(K key, ByteArray value);
}
