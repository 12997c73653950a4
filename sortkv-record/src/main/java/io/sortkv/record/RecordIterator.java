package io.sortkv.record;

import io.sortkv.codec.Decoded;
import io.sortkv.codec.KeyDecodeException;
import io.sortkv.common.CloseableIterator;
import io.sortkv.common.KVPair;
import io.sortkv.storage.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.NoSuchElementException;

/**
 * Decodes store entries into records one at a time as the caller advances.
 */
final class RecordIterator<R, K> implements CloseableIterator<ReadResult<R>> {

    private static final Logger log = LoggerFactory.getLogger(RecordIterator.class);

    private final RecordMapper<R, K> mapper;
    private final CloseableIterator<KVPair> source;

    RecordIterator(RecordMapper<R, K> mapper, CloseableIterator<KVPair> source) {
        this.mapper = mapper;
        this.source = source;
    }

    @Override
    public boolean hasNext() {
        try {
            return source.hasNext();
        } catch (StoreException e) {
            throw new RecordReadException.StoreFailure(e);
        }
    }

    @Override
    public ReadResult<R> next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }

        KVPair pair;
        try {
            pair = source.next();
        } catch (StoreException e) {
            return failed(new RecordReadException.StoreFailure(e));
        }

        K key;
        try {
            Decoded<K> decoded = mapper.keyCodec().decode(pair.key());
            key = decoded.value();
        } catch (KeyDecodeException e) {
            return failed(new RecordReadException.KeyDecodeFailure(e));
        }

        try {
            return new ReadResult.Success<>(mapper.decode(key, pair.value()));
        } catch (ValueDecodeException e) {
            return failed(new RecordReadException.ValueDecodeFailure(e));
        }
    }

    @Override
    public void close() {
        source.close();
    }

    private ReadResult<R> failed(RecordReadException error) {
        log.atDebug()
            .addKeyValue("reason", error.getClass().getSimpleName())
            .setCause(error.getCause())
            .log("Entry could not be read during scan");
        return new ReadResult.Failure<>(error);
    }
}
