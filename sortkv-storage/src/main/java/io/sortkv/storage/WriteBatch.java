package io.sortkv.storage;

import io.sortkv.common.ByteArray;
import io.sortkv.common.CloseableIterator;
import io.sortkv.common.KVPair;
import io.sortkv.common.Range;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Stages writes against a target store and applies them together on {@link #commit()}.
 * <p>
 * {@link #fetch(ByteArray)} sees the batch's own staged writes before falling back to the target.
 * Scans are refused with {@link StoreException.Unsupported}: a batch cannot merge its staged writes
 * into an ordered view. Not thread-safe.
 */
public final class WriteBatch implements Store {

    private static final Logger log = LoggerFactory.getLogger(WriteBatch.class);

    private final Store target;
    private final List<Mutation> mutations = new ArrayList<>();
    private final Map<ByteArray, Mutation> latest = new HashMap<>();
    private boolean committed;

    private WriteBatch(Store target) {
        this.target = Objects.requireNonNull(target, "target cannot be null");
    }

    public static WriteBatch on(Store target) {
        return new WriteBatch(target);
    }

    @Override
    public Optional<ByteArray> fetch(ByteArray key) {
        Objects.requireNonNull(key, "key cannot be null");
        Mutation staged = latest.get(key);
        if (staged instanceof Mutation.Put put) {
            return Optional.of(put.value());
        }
        if (staged instanceof Mutation.Delete) {
            return Optional.empty();
        }
        return target.fetch(key);
    }

    @Override
    public void insert(ByteArray key, ByteArray value) {
        stage(new Mutation.Put(key, value));
    }

    @Override
    public void remove(ByteArray key) {
        stage(new Mutation.Delete(key));
    }

    @Override
    public CloseableIterator<KVPair> range(Range<ByteArray> range) {
        log.atDebug()
            .addKeyValue("range", range)
            .log("Rejected range scan on write batch");
        throw new StoreException.Unsupported("range", "write batches do not support scans");
    }

    public int size() {
        return mutations.size();
    }

    public boolean isEmpty() {
        return mutations.isEmpty();
    }

    public List<Mutation> mutations() {
        return List.copyOf(mutations);
    }

    /**
     * Hands every staged mutation to the target's {@link Store#write(List)}. A batch commits once; if the
     * target fails, the batch stays open and can be committed again.
     */
    public void commit() {
        checkOpen();
        if (mutations.isEmpty()) {
            committed = true;
            return;
        }
        target.write(List.copyOf(mutations));
        committed = true;
        log.atDebug()
            .addKeyValue("mutations", mutations.size())
            .addKeyValue("keys", latest.size())
            .log("Committed write batch");
    }

    private void stage(Mutation mutation) {
        checkOpen();
        mutations.add(mutation);
        latest.put(mutation.key(), mutation);
    }

    private void checkOpen() {
        if (committed) {
            throw new IllegalStateException("Write batch already committed");
        }
    }
}
