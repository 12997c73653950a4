package io.sortkv.storage;

import io.sortkv.common.ByteArray;

import java.util.Objects;

public sealed interface Mutation permits Mutation.Put, Mutation.Delete {

    ByteArray key();

    record Put(ByteArray key, ByteArray value) implements Mutation {
        public Put {
            Objects.requireNonNull(key, "key cannot be null");
            Objects.requireNonNull(value, "value cannot be null");
        }
    }

    record Delete(ByteArray key) implements Mutation {
        public Delete {
            Objects.requireNonNull(key, "key cannot be null");
        }
    }
}
