package io.sortkv.codec;

import io.sortkv.common.ByteArray;

import java.util.Objects;

/**
 * Declares that every encoding of a {@code P} is a byte prefix of some valid encoding of a {@code K}.
 * <p>
 * A declaration is the only thing that allows a {@code P} to drive a prefix or range scan over keys of
 * type {@code K}. The relation is never inferred: tuple codecs declare their leading fields, and
 * {@link #identity(KeyEncoder)} declares a key type to be a prefix of itself.
 *
 * @param <P> the prefix type
 * @param <K> the full key type
 */
public final class KeyPrefix<P, K> {

    private final KeyEncoder<? super P> encoder;

    private KeyPrefix(KeyEncoder<? super P> encoder) {
        this.encoder = Objects.requireNonNull(encoder, "encoder cannot be null");
    }

    public static <K> KeyPrefix<K, K> identity(KeyEncoder<? super K> codec) {
        return new KeyPrefix<>(codec);
    }

    /**
     * Declares {@code P} a prefix of {@code K}. The caller is responsible for the prefix property holding
     * for every value of {@code P}.
     */
    public static <P, K> KeyPrefix<P, K> declare(KeyEncoder<? super P> encoder) {
        return new KeyPrefix<>(encoder);
    }

    public ByteArray encode(P prefix) {
        return encoder.encode(prefix);
    }
}
