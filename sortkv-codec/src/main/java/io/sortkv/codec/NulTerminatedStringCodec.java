package io.sortkv.codec;

import io.sortkv.common.ByteArray;

/**
 * UTF-8 text followed by a single {@code 0x00}. Strings containing U+0000 cannot be encoded.
 * <p>
 * Because the terminator is smaller than any UTF-8 byte, a shorter string sorts before every string it
 * is a prefix of, so the encoding preserves order.
 */
final class NulTerminatedStringCodec implements KeyCodec<String> {

    static final NulTerminatedStringCodec INSTANCE = new NulTerminatedStringCodec();

    private NulTerminatedStringCodec() {}

    @Override
    public void encode(String value, KeyWriter writer) {
        if (value.indexOf('\0') >= 0) {
            throw new IllegalArgumentException("NUL-terminated string cannot contain U+0000");
        }
        writer.writeBytes(Utf8.encode(value));
        writer.writeByte(0);
    }

    @Override
    public Decoded<String> decode(ByteArray bytes) {
        for (int i = 0; i < bytes.size(); i++) {
            if (bytes.get(i) == 0) {
                return new Decoded<>(Utf8.decode(bytes.slice(0, i)), bytes.slice(i + 1));
            }
        }
        throw new KeyDecodeException.MissingTerminator(bytes.size());
    }

    @Override
    public boolean orderPreserving() {
        return true;
    }
}
