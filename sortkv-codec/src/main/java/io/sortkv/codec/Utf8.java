package io.sortkv.codec;

import io.sortkv.common.ByteArray;

import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

final class Utf8 {

    private Utf8() {}

    static byte[] encode(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }

    static String decode(ByteArray bytes) {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT)
                .decode(bytes.asByteBuffer())
                .toString();
        } catch (CharacterCodingException e) {
            throw new KeyDecodeException.MalformedText("Invalid UTF-8 in %d bytes".formatted(bytes.size()), e);
        }
    }
}
