package io.sortkv.codec;

import io.sortkv.common.ByteArray;
import org.junit.jupiter.api.Test;

import static io.sortkv.codec.CodecAssertions.*;
import static org.assertj.core.api.Assertions.*;

class KeyWriterTest {

    @Test
    void writesBigEndian() {
        KeyWriter writer = new KeyWriter()
            .writeByte(0xAB)
            .writeShort(0x0102)
            .writeInt(0x03040506)
            .writeLong(0x0708090A0B0C0D0EL);

        assertThat(writer.toByteArray())
            .isEqualTo(bytes(0xAB, 1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11, 12, 13, 14));
    }

    @Test
    void growsPastItsInitialCapacity() {
        KeyWriter writer = new KeyWriter(0);

        writer.writeBytes(bytes(1, 2, 3));
        writer.writeBytes(new byte[] {4});

        assertThat(writer.size()).isEqualTo(4);
        assertThat(writer.toByteArray()).isEqualTo(bytes(1, 2, 3, 4));
    }

    @Test
    void presizedWriterHoldsExactlyItsContent() {
        KeyWriter writer = new KeyWriter(Long.BYTES);

        writer.writeLong(-1L);

        assertThat(writer.toByteArray()).isEqualTo(bytes(0xFF, 0xFF, 0xFF, 0xFF, 0xFF, 0xFF, 0xFF, 0xFF));
    }

    @Test
    void rejectsNegativeCapacity() {
        assertThatThrownBy(() -> new KeyWriter(-1))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("initialCapacity must be non-negative");
    }

    @Test
    void fixedWidthEncodingMatchesTheStreamingPath() {
        KeyWriter writer = new KeyWriter();
        KeyCodecs.int32().encode(-7, writer);

        ByteArray direct = KeyCodecs.int32().encode(-7);

        assertThat(direct).isEqualTo(writer.toByteArray());
        assertThat(direct.size()).isEqualTo(Integer.BYTES);
    }
}
