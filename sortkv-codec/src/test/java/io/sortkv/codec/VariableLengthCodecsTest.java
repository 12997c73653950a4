package io.sortkv.codec;

import io.sortkv.common.ByteArray;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.sortkv.codec.CodecAssertions.*;
import static org.assertj.core.api.Assertions.*;

class VariableLengthCodecsTest {

    @Nested
    class LengthPrefixed {

        @Test
        void writesEightByteHeaderThenContent() {
            assertThat(KeyCodecs.string().encode("hi"))
                .isEqualTo(bytes(0, 0, 0, 0, 0, 0, 0, 2, 'h', 'i'));
        }

        @Test
        void roundTripsMultiByteText() {
            assertRoundTrip(KeyCodecs.string(), "");
            assertRoundTrip(KeyCodecs.string(), "Hello there!");
            assertRoundTrip(KeyCodecs.string(), "grüße ☃");
            assertRoundTrip(KeyCodecs.bytes(), bytes(0, 0xFF, 7));
        }

        @Test
        void leavesFollowingFieldsUntouched() {
            ByteArray encoded = KeyCodecs.bytes().encode(bytes(1, 2)).concat(bytes(9));

            Decoded<ByteArray> decoded = KeyCodecs.bytes().decode(encoded);

            assertThat(decoded.value()).isEqualTo(bytes(1, 2));
            assertThat(decoded.remaining()).isEqualTo(bytes(9));
        }

        @Test
        void shorterContentSortsFirstRegardlessOfText() {
            assertThat(KeyCodecs.string().orderPreserving()).isFalse();
            assertThat(KeyCodecs.string().encode("z")).isLessThan(KeyCodecs.string().encode("aa"));
        }

        @Test
        void truncatedHeaderReportsHeaderWidth() {
            assertThatThrownBy(() -> KeyCodecs.string().decode(bytes(0, 0, 0)))
                .isInstanceOfSatisfying(KeyDecodeException.DataTooShort.class, e -> {
                    assertThat(e.expected()).isEqualTo(8);
                    assertThat(e.actual()).isEqualTo(3);
                });
        }

        @Test
        void declaredLengthBeyondInputFails() {
            ByteArray encoded = bytes(0, 0, 0, 0, 0, 0, 0, 5, 'a', 'b');

            assertThatThrownBy(() -> KeyCodecs.bytes().decode(encoded))
                .isInstanceOfSatisfying(KeyDecodeException.DataTooShort.class, e -> {
                    assertThat(e.expected()).isEqualTo(5);
                    assertThat(e.actual()).isEqualTo(2);
                });
        }

        @Test
        void hugeDeclaredLengthIsReportedUnsigned() {
            ByteArray encoded = bytes(0xFF, 0xFF, 0xFF, 0xFF, 0xFF, 0xFF, 0xFF, 0xFF);

            assertThatThrownBy(() -> KeyCodecs.bytes().decode(encoded))
                .isInstanceOf(KeyDecodeException.DataTooShort.class)
                .hasMessageContaining("18446744073709551615");
        }

        @Test
        void invalidUtf8IsMalformedText() {
            ByteArray encoded = bytes(0, 0, 0, 0, 0, 0, 0, 2, 0xC3, 0x28);

            assertThatThrownBy(() -> KeyCodecs.string().decode(encoded))
                .isInstanceOf(KeyDecodeException.MalformedText.class);
        }
    }

    @Nested
    class Greedy {

        @Test
        void takesEverythingThatIsLeft() {
            Decoded<String> decoded = KeyCodecs.greedyString().decode(bytes('a', 'b', 'c'));

            assertThat(decoded.value()).isEqualTo("abc");
            assertThat(decoded.remaining().isEmpty()).isTrue();
        }

        @Test
        void preservesLexicographicOrder() {
            assertOrderPreserved(KeyCodecs.greedyString(), "", "a", "aa", "ab", "b");
            assertOrderPreserved(KeyCodecs.greedyBytes(), bytes(), bytes(0), bytes(0, 0), bytes(1), bytes(0xFF));
        }

        @Test
        void reportsThatItConsumesTheRemainder() {
            assertThat(KeyCodecs.greedyBytes().consumesRemainder()).isTrue();
            assertThat(KeyCodecs.greedyString().consumesRemainder()).isTrue();
            assertThat(KeyCodecs.string().consumesRemainder()).isFalse();
        }

        @Test
        void invalidUtf8IsMalformedText() {
            assertThatThrownBy(() -> KeyCodecs.greedyString().decode(bytes(0xFF)))
                .isInstanceOf(KeyDecodeException.MalformedText.class);
        }
    }

    @Nested
    class NulTerminated {

        @Test
        void appendsTerminator() {
            assertThat(KeyCodecs.nulTerminatedString().encode("ab")).isEqualTo(bytes('a', 'b', 0));
        }

        @Test
        void stopsAtTheFirstTerminator() {
            Decoded<String> decoded = KeyCodecs.nulTerminatedString().decode(bytes('a', 0, 'b', 0));

            assertThat(decoded.value()).isEqualTo("a");
            assertThat(decoded.remaining()).isEqualTo(bytes('b', 0));
        }

        @Test
        void shorterStringSortsBeforeItsExtensions() {
            assertOrderPreserved(KeyCodecs.nulTerminatedString(), "", "a", "a\u0001", "ab", "b");
        }

        @Test
        void rejectsEmbeddedNul() {
            assertThatThrownBy(() -> KeyCodecs.nulTerminatedString().encode("a\0b"))
                .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        void missingTerminatorFails() {
            assertThatThrownBy(() -> KeyCodecs.nulTerminatedString().decode(bytes('a', 'b')))
                .isInstanceOf(KeyDecodeException.MissingTerminator.class)
                .hasMessage("No NUL terminator in 2 bytes");
        }
    }

    @Nested
    class FixedBytes {

        @Test
        void encodesAsIs() {
            assertThat(KeyCodecs.fixedBytes(3).encode(bytes(1, 2, 3))).isEqualTo(bytes(1, 2, 3));
        }

        @Test
        void rejectsWrongWidth() {
            assertThatThrownBy(() -> KeyCodecs.fixedBytes(3).encode(bytes(1, 2)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Expected exactly 3 bytes, got 2");
        }

        @Test
        void decodesExactlyTheWidth() {
            Decoded<ByteArray> decoded = KeyCodecs.fixedBytes(2).decode(bytes(1, 2, 3));

            assertThat(decoded.value()).isEqualTo(bytes(1, 2));
            assertThat(decoded.remaining()).isEqualTo(bytes(3));
        }
    }

    @Nested
    class Lists {

        private final KeyCodec<List<Integer>> codec = KeyCodecs.listOf(KeyCodecs.int32());

        @Test
        void writesCountThenElements() {
            assertThat(codec.encode(List.of(1)))
                .isEqualTo(bytes(0, 0, 0, 0, 0, 0, 0, 1, 0x80, 0, 0, 1));
        }

        @Test
        void roundTrips() {
            assertRoundTrip(codec, List.of());
            assertRoundTrip(codec, List.of(-5, 0, 5));
            assertRoundTrip(KeyCodecs.listOf(KeyCodecs.string()), List.of("a", "", "bc"));
        }

        @Test
        void decodedListIsUnmodifiable() {
            List<Integer> decoded = codec.decode(codec.encode(List.of(1, 2))).value();

            assertThatThrownBy(() -> decoded.add(3)).isInstanceOf(UnsupportedOperationException.class);
        }

        @Test
        void failingElementReportsItsIndex() {
            ByteArray encoded = codec.encode(List.of(1, 2));
            ByteArray truncated = encoded.slice(0, encoded.size() - 1);

            assertThatThrownBy(() -> codec.decode(truncated))
                .isInstanceOfSatisfying(KeyDecodeException.ElementFailure.class, e -> {
                    assertThat(e.index()).isEqualTo(1);
                    assertThat(e.getCause()).isInstanceOf(KeyDecodeException.DataTooShort.class);
                });
        }

        @Test
        void rejectsGreedyElements() {
            assertThatThrownBy(() -> KeyCodecs.listOf(KeyCodecs.greedyString()))
                .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        void countLargerThanTheFollowingBytesFailsFast() {
            ByteArray corrupt = bytes(0x7F, 0xFF, 0xFF, 0xFF, 0xFF, 0xFF, 0xFF, 0xFF, 0x80, 0, 0, 1);

            assertThatThrownBy(() -> codec.decode(corrupt))
                .isInstanceOfSatisfying(KeyDecodeException.DataTooShort.class, e -> {
                    assertThat(e.expected()).isEqualTo(Long.MAX_VALUE);
                    assertThat(e.actual()).isEqualTo(4);
                });
        }

        @Test
        void rejectsZeroWidthElements() {
            assertThatThrownBy(() -> KeyCodecs.listOf(KeyCodecs.fixedBytes(0)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("List elements must encode to at least one byte");
        }

        @Test
        void rejectsElementsThatEncodeToNothing() {
            KeyCodec<List<String>> wrapped = KeyCodecs.listOf(
                KeyCodecs.fixedBytes(0).<String>map(raw -> "", text -> ByteArray.empty())
            );

            assertThatThrownBy(() -> wrapped.encode(List.of("")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("List elements must encode to at least one byte");
            assertThatThrownBy(() -> wrapped.decode(bytes(0, 0, 0, 0, 0, 0, 0, 3)))
                .isInstanceOf(KeyDecodeException.DataTooShort.class);
        }

        @Test
        void isNotOrderPreserving() {
            assertThat(codec.orderPreserving()).isFalse();
        }
    }
}
