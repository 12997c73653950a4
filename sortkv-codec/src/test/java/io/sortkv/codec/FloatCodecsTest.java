package io.sortkv.codec;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static io.sortkv.codec.CodecAssertions.*;
import static org.assertj.core.api.Assertions.*;

class FloatCodecsTest {

    @Test
    void negativeZeroAndPositiveDoublesSortNumerically() {
        assertOrderPreserved(KeyCodecs.float64(), -2.0, -1.0, 0.0, 1.0);
    }

    @Test
    void extremesSortNumerically() {
        assertOrderPreserved(
            KeyCodecs.float64(),
            Double.NEGATIVE_INFINITY, -Double.MAX_VALUE, -1e-300, -Double.MIN_VALUE,
            0.0, Double.MIN_VALUE, 1e-300, 1.5, Double.MAX_VALUE, Double.POSITIVE_INFINITY
        );
        assertOrderPreserved(
            KeyCodecs.float32(),
            Float.NEGATIVE_INFINITY, -3.5f, -Float.MIN_VALUE, 0.0f, Float.MIN_VALUE, 3.5f, Float.POSITIVE_INFINITY
        );
    }

    @Test
    void negativeZeroSortsJustBelowZero() {
        assertThat(KeyCodecs.float64().encode(-0.0)).isLessThan(KeyCodecs.float64().encode(0.0));
        assertThat(KeyCodecs.float64().encode(-0.0)).isGreaterThan(KeyCodecs.float64().encode(-Double.MIN_VALUE));
    }

    @Test
    void nonNegativeGetsTheSignBitSet() {
        assertThat(KeyCodecs.float64().encode(0.0)).isEqualTo(bytes(0x80, 0, 0, 0, 0, 0, 0, 0));
        assertThat(KeyCodecs.float32().encode(1.0f)).isEqualTo(bytes(0xBF, 0x80, 0, 0));
    }

    @Test
    void negativeHasEveryBitInverted() {
        // -1.0f is 0xBF800000
        assertThat(KeyCodecs.float32().encode(-1.0f)).isEqualTo(bytes(0x40, 0x7F, 0xFF, 0xFF));
    }

    @ParameterizedTest
    @ValueSource(doubles = {-2.5, -0.0, 0.0, 3.25, Double.MAX_VALUE, Double.NEGATIVE_INFINITY})
    void doublesRoundTrip(double value) {
        Decoded<Double> decoded = KeyCodecs.float64().decode(KeyCodecs.float64().encode(value));

        assertThat(Double.doubleToRawLongBits(decoded.value())).isEqualTo(Double.doubleToRawLongBits(value));
    }

    @ParameterizedTest
    @ValueSource(floats = {-2.5f, -0.0f, 0.0f, 3.25f, Float.MIN_VALUE})
    void floatsRoundTrip(float value) {
        Decoded<Float> decoded = KeyCodecs.float32().decode(KeyCodecs.float32().encode(value));

        assertThat(Float.floatToRawIntBits(decoded.value())).isEqualTo(Float.floatToRawIntBits(value));
    }

    @Test
    void nanRoundTrips() {
        assertThat(KeyCodecs.float64().decode(KeyCodecs.float64().encode(Double.NaN)).value()).isNaN();
    }

    @Test
    void truncatedInputFails() {
        assertThatThrownBy(() -> KeyCodecs.float32().decode(bytes(0x80, 0)))
            .isInstanceOf(KeyDecodeException.DataTooShort.class);
    }
}
