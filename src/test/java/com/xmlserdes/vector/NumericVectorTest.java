package com.xmlserdes.vector;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for NumericVector text and byte forms.
 */
class NumericVectorTest {

    @Test
    void testParseTextToleratesWhitespace() {
        NumericVector vector = NumericVector.parseText(DType.INT32, " 1, 2 ,3 ");

        assertThat(vector.length()).isEqualTo(3);
        assertThat(vector.toList()).containsExactly(1, 2, 3);
        assertThat(vector.toText()).isEqualTo("1,2,3");
    }

    @Test
    void testBlankTextIsEmptyVector() {
        NumericVector vector = NumericVector.parseText(DType.FLOAT64, "  ");

        assertThat(vector.length()).isZero();
        assertThat(vector.toText()).isEmpty();
    }

    @Test
    void testFloatTextUsesShortestRoundTripForm() {
        NumericVector vector = NumericVector.ofDoubles(0.1, -2.0, 1e-3);

        assertThat(vector.toText()).isEqualTo("0.1,-2.0,0.001");
        assertThat(NumericVector.parseText(DType.FLOAT64, vector.toText())).isEqualTo(vector);
    }

    @Test
    void testBytesAreLittleEndian() {
        NumericVector vector = NumericVector.ofInts(1, 256);

        assertThat(vector.stride()).isEqualTo(4);
        assertThat(vector.toBytes()).isEqualTo(new byte[]{1, 0, 0, 0, 0, 1, 0, 0});
        assertThat(NumericVector.fromBytes(DType.INT32, vector.toBytes())).isEqualTo(vector);
    }

    @Test
    void testFromBytesRejectsPartialElement() {
        assertThatThrownBy(() -> NumericVector.fromBytes(DType.INT32, new byte[6]))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testParseTextRejectsOutOfRange() {
        assertThatThrownBy(() -> NumericVector.parseText(DType.UINT8, "1,300"))
                .isInstanceOf(NumberFormatException.class);
    }

    @Test
    void testEqualityIgnoresConstructionRoute() {
        assertThat(NumericVector.of(DType.INT32, 4, 5)).isEqualTo(NumericVector.ofInts(4, 5));
        assertThat(NumericVector.of(DType.INT64, 4, 5)).isNotEqualTo(NumericVector.ofInts(4, 5));
    }

    @Test
    void testGetOutOfBounds() {
        NumericVector vector = NumericVector.ofLongs(7L);

        assertThat(vector.getLong(0)).isEqualTo(7L);
        assertThatThrownBy(() -> vector.get(1)).isInstanceOf(IndexOutOfBoundsException.class);
    }
}
