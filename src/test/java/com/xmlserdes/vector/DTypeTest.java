package com.xmlserdes.vector;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for DType code parsing, range checks and text forms.
 */
class DTypeTest {

    @ParameterizedTest
    @CsvSource({
            "i1, INT8",
            "<i2, INT16",
            "=i4, INT32",
            "int64, INT64",
            "|u1, UINT8",
            "u2, UINT16",
            "<u4, UINT32",
            "uint64, UINT64",
            "f4, FLOAT32",
            "float64, FLOAT64"
    })
    void testFromCode(String code, DType expected) {
        assertThat(DType.fromCode(code)).isEqualTo(expected);
    }

    @Test
    void testFromCodeRejectsBigEndian() {
        assertThatThrownBy(() -> DType.fromCode(">i4"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("big-endian");
    }

    @Test
    void testFromCodeRejectsUnknown() {
        assertThatThrownBy(() -> DType.fromCode("c16"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("unknown dtype code");
    }

    @Test
    void testParseUnsignedRange() {
        assertThat(DType.UINT8.parse("255")).isEqualTo((short) 255);
        assertThatThrownBy(() -> DType.UINT8.parse("256")).isInstanceOf(NumberFormatException.class);
        assertThatThrownBy(() -> DType.UINT16.parse("-1")).isInstanceOf(NumberFormatException.class);
    }

    @Test
    void testUint64FormatsUnsigned() {
        assertThat(DType.UINT64.format(-1L)).isEqualTo("18446744073709551615");
        assertThat(DType.UINT64.parse("18446744073709551615")).isEqualTo(-1L);
    }

    @Test
    void testNormalizeRejectsOutOfRange() {
        assertThatThrownBy(() -> DType.INT8.normalize(200)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> DType.INT32.normalize(1.5)).isInstanceOf(IllegalArgumentException.class);
        assertThat(DType.INT16.normalize(12L)).isEqualTo((short) 12);
        assertThat(DType.FLOAT64.normalize(3)).isEqualTo(3.0);
    }

    @Test
    void testWriteReadUnsignedLittleEndian() {
        ByteBuffer buffer = ByteBuffer.allocate(2).order(ByteOrder.LITTLE_ENDIAN);
        DType.UINT16.write(buffer, 65535);
        buffer.flip();

        assertThat(buffer.get(0)).isEqualTo((byte) 0xFF);
        assertThat(DType.UINT16.read(buffer)).isEqualTo(65535);
    }
}
