package com.xmlserdes.vector;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for record layouts and packed record vectors.
 */
class RecordVectorTest {

    private static final RecordType SAMPLE = RecordType.builder()
            .field("x", DType.FLOAT64)
            .field("n", DType.UINT8)
            .build();

    private static final RecordType POINT = RecordType.builder()
            .field("x", DType.FLOAT32)
            .field("y", DType.FLOAT32)
            .build();

    private static final RecordType SEGMENT = RecordType.builder()
            .field("start", POINT)
            .field("end", POINT)
            .field("id", DType.INT32)
            .build();

    @Test
    void testRecordSizeIsPacked() {
        assertThat(SAMPLE.getByteSize()).isEqualTo(9);
        assertThat(SEGMENT.getByteSize()).isEqualTo(20);
        assertThat(SAMPLE.getFieldNames()).containsExactly("x", "n");
    }

    @Test
    void testBytesRoundTrip() {
        RecordValue first = RecordValue.of(SAMPLE, 1.5, 200);
        RecordValue second = RecordValue.of(SAMPLE, -0.25, 0);
        RecordVector vector = RecordVector.of(SAMPLE, first, second);

        assertThat(vector.length()).isEqualTo(2);
        assertThat(vector.stride()).isEqualTo(9);
        assertThat(vector.toBytes()).hasSize(18);

        RecordVector copy = RecordVector.fromBytes(SAMPLE, vector.toBytes());
        assertThat(copy.records()).containsExactly(first, second);
        assertThat(copy.get(0).getNumber("n")).isEqualTo((short) 200);
    }

    @Test
    void testNestedRecords() {
        RecordValue segment = RecordValue.of(SEGMENT,
                RecordValue.of(POINT, 0f, 0f),
                RecordValue.of(POINT, 3f, 4f),
                7);

        RecordVector copy = RecordVector.fromBytes(SEGMENT, RecordVector.of(SEGMENT, segment).toBytes());

        assertThat(copy.get(0)).isEqualTo(segment);
        assertThat(copy.get(0).getRecord("end").getNumber("y")).isEqualTo(4f);
    }

    @Test
    void testFromBytesRejectsPartialRecord() {
        assertThatThrownBy(() -> RecordVector.fromBytes(SAMPLE, new byte[10]))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testRecordValueChecksArity() {
        assertThatThrownBy(() -> RecordValue.of(SAMPLE, 1.0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("expected 2 values");
    }

    @Test
    void testRecordValueChecksRange() {
        assertThatThrownBy(() -> RecordValue.of(SAMPLE, 1.0, 256))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testDuplicateFieldRejected() {
        assertThatThrownBy(() -> RecordType.builder().field("a", DType.INT8).field("a", DType.INT16))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("duplicate");
    }
}
