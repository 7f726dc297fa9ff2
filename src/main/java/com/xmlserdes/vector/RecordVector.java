package com.xmlserdes.vector;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Immutable fixed-stride buffer of records, packed little-endian with no padding.
 */
public final class RecordVector {

    private final RecordType type;
    private final byte[] data;

    private RecordVector(RecordType type, byte[] data) {
        this.type = type;
        this.data = data;
    }

    public static RecordVector of(RecordType type, RecordValue... records) {
        return of(type, Arrays.asList(records));
    }

    public static RecordVector of(RecordType type, List<RecordValue> records) {
        Objects.requireNonNull(type, "type");
        ByteBuffer buffer = ByteBuffer.allocate(records.size() * type.getByteSize()).order(ByteOrder.LITTLE_ENDIAN);
        for (RecordValue record : records) {
            if (!record.getType().equals(type)) {
                throw new IllegalArgumentException("record of " + record.getType() + " in vector of " + type);
            }
            type.write(buffer, record);
        }
        return new RecordVector(type, buffer.array());
    }

    /**
     * @throws IllegalArgumentException if the length is not a multiple of the record size
     */
    public static RecordVector fromBytes(RecordType type, byte[] bytes) {
        if (bytes.length % type.getByteSize() != 0) {
            throw new IllegalArgumentException(bytes.length + " bytes is not a whole number of "
                    + type.getByteSize() + "-byte records");
        }
        return new RecordVector(type, bytes.clone());
    }

    public RecordType getType() {
        return type;
    }

    public int length() {
        return data.length / type.getByteSize();
    }

    public int stride() {
        return type.getByteSize();
    }

    public RecordValue get(int index) {
        if (index < 0 || index >= length()) {
            throw new IndexOutOfBoundsException("index " + index + " out of bounds for length " + length());
        }
        ByteBuffer buffer = ByteBuffer.wrap(data).order(ByteOrder.LITTLE_ENDIAN);
        buffer.position(index * stride());
        return type.read(buffer);
    }

    public List<RecordValue> records() {
        ByteBuffer buffer = ByteBuffer.wrap(data).order(ByteOrder.LITTLE_ENDIAN);
        List<RecordValue> records = new ArrayList<>(length());
        while (buffer.hasRemaining()) {
            records.add(type.read(buffer));
        }
        return records;
    }

    public byte[] toBytes() {
        return data.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RecordVector other)) {
            return false;
        }
        return type.equals(other.type) && Arrays.equals(data, other.data);
    }

    @Override
    public int hashCode() {
        return 31 * type.hashCode() + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return "RecordVector" + records();
    }
}
