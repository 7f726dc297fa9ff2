package com.xmlserdes.vector;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Immutable one-dimensional buffer of a single {@link DType}, stored packed little-endian.
 */
public final class NumericVector {

    public static final char SEPARATOR = ',';

    private final DType dtype;
    private final byte[] data;

    private NumericVector(DType dtype, byte[] data) {
        this.dtype = dtype;
        this.data = data;
    }

    public static NumericVector of(DType dtype, Number... values) {
        return of(dtype, Arrays.asList(values));
    }

    public static NumericVector of(DType dtype, List<? extends Number> values) {
        Objects.requireNonNull(dtype, "dtype");
        ByteBuffer buffer = allocate(values.size() * dtype.getByteSize());
        for (Number value : values) {
            dtype.write(buffer, value);
        }
        return new NumericVector(dtype, buffer.array());
    }

    public static NumericVector ofDoubles(double... values) {
        ByteBuffer buffer = allocate(values.length * DType.FLOAT64.getByteSize());
        for (double v : values) {
            buffer.putDouble(v);
        }
        return new NumericVector(DType.FLOAT64, buffer.array());
    }

    public static NumericVector ofInts(int... values) {
        ByteBuffer buffer = allocate(values.length * DType.INT32.getByteSize());
        for (int v : values) {
            buffer.putInt(v);
        }
        return new NumericVector(DType.INT32, buffer.array());
    }

    public static NumericVector ofLongs(long... values) {
        ByteBuffer buffer = allocate(values.length * DType.INT64.getByteSize());
        for (long v : values) {
            buffer.putLong(v);
        }
        return new NumericVector(DType.INT64, buffer.array());
    }

    /**
     * Wrap packed little-endian bytes.
     *
     * @throws IllegalArgumentException if the length is not a multiple of the dtype's size
     */
    public static NumericVector fromBytes(DType dtype, byte[] bytes) {
        if (bytes.length % dtype.getByteSize() != 0) {
            throw new IllegalArgumentException(bytes.length + " bytes is not a whole number of "
                    + dtype + " elements");
        }
        return new NumericVector(dtype, bytes.clone());
    }

    /**
     * Parse comma-separated text. Whitespace around tokens is ignored; blank text is an empty vector.
     *
     * @throws NumberFormatException if any token does not parse as the dtype
     */
    public static NumericVector parseText(DType dtype, String text) {
        if (text == null || text.isBlank()) {
            return of(dtype, List.of());
        }
        String[] tokens = text.split(String.valueOf(SEPARATOR), -1);
        List<Number> values = new ArrayList<>(tokens.length);
        for (String token : tokens) {
            values.add(dtype.parse(token.trim()));
        }
        return of(dtype, values);
    }

    private static ByteBuffer allocate(int size) {
        return ByteBuffer.allocate(size).order(ByteOrder.LITTLE_ENDIAN);
    }

    private ByteBuffer view() {
        return ByteBuffer.wrap(data).order(ByteOrder.LITTLE_ENDIAN);
    }

    public DType getDtype() {
        return dtype;
    }

    public int length() {
        return data.length / dtype.getByteSize();
    }

    public int stride() {
        return dtype.getByteSize();
    }

    public Number get(int index) {
        if (index < 0 || index >= length()) {
            throw new IndexOutOfBoundsException("index " + index + " out of bounds for length " + length());
        }
        ByteBuffer buffer = view();
        buffer.position(index * stride());
        return dtype.read(buffer);
    }

    public double getDouble(int index) {
        return get(index).doubleValue();
    }

    public long getLong(int index) {
        return get(index).longValue();
    }

    public List<Number> toList() {
        ByteBuffer buffer = view();
        List<Number> values = new ArrayList<>(length());
        while (buffer.hasRemaining()) {
            values.add(dtype.read(buffer));
        }
        return values;
    }

    public double[] toDoubleArray() {
        return toList().stream().mapToDouble(Number::doubleValue).toArray();
    }

    public String toText() {
        return toList().stream()
                .map(dtype::format)
                .collect(Collectors.joining(String.valueOf(SEPARATOR)));
    }

    public byte[] toBytes() {
        return data.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof NumericVector other)) {
            return false;
        }
        return dtype == other.dtype && Arrays.equals(data, other.data);
    }

    @Override
    public int hashCode() {
        return 31 * dtype.hashCode() + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return "NumericVector(" + dtype.getCode() + ")[" + toText() + "]";
    }
}
