package com.xmlserdes.vector;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.util.Locale;

/**
 * Fixed-width numeric element types for vector payloads and dtype-coded scalars.
 * <p>
 * Values are carried as the narrowest boxed Java type that holds the full range:
 * unsigned 8/16/32-bit types widen to {@code Short}/{@code Integer}/{@code Long};
 * {@code UINT64} is a {@code Long} holding the unsigned bit pattern.
 */
public enum DType {
    INT8("i1", 1, Byte.class),
    INT16("i2", 2, Short.class),
    INT32("i4", 4, Integer.class),
    INT64("i8", 8, Long.class),
    UINT8("u1", 1, Short.class),
    UINT16("u2", 2, Integer.class),
    UINT32("u4", 4, Long.class),
    UINT64("u8", 8, Long.class),
    FLOAT32("f4", 4, Float.class),
    FLOAT64("f8", 8, Double.class);

    private static final BigInteger UINT64_MAX = BigInteger.ONE.shiftLeft(64).subtract(BigInteger.ONE);

    private final String code;
    private final int byteSize;
    private final Class<? extends Number> valueType;

    DType(String code, int byteSize, Class<? extends Number> valueType) {
        this.code = code;
        this.byteSize = byteSize;
        this.valueType = valueType;
    }

    /**
     * Resolve a dtype code. Accepts short codes ({@code i4}, {@code u1}, {@code f8}), optionally
     * prefixed with a little-endian or native byte-order marker ({@code <}, {@code =}, {@code |}),
     * and long names ({@code int32}, {@code uint8}, {@code float64}).
     *
     * @throws IllegalArgumentException for unknown codes and big-endian codes
     */
    public static DType fromCode(String code) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("empty dtype code");
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        char order = normalized.charAt(0);
        if (order == '>') {
            throw new IllegalArgumentException("big-endian dtype not supported: " + code);
        }
        if (order == '<' || order == '=' || order == '|') {
            normalized = normalized.substring(1);
        }
        return switch (normalized) {
            case "i1", "int8" -> INT8;
            case "i2", "int16" -> INT16;
            case "i4", "int32" -> INT32;
            case "i8", "int64" -> INT64;
            case "u1", "uint8" -> UINT8;
            case "u2", "uint16" -> UINT16;
            case "u4", "uint32" -> UINT32;
            case "u8", "uint64" -> UINT64;
            case "f4", "float32" -> FLOAT32;
            case "f8", "float64" -> FLOAT64;
            default -> throw new IllegalArgumentException("unknown dtype code: " + code);
        };
    }

    public String getCode() {
        return code;
    }

    public int getByteSize() {
        return byteSize;
    }

    public Class<? extends Number> getValueType() {
        return valueType;
    }

    public boolean isFloating() {
        return this == FLOAT32 || this == FLOAT64;
    }

    public boolean isUnsigned() {
        return this == UINT8 || this == UINT16 || this == UINT32 || this == UINT64;
    }

    /**
     * Parse one element from its decimal text form.
     *
     * @throws NumberFormatException if the text is not a number or is out of range
     */
    public Number parse(String text) {
        return switch (this) {
            case INT8 -> Byte.valueOf(text);
            case INT16 -> Short.valueOf(text);
            case INT32 -> Integer.valueOf(text);
            case INT64 -> Long.valueOf(text);
            case UINT8 -> (short) checkRange(Integer.parseInt(text), 0xFFL, text);
            case UINT16 -> (int) checkRange(Integer.parseInt(text), 0xFFFFL, text);
            case UINT32 -> checkRange(Long.parseLong(text), 0xFFFF_FFFFL, text);
            case UINT64 -> Long.parseUnsignedLong(text);
            case FLOAT32 -> Float.valueOf(text);
            case FLOAT64 -> Double.valueOf(text);
        };
    }

    private long checkRange(long value, long max, String text) {
        if (value < 0 || value > max) {
            throw new NumberFormatException("value out of range for " + name().toLowerCase(Locale.ROOT) + ": " + text);
        }
        return value;
    }

    public String format(Number value) {
        Number normalized = normalize(value);
        if (this == UINT64) {
            return Long.toUnsignedString(normalized.longValue());
        }
        return normalized.toString();
    }

    /**
     * Convert any Java number to this dtype's canonical boxed value.
     *
     * @throws IllegalArgumentException if the value does not fit or is not integral for an integer dtype
     */
    public Number normalize(Number value) {
        if (value == null) {
            throw new IllegalArgumentException("null is not a valid " + this + " value");
        }
        if (this == FLOAT32) {
            return value.floatValue();
        }
        if (this == FLOAT64) {
            return value.doubleValue();
        }
        if (value instanceof Float || value instanceof Double || value instanceof BigDecimal) {
            throw new IllegalArgumentException("expected an integral value for " + this + " but got " + value);
        }
        long bits;
        if (value instanceof BigInteger big) {
            if (this == UINT64) {
                if (big.signum() < 0 || big.compareTo(UINT64_MAX) > 0) {
                    throw new IllegalArgumentException(value + " out of range for " + this);
                }
                return big.longValue();
            }
            if (big.bitLength() > 63) {
                throw new IllegalArgumentException(value + " out of range for " + this);
            }
            bits = big.longValue();
        } else {
            bits = value.longValue();
        }
        return switch (this) {
            case INT8 -> (byte) inRange(bits, Byte.MIN_VALUE, Byte.MAX_VALUE);
            case INT16 -> (short) inRange(bits, Short.MIN_VALUE, Short.MAX_VALUE);
            case INT32 -> (int) inRange(bits, Integer.MIN_VALUE, Integer.MAX_VALUE);
            case INT64, UINT64 -> bits;
            case UINT8 -> (short) inRange(bits, 0, 0xFFL);
            case UINT16 -> (int) inRange(bits, 0, 0xFFFFL);
            case UINT32 -> inRange(bits, 0, 0xFFFF_FFFFL);
            default -> throw new IllegalStateException("unhandled dtype " + this);
        };
    }

    private long inRange(long value, long min, long max) {
        if (value < min || value > max) {
            throw new IllegalArgumentException(value + " out of range for " + this);
        }
        return value;
    }

    /**
     * Write one element at the buffer's position; the buffer's byte order applies.
     */
    public void write(ByteBuffer buffer, Number value) {
        Number v = normalize(value);
        switch (this) {
            case INT8, UINT8 -> buffer.put((byte) v.longValue());
            case INT16, UINT16 -> buffer.putShort((short) v.longValue());
            case INT32, UINT32 -> buffer.putInt((int) v.longValue());
            case INT64, UINT64 -> buffer.putLong(v.longValue());
            case FLOAT32 -> buffer.putFloat(v.floatValue());
            case FLOAT64 -> buffer.putDouble(v.doubleValue());
        }
    }

    public Number read(ByteBuffer buffer) {
        return switch (this) {
            case INT8 -> buffer.get();
            case INT16 -> buffer.getShort();
            case INT32 -> buffer.getInt();
            case INT64, UINT64 -> buffer.getLong();
            case UINT8 -> (short) Byte.toUnsignedInt(buffer.get());
            case UINT16 -> Short.toUnsignedInt(buffer.getShort());
            case UINT32 -> Integer.toUnsignedLong(buffer.getInt());
            case FLOAT32 -> buffer.getFloat();
            case FLOAT64 -> buffer.getDouble();
        };
    }
}
