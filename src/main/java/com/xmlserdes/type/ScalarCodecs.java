package com.xmlserdes.type;

import com.xmlserdes.vector.DType;
import lombok.experimental.UtilityClass;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Built-in scalar codecs.
 * <p>
 * Floating-point values are written with {@link Double#toString(double)} /
 * {@link Float#toString(float)}, which parse back to the identical value. Booleans use the
 * tokens {@code true} and {@code false} only, in both directions, and are never trimmed.
 */
@UtilityClass
public class ScalarCodecs {

    public static final String TRUE_TOKEN = "true";
    public static final String FALSE_TOKEN = "false";

    public static final ScalarCodec<Integer> INTEGER =
            ScalarCodec.of("Integer", Integer.class, Integer::valueOf, String::valueOf);
    public static final ScalarCodec<Long> LONG =
            ScalarCodec.of("Long", Long.class, Long::valueOf, String::valueOf);
    public static final ScalarCodec<Short> SHORT =
            ScalarCodec.of("Short", Short.class, Short::valueOf, String::valueOf);
    public static final ScalarCodec<Byte> BYTE =
            ScalarCodec.of("Byte", Byte.class, Byte::valueOf, String::valueOf);
    public static final ScalarCodec<Double> DOUBLE =
            ScalarCodec.of("Double", Double.class, Double::valueOf, String::valueOf);
    public static final ScalarCodec<Float> FLOAT =
            ScalarCodec.of("Float", Float.class, Float::valueOf, String::valueOf);
    public static final ScalarCodec<BigDecimal> BIG_DECIMAL =
            ScalarCodec.of("BigDecimal", BigDecimal.class, BigDecimal::new, BigDecimal::toString);
    public static final ScalarCodec<BigInteger> BIG_INTEGER =
            ScalarCodec.of("BigInteger", BigInteger.class, BigInteger::new, BigInteger::toString);
    public static final ScalarCodec<String> STRING =
            ScalarCodec.verbatim("String", String.class, s -> s, s -> s);
    public static final ScalarCodec<Boolean> BOOLEAN =
            ScalarCodec.verbatim("Boolean", Boolean.class, ScalarCodecs::parseBoolean,
                    b -> b ? TRUE_TOKEN : FALSE_TOKEN);

    private static final Map<Class<?>, ScalarCodec<?>> BY_CLASS = Map.ofEntries(
            Map.entry(Integer.class, INTEGER),
            Map.entry(int.class, INTEGER),
            Map.entry(Long.class, LONG),
            Map.entry(long.class, LONG),
            Map.entry(Short.class, SHORT),
            Map.entry(short.class, SHORT),
            Map.entry(Byte.class, BYTE),
            Map.entry(byte.class, BYTE),
            Map.entry(Double.class, DOUBLE),
            Map.entry(double.class, DOUBLE),
            Map.entry(Float.class, FLOAT),
            Map.entry(float.class, FLOAT),
            Map.entry(Boolean.class, BOOLEAN),
            Map.entry(boolean.class, BOOLEAN),
            Map.entry(String.class, STRING),
            Map.entry(BigDecimal.class, BIG_DECIMAL),
            Map.entry(BigInteger.class, BIG_INTEGER)
    );

    private static final Map<Class<?>, ScalarCodec<?>> ENUM_CODECS = new ConcurrentHashMap<>();

    /**
     * Codec for a plain Java scalar class or an enum; empty for anything else.
     */
    public static Optional<ScalarCodec<?>> forClass(Class<?> type) {
        ScalarCodec<?> codec = BY_CLASS.get(type);
        if (codec != null) {
            return Optional.of(codec);
        }
        if (type.isEnum()) {
            return Optional.of(forEnum(type));
        }
        return Optional.empty();
    }

    /**
     * Enum constants are written as their {@link Enum#name()}. Each enum class gets one codec.
     *
     * @throws IllegalArgumentException if {@code enumType} is not an enum
     */
    public static ScalarCodec<?> forEnum(Class<?> enumType) {
        if (!enumType.isEnum()) {
            throw new IllegalArgumentException(enumType.getName() + " is not an enum");
        }
        return ENUM_CODECS.computeIfAbsent(enumType, ScalarCodecs::enumCodec);
    }

    public static ScalarCodec<Number> forDType(DType dtype) {
        return ScalarCodec.of(dtype.getCode(), Number.class, dtype::parse, dtype::format);
    }

    private static Boolean parseBoolean(String text) {
        if (TRUE_TOKEN.equals(text)) {
            return Boolean.TRUE;
        }
        if (FALSE_TOKEN.equals(text)) {
            return Boolean.FALSE;
        }
        throw new IllegalArgumentException("expected \"" + TRUE_TOKEN + "\" or \"" + FALSE_TOKEN + "\"");
    }

    private static <T> ScalarCodec<T> enumCodec(Class<T> enumType) {
        return ScalarCodec.of(enumType.getSimpleName(), enumType,
                text -> parseEnum(enumType, text), constant -> ((Enum<?>) constant).name());
    }

    private static <T> T parseEnum(Class<T> enumType, String text) {
        for (T constant : enumType.getEnumConstants()) {
            if (((Enum<?>) constant).name().equals(text)) {
                return constant;
            }
        }
        throw new IllegalArgumentException("not a member of enumeration " + enumType.getSimpleName());
    }
}
