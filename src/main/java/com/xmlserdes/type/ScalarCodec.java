package com.xmlserdes.type;

import lombok.Getter;

import java.util.function.Function;

/**
 * Text conversion pair for one scalar Java type.
 *
 * @param <T> the Java value type
 */
@Getter
public final class ScalarCodec<T> {

    /**
     * Type name used in error messages.
     */
    private final String name;
    private final Class<T> valueType;
    private final Function<String, ? extends T> parser;
    private final Function<? super T, String> formatter;
    /**
     * Whether surrounding whitespace may be stripped before parsing. False for strings,
     * whose whitespace is part of the value.
     */
    private final boolean trimmable;

    private ScalarCodec(String name, Class<T> valueType, Function<String, ? extends T> parser,
                        Function<? super T, String> formatter, boolean trimmable) {
        this.name = name;
        this.valueType = valueType;
        this.parser = parser;
        this.formatter = formatter;
        this.trimmable = trimmable;
    }

    public static <T> ScalarCodec<T> of(String name, Class<T> valueType,
                                        Function<String, ? extends T> parser,
                                        Function<? super T, String> formatter) {
        return new ScalarCodec<>(name, valueType, parser, formatter, true);
    }

    public static <T> ScalarCodec<T> verbatim(String name, Class<T> valueType,
                                              Function<String, ? extends T> parser,
                                              Function<? super T, String> formatter) {
        return new ScalarCodec<>(name, valueType, parser, formatter, false);
    }

    public T parse(String text) {
        return parser.apply(text);
    }

    public String format(T value) {
        return formatter.apply(value);
    }

    @Override
    public String toString() {
        return name;
    }
}
