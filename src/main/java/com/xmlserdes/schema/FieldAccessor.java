package com.xmlserdes.schema;

import java.util.Map;
import java.util.function.Function;

/**
 * Reads field values off the objects being serialized.
 */
@FunctionalInterface
public interface FieldAccessor {

    /**
     * @throws com.xmlserdes.error.ConfigurationException if {@code target} has no field of that name
     */
    Object get(Object target, String fieldName);

    /**
     * Reads from {@link Map} and {@link FieldValues} targets.
     */
    static FieldAccessor forMaps() {
        return MapFieldAccessor.INSTANCE;
    }

    static <T> FieldAccessor ofGetters(Class<T> type, Map<String, Function<? super T, ?>> getters) {
        return new GetterFieldAccessor<>(type, getters);
    }
}
