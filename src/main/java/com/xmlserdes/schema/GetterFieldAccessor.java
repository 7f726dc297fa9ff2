package com.xmlserdes.schema;

import com.xmlserdes.error.ConfigurationException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;

class GetterFieldAccessor<T> implements FieldAccessor {

    private final Class<T> type;
    private final Map<String, Function<? super T, ?>> getters;

    GetterFieldAccessor(Class<T> type, Map<String, Function<? super T, ?>> getters) {
        this.type = type;
        this.getters = new LinkedHashMap<>(getters);
    }

    @Override
    public Object get(Object target, String fieldName) {
        Function<? super T, ?> getter = getters.get(fieldName);
        if (getter == null) {
            throw new ConfigurationException("no getter for field \"" + fieldName + "\" of " + type.getName());
        }
        if (!type.isInstance(target)) {
            throw new ConfigurationException("expected " + type.getName() + " but got "
                    + (target == null ? "null" : target.getClass().getName()));
        }
        return getter.apply(type.cast(target));
    }
}
