package com.xmlserdes.schema;

import com.xmlserdes.error.ConfigurationException;

import java.util.Map;

class MapFieldAccessor implements FieldAccessor {

    static final MapFieldAccessor INSTANCE = new MapFieldAccessor();

    @Override
    public Object get(Object target, String fieldName) {
        if (target instanceof FieldValues values) {
            return get(values.asMap(), fieldName);
        }
        if (target instanceof Map<?, ?> map) {
            return get(map, fieldName);
        }
        throw new ConfigurationException("cannot read field \"" + fieldName + "\" from "
                + (target == null ? "null" : target.getClass().getName()) + ": not a map");
    }

    private Object get(Map<?, ?> map, String fieldName) {
        if (!map.containsKey(fieldName)) {
            throw new ConfigurationException("no field \"" + fieldName + "\" among " + map.keySet());
        }
        return map.get(fieldName);
    }
}
