package com.xmlserdes.schema;

import com.xmlserdes.error.ConfigurationException;
import lombok.EqualsAndHashCode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Decoded field values keyed by field name, in schema order. Values may be {@code null}
 * when a field's default is {@code null}.
 */
@EqualsAndHashCode
public final class FieldValues {

    private final Map<String, Object> values;

    private FieldValues(Map<String, Object> values) {
        this.values = values;
    }

    public static FieldValues of(Map<String, ?> values) {
        return new FieldValues(Collections.unmodifiableMap(new LinkedHashMap<>(values)));
    }

    /**
     * @throws IllegalArgumentException if there is no such field
     */
    public Object get(String fieldName) {
        if (!values.containsKey(fieldName)) {
            throw new IllegalArgumentException("no field named \"" + fieldName + "\" in " + values.keySet());
        }
        return values.get(fieldName);
    }

    /**
     * @throws ConfigurationException if the value is not a {@code type}, i.e. the factory reading it
     *                                disagrees with the field's XML type
     */
    public <T> T get(String fieldName, Class<T> type) {
        return checked(fieldName, get(fieldName), type);
    }

    /**
     * List field with every item checked against {@code itemType}.
     *
     * @throws ConfigurationException if the value is not a list of {@code itemType}
     */
    public <E> List<E> getList(String fieldName, Class<E> itemType) {
        Object value = get(fieldName);
        if (value == null) {
            return null;
        }
        if (!(value instanceof List<?> list)) {
            throw new ConfigurationException("field \"" + fieldName + "\" holds "
                    + value.getClass().getSimpleName() + ", not a list");
        }
        List<E> items = new ArrayList<>(list.size());
        for (Object item : list) {
            items.add(checked(fieldName, item, itemType));
        }
        return Collections.unmodifiableList(items);
    }

    public boolean contains(String fieldName) {
        return values.containsKey(fieldName);
    }

    public List<String> names() {
        return List.copyOf(values.keySet());
    }

    public int size() {
        return values.size();
    }

    public Map<String, Object> asMap() {
        return values;
    }

    private static <T> T checked(String fieldName, Object value, Class<T> type) {
        if (value != null && !type.isInstance(value)) {
            throw new ConfigurationException("field \"" + fieldName + "\" holds "
                    + value.getClass().getSimpleName() + ", not " + type.getSimpleName());
        }
        return type.cast(value);
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
