package com.xmlserdes.vector;

import lombok.EqualsAndHashCode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One row of a {@link RecordVector}: values keyed by field name, in field order.
 * Numbers are normalized to their dtype's canonical boxed type on construction.
 */
@EqualsAndHashCode
public final class RecordValue {

    private final RecordType type;
    private final Map<String, Object> values;

    RecordValue(RecordType type, Map<String, Object> values) {
        this.type = type;
        this.values = Collections.unmodifiableMap(values);
    }

    /**
     * Build a record from values given in field order. Nested fields take a {@link RecordValue}.
     *
     * @throws IllegalArgumentException on a count mismatch, a wrong nested type, or an out-of-range number
     */
    public static RecordValue of(RecordType type, Object... values) {
        return of(type, List.of(values));
    }

    public static RecordValue of(RecordType type, List<?> values) {
        List<RecordType.Field> fields = type.getFields();
        if (values.size() != fields.size()) {
            throw new IllegalArgumentException("expected " + fields.size() + " values for " + type
                    + " but got " + values.size());
        }
        Map<String, Object> normalized = new LinkedHashMap<>();
        for (int i = 0; i < fields.size(); i++) {
            RecordType.Field field = fields.get(i);
            Object value = values.get(i);
            if (field.isNested()) {
                if (!(value instanceof RecordValue nested) || !nested.getType().equals(field.getRecordType())) {
                    throw new IllegalArgumentException("field \"" + field.getName() + "\" expects a record of "
                            + field.getRecordType());
                }
                normalized.put(field.getName(), nested);
            } else {
                if (!(value instanceof Number number)) {
                    throw new IllegalArgumentException("field \"" + field.getName() + "\" expects a number but got "
                            + value);
                }
                normalized.put(field.getName(), field.getDtype().normalize(number));
            }
        }
        return new RecordValue(type, normalized);
    }

    public RecordType getType() {
        return type;
    }

    public Object get(String field) {
        if (!values.containsKey(field)) {
            throw new IllegalArgumentException("no field \"" + field + "\" in " + type);
        }
        return values.get(field);
    }

    public Number getNumber(String field) {
        return (Number) get(field);
    }

    public RecordValue getRecord(String field) {
        return (RecordValue) get(field);
    }

    public Map<String, Object> asMap() {
        return values;
    }

    @Override
    public String toString() {
        return values.values().toString();
    }
}
