package com.xmlserdes.vector;

import lombok.EqualsAndHashCode;
import lombok.Value;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Layout of one fixed-size record: an ordered list of named fields, each either a
 * {@link DType} or a nested record type. Fields are packed without padding.
 */
@EqualsAndHashCode
public final class RecordType {

    /**
     * One named field of a record; exactly one of {@code dtype} and {@code recordType} is set.
     */
    @Value
    public static class Field {
        String name;
        DType dtype;
        RecordType recordType;

        public boolean isNested() {
            return recordType != null;
        }

        public int getByteSize() {
            return isNested() ? recordType.getByteSize() : dtype.getByteSize();
        }
    }

    private final List<Field> fields;
    @EqualsAndHashCode.Exclude
    private final int byteSize;

    private RecordType(List<Field> fields) {
        this.fields = List.copyOf(fields);
        this.byteSize = fields.stream().mapToInt(Field::getByteSize).sum();
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<Field> getFields() {
        return fields;
    }

    public Optional<Field> getField(String name) {
        return fields.stream().filter(f -> f.getName().equals(name)).findFirst();
    }

    public List<String> getFieldNames() {
        return fields.stream().map(Field::getName).toList();
    }

    /**
     * Bytes per record.
     */
    public int getByteSize() {
        return byteSize;
    }

    void write(ByteBuffer buffer, RecordValue record) {
        for (Field field : fields) {
            Object value = record.get(field.getName());
            if (field.isNested()) {
                field.getRecordType().write(buffer, (RecordValue) value);
            } else {
                field.getDtype().write(buffer, (Number) value);
            }
        }
    }

    RecordValue read(ByteBuffer buffer) {
        Map<String, Object> values = new LinkedHashMap<>();
        for (Field field : fields) {
            values.put(field.getName(), field.isNested()
                    ? field.getRecordType().read(buffer)
                    : field.getDtype().read(buffer));
        }
        return new RecordValue(this, values);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < fields.size(); i++) {
            Field field = fields.get(i);
            if (i > 0) {
                sb.append(", ");
            }
            sb.append('(').append(field.getName()).append(", ")
                    .append(field.isNested() ? field.getRecordType() : field.getDtype().getCode())
                    .append(')');
        }
        return sb.append(']').toString();
    }

    public static class Builder {
        private final List<Field> fields = new ArrayList<>();

        public Builder field(String name, DType dtype) {
            return add(new Field(name, dtype, null));
        }

        public Builder field(String name, RecordType nested) {
            return add(new Field(name, null, nested));
        }

        private Builder add(Field field) {
            if (field.getName() == null || field.getName().isBlank()) {
                throw new IllegalArgumentException("record field name must not be blank");
            }
            if (field.getDtype() == null && field.getRecordType() == null) {
                throw new IllegalArgumentException("record field \"" + field.getName() + "\" has no type");
            }
            if (fields.stream().anyMatch(f -> f.getName().equals(field.getName()))) {
                throw new IllegalArgumentException("duplicate record field \"" + field.getName() + "\"");
            }
            fields.add(field);
            return this;
        }

        public RecordType build() {
            if (fields.isEmpty()) {
                throw new IllegalArgumentException("record type needs at least one field");
            }
            return new RecordType(fields);
        }
    }
}
