package com.xmlserdes.schema;

import com.xmlserdes.error.ConfigurationException;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.Arrays;

/**
 * Declaration of one field: {@code (tag[, fieldName], type)}, optionally with a default.
 * <p>
 * A tag starting with {@code @} maps the field to an attribute. The type is any terse form
 * understood by {@link com.xmlserdes.type.TypeDescriptors#fromTerse(Object)}.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class FieldSpec {
    String tag;
    /**
     * Explicit field name, or {@code null} to derive it from the tag.
     */
    String fieldName;
    Object type;
    boolean defaulted;
    Object defaultValue;

    public static FieldSpec of(String tag, Object type) {
        return new FieldSpec(tag, null, type, false, null);
    }

    public static FieldSpec of(String tag, String fieldName, Object type) {
        return new FieldSpec(tag, fieldName, type, false, null);
    }

    /**
     * @throws ConfigurationException unless the tuple is {@code (tag, type)} or {@code (tag, fieldName, type)}
     */
    public static FieldSpec fromTuple(Object... tuple) {
        if (tuple == null || tuple.length < 2 || tuple.length > 3) {
            throw new ConfigurationException("field specification must have 2 or 3 entries but got "
                    + Arrays.deepToString(tuple));
        }
        if (!(tuple[0] instanceof String tag)) {
            throw new ConfigurationException("field tag must be a string but got " + tuple[0]);
        }
        if (tuple.length == 2) {
            return of(tag, tuple[1]);
        }
        if (!(tuple[1] instanceof String fieldName)) {
            throw new ConfigurationException("field name for \"" + tag + "\" must be a string but got " + tuple[1]);
        }
        return of(tag, fieldName, tuple[2]);
    }

    /**
     * Same field, used when the attribute or element is absent on decode and omitted when the
     * value is {@code null} on encode.
     */
    public FieldSpec withDefault(Object value) {
        return new FieldSpec(tag, fieldName, type, true, value);
    }

    public boolean isAttribute() {
        return tag != null && tag.startsWith(TagNames.ATTRIBUTE_MARKER);
    }
}
