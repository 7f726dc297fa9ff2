package com.xmlserdes.schema;

import com.xmlserdes.type.ListDescriptor;
import com.xmlserdes.type.TypeDescriptor;
import lombok.Value;

/**
 * One resolved field mapping.
 */
@Value
public class ElementDescriptor {
    /**
     * Tag without the attribute marker.
     */
    String tag;
    boolean attribute;
    String fieldName;
    TypeDescriptor type;
    boolean defaulted;
    Object defaultValue;

    public boolean isList() {
        return type instanceof ListDescriptor;
    }

    @Override
    public String toString() {
        return (attribute ? TagNames.ATTRIBUTE_MARKER : "") + tag + " -> " + fieldName + ": " + type;
    }
}
