package com.xmlserdes.schema;

import com.xmlserdes.error.ConfigurationException;
import com.xmlserdes.type.ListDescriptor;
import com.xmlserdes.type.RecordVectorDescriptor;
import com.xmlserdes.type.TypeDescriptor;
import com.xmlserdes.type.TypeDescriptors;
import org.jdom2.Verifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a {@link FieldSpec} into an {@link ElementDescriptor}.
 * <p>
 * Rules:
 * - {@code @tag} is an attribute and must have an atomic type
 * - a missing field name is the tag with {@code -} replaced by {@code _}
 * - lists and record vectors without an item tag get the singular of the field tag
 */
public class ElementDescriptorParser {
    private static final Logger log = LoggerFactory.getLogger(ElementDescriptorParser.class);

    /**
     * @throws ConfigurationException if the tag is illegal, the type cannot be resolved or an
     *                                attribute has a non-atomic type
     */
    public ElementDescriptor parse(FieldSpec spec) {
        String rawTag = spec.getTag();
        if (rawTag == null || rawTag.isEmpty()) {
            throw new ConfigurationException("field tag must not be empty");
        }
        boolean attribute = spec.isAttribute();
        String tag = attribute ? rawTag.substring(TagNames.ATTRIBUTE_MARKER.length()) : rawTag;

        String problem = attribute ? Verifier.checkAttributeName(tag) : Verifier.checkElementName(tag);
        if (problem != null) {
            throw new ConfigurationException("illegal tag \"" + rawTag + "\": " + problem);
        }

        String fieldName = spec.getFieldName() != null ? spec.getFieldName() : TagNames.toFieldName(tag);
        if (fieldName.isBlank()) {
            throw new ConfigurationException("field name for \"" + rawTag + "\" must not be blank");
        }

        TypeDescriptor type;
        try {
            type = withItemTag(TypeDescriptors.fromTerse(spec.getType()), tag);
        } catch (ConfigurationException e) {
            throw new ConfigurationException("field \"" + rawTag + "\": " + e.getDetail(), e);
        }
        if (attribute && !type.isAtomic()) {
            throw new ConfigurationException("attribute \"" + rawTag + "\" must have an atomic type but has " + type);
        }

        ElementDescriptor descriptor = new ElementDescriptor(tag, attribute, fieldName, type,
                spec.isDefaulted(), spec.getDefaultValue());
        log.trace("Parsed field {}", descriptor);
        return descriptor;
    }

    private TypeDescriptor withItemTag(TypeDescriptor type, String groupingTag) {
        if (type instanceof ListDescriptor list && !list.hasContainedTag()) {
            return list.withContainedTag(TagNames.singular(groupingTag));
        }
        if (type instanceof RecordVectorDescriptor records && !records.hasContainedTag()) {
            return records.withContainedTag(TagNames.singular(groupingTag));
        }
        return type;
    }
}
