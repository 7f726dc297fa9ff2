package com.xmlserdes.type;

import com.xmlserdes.error.ConfigurationException;
import com.xmlserdes.vector.RecordType;
import com.xmlserdes.vector.RecordVector;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import org.jdom2.Verifier;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A {@link RecordVector} held in a single element. In text form each
 * record becomes a child tagged with the contained tag, holding one sub-element per record
 * field, so in text form record field names must be legal element names.
 */
@Getter
@EqualsAndHashCode(callSuper = false)
public final class RecordVectorDescriptor extends TypeDescriptor {

    private final RecordType recordType;
    /**
     * Record tag for the text form, or {@code null} until attached to a field.
     */
    private final String containedTag;
    private final VectorEncoding encoding;

    private RecordVectorDescriptor(RecordType recordType, String containedTag, VectorEncoding encoding) {
        this.recordType = Objects.requireNonNull(recordType, "recordType");
        this.containedTag = containedTag;
        this.encoding = Objects.requireNonNull(encoding, "encoding");
        if (encoding == VectorEncoding.TEXT) {
            checkFieldNames(recordType);
        }
    }

    public static RecordVectorDescriptor of(RecordType recordType, String containedTag) {
        return new RecordVectorDescriptor(recordType, containedTag, VectorEncoding.TEXT);
    }

    public static RecordVectorDescriptor of(RecordType recordType, String containedTag, VectorEncoding encoding) {
        return new RecordVectorDescriptor(recordType, containedTag, encoding);
    }

    public boolean hasContainedTag() {
        return containedTag != null;
    }

    public RecordVectorDescriptor withContainedTag(String tag) {
        return new RecordVectorDescriptor(recordType, tag, encoding);
    }

    @Override
    public Class<?> getValueType() {
        return RecordVector.class;
    }

    @Override
    public <R, C> R accept(TypeDescriptorVisitor<R, C> visitor, C context) {
        return visitor.visitRecordVector(this, context);
    }

    /**
     * @throws ConfigurationException naming every field, nested ones included, that is not a legal element name
     */
    private static void checkFieldNames(RecordType recordType) {
        List<String> errors = new ArrayList<>();
        collectIllegalNames(recordType, "", errors);
        if (!errors.isEmpty()) {
            throw new ConfigurationException(errors);
        }
    }

    private static void collectIllegalNames(RecordType recordType, String prefix, List<String> errors) {
        for (RecordType.Field field : recordType.getFields()) {
            String problem = Verifier.checkElementName(field.getName());
            if (problem != null) {
                errors.add("illegal record field name \"" + prefix + field.getName() + "\": " + problem);
            }
            if (field.isNested()) {
                collectIllegalNames(field.getRecordType(), prefix + field.getName() + ".", errors);
            }
        }
    }

    @Override
    public String toString() {
        return "RecordVector(" + recordType + ", <" + containedTag + ">, " + encoding + ")";
    }
}
