package com.xmlserdes.convert;

import com.xmlserdes.binding.XmlBinding;
import com.xmlserdes.error.ValueTypeException;
import com.xmlserdes.schema.ElementDescriptor;
import com.xmlserdes.schema.FieldAccessor;
import com.xmlserdes.schema.SerDesDescriptor;
import com.xmlserdes.schema.TagNames;
import com.xmlserdes.type.AtomicDescriptor;
import com.xmlserdes.type.InstanceDescriptor;
import com.xmlserdes.type.ListDescriptor;
import com.xmlserdes.type.NumericVectorDescriptor;
import com.xmlserdes.type.RecordVectorDescriptor;
import com.xmlserdes.type.TypeDescriptor;
import com.xmlserdes.type.TypeDescriptorVisitor;
import com.xmlserdes.type.VectorEncoding;
import com.xmlserdes.vector.NumericVector;
import com.xmlserdes.vector.RecordType;
import com.xmlserdes.vector.RecordValue;
import com.xmlserdes.vector.RecordVector;
import com.xmlserdes.xml.NodePath;
import lombok.Value;
import org.jdom2.Element;

import java.util.Base64;
import java.util.Collection;
import java.util.List;

/**
 * Builds XML elements from values, walking type descriptors recursively.
 * Stateless; a failed call never hands back a partially built element.
 */
public class XmlEncoder implements TypeDescriptorVisitor<Element, XmlEncoder.Target> {

    private static final XmlEncoder DEFAULT = new XmlEncoder();

    /**
     * Value to encode plus the tag and location of the element it becomes.
     */
    @Value
    public static class Target {
        Object value;
        String tag;
        NodePath path;
    }

    public static XmlEncoder defaults() {
        return DEFAULT;
    }

    public Element encode(TypeDescriptor descriptor, Object value, String tag) {
        return encode(descriptor, value, tag, NodePath.of(tag));
    }

    public Element encode(TypeDescriptor descriptor, Object value, String tag, NodePath path) {
        return descriptor.accept(this, new Target(value, tag, path));
    }

    /**
     * Build element {@code tag} with an attribute or child for every field of {@code obj}.
     * Null values are skipped for fields with a default and rejected otherwise.
     */
    public Element encodeFields(SerDesDescriptor table, Object obj, String tag, FieldAccessor accessor, NodePath path) {
        Element element = new Element(tag);
        for (ElementDescriptor attribute : table.getAttributes()) {
            NodePath attributePath = path.attribute(attribute.getTag());
            Object value = accessor.get(obj, attribute.getFieldName());
            if (value == null) {
                requireDefault(attribute, attributePath);
                continue;
            }
            AtomicDescriptor<?> atomic = (AtomicDescriptor<?>) attribute.getType();
            element.setAttribute(attribute.getTag(), atomic.format(value, attributePath));
        }
        for (ElementDescriptor child : table.getElements()) {
            NodePath childPath = path.child(child.getTag());
            Object value = accessor.get(obj, child.getFieldName());
            if (value == null) {
                requireDefault(child, childPath);
                continue;
            }
            element.addContent(encode(child.getType(), value, child.getTag(), childPath));
        }
        return element;
    }

    private static void requireDefault(ElementDescriptor descriptor, NodePath path) {
        if (!descriptor.isDefaulted()) {
            throw new ValueTypeException("field \"" + descriptor.getFieldName() + "\" is null and has no default", path);
        }
    }

    @Override
    public Element visitAtomic(AtomicDescriptor<?> atomic, Target target) {
        Element element = new Element(target.getTag());
        element.setText(atomic.format(target.getValue(), target.getPath()));
        return element;
    }

    @Override
    public Element visitList(ListDescriptor list, Target target) {
        if (!(target.getValue() instanceof Collection<?> items)) {
            throw new ValueTypeException("expected a list but got " + describe(target.getValue()), target.getPath());
        }
        String itemTag = list.hasContainedTag() ? list.getContainedTag() : TagNames.singular(target.getTag());
        Element group = new Element(target.getTag());
        int index = 0;
        for (Object item : items) {
            group.addContent(encode(list.getContained(), item, itemTag, target.getPath().indexed(itemTag, index++)));
        }
        return group;
    }

    @Override
    public Element visitInstance(InstanceDescriptor instance, Target target) {
        XmlBinding<?> binding = instance.getBinding();
        if (!binding.getType().isInstance(target.getValue())) {
            throw new ValueTypeException("expected " + binding.getType().getSimpleName() + " but got "
                    + describe(target.getValue()), target.getPath());
        }
        return encodeFields(binding.getDescriptor(), target.getValue(), target.getTag(),
                binding.getAccessor(), target.getPath());
    }

    @Override
    public Element visitNumericVector(NumericVectorDescriptor vector, Target target) {
        if (!(target.getValue() instanceof NumericVector value) || value.getDtype() != vector.getDtype()) {
            throw new ValueTypeException("expected a " + vector.getDtype().getCode() + " vector but got "
                    + describe(target.getValue()), target.getPath());
        }
        Element element = new Element(target.getTag());
        element.setText(vector.getEncoding() == VectorEncoding.BINARY
                ? Base64.getEncoder().encodeToString(value.toBytes())
                : value.toText());
        return element;
    }

    @Override
    public Element visitRecordVector(RecordVectorDescriptor vector, Target target) {
        if (!(target.getValue() instanceof RecordVector value) || !value.getType().equals(vector.getRecordType())) {
            throw new ValueTypeException("expected a vector of " + vector.getRecordType() + " records but got "
                    + describe(target.getValue()), target.getPath());
        }
        Element element = new Element(target.getTag());
        if (vector.getEncoding() == VectorEncoding.BINARY) {
            element.setText(Base64.getEncoder().encodeToString(value.toBytes()));
            return element;
        }
        String itemTag = vector.hasContainedTag() ? vector.getContainedTag() : TagNames.singular(target.getTag());
        List<RecordValue> records = value.records();
        for (RecordValue record : records) {
            element.addContent(encodeRecord(vector.getRecordType(), record, itemTag));
        }
        return element;
    }

    private Element encodeRecord(RecordType type, RecordValue record, String tag) {
        Element element = new Element(tag);
        for (RecordType.Field field : type.getFields()) {
            Object value = record.get(field.getName());
            if (field.isNested()) {
                element.addContent(encodeRecord(field.getRecordType(), (RecordValue) value, field.getName()));
            } else {
                element.addContent(new Element(field.getName()).setText(field.getDtype().format((Number) value)));
            }
        }
        return element;
    }

    private static String describe(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName();
    }
}
