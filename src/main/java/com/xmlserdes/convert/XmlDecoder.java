package com.xmlserdes.convert;

import com.xmlserdes.binding.XmlBinding;
import com.xmlserdes.config.SerDesConfig;
import com.xmlserdes.error.MissingAttributeException;
import com.xmlserdes.error.MissingElementException;
import com.xmlserdes.error.ShapeException;
import com.xmlserdes.error.TagListComparison;
import com.xmlserdes.error.TextParseException;
import com.xmlserdes.error.UnexpectedChildrenException;
import com.xmlserdes.error.XmlSerDesException;
import com.xmlserdes.schema.ElementDescriptor;
import com.xmlserdes.schema.FieldValues;
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
import com.xmlserdes.xml.XmlDocuments;
import lombok.Value;
import org.jdom2.Attribute;
import org.jdom2.Element;

import java.util.ArrayList;
import java.util.Base64;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Builds values from XML elements, walking type descriptors recursively.
 */
public class XmlDecoder implements TypeDescriptorVisitor<Object, XmlDecoder.Source> {

    private static final XmlDecoder DEFAULT = new XmlDecoder(SerDesConfig.defaults());

    private final SerDesConfig config;

    /**
     * Element being decoded and its location.
     */
    @Value
    public static class Source {
        Element element;
        NodePath path;
    }

    public XmlDecoder(SerDesConfig config) {
        this.config = config;
    }

    /**
     * Lenient decoder with default settings.
     */
    public static XmlDecoder defaults() {
        return DEFAULT;
    }

    public SerDesConfig getConfig() {
        return config;
    }

    public Object decode(TypeDescriptor descriptor, Element element, String expectedTag) {
        return decode(descriptor, element, expectedTag, NodePath.of(element.getName()));
    }

    /**
     * @param expectedTag tag the element must carry, or {@code null} to accept any
     */
    public Object decode(TypeDescriptor descriptor, Element element, String expectedTag, NodePath path) {
        if (expectedTag != null && !expectedTag.equals(element.getName())) {
            throw new XmlSerDesException("expected tag <" + expectedTag + "> but got <" + element.getName() + ">", path);
        }
        return descriptor.accept(this, new Source(element, path));
    }

    /**
     * Read every field of {@code table} from {@code element}. Absent fields take their default;
     * absent lists without a default are empty.
     */
    public FieldValues decodeFields(SerDesDescriptor table, Element element, NodePath path) {
        if (config.isRejectUnknownAttributes()) {
            checkAttributes(table, element, path);
        }
        if (config.isRejectUnknownChildren()) {
            checkChildren(table, element, path);
        }

        Map<String, Object> values = new LinkedHashMap<>();
        for (ElementDescriptor attribute : table.getAttributes()) {
            NodePath attributePath = path.attribute(attribute.getTag());
            String text = element.getAttributeValue(attribute.getTag());
            if (text == null) {
                if (!attribute.isDefaulted()) {
                    throw new MissingAttributeException(attribute.getTag(), attributePath);
                }
                values.put(attribute.getFieldName(), attribute.getDefaultValue());
                continue;
            }
            AtomicDescriptor<?> atomic = (AtomicDescriptor<?>) attribute.getType();
            values.put(attribute.getFieldName(), atomic.parse(text, attributePath, config.isTrimScalarText()));
        }

        for (ElementDescriptor child : table.getElements()) {
            List<Element> matches = element.getChildren(child.getTag());
            if (matches.isEmpty()) {
                if (child.isDefaulted()) {
                    values.put(child.getFieldName(), child.getDefaultValue());
                } else if (child.isList()) {
                    values.put(child.getFieldName(), List.of());
                } else {
                    throw new MissingElementException(child.getTag(), path);
                }
                continue;
            }
            if (matches.size() > 1) {
                throw new XmlSerDesException("element <" + child.getTag() + "> appears " + matches.size()
                        + " times but maps to a single field", path);
            }
            values.put(child.getFieldName(), decode(child.getType(), matches.get(0), child.getTag(), path.child(child.getTag())));
        }
        return FieldValues.of(values);
    }

    private void checkAttributes(SerDesDescriptor table, Element element, NodePath path) {
        Set<String> declared = table.getAttributes().stream()
                .map(ElementDescriptor::getTag)
                .collect(Collectors.toSet());
        for (Attribute attribute : element.getAttributes()) {
            if (!declared.contains(attribute.getQualifiedName())) {
                throw new XmlSerDesException("unexpected attribute \"" + attribute.getQualifiedName() + "\"",
                        path.attribute(attribute.getQualifiedName()));
            }
        }
    }

    private void checkChildren(SerDesDescriptor table, Element element, NodePath path) {
        List<String> expected = new ArrayList<>();
        for (ElementDescriptor child : table.getElements()) {
            boolean present = element.getChild(child.getTag()) != null;
            if (present || !(child.isDefaulted() || child.isList())) {
                expected.add(child.getTag());
            }
        }
        compareChildren(expected, element, path);
    }

    private static void compareChildren(List<String> expected, Element element, NodePath path) {
        TagListComparison comparison = new TagListComparison(expected, XmlDocuments.childTags(element));
        if (!comparison.isEmpty()) {
            throw new UnexpectedChildrenException(comparison, path);
        }
    }

    /**
     * In strict mode every child must carry the item tag.
     */
    private void checkItems(String itemTag, Element element, NodePath path) {
        if (config.isRejectUnknownChildren()) {
            int count = element.getChildren(itemTag).size();
            compareChildren(Collections.nCopies(count, itemTag), element, path);
        }
    }

    @Override
    public Object visitAtomic(AtomicDescriptor<?> atomic, Source source) {
        return atomic.parse(source.getElement().getText(), source.getPath(), config.isTrimScalarText());
    }

    @Override
    public Object visitList(ListDescriptor list, Source source) {
        Element group = source.getElement();
        String itemTag = list.hasContainedTag() ? list.getContainedTag() : TagNames.singular(group.getName());
        checkItems(itemTag, group, source.getPath());
        List<Element> children = group.getChildren(itemTag);
        List<Object> items = new ArrayList<>(children.size());
        for (int i = 0; i < children.size(); i++) {
            items.add(decode(list.getContained(), children.get(i), itemTag, source.getPath().indexed(itemTag, i)));
        }
        return Collections.unmodifiableList(items);
    }

    @Override
    public Object visitInstance(InstanceDescriptor instance, Source source) {
        XmlBinding<?> binding = instance.getBinding();
        FieldValues values = decodeFields(binding.getDescriptor(), source.getElement(), source.getPath());
        return binding.instantiate(values, source.getPath());
    }

    @Override
    public Object visitNumericVector(NumericVectorDescriptor vector, Source source) {
        String text = scalarText(source.getElement());
        if (vector.getEncoding() == VectorEncoding.BINARY) {
            byte[] bytes = base64(text, source.getPath());
            checkShape(bytes, vector.getDtype().getByteSize(), source.getPath());
            return NumericVector.fromBytes(vector.getDtype(), bytes);
        }
        try {
            return NumericVector.parseText(vector.getDtype(), text);
        } catch (NumberFormatException e) {
            throw new TextParseException(text, vector.getDtype().getCode() + " vector", e.getMessage(), source.getPath());
        }
    }

    @Override
    public Object visitRecordVector(RecordVectorDescriptor vector, Source source) {
        RecordType type = vector.getRecordType();
        Element element = source.getElement();
        if (vector.getEncoding() == VectorEncoding.BINARY) {
            byte[] bytes = base64(scalarText(element), source.getPath());
            checkShape(bytes, type.getByteSize(), source.getPath());
            return RecordVector.fromBytes(type, bytes);
        }
        String itemTag = vector.hasContainedTag() ? vector.getContainedTag() : TagNames.singular(element.getName());
        checkItems(itemTag, element, source.getPath());
        List<Element> children = element.getChildren(itemTag);
        List<RecordValue> records = new ArrayList<>(children.size());
        for (int i = 0; i < children.size(); i++) {
            records.add(decodeRecord(type, children.get(i), source.getPath().indexed(itemTag, i)));
        }
        return RecordVector.of(type, records);
    }

    private RecordValue decodeRecord(RecordType type, Element element, NodePath path) {
        if (config.isRejectUnknownChildren()) {
            compareChildren(type.getFieldNames(), element, path);
        }
        List<Object> values = new ArrayList<>(type.getFields().size());
        for (RecordType.Field field : type.getFields()) {
            List<Element> matches = element.getChildren(field.getName());
            if (matches.isEmpty()) {
                throw new MissingElementException(field.getName(), path);
            }
            if (matches.size() > 1) {
                throw new XmlSerDesException("record field <" + field.getName() + "> appears " + matches.size() + " times", path);
            }
            NodePath fieldPath = path.child(field.getName());
            if (field.isNested()) {
                values.add(decodeRecord(field.getRecordType(), matches.get(0), fieldPath));
                continue;
            }
            String text = scalarText(matches.get(0));
            try {
                values.add(field.getDtype().parse(text));
            } catch (NumberFormatException e) {
                throw new TextParseException(text, field.getDtype().getCode(), e.getMessage(), fieldPath);
            }
        }
        return RecordValue.of(type, values);
    }

    private String scalarText(Element element) {
        String text = element.getText();
        return config.isTrimScalarText() ? text.strip() : text;
    }

    private static byte[] base64(String text, NodePath path) {
        try {
            return Base64.getDecoder().decode(text);
        } catch (IllegalArgumentException e) {
            throw new TextParseException(text, "base64", e.getMessage(), path);
        }
    }

    private static void checkShape(byte[] bytes, int stride, NodePath path) {
        if (bytes.length % stride != 0) {
            throw new ShapeException(bytes.length, stride, path);
        }
    }
}
