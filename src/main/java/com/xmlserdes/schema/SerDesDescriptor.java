package com.xmlserdes.schema;

import com.xmlserdes.convert.XmlDecoder;
import com.xmlserdes.convert.XmlEncoder;
import com.xmlserdes.error.ConfigurationException;
import com.xmlserdes.xml.NodePath;
import org.jdom2.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * The resolved schema of one class: attribute descriptors first, then element descriptors,
 * each group in declaration order. Immutable once built.
 */
public final class SerDesDescriptor {
    private static final Logger log = LoggerFactory.getLogger(SerDesDescriptor.class);

    private final List<ElementDescriptor> attributes;
    private final List<ElementDescriptor> elements;

    private SerDesDescriptor(List<ElementDescriptor> attributes, List<ElementDescriptor> elements) {
        this.attributes = List.copyOf(attributes);
        this.elements = List.copyOf(elements);
    }

    public static SerDesDescriptor of(FieldSpec... specs) {
        return of(Arrays.asList(specs));
    }

    /**
     * Resolve every field, reporting all schema errors together.
     *
     * @throws ConfigurationException listing every malformed field, duplicate tag and duplicate field name
     */
    public static SerDesDescriptor of(List<FieldSpec> specs) {
        ElementDescriptorParser parser = new ElementDescriptorParser();
        List<String> errors = new ArrayList<>();
        List<ElementDescriptor> attributes = new ArrayList<>();
        List<ElementDescriptor> elements = new ArrayList<>();
        Set<String> tags = new HashSet<>();
        Set<String> fieldNames = new HashSet<>();

        for (FieldSpec spec : specs) {
            ElementDescriptor descriptor;
            try {
                descriptor = parser.parse(spec);
            } catch (ConfigurationException e) {
                errors.addAll(e.getErrors());
                continue;
            }
            if (!tags.add(descriptor.getTag())) {
                errors.add("duplicate tag \"" + descriptor.getTag() + "\"");
            }
            if (!fieldNames.add(descriptor.getFieldName())) {
                errors.add("duplicate field name \"" + descriptor.getFieldName() + "\"");
            }
            (descriptor.isAttribute() ? attributes : elements).add(descriptor);
        }

        if (!errors.isEmpty()) {
            throw new ConfigurationException(errors);
        }
        log.debug("Resolved descriptor table: {} attributes, {} elements", attributes.size(), elements.size());
        return new SerDesDescriptor(attributes, elements);
    }

    public List<ElementDescriptor> getAttributes() {
        return attributes;
    }

    public List<ElementDescriptor> getElements() {
        return elements;
    }

    /**
     * Attributes followed by elements.
     */
    public List<ElementDescriptor> getDescriptors() {
        List<ElementDescriptor> all = new ArrayList<>(attributes);
        all.addAll(elements);
        return all;
    }

    public List<String> getFieldNames() {
        return getDescriptors().stream().map(ElementDescriptor::getFieldName).toList();
    }

    public List<String> getElementTags() {
        return elements.stream().map(ElementDescriptor::getTag).toList();
    }

    public Optional<ElementDescriptor> find(String fieldName) {
        return getDescriptors().stream().filter(d -> d.getFieldName().equals(fieldName)).findFirst();
    }

    public Element serialize(Object obj, String tag, FieldAccessor accessor) {
        return XmlEncoder.defaults().encodeFields(this, obj, tag, accessor, NodePath.of(tag));
    }

    public FieldValues deserialize(Element element) {
        return XmlDecoder.defaults().decodeFields(this, element, NodePath.of(element.getName()));
    }

    @Override
    public String toString() {
        return "SerDesDescriptor" + getDescriptors();
    }
}
