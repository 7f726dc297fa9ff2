package com.xmlserdes.schema;

import com.xmlserdes.error.ConfigurationException;
import com.xmlserdes.xml.XmlDocuments;
import org.jdom2.Element;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for descriptor table assembly and field-level conversion.
 */
class SerDesDescriptorTest {

    private static final SerDesDescriptor FURNITURE = SerDesDescriptor.of(
            FieldSpec.of("@type", String.class),
            FieldSpec.of("name", String.class),
            FieldSpec.of("dimensions", List.of(Double.class)));

    @Test
    void testAttributesPartitionedFirst() {
        SerDesDescriptor table = SerDesDescriptor.of(
                FieldSpec.of("name", String.class),
                FieldSpec.of("@id", int.class),
                FieldSpec.of("size", int.class),
                FieldSpec.of("@kind", String.class));

        assertThat(table.getDescriptors()).extracting(ElementDescriptor::getTag)
                .containsExactly("id", "kind", "name", "size");
        assertThat(table.getElementTags()).containsExactly("name", "size");
        assertThat(table.getFieldNames()).containsExactly("id", "kind", "name", "size");
    }

    @Test
    void testDuplicateTagAcrossAttributeAndElement() {
        assertThatThrownBy(() -> SerDesDescriptor.of(
                FieldSpec.of("@name", String.class),
                FieldSpec.of("name", "title", String.class)))
                .isInstanceOfSatisfying(ConfigurationException.class,
                        e -> assertThat(e.getErrors()).containsExactly("duplicate tag \"name\""));
    }

    @Test
    void testDuplicateElementTagAndFieldName() {
        assertThatThrownBy(() -> SerDesDescriptor.of(
                FieldSpec.of("name", String.class),
                FieldSpec.of("name", String.class)))
                .isInstanceOfSatisfying(ConfigurationException.class,
                        e -> assertThat(e.getErrors())
                                .containsExactly("duplicate tag \"name\"", "duplicate field name \"name\""));
    }

    @Test
    void testAllErrorsReportedTogether() {
        assertThatThrownBy(() -> SerDesDescriptor.of(
                FieldSpec.of("1st", String.class),
                FieldSpec.of("@sizes", List.of(Integer.class)),
                FieldSpec.of("ok", String.class)))
                .isInstanceOfSatisfying(ConfigurationException.class,
                        e -> assertThat(e.getErrors()).hasSize(2));
    }

    @Test
    void testSerializeFromMap() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("type", "chair");
        fields.put("name", "Armchair");
        fields.put("dimensions", List.of(1.0, 2.0));

        Element element = FURNITURE.serialize(fields, "furniture", FieldAccessor.forMaps());

        assertThat(XmlDocuments.toText(element)).isEqualTo("<furniture type=\"chair\"><name>Armchair</name>"
                + "<dimensions><dimension>1.0</dimension><dimension>2.0</dimension></dimensions></furniture>");
    }

    @Test
    void testSerializeMissingFieldIsConfigurationError() {
        Map<String, Object> fields = Map.of("type", "chair", "name", "Armchair");

        assertThatThrownBy(() -> FURNITURE.serialize(fields, "furniture", FieldAccessor.forMaps()))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("dimensions");
    }

    @Test
    void testDeserializeToOrderedValues() {
        Element element = XmlDocuments.parse("<furniture type=\"chair\"><dimensions><dimension>1.0</dimension>"
                + "<dimension>2.0</dimension></dimensions><name>Armchair</name></furniture>");

        FieldValues values = FURNITURE.deserialize(element);

        assertThat(values.names()).containsExactly("type", "name", "dimensions");
        assertThat(values.get("type")).isEqualTo("chair");
        assertThat(values.get("name")).isEqualTo("Armchair");
        assertThat(values.get("dimensions")).isEqualTo(List.of(1.0, 2.0));
    }

    @Test
    void testSerializedValuesFeedBack() {
        Element element = XmlDocuments.parse("<furniture type=\"stool\"><name>Stool</name><dimensions/></furniture>");

        FieldValues values = FURNITURE.deserialize(element);
        Element again = FURNITURE.serialize(values, "furniture", FieldAccessor.forMaps());

        assertThat(FURNITURE.deserialize(again)).isEqualTo(values);
        assertThat(values.get("dimensions", List.class)).isEmpty();
    }
}
