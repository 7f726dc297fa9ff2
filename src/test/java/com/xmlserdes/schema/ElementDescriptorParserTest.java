package com.xmlserdes.schema;

import com.xmlserdes.error.ConfigurationException;
import com.xmlserdes.type.AtomicDescriptor;
import com.xmlserdes.type.ListDescriptor;
import com.xmlserdes.type.RecordVectorDescriptor;
import com.xmlserdes.type.ScalarCodecs;
import com.xmlserdes.vector.DType;
import com.xmlserdes.vector.RecordType;
import com.xmlserdes.vector.RecordVector;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for ElementDescriptorParser.
 */
class ElementDescriptorParserTest {

    private final ElementDescriptorParser parser = new ElementDescriptorParser();

    @Test
    void testParseAttribute() {
        ElementDescriptor descriptor = parser.parse(FieldSpec.of("@type", String.class));

        assertThat(descriptor.isAttribute()).isTrue();
        assertThat(descriptor.getTag()).isEqualTo("type");
        assertThat(descriptor.getFieldName()).isEqualTo("type");
        assertThat(descriptor.getType()).isEqualTo(AtomicDescriptor.of(ScalarCodecs.STRING));
    }

    @Test
    void testFieldNameDerivedFromTag() {
        ElementDescriptor descriptor = parser.parse(FieldSpec.of("seat-count", int.class));

        assertThat(descriptor.isAttribute()).isFalse();
        assertThat(descriptor.getTag()).isEqualTo("seat-count");
        assertThat(descriptor.getFieldName()).isEqualTo("seat_count");
    }

    @Test
    void testExplicitFieldName() {
        ElementDescriptor descriptor = parser.parse(FieldSpec.of("seat-count", "seats", int.class));

        assertThat(descriptor.getFieldName()).isEqualTo("seats");
    }

    @Test
    void testListGetsSingularItemTag() {
        ElementDescriptor dimensions = parser.parse(FieldSpec.of("dimensions", List.of(Double.class)));
        ElementDescriptor categories = parser.parse(FieldSpec.of("categories", List.of(String.class)));
        ElementDescriptor data = parser.parse(FieldSpec.of("data", List.of(String.class)));

        assertThat(((ListDescriptor) dimensions.getType()).getContainedTag()).isEqualTo("dimension");
        assertThat(((ListDescriptor) categories.getType()).getContainedTag()).isEqualTo("category");
        assertThat(((ListDescriptor) data.getType()).getContainedTag()).isEqualTo("data-item");
        assertThat(dimensions.isList()).isTrue();
    }

    @Test
    void testExplicitItemTagKept() {
        ElementDescriptor descriptor = parser.parse(FieldSpec.of("dimensions", List.of(Double.class, "d")));

        assertThat(((ListDescriptor) descriptor.getType()).getContainedTag()).isEqualTo("d");
    }

    @Test
    void testRecordVectorGetsSingularItemTag() {
        RecordType point = RecordType.builder().field("x", DType.INT32).build();

        ElementDescriptor descriptor = parser.parse(FieldSpec.of("points", List.of(RecordVector.class, point)));

        assertThat(((RecordVectorDescriptor) descriptor.getType()).getContainedTag()).isEqualTo("point");
    }

    @Test
    void testAttributeMustBeAtomic() {
        assertThatThrownBy(() -> parser.parse(FieldSpec.of("@sizes", List.of(Integer.class))))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("attribute \"@sizes\" must have an atomic type");
    }

    @Test
    void testIllegalTag() {
        assertThatThrownBy(() -> parser.parse(FieldSpec.of("1st", String.class)))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("illegal tag \"1st\"");
        assertThatThrownBy(() -> parser.parse(FieldSpec.of("@", String.class)))
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void testUnresolvableTypeNamesField() {
        assertThatThrownBy(() -> parser.parse(FieldSpec.of("when", Object.class)))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("field \"when\"");
    }

    @Test
    void testTupleForms() {
        assertThat(FieldSpec.fromTuple("name", String.class)).isEqualTo(FieldSpec.of("name", String.class));
        assertThat(FieldSpec.fromTuple("seat-count", "seats", int.class))
                .isEqualTo(FieldSpec.of("seat-count", "seats", int.class));
        assertThatThrownBy(() -> FieldSpec.fromTuple("name")).isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> FieldSpec.fromTuple("a", "b", int.class, "extra"))
                .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> FieldSpec.fromTuple(1, String.class)).isInstanceOf(ConfigurationException.class);
    }

    @Test
    void testDefaultCarriedThrough() {
        ElementDescriptor descriptor = parser.parse(FieldSpec.of("@colour", String.class).withDefault("white"));

        assertThat(descriptor.isDefaulted()).isTrue();
        assertThat(descriptor.getDefaultValue()).isEqualTo("white");
    }
}
