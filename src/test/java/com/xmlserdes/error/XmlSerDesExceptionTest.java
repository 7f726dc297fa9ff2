package com.xmlserdes.error;

import com.xmlserdes.xml.NodePath;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for exception messages and locations.
 */
class XmlSerDesExceptionTest {

    @Test
    void testMessageCarriesPath() {
        NodePath path = NodePath.of("building").child("rooms").indexed("room", 1);
        MissingAttributeException e = new MissingAttributeException("type", path.attribute("type"));

        assertThat(e).hasMessage("missing required attribute \"type\" at /building/rooms/room[2]/@type");
        assertThat(e.getDetail()).isEqualTo("missing required attribute \"type\"");
        assertThat(e.getAttributeName()).isEqualTo("type");
    }

    @Test
    void testMessageWithoutPath() {
        XmlSerDesException e = new XmlSerDesException("broken");

        assertThat(e).hasMessage("broken");
        assertThat(e.getPath()).isNull();
    }

    @Test
    void testConfigurationExceptionJoinsErrors() {
        ConfigurationException e = new ConfigurationException(List.of("first", "second"));

        assertThat(e.getErrors()).containsExactly("first", "second");
        assertThat(e.getMessage()).contains("first").contains("second");
    }

    @Test
    void testShapeExceptionMessage() {
        ShapeException e = new ShapeException(6, 4, NodePath.of("samples"));

        assertThat(e.getLength()).isEqualTo(6);
        assertThat(e.getStride()).isEqualTo(4);
        assertThat(e.getMessage()).endsWith(" at /samples");
    }
}
