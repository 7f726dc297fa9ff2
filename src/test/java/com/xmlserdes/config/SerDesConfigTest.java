package com.xmlserdes.config;

import com.xmlserdes.error.ConfigurationException;
import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for SerDesConfig loading.
 */
class SerDesConfigTest {

    @Test
    void testDefaults() {
        SerDesConfig config = SerDesConfig.defaults();

        assertThat(config.isRejectUnknownChildren()).isFalse();
        assertThat(config.isRejectUnknownAttributes()).isFalse();
        assertThat(config.isTrimScalarText()).isTrue();
    }

    @Test
    void testLoadFromClasspathDefaultResource() {
        assertThat(SerDesConfig.load()).isEqualTo(SerDesConfig.defaults());
    }

    @Test
    void testLoadNamedResource() {
        SerDesConfig config = SerDesConfig.load("xmlserdes-strict.properties");

        assertThat(config.isRejectUnknownChildren()).isTrue();
        assertThat(config.isRejectUnknownAttributes()).isTrue();
        assertThat(config.isTrimScalarText()).isFalse();
    }

    @Test
    void testMissingNamedResource() {
        assertThatThrownBy(() -> SerDesConfig.load("no-such.properties"))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("not found");
    }

    @Test
    void testInvalidValuesAllReported() {
        assertThatThrownBy(() -> SerDesConfig.load("xmlserdes-invalid.properties"))
                .isInstanceOfSatisfying(ConfigurationException.class, e -> assertThat(e.getErrors()).hasSize(2));
    }

    @Test
    void testFromPropertiesIgnoresCaseAndWhitespace() {
        Properties properties = new Properties();
        properties.setProperty(SerDesConfig.REJECT_UNKNOWN_CHILDREN, " TRUE ");
        properties.setProperty("unrelated.key", "x");

        SerDesConfig config = SerDesConfig.fromProperties(properties);

        assertThat(config.isRejectUnknownChildren()).isTrue();
        assertThat(config.isRejectUnknownAttributes()).isFalse();
    }

    @Test
    void testStrictPreset() {
        SerDesConfig strict = SerDesConfig.strict();

        assertThat(strict.isRejectUnknownChildren()).isTrue();
        assertThat(strict.isRejectUnknownAttributes()).isTrue();
        assertThat(strict.toBuilder().rejectUnknownAttributes(false).build().isRejectUnknownAttributes()).isFalse();
    }
}
