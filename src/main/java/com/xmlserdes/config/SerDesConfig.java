package com.xmlserdes.config;

import com.xmlserdes.error.ConfigurationException;
import lombok.Builder;
import lombok.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

/**
 * Conversion settings.
 * <p>
 * Loaded from {@value #DEFAULT_RESOURCE} on the classpath when present:
 * <pre>
 * xmlserdes.reject-unknown-children=false
 * xmlserdes.reject-unknown-attributes=false
 * xmlserdes.trim-scalar-text=true
 * </pre>
 */
@Value
@Builder(toBuilder = true)
public class SerDesConfig {
    private static final Logger log = LoggerFactory.getLogger(SerDesConfig.class);

    public static final String DEFAULT_RESOURCE = "xmlserdes.properties";
    public static final String PREFIX = "xmlserdes.";
    public static final String REJECT_UNKNOWN_CHILDREN = PREFIX + "reject-unknown-children";
    public static final String REJECT_UNKNOWN_ATTRIBUTES = PREFIX + "reject-unknown-attributes";
    public static final String TRIM_SCALAR_TEXT = PREFIX + "trim-scalar-text";

    private static final List<String> KEYS = List.of(REJECT_UNKNOWN_CHILDREN, REJECT_UNKNOWN_ATTRIBUTES, TRIM_SCALAR_TEXT);

    /**
     * Child elements not declared in the schema raise
     * {@link com.xmlserdes.error.UnexpectedChildrenException}.
     */
    @Builder.Default
    boolean rejectUnknownChildren = false;
    /**
     * Attributes not declared in the schema are an error.
     */
    @Builder.Default
    boolean rejectUnknownAttributes = false;
    /**
     * Strip whitespace around non-string scalar text and vector text before parsing.
     */
    @Builder.Default
    boolean trimScalarText = true;

    public static SerDesConfig defaults() {
        return SerDesConfig.builder().build();
    }

    /**
     * Strict preset: unknown children and attributes are rejected.
     */
    public static SerDesConfig strict() {
        return SerDesConfig.builder()
                .rejectUnknownChildren(true)
                .rejectUnknownAttributes(true)
                .build();
    }

    /**
     * Load {@value #DEFAULT_RESOURCE} from the classpath, or the defaults if it is absent.
     */
    public static SerDesConfig load() {
        return load(DEFAULT_RESOURCE, false);
    }

    /**
     * @throws ConfigurationException if the resource is missing, unreadable or holds bad values
     */
    public static SerDesConfig load(String resource) {
        return load(resource, true);
    }

    private static SerDesConfig load(String resource, boolean required) {
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        if (loader == null) {
            loader = SerDesConfig.class.getClassLoader();
        }
        try (InputStream in = loader.getResourceAsStream(resource)) {
            if (in == null) {
                if (required) {
                    throw new ConfigurationException("configuration resource not found: " + resource);
                }
                log.debug("No {} on the classpath, using defaults", resource);
                return defaults();
            }
            Properties properties = new Properties();
            properties.load(in);
            SerDesConfig config = fromProperties(properties);
            log.debug("Loaded configuration from {}: {}", resource, config);
            return config;
        } catch (IOException e) {
            throw new ConfigurationException("cannot read configuration resource " + resource, e);
        }
    }

    /**
     * Keys outside the {@value #PREFIX} namespace are ignored; unknown keys inside it are logged.
     *
     * @throws ConfigurationException listing every value that is not {@code true} or {@code false}
     */
    public static SerDesConfig fromProperties(Properties properties) {
        List<String> errors = new ArrayList<>();
        for (String key : properties.stringPropertyNames()) {
            if (key.startsWith(PREFIX) && !KEYS.contains(key)) {
                log.warn("Ignoring unknown configuration key {}", key);
            }
        }
        SerDesConfig defaults = defaults();
        SerDesConfig config = SerDesConfig.builder()
                .rejectUnknownChildren(flag(properties, REJECT_UNKNOWN_CHILDREN, defaults.isRejectUnknownChildren(), errors))
                .rejectUnknownAttributes(flag(properties, REJECT_UNKNOWN_ATTRIBUTES, defaults.isRejectUnknownAttributes(), errors))
                .trimScalarText(flag(properties, TRIM_SCALAR_TEXT, defaults.isTrimScalarText(), errors))
                .build();
        if (!errors.isEmpty()) {
            throw new ConfigurationException(errors);
        }
        return config;
    }

    private static boolean flag(Properties properties, String key, boolean fallback, List<String> errors) {
        String value = properties.getProperty(key);
        if (value == null) {
            return fallback;
        }
        String trimmed = value.trim();
        if ("true".equalsIgnoreCase(trimmed)) {
            return true;
        }
        if ("false".equalsIgnoreCase(trimmed)) {
            return false;
        }
        errors.add(key + ": expected true or false but got \"" + value + "\"");
        return fallback;
    }
}
