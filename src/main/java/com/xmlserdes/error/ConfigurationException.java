package com.xmlserdes.error;

import java.util.List;

/**
 * The schema itself is malformed: duplicate tag, attribute wrapping a non-atomic type,
 * unresolvable type specification, class without binding.
 * <p>
 * Can hold several errors at once so a broken schema is reported in one go.
 */
public class ConfigurationException extends XmlSerDesException {

    private static final long serialVersionUID = 1L;

    private final List<String> errors;

    public ConfigurationException(String error) {
        this(List.of(error));
    }

    public ConfigurationException(List<String> errors) {
        super(String.join(System.lineSeparator(), errors));
        this.errors = List.copyOf(errors);
    }

    public ConfigurationException(String error, Throwable cause) {
        super(error, null, cause);
        this.errors = List.of(error);
    }

    public List<String> getErrors() {
        return errors;
    }
}
