package com.xmlserdes.error;

import com.xmlserdes.xml.NodePath;

/**
 * Leaf text that cannot be parsed as its declared scalar type.
 */
public class TextParseException extends XmlSerDesException {

    private static final long serialVersionUID = 1L;

    private final String text;
    private final String typeName;

    public TextParseException(String text, String typeName, String reason, NodePath path) {
        super(String.format("could not parse \"%.100s\" as %s: %s", text, typeName, reason), path);
        this.text = text;
        this.typeName = typeName;
    }

    public String getText() {
        return text;
    }

    public String getTypeName() {
        return typeName;
    }
}
