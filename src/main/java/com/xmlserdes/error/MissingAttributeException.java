package com.xmlserdes.error;

import com.xmlserdes.xml.NodePath;

public class MissingAttributeException extends XmlSerDesException {

    private static final long serialVersionUID = 1L;

    private final String attributeName;

    public MissingAttributeException(String attributeName, NodePath path) {
        super("missing required attribute \"" + attributeName + "\"", path);
        this.attributeName = attributeName;
    }

    public String getAttributeName() {
        return attributeName;
    }
}
