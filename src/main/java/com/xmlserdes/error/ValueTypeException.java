package com.xmlserdes.error;

import com.xmlserdes.xml.NodePath;

/**
 * A value handed to the serializer does not have the type its descriptor expects.
 */
public class ValueTypeException extends XmlSerDesException {

    private static final long serialVersionUID = 1L;

    public ValueTypeException(String detail, NodePath path) {
        super(detail, path);
    }
}
