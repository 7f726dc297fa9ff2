package com.xmlserdes.error;

import com.xmlserdes.xml.NodePath;

/**
 * Raised in strict mode when an element's children do not match the declared tags.
 */
public class UnexpectedChildrenException extends XmlSerDesException {

    private static final long serialVersionUID = 1L;

    private final transient TagListComparison comparison;

    public UnexpectedChildrenException(TagListComparison comparison, NodePath path) {
        super("children do not match schema " + comparison, path);
        this.comparison = comparison;
    }

    public TagListComparison getComparison() {
        return comparison;
    }
}
