package com.xmlserdes.error;

import com.xmlserdes.xml.NodePath;

public class MissingElementException extends XmlSerDesException {

    private static final long serialVersionUID = 1L;

    private final String tag;

    public MissingElementException(String tag, NodePath path) {
        super("missing required element <" + tag + ">", path);
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }
}
