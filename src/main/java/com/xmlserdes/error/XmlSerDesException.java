package com.xmlserdes.error;

import com.xmlserdes.xml.NodePath;

/**
 * Base of every failure raised while resolving schemas or converting between objects and XML.
 * When a location is known, the message ends with {@code " at /path/to/node"}.
 */
public class XmlSerDesException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String detail;
    private final transient NodePath path;

    public XmlSerDesException(String detail) {
        this(detail, (NodePath) null);
    }

    public XmlSerDesException(String detail, NodePath path) {
        super(render(detail, path));
        this.detail = detail;
        this.path = path;
    }

    public XmlSerDesException(String detail, NodePath path, Throwable cause) {
        super(render(detail, path), cause);
        this.detail = detail;
        this.path = path;
    }

    /**
     * Message without the location suffix.
     */
    public String getDetail() {
        return detail;
    }

    /**
     * Location of the failing node, or {@code null} for failures not tied to a node.
     */
    public NodePath getPath() {
        return path;
    }

    private static String render(String detail, NodePath path) {
        return path == null ? detail : detail + " at " + path;
    }
}
