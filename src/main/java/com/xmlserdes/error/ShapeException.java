package com.xmlserdes.error;

import com.xmlserdes.xml.NodePath;

/**
 * Packed buffer whose byte length is not a whole number of elements.
 */
public class ShapeException extends XmlSerDesException {

    private static final long serialVersionUID = 1L;

    private final int length;
    private final int stride;

    public ShapeException(int length, int stride, NodePath path) {
        super("buffer of " + length + " bytes is not a multiple of the " + stride + "-byte element stride", path);
        this.length = length;
        this.stride = stride;
    }

    public int getLength() {
        return length;
    }

    public int getStride() {
        return stride;
    }
}
