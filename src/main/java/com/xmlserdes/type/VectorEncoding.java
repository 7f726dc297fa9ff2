package com.xmlserdes.type;

/**
 * Wire form of a vector payload.
 */
public enum VectorEncoding {
    /**
     * Human-readable: comma-separated text for numeric vectors, one child element per record
     * for record vectors.
     */
    TEXT,
    /**
     * Base64 of the packed little-endian buffer.
     */
    BINARY
}
