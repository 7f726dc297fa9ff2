package com.xmlserdes.type;

import com.xmlserdes.convert.XmlDecoder;
import com.xmlserdes.convert.XmlEncoder;
import org.jdom2.Element;

/**
 * How one field value maps onto XML.
 * <p>
 * The variants are fixed: {@link AtomicDescriptor}, {@link ListDescriptor},
 * {@link InstanceDescriptor}, {@link NumericVectorDescriptor} and {@link RecordVectorDescriptor}.
 * Descriptors hold configuration only and never touch instance data until asked to convert.
 */
public abstract class TypeDescriptor {

    TypeDescriptor() {
    }

    public abstract <R, C> R accept(TypeDescriptorVisitor<R, C> visitor, C context);

    /**
     * Java type of the values this descriptor converts.
     */
    public abstract Class<?> getValueType();

    /**
     * Whether values of this type can live in an XML attribute.
     */
    public boolean isAtomic() {
        return false;
    }

    /**
     * Encode a value as a new element named {@code tag}, using lenient default settings.
     */
    public Element encode(Object value, String tag) {
        return XmlEncoder.defaults().encode(this, value, tag);
    }

    /**
     * Decode an element, checking its tag against {@code expectedTag} unless that is null.
     */
    public Object decode(Element element, String expectedTag) {
        return XmlDecoder.defaults().decode(this, element, expectedTag);
    }
}
