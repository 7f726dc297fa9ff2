package com.xmlserdes.binding;

import com.xmlserdes.convert.XmlEncoder;
import com.xmlserdes.xml.XmlDocuments;
import org.jdom2.Element;

/**
 * Mixin for bound classes: serialize through the binding registered for the runtime class.
 */
public interface XmlSerializable {

    /**
     * Serialize under the binding's default tag.
     */
    default Element toXml() {
        return toXml(XmlBindings.get(getClass()).getDefaultTag());
    }

    default Element toXml(String tag) {
        return XmlEncoder.defaults().encode(XmlBindings.get(getClass()).asType(), this, tag);
    }

    default String toXmlText() {
        return XmlDocuments.toText(toXml());
    }
}
