package com.xmlserdes;

import com.xmlserdes.binding.XmlBinding;
import com.xmlserdes.binding.XmlBindings;
import com.xmlserdes.config.SerDesConfig;
import com.xmlserdes.convert.XmlDecoder;
import com.xmlserdes.convert.XmlEncoder;
import com.xmlserdes.type.TypeDescriptor;
import com.xmlserdes.xml.XmlDocuments;
import org.jdom2.Element;

/**
 * Entry point for converting bound objects to and from XML under one configuration.
 * Thread-safe.
 */
public final class XmlSerDes {

    private final SerDesConfig config;
    private final XmlEncoder encoder;
    private final XmlDecoder decoder;

    private XmlSerDes(SerDesConfig config) {
        this.config = config;
        this.encoder = XmlEncoder.defaults();
        this.decoder = new XmlDecoder(config);
    }

    /**
     * Settings from {@code xmlserdes.properties} on the classpath, or the built-in defaults.
     */
    public static XmlSerDes defaults() {
        return new XmlSerDes(SerDesConfig.load());
    }

    public static XmlSerDes withConfig(SerDesConfig config) {
        return new XmlSerDes(config);
    }

    public SerDesConfig getConfig() {
        return config;
    }

    /**
     * Serialize under the default tag of the object's binding.
     */
    public Element serialize(Object obj) {
        return serialize(obj, bindingOf(obj).getDefaultTag());
    }

    public Element serialize(Object obj, String tag) {
        return encoder.encode(bindingOf(obj).asType(), obj, tag);
    }

    /**
     * Deserialize, requiring the element to carry the binding's default tag.
     */
    public <T> T deserialize(Class<T> type, Element element) {
        return deserialize(type, element, XmlBindings.get(type).getDefaultTag());
    }

    /**
     * @param expectedTag tag the element must carry, or {@code null} to accept any
     */
    public <T> T deserialize(Class<T> type, Element element, String expectedTag) {
        XmlBinding<?> binding = XmlBindings.get(type);
        return type.cast(decoder.decode(binding.asType(), element, expectedTag));
    }

    public Element encode(TypeDescriptor descriptor, Object value, String tag) {
        return encoder.encode(descriptor, value, tag);
    }

    public Object decode(TypeDescriptor descriptor, Element element, String expectedTag) {
        return decoder.decode(descriptor, element, expectedTag);
    }

    public String toXmlText(Object obj) {
        return XmlDocuments.toText(serialize(obj));
    }

    public <T> T fromXmlText(Class<T> type, String xml) {
        return deserialize(type, XmlDocuments.parse(xml));
    }

    private static XmlBinding<?> bindingOf(Object obj) {
        if (obj == null) {
            throw new IllegalArgumentException("cannot serialize null");
        }
        return XmlBindings.get(obj.getClass());
    }
}
