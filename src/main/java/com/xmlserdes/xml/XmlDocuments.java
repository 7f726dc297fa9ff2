package com.xmlserdes.xml;

import com.xmlserdes.error.XmlSerDesException;
import lombok.experimental.UtilityClass;
import org.jdom2.Document;
import org.jdom2.Element;
import org.jdom2.JDOMException;
import org.jdom2.input.SAXBuilder;
import org.jdom2.input.sax.XMLReaders;
import org.jdom2.output.Format;
import org.jdom2.output.XMLOutputter;

import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;

/**
 * Text I/O and small tree helpers over JDOM.
 * Output uses the raw format: no declaration, no indentation, text kept verbatim.
 */
@UtilityClass
public class XmlDocuments {

    /**
     * Render an element (and its subtree) as XML text.
     */
    public static String toText(Element element) {
        return new XMLOutputter(Format.getRawFormat()).outputString(element);
    }

    /**
     * Parse XML text and return its root element, detached from the document.
     */
    public static Element parse(String xml) {
        SAXBuilder builder = new SAXBuilder(XMLReaders.NONVALIDATING);
        builder.setExpandEntities(false);
        try {
            Document document = builder.build(new StringReader(xml));
            return document.detachRootElement();
        } catch (JDOMException | IOException e) {
            throw new XmlSerDesException("malformed XML document: " + e.getMessage(), null, e);
        }
    }

    /**
     * Names of the element's child elements, in document order.
     */
    public static List<String> childTags(Element element) {
        List<String> tags = new ArrayList<>();
        for (Element child : element.getChildren()) {
            tags.add(child.getName());
        }
        return tags;
    }
}
