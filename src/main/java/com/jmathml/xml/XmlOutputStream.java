package com.jmathml.xml;

import com.ctc.wstx.stax.WstxOutputFactory;
import org.codehaus.stax2.XMLOutputFactory2;
import org.codehaus.stax2.XMLStreamWriter2;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import javax.xml.stream.XMLStreamException;
import java.io.IOException;
import java.io.Writer;

/**
 * Writes elements, attributes and text with two-space indentation. Elements with no
 * content come out as {@code <x/>}. Turning auto-indent off keeps the content of leaf
 * elements on one line, e.g. {@code <ci> x </ci>}.
 */
public class XmlOutputStream implements AutoCloseable {
    private static final XMLOutputFactory2 FACTORY = createFactory();
    private static final String XML_DECLARATION = "<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n";

    private final XMLStreamWriter2 writer;
    // one entry per open element: whether its children were indented one level
    private final MutableList<Boolean> open = Lists.mutable.empty();

    private int indent;
    private boolean autoIndent = true;
    private boolean inStart;
    private boolean inText;
    private boolean skipNextIndent;

    public XmlOutputStream(Writer out, boolean writeXmlDeclaration) throws XMLStreamException {
        if (writeXmlDeclaration) {
            try {
                out.write(XML_DECLARATION);
            } catch (IOException e) {
                throw new XMLStreamException(e);
            }
        }
        this.writer = (XMLStreamWriter2) FACTORY.createXMLStreamWriter(out);
    }

    private static XMLOutputFactory2 createFactory() {
        XMLOutputFactory2 factory = new WstxOutputFactory();
        factory.setProperty(XMLOutputFactory2.IS_REPAIRING_NAMESPACES, false);
        factory.setProperty(XMLOutputFactory2.P_AUTOMATIC_EMPTY_ELEMENTS, true);
        return factory;
    }

    public void startElement(String name) throws XMLStreamException {
        startElement("", name);
    }

    public void startElement(String prefix, String name) throws XMLStreamException {
        if (inStart) {
            indent++;
            open.set(open.size() - 1, true);
        }
        if (inText && skipNextIndent) {
            skipNextIndent = false;
        } else {
            writeIndent(false);
        }
        if (prefix.isEmpty()) {
            writer.writeStartElement(name);
        } else {
            writer.writeStartElement(prefix, name, "");
        }
        open.add(false);
        inStart = true;
    }

    public void endElement() throws XMLStreamException {
        if (open.isEmpty()) {
            throw new IllegalStateException("No element is open");
        }
        boolean indented = open.remove(open.size() - 1);
        if (indented && indent > 0) {
            indent--;
        }
        if (inStart) {
            inStart = false;
        } else if (inText) {
            inText = false;
            skipNextIndent = false;
        } else {
            writeIndent(true);
        }
        writer.writeEndElement();
    }

    public void emptyElement(String name) throws XMLStreamException {
        startElement(name);
        endElement();
    }

    public void writeAttribute(String name, String value) throws XMLStreamException {
        requireStart();
        writer.writeAttribute(name, value);
    }

    public void writeAttribute(String prefix, String name, String value) throws XMLStreamException {
        requireStart();
        if (prefix.isEmpty()) {
            writer.writeAttribute(name, value);
        } else {
            writer.writeAttribute(prefix, "", name, value);
        }
    }

    public void writeNamespace(String prefix, String uri) throws XMLStreamException {
        requireStart();
        if (prefix.isEmpty()) {
            writer.writeDefaultNamespace(uri);
        } else {
            writer.writeNamespace(prefix, uri);
        }
    }

    public void writeText(String characters) throws XMLStreamException {
        if (characters.isEmpty()) {
            return;
        }
        inStart = false;
        writer.writeCharacters(characters);
        inText = true;
        skipNextIndent = true;
    }

    public void setAutoIndent(boolean autoIndent) {
        this.autoIndent = autoIndent;
    }

    /**
     * Re-emits an uninterpreted subtree exactly as it was read; no indentation is
     * added inside it.
     */
    public void writeNode(XmlNode node) throws XMLStreamException {
        if (node instanceof XmlNode.Text text) {
            writeText(text.characters());
            return;
        }
        XmlNode.Element element = (XmlNode.Element) node;
        boolean wasAutoIndent = autoIndent;
        startElement(element.prefix(), element.name());
        setAutoIndent(false);
        for (XmlNamespace namespace : element.namespaces()) {
            writeNamespace(namespace.prefix(), namespace.uri());
        }
        for (XmlAttribute attribute : element.attributes()) {
            writeAttribute(attribute.prefix(), attribute.localName(), attribute.value());
        }
        for (XmlNode child : element.children()) {
            writeNode(child);
        }
        endElement();
        setAutoIndent(wasAutoIndent);
    }

    private void writeIndent(boolean isEnd) throws XMLStreamException {
        if (!autoIndent) {
            return;
        }
        if (indent > 0 || isEnd) {
            writer.writeCharacters("\n");
        }
        if (indent > 0) {
            writer.writeCharacters("  ".repeat(indent));
        }
    }

    private void requireStart() {
        if (!inStart) {
            throw new IllegalStateException("Attributes must follow a start tag");
        }
    }

    public void flush() throws XMLStreamException {
        writer.flush();
    }

    @Override
    public void close() throws XMLStreamException {
        writer.close();
    }
}
