package com.jmathml.xml;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.impl.factory.Lists;

/**
 * One token of an XML stream: a start tag, an end tag, a run of text, or the end of
 * input. An element with no content is a single token that is both a start and an
 * end.
 */
public record XmlToken(
    Kind kind,
    String name,
    String prefix,
    String namespaceUri,
    boolean start,
    boolean end,
    String characters,
    ImmutableList<XmlAttribute> attributes,
    ImmutableList<XmlNamespace> namespaces,
    int line,
    int column) {

    public enum Kind {
        ELEMENT, TEXT, EOF
    }

    public static XmlToken startElement(String name, String prefix, String namespaceUri,
                                        ImmutableList<XmlAttribute> attributes,
                                        ImmutableList<XmlNamespace> namespaces,
                                        int line, int column) {
        return new XmlToken(Kind.ELEMENT, name, prefix, namespaceUri, true, false, "",
            attributes, namespaces, line, column);
    }

    public static XmlToken endElement(String name, String prefix, String namespaceUri, int line, int column) {
        return new XmlToken(Kind.ELEMENT, name, prefix, namespaceUri, false, true, "",
            Lists.immutable.empty(), Lists.immutable.empty(), line, column);
    }

    public static XmlToken text(String characters, int line, int column) {
        return new XmlToken(Kind.TEXT, "", "", "", false, false, characters,
            Lists.immutable.empty(), Lists.immutable.empty(), line, column);
    }

    public static XmlToken eof(int line, int column) {
        return new XmlToken(Kind.EOF, "", "", "", false, false, "",
            Lists.immutable.empty(), Lists.immutable.empty(), line, column);
    }

    public XmlToken asEmptyElement() {
        return new XmlToken(kind, name, prefix, namespaceUri, true, true, characters,
            attributes, namespaces, line, column);
    }

    public boolean isStart() {
        return start;
    }

    public boolean isEnd() {
        return end;
    }

    public boolean isText() {
        return kind == Kind.TEXT;
    }

    public boolean isEof() {
        return kind == Kind.EOF;
    }

    /**
     * @return true if this is the closing tag of {@code element}; an empty element is
     * never the end of anything but itself
     */
    public boolean isEndFor(XmlToken element) {
        return end && !start
            && element.start
            && name.equals(element.name)
            && namespaceUri.equals(element.namespaceUri);
    }

    public String attribute(String localName) {
        XmlAttribute attribute = attributes.detect(a -> a.localName().equals(localName));
        return attribute != null ? attribute.value() : null;
    }

    public String attribute(String localName, String namespaceUri) {
        XmlAttribute attribute = attributes.detect(
            a -> a.localName().equals(localName) && a.namespaceUri().equals(namespaceUri));
        return attribute != null ? attribute.value() : null;
    }

    public boolean hasAttribute(String localName) {
        return attribute(localName) != null;
    }

    @Override
    public String toString() {
        return switch (kind) {
            case TEXT -> "text '" + characters + "'";
            case EOF -> "end of input";
            case ELEMENT -> (start ? "<" : "</") + name + (start && end ? "/>" : ">");
        };
    }
}
