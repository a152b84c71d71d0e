package com.jmathml.xml;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.impl.factory.Lists;

/**
 * An uninterpreted XML subtree, used for the annotations attached to a
 * {@code semantics} element. Instances are immutable.
 */
public sealed interface XmlNode {

    record Element(
        String name,
        String prefix,
        String namespaceUri,
        ImmutableList<XmlNamespace> namespaces,
        ImmutableList<XmlAttribute> attributes,
        ImmutableList<XmlNode> children) implements XmlNode {

        public String attribute(String localName) {
            XmlAttribute attribute = attributes.detect(a -> a.localName().equals(localName));
            return attribute != null ? attribute.value() : null;
        }
    }

    record Text(String characters) implements XmlNode {
    }

    /**
     * Consumes the element at the head of {@code stream} together with everything up
     * to and including its end tag.
     */
    static Element read(XmlInputStream stream) {
        XmlToken start = stream.next();
        var children = Lists.mutable.<XmlNode>empty();
        if (!start.isEnd()) {
            while (stream.isGood() && !stream.peek().isEndFor(start)) {
                XmlToken token = stream.peek();
                if (token.isText()) {
                    children.add(new Text(stream.next().characters()));
                } else if (token.isStart()) {
                    children.add(read(stream));
                } else {
                    // end tag of something never opened here
                    stream.next();
                }
            }
            if (stream.isGood()) {
                stream.next();
            }
        }
        return new Element(start.name(), start.prefix(), start.namespaceUri(),
            start.namespaces(), start.attributes(), children.toImmutable());
    }
}
