package com.jmathml.xml;

public record XmlAttribute(String localName, String prefix, String namespaceUri, String value) {

    public static XmlAttribute of(String localName, String value) {
        return new XmlAttribute(localName, "", "", value);
    }

    public String qualifiedName() {
        return prefix.isEmpty() ? localName : prefix + ":" + localName;
    }
}
