package com.jmathml.xml;

public record XmlNamespace(String prefix, String uri) {

    public boolean isDefault() {
        return prefix.isEmpty();
    }
}
