package com.jmathml.ast;

/**
 * A symbol contributed by a grammar extension.
 *
 * @param extension   name of the contributing extension
 * @param elementName MathML element the symbol is read from and written as, or null
 *                    for a symbol that only exists as a {@code csymbol}
 * @param csymbolUrl  definitionURL of the symbol when it is written as a {@code csymbol}
 * @param nodeTag     true when the element is a container written with its own
 *                    children instead of inside {@code apply}
 */
public record ExtensionSymbol(String extension, String elementName, String csymbolUrl, boolean nodeTag) {

    public static ExtensionSymbol element(String extension, String elementName) {
        return new ExtensionSymbol(extension, elementName, null, false);
    }

    public static ExtensionSymbol container(String extension, String elementName) {
        return new ExtensionSymbol(extension, elementName, null, true);
    }

    public static ExtensionSymbol csymbol(String extension, String name, String url) {
        return new ExtensionSymbol(extension, name, url, false);
    }

    public boolean isCsymbol() {
        return csymbolUrl != null;
    }
}
