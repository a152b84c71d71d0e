package com.jmathml.symbols;

import com.jmathml.ast.ExtensionSymbol;
import org.eclipse.collections.api.list.ImmutableList;

/**
 * Extra MathML vocabulary layered on top of the core grammar. The core grammar always
 * wins; an extension is only asked about names and URLs the core does not know.
 */
public interface GrammarExtension {

    String name();

    /**
     * @param namespaces the context being read or written, or null when there is none
     */
    boolean appliesTo(NamespaceContext namespaces);

    ImmutableList<ExtensionSymbol> symbols();

    default ExtensionSymbol resolveTag(String name) {
        return symbols().detect(s -> !s.isCsymbol() && s.elementName().equals(name));
    }

    default String tagFor(ExtensionSymbol symbol) {
        return symbols().contains(symbol) ? symbol.elementName() : null;
    }

    default String csymbolUrlFor(ExtensionSymbol symbol) {
        return symbols().contains(symbol) ? symbol.csymbolUrl() : null;
    }

    default boolean isNodeTag(String name) {
        return symbols().anySatisfy(s -> s.nodeTag() && s.elementName().equals(name));
    }
}
