package com.jmathml.symbols;

import com.jmathml.ast.ExtensionSymbol;
import com.jmathml.ast.NodeType;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.api.set.MutableSet;
import org.eclipse.collections.impl.factory.Maps;
import org.eclipse.collections.impl.factory.Sets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps {@code csymbol} definitionURLs to the kind of node they stand for. The SBML
 * symbols (time, delay, avogadro) are always present; extension URLs are added once
 * per namespace context.
 */
public class DefinitionUrlRegistry {
    private static final Logger log = LoggerFactory.getLogger(DefinitionUrlRegistry.class);

    public static final String URL_TIME = "http://www.sbml.org/sbml/symbols/time";
    public static final String URL_DELAY = "http://www.sbml.org/sbml/symbols/delay";
    public static final String URL_AVOGADRO = "http://www.sbml.org/sbml/symbols/avogadro";

    public record Definition(NodeType type, ExtensionSymbol extension) {
    }

    private final MutableMap<String, Definition> definitions = Maps.mutable.empty();
    private final MutableSet<String> populatedFor = Sets.mutable.empty();

    public DefinitionUrlRegistry() {
        register(URL_TIME, NodeType.NAME_TIME);
        register(URL_DELAY, NodeType.FUNCTION_DELAY);
        register(URL_AVOGADRO, NodeType.NAME_AVOGADRO);
    }

    /**
     * Registers a core URL. The first registration of a URL wins.
     *
     * @return true if the URL was new
     */
    public boolean register(String url, NodeType type) {
        return registerDefinition(url, new Definition(type, null));
    }

    public boolean register(ExtensionSymbol symbol) {
        if (!symbol.isCsymbol()) {
            throw new IllegalArgumentException(symbol.elementName() + " is not a csymbol");
        }
        return registerDefinition(symbol.csymbolUrl(), new Definition(NodeType.EXTENSION, symbol));
    }

    private boolean registerDefinition(String url, Definition definition) {
        if (definitions.containsKey(url)) {
            return false;
        }
        definitions.put(url, definition);
        return true;
    }

    /**
     * Adds the c-symbols of every extension that applies to {@code namespaces}. Runs
     * at most once per distinct context.
     */
    public void populate(NamespaceContext namespaces, ImmutableList<GrammarExtension> extensions) {
        String key = namespaces == null ? "" : namespaces.toString();
        if (!populatedFor.add(key)) {
            return;
        }
        for (GrammarExtension extension : extensions) {
            if (!extension.appliesTo(namespaces)) {
                continue;
            }
            for (ExtensionSymbol symbol : extension.symbols()) {
                if (symbol.isCsymbol() && register(symbol)) {
                    log.debug("Registered csymbol {} from {} for {}",
                        symbol.csymbolUrl(), extension.name(), key.isEmpty() ? "no namespace" : key);
                }
            }
        }
    }

    public Definition lookup(String url) {
        return url == null ? null : definitions.get(url);
    }

    public static String urlFor(NodeType type) {
        return switch (type) {
            case NAME_TIME -> URL_TIME;
            case FUNCTION_DELAY -> URL_DELAY;
            case NAME_AVOGADRO -> URL_AVOGADRO;
            default -> null;
        };
    }

    public int size() {
        return definitions.size();
    }
}
