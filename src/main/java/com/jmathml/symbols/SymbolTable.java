package com.jmathml.symbols;

import com.jmathml.ast.ExtensionSymbol;
import com.jmathml.ast.NodeType;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.map.ImmutableMap;
import org.eclipse.collections.api.set.ImmutableSet;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.Maps;
import org.eclipse.collections.impl.factory.Sets;

import java.util.Arrays;

/**
 * Maps MathML element names to node types and back. The core vocabulary is fixed;
 * the grammar extensions given at construction are consulted only for names the
 * core does not know.
 */
public class SymbolTable {
    // sorted case-insensitively; structural elements map to UNKNOWN
    private static final String[] ELEMENTS = {
        "abs", "and", "annotation", "annotation-xml", "apply", "arccos", "arccosh",
        "arccot", "arccoth", "arccsc", "arccsch", "arcsec", "arcsech", "arcsin",
        "arcsinh", "arctan", "arctanh", "bvar", "ceiling", "ci", "cn", "cos", "cosh",
        "cot", "coth", "csc", "csch", "csymbol", "degree", "divide", "eq", "exp",
        "exponentiale", "factorial", "false", "floor", "geq", "gt", "infinity",
        "lambda", "leq", "ln", "log", "logbase", "lt", "math", "minus", "neq", "not",
        "notanumber", "or", "otherwise", "pi", "piece", "piecewise", "plus", "power",
        "root", "sec", "sech", "semantics", "sep", "sin", "sinh", "tan", "tanh",
        "times", "true", "xor"
    };

    private static final NodeType[] TYPES = {
        NodeType.FUNCTION_ABS, NodeType.LOGICAL_AND, NodeType.UNKNOWN, NodeType.UNKNOWN,
        NodeType.FUNCTION, NodeType.FUNCTION_ARCCOS, NodeType.FUNCTION_ARCCOSH,
        NodeType.FUNCTION_ARCCOT, NodeType.FUNCTION_ARCCOTH, NodeType.FUNCTION_ARCCSC,
        NodeType.FUNCTION_ARCCSCH, NodeType.FUNCTION_ARCSEC, NodeType.FUNCTION_ARCSECH,
        NodeType.FUNCTION_ARCSIN, NodeType.FUNCTION_ARCSINH, NodeType.FUNCTION_ARCTAN,
        NodeType.FUNCTION_ARCTANH, NodeType.UNKNOWN, NodeType.FUNCTION_CEILING,
        NodeType.NAME, NodeType.REAL, NodeType.FUNCTION_COS, NodeType.FUNCTION_COSH,
        NodeType.FUNCTION_COT, NodeType.FUNCTION_COTH, NodeType.FUNCTION_CSC,
        NodeType.FUNCTION_CSCH, NodeType.CSYMBOL_FUNCTION, NodeType.UNKNOWN,
        NodeType.DIVIDE, NodeType.RELATIONAL_EQ, NodeType.FUNCTION_EXP,
        NodeType.CONSTANT_E, NodeType.FUNCTION_FACTORIAL, NodeType.CONSTANT_FALSE,
        NodeType.FUNCTION_FLOOR, NodeType.RELATIONAL_GEQ, NodeType.RELATIONAL_GT,
        NodeType.REAL, NodeType.LAMBDA, NodeType.RELATIONAL_LEQ, NodeType.FUNCTION_LN,
        NodeType.FUNCTION_LOG, NodeType.UNKNOWN, NodeType.RELATIONAL_LT, NodeType.UNKNOWN,
        NodeType.MINUS, NodeType.RELATIONAL_NEQ, NodeType.LOGICAL_NOT, NodeType.REAL,
        NodeType.LOGICAL_OR, NodeType.UNKNOWN, NodeType.CONSTANT_PI, NodeType.UNKNOWN,
        NodeType.FUNCTION_PIECEWISE, NodeType.PLUS, NodeType.POWER, NodeType.FUNCTION_ROOT,
        NodeType.FUNCTION_SEC, NodeType.FUNCTION_SECH, NodeType.UNKNOWN, NodeType.UNKNOWN,
        NodeType.FUNCTION_SIN, NodeType.FUNCTION_SINH, NodeType.FUNCTION_TAN,
        NodeType.FUNCTION_TANH, NodeType.TIMES, NodeType.CONSTANT_TRUE, NodeType.LOGICAL_XOR
    };

    private static final ImmutableSet<String> NODE_TAGS = Sets.immutable.of(
        "apply", "cn", "ci", "csymbol", "true", "false", "notanumber", "pi",
        "infinity", "exponentiale", "semantics", "piecewise");

    private static final ImmutableMap<NodeType, String> ELEMENT_NAMES;

    static {
        if (ELEMENTS.length != TYPES.length) {
            throw new IllegalStateException("Element table and type table differ in length");
        }
        var names = Maps.mutable.<NodeType, String>empty();
        for (NodeType type : NodeType.values()) {
            if (type.elementName() != null) {
                names.put(type, type.elementName());
            }
        }
        ELEMENT_NAMES = names.toImmutable();
    }

    private final ImmutableList<GrammarExtension> extensions;

    public SymbolTable() {
        this(Lists.immutable.empty());
    }

    public SymbolTable(ImmutableList<GrammarExtension> extensions) {
        this.extensions = extensions;
    }

    public ImmutableList<GrammarExtension> extensions() {
        return extensions;
    }

    /**
     * Looks up a core element name, ignoring case.
     *
     * @return the node type, {@link NodeType#UNKNOWN} for structural elements such as
     * {@code bvar} or {@code sep}, or null if the name is not core MathML
     */
    public static NodeType lookup(String name) {
        int index = Arrays.binarySearch(ELEMENTS, name, String.CASE_INSENSITIVE_ORDER);
        return index >= 0 ? TYPES[index] : null;
    }

    public static String canonicalName(String name) {
        int index = Arrays.binarySearch(ELEMENTS, name, String.CASE_INSENSITIVE_ORDER);
        return index >= 0 ? ELEMENTS[index] : null;
    }

    public static boolean isCoreElement(String name) {
        return lookup(name) != null;
    }

    public static String elementName(NodeType type) {
        return ELEMENT_NAMES.get(type);
    }

    public String elementName(ExtensionSymbol symbol) {
        GrammarExtension owner = ownerOf(symbol);
        return owner != null ? owner.tagFor(symbol) : null;
    }

    public String csymbolUrl(ExtensionSymbol symbol) {
        GrammarExtension owner = ownerOf(symbol);
        return owner != null ? owner.csymbolUrlFor(symbol) : null;
    }

    /**
     * Asks the extensions applicable to {@code namespaces}, in registration order, for
     * an element the core grammar does not define.
     */
    public ExtensionSymbol resolveExtensionTag(String name, NamespaceContext namespaces) {
        for (GrammarExtension extension : extensions) {
            if (extension.appliesTo(namespaces)) {
                ExtensionSymbol symbol = extension.resolveTag(name);
                if (symbol != null) {
                    return symbol;
                }
            }
        }
        return null;
    }

    public boolean isNodeTag(String name) {
        return NODE_TAGS.contains(name) || extensions.anySatisfy(e -> e.isNodeTag(name));
    }

    public boolean isNodeTag(ExtensionSymbol symbol) {
        return symbol.nodeTag() && ownerOf(symbol) != null;
    }

    private GrammarExtension ownerOf(ExtensionSymbol symbol) {
        return extensions.detect(e -> e.name().equals(symbol.extension()));
    }

    /**
     * Whether a c-symbol kind may be used with the given level and version. Anything
     * goes without a context; Level 1 has no c-symbols; avogadro and extension symbols
     * need Level 3.
     */
    public static boolean isValidCsymbol(NamespaceContext namespaces, NodeType type) {
        if (namespaces == null) {
            return true;
        }
        if (namespaces.level() < 2) {
            return false;
        }
        return namespaces.level() >= 3
            || (type != NodeType.NAME_AVOGADRO && type != NodeType.EXTENSION);
    }
}
