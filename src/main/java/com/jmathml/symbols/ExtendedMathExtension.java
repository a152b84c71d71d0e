package com.jmathml.symbols;

import com.jmathml.ast.ExtensionSymbol;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.impl.factory.Lists;

/**
 * The extended math vocabulary that became part of SBML Level 3 Version 2 core:
 * {@code max}, {@code min}, {@code quotient}, {@code rem}, {@code implies} and the
 * {@code rateOf} c-symbol.
 */
public class ExtendedMathExtension implements GrammarExtension {
    public static final String NAME = "extended-math";
    public static final String RATE_OF_URL = "http://www.sbml.org/sbml/symbols/rateOf";

    public static final ExtensionSymbol MAX = ExtensionSymbol.element(NAME, "max");
    public static final ExtensionSymbol MIN = ExtensionSymbol.element(NAME, "min");
    public static final ExtensionSymbol QUOTIENT = ExtensionSymbol.element(NAME, "quotient");
    public static final ExtensionSymbol REM = ExtensionSymbol.element(NAME, "rem");
    public static final ExtensionSymbol IMPLIES = ExtensionSymbol.element(NAME, "implies");
    public static final ExtensionSymbol RATE_OF = ExtensionSymbol.csymbol(NAME, "rateOf", RATE_OF_URL);

    private static final ImmutableList<ExtensionSymbol> SYMBOLS =
        Lists.immutable.of(MAX, MIN, QUOTIENT, REM, IMPLIES, RATE_OF);

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean appliesTo(NamespaceContext namespaces) {
        return namespaces == null
            || namespaces.level() == 3 && namespaces.version() >= 2;
    }

    @Override
    public ImmutableList<ExtensionSymbol> symbols() {
        return SYMBOLS;
    }
}
