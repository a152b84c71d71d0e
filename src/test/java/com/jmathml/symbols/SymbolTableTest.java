package com.jmathml.symbols;

import com.jmathml.ast.NodeType;
import org.eclipse.collections.impl.factory.Lists;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

public class SymbolTableTest {

    private final SymbolTable symbols = new SymbolTable(Lists.immutable.of(new ExtendedMathExtension()));

    // ============================================================
    // Core vocabulary
    // ============================================================

    @ParameterizedTest
    @CsvSource({
        "plus, PLUS",
        "times, TIMES",
        "power, POWER",
        "ci, NAME",
        "cn, REAL",
        "csymbol, CSYMBOL_FUNCTION",
        "apply, FUNCTION",
        "arccsch, FUNCTION_ARCCSCH",
        "exponentiale, CONSTANT_E",
        "notanumber, REAL",
        "neq, RELATIONAL_NEQ",
        "xor, LOGICAL_XOR",
        "bvar, UNKNOWN",
        "sep, UNKNOWN",
        "annotation-xml, UNKNOWN"
    })
    public void testLookup(String name, NodeType expected) {
        assertEquals(expected, SymbolTable.lookup(name));
    }

    @Test
    public void testLookupIgnoresCase() {
        assertEquals(NodeType.FUNCTION_SIN, SymbolTable.lookup("Sin"));
        assertEquals(NodeType.PLUS, SymbolTable.lookup("PLUS"));
    }

    @Test
    public void testUnknownNames() {
        assertNull(SymbolTable.lookup("max"));
        assertNull(SymbolTable.lookup("vector"));
        assertFalse(SymbolTable.isCoreElement("mi"));
        assertTrue(SymbolTable.isCoreElement("math"));
    }

    @Test
    public void testEveryElementNameLooksUpItsType() {
        for (NodeType type : NodeType.values()) {
            String name = type.elementName();
            if (name != null) {
                assertEquals(type, SymbolTable.lookup(name), "lookup of " + name);
                assertEquals(name, SymbolTable.elementName(type));
            }
        }
    }

    @Test
    public void testTypesWithoutElement() {
        assertNull(SymbolTable.elementName(NodeType.NAME));
        assertNull(SymbolTable.elementName(NodeType.FUNCTION_DELAY));
        assertNull(SymbolTable.elementName(NodeType.EXTENSION));
    }

    @Test
    public void testNodeTags() {
        assertTrue(symbols.isNodeTag("apply"));
        assertTrue(symbols.isNodeTag("semantics"));
        assertTrue(symbols.isNodeTag("piecewise"));
        assertFalse(symbols.isNodeTag("lambda"));
        assertFalse(symbols.isNodeTag("plus"));
        assertFalse(symbols.isNodeTag("max"));
    }

    // ============================================================
    // Extensions
    // ============================================================

    @Test
    public void testExtensionTagsDependOnContext() {
        assertEquals(ExtendedMathExtension.MAX, symbols.resolveExtensionTag("max", NamespaceContext.L3V2));
        assertEquals(ExtendedMathExtension.IMPLIES, symbols.resolveExtensionTag("implies", null));
        assertNull(symbols.resolveExtensionTag("max", new NamespaceContext(3, 1)));
        assertNull(symbols.resolveExtensionTag("rateOf", NamespaceContext.L3V2));
        assertNull(new SymbolTable().resolveExtensionTag("max", NamespaceContext.L3V2));
    }

    @Test
    public void testExtensionNames() {
        assertEquals("quotient", symbols.elementName(ExtendedMathExtension.QUOTIENT));
        assertEquals(ExtendedMathExtension.RATE_OF_URL, symbols.csymbolUrl(ExtendedMathExtension.RATE_OF));
        assertNull(symbols.csymbolUrl(ExtendedMathExtension.REM));
        assertNull(new SymbolTable().elementName(ExtendedMathExtension.QUOTIENT));
        assertFalse(symbols.isNodeTag(ExtendedMathExtension.MAX));
    }

    // ============================================================
    // c-symbol validity
    // ============================================================

    @Test
    public void testCsymbolValidity() {
        NamespaceContext l1 = new NamespaceContext(1, 2);
        NamespaceContext l2 = new NamespaceContext(2, 4);
        NamespaceContext l3 = new NamespaceContext(3, 1);

        assertTrue(SymbolTable.isValidCsymbol(null, NodeType.NAME_AVOGADRO));
        assertFalse(SymbolTable.isValidCsymbol(l1, NodeType.NAME_TIME));
        assertTrue(SymbolTable.isValidCsymbol(l2, NodeType.NAME_TIME));
        assertTrue(SymbolTable.isValidCsymbol(l2, NodeType.FUNCTION_DELAY));
        assertFalse(SymbolTable.isValidCsymbol(l2, NodeType.NAME_AVOGADRO));
        assertFalse(SymbolTable.isValidCsymbol(l2, NodeType.EXTENSION));
        assertTrue(SymbolTable.isValidCsymbol(l3, NodeType.NAME_AVOGADRO));
        assertTrue(SymbolTable.isValidCsymbol(l3, NodeType.EXTENSION));
    }
}
