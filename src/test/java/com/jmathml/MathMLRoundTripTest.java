package com.jmathml;

import com.jmathml.ast.AstNode;
import com.jmathml.ast.NodeType;
import com.jmathml.symbols.NamespaceContext;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Reading what was written gives back the tree that was read.
 */
public class MathMLRoundTripTest {

    private static final String MATH = "<math xmlns=\"http://www.w3.org/1998/Math/MathML\">";
    private static final String MATH_WITH_SBML =
        "<math xmlns=\"http://www.w3.org/1998/Math/MathML\" xmlns:sbml=\"http://www.sbml.org/sbml/level3/version2/core\">";
    private static final String END = "</math>";

    static Stream<String> expressions() {
        return Stream.of(
            "<cn type=\"integer\">12345</cn>",
            "<cn type=\"integer\">-7</cn>",
            "<cn type=\"rational\">12342<sep/>2342342</cn>",
            "<cn type=\"e-notation\">12.3<sep/>5</cn>",
            "<cn>0.25</cn>",
            "<notanumber/>",
            "<infinity/>",
            "<apply><minus/><infinity/></apply>",
            "<ci id=\"n1\" class=\"species\" style=\"bold\">x</ci>",
            "<ci definitionURL=\"http://example.org/x\">x</ci>",
            "<csymbol encoding=\"text\" definitionURL=\"http://www.sbml.org/sbml/symbols/time\">t</csymbol>",
            "<apply><plus/><ci>a</ci><ci>b</ci><ci>c</ci></apply>",
            "<apply><times/><ci>a</ci><apply><plus/><ci>b</ci><cn>1</cn></apply></apply>",
            "<apply><divide/><apply><power/><ci>x</ci><cn type=\"integer\">2</cn></apply><pi/></apply>",
            "<apply><ci>f</ci><ci>x</ci><ci>y</ci></apply>",
            "<apply><log/><ci>x</ci></apply>",
            "<apply><root/><degree><cn type=\"integer\">3</cn></degree><ci>x</ci></apply>",
            "<apply><and/><apply><lt/><ci>a</ci><ci>b</ci></apply><apply><not/><false/></apply></apply>",
            "<apply><csymbol encoding=\"text\" definitionURL=\"http://www.sbml.org/sbml/symbols/delay\">delay</csymbol>"
                + "<ci>x</ci><cn>0.5</cn></apply>",
            "<apply><csymbol encoding=\"text\" definitionURL=\"http://example.org/f\">f</csymbol><ci>y</ci></apply>",
            "<apply><max/><ci>a</ci><ci>b</ci></apply>",
            "<apply><csymbol encoding=\"text\" definitionURL=\"http://www.sbml.org/sbml/symbols/rateOf\">rateOf</csymbol>"
                + "<ci>S1</ci></apply>",
            "<piecewise><piece><cn type=\"integer\">1</cn><apply><gt/><ci>x</ci><cn>0</cn></apply></piece>"
                + "<otherwise><cn type=\"integer\">0</cn></otherwise></piecewise>",
            "<lambda><bvar><ci>x</ci></bvar><apply><sin/><apply><plus/><ci>x</ci><cn>1</cn></apply></apply></lambda>",
            "<lambda><bvar><ci>x</ci></bvar><bvar><ci>y</ci></bvar></lambda>",
            "<semantics definitionURL=\"http://example.org/sum\"><apply><plus/><ci>a</ci><ci>b</ci></apply>"
                + "<annotation encoding=\"text\">a+b</annotation></semantics>",
            "<semantics><ci>x</ci><annotation-xml encoding=\"MathML-Presentation\"><mi>x</mi></annotation-xml></semantics>"
        );
    }

    @ParameterizedTest
    @MethodSource("expressions")
    public void testRoundTrip(String content) {
        AstNode tree = MathML.parse(MATH + content + END);
        assertNotNull(tree, "Failed to parse " + content);

        String xml = MathML.serialize(tree);
        AstNode again = MathML.parse(xml);

        assertNotNull(again, "Failed to re-read " + xml);
        assertTrue(tree.exactlyEqual(again), "Expected " + tree + " but got " + again);
    }

    @Test
    public void testRoundTripWithUnits() {
        NamespaceContext namespaces = NamespaceContext.L3V2;
        AstNode tree = MathML.parse(MATH_WITH_SBML
            + "<apply><times/><cn sbml:units=\"mole\" type=\"integer\">3</cn><ci>x</ci></apply>" + END, namespaces);
        assertNotNull(tree);

        AstNode again = MathML.parse(MathML.serialize(tree, namespaces), namespaces);

        assertNotNull(again);
        assertTrue(tree.exactlyEqual(again));
        assertEquals("mole", again.getChild(0).getUnits());
    }

    // ============================================================
    // n-ary plus and times
    // ============================================================

    @Test
    public void testNaryPlusIsAFixedPoint() {
        AstNode flat = AstNode.of(NodeType.PLUS, AstNode.name("a"), AstNode.name("b"), AstNode.name("c"));

        String first = MathML.serialize(flat);
        String second = MathML.serialize(MathML.parse(first));

        assertEquals(first, second);
        assertTrue(MathML.parse(first).exactlyEqual(MathML.parse(second)));
        assertEquals("PLUS(PLUS(NAME 'a', NAME 'b'), NAME 'c')", MathML.parse(first).toString());
        assertFalse(flat.exactlyEqual(MathML.parse(first)));
    }

    @Test
    public void testRightNestedTimesIsRebuiltLeftNested() {
        AstNode right = AstNode.of(NodeType.TIMES, AstNode.name("a"),
            AstNode.of(NodeType.TIMES, AstNode.name("b"), AstNode.name("c")));

        String xml = MathML.serialize(right);
        AstNode reread = MathML.parse(xml);

        assertFalse(right.exactlyEqual(reread));
        assertEquals("TIMES(TIMES(NAME 'a', NAME 'b'), NAME 'c')", reread.toString());
        assertEquals(xml, MathML.serialize(reread));
    }
}
