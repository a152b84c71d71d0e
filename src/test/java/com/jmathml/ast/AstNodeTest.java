package com.jmathml.ast;

import com.jmathml.symbols.ExtendedMathExtension;
import com.jmathml.xml.XmlNode;
import org.eclipse.collections.impl.factory.Lists;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class AstNodeTest {

    // ============================================================
    // Kind and numeric payload
    // ============================================================

    @Test
    public void testNewNodeIsUnknown() {
        AstNode node = new AstNode();

        assertTrue(node.isUnknown());
        assertNull(node.getValue());
        assertEquals(0, node.getNumChildren());
    }

    @Test
    public void testSetValueSetsType() {
        AstNode node = new AstNode();

        node.setValue(3);
        assertEquals(NodeType.INTEGER, node.getType());
        node.setValue(2.5);
        assertEquals(NodeType.REAL, node.getType());
        node.setValue(1, 4);
        assertEquals(NodeType.RATIONAL, node.getType());
        assertEquals(0.25, node.getReal());
        node.setValue(1.5, 3);
        assertEquals(NodeType.REAL_E, node.getType());
        assertEquals(1500.0, node.getReal(), 1e-9);
    }

    @Test
    public void testNumericTypeNeedsMatchingValue() {
        AstNode node = new AstNode();
        assertThrows(IllegalArgumentException.class, () -> node.setType(NodeType.INTEGER));

        AstNode real = AstNode.real(1.5);
        assertThrows(IllegalArgumentException.class, () -> real.setType(NodeType.INTEGER));
        real.setType(NodeType.REAL);
        assertEquals(1.5, real.getReal());
    }

    @Test
    public void testNonNumericTypeClearsValue() {
        AstNode node = AstNode.integer(7);

        node.setType(NodeType.NAME);

        assertNull(node.getValue());
        assertEquals(0, node.getInteger());
        assertFalse(node.isNumber());
    }

    @Test
    public void testSetTypeClearsExtension() {
        AstNode node = AstNode.extension(ExtendedMathExtension.MIN);

        node.setType(NodeType.FUNCTION_ABS);

        assertNull(node.getExtension());
    }

    @Test
    public void testAccessorsOnOtherKinds() {
        AstNode integer = AstNode.integer(6);

        assertEquals(6, integer.getNumerator());
        assertEquals(1, integer.getDenominator());
        assertEquals(6.0, integer.getMantissa());
        assertEquals(0, integer.getExponent());
        assertEquals(0.0, AstNode.name("x").getReal());
    }

    // ============================================================
    // Children
    // ============================================================

    @Test
    public void testChildren() {
        AstNode a = AstNode.name("a");
        AstNode b = AstNode.name("b");
        AstNode c = AstNode.name("c");
        AstNode node = AstNode.of(NodeType.PLUS, b);

        node.prependChild(a);
        node.addChild(c);

        assertEquals(3, node.getNumChildren());
        assertSame(a, node.getLeftChild());
        assertSame(c, node.getRightChild());
        assertSame(b, node.getChild(1));

        assertSame(b, node.removeChild(1));
        node.insertChild(1, b);
        assertSame(b, node.getChild(1));
    }

    @Test
    public void testRightChildNeedsTwoChildren() {
        AstNode node = AstNode.of(NodeType.MINUS, AstNode.name("x"));

        assertNotNull(node.getLeftChild());
        assertNull(node.getRightChild());
        assertNull(new AstNode().getLeftChild());
    }

    @Test
    public void testChildrenAreReadOnly() {
        AstNode node = AstNode.of(NodeType.PLUS, AstNode.name("a"));

        assertThrows(UnsupportedOperationException.class, () -> node.getChildren().add(AstNode.name("b")));
    }

    @Test
    public void testNumberCannotHoldChildren() {
        AstNode number = AstNode.integer(1);

        assertThrows(IllegalStateException.class, () -> number.addChild(AstNode.name("x")));
    }

    @Test
    public void testNodeWithChildrenCannotHoldNumber() {
        AstNode node = AstNode.of(NodeType.PLUS, AstNode.name("x"));

        assertThrows(IllegalStateException.class, () -> node.setValue(1));
    }

    @Test
    public void testNodeCannotBeItsOwnChild() {
        AstNode node = new AstNode(NodeType.PLUS);

        assertThrows(IllegalArgumentException.class, () -> node.addChild(node));
    }

    @Test
    public void testChildIndexOutOfRange() {
        AstNode node = AstNode.of(NodeType.PLUS, AstNode.name("x"));

        assertThrows(IndexOutOfBoundsException.class, () -> node.getChild(3));
    }

    @Test
    public void testSwapChildren() {
        AstNode left = AstNode.of(NodeType.PLUS, AstNode.name("a"), AstNode.name("b"));
        AstNode right = AstNode.of(NodeType.TIMES, AstNode.name("c"));

        left.swapChildren(right);

        assertEquals("PLUS(NAME 'c')", left.toString());
        assertEquals("TIMES(NAME 'a', NAME 'b')", right.toString());
    }

    // ============================================================
    // Predicates
    // ============================================================

    @Test
    public void testCategories() {
        assertTrue(new AstNode(NodeType.CONSTANT_E).isConstant());
        assertTrue(new AstNode(NodeType.POWER).isOperator());
        assertTrue(new AstNode(NodeType.FUNCTION_COSH).isFunction());
        assertTrue(new AstNode(NodeType.NAME_TIME).isName());
        assertTrue(new AstNode(NodeType.LOGICAL_XOR).isLogical());
        assertTrue(new AstNode(NodeType.RELATIONAL_NEQ).isBoolean());
        assertTrue(new AstNode(NodeType.CONSTANT_FALSE).isBoolean());
        assertFalse(new AstNode(NodeType.CONSTANT_PI).isBoolean());
        assertTrue(AstNode.rational(1, 2).isReal());
        assertTrue(AstNode.rational(1, 2).isRational());
        assertFalse(AstNode.integer(1).isReal());
    }

    @Test
    public void testSpecialValues() {
        assertTrue(AstNode.real(Double.NaN).isNaN());
        assertTrue(AstNode.real(Double.POSITIVE_INFINITY).isInfinity());
        assertTrue(AstNode.real(Double.NEGATIVE_INFINITY).isNegInfinity());
        assertFalse(AstNode.real(1).isInfinity());
    }

    @Test
    public void testLog10AndSqrt() {
        AstNode log = AstNode.of(NodeType.FUNCTION_LOG, AstNode.integer(10), AstNode.name("x"));
        AstNode ln = AstNode.of(NodeType.FUNCTION_LOG, AstNode.real(10), AstNode.name("x"));
        AstNode sqrt = AstNode.of(NodeType.FUNCTION_ROOT, AstNode.integer(2), AstNode.name("x"));

        assertTrue(log.isLog10());
        assertFalse(ln.isLog10());
        assertTrue(sqrt.isSqrt());
        assertFalse(AstNode.of(NodeType.FUNCTION_ROOT, AstNode.name("x")).isSqrt());
    }

    @Test
    public void testHasUnitsLooksAtDescendants() {
        AstNode withUnits = AstNode.real(2);
        withUnits.setUnits("second");
        AstNode tree = AstNode.of(NodeType.PLUS, AstNode.name("t"),
            AstNode.of(NodeType.TIMES, AstNode.name("k"), withUnits));

        assertTrue(tree.hasUnits());
        assertFalse(AstNode.of(NodeType.PLUS, AstNode.name("t")).hasUnits());
    }

    // ============================================================
    // Copy and equality
    // ============================================================

    private AstNode sample() {
        AstNode x = AstNode.name("x");
        x.setId("n1");
        AstNode k = AstNode.integer(2);
        k.setUnits("dimensionless");
        AstNode node = AstNode.of(NodeType.POWER, x, k);
        node.addSemanticsAnnotation(new XmlNode.Element("annotation", "", "", Lists.immutable.empty(),
            Lists.immutable.empty(), Lists.immutable.of(new XmlNode.Text("x^2"))));
        return node;
    }

    @Test
    public void testDeepCopyIsEqualAndIndependent() {
        AstNode original = sample();
        AstNode copy = original.deepCopy();

        assertTrue(original.exactlyEqual(copy));
        assertNotSame(original.getChild(0), copy.getChild(0));

        copy.getChild(0).setName("y");
        assertFalse(original.exactlyEqual(copy));
        assertEquals("x", original.getChild(0).getName());
    }

    @Test
    public void testExactlyEqualComparesMetadata() {
        AstNode a = sample();
        AstNode b = sample();
        b.getChild(1).setUnits("mole");

        assertFalse(a.exactlyEqual(b));
        assertFalse(a.exactlyEqual(null));
        assertTrue(a.exactlyEqual(a));
    }

    @Test
    public void testEmptyAttributesEqualUnset() {
        AstNode a = AstNode.name("x");
        AstNode b = AstNode.name("x");
        b.setId("");
        b.setStyle("");

        assertTrue(a.exactlyEqual(b));
        assertFalse(b.isSetId());
    }

    @Test
    public void testNaNEqualsNaN() {
        assertTrue(AstNode.real(Double.NaN).exactlyEqual(AstNode.real(Double.NaN)));
        assertFalse(AstNode.real(1).exactlyEqual(AstNode.integer(1)));
    }

    @Test
    public void testSemanticsAnnotationSetsFlag() {
        AstNode node = sample();

        assertTrue(node.getSemanticsFlag());
        assertEquals(1, node.getNumSemanticsAnnotations());
        assertTrue(node.getSemanticsAnnotation(0) instanceof XmlNode.Element);
    }

    @Test
    public void testToString() {
        AstNode node = AstNode.of(NodeType.PLUS, AstNode.name("x"), AstNode.extension(ExtendedMathExtension.REM));

        assertEquals("PLUS(NAME 'x', EXTENSION rem)", node.toString());
    }
}
