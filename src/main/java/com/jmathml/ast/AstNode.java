package com.jmathml.ast;

import com.jmathml.xml.XmlNode;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.Objects;

/**
 * One node of a MathML expression tree. A node is a leaf (number, name, constant)
 * or an interior node (operator, function, lambda, piecewise), never both; children
 * are owned exclusively by their parent.
 *
 * <p>The reader builds nodes in two steps: a provisional node is created for an
 * element and its kind is switched once the element's shape is known, e.g. a name
 * becomes a user function call when it turns out to be the head of an {@code apply}.
 */
public class AstNode {
    private NodeType type;
    private final MutableList<AstNode> children = Lists.mutable.empty();
    private NumericValue value;

    private String name;
    private String definitionUrl;
    private String units;
    private String id;
    private String className;
    private String style;
    private ExtensionSymbol extension;

    private boolean bvar;
    private boolean semanticsFlag;
    private final MutableList<XmlNode> semanticsAnnotations = Lists.mutable.empty();

    public AstNode() {
        this(NodeType.UNKNOWN);
    }

    public AstNode(NodeType type) {
        this.type = Objects.requireNonNull(type);
    }

    public static AstNode integer(int value) {
        AstNode node = new AstNode();
        node.setValue(value);
        return node;
    }

    public static AstNode real(double value) {
        AstNode node = new AstNode();
        node.setValue(value);
        return node;
    }

    public static AstNode rational(int numerator, int denominator) {
        AstNode node = new AstNode();
        node.setValue(numerator, denominator);
        return node;
    }

    public static AstNode eNotation(double mantissa, int exponent) {
        AstNode node = new AstNode();
        node.setValue(mantissa, exponent);
        return node;
    }

    public static AstNode name(String name) {
        AstNode node = new AstNode(NodeType.NAME);
        node.setName(name);
        return node;
    }

    public static AstNode extension(ExtensionSymbol symbol) {
        AstNode node = new AstNode(NodeType.EXTENSION);
        node.setExtension(symbol);
        return node;
    }

    public static AstNode of(NodeType type, AstNode... children) {
        AstNode node = new AstNode(type);
        for (AstNode child : children) {
            node.addChild(child);
        }
        return node;
    }

    // ============================================================
    // Kind
    // ============================================================

    public NodeType getType() {
        return type;
    }

    /**
     * Switches the kind of this node. Numeric kinds must be set through one of the
     * {@code setValue} methods so that the payload matches.
     */
    public void setType(NodeType type) {
        Objects.requireNonNull(type);
        if (type.category() == NodeType.Category.NUMBER) {
            if (value == null || value.nodeType() != type) {
                throw new IllegalArgumentException("Numeric type " + type + " needs a matching value");
            }
        } else {
            value = null;
        }
        if (type != NodeType.EXTENSION) {
            extension = null;
        }
        this.type = type;
    }

    public ExtensionSymbol getExtension() {
        return extension;
    }

    public void setExtension(ExtensionSymbol extension) {
        this.extension = Objects.requireNonNull(extension);
        this.value = null;
        this.type = NodeType.EXTENSION;
    }

    // ============================================================
    // Numeric payload
    // ============================================================

    public NumericValue getValue() {
        return value;
    }

    public void setValue(NumericValue value) {
        Objects.requireNonNull(value);
        if (!children.isEmpty()) {
            throw new IllegalStateException("A node with children cannot hold a number");
        }
        this.value = value;
        this.extension = null;
        this.type = value.nodeType();
    }

    public void setValue(int value) {
        setValue(new NumericValue.IntegerValue(value));
    }

    public void setValue(double value) {
        setValue(new NumericValue.RealValue(value));
    }

    public void setValue(int numerator, int denominator) {
        setValue(new NumericValue.RationalValue(numerator, denominator));
    }

    public void setValue(double mantissa, int exponent) {
        setValue(new NumericValue.ENotationValue(mantissa, exponent));
    }

    public double getReal() {
        return value != null ? value.toDouble() : 0;
    }

    public int getInteger() {
        return value instanceof NumericValue.IntegerValue i ? i.value() : 0;
    }

    public int getNumerator() {
        if (value instanceof NumericValue.RationalValue r) {
            return r.numerator();
        }
        return getInteger();
    }

    public int getDenominator() {
        return value instanceof NumericValue.RationalValue r ? r.denominator() : 1;
    }

    public double getMantissa() {
        if (value instanceof NumericValue.ENotationValue e) {
            return e.mantissa();
        }
        return getReal();
    }

    public int getExponent() {
        return value instanceof NumericValue.ENotationValue e ? e.exponent() : 0;
    }

    // ============================================================
    // Children
    // ============================================================

    public int getNumChildren() {
        return children.size();
    }

    public AstNode getChild(int index) {
        return children.get(index);
    }

    public AstNode getLeftChild() {
        return children.isEmpty() ? null : children.getFirst();
    }

    public AstNode getRightChild() {
        return children.size() > 1 ? children.getLast() : null;
    }

    public MutableList<AstNode> getChildren() {
        return children.asUnmodifiable();
    }

    public void addChild(AstNode child) {
        children.add(checkChild(child));
    }

    public void prependChild(AstNode child) {
        children.add(0, checkChild(child));
    }

    public void insertChild(int index, AstNode child) {
        children.add(index, checkChild(child));
    }

    public AstNode removeChild(int index) {
        return children.remove(index);
    }

    public void swapChildren(AstNode other) {
        if ((isNumber() && !other.children.isEmpty()) || (other.isNumber() && !children.isEmpty())) {
            throw new IllegalStateException("A number node cannot hold children");
        }
        MutableList<AstNode> mine = Lists.mutable.ofAll(children);
        children.clear();
        children.addAll(other.children);
        other.children.clear();
        other.children.addAll(mine);
    }

    private AstNode checkChild(AstNode child) {
        Objects.requireNonNull(child);
        if (isNumber()) {
            throw new IllegalStateException("A number node cannot hold children");
        }
        if (child == this) {
            throw new IllegalArgumentException("A node cannot be its own child");
        }
        return child;
    }

    // ============================================================
    // Metadata
    // ============================================================

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getDefinitionUrl() {
        return definitionUrl;
    }

    public void setDefinitionUrl(String definitionUrl) {
        this.definitionUrl = definitionUrl;
    }

    public String getUnits() {
        return units;
    }

    public void setUnits(String units) {
        this.units = units;
    }

    public boolean isSetUnits() {
        return units != null && !units.isEmpty();
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public boolean isSetId() {
        return id != null && !id.isEmpty();
    }

    public String getClassName() {
        return className;
    }

    public void setClassName(String className) {
        this.className = className;
    }

    public boolean isSetClassName() {
        return className != null && !className.isEmpty();
    }

    public String getStyle() {
        return style;
    }

    public void setStyle(String style) {
        this.style = style;
    }

    public boolean isSetStyle() {
        return style != null && !style.isEmpty();
    }

    public boolean isBvar() {
        return bvar;
    }

    public void setBvar(boolean bvar) {
        this.bvar = bvar;
    }

    public boolean getSemanticsFlag() {
        return semanticsFlag;
    }

    public void setSemanticsFlag(boolean semanticsFlag) {
        this.semanticsFlag = semanticsFlag;
    }

    public void addSemanticsAnnotation(XmlNode annotation) {
        semanticsAnnotations.add(Objects.requireNonNull(annotation));
        semanticsFlag = true;
    }

    public int getNumSemanticsAnnotations() {
        return semanticsAnnotations.size();
    }

    public XmlNode getSemanticsAnnotation(int index) {
        return semanticsAnnotations.get(index);
    }

    public ImmutableList<XmlNode> getSemanticsAnnotations() {
        return semanticsAnnotations.toImmutable();
    }

    // ============================================================
    // Predicates
    // ============================================================

    public boolean isNumber() {
        return type.category() == NodeType.Category.NUMBER;
    }

    public boolean isInteger() {
        return type == NodeType.INTEGER;
    }

    public boolean isRational() {
        return type == NodeType.RATIONAL;
    }

    public boolean isReal() {
        return type == NodeType.REAL || type == NodeType.REAL_E || type == NodeType.RATIONAL;
    }

    public boolean isName() {
        return type.category() == NodeType.Category.NAME;
    }

    public boolean isConstant() {
        return type.category() == NodeType.Category.CONSTANT;
    }

    public boolean isBoolean() {
        return type == NodeType.CONSTANT_TRUE || type == NodeType.CONSTANT_FALSE
            || isLogical() || isRelational();
    }

    public boolean isOperator() {
        return type.category() == NodeType.Category.OPERATOR;
    }

    public boolean isFunction() {
        return type.category() == NodeType.Category.FUNCTION;
    }

    public boolean isLogical() {
        return type.category() == NodeType.Category.LOGICAL;
    }

    public boolean isRelational() {
        return type.category() == NodeType.Category.RELATIONAL;
    }

    public boolean isLambda() {
        return type == NodeType.LAMBDA;
    }

    public boolean isPiecewise() {
        return type == NodeType.FUNCTION_PIECEWISE;
    }

    public boolean isLog10() {
        return type == NodeType.FUNCTION_LOG && children.size() == 2
            && children.getFirst().isInteger() && children.getFirst().getInteger() == 10;
    }

    public boolean isSqrt() {
        return type == NodeType.FUNCTION_ROOT && children.size() == 2
            && children.getFirst().isInteger() && children.getFirst().getInteger() == 2;
    }

    public boolean isUnknown() {
        return type == NodeType.UNKNOWN;
    }

    public boolean isNaN() {
        return type == NodeType.REAL && Double.isNaN(getReal());
    }

    public boolean isInfinity() {
        return isReal() && getReal() == Double.POSITIVE_INFINITY;
    }

    public boolean isNegInfinity() {
        return isReal() && getReal() == Double.NEGATIVE_INFINITY;
    }

    public boolean hasUnits() {
        if (isNumber() && isSetUnits()) {
            return true;
        }
        return children.anySatisfy(AstNode::hasUnits);
    }

    // ============================================================
    // Copy and comparison
    // ============================================================

    public AstNode deepCopy() {
        AstNode copy = new AstNode(type);
        copy.value = value;
        copy.name = name;
        copy.definitionUrl = definitionUrl;
        copy.units = units;
        copy.id = id;
        copy.className = className;
        copy.style = style;
        copy.extension = extension;
        copy.bvar = bvar;
        copy.semanticsFlag = semanticsFlag;
        // XmlNode subtrees are immutable records, so the list copy is a deep copy
        copy.semanticsAnnotations.addAll(semanticsAnnotations);
        children.forEach(child -> copy.children.add(child.deepCopy()));
        return copy;
    }

    /**
     * Structural equality over kind, payload, every metadata field, annotations and
     * children. NaN payloads compare equal to each other.
     */
    public boolean exactlyEqual(AstNode other) {
        if (other == this) {
            return true;
        }
        if (other == null || other.type != type) {
            return false;
        }
        boolean same = Objects.equals(value, other.value)
            && Objects.equals(name, other.name)
            && Objects.equals(definitionUrl, other.definitionUrl)
            && Objects.equals(blankToNull(units), blankToNull(other.units))
            && Objects.equals(blankToNull(id), blankToNull(other.id))
            && Objects.equals(blankToNull(className), blankToNull(other.className))
            && Objects.equals(blankToNull(style), blankToNull(other.style))
            && Objects.equals(extension, other.extension)
            && bvar == other.bvar
            && semanticsFlag == other.semanticsFlag
            && semanticsAnnotations.equals(other.semanticsAnnotations)
            && children.size() == other.children.size();
        if (!same) {
            return false;
        }
        for (int i = 0; i < children.size(); i++) {
            if (!children.get(i).exactlyEqual(other.children.get(i))) {
                return false;
            }
        }
        return true;
    }

    private static String blankToNull(String s) {
        return s == null || s.isEmpty() ? null : s;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        appendTo(sb);
        return sb.toString();
    }

    private void appendTo(StringBuilder sb) {
        sb.append(type);
        if (value != null) {
            sb.append('=').append(value);
        }
        if (name != null) {
            sb.append(" '").append(name).append('\'');
        }
        if (extension != null) {
            sb.append(' ').append(extension.elementName());
        }
        if (!children.isEmpty()) {
            sb.append('(');
            for (int i = 0; i < children.size(); i++) {
                if (i > 0) {
                    sb.append(", ");
                }
                children.get(i).appendTo(sb);
            }
            sb.append(')');
        }
    }
}
