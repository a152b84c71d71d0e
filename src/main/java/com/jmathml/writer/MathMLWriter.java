package com.jmathml.writer;

import com.jmathml.MathMLContext;
import com.jmathml.ast.AstNode;
import com.jmathml.ast.ExtensionSymbol;
import com.jmathml.ast.NodeType;
import com.jmathml.symbols.DefinitionUrlRegistry;
import com.jmathml.symbols.NamespaceContext;
import com.jmathml.symbols.SymbolTable;
import com.jmathml.xml.XmlNode;
import com.jmathml.xml.XmlOutputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.xml.stream.XMLStreamException;
import java.io.StringWriter;

/**
 * Writes an {@link AstNode} tree as MathML inside a {@code math} element.
 */
public class MathMLWriter {
    private static final Logger log = LoggerFactory.getLogger(MathMLWriter.class);

    private final NamespaceContext namespaces;
    private final SymbolTable symbols;

    public MathMLWriter(MathMLContext context) {
        this.namespaces = context.namespaces();
        this.symbols = context.symbols();
    }

    public String toXml(AstNode node) {
        StringWriter out = new StringWriter();
        try (XmlOutputStream stream = new XmlOutputStream(out, true)) {
            write(node, stream);
            stream.flush();
        } catch (XMLStreamException e) {
            throw new IllegalStateException("Failed to write MathML", e);
        }
        return out.toString();
    }

    public void write(AstNode node, XmlOutputStream stream) throws XMLStreamException {
        stream.startElement("math");
        stream.writeNamespace("", NamespaceContext.MATHML_URI);
        if (node != null) {
            if (node.hasUnits()) {
                NamespaceContext sbml = namespaces != null ? namespaces : NamespaceContext.L3V2;
                stream.writeNamespace("sbml", sbml.sbmlUri());
            }
            writeNode(node, stream);
        }
        stream.endElement();
        log.debug("Wrote {} for {}", node == null ? "empty math" : node.getType(),
            namespaces == null ? "plain MathML" : namespaces);
    }

    private void writeNode(AstNode node, XmlOutputStream stream) throws XMLStreamException {
        if (node.getSemanticsFlag()) {
            writeSemantics(node, stream);
        } else {
            writeContent(node, stream);
        }
    }

    private void writeContent(AstNode node, XmlOutputStream stream) throws XMLStreamException {
        if (node.isNumber()) {
            writeNumber(node, stream);
        } else if (node.isName()) {
            writeName(node, stream);
        } else if (node.isConstant()) {
            writeEmptyElement(node.getType().elementName(), node, stream);
        } else if (node.isOperator()) {
            writeOperator(node, stream);
        } else if (node.isLambda()) {
            writeLambda(node, stream);
        } else if (node.isPiecewise()) {
            writePiecewise(node, stream);
        } else if (node.getType() == NodeType.EXTENSION && symbols.isNodeTag(node.getExtension())) {
            writeContainer(node, stream);
        } else if (!node.isUnknown()) {
            writeFunction(node, stream);
        }
    }

    private void writeSemantics(AstNode node, XmlOutputStream stream) throws XMLStreamException {
        stream.startElement("semantics");
        writeAttributes(node, stream);
        if (node.getDefinitionUrl() != null) {
            stream.writeAttribute("definitionURL", node.getDefinitionUrl());
        }
        writeContent(node, stream);
        for (XmlNode annotation : node.getSemanticsAnnotations()) {
            stream.writeNode(annotation);
        }
        stream.endElement();
    }

    private static void writeAttributes(AstNode node, XmlOutputStream stream) throws XMLStreamException {
        if (node.isSetId()) {
            stream.writeAttribute("id", node.getId());
        }
        if (node.isSetClassName()) {
            stream.writeAttribute("class", node.getClassName());
        }
        if (node.isSetStyle()) {
            stream.writeAttribute("style", node.getStyle());
        }
    }

    private static void writeEmptyElement(String name, AstNode node, XmlOutputStream stream)
        throws XMLStreamException {
        stream.startElement(name);
        writeAttributes(node, stream);
        stream.endElement();
    }

    // ============================================================
    // Numbers
    // ============================================================

    private void writeNumber(AstNode node, XmlOutputStream stream) throws XMLStreamException {
        if (node.isNaN()) {
            writeEmptyElement("notanumber", node, stream);
            return;
        }
        if (node.getType() != NodeType.REAL_E && node.isInfinity()) {
            writeEmptyElement("infinity", node, stream);
            return;
        }
        if (node.isNegInfinity()) {
            stream.startElement("apply");
            stream.setAutoIndent(false);
            stream.writeText(" ");
            stream.emptyElement("minus");
            stream.writeText(" ");
            writeEmptyElement("infinity", node, stream);
            stream.writeText(" ");
            stream.endElement();
            stream.setAutoIndent(true);
            return;
        }

        stream.startElement("cn");
        writeAttributes(node, stream);
        // units only exist from Level 3 on
        if (node.isSetUnits() && (namespaces == null || namespaces.level() == 3)) {
            stream.writeAttribute("sbml", "units", node.getUnits());
        }
        stream.setAutoIndent(false);

        switch (node.getType()) {
            case INTEGER -> {
                stream.writeAttribute("type", "integer");
                stream.writeText(" " + node.getInteger() + " ");
            }
            case RATIONAL -> {
                stream.writeAttribute("type", "rational");
                stream.writeText(" " + node.getNumerator() + " ");
                stream.emptyElement("sep");
                stream.writeText(" " + node.getDenominator() + " ");
            }
            case REAL_E -> writeENotation(node.getMantissa(), node.getExponent(), stream);
            default -> writeDouble(node.getReal(), stream);
        }

        stream.endElement();
        stream.setAutoIndent(true);
    }

    // a double whose rendering needs an exponent goes out as e-notation
    private static void writeDouble(double value, XmlOutputStream stream) throws XMLStreamException {
        String text = DoubleFormat.format(value);
        int position = text.indexOf('e');
        if (position < 0) {
            stream.writeText(" " + text + " ");
            return;
        }
        double mantissa = Double.parseDouble(text.substring(0, position));
        long exponent = Long.parseLong(stripPlus(text.substring(position + 1)));
        writeENotation(mantissa, exponent, stream);
    }

    /**
     * Writes {@code mantissa <sep/> exponent}; an exponent that the mantissa's own
     * rendering needs is folded into {@code exponent}.
     */
    private static void writeENotation(double mantissa, long exponent, XmlOutputStream stream)
        throws XMLStreamException {
        String text = DoubleFormat.format(mantissa);
        int position = text.indexOf('e');
        if (position >= 0) {
            exponent += Long.parseLong(stripPlus(text.substring(position + 1)));
            text = text.substring(0, position);
        }
        stream.writeAttribute("type", "e-notation");
        stream.writeText(" " + text + " ");
        stream.emptyElement("sep");
        stream.writeText(" " + exponent + " ");
    }

    private static String stripPlus(String exponent) {
        return exponent.startsWith("+") ? exponent.substring(1) : exponent;
    }

    // ============================================================
    // Names and c-symbols
    // ============================================================

    private void writeName(AstNode node, XmlOutputStream stream) throws XMLStreamException {
        NodeType type = node.getType();
        if (type == NodeType.NAME || type == NodeType.FUNCTION) {
            stream.startElement("ci");
            stream.setAutoIndent(false);
            writeAttributes(node, stream);
            if (node.getDefinitionUrl() != null) {
                stream.writeAttribute("definitionURL", node.getDefinitionUrl());
            }
            if (node.getName() != null) {
                stream.writeText(" " + node.getName() + " ");
            }
            stream.endElement();
            stream.setAutoIndent(true);
        } else {
            writeCsymbol(node, stream);
        }
    }

    private void writeCsymbol(AstNode node, XmlOutputStream stream) throws XMLStreamException {
        String url = DefinitionUrlRegistry.urlFor(node.getType());
        if (url == null && node.getExtension() != null) {
            url = symbols.csymbolUrl(node.getExtension());
            if (url == null) {
                url = node.getExtension().csymbolUrl();
            }
        }
        if (url == null) {
            url = node.getDefinitionUrl() != null ? node.getDefinitionUrl() : "";
        }

        stream.startElement("csymbol");
        stream.setAutoIndent(false);
        writeAttributes(node, stream);
        stream.writeAttribute("encoding", "text");
        stream.writeAttribute("definitionURL", url);
        if (node.getName() != null) {
            stream.writeText(" " + node.getName() + " ");
        }
        stream.endElement();
        stream.setAutoIndent(true);
    }

    // ============================================================
    // Operators, functions, lambda, piecewise
    // ============================================================

    private void writeOperator(AstNode node, XmlOutputStream stream) throws XMLStreamException {
        stream.startElement("apply");
        writeEmptyElement(node.getType().elementName(), node, stream);
        writeOperatorArgs(node, stream);
        stream.endElement();
    }

    /**
     * Binary {@code plus} and {@code times} chains are unrolled into one n-ary element;
     * a node that already has more than two operands is written as it is.
     */
    private void writeOperatorArgs(AstNode node, XmlOutputStream stream) throws XMLStreamException {
        NodeType type = node.getType();
        boolean nary = type == NodeType.PLUS || type == NodeType.TIMES;
        if (nary && node.getNumChildren() <= 2) {
            for (AstNode child : node.getChildren()) {
                if (child.getType() == type && !child.getSemanticsFlag()) {
                    writeOperatorArgs(child, stream);
                } else {
                    writeNode(child, stream);
                }
            }
            return;
        }
        for (AstNode child : node.getChildren()) {
            writeNode(child, stream);
        }
    }

    private void writeFunction(AstNode node, XmlOutputStream stream) throws XMLStreamException {
        stream.startElement("apply");

        NodeType type = node.getType();
        switch (type) {
            case FUNCTION -> writeName(node, stream);
            case FUNCTION_DELAY, CSYMBOL_FUNCTION -> writeCsymbol(node, stream);
            case EXTENSION -> {
                ExtensionSymbol symbol = node.getExtension();
                if (symbol.isCsymbol()) {
                    writeCsymbol(node, stream);
                } else {
                    writeEmptyElement(elementNameOf(symbol), node, stream);
                }
            }
            default -> writeEmptyElement(type.elementName(), node, stream);
        }

        if (type == NodeType.FUNCTION_LOG) {
            writeWithFirstArgumentIn("logbase", node, stream);
        } else if (type == NodeType.FUNCTION_ROOT) {
            writeWithFirstArgumentIn("degree", node, stream);
        } else {
            for (AstNode child : node.getChildren()) {
                writeNode(child, stream);
            }
        }

        stream.endElement();
    }

    private void writeWithFirstArgumentIn(String wrapper, AstNode node, XmlOutputStream stream)
        throws XMLStreamException {
        int count = node.getNumChildren();
        if (count == 1) {
            writeNode(node.getChild(0), stream);
            return;
        }
        for (int i = 0; i < count; i++) {
            if (i == 0) {
                stream.startElement(wrapper);
                writeNode(node.getChild(0), stream);
                stream.endElement();
            } else {
                writeNode(node.getChild(i), stream);
            }
        }
    }

    /**
     * All children but the last are bound variables. When the last child is itself
     * marked as a bound variable the lambda has no body and none is written.
     */
    private void writeLambda(AstNode node, XmlOutputStream stream) throws XMLStreamException {
        stream.startElement("lambda");
        writeAttributes(node, stream);

        int count = node.getNumChildren();
        if (count > 0) {
            boolean bodyPresent = !node.getChild(count - 1).isBvar();
            int bvars = bodyPresent ? count - 1 : count;
            for (int i = 0; i < bvars; i++) {
                stream.startElement("bvar");
                writeNode(node.getChild(i), stream);
                stream.endElement();
            }
            if (bodyPresent) {
                writeNode(node.getChild(count - 1), stream);
            }
        }

        stream.endElement();
    }

    private void writePiecewise(AstNode node, XmlOutputStream stream) throws XMLStreamException {
        int count = node.getNumChildren();
        // an odd child count means the last one is the otherwise value
        int pieces = count % 2 != 0 ? count - 1 : count;

        stream.startElement("piecewise");
        writeAttributes(node, stream);
        for (int i = 0; i < pieces; i += 2) {
            stream.startElement("piece");
            writeNode(node.getChild(i), stream);
            writeNode(node.getChild(i + 1), stream);
            stream.endElement();
        }
        if (pieces < count) {
            stream.startElement("otherwise");
            writeNode(node.getChild(pieces), stream);
            stream.endElement();
        }
        stream.endElement();
    }

    private void writeContainer(AstNode node, XmlOutputStream stream) throws XMLStreamException {
        stream.startElement(elementNameOf(node.getExtension()));
        writeAttributes(node, stream);
        for (AstNode child : node.getChildren()) {
            writeNode(child, stream);
        }
        stream.endElement();
    }

    private String elementNameOf(ExtensionSymbol symbol) {
        String name = symbols.elementName(symbol);
        return name != null ? name : symbol.elementName();
    }
}
