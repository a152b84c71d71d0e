package com.jmathml;

import com.jmathml.ast.AstNode;
import com.jmathml.diagnostics.ErrorCode;
import com.jmathml.diagnostics.ErrorLog;
import com.jmathml.reader.MathMLReader;
import com.jmathml.symbols.NamespaceContext;
import com.jmathml.writer.MathMLWriter;
import com.jmathml.xml.XmlInputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * String entry points for reading and writing MathML.
 *
 * <p>{@code parse} is all-or-nothing: it returns null when reading logged any error
 * other than a wrong {@code piece}/{@code otherwise} child count. Use
 * {@link #read(String, MathMLContext, ErrorLog)} to get the best-effort tree together
 * with the diagnostics.
 */
public final class MathML {
    private static final Logger log = LoggerFactory.getLogger(MathML.class);

    private static final String XML_DECLARATION_START = "<?xml version=";
    private static final String XML_DECLARATION = "<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n";

    private MathML() {
    }

    public static AstNode parse(String xml) {
        return parse(xml, MathMLContext.unversioned());
    }

    public static AstNode parse(String xml, NamespaceContext namespaces) {
        return parse(xml, MathMLContext.of(namespaces));
    }

    public static AstNode parse(String xml, MathMLContext context) {
        if (xml == null) {
            return null;
        }
        ErrorLog errors = new ErrorLog();
        AstNode node = read(xml, context, errors);
        if (errors.containsOtherThan(ErrorCode.OPS_NEED_CORRECT_NUMBER_OF_ARGS)) {
            log.debug("Discarding parsed MathML: {} diagnostic(s), first {}", errors.size(), errors.get(0));
            return null;
        }
        return node;
    }

    /**
     * Reads {@code xml} and returns whatever tree could be built; every problem found
     * is appended to {@code errors}.
     */
    public static AstNode read(String xml, MathMLContext context, ErrorLog errors) {
        try (XmlInputStream stream = new XmlInputStream(withDeclaration(xml), context, errors)) {
            return new MathMLReader(stream).read();
        }
    }

    public static String serialize(AstNode node) {
        return serialize(node, MathMLContext.unversioned());
    }

    public static String serialize(AstNode node, NamespaceContext namespaces) {
        return serialize(node, MathMLContext.of(namespaces));
    }

    public static String serialize(AstNode node, MathMLContext context) {
        if (node == null) {
            return "";
        }
        return new MathMLWriter(context).toXml(node);
    }

    private static String withDeclaration(String xml) {
        return xml.startsWith(XML_DECLARATION_START) ? xml : XML_DECLARATION + xml;
    }
}
