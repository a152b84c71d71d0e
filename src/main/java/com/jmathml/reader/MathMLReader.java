package com.jmathml.reader;

import com.jmathml.MathMLContext;
import com.jmathml.ast.AstNode;
import com.jmathml.ast.ExtensionSymbol;
import com.jmathml.ast.NodeType;
import com.jmathml.diagnostics.ErrorCode;
import com.jmathml.diagnostics.ErrorLog;
import com.jmathml.symbols.DefinitionUrlRegistry;
import com.jmathml.symbols.NamespaceContext;
import com.jmathml.symbols.SymbolTable;
import com.jmathml.xml.XmlInputStream;
import com.jmathml.xml.XmlNode;
import com.jmathml.xml.XmlToken;
import org.eclipse.collections.api.set.ImmutableSet;
import org.eclipse.collections.impl.factory.Sets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Recursive-descent reader from a MathML token stream to an {@link AstNode} tree.
 *
 * <p>Problems in the input are posted to the stream's {@link ErrorLog} and reading
 * carries on; the returned tree is the most complete one that could be built.
 */
public class MathMLReader {
    private static final Logger log = LoggerFactory.getLogger(MathMLReader.class);

    // elements that can never be the operator of an apply
    private static final ImmutableSet<String> NOT_OPERATORS = Sets.immutable.of(
        "bvar", "piece", "otherwise", "logbase", "degree", "lambda", "semantics");

    private final XmlInputStream stream;
    private final String requiredPrefix;
    private final MathMLContext context;
    private final SymbolTable symbols;
    private final NamespaceContext namespaces;
    private final int level;
    private final int version;
    private int depth;

    public MathMLReader(XmlInputStream stream) {
        this(stream, "");
    }

    /**
     * @param requiredPrefix namespace prefix every MathML element must carry, or empty
     *                       when elements are unprefixed
     */
    public MathMLReader(XmlInputStream stream, String requiredPrefix) {
        this.stream = stream;
        this.requiredPrefix = requiredPrefix == null ? "" : requiredPrefix;
        this.context = stream.context();
        this.symbols = context.symbols();
        this.namespaces = context.namespaces();
        this.level = context.level();
        this.version = context.version();
    }

    public static AstNode read(XmlInputStream stream, String requiredPrefix) {
        return new MathMLReader(stream, requiredPrefix).read();
    }

    /**
     * Reads a {@code math} element, or a single content element when the stream is
     * not positioned on {@code math}.
     */
    public AstNode read() {
        int errorsBefore = stream.errorLog().size();
        AstNode node = readTopLevel();
        log.debug("Read {} with {} new diagnostic(s)", node.getType(), stream.errorLog().size() - errorsBefore);
        return node;
    }

    private AstNode readTopLevel() {
        stream.skipText();
        AstNode node = new AstNode();
        XmlToken head = stream.peek();
        checkPrefix(head);

        if (!head.name().equals("math") || !head.isStart()) {
            readNode(node);
            return node;
        }

        XmlToken math = stream.next();
        if (math.isEnd()) {
            return node;
        }

        stream.skipText();
        XmlToken first = stream.peek();
        if (first.isEndFor(math)) {
            stream.next();
            return node;
        }
        checkPrefix(first);
        String firstName = canonical(first.name());
        if (symbols.isNodeTag(firstName) || firstName.equals("lambda")) {
            readNode(node);
        } else {
            logError(first, ErrorCode.BAD_MATHML_NODE_TYPE,
                "<" + first.name() + "> cannot be used directly following a <math> tag.");
        }

        // a legitimate read may still be followed by something other than </math>
        stream.skipText();
        XmlToken after = stream.peek();
        if (stream.isGood() && !after.isEndFor(math) && !stream.errorLog().contains(ErrorCode.BAD_MATHML)) {
            logError(math, ErrorCode.INVALID_MATH_ELEMENT, "Unexpected element encountered. The element <"
                + after.name() + "> should not be encountered here.");
        }
        stream.skipPastEnd(math);
        return node;
    }

    // ============================================================
    // Element dispatch
    // ============================================================

    private void readNode(AstNode node) {
        stream.skipText();
        XmlToken peeked = stream.peek();
        if (!stream.isGood()) {
            return;
        }
        if (peeked.isEnd() && !peeked.isStart()) {
            // nothing left to read at this level
            if (peeked.name().equals("math")) {
                checkPrefix(peeked);
            }
            return;
        }

        XmlToken element = stream.next();
        if (depth >= context.maxDepth()) {
            logError(element, ErrorCode.MATH_NESTING_TOO_DEEP,
                "Elements nested more than " + context.maxDepth() + " levels deep are not read.");
            stream.skipPastEnd(element);
            return;
        }
        depth++;
        try {
            readElement(node, element);
        } finally {
            depth--;
        }
    }

    private void readElement(AstNode node, XmlToken element) {
        // core names match ignoring case; dispatch on their canonical spelling
        String name = canonical(element.name());

        NodeType coreType = SymbolTable.lookup(name);
        ExtensionSymbol extension = null;
        if (coreType == null) {
            if (level > 2) {
                extension = symbols.resolveExtensionTag(name, namespaces);
            }
            if (extension == null) {
                logError(element, ErrorCode.DISALLOWED_MATHML_SYMBOL,
                    "<" + name + "> is not valid in SBML Level " + level + " Version " + version + ".");
            }
        }

        checkPrefix(element);
        readAttributes(node, element, name);

        switch (name) {
            case "apply", "lambda", "piecewise" -> {
                if (!readContainer(node, element, name, null)) {
                    return;
                }
            }
            case "bvar" -> {
                node.setBvar(true);
                if (!element.isEnd()) {
                    readNode(node);
                }
            }
            case "degree", "logbase", "otherwise" -> {
                if (!element.isEnd()) {
                    readNode(node);
                }
            }
            case "piece" -> {
                // </piece> is consumed by the piecewise loop, which counts the children
                if (!element.isEnd()) {
                    readNode(node);
                }
                return;
            }
            case "semantics" -> readSemantics(node, element);
            default -> {
                if (extension != null && extension.nodeTag()) {
                    readContainer(node, element, name, extension);
                } else {
                    readLeaf(node, element, name, coreType, extension);
                }
            }
        }

        addDefaultArguments(node);

        if (name.equals("otherwise")) {
            while (stream.peek().isText()) {
                stream.next();
            }
            if (!stream.peek().isEndFor(element)) {
                logError(element, ErrorCode.OPS_NEED_CORRECT_NUMBER_OF_ARGS,
                    "The <otherwise> element should have one child element.");
            }
        }

        stream.skipPastEnd(element);
    }

    // ============================================================
    // apply, lambda, piecewise and extension containers
    // ============================================================

    /**
     * @return false when the element was rejected and already skipped
     */
    private boolean readContainer(AstNode node, XmlToken element, String name, ExtensionSymbol extension) {
        if (name.equals("apply")) {
            if (element.isEnd()) {
                // <apply/>
                return true;
            }
            stream.skipText();
            String operatorName = canonical(stream.peek().name());
            if (NOT_OPERATORS.contains(operatorName)) {
                logError(element, ErrorCode.BAD_MATHML, "<" + operatorName
                    + "> is not an operator and cannot be used directly following an <apply> tag.");
            }

            readNode(node);
            if (node.getType() == NodeType.NAME) {
                node.setType(NodeType.FUNCTION);
            }

            String rejected = rejectedOperator(node);
            if (rejected != null) {
                logError(element, ErrorCode.BAD_MATHML, rejected);
                stream.skipPastEnd(element);
                return false;
            }
        } else if (name.equals("lambda")) {
            node.setType(NodeType.LAMBDA);
        } else if (name.equals("piecewise")) {
            node.setType(NodeType.FUNCTION_PIECEWISE);
        } else {
            node.setExtension(extension);
        }

        if (!element.isEnd()) {
            readChildren(node, element);
        }
        return true;
    }

    private static String rejectedOperator(AstNode node) {
        if (node.isNumber()) {
            return "A number is not an operator and cannot be used directly following an <apply> tag.";
        }
        return switch (node.getType()) {
            case CONSTANT_TRUE, CONSTANT_FALSE, CONSTANT_PI, CONSTANT_E -> "<" + node.getType().elementName()
                + "> is not an operator and cannot be used directly following an <apply> tag.";
            case FUNCTION_PIECEWISE ->
                "A <piecewise> element is not an operator and cannot be used directly following an <apply> tag.";
            default -> null;
        };
    }

    private void readChildren(AstNode node, XmlToken element) {
        while (stream.isGood() && !stream.peek().isEndFor(element)) {
            stream.skipText();
            XmlToken peeked = stream.peek();
            if (!stream.isGood() || peeked.isEndFor(element)) {
                continue;
            }
            if (peeked.isEnd() && !peeked.isStart()) {
                if (peeked.name().equals("math")) {
                    break;
                }
                // end tag of something never opened here
                stream.next();
                continue;
            }

            if (peeked.isStart() && peeked.isEnd() && canonical(peeked.name()).equals("piece")) {
                logError(peeked, ErrorCode.OPS_NEED_CORRECT_NUMBER_OF_ARGS,
                    "The <piece> element should have two child elements.");
                stream.next();
                continue;
            }

            if (node.getType() == NodeType.PLUS || node.getType() == NodeType.TIMES) {
                reduceBinary(node);
            }

            AstNode child = new AstNode();
            boolean keep = true;
            if (peeked.name().equals("math") && peeked.isStart()) {
                logError(element, ErrorCode.BAD_MATHML_NODE_TYPE, "<math> incorrectly used.");
                keep = false;
            }
            readNode(child);

            stream.skipText();
            XmlToken following = stream.peek();
            String nextName = canonical(following.name());
            if (node.isLambda() && !following.isEof()
                && !nextName.equals("lambda") && !nextName.equals("bvar")
                && !symbols.isNodeTag(nextName)) {
                logError(element, ErrorCode.BAD_MATHML_NODE_TYPE,
                    "<" + nextName + "> cannot be used directly following a <bvar> element.");
            }

            if (nextName.equals("math") && following.isEnd() && !following.isStart()) {
                // ran into the end of the document element
                break;
            }
            if (keep) {
                node.addChild(child);
            }

            if (nextName.equals("piece") && following.isEnd() && !following.isStart()) {
                if (node.getNumChildren() % 2 != 0) {
                    logError(element, ErrorCode.OPS_NEED_CORRECT_NUMBER_OF_ARGS,
                        "The <piece> element should have two child elements.");
                }
                stream.next();
            }
        }
    }

    /**
     * Folds an n-ary {@code plus} or {@code times} into nested binary nodes: once two
     * operands are held they move into a new node of the same type, which becomes the
     * first operand.
     */
    private static void reduceBinary(AstNode node) {
        if (node.getNumChildren() == 2) {
            AstNode op = new AstNode(node.getType());
            node.swapChildren(op);
            node.prependChild(op);
        }
    }

    // log(x) means log(10, x) and root(x) means root(2, x)
    private static void addDefaultArguments(AstNode node) {
        if (node.getNumChildren() != 1) {
            return;
        }
        if (node.getType() == NodeType.FUNCTION_LOG) {
            node.prependChild(dimensionless(10));
        } else if (node.getType() == NodeType.FUNCTION_ROOT) {
            node.prependChild(dimensionless(2));
        }
    }

    private static AstNode dimensionless(int value) {
        AstNode child = AstNode.integer(value);
        child.setUnits("dimensionless");
        return child;
    }

    // ============================================================
    // semantics
    // ============================================================

    private void readSemantics(AstNode node, XmlToken element) {
        if (element.isEnd()) {
            return;
        }
        String url = element.attribute("definitionURL");
        readNode(node);
        node.setSemanticsFlag(true);
        if (url != null) {
            node.setDefinitionUrl(url);
        }

        stream.skipText();
        while (stream.isGood() && !stream.peek().isEndFor(element)) {
            XmlToken token = stream.peek();
            if (token.isStart() && symbols.isNodeTag(token.name())) {
                logError(token, ErrorCode.INVALID_MATH_ELEMENT, "Unexpected element encountered. The element <"
                    + token.name() + "> should not be encountered here.");
                stream.skipPastEnd(stream.next());
                continue;
            }
            if (token.isStart() && (token.name().equals("annotation") || token.name().equals("annotation-xml"))) {
                node.addSemanticsAnnotation(XmlNode.read(stream));
            } else {
                stream.next();
            }
        }
    }

    // ============================================================
    // Leaves: ci, csymbol, cn and the rest
    // ============================================================

    private void readLeaf(AstNode node, XmlToken element, String name, NodeType coreType,
                          ExtensionSymbol extension) {
        switch (name) {
            case "ci", "csymbol" -> readSymbol(node, element, name.equals("csymbol"));
            case "cn" -> readNumber(node, element);
            case "notanumber" -> node.setValue(Double.NaN);
            case "infinity" -> node.setValue(Double.POSITIVE_INFINITY);
            default -> {
                if (coreType != null) {
                    node.setType(coreType);
                } else if (extension != null) {
                    node.setExtension(extension);
                }
            }
        }
    }

    private void readSymbol(AstNode node, XmlToken element, boolean csymbol) {
        String url = element.attribute("definitionURL");
        DefinitionUrlRegistry.Definition definition = context.definitionUrls().lookup(url);

        if (csymbol) {
            if (namespaces == null && definition == null) {
                // plain MathML keeps csymbols nobody knows as generic functions
                node.setType(NodeType.CSYMBOL_FUNCTION);
                node.setDefinitionUrl(url);
            } else if (definition == null || !SymbolTable.isValidCsymbol(namespaces, definition.type())) {
                logError(element, ErrorCode.BAD_CSYMBOL_DEFINITION_URL_VALUE,
                    url == null ? "" : "The URL '" + url + "' is not recognised here.");
            } else {
                applyDefinition(node, definition, url);
            }
        } else if (url != null) {
            // a ci naming a known symbol becomes that symbol
            if (definition != null && SymbolTable.isValidCsymbol(namespaces, definition.type())) {
                applyDefinition(node, definition, url);
            } else {
                node.setDefinitionUrl(url);
            }
        }

        node.setName(trim(readText(element)));
        if (node.isUnknown()) {
            node.setType(NodeType.NAME);
        }
    }

    private static void applyDefinition(AstNode node, DefinitionUrlRegistry.Definition definition, String url) {
        if (definition.extension() != null) {
            node.setExtension(definition.extension());
            node.setDefinitionUrl(url);
        } else {
            node.setType(definition.type());
        }
    }

    private void readNumber(AstNode node, XmlToken element) {
        String type = element.attribute("type");
        if (type == null) {
            type = "real";
        }

        String units = element.attribute("units");
        if (!SyntaxChecker.isValidUnitSId(units)) {
            logError(element, ErrorCode.INVALID_UNIT_ID_SYNTAX,
                "The units attribute '" + units + "' does not conform to the syntax.");
        }

        switch (type) {
            case "real" -> {
                NumericText.Scanned<Double> value = NumericText.scanDouble(readText(element));
                node.setValue(value.value());
                if (!value.ok() || node.isInfinity() || node.isNegInfinity()) {
                    logError(element, ErrorCode.FAILED_MATHML_READ_OF_DOUBLE, "");
                }
            }
            case "integer" -> {
                NumericText.Scanned<Integer> value = NumericText.scanInt(readText(element));
                if (!value.ok()) {
                    logError(element, ErrorCode.FAILED_MATHML_READ_OF_INTEGER, "");
                }
                node.setValue(value.value().intValue());
            }
            case "e-notation" -> {
                NumericText.Scanned<Double> mantissa = NumericText.scanDouble(readText(element));
                NumericText.Scanned<Integer> exponent = new NumericText.Scanned<>(0, true);
                if (readSeparator(element)) {
                    exponent = NumericText.scanInt(readText(element));
                }
                node.setValue(mantissa.value(), exponent.value());
                if (!mantissa.ok() || !exponent.ok() || node.isInfinity() || node.isNegInfinity()) {
                    logError(element, ErrorCode.FAILED_MATHML_READ_OF_EXPONENTIAL, "");
                }
            }
            case "rational" -> {
                NumericText.Scanned<Integer> numerator = NumericText.scanInt(readText(element));
                NumericText.Scanned<Integer> denominator = new NumericText.Scanned<>(1, true);
                if (readSeparator(element)) {
                    denominator = NumericText.scanInt(readText(element));
                }
                if (!numerator.ok() || !denominator.ok()) {
                    logError(element, ErrorCode.FAILED_MATHML_READ_OF_RATIONAL, "");
                }
                node.setValue(numerator.value().intValue(), denominator.value().intValue());
            }
            default -> logError(element, ErrorCode.DISALLOWED_MATH_TYPE_ATTRIBUTE_VALUE,
                "The type '" + type + "' is not a <cn> type.");
        }

        if (units != null && !units.isEmpty() && node.isNumber()) {
            node.setUnits(units);
        }
    }

    private String readText(XmlToken element) {
        if (element.isEnd() || !stream.peek().isText()) {
            return "";
        }
        return stream.next().characters();
    }

    private boolean readSeparator(XmlToken element) {
        if (element.isEnd() || !stream.peek().name().equals("sep") || !stream.peek().isStart()) {
            return false;
        }
        stream.skipPastEnd(stream.next());
        return true;
    }

    private static String canonical(String name) {
        String canonical = SymbolTable.canonicalName(name);
        return canonical != null ? canonical : name;
    }

    private static String trim(String s) {
        int begin = 0;
        int end = s.length();
        while (begin < end && isXmlSpace(s.charAt(begin))) {
            begin++;
        }
        while (end > begin && isXmlSpace(s.charAt(end - 1))) {
            end--;
        }
        return s.substring(begin, end);
    }

    private static boolean isXmlSpace(char c) {
        return c == ' ' || c == '\t' || c == '\r' || c == '\n';
    }

    // ============================================================
    // Attributes, prefixes and diagnostics
    // ============================================================

    private void readAttributes(AstNode node, XmlToken element, String name) {

        String id = element.attribute("id");
        if (isSet(id)) {
            node.setId(id);
        }
        String className = element.attribute("class");
        if (isSet(className)) {
            node.setClassName(className);
        }
        String style = element.attribute("style");
        if (isSet(style)) {
            node.setStyle(style);
        }

        if (isSet(element.attribute("type")) && !name.equals("cn")) {
            logError(element, ErrorCode.DISALLOWED_MATH_TYPE_ATTRIBUTE_USE, "");
        }
        if (isSet(element.attribute("encoding")) && !name.equals("csymbol")) {
            logError(element, ErrorCode.DISALLOWED_MATHML_ENCODING_USE, "");
        }

        if (isSet(element.attribute("definitionURL"))) {
            // ci may carry a definitionURL from Level 2 Version 5 on
            boolean ciAllowed = level > 2 || level == 2 && version == 5;
            boolean allowed = name.equals("csymbol") || name.equals("semantics")
                || ciAllowed && name.equals("ci");
            if (!allowed) {
                logError(element, ErrorCode.DISALLOWED_DEFINITION_URL_USE, "");
            }
        }

        if (isSet(element.attribute("units"))) {
            if (level > 2) {
                if (!name.equals("cn")) {
                    logError(element, ErrorCode.DISALLOWED_MATH_UNITS_USE, "");
                }
            } else {
                logError(element, ErrorCode.INVALID_MATHML_ATTRIBUTE, "");
            }
        }
    }

    private void checkPrefix(XmlToken token) {
        if (requiredPrefix.isEmpty() || token.isEof() || token.isText()) {
            return;
        }
        if (!token.prefix().equals(requiredPrefix)) {
            logError(token, ErrorCode.INVALID_MATH_ELEMENT,
                "Element <" + token.name() + "> should have prefix \"" + requiredPrefix + "\".");
        }
    }

    private static boolean isSet(String value) {
        return value != null && !value.isEmpty();
    }

    private void logError(XmlToken token, ErrorCode code, String detail) {
        stream.errorLog().logError(code, level, version, detail, token.line(), token.column());
    }
}
