package com.jmathml.xml;

import com.ctc.wstx.stax.WstxInputFactory;
import com.jmathml.MathMLContext;
import com.jmathml.diagnostics.ErrorCode;
import com.jmathml.diagnostics.ErrorLog;
import com.jmathml.symbols.NamespaceContext;
import org.codehaus.stax2.XMLInputFactory2;
import org.codehaus.stax2.XMLStreamLocation2;
import org.codehaus.stax2.XMLStreamReader2;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.xml.stream.Location;
import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import java.io.Reader;
import java.io.StringReader;

/**
 * Pull stream of {@link XmlToken}s with one token of lookahead. Malformed XML is
 * posted to the error log as {@link ErrorCode#BADLY_FORMED_XML} and ends the stream.
 */
public class XmlInputStream implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(XmlInputStream.class);

    private static final XMLInputFactory2 FACTORY = createFactory();

    private final MathMLContext context;
    private final ErrorLog errorLog;
    private final MutableList<XmlToken> pending = Lists.mutable.empty();
    private XMLStreamReader2 reader;
    private boolean error;
    private boolean exhausted;
    private int lastLine = 1;
    private int lastColumn = 1;

    public XmlInputStream(String content, MathMLContext context, ErrorLog errorLog) {
        this(new StringReader(content), context, errorLog);
    }

    public XmlInputStream(Reader content, MathMLContext context, ErrorLog errorLog) {
        this.context = context;
        this.errorLog = errorLog;
        try {
            this.reader = (XMLStreamReader2) FACTORY.createXMLStreamReader(content);
        } catch (XMLStreamException e) {
            fail(e);
        }
    }

    private static XMLInputFactory2 createFactory() {
        XMLInputFactory2 factory = new WstxInputFactory();
        factory.setProperty(XMLInputFactory.IS_NAMESPACE_AWARE, true);
        factory.setProperty(XMLInputFactory.IS_COALESCING, true);
        factory.setProperty(XMLInputFactory.SUPPORT_DTD, false);
        factory.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, false);
        return factory;
    }

    public MathMLContext context() {
        return context;
    }

    public NamespaceContext namespaces() {
        return context.namespaces();
    }

    public ErrorLog errorLog() {
        return errorLog;
    }

    public boolean isGood() {
        return !error && !peek().isEof();
    }

    public boolean isError() {
        return error;
    }

    public XmlToken peek() {
        fill();
        return pending.getFirst();
    }

    public XmlToken next() {
        fill();
        XmlToken token = pending.remove(0);
        if (token.isEof()) {
            // end of input stays visible to later calls
            pending.add(0, token);
        }
        return token;
    }

    public void skipText() {
        while (isGood() && peek().isText()) {
            next();
        }
    }

    /**
     * Consumes tokens up to and including the end tag of {@code element}, which must
     * already have been consumed. Nested elements of the same name are matched so the
     * right end tag is found.
     */
    public void skipPastEnd(XmlToken element) {
        if (element.isEnd()) {
            return;
        }
        int depth = 0;
        while (isGood()) {
            XmlToken token = next();
            if (token.isEndFor(element)) {
                if (depth == 0) {
                    return;
                }
                depth--;
            } else if (token.isStart() && !token.isEnd()
                && token.name().equals(element.name())
                && token.namespaceUri().equals(element.namespaceUri())) {
                depth++;
            }
        }
    }

    private void fill() {
        while (pending.isEmpty()) {
            if (exhausted || error || reader == null) {
                pending.add(XmlToken.eof(lastLine, lastColumn));
                return;
            }
            try {
                convert(reader.next());
            } catch (XMLStreamException e) {
                fail(e);
            }
        }
    }

    private void convert(int event) throws XMLStreamException {
        switch (event) {
            case XMLStreamConstants.START_ELEMENT -> {
                XmlToken start = startToken();
                // an element with no content at all becomes a single token
                int following = reader.next();
                if (following == XMLStreamConstants.END_ELEMENT) {
                    pending.add(start.asEmptyElement());
                } else {
                    pending.add(start);
                    convert(following);
                }
            }
            case XMLStreamConstants.END_ELEMENT -> {
                XMLStreamLocation2 location = reader.getLocationInfo().getStartLocation();
                remember(location);
                pending.add(XmlToken.endElement(reader.getLocalName(), nullToEmpty(reader.getPrefix()),
                    nullToEmpty(reader.getNamespaceURI()), location.getLineNumber(), location.getColumnNumber()));
            }
            case XMLStreamConstants.CHARACTERS, XMLStreamConstants.CDATA, XMLStreamConstants.SPACE -> {
                XMLStreamLocation2 location = reader.getLocationInfo().getStartLocation();
                remember(location);
                pending.add(XmlToken.text(reader.getText(), location.getLineNumber(), location.getColumnNumber()));
            }
            case XMLStreamConstants.END_DOCUMENT -> exhausted = true;
            default -> {
                // comments, processing instructions and the prolog carry no math
            }
        }
    }

    private XmlToken startToken() {
        XMLStreamLocation2 location = reader.getLocationInfo().getStartLocation();
        remember(location);

        var attributes = Lists.mutable.<XmlAttribute>empty();
        for (int i = 0; i < reader.getAttributeCount(); i++) {
            attributes.add(new XmlAttribute(reader.getAttributeLocalName(i),
                nullToEmpty(reader.getAttributePrefix(i)),
                nullToEmpty(reader.getAttributeNamespace(i)),
                reader.getAttributeValue(i)));
        }
        var namespaces = Lists.mutable.<XmlNamespace>empty();
        for (int i = 0; i < reader.getNamespaceCount(); i++) {
            namespaces.add(new XmlNamespace(nullToEmpty(reader.getNamespacePrefix(i)),
                nullToEmpty(reader.getNamespaceURI(i))));
        }
        return XmlToken.startElement(reader.getLocalName(), nullToEmpty(reader.getPrefix()),
            nullToEmpty(reader.getNamespaceURI()), attributes.toImmutable(), namespaces.toImmutable(),
            location.getLineNumber(), location.getColumnNumber());
    }

    private void remember(XMLStreamLocation2 location) {
        lastLine = location.getLineNumber();
        lastColumn = location.getColumnNumber();
    }

    private void fail(XMLStreamException e) {
        Location location = e.getLocation();
        int line = location != null ? location.getLineNumber() : lastLine;
        int column = location != null ? location.getColumnNumber() : lastColumn;
        log.debug("Malformed XML at line {}, column {}", line, column, e);
        errorLog.logError(ErrorCode.BADLY_FORMED_XML, levelOf(), versionOf(), e.getMessage(), line, column);
        error = true;
        lastLine = line;
        lastColumn = column;
    }

    private int levelOf() {
        NamespaceContext namespaces = namespaces();
        return namespaces != null ? namespaces.level() : NamespaceContext.L3V2.level();
    }

    private int versionOf() {
        NamespaceContext namespaces = namespaces();
        return namespaces != null ? namespaces.version() : NamespaceContext.L3V2.version();
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }

    @Override
    public void close() {
        if (reader == null) {
            return;
        }
        try {
            reader.closeCompletely();
        } catch (XMLStreamException e) {
            log.debug("Failed to close XML reader", e);
        }
    }
}
