package io.planbridge.core.markup;

import io.planbridge.core.markup.MarkupSyntaxException.Reason;
import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import javax.xml.XMLConstants;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.parsers.SAXParser;
import javax.xml.parsers.SAXParserFactory;
import org.xml.sax.Attributes;
import org.xml.sax.InputSource;
import org.xml.sax.Locator;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;
import org.xml.sax.helpers.DefaultHandler;

/// Strict parser from markup text to a forest of {@link MarkupNode}s, built on the JDK's SAX
/// parser.
///
/// The input is wrapped in a synthetic document element so that several top-level elements
/// are accepted; the caller decides which one to use. A leading XML declaration and DOCTYPE are
/// blanked out before wrapping, with line and column positions preserved. DOCTYPE declarations
/// anywhere else, and with them external entities, are rejected.
///
/// The synthetic closing tag starts on a line of its own after the input. Any error the
/// parser reports on that line means the input stopped early and fails with
/// {@link Reason#END_OF_INPUT}, located at the end of the input; that is the signal for
/// truncation recovery. Every other error fails with {@link Reason#MALFORMED} and the parser's
/// own message and location.
///
/// ### Contracts
/// - **Postcondition**: a successful build returns at least one top-level element
/// - **Invariant**: line numbers refer to the caller's text, not the wrapped document
///
/// Thread-safe; every call gets its own parser.
public final class MarkupTreeBuilder {

    private static final String DOCUMENT = "planbridge-document";
    private static final String OPEN_DOCUMENT = "<" + DOCUMENT + ">\n";
    private static final String CLOSE_DOCUMENT = "\n</" + DOCUMENT + ">";

    private static final Pattern PROLOG =
            Pattern.compile(
                    "\\A\\s*(?:<\\?xml\\s.*?\\?>\\s*)?(?:<!DOCTYPE\\s[^\\[>]*(?:\\[.*?])?\\s*>)?",
                    Pattern.DOTALL);

    private final SAXParserFactory factory;

    public MarkupTreeBuilder() {
        factory = SAXParserFactory.newInstance();
        factory.setNamespaceAware(false);
        factory.setValidating(false);
        try {
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
            factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
        } catch (ParserConfigurationException | SAXException e) {
            throw new IllegalStateException("XML parser does not support secure processing", e);
        }
    }

    /// Parses the markup.
    ///
    /// @param text markup, not null
    /// @return top-level elements in document order, never empty
    /// @throws MarkupSyntaxException if the markup is incomplete or malformed
    public List<MarkupNode> build(String text) throws MarkupSyntaxException {
        Objects.requireNonNull(text, "text must not be null");
        TreeHandler handler = new TreeHandler();
        String document = OPEN_DOCUMENT + blankProlog(text) + CLOSE_DOCUMENT;
        try {
            newParser().parse(new InputSource(new StringReader(document)), handler);
        } catch (SAXParseException e) {
            throw translate(e, text);
        } catch (SAXException e) {
            throw new MarkupSyntaxException(
                    Reason.MALFORMED, String.valueOf(e.getMessage()), 1, 1);
        } catch (IOException e) {
            throw new IllegalStateException("Reading in-memory markup failed", e);
        }
        if (handler.roots.isEmpty()) {
            throw endOfInput(text);
        }
        return List.copyOf(handler.roots);
    }

    private SAXParser newParser() {
        synchronized (factory) {
            try {
                return factory.newSAXParser();
            } catch (ParserConfigurationException | SAXException e) {
                throw new IllegalStateException("Cannot create XML parser", e);
            }
        }
    }

    private static MarkupSyntaxException translate(SAXParseException e, String text) {
        // the synthetic start tag occupies line 1 of the wrapped document
        int line = e.getLineNumber() - 1;
        if (line > MarkupTokens.lineAt(text, text.length())) {
            return endOfInput(text);
        }
        return new MarkupSyntaxException(
                Reason.MALFORMED, describe(e), Math.max(line, 1), Math.max(e.getColumnNumber(), 1));
    }

    private static String describe(SAXParseException e) {
        String message = e.getMessage();
        if (message == null || message.isBlank()) {
            return "not well-formed";
        }
        return message.strip().replace("\"" + DOCUMENT + "\"", "document");
    }

    private static MarkupSyntaxException endOfInput(String text) {
        int lineStart = text.lastIndexOf('\n') + 1;
        return new MarkupSyntaxException(
                Reason.END_OF_INPUT,
                "no element found",
                MarkupTokens.lineAt(text, text.length()),
                text.length() - lineStart + 1);
    }

    /// Replaces a leading XML declaration and DOCTYPE with spaces, keeping line breaks.
    static String blankProlog(String text) {
        Matcher prolog = PROLOG.matcher(text);
        if (!prolog.lookingAt() || prolog.end() == 0) {
            return text;
        }
        StringBuilder out = new StringBuilder(text.length());
        for (int i = 0; i < prolog.end(); i++) {
            char c = text.charAt(i);
            out.append(c == '\n' || c == '\r' ? c : ' ');
        }
        return out.append(text, prolog.end(), text.length()).toString();
    }

    /// Builds the node forest below the synthetic document element.
    private static final class TreeHandler extends DefaultHandler {
        private final Deque<NodeBuilder> open = new ArrayDeque<>();
        private final List<MarkupNode> roots = new ArrayList<>();
        private Locator locator;
        private int depth;

        @Override
        public void setDocumentLocator(Locator locator) {
            this.locator = locator;
        }

        @Override
        public void startElement(String uri, String localName, String qName, Attributes attributes) {
            if (depth++ == 0) {
                return;
            }
            int line = locator != null ? Math.max(locator.getLineNumber() - 1, 1) : 1;
            NodeBuilder node = new NodeBuilder(qName, line);
            for (int i = 0; i < attributes.getLength(); i++) {
                node.attributes.put(attributes.getQName(i), attributes.getValue(i));
            }
            open.push(node);
        }

        @Override
        public void endElement(String uri, String localName, String qName) {
            if (--depth == 0) {
                return;
            }
            MarkupNode node = open.pop().build();
            if (open.isEmpty()) {
                roots.add(node);
            } else {
                open.peek().children.add(node);
            }
        }

        @Override
        public void characters(char[] ch, int start, int length) {
            if (!open.isEmpty()) {
                open.peek().text.append(ch, start, length);
            }
        }
    }

    private static final class NodeBuilder {
        final String name;
        final int line;
        final Map<String, String> attributes = new LinkedHashMap<>();
        final List<MarkupNode> children = new ArrayList<>();
        final StringBuilder text = new StringBuilder();

        NodeBuilder(String name, int line) {
            this.name = name;
            this.line = line;
        }

        MarkupNode build() {
            return new MarkupNode(name, attributes, children, text.toString(), line);
        }
    }
}
