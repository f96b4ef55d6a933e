package com.releasefeed.pipeline.parse;

import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.ErrorHandler;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Detects the feed format from the document structure and extracts raw entries. Never throws: bodies
 * that are not XML become {@link ParseResult.Malformed}, unknown documents {@link ParseResult.Unrecognized}.
 */
public final class FeedDocumentParser {
    private FeedDocumentParser() {
    }

    /** Parses an already decoded document; any encoding declaration in it is ignored. */
    public static ParseResult parse(String xml) {
        if (xml == null || xml.isBlank()) {
            return new ParseResult.Malformed("empty body");
        }
        return parse(new InputSource(new StringReader(xml.trim())));
    }

    /** Parses raw feed bytes; the byte-order mark or XML declaration decides the encoding, UTF-8 otherwise. */
    public static ParseResult parse(byte[] content) {
        if (content == null) {
            return new ParseResult.Malformed("empty body");
        }
        int start = leadingWhitespace(content);
        if (start == content.length) {
            return new ParseResult.Malformed("empty body");
        }
        return parse(new InputSource(new ByteArrayInputStream(content, start, content.length - start)));
    }

    private static ParseResult parse(InputSource source) {
        Document document;
        try {
            document = newDocumentBuilder().parse(source);
        } catch (SAXException | IOException e) {
            return new ParseResult.Malformed(e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser does not support secure processing features", e);
        }

        Element root = document.getDocumentElement();
        if (root == null) {
            return new ParseResult.Malformed("no root element");
        }
        String rootName = localName(root.getTagName());
        if ("rss".equals(rootName) || "rdf".equals(rootName) || firstChild(root, "channel").isPresent()) {
            return new ParseResult.RssItems(parseRss(document));
        }
        if ("feed".equals(rootName)) {
            return new ParseResult.AtomEntries(parseAtom(document));
        }
        return new ParseResult.Unrecognized(root.getTagName());
    }

    private static int leadingWhitespace(byte[] content) {
        int index = 0;
        while (index < content.length && (content[index] == ' ' || content[index] == '\t'
                || content[index] == '\r' || content[index] == '\n')) {
            index++;
        }
        return index;
    }

    private static DocumentBuilder newDocumentBuilder() throws ParserConfigurationException {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
        factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
        factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
        factory.setExpandEntityReferences(false);

        DocumentBuilder builder = factory.newDocumentBuilder();
        builder.setErrorHandler(new ErrorHandler() {
            @Override
            public void warning(SAXParseException exception) {
                // warnings do not affect the parsed document
            }

            @Override
            public void error(SAXParseException exception) throws SAXParseException {
                throw exception;
            }

            @Override
            public void fatalError(SAXParseException exception) throws SAXParseException {
                throw exception;
            }
        });
        return builder;
    }

    private static List<RawEntry> parseRss(Document document) {
        NodeList items = document.getElementsByTagName("item");
        List<RawEntry> entries = new ArrayList<>();
        for (int i = 0; i < items.getLength(); i++) {
            Node item = items.item(i);
            String link = childText(item, "link")
                    .or(() -> childText(item, "guid").filter(FeedDocumentParser::looksLikeUrl))
                    .orElse(null);
            String date = childText(item, "pubDate")
                    .or(() -> childText(item, "dc:date"))
                    .orElse(null);
            String description = childText(item, "description")
                    .or(() -> childText(item, "content:encoded"))
                    .orElse(null);
            entries.add(new RawEntry(
                    childText(item, "title").orElse(null),
                    link,
                    date,
                    description,
                    childText(item, "category").orElse(null)
            ));
        }
        return entries;
    }

    private static List<RawEntry> parseAtom(Document document) {
        NodeList items = document.getElementsByTagName("entry");
        List<RawEntry> entries = new ArrayList<>();
        for (int i = 0; i < items.getLength(); i++) {
            Node entry = items.item(i);
            String link = atomLink(entry)
                    .or(() -> childText(entry, "id").filter(FeedDocumentParser::looksLikeUrl))
                    .orElse(null);
            String date = childText(entry, "published")
                    .or(() -> childText(entry, "updated"))
                    .orElse(null);
            String summary = childText(entry, "summary")
                    .or(() -> childText(entry, "content"))
                    .orElse(null);
            String category = childAttribute(entry, "category", "term")
                    .or(() -> childAttribute(entry, "category", "label"))
                    .orElse(null);
            entries.add(new RawEntry(childText(entry, "title").orElse(null), link, date, summary, category));
        }
        return entries;
    }

    private static Optional<String> atomLink(Node entry) {
        if (!(entry instanceof Element element)) {
            return Optional.empty();
        }
        NodeList links = element.getElementsByTagName("link");
        String fallback = null;
        for (int i = 0; i < links.getLength(); i++) {
            if (!(links.item(i) instanceof Element link)) {
                continue;
            }
            String href = link.getAttribute("href").trim();
            if (href.isEmpty()) {
                continue;
            }
            String rel = link.getAttribute("rel").trim();
            if (rel.isEmpty() || "alternate".equals(rel)) {
                return Optional.of(href);
            }
            if (fallback == null) {
                fallback = href;
            }
        }
        return Optional.ofNullable(fallback);
    }

    private static Optional<Element> firstChild(Element parent, String name) {
        NodeList children = parent.getChildNodes();
        for (int i = 0; i < children.getLength(); i++) {
            if (children.item(i) instanceof Element child && localName(child.getTagName()).equals(name)) {
                return Optional.of(child);
            }
        }
        return Optional.empty();
    }

    private static Optional<String> childText(Node parent, String tagName) {
        if (!(parent instanceof Element element)) {
            return Optional.empty();
        }
        NodeList children = element.getElementsByTagName(tagName);
        if (children.getLength() == 0) {
            return Optional.empty();
        }
        String text = children.item(0).getTextContent();
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(text.trim());
    }

    private static Optional<String> childAttribute(Node parent, String tagName, String attribute) {
        if (!(parent instanceof Element element)) {
            return Optional.empty();
        }
        NodeList children = element.getElementsByTagName(tagName);
        if (children.getLength() == 0 || !(children.item(0) instanceof Element child)) {
            return Optional.empty();
        }
        String value = child.getAttribute(attribute);
        return value == null || value.isBlank() ? Optional.empty() : Optional.of(value.trim());
    }

    private static boolean looksLikeUrl(String value) {
        String lowered = value.toLowerCase(Locale.ROOT);
        return lowered.startsWith("http://") || lowered.startsWith("https://");
    }

    private static String localName(String tagName) {
        int colon = tagName.indexOf(':');
        return (colon >= 0 ? tagName.substring(colon + 1) : tagName).toLowerCase(Locale.ROOT);
    }
}
