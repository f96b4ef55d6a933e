package com.releasefeed.service.feed;

import com.releasefeed.core.model.AggregatedFeed;
import com.releasefeed.core.model.FeedItem;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Serializes an {@link AggregatedFeed} as an RSS 2.0 document. The channel is always present, so a run
 * that found nothing still publishes a valid, empty feed.
 */
public class RssFeedWriter {
    public static final String CHANNEL_TITLE = "Zscaler Releases (help.zscaler.com)";
    public static final String CHANNEL_DESCRIPTION = "Automatically generated feed of new Zscaler release notes across all products.";
    public static final String FEED_PATH = "/rss.xml";

    private static final Logger LOGGER = Logger.getLogger(RssFeedWriter.class.getName());
    private static final String ATOM_NS = "http://www.w3.org/2005/Atom";

    private final String siteUrl;
    private final String language;

    public RssFeedWriter(String siteUrl) {
        this(siteUrl, "en");
    }

    public RssFeedWriter(String siteUrl, String language) {
        this.siteUrl = Objects.requireNonNull(siteUrl, "siteUrl is required");
        this.language = language;
    }

    public void write(AggregatedFeed feed, Path output) {
        String xml = render(feed);
        try {
            Path parent = output.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(output, xml, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Failed writing feed to " + output, e);
        }
        LOGGER.info("Wrote " + feed.items().size() + " items to " + output);
    }

    public String render(AggregatedFeed feed) {
        Document document = newDocument();
        Element rss = document.createElement("rss");
        rss.setAttribute("version", "2.0");
        rss.setAttribute("xmlns:atom", ATOM_NS);
        document.appendChild(rss);

        Element channel = append(document, rss, "channel", null);
        append(document, channel, "title", CHANNEL_TITLE);
        append(document, channel, "link", siteUrl);
        Element self = document.createElement("atom:link");
        self.setAttribute("href", siteUrl + FEED_PATH);
        self.setAttribute("rel", "self");
        self.setAttribute("type", "application/rss+xml");
        channel.appendChild(self);
        append(document, channel, "description", CHANNEL_DESCRIPTION);
        if (language != null && !language.isBlank()) {
            append(document, channel, "language", language);
        }
        append(document, channel, "lastBuildDate", rfc1123(feed.generatedAt()));

        for (FeedItem item : feed.items()) {
            String title = item.title().isBlank() ? item.link() : item.title();
            Element entry = append(document, channel, "item", null);
            append(document, entry, "title", title);
            append(document, entry, "link", item.link());
            Element guid = append(document, entry, "guid", item.link());
            guid.setAttribute("isPermaLink", "true");
            append(document, entry, "pubDate", rfc1123(item.publishedAt()));
            append(document, entry, "description", summary(item, title));
            if (item.category() != null && !item.category().isBlank()) {
                append(document, entry, "category", item.category());
            }
        }
        return serialize(document);
    }

    private static String summary(FeedItem item, String title) {
        if (!item.description().isBlank()) {
            return item.description();
        }
        return item.sourceFeed().isBlank() ? title : title + " (source: " + item.sourceFeed() + ")";
    }

    private static String rfc1123(Instant instant) {
        return DateTimeFormatter.RFC_1123_DATE_TIME.format(instant.atZone(ZoneOffset.UTC));
    }

    private static Element append(Document document, Element parent, String name, String text) {
        Element element = document.createElement(name);
        if (text != null) {
            element.setTextContent(text);
        }
        parent.appendChild(element);
        return element;
    }

    private static Document newDocument() {
        try {
            Document document = DocumentBuilderFactory.newInstance().newDocumentBuilder().newDocument();
            document.setXmlStandalone(true);
            return document;
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML document builder unavailable", e);
        }
    }

    private static String serialize(Document document) {
        try {
            TransformerFactory factory = TransformerFactory.newInstance();
            factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_DTD, "");
            factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_STYLESHEET, "");
            Transformer transformer = factory.newTransformer();
            transformer.setOutputProperty(OutputKeys.ENCODING, StandardCharsets.UTF_8.name());
            transformer.setOutputProperty(OutputKeys.INDENT, "yes");
            transformer.setOutputProperty("{http://xml.apache.org/xslt}indent-amount", "2");
            StringWriter out = new StringWriter();
            transformer.transform(new DOMSource(document), new StreamResult(out));
            return out.toString();
        } catch (TransformerException e) {
            throw new IllegalStateException("Failed serializing RSS document", e);
        }
    }
}
