package com.releasefeed.pipeline.parse;

import com.releasefeed.pipeline.support.FixtureUtils;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FeedDocumentParserTest {
    @Test
    void rssDocumentYieldsRssItems() throws Exception {
        ParseResult result = FeedDocumentParser.parse(FixtureUtils.fixture("fixtures/sample-rss.xml"));

        ParseResult.RssItems rss = assertInstanceOf(ParseResult.RssItems.class, result);
        assertEquals(2, rss.entries().size());
        RawEntry first = rss.entries().get(0);
        assertEquals("Enhanced Security Feature", first.title());
        assertEquals("https://help.zscaler.com/zia/enhanced-security", first.link());
        assertEquals("Mon, 16 Dec 2024 10:00:00 +0000", first.date());
        assertEquals("Available", first.category());
        assertEquals("<p>Performance improvements in ZIA</p>", rss.entries().get(1).description());
        assertNull(rss.entries().get(1).category());
    }

    @Test
    void rawBytesAreDecodedWithDeclaredEncoding() throws Exception {
        ParseResult result = FeedDocumentParser.parse(FixtureUtils.fixtureBytes("fixtures/latin1-rss.xml"));

        RawEntry entry = assertInstanceOf(ParseResult.RssItems.class, result).entries().get(0);
        assertEquals("Caf\u00e9 r\u00e9sum\u00e9 for Z\u00fcrich tenants", entry.title());
        assertEquals("Gr\u00f6\u00dfere \u00dcbersicht f\u00fcr Administratoren", entry.description());
    }

    @Test
    void rawBytesWithoutDeclarationDefaultToUtf8() {
        byte[] body = ("\n  <rss version=\"2.0\"><channel><item><title>Caf\u00e9</title>"
                + "<link>https://help.zscaler.com/zia/cafe</link></item></channel></rss>").getBytes(StandardCharsets.UTF_8);

        RawEntry entry = assertInstanceOf(ParseResult.RssItems.class, FeedDocumentParser.parse(body)).entries().get(0);

        assertEquals("Caf\u00e9", entry.title());
        assertInstanceOf(ParseResult.Malformed.class, FeedDocumentParser.parse(" \r\n".getBytes(StandardCharsets.UTF_8)));
        assertInstanceOf(ParseResult.Malformed.class, FeedDocumentParser.parse((byte[]) null));
    }

    @Test
    void atomDocumentPrefersAlternateLinkAndPublishedDate() throws Exception {
        ParseResult result = FeedDocumentParser.parse(FixtureUtils.fixture("fixtures/sample-atom.xml"));

        ParseResult.AtomEntries atom = assertInstanceOf(ParseResult.AtomEntries.class, result);
        List<RawEntry> entries = atom.entries();
        assertEquals(2, entries.size());
        assertEquals("https://help.zscaler.com/zpa/access-policy", entries.get(0).link());
        assertEquals("2024-12-18T09:00:00+01:00", entries.get(0).date());
        assertEquals("Limited", entries.get(0).category());
        assertEquals("New access policy features in ZPA", entries.get(0).description());

        assertEquals("https://help.zscaler.com/zpa/connector-upgrade", entries.get(1).link());
        assertEquals("2024-12-17T08:15:00Z", entries.get(1).date());
        assertEquals("Connector upgrade notes", entries.get(1).description());
    }

    @Test
    void rssVariantsUseGuidAndDublinCoreFallbacks() throws Exception {
        ParseResult result = FeedDocumentParser.parse(FixtureUtils.fixture("fixtures/rss-variants.xml"));

        List<RawEntry> entries = result.entries();
        assertEquals(6, entries.size());
        assertEquals("https://help.zscaler.com/zdx/guid-only", entries.get(1).link());
        assertEquals("2024-12-17T08:00:00Z", entries.get(1).date());
        assertNull(entries.get(4).date());
        assertNull(entries.get(5).link(), "non-URL guid must not be used as a link");
    }

    @Test
    void rdfRootIsTreatedAsRss() {
        String rdf = """
                <?xml version="1.0"?>
                <rdf:RDF xmlns:rdf="http://www.w3.org/1999/02/22-rdf-syntax-ns#" xmlns="http://purl.org/rss/1.0/">
                  <channel><title>t</title></channel>
                  <item><title>One</title><link>https://example.com/one</link></item>
                </rdf:RDF>
                """;

        ParseResult result = FeedDocumentParser.parse(rdf);

        assertInstanceOf(ParseResult.RssItems.class, result);
        assertEquals("https://example.com/one", result.entries().get(0).link());
    }

    @Test
    void atomIdServesAsLinkWhenNoHrefPresent() {
        String atom = """
                <feed xmlns="http://www.w3.org/2005/Atom">
                  <entry>
                    <title>Only id</title>
                    <id>https://example.com/only-id</id>
                    <updated>2024-12-17T08:15:00Z</updated>
                  </entry>
                </feed>
                """;

        assertEquals("https://example.com/only-id", FeedDocumentParser.parse(atom).entries().get(0).link());
    }

    @Test
    void unknownRootIsUnrecognized() throws Exception {
        ParseResult result = FeedDocumentParser.parse(FixtureUtils.fixture("fixtures/unknown-structure.xml"));

        ParseResult.Unrecognized unrecognized = assertInstanceOf(ParseResult.Unrecognized.class, result);
        assertEquals("urlset", unrecognized.rootElement());
        assertTrue(result.entries().isEmpty());
    }

    @Test
    void brokenOrEmptyBodiesAreMalformed() {
        assertInstanceOf(ParseResult.Malformed.class, FeedDocumentParser.parse("<rss><channel><item></rss>"));
        assertInstanceOf(ParseResult.Malformed.class, FeedDocumentParser.parse("<html>not a feed"));
        assertInstanceOf(ParseResult.Malformed.class, FeedDocumentParser.parse(""));
        assertInstanceOf(ParseResult.Malformed.class, FeedDocumentParser.parse((String) null));
    }

    @Test
    void doctypeDeclarationsAreRejected() {
        String withEntity = """
                <?xml version="1.0"?>
                <!DOCTYPE rss [<!ENTITY xxe SYSTEM "file:///etc/passwd">]>
                <rss><channel><item><title>&xxe;</title></item></channel></rss>
                """;

        assertInstanceOf(ParseResult.Malformed.class, FeedDocumentParser.parse(withEntity));
    }
}
