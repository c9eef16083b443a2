package feed.reader.app.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.charset.StandardCharsets;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class FeedParserTest {

    private static final String RSS = """
            <?xml version="1.0" encoding="UTF-8"?>
            <rss version="2.0">
              <channel>
                <title> Example Blog </title>
                <description>Posts about things</description>
                <link>https://example.com/</link>
                <item>
                  <title>First post</title>
                  <link>https://example.com/posts/1</link>
                  <guid isPermaLink="false">post-1</guid>
                  <description>&lt;p&gt;Hello&lt;/p&gt;</description>
                  <author>ada@example.com (Ada)</author>
                  <pubDate>Fri, 01 Mar 2024 10:00:00 GMT</pubDate>
                </item>
                <item>
                  <title>No guid</title>
                  <link>https://example.com/posts/2</link>
                </item>
              </channel>
            </rss>
            """;

    private static final String ATOM = """
            <?xml version="1.0" encoding="utf-8"?>
            <feed xmlns="http://www.w3.org/2005/Atom">
              <title>Atom Example</title>
              <subtitle>Subtitle here</subtitle>
              <id>urn:uuid:feed</id>
              <updated>2024-03-02T12:00:00Z</updated>
              <entry>
                <title>Atom entry</title>
                <id>urn:uuid:entry-1</id>
                <link rel="alternate" href="https://example.org/entry-1"/>
                <updated>2024-03-02T12:00:00Z</updated>
                <author><name>Grace</name></author>
                <content type="html">&lt;b&gt;Body&lt;/b&gt;</content>
              </entry>
            </feed>
            """;

    private static final String JSON_FEED = """
            {
              "version": "https://jsonfeed.org/version/1.1",
              "title": "JSON Example",
              "items": [
                {
                  "id": "j-1",
                  "url": "https://example.net/j-1",
                  "title": "Json item",
                  "content_text": "Plain body",
                  "authors": [{"name": "Linus"}],
                  "date_published": "2024-03-03T08:30:00+01:00"
                },
                {
                  "url": "https://example.net/j-2",
                  "summary": "Only a summary"
                }
              ]
            }
            """;

    @Mock
    private FeedFetcher feedFetcher;

    private FeedParser feedParser;

    @BeforeEach
    void setUp() {
        feedParser = new FeedParser(feedFetcher, new ObjectMapper(), 15000, 2, 5);
    }

    @Test
    void parse_WithRss_ShouldMapChannelAndItems() throws Exception {
        // When
        ParsedFeed feed = feedParser.parse(RSS);

        // Then
        assertEquals("Example Blog", feed.getTitle());
        assertEquals("Posts about things", feed.getDescription());
        assertEquals(2, feed.getItems().size());

        ParsedFeedItem first = feed.getItems().get(0);
        assertEquals("post-1", first.getGuid());
        assertEquals("First post", first.getTitle());
        assertEquals("https://example.com/posts/1", first.getLink());
        assertEquals("<p>Hello</p>", first.getContent());
        assertNotNull(first.getAuthor());
        assertEquals(Instant.parse("2024-03-01T10:00:00Z"), first.getPublishedAt());

        ParsedFeedItem second = feed.getItems().get(1);
        assertEquals("https://example.com/posts/2", second.getGuid());
        assertNull(second.getContent());
        assertNull(second.getPublishedAt());
    }

    @Test
    void parse_WithAtom_ShouldUseEntryIdAndUpdatedDate() throws Exception {
        // When
        ParsedFeed feed = feedParser.parse(ATOM);

        // Then
        assertEquals("Atom Example", feed.getTitle());
        ParsedFeedItem entry = feed.getItems().get(0);
        assertEquals("urn:uuid:entry-1", entry.getGuid());
        assertEquals("https://example.org/entry-1", entry.getLink());
        assertEquals("<b>Body</b>", entry.getContent());
        assertEquals("Grace", entry.getAuthor());
        assertEquals(Instant.parse("2024-03-02T12:00:00Z"), entry.getPublishedAt());
    }

    @Test
    void parse_WithJsonFeed_ShouldMapItems() throws Exception {
        // When
        ParsedFeed feed = feedParser.parse(JSON_FEED);

        // Then
        assertEquals("JSON Example", feed.getTitle());
        assertNull(feed.getDescription());
        ParsedFeedItem first = feed.getItems().get(0);
        assertEquals("j-1", first.getGuid());
        assertEquals("Plain body", first.getContent());
        assertEquals("Linus", first.getAuthor());
        assertEquals(Instant.parse("2024-03-03T07:30:00Z"), first.getPublishedAt());

        ParsedFeedItem second = feed.getItems().get(1);
        assertEquals("https://example.net/j-2", second.getGuid());
        assertEquals("Only a summary", second.getContent());
    }

    @Test
    void parse_WithByteOrderMark_ShouldStillParse() throws Exception {
        ParsedFeed feed = feedParser.parse("\uFEFF" + RSS.trim());

        assertEquals("Example Blog", feed.getTitle());
    }

    @Test
    void parse_WithNonFeedDocuments_ShouldThrowParseException() {
        assertThrows(FeedParseException.class, () -> feedParser.parse(""));
        assertThrows(FeedParseException.class, () -> feedParser.parse("this is not xml"));
        assertThrows(FeedParseException.class, () -> feedParser.parse("<html><body>hi</body></html>"));
        assertThrows(FeedParseException.class, () -> feedParser.parse("{\"hello\": \"world\"}"));
        assertThrows(FeedParseException.class, () -> feedParser.parse("{ broken json"));
    }

    @Test
    void parseWithValidators_WhenNotModified_ShouldSkipParsingAndSendValidators() throws Exception {
        // Given
        when(feedFetcher.fetch(eq("https://example.com/feed"), any(FetchOptions.class)))
                .thenReturn(FetchResult.notModified("\"v2\"", null, "https://example.com/feed"));

        // When
        FeedParseResult result = feedParser.parseWithValidators("https://example.com/feed", "\"v1\"", "yesterday");

        // Then
        assertTrue(result.isNotModified());
        assertNull(result.getFeed());
        assertEquals("\"v2\"", result.getEtag());

        ArgumentCaptor<FetchOptions> captor = ArgumentCaptor.forClass(FetchOptions.class);
        verify(feedFetcher).fetch(eq("https://example.com/feed"), captor.capture());
        assertEquals("\"v1\"", captor.getValue().getIfNoneMatch());
        assertEquals("yesterday", captor.getValue().getIfModifiedSince());
        assertEquals(2, captor.getValue().getRetries());
    }

    @Test
    void parseWithMetadata_ShouldCarryValidatorsAndFinalUrl() throws Exception {
        // Given
        when(feedFetcher.fetch(eq("https://example.com/rss"), any(FetchOptions.class)))
                .thenReturn(FetchResult.ok(RSS, "\"e\"", "lm", "https://example.com/rss.xml"));

        // When
        FeedParseResult result = feedParser.parseWithMetadata("https://example.com/rss");

        // Then
        assertFalse(result.isNotModified());
        assertEquals("Example Blog", result.getFeed().getTitle());
        assertEquals("\"e\"", result.getEtag());
        assertEquals("lm", result.getLastModified());
        assertEquals("https://example.com/rss.xml", result.getFinalUrl());
    }

    @Test
    void parse_WithNetscapeRss091Doctype_ShouldParse() throws Exception {
        String rss091 = """
                <?xml version="1.0" encoding="UTF-8"?>
                <!DOCTYPE rss PUBLIC "-//Netscape Communications//DTD RSS 0.91//EN"
                  "http://my.netscape.com/publish/formats/rss-0.91.dtd">
                <rss version="0.91">
                  <channel>
                    <title>Old School</title>
                    <link>https://old.example.com/</link>
                    <description>Still on 0.91</description>
                    <language>en-us</language>
                    <item>
                      <title>Hello again</title>
                      <link>https://old.example.com/hello</link>
                    </item>
                  </channel>
                </rss>
                """;

        ParsedFeed feed = feedParser.parse(rss091);

        assertEquals("Old School", feed.getTitle());
        assertEquals(1, feed.getItems().size());
        assertEquals("https://old.example.com/hello", feed.getItems().get(0).getGuid());
    }

    @Test
    void parseWithMetadata_WithLatin1BodyAndNoHeaderCharset_ShouldUseXmlDeclaration() throws Exception {
        // Given
        String latin1 = """
                <?xml version="1.0" encoding="ISO-8859-1"?>
                <rss version="2.0">
                  <channel>
                    <title>Caf\u00E9 news</title>
                    <item>
                      <guid>c-1</guid>
                      <title>Cr\u00E8me br\u00FBl\u00E9e</title>
                      <author>Ren\u00E9e</author>
                    </item>
                  </channel>
                </rss>
                """;
        when(feedFetcher.fetch(eq("https://example.fr/rss"), any(FetchOptions.class)))
                .thenReturn(FetchResult.ok(latin1.getBytes(StandardCharsets.ISO_8859_1), "application/rss+xml",
                        null, null, "https://example.fr/rss"));

        // When
        FeedParseResult result = feedParser.parseWithMetadata("https://example.fr/rss");

        // Then
        assertEquals("Caf\u00E9 news", result.getFeed().getTitle());
        ParsedFeedItem item = result.getFeed().getItems().get(0);
        assertEquals("Cr\u00E8me br\u00FBl\u00E9e", item.getTitle());
        assertEquals("Ren\u00E9e", item.getAuthor());
    }

    @Test
    void parseWithMetadata_WithJsonBodyBytes_ShouldUseJsonFeedPath() throws Exception {
        // Given
        when(feedFetcher.fetch(eq("https://example.com/feed.json"), any(FetchOptions.class)))
                .thenReturn(FetchResult.ok(JSON_FEED.getBytes(StandardCharsets.UTF_8), "application/feed+json",
                        null, null, "https://example.com/feed.json"));

        // When
        FeedParseResult result = feedParser.parseWithMetadata("https://example.com/feed.json");

        // Then
        assertFalse(result.getFeed().getItems().isEmpty());
    }
}
