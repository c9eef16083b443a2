package feed.reader.app.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rometools.rome.feed.synd.SyndContent;
import com.rometools.rome.feed.synd.SyndEntry;
import com.rometools.rome.feed.synd.SyndFeed;
import com.rometools.rome.feed.synd.SyndLink;
import com.rometools.rome.feed.synd.SyndPerson;
import com.rometools.rome.io.FeedException;
import com.rometools.rome.io.SyndFeedInput;
import com.rometools.rome.io.XmlReader;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;

/**
 * Turns RSS 0.9x/1.0/2.0, Atom and JSON Feed documents into {@link ParsedFeed}s.
 * XML formats go through Rome; JSON Feed is read with Jackson.
 */
@Slf4j
@Service
public class FeedParser {
    private final FeedFetcher feedFetcher;
    private final ObjectMapper objectMapper;
    private final long fetchTimeoutMs;
    private final int fetchRetries;
    private final int maxRedirects;

    public FeedParser(FeedFetcher feedFetcher,
                      ObjectMapper objectMapper,
                      @Value("${feeds.fetch.timeout-ms:15000}") long fetchTimeoutMs,
                      @Value("${feeds.fetch.retries:2}") int fetchRetries,
                      @Value("${feeds.fetch.max-redirects:5}") int maxRedirects) {
        this.feedFetcher = feedFetcher;
        this.objectMapper = objectMapper;
        this.fetchTimeoutMs = fetchTimeoutMs;
        this.fetchRetries = fetchRetries;
        this.maxRedirects = maxRedirects;
    }

    /**
     * Parses a raw document. Missing optional fields come back as nulls.
     * @throws FeedParseException if the body is empty or not a recognizable feed
     */
    public ParsedFeed parse(String rawBody) throws FeedParseException {
        if (rawBody == null || rawBody.isBlank()) {
            throw new FeedParseException("Feed document is empty");
        }
        String body = stripByteOrderMark(rawBody).trim();
        if (body.startsWith("{")) {
            return parseJsonFeed(body);
        }
        return parseXmlFeed(new StringReader(body));
    }

    /**
     * Parses a fetched body. XML is read from the raw bytes so the prolog's encoding
     * declaration is honoured when the Content-Type carries no charset.
     */
    ParsedFeed parse(FetchResult fetch) throws FeedParseException {
        byte[] bytes = fetch.getBodyBytes();
        String text = fetch.getBody();
        if (bytes == null || text == null || text.isBlank()) {
            throw new FeedParseException("Feed document is empty");
        }
        String body = stripByteOrderMark(text).trim();
        if (body.startsWith("{")) {
            return parseJsonFeed(body);
        }
        try (Reader reader = openXmlReader(bytes, fetch.getContentType())) {
            return parseXmlFeed(reader);
        } catch (IOException e) {
            throw new FeedParseException("Could not decode feed document: " + e.getMessage(), e);
        }
    }

    private static Reader openXmlReader(byte[] bytes, String contentType) throws IOException {
        ByteArrayInputStream stream = new ByteArrayInputStream(bytes);
        if (contentType == null || contentType.isBlank()) {
            return new XmlReader(stream, true);
        }
        return new XmlReader(stream, contentType, true);
    }

    /**
     * Fetches and parses a URL for a brand-new subscription, with no cached validators.
     */
    public FeedParseResult parseWithMetadata(String url) throws FeedFetchException, FeedParseException {
        FetchResult fetch = feedFetcher.fetch(url, defaultOptions().build());
        return FeedParseResult.updated(parse(fetch), fetch);
    }

    /**
     * Same as {@link #parseWithMetadata(String)} with caller-chosen fetch options, for probing discovery candidates.
     */
    public FeedParseResult parseWithMetadata(String url, FetchOptions options) throws FeedFetchException, FeedParseException {
        FetchResult fetch = feedFetcher.fetch(url, options);
        return FeedParseResult.updated(parse(fetch), fetch);
    }

    /**
     * Conditional fetch for refresh. A not-modified answer skips parsing entirely.
     */
    public FeedParseResult parseWithValidators(String url, String etag, String lastModified)
            throws FeedFetchException, FeedParseException {
        FetchOptions options = defaultOptions()
                .ifNoneMatch(etag)
                .ifModifiedSince(lastModified)
                .build();
        FetchResult fetch = feedFetcher.fetch(url, options);
        if (fetch.isNotModified()) {
            return FeedParseResult.notModified(fetch);
        }
        return FeedParseResult.updated(parse(fetch), fetch);
    }

    private FetchOptions.FetchOptionsBuilder defaultOptions() {
        return FetchOptions.builder()
                .timeoutMs(fetchTimeoutMs)
                .retries(fetchRetries)
                .maxRedirects(maxRedirects)
                .acceptHeader(FetchOptions.FEED_ACCEPT);
    }

    private ParsedFeed parseXmlFeed(Reader body) throws FeedParseException {
        SyndFeed feed;
        try {
            SyndFeedInput input = new SyndFeedInput();
            // RSS 0.91 documents carry the Netscape DOCTYPE; Rome keeps external entities off
            input.setAllowDoctypes(true);
            feed = input.build(body);
        } catch (FeedException | IllegalArgumentException e) {
            throw new FeedParseException("Not a valid RSS or Atom document: " + e.getMessage(), e);
        }

        List<ParsedFeedItem> items = new ArrayList<>();
        for (SyndEntry entry : feed.getEntries()) {
            items.add(toItem(entry));
        }
        return new ParsedFeed(clean(feed.getTitle()), clean(feed.getDescription()), items);
    }

    private ParsedFeedItem toItem(SyndEntry entry) {
        String link = clean(entry.getLink());
        if (link == null && entry.getLinks() != null) {
            link = entry.getLinks().stream()
                    .map(SyndLink::getHref)
                    .map(FeedParser::clean)
                    .filter(href -> href != null)
                    .findFirst()
                    .orElse(null);
        }

        // guid for RSS, id for Atom, otherwise the permalink
        String guid = clean(entry.getUri());
        if (guid == null) {
            guid = link;
        }

        return ParsedFeedItem.builder()
                .guid(guid)
                .title(clean(entry.getTitle()))
                .link(link)
                .content(extractContent(entry))
                .author(extractAuthor(entry))
                .publishedAt(toInstant(entry.getPublishedDate() != null ? entry.getPublishedDate() : entry.getUpdatedDate()))
                .build();
    }

    private String extractContent(SyndEntry entry) {
        // content:encoded / Atom content first, then description / summary
        if (entry.getContents() != null) {
            for (SyndContent content : entry.getContents()) {
                String value = clean(content.getValue());
                if (value != null) {
                    return value;
                }
            }
        }
        SyndContent description = entry.getDescription();
        return description != null ? clean(description.getValue()) : null;
    }

    private String extractAuthor(SyndEntry entry) {
        String author = clean(entry.getAuthor());
        if (author != null) {
            return author;
        }
        if (entry.getAuthors() != null) {
            for (SyndPerson person : entry.getAuthors()) {
                String name = clean(person.getName());
                if (name != null) {
                    return name;
                }
            }
        }
        return null;
    }

    private ParsedFeed parseJsonFeed(String body) throws FeedParseException {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new FeedParseException("Not a valid JSON Feed document: " + e.getOriginalMessage(), e);
        }
        String version = root.path("version").asText("");
        if (!version.contains("jsonfeed.org") || !root.path("items").isArray()) {
            throw new FeedParseException("JSON document is not a JSON Feed");
        }

        List<ParsedFeedItem> items = new ArrayList<>();
        for (JsonNode node : root.path("items")) {
            String link = firstText(node, "url", "external_url");
            String guid = firstText(node, "id");
            items.add(ParsedFeedItem.builder()
                    .guid(guid != null ? guid : link)
                    .title(firstText(node, "title"))
                    .link(link)
                    .content(firstText(node, "content_html", "content_text", "summary"))
                    .author(jsonAuthor(node))
                    .publishedAt(parseIsoInstant(firstText(node, "date_published", "date_modified")))
                    .build());
        }
        return new ParsedFeed(firstText(root, "title"), firstText(root, "description"), items);
    }

    private static String jsonAuthor(JsonNode item) {
        JsonNode authors = item.path("authors");
        if (authors.isArray()) {
            for (JsonNode author : authors) {
                String name = firstText(author, "name");
                if (name != null) {
                    return name;
                }
            }
        }
        return firstText(item.path("author"), "name");
    }

    private static String firstText(JsonNode node, String... fields) {
        for (String field : fields) {
            JsonNode value = node.get(field);
            if (value != null && value.isValueNode()) {
                String text = clean(value.asText());
                if (text != null) {
                    return text;
                }
            }
        }
        return null;
    }

    private static Instant parseIsoInstant(String value) {
        if (value == null) {
            return null;
        }
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException e) {
            log.debug("Ignoring unparseable JSON Feed date: {}", value);
            return null;
        }
    }

    private static Instant toInstant(Date date) {
        return date != null ? date.toInstant() : null;
    }

    private static String stripByteOrderMark(String text) {
        return text.startsWith("\uFEFF") ? text.substring(1) : text;
    }

    static String clean(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
