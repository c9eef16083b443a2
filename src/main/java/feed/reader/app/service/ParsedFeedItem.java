package feed.reader.app.service;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * One entry of a parsed feed. Every field is optional.
 */
@Value
@Builder
public class ParsedFeedItem {
    String guid;
    String title;
    String link;
    String content;
    String author;
    Instant publishedAt;
}
