package feed.reader.app.service;

import lombok.Value;

import java.util.List;

/**
 * Format-independent view of a feed document.
 */
@Value
public class ParsedFeed {
    String title;
    String description;
    List<ParsedFeedItem> items;
}
