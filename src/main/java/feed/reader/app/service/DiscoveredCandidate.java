package feed.reader.app.service;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Value;

/**
 * A URL confirmed to serve a parseable feed.
 */
@Value
public class DiscoveredCandidate {
    public static final String METHOD_DIRECT = "direct";

    String url;
    String title;
    String method;
    boolean duplicate;
    String existingFeedId;
    @JsonIgnore
    FeedParseResult parseResult;
}
