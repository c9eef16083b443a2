package feed.reader.app.service;

import lombok.Value;

/**
 * A fetch-and-parse outcome together with the validators to cache for the next conditional request.
 * {@code feed} is null when the origin answered not-modified.
 */
@Value
public class FeedParseResult {
    boolean notModified;
    ParsedFeed feed;
    String etag;
    String lastModified;
    String finalUrl;

    public static FeedParseResult updated(ParsedFeed feed, FetchResult fetch) {
        return new FeedParseResult(false, feed, fetch.getEtag(), fetch.getLastModified(), fetch.getFinalUrl());
    }

    public static FeedParseResult notModified(FetchResult fetch) {
        return new FeedParseResult(true, null, fetch.getEtag(), fetch.getLastModified(), fetch.getFinalUrl());
    }
}
