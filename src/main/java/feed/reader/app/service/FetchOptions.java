package feed.reader.app.service;

import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class FetchOptions {
    public static final String FEED_ACCEPT =
            "application/rss+xml,application/atom+xml,application/xml,text/xml;q=0.9,*/*;q=0.1";
    public static final String HTML_ACCEPT =
            "text/html,application/xhtml+xml;q=0.9,text/plain;q=0.8,*/*;q=0.1";

    @Builder.Default
    long timeoutMs = 7000;
    @Builder.Default
    int maxRedirects = 5;
    @Builder.Default
    int retries = 2;
    @Builder.Default
    String acceptHeader = FEED_ACCEPT;
    String ifNoneMatch;
    String ifModifiedSince;
}
