package feed.reader.app.service;

/**
 * Bounded, optionally conditional HTTP retrieval.
 */
public interface FeedFetcher {

    /**
     * Fetches a URL, following at most {@code options.maxRedirects} redirects and retrying
     * retryable failures {@code options.retries} times.
     * @param url Absolute http(s) URL
     * @param options timeouts and request headers
     * @return The body with its validators, or a not-modified result when validators were sent and still match
     * @throws FeedFetchException classified as timeout, network, non-2xx status, blocked host or redirect overflow
     */
    FetchResult fetch(String url, FetchOptions options) throws FeedFetchException;
}
