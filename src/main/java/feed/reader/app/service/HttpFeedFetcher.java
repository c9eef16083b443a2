package feed.reader.app.service;

import lombok.extern.slf4j.Slf4j;
import okhttp3.Call;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okio.BufferedSource;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

/**
 * {@link FeedFetcher} on top of OkHttp. Redirects are followed manually so each hop is
 * checked by the {@link RemoteAddressGuard}; retries use jittered exponential backoff.
 */
@Slf4j
@Service
public class HttpFeedFetcher implements FeedFetcher {
    private static final Set<Integer> REDIRECT_STATUS_CODES = Set.of(301, 302, 303, 307, 308);
    private static final long MAX_BACKOFF_MS = 2000;

    private final OkHttpClient httpClient;
    private final RemoteAddressGuard addressGuard;
    private final long maxBodyBytes;
    private final String userAgent;

    public HttpFeedFetcher(OkHttpClient httpClient,
                           RemoteAddressGuard addressGuard,
                           @Value("${feeds.fetch.max-body-bytes:5242880}") long maxBodyBytes,
                           @Value("${feeds.fetch.user-agent:FeedReader/1.0}") String userAgent) {
        this.httpClient = httpClient;
        this.addressGuard = addressGuard;
        this.maxBodyBytes = maxBodyBytes;
        this.userAgent = userAgent;
    }

    @Override
    public FetchResult fetch(String url, FetchOptions options) throws FeedFetchException {
        HttpUrl target = HttpUrl.parse(url);
        if (target == null) {
            throw new FeedFetchException(FeedFetchException.FetchFailure.INVALID_URL, "Invalid URL: " + url);
        }

        int totalAttempts = Math.max(0, options.getRetries()) + 1;
        FeedFetchException lastError = null;

        for (int attempt = 0; attempt < totalAttempts; attempt++) {
            try {
                return fetchOnce(target, options);
            } catch (FeedFetchException e) {
                lastError = e;
                boolean lastAttempt = attempt + 1 >= totalAttempts;
                if (!e.isRetryable() || lastAttempt) {
                    break;
                }
                long delay = backoffMs(attempt);
                log.debug("Retrying {} in {} ms after: {}", url, delay, e.getMessage());
                sleep(delay);
            }
        }

        if (totalAttempts > 1 && lastError.isRetryable()) {
            log.warn("Fetch retries exhausted for {} after {} attempts: {}", url, totalAttempts, lastError.getMessage());
        }
        throw lastError;
    }

    private FetchResult fetchOnce(HttpUrl start, FetchOptions options) throws FeedFetchException {
        HttpUrl current = start;
        addressGuard.check(current);

        for (int redirectCount = 0; ; redirectCount++) {
            Request request = buildRequest(current, options);
            Call call = httpClient.newCall(request);
            call.timeout().timeout(options.getTimeoutMs(), TimeUnit.MILLISECONDS);

            try (Response response = call.execute()) {
                int status = response.code();

                if (REDIRECT_STATUS_CODES.contains(status)) {
                    String location = response.header("Location");
                    if (location == null || location.isBlank()) {
                        throw new FeedFetchException(FeedFetchException.FetchFailure.NETWORK,
                                "Redirect response missing location header from " + current);
                    }
                    if (redirectCount >= options.getMaxRedirects()) {
                        throw new FeedFetchException(FeedFetchException.FetchFailure.TOO_MANY_REDIRECTS,
                                "Too many redirects starting at " + start);
                    }
                    HttpUrl next = current.resolve(location);
                    if (next == null) {
                        throw new FeedFetchException(FeedFetchException.FetchFailure.INVALID_URL,
                                "Unsupported redirect target: " + location);
                    }
                    addressGuard.check(next);
                    current = next;
                    continue;
                }

                String etag = response.header("ETag");
                String lastModified = response.header("Last-Modified");
                String finalUrl = current.toString();

                if (status == 304) {
                    return FetchResult.notModified(etag, lastModified, finalUrl);
                }
                if (!response.isSuccessful()) {
                    throw FeedFetchException.httpStatus(status, finalUrl);
                }
                return FetchResult.ok(readBody(response.body(), finalUrl), response.header("Content-Type"),
                        etag, lastModified, finalUrl);
            } catch (RemoteAddressGuard.BlockedAddressException e) {
                throw new FeedFetchException(FeedFetchException.FetchFailure.BLOCKED_HOST, e.getMessage(), e);
            } catch (InterruptedIOException e) {
                throw new FeedFetchException(FeedFetchException.FetchFailure.TIMEOUT,
                        "Timed out fetching " + current, e);
            } catch (IOException e) {
                throw new FeedFetchException(FeedFetchException.FetchFailure.NETWORK,
                        "Network error fetching " + current + ": " + e.getMessage(), e);
            }
        }
    }

    private Request buildRequest(HttpUrl url, FetchOptions options) {
        Request.Builder builder = new Request.Builder()
                .url(url)
                .get()
                .header("Accept", options.getAcceptHeader())
                .header("User-Agent", userAgent);
        if (options.getIfNoneMatch() != null && !options.getIfNoneMatch().isBlank()) {
            builder.header("If-None-Match", options.getIfNoneMatch());
        }
        if (options.getIfModifiedSince() != null && !options.getIfModifiedSince().isBlank()) {
            builder.header("If-Modified-Since", options.getIfModifiedSince());
        }
        return builder.build();
    }

    private byte[] readBody(ResponseBody body, String url) throws IOException, FeedFetchException {
        if (body == null) {
            return new byte[0];
        }
        BufferedSource source = body.source();
        // request() buffers up to the limit; true means more bytes were available
        if (source.request(maxBodyBytes + 1)) {
            throw new FeedFetchException(FeedFetchException.FetchFailure.NETWORK,
                    "Response body exceeds " + maxBodyBytes + " bytes for " + url);
        }
        return body.bytes();
    }

    static long backoffMs(int attempt) {
        long base = 200L * (1L << Math.min(attempt, 10));
        long jitter = ThreadLocalRandom.current().nextLong(100);
        return Math.min(MAX_BACKOFF_MS, base + jitter);
    }

    private static void sleep(long millis) throws FeedFetchException {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FeedFetchException(FeedFetchException.FetchFailure.NETWORK, "Interrupted while waiting to retry", e);
        }
    }
}
