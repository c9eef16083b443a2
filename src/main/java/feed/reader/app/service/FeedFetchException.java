package feed.reader.app.service;

import lombok.Getter;

/**
 * A fetch that did not produce a body or a not-modified answer.
 */
@Getter
public class FeedFetchException extends Exception {

    public enum FetchFailure {
        TIMEOUT,
        NETWORK,
        HTTP_STATUS,
        BLOCKED_HOST,
        TOO_MANY_REDIRECTS,
        INVALID_URL
    }

    private final FetchFailure failure;
    private final int statusCode;

    public FeedFetchException(FetchFailure failure, String message) {
        this(failure, 0, message, null);
    }

    public FeedFetchException(FetchFailure failure, String message, Throwable cause) {
        this(failure, 0, message, cause);
    }

    public FeedFetchException(FetchFailure failure, int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.failure = failure;
        this.statusCode = statusCode;
    }

    public static FeedFetchException httpStatus(int statusCode, String url) {
        return new FeedFetchException(FetchFailure.HTTP_STATUS, statusCode,
                "HTTP " + statusCode + " for " + url, null);
    }

    /**
     * Timeouts, transport failures, 408, 429 and 5xx responses are worth another attempt.
     */
    public boolean isRetryable() {
        switch (failure) {
            case TIMEOUT:
            case NETWORK:
                return true;
            case HTTP_STATUS:
                return statusCode == 408 || statusCode == 429 || statusCode >= 500;
            default:
                return false;
        }
    }
}
