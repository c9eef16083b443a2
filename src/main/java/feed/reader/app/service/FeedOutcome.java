package feed.reader.app.service;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Value;

/**
 * Result of refreshing one feed within a batch.
 */
@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FeedOutcome {

    public enum Status {
        SUCCESS,
        ERROR;

        @JsonValue
        public String wireName() {
            return name().toLowerCase();
        }
    }

    public enum FetchState {
        UPDATED,
        NOT_MODIFIED;

        @JsonValue
        public String wireName() {
            return name().toLowerCase();
        }
    }

    String feedId;
    String feedUrl;
    int newItemCount;
    Status status;
    FetchState fetchState;
    String errorCode;
    String errorMessage;

    public static FeedOutcome updated(String feedId, String feedUrl, int newItemCount) {
        return new FeedOutcome(feedId, feedUrl, newItemCount, Status.SUCCESS, FetchState.UPDATED, null, null);
    }

    public static FeedOutcome notModified(String feedId, String feedUrl) {
        return new FeedOutcome(feedId, feedUrl, 0, Status.SUCCESS, FetchState.NOT_MODIFIED, null, null);
    }

    public static FeedOutcome error(String feedId, String feedUrl, FeedError error) {
        return new FeedOutcome(feedId, feedUrl, 0, Status.ERROR, null, error.getCode(), error.getMessage());
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }
}
