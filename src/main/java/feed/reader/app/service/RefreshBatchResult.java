package feed.reader.app.service;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Value;

import java.util.List;

@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RefreshBatchResult {

    public enum Status {
        OK,
        USER_NOT_FOUND;

        @JsonValue
        public String wireName() {
            return name().toLowerCase();
        }
    }

    Status status;
    List<FeedOutcome> results;
    int retentionDeletedCount;
    String message;

    public static RefreshBatchResult userNotFound(int retentionDeletedCount) {
        return new RefreshBatchResult(Status.USER_NOT_FOUND, List.of(), retentionDeletedCount, null);
    }

    public static RefreshBatchResult ok(List<FeedOutcome> results, int retentionDeletedCount, String message) {
        return new RefreshBatchResult(Status.OK, results, retentionDeletedCount, message);
    }
}
