package feed.reader.app.service;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Value;

import java.util.List;

@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DiscoverResult {

    public enum Status {
        SINGLE,
        MULTIPLE,
        DUPLICATE,
        NO_FEED_FOUND,
        ERROR
    }

    Status status;
    String normalizedInputUrl;
    List<DiscoveredCandidate> candidates;
    FeedError error;

    public static DiscoverResult error(String normalizedInputUrl, FeedError error) {
        return new DiscoverResult(Status.ERROR, normalizedInputUrl, List.of(), error);
    }

    public static DiscoverResult of(String normalizedInputUrl, List<DiscoveredCandidate> candidates) {
        long addable = candidates.stream().filter(candidate -> !candidate.isDuplicate()).count();
        Status status = addable == 0 ? Status.DUPLICATE : addable == 1 ? Status.SINGLE : Status.MULTIPLE;
        return new DiscoverResult(status, normalizedInputUrl, candidates, null);
    }
}
