package feed.reader.app.service;

import lombok.Value;

@Value
public class MoveFeedsResult {

    public enum Status {
        OK,
        FOLDER_NOT_FOUND
    }

    Status status;
    int totalFeeds;
    int movedFeeds;
    int failedFeeds;

    public static MoveFeedsResult folderNotFound() {
        return new MoveFeedsResult(Status.FOLDER_NOT_FOUND, 0, 0, 0);
    }
}
