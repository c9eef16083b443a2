package feed.reader.app.service;

import feed.reader.app.entity.Feed;
import lombok.Value;

import java.util.List;

@Value
public class SubscribeResult {

    public enum Status {
        CREATED,
        DUPLICATE,
        INVALID_FOLDER_IDS,
        NO_FEED_FOUND,
        ERROR
    }

    Status status;
    Feed feed;
    List<String> folderIds;
    int insertedItemCount;
    boolean discovered;
    List<String> invalidFolderIds;
    FeedError error;

    public static SubscribeResult created(Feed feed, List<String> folderIds, int insertedItemCount, boolean discovered) {
        return new SubscribeResult(Status.CREATED, feed, folderIds, insertedItemCount, discovered, List.of(), null);
    }

    public static SubscribeResult duplicate(Feed feed, List<String> folderIds) {
        return new SubscribeResult(Status.DUPLICATE, feed, folderIds, 0, false, List.of(), null);
    }

    public static SubscribeResult invalidFolderIds(List<String> invalidFolderIds) {
        return new SubscribeResult(Status.INVALID_FOLDER_IDS, null, List.of(), 0, false, invalidFolderIds, null);
    }

    public static SubscribeResult failed(Status status, FeedError error) {
        return new SubscribeResult(status, null, List.of(), 0, false, List.of(), error);
    }
}
