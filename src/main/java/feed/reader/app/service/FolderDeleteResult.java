package feed.reader.app.service;

import lombok.Value;

@Value
public class FolderDeleteResult {

    public enum Status {
        OK,
        NOT_FOUND
    }

    Status status;
    FolderService.DeleteMode mode;
    int totalFeeds;
    int exclusiveFeeds;
    int crossListedFeeds;
    int unsubscribedFeeds;

    public static FolderDeleteResult notFound(FolderService.DeleteMode mode) {
        return new FolderDeleteResult(Status.NOT_FOUND, mode, 0, 0, 0, 0);
    }
}
