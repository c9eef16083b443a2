package feed.reader.app.service;

import lombok.Value;

import java.util.List;

@Value
public class FolderAssignmentResult {

    public enum Status {
        OK,
        FEED_NOT_FOUND,
        INVALID_FOLDER_IDS
    }

    Status status;
    List<String> folderIds;
    List<String> addedFolderIds;
    List<String> invalidFolderIds;

    public static FolderAssignmentResult ok(List<String> folderIds, List<String> addedFolderIds) {
        return new FolderAssignmentResult(Status.OK, folderIds, addedFolderIds, List.of());
    }

    public static FolderAssignmentResult feedNotFound() {
        return new FolderAssignmentResult(Status.FEED_NOT_FOUND, List.of(), List.of(), List.of());
    }

    public static FolderAssignmentResult invalidFolderIds(List<String> invalidFolderIds) {
        return new FolderAssignmentResult(Status.INVALID_FOLDER_IDS, List.of(), List.of(), invalidFolderIds);
    }
}
