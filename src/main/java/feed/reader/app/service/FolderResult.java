package feed.reader.app.service;

import feed.reader.app.entity.Folder;
import lombok.Value;

@Value
public class FolderResult {

    public enum Status {
        OK,
        INVALID_NAME,
        RESERVED_NAME,
        DUPLICATE_NAME,
        FOLDER_LIMIT_REACHED,
        NOT_FOUND
    }

    Status status;
    Folder folder;

    public static FolderResult ok(Folder folder) {
        return new FolderResult(Status.OK, folder);
    }

    public static FolderResult of(Status status) {
        return new FolderResult(status, null);
    }
}
