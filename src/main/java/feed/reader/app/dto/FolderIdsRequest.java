package feed.reader.app.dto;

import lombok.Data;

import java.util.List;

@Data
public class FolderIdsRequest {
    private List<String> folderIds;
}
