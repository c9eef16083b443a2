package feed.reader.app.dto;

import lombok.Data;

@Data
public class MoveFeedsRequest {
    private String folderId;
}
