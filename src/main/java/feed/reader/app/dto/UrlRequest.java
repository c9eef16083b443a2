package feed.reader.app.dto;

import lombok.Data;

import java.util.List;

@Data
public class UrlRequest {
    private String url;
    private List<String> folderIds;
}
