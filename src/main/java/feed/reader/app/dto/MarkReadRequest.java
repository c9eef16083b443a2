package feed.reader.app.dto;

import feed.reader.app.service.FeedItemService;
import lombok.Data;

@Data
public class MarkReadRequest {
    private FeedItemService.ReadScope scope;
    private String id;
}
