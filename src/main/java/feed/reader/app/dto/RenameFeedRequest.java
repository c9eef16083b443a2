package feed.reader.app.dto;

import lombok.Data;

/**
 * A blank or missing {@code customTitle} clears the override.
 */
@Data
public class RenameFeedRequest {
    private String customTitle;
}
