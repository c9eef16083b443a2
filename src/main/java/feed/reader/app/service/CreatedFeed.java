package feed.reader.app.service;

import feed.reader.app.entity.Feed;
import lombok.Value;

@Value
public class CreatedFeed {
    Feed feed;
    int insertedItemCount;
}
