package feed.reader.app.dto;

import feed.reader.app.entity.FeedItem;
import lombok.Data;

import java.time.Instant;

@Data
public class FeedItemView {
    private String id;
    private String feedId;
    private String title;
    private String link;
    private String content;
    private String author;
    private Instant publishedAt;
    private Instant readAt;
    private Instant createdAt;

    public static FeedItemView of(FeedItem item, String feedId) {
        FeedItemView view = new FeedItemView();
        view.setId(item.getId());
        view.setFeedId(feedId);
        view.setTitle(item.getTitle());
        view.setLink(item.getLink());
        view.setContent(item.getContent());
        view.setAuthor(item.getAuthor());
        view.setPublishedAt(item.getPublishedAt());
        view.setReadAt(item.getReadAt());
        view.setCreatedAt(item.getCreatedAt());
        return view;
    }
}
