package feed.reader.app.dto;

import feed.reader.app.entity.Feed;
import feed.reader.app.entity.FetchStatus;
import lombok.Data;

import java.time.Instant;
import java.util.List;

/**
 * API shape of a feed with its resolved folder ids.
 */
@Data
public class FeedView {
    private String id;
    private String url;
    private String title;
    private String customTitle;
    private String displayTitle;
    private String description;
    private List<String> folderIds;
    private Instant lastFetchedAt;
    private FetchStatus lastFetchStatus;
    private String lastFetchErrorCode;
    private String lastFetchErrorMessage;
    private Instant lastFetchErrorAt;
    private Instant createdAt;
    private Instant updatedAt;

    public static FeedView of(Feed feed, List<String> folderIds) {
        FeedView view = new FeedView();
        view.setId(feed.getId());
        view.setUrl(feed.getUrl());
        view.setTitle(feed.getTitle());
        view.setCustomTitle(feed.getCustomTitle());
        view.setDisplayTitle(feed.getDisplayTitle());
        view.setDescription(feed.getDescription());
        view.setFolderIds(folderIds);
        view.setLastFetchedAt(feed.getLastFetchedAt());
        view.setLastFetchStatus(feed.getLastFetchStatus());
        view.setLastFetchErrorCode(feed.getLastFetchErrorCode());
        view.setLastFetchErrorMessage(feed.getLastFetchErrorMessage());
        view.setLastFetchErrorAt(feed.getLastFetchErrorAt());
        view.setCreatedAt(feed.getCreatedAt());
        view.setUpdatedAt(feed.getUpdatedAt());
        return view;
    }
}
