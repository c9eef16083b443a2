package feed.reader.app.service;

import com.fasterxml.jackson.annotation.JsonValue;
import feed.reader.app.dto.FeedItemView;
import feed.reader.app.entity.Feed;
import feed.reader.app.entity.FeedItem;
import feed.reader.app.repository.FeedItemRepository;
import feed.reader.app.repository.FeedRepository;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

@Slf4j
@Service
public class FeedItemService {

    public enum ReadScope {
        ALL,
        FEED,
        FOLDER,
        UNCATEGORIZED;

        @JsonValue
        public String wireName() {
            return name().toLowerCase();
        }
    }

    public enum MarkReadStatus {
        NOT_FOUND,
        ALREADY_READ,
        MARKED
    }

    @Value
    public static class MarkReadResult {
        MarkReadStatus status;
        String itemId;
        Instant readAt;
    }

    private final FeedItemRepository feedItemRepository;
    private final FeedRepository feedRepository;
    private final RetentionService retentionService;
    private final FolderMembershipService membershipService;

    public FeedItemService(FeedItemRepository feedItemRepository,
                           FeedRepository feedRepository,
                           RetentionService retentionService,
                           FolderMembershipService membershipService) {
        this.feedItemRepository = feedItemRepository;
        this.feedRepository = feedRepository;
        this.retentionService = retentionService;
        this.membershipService = membershipService;
    }

    /**
     * Items of one feed, newest first. Prunes the feed first so readers never page through
     * more than the retention cap.
     */
    public Optional<List<FeedItemView>> listItems(String ownerId, String feedId) {
        if (feedRepository.findByIdAndOwnerId(feedId, ownerId).isEmpty()) {
            return Optional.empty();
        }
        retentionService.enforce(ownerId, feedId);
        return Optional.of(feedItemRepository.findNewestFirst(ownerId, feedId).stream()
                .map(item -> FeedItemView.of(item, feedId))
                .collect(Collectors.toList()));
    }

    public MarkReadResult markItemRead(String ownerId, String itemId) {
        Optional<FeedItem> itemOpt = feedItemRepository.findByIdAndOwnerId(itemId, ownerId);
        if (itemOpt.isEmpty()) {
            return new MarkReadResult(MarkReadStatus.NOT_FOUND, itemId, null);
        }
        FeedItem item = itemOpt.get();
        if (item.getReadAt() != null) {
            return new MarkReadResult(MarkReadStatus.ALREADY_READ, item.getId(), item.getReadAt());
        }
        Instant now = Instant.now();
        item.setReadAt(now);
        item.setUpdatedAt(now);
        feedItemRepository.save(item);
        return new MarkReadResult(MarkReadStatus.MARKED, item.getId(), now);
    }

    /**
     * Marks every unread item in the scope as read.
     * @param scopeId Feed id for {@code FEED}, folder id for {@code FOLDER}, ignored otherwise
     * @return Number of items marked
     */
    public int markAllRead(String ownerId, ReadScope scope, String scopeId) {
        List<Feed> feeds = feedRepository.findByOwnerIdOrderByCreatedAtAsc(ownerId);
        List<String> feedIds;
        switch (scope) {
            case FEED:
                feedIds = feeds.stream().map(Feed::getId).filter(id -> id.equals(scopeId)).collect(Collectors.toList());
                break;
            case FOLDER:
            case UNCATEGORIZED:
                Map<String, List<String>> folderIds = membershipService.resolveForFeeds(ownerId, feeds);
                feedIds = feeds.stream()
                        .filter(feed -> {
                            List<String> assigned = folderIds.getOrDefault(feed.getId(), List.of());
                            return scope == ReadScope.FOLDER ? assigned.contains(scopeId) : assigned.isEmpty();
                        })
                        .map(Feed::getId)
                        .collect(Collectors.toList());
                break;
            default:
                feedIds = feeds.stream().map(Feed::getId).collect(Collectors.toList());
        }
        if (feedIds.isEmpty()) {
            return 0;
        }
        int marked = feedItemRepository.markUnreadAsRead(feedIds, Instant.now());
        log.debug("Marked {} item(s) read for owner {} in scope {}", marked, ownerId, scope);
        return marked;
    }
}
