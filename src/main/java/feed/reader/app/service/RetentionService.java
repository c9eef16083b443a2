package feed.reader.app.service;

import feed.reader.app.repository.FeedItemRepository;
import feed.reader.app.repository.FeedRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Keeps at most {@code feeds.retention.max-items-per-feed} items per feed, evicting the oldest
 * by published time (creation time when unpublished).
 */
@Slf4j
@Service
public class RetentionService {
    private static final int DELETE_CHUNK_SIZE = 500;

    private final FeedItemRepository feedItemRepository;
    private final FeedRepository feedRepository;
    private final int maxItemsPerFeed;

    public RetentionService(FeedItemRepository feedItemRepository,
                            FeedRepository feedRepository,
                            @Value("${feeds.retention.max-items-per-feed:50}") int maxItemsPerFeed) {
        this.feedItemRepository = feedItemRepository;
        this.feedRepository = feedRepository;
        this.maxItemsPerFeed = maxItemsPerFeed;
    }

    /**
     * Prunes one feed of the owner. Runs only against committed rows, so call it after inserting.
     * @return Number of items deleted; 0 when the feed is within the cap or not owned by the owner
     */
    public int enforce(String ownerId, String feedId) {
        List<String> rankedIds = feedItemRepository.findRankedIds(ownerId, feedId);
        if (rankedIds.size() <= maxItemsPerFeed) {
            return 0;
        }
        List<String> excess = rankedIds.subList(maxItemsPerFeed, rankedIds.size());
        int deleted = 0;
        for (int from = 0; from < excess.size(); from += DELETE_CHUNK_SIZE) {
            List<String> chunk = excess.subList(from, Math.min(from + DELETE_CHUNK_SIZE, excess.size()));
            deleted += feedItemRepository.deleteByIdIn(chunk);
        }
        log.debug("Pruned {} item(s) from feed {}", deleted, feedId);
        return deleted;
    }

    public int enforceForOwner(String ownerId) {
        int deleted = 0;
        for (String feedId : feedRepository.findIdsByOwnerId(ownerId)) {
            deleted += enforce(ownerId, feedId);
        }
        if (deleted > 0) {
            log.info("Retention removed {} item(s) for owner {}", deleted, ownerId);
        }
        return deleted;
    }

    public int getMaxItemsPerFeed() {
        return maxItemsPerFeed;
    }
}
