package feed.reader.app.service;

import feed.reader.app.dto.FeedView;
import feed.reader.app.entity.Feed;
import feed.reader.app.repository.FeedFolderMembershipRepository;
import feed.reader.app.repository.FeedItemRepository;
import feed.reader.app.repository.FeedRepository;
import feed.reader.app.repository.FolderRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;

/**
 * Subscription management: listing, renaming, unsubscribing and bulk moves of uncategorized feeds.
 */
@Slf4j
@Service
public class FeedService {
    static final int CUSTOM_TITLE_MAX_LENGTH = 255;

    private final FeedRepository feedRepository;
    private final FeedItemRepository feedItemRepository;
    private final FeedFolderMembershipRepository membershipRepository;
    private final FolderRepository folderRepository;
    private final FolderMembershipService membershipService;
    private final Executor feedRefreshExecutor;

    public FeedService(FeedRepository feedRepository,
                       FeedItemRepository feedItemRepository,
                       FeedFolderMembershipRepository membershipRepository,
                       FolderRepository folderRepository,
                       FolderMembershipService membershipService,
                       @Qualifier("feedRefreshExecutor") Executor feedRefreshExecutor) {
        this.feedRepository = feedRepository;
        this.feedItemRepository = feedItemRepository;
        this.membershipRepository = membershipRepository;
        this.folderRepository = folderRepository;
        this.membershipService = membershipService;
        this.feedRefreshExecutor = feedRefreshExecutor;
    }

    public List<FeedView> listFeeds(String ownerId) {
        List<Feed> feeds = feedRepository.findByOwnerIdOrderByCreatedAtAsc(ownerId);
        Map<String, List<String>> folderIds = membershipService.resolveForFeeds(ownerId, feeds);
        return feeds.stream()
                .map(feed -> FeedView.of(feed, folderIds.getOrDefault(feed.getId(), List.of())))
                .collect(Collectors.toList());
    }

    public Optional<FeedView> getFeed(String ownerId, String feedId) {
        return feedRepository.findByIdAndOwnerId(feedId, ownerId)
                .map(feed -> FeedView.of(feed, membershipService.resolveForFeed(ownerId, feed)));
    }

    /**
     * Sets or clears the user's title override.
     * @throws IllegalArgumentException if the title is longer than 255 characters
     */
    public Optional<FeedView> renameFeed(String ownerId, String feedId, String customTitle) {
        String trimmed = customTitle != null ? customTitle.trim() : "";
        if (trimmed.length() > CUSTOM_TITLE_MAX_LENGTH) {
            throw new IllegalArgumentException("Custom title must be at most " + CUSTOM_TITLE_MAX_LENGTH + " characters");
        }
        Optional<Feed> feedOpt = feedRepository.findByIdAndOwnerId(feedId, ownerId);
        if (feedOpt.isEmpty()) {
            return Optional.empty();
        }
        Feed feed = feedOpt.get();
        feed.setCustomTitle(trimmed.isEmpty() ? null : trimmed);
        feed.setUpdatedAt(Instant.now());
        Feed saved = feedRepository.save(feed);
        return Optional.of(FeedView.of(saved, membershipService.resolveForFeed(ownerId, saved)));
    }

    /**
     * Unsubscribes, removing the feed's memberships and items with it.
     * @return false when the owner has no such feed
     */
    public boolean deleteFeed(String ownerId, String feedId) {
        Optional<Feed> feed = feedRepository.findByIdAndOwnerId(feedId, ownerId);
        if (feed.isEmpty()) {
            return false;
        }
        deleteFeed(ownerId, feed.get());
        return true;
    }

    void deleteFeed(String ownerId, Feed feed) {
        membershipRepository.deleteAllForFeed(ownerId, feed.getId());
        feedItemRepository.deleteAllByFeedId(feed.getId());
        feedRepository.delete(feed);
        log.info("Owner {} unsubscribed from {}", ownerId, feed.getUrl());
    }

    /**
     * @return Number of feeds deleted
     */
    public int deleteUncategorizedFeeds(String ownerId) {
        List<Feed> uncategorized = findUncategorized(ownerId);
        for (Feed feed : uncategorized) {
            deleteFeed(ownerId, feed);
        }
        return uncategorized.size();
    }

    /**
     * Moves every feed without a folder into {@code folderId}. Feeds are moved independently;
     * one failure does not stop the others.
     */
    public MoveFeedsResult moveUncategorizedFeedsToFolder(String ownerId, String folderId) {
        if (folderId == null || folderRepository.findByIdAndOwnerId(folderId, ownerId).isEmpty()) {
            return MoveFeedsResult.folderNotFound();
        }
        List<Feed> uncategorized = findUncategorized(ownerId);

        List<CompletableFuture<Boolean>> futures = uncategorized.stream()
                .map(feed -> CompletableFuture
                        .supplyAsync(() -> membershipService.addFeedFolders(ownerId, feed.getId(), List.of(folderId)).getStatus()
                                == FolderAssignmentResult.Status.OK, feedRefreshExecutor)
                        .exceptionally(e -> {
                            log.warn("Could not move feed {} into folder {}: {}", feed.getId(), folderId, e.getMessage());
                            return false;
                        }))
                .collect(Collectors.toList());
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        int moved = (int) futures.stream().filter(CompletableFuture::join).count();
        return new MoveFeedsResult(MoveFeedsResult.Status.OK, uncategorized.size(), moved, uncategorized.size() - moved);
    }

    List<Feed> findUncategorized(String ownerId) {
        List<Feed> feeds = feedRepository.findByOwnerIdOrderByCreatedAtAsc(ownerId);
        Map<String, List<String>> folderIds = membershipService.resolveForFeeds(ownerId, feeds);
        return feeds.stream()
                .filter(feed -> folderIds.getOrDefault(feed.getId(), List.of()).isEmpty())
                .collect(Collectors.toList());
    }
}
