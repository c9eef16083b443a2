package feed.reader.app.service;

import feed.reader.app.entity.Feed;
import feed.reader.app.entity.FetchStatus;
import feed.reader.app.repository.FeedRepository;
import feed.reader.app.repository.UserRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;

/**
 * Refreshes every feed of an owner concurrently. Each feed runs as its own task and always
 * settles into a {@link FeedOutcome}; a failing feed records its error on the feed row and
 * never affects its siblings.
 * <p>
 * Per feed: conditional fetch with the cached validators, then either
 * <ul>
 *   <li>not modified: only fetch metadata is updated,</li>
 *   <li>updated: items are inserted, retention runs, then metadata and validators are saved,</li>
 *   <li>error: the classified error is stored on the feed.</li>
 * </ul>
 * Validators are saved last so an interrupted refresh is simply repeated next time.
 */
@Slf4j
@Service
public class FeedRefreshService {
    static final String NO_FEEDS_MESSAGE = "No feeds to refresh";

    private final FeedRepository feedRepository;
    private final UserRepository userRepository;
    private final FeedParser feedParser;
    private final FeedItemWriter feedItemWriter;
    private final RetentionService retentionService;
    private final FeedErrorClassifier errorClassifier;
    private final Executor feedRefreshExecutor;

    public FeedRefreshService(FeedRepository feedRepository,
                              UserRepository userRepository,
                              FeedParser feedParser,
                              FeedItemWriter feedItemWriter,
                              RetentionService retentionService,
                              FeedErrorClassifier errorClassifier,
                              @Qualifier("feedRefreshExecutor") Executor feedRefreshExecutor) {
        this.feedRepository = feedRepository;
        this.userRepository = userRepository;
        this.feedParser = feedParser;
        this.feedItemWriter = feedItemWriter;
        this.retentionService = retentionService;
        this.errorClassifier = errorClassifier;
        this.feedRefreshExecutor = feedRefreshExecutor;
    }

    /**
     * Refreshes all feeds of one owner.
     * @param ownerId The owner whose feeds are refreshed
     * @return One outcome per feed, in the order the feeds were created, plus the number of items pruned
     */
    public RefreshBatchResult refreshAllFeedsForOwner(String ownerId) {
        int retentionDeletedCount = retentionService.enforceForOwner(ownerId);

        if (!userRepository.existsById(ownerId)) {
            log.warn("Refresh requested for unknown owner {}", ownerId);
            return RefreshBatchResult.userNotFound(retentionDeletedCount);
        }

        List<Feed> feeds = feedRepository.findByOwnerIdOrderByCreatedAtAsc(ownerId);
        if (feeds.isEmpty()) {
            return RefreshBatchResult.ok(List.of(), retentionDeletedCount, NO_FEEDS_MESSAGE);
        }

        log.info("Refreshing {} feed(s) for owner {}", feeds.size(), ownerId);

        List<CompletableFuture<RefreshTaskResult>> futures = feeds.stream()
                .map(feed -> submit(ownerId, feed))
                .collect(Collectors.toList());

        // Wait for every feed; a task never completes exceptionally
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        List<FeedOutcome> outcomes = new ArrayList<>();
        for (CompletableFuture<RefreshTaskResult> future : futures) {
            RefreshTaskResult taskResult = future.join();
            outcomes.add(taskResult.outcome);
            retentionDeletedCount += taskResult.prunedCount;
        }

        long failed = outcomes.stream().filter(outcome -> !outcome.isSuccess()).count();
        log.info("Refresh finished for owner {}: {} succeeded, {} failed, {} item(s) pruned",
                ownerId, outcomes.size() - failed, failed, retentionDeletedCount);
        return RefreshBatchResult.ok(outcomes, retentionDeletedCount, null);
    }

    private CompletableFuture<RefreshTaskResult> submit(String ownerId, Feed feed) {
        try {
            return CompletableFuture.supplyAsync(() -> refreshFeed(ownerId, feed), feedRefreshExecutor)
                    .exceptionally(e -> failed(feed, e));
        } catch (RuntimeException e) {
            // Executor refused the task
            return CompletableFuture.completedFuture(failed(feed, e));
        }
    }

    private RefreshTaskResult failed(Feed feed, Throwable e) {
        Throwable cause = e.getCause() != null ? e.getCause() : e;
        log.error("Refresh task for feed {} failed unexpectedly: {}", feed.getId(), cause.getMessage(), cause);
        FeedError error = errorClassifier.classify(cause, FeedErrorClassifier.ErrorContext.REFRESH);
        recordError(feed, error, Instant.now());
        return new RefreshTaskResult(FeedOutcome.error(feed.getId(), feed.getUrl(), error), 0);
    }

    /**
     * Runs the fetch/parse/insert/prune sequence for one feed and records the outcome on it.
     */
    RefreshTaskResult refreshFeed(String ownerId, Feed feed) {
        Instant now = Instant.now();
        try {
            FeedParseResult parsed = feedParser.parseWithValidators(feed.getUrl(), feed.getHttpEtag(), feed.getHttpLastModified());

            if (parsed.isNotModified()) {
                markSuccess(feed, now);
                // Some origins omit validators on 304; keep what we had
                if (parsed.getEtag() != null) {
                    feed.setHttpEtag(parsed.getEtag());
                }
                if (parsed.getLastModified() != null) {
                    feed.setHttpLastModified(parsed.getLastModified());
                }
                feedRepository.save(feed);
                log.debug("Feed {} not modified", feed.getId());
                return new RefreshTaskResult(FeedOutcome.notModified(feed.getId(), feed.getUrl()), 0);
            }

            ParsedFeed parsedFeed = parsed.getFeed();
            int inserted = feedItemWriter.insertItems(feed.getId(), parsedFeed.getItems());
            int pruned = inserted > 0 ? retentionService.enforce(ownerId, feed.getId()) : 0;

            if (parsedFeed.getTitle() != null) {
                feed.setTitle(parsedFeed.getTitle());
            }
            if (parsedFeed.getDescription() != null) {
                feed.setDescription(parsedFeed.getDescription());
            }
            feed.setHttpEtag(parsed.getEtag());
            feed.setHttpLastModified(parsed.getLastModified());
            markSuccess(feed, now);
            feedRepository.save(feed);

            log.debug("Feed {} updated with {} new item(s)", feed.getId(), inserted);
            return new RefreshTaskResult(FeedOutcome.updated(feed.getId(), feed.getUrl(), inserted), pruned);
        } catch (Exception e) {
            FeedError error = errorClassifier.classify(e, FeedErrorClassifier.ErrorContext.REFRESH);
            log.warn("Refresh failed for feed {} ({}): {}", feed.getId(), error.getCode(), e.getMessage());
            recordError(feed, error, now);
            return new RefreshTaskResult(FeedOutcome.error(feed.getId(), feed.getUrl(), error), 0);
        }
    }

    private void markSuccess(Feed feed, Instant now) {
        feed.setLastFetchedAt(now);
        feed.setLastFetchStatus(FetchStatus.SUCCESS);
        feed.setLastFetchErrorCode(null);
        feed.setLastFetchErrorMessage(null);
        feed.setLastFetchErrorAt(null);
        feed.setUpdatedAt(now);
    }

    private void recordError(Feed feed, FeedError error, Instant now) {
        feed.setLastFetchedAt(now);
        feed.setLastFetchStatus(FetchStatus.ERROR);
        feed.setLastFetchErrorCode(error.getCode());
        feed.setLastFetchErrorMessage(error.getMessage());
        feed.setLastFetchErrorAt(now);
        feed.setUpdatedAt(now);
        try {
            feedRepository.save(feed);
        } catch (RuntimeException e) {
            // The outcome still reports the error even if it could not be persisted
            log.error("Could not record fetch error on feed {}: {}", feed.getId(), e.getMessage(), e);
        }
    }

    static final class RefreshTaskResult {
        final FeedOutcome outcome;
        final int prunedCount;

        RefreshTaskResult(FeedOutcome outcome, int prunedCount) {
            this.outcome = outcome;
            this.prunedCount = prunedCount;
        }
    }
}
