package feed.reader.app.service;

import feed.reader.app.entity.Feed;
import feed.reader.app.entity.FetchStatus;
import feed.reader.app.repository.FeedRepository;
import feed.reader.app.repository.UserRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Adding feeds: probing a URL for feeds and creating subscriptions with their first items.
 */
@Slf4j
@Service
public class FeedSubscriptionService {
    public static final String NO_FEED_FOUND_MESSAGE =
            "We couldn't find any feed at this URL. Contact the site owner and ask for the feed link.";

    private final FeedUrlNormalizer urlNormalizer;
    private final FeedParser feedParser;
    private final FeedDiscoveryService discoveryService;
    private final FeedItemWriter feedItemWriter;
    private final RetentionService retentionService;
    private final FolderMembershipService membershipService;
    private final FolderMembershipResolver membershipResolver;
    private final FeedErrorClassifier errorClassifier;
    private final FeedRepository feedRepository;
    private final UserRepository userRepository;
    private final long candidateTimeoutMs;

    public FeedSubscriptionService(FeedUrlNormalizer urlNormalizer,
                                   FeedParser feedParser,
                                   FeedDiscoveryService discoveryService,
                                   FeedItemWriter feedItemWriter,
                                   RetentionService retentionService,
                                   FolderMembershipService membershipService,
                                   FolderMembershipResolver membershipResolver,
                                   FeedErrorClassifier errorClassifier,
                                   FeedRepository feedRepository,
                                   UserRepository userRepository,
                                   @Value("${feeds.discovery.timeout-ms:7000}") long candidateTimeoutMs) {
        this.urlNormalizer = urlNormalizer;
        this.feedParser = feedParser;
        this.discoveryService = discoveryService;
        this.feedItemWriter = feedItemWriter;
        this.retentionService = retentionService;
        this.membershipService = membershipService;
        this.membershipResolver = membershipResolver;
        this.errorClassifier = errorClassifier;
        this.feedRepository = feedRepository;
        this.userRepository = userRepository;
        this.candidateTimeoutMs = candidateTimeoutMs;
    }

    /**
     * Lists the feeds reachable from a URL: the URL itself when it is a feed, then validated
     * discovery candidates. Each candidate says whether the owner already subscribes to it.
     */
    public DiscoverResult discover(String ownerId, String url) {
        Optional<String> normalized = urlNormalizer.normalize(url);
        if (normalized.isEmpty()) {
            return DiscoverResult.error(null, invalidUrlError());
        }
        String inputUrl = normalized.get();

        List<DiscoveredCandidate> candidates = new ArrayList<>();
        Set<String> seen = new HashSet<>();

        try {
            FeedParseResult direct = feedParser.parseWithMetadata(inputUrl);
            DiscoveredCandidate candidate = toCandidate(ownerId, inputUrl, DiscoveredCandidate.METHOD_DIRECT, direct);
            candidates.add(candidate);
            seen.add(candidate.getUrl());
        } catch (FeedFetchException | FeedParseException e) {
            FeedError error = errorClassifier.classify(e, FeedErrorClassifier.ErrorContext.CREATE);
            if (!FeedErrorClassifier.INVALID_XML.equals(error.getCode())) {
                log.debug("Discover for {} stopped: {}", inputUrl, e.getMessage());
                return DiscoverResult.error(inputUrl, error);
            }
        }

        FeedDiscoveryResult discovery = discoveryService.discoverFeedCandidates(inputUrl);
        for (String candidateUrl : discovery.getCandidates()) {
            if (seen.contains(candidateUrl)) {
                continue;
            }
            Optional<DiscoveredCandidate> validated = validateCandidate(ownerId, candidateUrl,
                    discovery.methodOf(candidateUrl).wireName());
            if (validated.isPresent() && seen.add(validated.get().getUrl())) {
                candidates.add(validated.get());
            }
        }

        if (candidates.isEmpty()) {
            return new DiscoverResult(DiscoverResult.Status.NO_FEED_FOUND, inputUrl, List.of(),
                    new FeedError(FeedErrorClassifier.INVALID_XML, NO_FEED_FOUND_MESSAGE));
        }
        return DiscoverResult.of(inputUrl, candidates);
    }

    /**
     * Subscribes the owner to a URL. When the URL is not a feed itself, the first discovered
     * candidate that parses is used instead.
     */
    public SubscribeResult subscribe(String ownerId, String url, Collection<String> folderIds) {
        Optional<String> normalized = urlNormalizer.normalize(url);
        if (normalized.isEmpty()) {
            return SubscribeResult.failed(SubscribeResult.Status.ERROR, invalidUrlError());
        }
        String inputUrl = normalized.get();

        List<String> requestedFolderIds = membershipResolver.normalize(folderIds);
        List<String> invalid = membershipService.findInvalidFolderIds(ownerId, requestedFolderIds);
        if (!invalid.isEmpty()) {
            return SubscribeResult.invalidFolderIds(invalid);
        }

        Optional<Feed> existing = feedRepository.findByOwnerIdAndUrl(ownerId, inputUrl);
        if (existing.isPresent()) {
            return duplicateOf(ownerId, existing.get());
        }

        FeedParseResult parsed;
        boolean discovered = false;
        try {
            parsed = feedParser.parseWithMetadata(inputUrl);
        } catch (FeedFetchException | FeedParseException e) {
            FeedError error = errorClassifier.classify(e, FeedErrorClassifier.ErrorContext.CREATE);
            if (!FeedErrorClassifier.INVALID_XML.equals(error.getCode())) {
                return SubscribeResult.failed(SubscribeResult.Status.ERROR, error);
            }
            parsed = null;
        }

        if (parsed == null) {
            for (String candidateUrl : discoveryService.discoverFeedCandidates(inputUrl).getCandidates()) {
                Optional<Feed> candidateDuplicate = feedRepository.findByOwnerIdAndUrl(ownerId, candidateUrl);
                if (candidateDuplicate.isPresent()) {
                    return duplicateOf(ownerId, candidateDuplicate.get());
                }
                try {
                    parsed = feedParser.parseWithMetadata(candidateUrl, candidateFetchOptions());
                    discovered = true;
                    break;
                } catch (FeedFetchException | FeedParseException e) {
                    log.debug("Candidate {} rejected: {}", candidateUrl, e.getMessage());
                }
            }
            if (parsed == null) {
                return SubscribeResult.failed(SubscribeResult.Status.NO_FEED_FOUND,
                        new FeedError(FeedErrorClassifier.INVALID_XML, NO_FEED_FOUND_MESSAGE));
            }
        }

        String resolvedUrl = urlNormalizer.normalize(parsed.getFinalUrl()).orElse(inputUrl);
        if (!resolvedUrl.equals(inputUrl)) {
            Optional<Feed> resolvedDuplicate = feedRepository.findByOwnerIdAndUrl(ownerId, resolvedUrl);
            if (resolvedDuplicate.isPresent()) {
                return duplicateOf(ownerId, resolvedDuplicate.get());
            }
        }

        CreatedFeed created;
        try {
            created = createFeedWithInitialItems(ownerId, resolvedUrl, parsed.getFeed(), requestedFolderIds,
                    parsed.getEtag(), parsed.getLastModified());
        } catch (DataIntegrityViolationException e) {
            // Lost a race against a concurrent subscribe of the same URL
            Optional<Feed> raced = feedRepository.findByOwnerIdAndUrl(ownerId, resolvedUrl);
            if (raced.isPresent()) {
                return duplicateOf(ownerId, raced.get());
            }
            throw e;
        }

        log.info("Owner {} subscribed to {} ({} item(s))", ownerId, resolvedUrl, created.getInsertedItemCount());
        return SubscribeResult.created(created.getFeed(),
                membershipService.resolveForFeed(ownerId, created.getFeed()),
                created.getInsertedItemCount(), discovered);
    }

    /**
     * Stores a new feed with the items of its first parse, then applies retention once so the feed
     * never starts above the cap, then records its folder memberships.
     */
    public CreatedFeed createFeedWithInitialItems(String ownerId, String url, ParsedFeed parsedFeed,
                                                  Collection<String> folderIds, String etag, String lastModified) {
        Instant now = Instant.now();
        Feed feed = new Feed();
        feed.setOwner(userRepository.getReferenceById(ownerId));
        feed.setUrl(url);
        feed.setTitle(parsedFeed.getTitle());
        feed.setDescription(parsedFeed.getDescription());
        feed.setLastFetchedAt(now);
        feed.setLastFetchStatus(FetchStatus.SUCCESS);
        feed.setHttpEtag(etag);
        feed.setHttpLastModified(lastModified);
        feed.setCreatedAt(now);
        feed.setUpdatedAt(now);
        Feed saved = feedRepository.save(feed);

        int inserted = feedItemWriter.insertItems(saved.getId(), parsedFeed.getItems());
        retentionService.enforce(ownerId, saved.getId());

        List<String> normalizedFolderIds = membershipResolver.normalize(folderIds);
        if (!normalizedFolderIds.isEmpty()) {
            membershipService.insertMemberships(ownerId, saved.getId(), normalizedFolderIds);
        }
        return new CreatedFeed(saved, inserted);
    }

    private Optional<DiscoveredCandidate> validateCandidate(String ownerId, String candidateUrl, String method) {
        try {
            FeedParseResult parsed = feedParser.parseWithMetadata(candidateUrl, candidateFetchOptions());
            String finalUrl = urlNormalizer.normalize(parsed.getFinalUrl()).orElse(candidateUrl);
            return Optional.of(toCandidate(ownerId, finalUrl, method, parsed));
        } catch (FeedFetchException | FeedParseException e) {
            log.debug("Candidate {} rejected: {}", candidateUrl, e.getMessage());
            return Optional.empty();
        }
    }

    private DiscoveredCandidate toCandidate(String ownerId, String url, String method, FeedParseResult parsed) {
        Optional<Feed> existing = feedRepository.findByOwnerIdAndUrl(ownerId, url);
        return new DiscoveredCandidate(url, parsed.getFeed().getTitle(), method,
                existing.isPresent(), existing.map(Feed::getId).orElse(null), parsed);
    }

    private SubscribeResult duplicateOf(String ownerId, Feed feed) {
        return SubscribeResult.duplicate(feed, membershipService.resolveForFeed(ownerId, feed));
    }

    private FetchOptions candidateFetchOptions() {
        return FetchOptions.builder()
                .timeoutMs(candidateTimeoutMs)
                .retries(0)
                .maxRedirects(5)
                .acceptHeader(FetchOptions.FEED_ACCEPT)
                .build();
    }

    private FeedError invalidUrlError() {
        return errorClassifier.classify(
                new FeedFetchException(FeedFetchException.FetchFailure.INVALID_URL, "Invalid URL"),
                FeedErrorClassifier.ErrorContext.CREATE);
    }
}
