package feed.reader.app.service;

import feed.reader.app.entity.Feed;
import feed.reader.app.entity.FetchStatus;
import feed.reader.app.entity.User;
import feed.reader.app.repository.FeedRepository;
import feed.reader.app.repository.UserRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class FeedSubscriptionServiceTest {

    private static final String OWNER_ID = "owner-1";
    private static final String FEED_URL = "https://example.com/feed.xml";

    @Mock
    private FeedParser feedParser;

    @Mock
    private FeedDiscoveryService discoveryService;

    @Mock
    private FeedItemWriter feedItemWriter;

    @Mock
    private RetentionService retentionService;

    @Mock
    private FolderMembershipService membershipService;

    @Mock
    private FeedRepository feedRepository;

    @Mock
    private UserRepository userRepository;

    private FeedSubscriptionService subscriptionService;

    private ParsedFeed parsedFeed;

    @BeforeEach
    void setUp() {
        subscriptionService = new FeedSubscriptionService(new FeedUrlNormalizer(), feedParser, discoveryService,
                feedItemWriter, retentionService, membershipService, new FolderMembershipResolver(),
                new FeedErrorClassifier(), feedRepository, userRepository, 7000);
        parsedFeed = new ParsedFeed("Example", "About", List.of(
                ParsedFeedItem.builder().guid("1").title("One").build(),
                ParsedFeedItem.builder().guid("2").title("Two").build()));
    }

    private void stubFeedCreation() {
        User owner = new User();
        owner.setId(OWNER_ID);
        when(userRepository.getReferenceById(OWNER_ID)).thenReturn(owner);
        when(feedRepository.save(any(Feed.class))).thenAnswer(invocation -> {
            Feed feed = invocation.getArgument(0);
            feed.setId("new-feed");
            return feed;
        });
    }

    private static Feed existingFeed(String id, String url) {
        Feed feed = new Feed();
        feed.setId(id);
        feed.setUrl(url);
        return feed;
    }

    @Test
    void subscribe_WithDirectFeed_ShouldCreateFeedThenItemsThenRetentionThenMemberships() throws Exception {
        // Given
        when(feedParser.parseWithMetadata(FEED_URL))
                .thenReturn(FeedParseResult.updated(parsedFeed, FetchResult.ok("<rss/>", "\"e1\"", "lm", FEED_URL)));
        stubFeedCreation();
        when(feedItemWriter.insertItems("new-feed", parsedFeed.getItems())).thenReturn(2);
        when(membershipService.resolveForFeed(eq(OWNER_ID), any(Feed.class))).thenReturn(List.of("f1"));

        // When
        SubscribeResult result = subscriptionService.subscribe(OWNER_ID, " example.com/feed.xml ", List.of("f1", " f1 "));

        // Then
        assertEquals(SubscribeResult.Status.CREATED, result.getStatus());
        assertEquals(2, result.getInsertedItemCount());
        assertFalse(result.isDiscovered());
        assertEquals(List.of("f1"), result.getFolderIds());

        Feed created = result.getFeed();
        assertEquals(FEED_URL, created.getUrl());
        assertEquals("Example", created.getTitle());
        assertEquals("\"e1\"", created.getHttpEtag());
        assertEquals(FetchStatus.SUCCESS, created.getLastFetchStatus());
        assertNull(created.getLegacyFolderId());

        InOrder inOrder = inOrder(feedRepository, feedItemWriter, retentionService, membershipService);
        inOrder.verify(feedRepository).save(any(Feed.class));
        inOrder.verify(feedItemWriter).insertItems("new-feed", parsedFeed.getItems());
        inOrder.verify(retentionService).enforce(OWNER_ID, "new-feed");
        inOrder.verify(membershipService).insertMemberships(OWNER_ID, "new-feed", List.of("f1"));
    }

    @Test
    void subscribe_WithExistingUrl_ShouldReturnDuplicateWithoutFetching() throws Exception {
        // Given
        Feed existing = existingFeed("feed-9", FEED_URL);
        when(feedRepository.findByOwnerIdAndUrl(OWNER_ID, FEED_URL)).thenReturn(Optional.of(existing));

        // When
        SubscribeResult result = subscriptionService.subscribe(OWNER_ID, FEED_URL, null);

        // Then
        assertEquals(SubscribeResult.Status.DUPLICATE, result.getStatus());
        assertSame(existing, result.getFeed());
        verifyNoInteractions(feedParser, feedItemWriter);
        verify(feedRepository, never()).save(any());
    }

    @Test
    void subscribe_WithUnknownFolder_ShouldRejectBeforeAnyWrite() {
        // Given
        when(membershipService.findInvalidFolderIds(OWNER_ID, List.of("bogus", "f1"))).thenReturn(List.of("bogus"));

        // When
        SubscribeResult result = subscriptionService.subscribe(OWNER_ID, FEED_URL, List.of("f1", "bogus"));

        // Then
        assertEquals(SubscribeResult.Status.INVALID_FOLDER_IDS, result.getStatus());
        assertEquals(List.of("bogus"), result.getInvalidFolderIds());
        verifyNoInteractions(feedParser, feedItemWriter);
        verify(feedRepository, never()).save(any());
    }

    @Test
    void subscribe_WithInvalidUrl_ShouldReturnInvalidUrlError() {
        SubscribeResult result = subscriptionService.subscribe(OWNER_ID, "ftp://example.com", null);

        assertEquals(SubscribeResult.Status.ERROR, result.getStatus());
        assertEquals("invalid_url", result.getError().getCode());
    }

    @Test
    void subscribe_WithSitePage_ShouldFallBackToFirstWorkingCandidate() throws Exception {
        // Given
        String siteUrl = "https://example.com/";
        when(feedParser.parseWithMetadata(siteUrl)).thenThrow(new FeedParseException("html"));
        FeedDiscoveryResult discovery = new FeedDiscoveryResult();
        discovery.add("https://example.com/broken.xml", FeedDiscoveryResult.DiscoveryMethod.HTML_ALTERNATE);
        discovery.add("https://example.com/feed", FeedDiscoveryResult.DiscoveryMethod.HEURISTIC_PATH);
        when(discoveryService.discoverFeedCandidates(siteUrl)).thenReturn(discovery);
        when(feedParser.parseWithMetadata(eq("https://example.com/broken.xml"), any(FetchOptions.class)))
                .thenThrow(FeedFetchException.httpStatus(404, "https://example.com/broken.xml"));
        when(feedParser.parseWithMetadata(eq("https://example.com/feed"), any(FetchOptions.class)))
                .thenReturn(FeedParseResult.updated(parsedFeed, FetchResult.ok("<rss/>", null, null, "https://example.com/feed")));
        stubFeedCreation();

        // When
        SubscribeResult result = subscriptionService.subscribe(OWNER_ID, "example.com", List.of());

        // Then
        assertEquals(SubscribeResult.Status.CREATED, result.getStatus());
        assertTrue(result.isDiscovered());
        assertEquals("https://example.com/feed", result.getFeed().getUrl());
        verify(membershipService, never()).insertMemberships(anyString(), anyString(), anyList());
    }

    @Test
    void subscribe_WhenDiscoveredCandidateIsAlreadySubscribed_ShouldReturnDuplicate() throws Exception {
        // Given
        String siteUrl = "https://example.com/";
        when(feedParser.parseWithMetadata(siteUrl)).thenThrow(new FeedParseException("html"));
        FeedDiscoveryResult discovery = new FeedDiscoveryResult();
        discovery.add("https://example.com/feed", FeedDiscoveryResult.DiscoveryMethod.HTML_ALTERNATE);
        when(discoveryService.discoverFeedCandidates(siteUrl)).thenReturn(discovery);
        when(feedRepository.findByOwnerIdAndUrl(eq(OWNER_ID), anyString())).thenReturn(Optional.empty());
        Feed existing = existingFeed("feed-3", "https://example.com/feed");
        when(feedRepository.findByOwnerIdAndUrl(OWNER_ID, "https://example.com/feed")).thenReturn(Optional.of(existing));

        // When
        SubscribeResult result = subscriptionService.subscribe(OWNER_ID, siteUrl, null);

        // Then
        assertEquals(SubscribeResult.Status.DUPLICATE, result.getStatus());
        assertEquals("feed-3", result.getFeed().getId());
    }

    @Test
    void subscribe_WhenNothingParses_ShouldReturnNoFeedFound() throws Exception {
        // Given
        when(feedParser.parseWithMetadata(FEED_URL)).thenThrow(new FeedParseException("html"));
        when(discoveryService.discoverFeedCandidates(FEED_URL)).thenReturn(FeedDiscoveryResult.empty());

        // When
        SubscribeResult result = subscriptionService.subscribe(OWNER_ID, FEED_URL, null);

        // Then
        assertEquals(SubscribeResult.Status.NO_FEED_FOUND, result.getStatus());
        assertEquals(FeedSubscriptionService.NO_FEED_FOUND_MESSAGE, result.getError().getMessage());
    }

    @Test
    void subscribe_WhenFetchTimesOut_ShouldReturnErrorWithoutDiscovery() throws Exception {
        // Given
        when(feedParser.parseWithMetadata(FEED_URL))
                .thenThrow(new FeedFetchException(FeedFetchException.FetchFailure.TIMEOUT, "slow"));

        // When
        SubscribeResult result = subscriptionService.subscribe(OWNER_ID, FEED_URL, null);

        // Then
        assertEquals(SubscribeResult.Status.ERROR, result.getStatus());
        assertEquals("timeout", result.getError().getCode());
        verifyNoInteractions(discoveryService);
    }

    @Test
    void subscribe_WhenRedirectLandsOnSubscribedFeed_ShouldReturnDuplicate() throws Exception {
        // Given
        when(feedParser.parseWithMetadata(FEED_URL))
                .thenReturn(FeedParseResult.updated(parsedFeed, FetchResult.ok("<rss/>", null, null, "https://example.com/rss")));
        when(feedRepository.findByOwnerIdAndUrl(eq(OWNER_ID), anyString())).thenReturn(Optional.empty());
        Feed existing = existingFeed("feed-4", "https://example.com/rss");
        when(feedRepository.findByOwnerIdAndUrl(OWNER_ID, "https://example.com/rss")).thenReturn(Optional.of(existing));

        // When
        SubscribeResult result = subscriptionService.subscribe(OWNER_ID, FEED_URL, null);

        // Then
        assertEquals(SubscribeResult.Status.DUPLICATE, result.getStatus());
        verify(feedRepository, never()).save(any());
    }

    @Test
    void discover_WithDirectFeed_ShouldReturnSingleCandidate() throws Exception {
        // Given
        when(feedParser.parseWithMetadata(FEED_URL))
                .thenReturn(FeedParseResult.updated(parsedFeed, FetchResult.ok("<rss/>", null, null, FEED_URL)));
        when(discoveryService.discoverFeedCandidates(FEED_URL)).thenReturn(FeedDiscoveryResult.empty());

        // When
        DiscoverResult result = subscriptionService.discover(OWNER_ID, FEED_URL);

        // Then
        assertEquals(DiscoverResult.Status.SINGLE, result.getStatus());
        assertEquals(1, result.getCandidates().size());
        assertEquals(DiscoveredCandidate.METHOD_DIRECT, result.getCandidates().get(0).getMethod());
        assertEquals("Example", result.getCandidates().get(0).getTitle());
    }

    @Test
    void discover_WithSitePage_ShouldValidateCandidatesAndFlagDuplicates() throws Exception {
        // Given
        String siteUrl = "https://example.com/";
        when(feedParser.parseWithMetadata(siteUrl)).thenThrow(new FeedParseException("html"));
        FeedDiscoveryResult discovery = new FeedDiscoveryResult();
        discovery.add("https://example.com/feed.xml", FeedDiscoveryResult.DiscoveryMethod.HTML_ALTERNATE);
        discovery.add("https://example.com/rss", FeedDiscoveryResult.DiscoveryMethod.HEURISTIC_PATH);
        discovery.add("https://example.com/atom.xml", FeedDiscoveryResult.DiscoveryMethod.HEURISTIC_PATH);
        when(discoveryService.discoverFeedCandidates(siteUrl)).thenReturn(discovery);
        when(feedParser.parseWithMetadata(eq("https://example.com/feed.xml"), any(FetchOptions.class)))
                .thenReturn(FeedParseResult.updated(parsedFeed, FetchResult.ok("<rss/>", null, null, "https://example.com/feed.xml")));
        when(feedParser.parseWithMetadata(eq("https://example.com/rss"), any(FetchOptions.class)))
                .thenReturn(FeedParseResult.updated(parsedFeed, FetchResult.ok("<rss/>", null, null, "https://example.com/rss")));
        when(feedParser.parseWithMetadata(eq("https://example.com/atom.xml"), any(FetchOptions.class)))
                .thenThrow(FeedFetchException.httpStatus(404, "https://example.com/atom.xml"));
        when(feedRepository.findByOwnerIdAndUrl(eq(OWNER_ID), anyString())).thenReturn(Optional.empty());
        when(feedRepository.findByOwnerIdAndUrl(OWNER_ID, "https://example.com/rss"))
                .thenReturn(Optional.of(existingFeed("feed-7", "https://example.com/rss")));

        // When
        DiscoverResult result = subscriptionService.discover(OWNER_ID, "example.com");

        // Then
        assertEquals(DiscoverResult.Status.SINGLE, result.getStatus());
        assertEquals(2, result.getCandidates().size());
        DiscoveredCandidate first = result.getCandidates().get(0);
        assertEquals("html_alternate", first.getMethod());
        assertFalse(first.isDuplicate());
        DiscoveredCandidate second = result.getCandidates().get(1);
        assertTrue(second.isDuplicate());
        assertEquals("feed-7", second.getExistingFeedId());
        verify(feedParser, never()).parseWithMetadata(eq("https://example.com/feed.xml"));
    }

    @Test
    void discover_WhenNothingFound_ShouldReturnNoFeedFound() throws Exception {
        // Given
        when(feedParser.parseWithMetadata(FEED_URL)).thenThrow(new FeedParseException("html"));
        when(discoveryService.discoverFeedCandidates(FEED_URL)).thenReturn(FeedDiscoveryResult.empty());

        // When
        DiscoverResult result = subscriptionService.discover(OWNER_ID, FEED_URL);

        // Then
        assertEquals(DiscoverResult.Status.NO_FEED_FOUND, result.getStatus());
        assertTrue(result.getCandidates().isEmpty());
    }

    @Test
    void discover_WhenHostUnreachable_ShouldStopWithError() throws Exception {
        // Given
        when(feedParser.parseWithMetadata(FEED_URL))
                .thenThrow(new FeedFetchException(FeedFetchException.FetchFailure.NETWORK, "refused"));

        // When
        DiscoverResult result = subscriptionService.discover(OWNER_ID, FEED_URL);

        // Then
        assertEquals(DiscoverResult.Status.ERROR, result.getStatus());
        assertEquals("network", result.getError().getCode());
        verifyNoInteractions(discoveryService);
    }
}
