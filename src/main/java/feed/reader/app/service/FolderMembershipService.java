package feed.reader.app.service;

import feed.reader.app.entity.Feed;
import feed.reader.app.entity.FeedFolderMembership;
import feed.reader.app.entity.Folder;
import feed.reader.app.repository.FeedFolderMembershipRepository;
import feed.reader.app.repository.FeedRepository;
import feed.reader.app.repository.FolderRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Reads and changes which folders a feed belongs to.
 * <p>
 * Replacing a feed's folders inserts the missing memberships before deleting stale ones, and
 * every membership insert is conflict-ignored, so a feed asked to be in at least one folder is
 * never observed in none. No surrounding transaction: each statement commits on its own.
 */
@Slf4j
@Service
public class FolderMembershipService {
    private static final String INSERT_MEMBERSHIP =
            "INSERT INTO feed_folder_memberships (id, owner_id, feed_id, folder_id, created_at) VALUES (?, ?, ?, ?, ?)";

    private final JdbcTemplate jdbcTemplate;
    private final FeedFolderMembershipRepository membershipRepository;
    private final FeedRepository feedRepository;
    private final FolderRepository folderRepository;
    private final FolderMembershipResolver resolver;

    public FolderMembershipService(JdbcTemplate jdbcTemplate,
                                   FeedFolderMembershipRepository membershipRepository,
                                   FeedRepository feedRepository,
                                   FolderRepository folderRepository,
                                   FolderMembershipResolver resolver) {
        this.jdbcTemplate = jdbcTemplate;
        this.membershipRepository = membershipRepository;
        this.feedRepository = feedRepository;
        this.folderRepository = folderRepository;
        this.resolver = resolver;
    }

    public List<String> resolveForFeed(String ownerId, Feed feed) {
        List<String> membershipFolderIds = membershipRepository.findByOwnerIdAndFeedId(ownerId, feed.getId()).stream()
                .map(FeedFolderMembership::getFolderId)
                .collect(Collectors.toList());
        return resolver.resolve(feed.getLegacyFolderId(), membershipFolderIds);
    }

    /**
     * Resolved folder ids for every given feed, keyed by feed id. Feeds without folders map to an empty list.
     */
    public Map<String, List<String>> resolveForFeeds(String ownerId, Collection<Feed> feeds) {
        Map<String, List<String>> membershipsByFeed = new HashMap<>();
        for (FeedFolderMembership membership : membershipRepository.findByOwnerId(ownerId)) {
            membershipsByFeed.computeIfAbsent(membership.getFeedId(), id -> new ArrayList<>()).add(membership.getFolderId());
        }
        Map<String, List<String>> resolved = new HashMap<>();
        for (Feed feed : feeds) {
            resolved.put(feed.getId(), resolver.resolve(feed.getLegacyFolderId(), membershipsByFeed.get(feed.getId())));
        }
        return resolved;
    }

    /**
     * Replaces the feed's folder set. An empty list removes the feed from every folder.
     */
    public FolderAssignmentResult setFeedFolders(String ownerId, String feedId, Collection<String> folderIds) {
        Optional<Feed> feedOpt = feedRepository.findByIdAndOwnerId(feedId, ownerId);
        if (feedOpt.isEmpty()) {
            return FolderAssignmentResult.feedNotFound();
        }
        Feed feed = feedOpt.get();

        List<String> desired = resolver.normalize(folderIds);
        List<String> invalid = findInvalidFolderIds(ownerId, desired);
        if (!invalid.isEmpty()) {
            log.debug("Rejecting folder assignment for feed {}: unknown folders {}", feedId, invalid);
            return FolderAssignmentResult.invalidFolderIds(invalid);
        }

        List<String> before = resolveForFeed(ownerId, feed);
        List<String> added = insertMemberships(ownerId, feedId, desired);

        // The membership rows now carry the full desired set
        if (feed.getLegacyFolderId() != null) {
            feed.setLegacyFolderId(null);
            feed.setUpdatedAt(Instant.now());
            feedRepository.save(feed);
        }

        if (desired.isEmpty()) {
            membershipRepository.deleteAllForFeed(ownerId, feedId);
        } else {
            membershipRepository.deleteStale(ownerId, feedId, desired);
        }

        List<String> newlyAdded = added.stream().filter(id -> !before.contains(id)).collect(Collectors.toList());
        return FolderAssignmentResult.ok(resolveForFeed(ownerId, feed), newlyAdded);
    }

    /**
     * Adds folders to the feed's current set. Insert-only.
     */
    public FolderAssignmentResult addFeedFolders(String ownerId, String feedId, Collection<String> folderIds) {
        Optional<Feed> feedOpt = feedRepository.findByIdAndOwnerId(feedId, ownerId);
        if (feedOpt.isEmpty()) {
            return FolderAssignmentResult.feedNotFound();
        }
        Feed feed = feedOpt.get();

        List<String> requested = resolver.normalize(folderIds);
        List<String> invalid = findInvalidFolderIds(ownerId, requested);
        if (!invalid.isEmpty()) {
            return FolderAssignmentResult.invalidFolderIds(invalid);
        }

        List<String> before = resolveForFeed(ownerId, feed);
        insertMemberships(ownerId, feedId, requested);
        List<String> added = requested.stream().filter(id -> !before.contains(id)).collect(Collectors.toList());
        return FolderAssignmentResult.ok(resolveForFeed(ownerId, feed), added);
    }

    /**
     * Inserts the given memberships, ignoring ones that already exist.
     * @return The folder ids whose membership row was created by this call
     */
    public List<String> insertMemberships(String ownerId, String feedId, Collection<String> folderIds) {
        OffsetDateTime now = OffsetDateTime.now(ZoneOffset.UTC);
        List<String> inserted = new ArrayList<>();
        for (String folderId : folderIds) {
            try {
                int rows = jdbcTemplate.update(INSERT_MEMBERSHIP,
                        UUID.randomUUID().toString(), ownerId, feedId, folderId, now);
                if (rows > 0) {
                    inserted.add(folderId);
                }
            } catch (DuplicateKeyException e) {
                log.debug("Feed {} already in folder {}", feedId, folderId);
            }
        }
        return inserted;
    }

    /**
     * @return Requested ids that are not folders of the owner, in request order
     */
    public List<String> findInvalidFolderIds(String ownerId, List<String> folderIds) {
        if (folderIds.isEmpty()) {
            return List.of();
        }
        Set<String> owned = new HashSet<>();
        for (Folder folder : folderRepository.findByOwnerIdAndIdIn(ownerId, folderIds)) {
            owned.add(folder.getId());
        }
        return folderIds.stream().filter(id -> !owned.contains(id)).collect(Collectors.toList());
    }
}
