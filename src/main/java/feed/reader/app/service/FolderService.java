package feed.reader.app.service;

import com.fasterxml.jackson.annotation.JsonValue;
import feed.reader.app.entity.Feed;
import feed.reader.app.entity.Folder;
import feed.reader.app.repository.FeedFolderMembershipRepository;
import feed.reader.app.repository.FeedRepository;
import feed.reader.app.repository.FolderRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

@Slf4j
@Service
public class FolderService {
    static final int FOLDER_NAME_MAX_LENGTH = 255;
    static final Set<String> RESERVED_NAMES = Set.of("all feeds", "saved", "uncategorized");

    public enum DeleteMode {
        REMOVE_ONLY,
        REMOVE_AND_UNSUBSCRIBE_EXCLUSIVE;

        @JsonValue
        public String wireName() {
            return name().toLowerCase();
        }
    }

    private final FolderRepository folderRepository;
    private final FeedRepository feedRepository;
    private final FeedFolderMembershipRepository membershipRepository;
    private final FolderMembershipService membershipService;
    private final FeedService feedService;
    private final int maxFoldersPerOwner;

    public FolderService(FolderRepository folderRepository,
                         FeedRepository feedRepository,
                         FeedFolderMembershipRepository membershipRepository,
                         FolderMembershipService membershipService,
                         FeedService feedService,
                         @Value("${feeds.folders.max-per-owner:50}") int maxFoldersPerOwner) {
        this.folderRepository = folderRepository;
        this.feedRepository = feedRepository;
        this.membershipRepository = membershipRepository;
        this.membershipService = membershipService;
        this.feedService = feedService;
        this.maxFoldersPerOwner = maxFoldersPerOwner;
    }

    public List<Folder> listFolders(String ownerId) {
        return folderRepository.findByOwnerIdOrderByNameAsc(ownerId);
    }

    public FolderResult createFolder(String ownerId, String name) {
        String trimmed = name != null ? name.trim() : "";
        Optional<FolderResult.Status> invalid = validateName(trimmed);
        if (invalid.isPresent()) {
            return FolderResult.of(invalid.get());
        }
        if (folderRepository.countByOwnerId(ownerId) >= maxFoldersPerOwner) {
            return FolderResult.of(FolderResult.Status.FOLDER_LIMIT_REACHED);
        }
        if (findSameName(ownerId, trimmed, null).isPresent()) {
            return FolderResult.of(FolderResult.Status.DUPLICATE_NAME);
        }

        Instant now = Instant.now();
        Folder folder = new Folder();
        folder.setOwnerId(ownerId);
        folder.setName(trimmed);
        folder.setCreatedAt(now);
        folder.setUpdatedAt(now);
        try {
            return FolderResult.ok(folderRepository.save(folder));
        } catch (DataIntegrityViolationException e) {
            log.warn("Could not create folder {} for owner {}: {}", trimmed, ownerId, e.getMessage());
            return FolderResult.of(FolderResult.Status.DUPLICATE_NAME);
        }
    }

    public FolderResult renameFolder(String ownerId, String folderId, String name) {
        String trimmed = name != null ? name.trim() : "";
        Optional<FolderResult.Status> invalid = validateName(trimmed);
        if (invalid.isPresent()) {
            return FolderResult.of(invalid.get());
        }
        Optional<Folder> folderOpt = folderRepository.findByIdAndOwnerId(folderId, ownerId);
        if (folderOpt.isEmpty()) {
            return FolderResult.of(FolderResult.Status.NOT_FOUND);
        }
        if (findSameName(ownerId, trimmed, folderId).isPresent()) {
            return FolderResult.of(FolderResult.Status.DUPLICATE_NAME);
        }
        Folder folder = folderOpt.get();
        folder.setName(trimmed);
        folder.setUpdatedAt(Instant.now());
        return FolderResult.ok(folderRepository.save(folder));
    }

    /**
     * Deletes a folder. With {@link DeleteMode#REMOVE_AND_UNSUBSCRIBE_EXCLUSIVE}, feeds whose only
     * folder is this one are unsubscribed; feeds also filed elsewhere stay.
     */
    public FolderDeleteResult deleteFolder(String ownerId, String folderId, DeleteMode mode) {
        Optional<Folder> folderOpt = folderRepository.findByIdAndOwnerId(folderId, ownerId);
        if (folderOpt.isEmpty()) {
            return FolderDeleteResult.notFound(mode);
        }

        List<Feed> feeds = feedRepository.findByOwnerIdOrderByCreatedAtAsc(ownerId);
        Map<String, List<String>> folderIds = membershipService.resolveForFeeds(ownerId, feeds);
        List<Feed> exclusive = new ArrayList<>();
        int crossListed = 0;
        for (Feed feed : feeds) {
            List<String> assigned = folderIds.getOrDefault(feed.getId(), List.of());
            if (!assigned.contains(folderId)) {
                continue;
            }
            if (assigned.size() <= 1) {
                exclusive.add(feed);
            } else {
                crossListed++;
            }
        }

        int unsubscribed = 0;
        if (mode == DeleteMode.REMOVE_AND_UNSUBSCRIBE_EXCLUSIVE) {
            for (Feed feed : exclusive) {
                feedService.deleteFeed(ownerId, feed);
                unsubscribed++;
            }
        }

        membershipRepository.deleteAllForFolder(ownerId, folderId);
        feedRepository.clearLegacyFolder(ownerId, folderId);
        folderRepository.delete(folderOpt.get());
        log.info("Owner {} deleted folder {} ({}), {} feed(s) unsubscribed", ownerId, folderId, mode, unsubscribed);

        return new FolderDeleteResult(FolderDeleteResult.Status.OK, mode,
                exclusive.size() + crossListed, exclusive.size(), crossListed, unsubscribed);
    }

    private Optional<FolderResult.Status> validateName(String trimmed) {
        if (trimmed.isEmpty() || trimmed.length() > FOLDER_NAME_MAX_LENGTH) {
            return Optional.of(FolderResult.Status.INVALID_NAME);
        }
        if (RESERVED_NAMES.contains(trimmed.toLowerCase(Locale.ROOT))) {
            return Optional.of(FolderResult.Status.RESERVED_NAME);
        }
        return Optional.empty();
    }

    private Optional<Folder> findSameName(String ownerId, String name, String excludeFolderId) {
        String normalized = name.toLowerCase(Locale.ROOT);
        return folderRepository.findByOwnerIdOrderByNameAsc(ownerId).stream()
                .filter(folder -> excludeFolderId == null || !folder.getId().equals(excludeFolderId))
                .filter(folder -> folder.getName().trim().toLowerCase(Locale.ROOT).equals(normalized))
                .findFirst();
    }
}
