package feed.reader.app.controller;

import feed.reader.app.dto.FeedView;
import feed.reader.app.dto.FolderIdsRequest;
import feed.reader.app.dto.MoveFeedsRequest;
import feed.reader.app.dto.RenameFeedRequest;
import feed.reader.app.dto.UrlRequest;
import feed.reader.app.service.DiscoverResult;
import feed.reader.app.service.FeedService;
import feed.reader.app.service.FeedSubscriptionService;
import feed.reader.app.service.FolderAssignmentResult;
import feed.reader.app.service.FolderMembershipService;
import feed.reader.app.service.MoveFeedsResult;
import feed.reader.app.service.OwnerService;
import feed.reader.app.service.SubscribeResult;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Subscriptions: discovery, subscribe, listing, renaming, folder assignment and unsubscribe.
 */
@RestController
@RequestMapping("/api/feeds")
public class FeedController {
    private final OwnerService ownerService;
    private final FeedSubscriptionService subscriptionService;
    private final FeedService feedService;
    private final FolderMembershipService membershipService;

    public FeedController(OwnerService ownerService,
                          FeedSubscriptionService subscriptionService,
                          FeedService feedService,
                          FolderMembershipService membershipService) {
        this.ownerService = ownerService;
        this.subscriptionService = subscriptionService;
        this.feedService = feedService;
        this.membershipService = membershipService;
    }

    @PostMapping("/discover")
    public ResponseEntity<?> discover(@RequestBody UrlRequest request, Authentication authentication) {
        String ownerId = ownerService.ownerId(authentication);
        DiscoverResult result = subscriptionService.discover(ownerId, request.getUrl());
        if (result.getStatus() == DiscoverResult.Status.ERROR || result.getStatus() == DiscoverResult.Status.NO_FEED_FOUND) {
            return error(HttpStatus.BAD_REQUEST, result.getError().getMessage(), result.getError().getCode());
        }
        return ResponseEntity.ok(result);
    }

    @PostMapping
    public ResponseEntity<?> subscribe(@RequestBody UrlRequest request, Authentication authentication) {
        String ownerId = ownerService.ownerId(authentication);
        SubscribeResult result = subscriptionService.subscribe(ownerId, request.getUrl(), request.getFolderIds());

        Map<String, Object> body = new HashMap<>();
        switch (result.getStatus()) {
            case CREATED:
                body.put("feed", FeedView.of(result.getFeed(), result.getFolderIds()));
                body.put("insertedItemCount", result.getInsertedItemCount());
                body.put("duplicate", false);
                if (result.isDiscovered()) {
                    body.put("message", "Feed found automatically and added.");
                }
                return ResponseEntity.status(HttpStatus.CREATED).body(body);
            case DUPLICATE:
                body.put("feed", FeedView.of(result.getFeed(), result.getFolderIds()));
                body.put("duplicate", true);
                body.put("message", "This feed is already in your library.");
                return ResponseEntity.status(HttpStatus.CONFLICT).body(body);
            case INVALID_FOLDER_IDS:
                body.put("error", "One or more selected folders could not be found.");
                body.put("code", "invalid_folder_ids");
                body.put("invalidFolderIds", result.getInvalidFolderIds());
                return ResponseEntity.badRequest().body(body);
            default:
                return error(HttpStatus.BAD_REQUEST, result.getError().getMessage(), result.getError().getCode());
        }
    }

    @GetMapping
    public ResponseEntity<List<FeedView>> listFeeds(Authentication authentication) {
        return ResponseEntity.ok(feedService.listFeeds(ownerService.ownerId(authentication)));
    }

    @PatchMapping("/{id}")
    public ResponseEntity<?> renameFeed(@PathVariable String id, @RequestBody RenameFeedRequest request,
                                        Authentication authentication) {
        String ownerId = ownerService.ownerId(authentication);
        try {
            return feedService.renameFeed(ownerId, id, request.getCustomTitle())
                    .<ResponseEntity<?>>map(ResponseEntity::ok)
                    .orElseGet(() -> error(HttpStatus.NOT_FOUND, "Feed not found", "not_found"));
        } catch (IllegalArgumentException e) {
            return error(HttpStatus.BAD_REQUEST, e.getMessage(), "invalid_title");
        }
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<?> deleteFeed(@PathVariable String id, Authentication authentication) {
        if (!feedService.deleteFeed(ownerService.ownerId(authentication), id)) {
            return error(HttpStatus.NOT_FOUND, "Feed not found", "not_found");
        }
        return ResponseEntity.noContent().build();
    }

    @PutMapping("/{id}/folders")
    public ResponseEntity<?> setFolders(@PathVariable String id, @RequestBody FolderIdsRequest request,
                                        Authentication authentication) {
        String ownerId = ownerService.ownerId(authentication);
        return toResponse(membershipService.setFeedFolders(ownerId, id, request.getFolderIds()));
    }

    @PostMapping("/{id}/folders")
    public ResponseEntity<?> addFolders(@PathVariable String id, @RequestBody FolderIdsRequest request,
                                        Authentication authentication) {
        String ownerId = ownerService.ownerId(authentication);
        return toResponse(membershipService.addFeedFolders(ownerId, id, request.getFolderIds()));
    }

    @DeleteMapping("/uncategorized")
    public ResponseEntity<Map<String, Object>> deleteUncategorized(Authentication authentication) {
        int deleted = feedService.deleteUncategorizedFeeds(ownerService.ownerId(authentication));
        Map<String, Object> body = new HashMap<>();
        body.put("deletedFeedCount", deleted);
        return ResponseEntity.ok(body);
    }

    @PostMapping("/uncategorized/move")
    public ResponseEntity<?> moveUncategorized(@RequestBody MoveFeedsRequest request, Authentication authentication) {
        MoveFeedsResult result = feedService.moveUncategorizedFeedsToFolder(
                ownerService.ownerId(authentication), request.getFolderId());
        if (result.getStatus() == MoveFeedsResult.Status.FOLDER_NOT_FOUND) {
            return error(HttpStatus.NOT_FOUND, "Folder not found", "not_found");
        }
        return ResponseEntity.ok(result);
    }

    private ResponseEntity<?> toResponse(FolderAssignmentResult result) {
        switch (result.getStatus()) {
            case FEED_NOT_FOUND:
                return error(HttpStatus.NOT_FOUND, "Feed not found", "not_found");
            case INVALID_FOLDER_IDS:
                Map<String, Object> body = new HashMap<>();
                body.put("error", "One or more selected folders could not be found.");
                body.put("code", "invalid_folder_ids");
                body.put("invalidFolderIds", result.getInvalidFolderIds());
                return ResponseEntity.badRequest().body(body);
            default:
                Map<String, Object> ok = new HashMap<>();
                ok.put("folderIds", result.getFolderIds());
                ok.put("addedFolderIds", result.getAddedFolderIds());
                return ResponseEntity.ok(ok);
        }
    }

    static ResponseEntity<?> error(HttpStatus status, String message, String code) {
        Map<String, Object> body = new HashMap<>();
        body.put("error", message);
        body.put("code", code);
        return ResponseEntity.status(status).body(body);
    }
}
