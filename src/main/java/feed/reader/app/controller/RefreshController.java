package feed.reader.app.controller;

import feed.reader.app.service.FeedRefreshService;
import feed.reader.app.service.OwnerService;
import feed.reader.app.service.RefreshBatchResult;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Manual trigger for refreshing every feed of the signed-in owner.
 */
@RestController
@RequestMapping("/api/refresh")
public class RefreshController {
    private final OwnerService ownerService;
    private final FeedRefreshService refreshService;

    public RefreshController(OwnerService ownerService, FeedRefreshService refreshService) {
        this.ownerService = ownerService;
        this.refreshService = refreshService;
    }

    @PostMapping
    public ResponseEntity<RefreshBatchResult> refresh(Authentication authentication) {
        RefreshBatchResult result = refreshService.refreshAllFeedsForOwner(ownerService.ownerId(authentication));
        if (result.getStatus() == RefreshBatchResult.Status.USER_NOT_FOUND) {
            return ResponseEntity.status(404).body(result);
        }
        return ResponseEntity.ok(result);
    }
}
