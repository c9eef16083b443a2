package feed.reader.app.controller;

import feed.reader.app.dto.FeedItemView;
import feed.reader.app.dto.MarkReadRequest;
import feed.reader.app.service.FeedItemService;
import feed.reader.app.service.OwnerService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api")
public class ItemController {
    private final OwnerService ownerService;
    private final FeedItemService feedItemService;

    public ItemController(OwnerService ownerService, FeedItemService feedItemService) {
        this.ownerService = ownerService;
        this.feedItemService = feedItemService;
    }

    @GetMapping("/feeds/{feedId}/items")
    public ResponseEntity<?> listItems(@PathVariable String feedId, Authentication authentication) {
        String ownerId = ownerService.ownerId(authentication);
        return feedItemService.listItems(ownerId, feedId)
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> FeedController.error(HttpStatus.NOT_FOUND, "Feed not found", "not_found"));
    }

    @PostMapping("/items/{id}/read")
    public ResponseEntity<?> markRead(@PathVariable String id, Authentication authentication) {
        FeedItemService.MarkReadResult result = feedItemService.markItemRead(ownerService.ownerId(authentication), id);
        if (result.getStatus() == FeedItemService.MarkReadStatus.NOT_FOUND) {
            return FeedController.error(HttpStatus.NOT_FOUND, "Item not found", "not_found");
        }
        return ResponseEntity.ok(result);
    }

    @PostMapping("/items/read")
    public ResponseEntity<?> markAllRead(@RequestBody MarkReadRequest request, Authentication authentication) {
        FeedItemService.ReadScope scope = request.getScope() != null ? request.getScope() : FeedItemService.ReadScope.ALL;
        if ((scope == FeedItemService.ReadScope.FEED || scope == FeedItemService.ReadScope.FOLDER)
                && (request.getId() == null || request.getId().isBlank())) {
            return FeedController.error(HttpStatus.BAD_REQUEST, "An id is required for this scope", "invalid_scope");
        }
        int marked = feedItemService.markAllRead(ownerService.ownerId(authentication), scope, request.getId());
        Map<String, Object> body = new HashMap<>();
        body.put("markedCount", marked);
        return ResponseEntity.ok(body);
    }
}
