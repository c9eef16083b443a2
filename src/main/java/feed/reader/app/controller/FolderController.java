package feed.reader.app.controller;

import feed.reader.app.dto.NameRequest;
import feed.reader.app.entity.Folder;
import feed.reader.app.service.FolderDeleteResult;
import feed.reader.app.service.FolderResult;
import feed.reader.app.service.FolderService;
import feed.reader.app.service.OwnerService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Locale;

@RestController
@RequestMapping("/api/folders")
public class FolderController {
    private final OwnerService ownerService;
    private final FolderService folderService;

    public FolderController(OwnerService ownerService, FolderService folderService) {
        this.ownerService = ownerService;
        this.folderService = folderService;
    }

    @GetMapping
    public ResponseEntity<List<Folder>> listFolders(Authentication authentication) {
        return ResponseEntity.ok(folderService.listFolders(ownerService.ownerId(authentication)));
    }

    @PostMapping
    public ResponseEntity<?> createFolder(@RequestBody NameRequest request, Authentication authentication) {
        FolderResult result = folderService.createFolder(ownerService.ownerId(authentication), request.getName());
        if (result.getStatus() == FolderResult.Status.OK) {
            return ResponseEntity.status(HttpStatus.CREATED).body(result.getFolder());
        }
        return toError(result.getStatus());
    }

    @PatchMapping("/{id}")
    public ResponseEntity<?> renameFolder(@PathVariable String id, @RequestBody NameRequest request,
                                          Authentication authentication) {
        FolderResult result = folderService.renameFolder(ownerService.ownerId(authentication), id, request.getName());
        if (result.getStatus() == FolderResult.Status.OK) {
            return ResponseEntity.ok(result.getFolder());
        }
        return toError(result.getStatus());
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<?> deleteFolder(@PathVariable String id,
                                          @RequestParam(defaultValue = "remove_only") String mode,
                                          Authentication authentication) {
        FolderService.DeleteMode deleteMode;
        try {
            deleteMode = FolderService.DeleteMode.valueOf(mode.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return FeedController.error(HttpStatus.BAD_REQUEST, "Unknown delete mode: " + mode, "invalid_mode");
        }
        FolderDeleteResult result = folderService.deleteFolder(ownerService.ownerId(authentication), id, deleteMode);
        if (result.getStatus() == FolderDeleteResult.Status.NOT_FOUND) {
            return FeedController.error(HttpStatus.NOT_FOUND, "Folder not found", "not_found");
        }
        return ResponseEntity.ok(result);
    }

    private ResponseEntity<?> toError(FolderResult.Status status) {
        switch (status) {
            case NOT_FOUND:
                return FeedController.error(HttpStatus.NOT_FOUND, "Folder not found", "not_found");
            case DUPLICATE_NAME:
                return FeedController.error(HttpStatus.CONFLICT, "A folder with this name already exists.", "duplicate_name");
            case RESERVED_NAME:
                return FeedController.error(HttpStatus.BAD_REQUEST, "This folder name is reserved.", "reserved_name");
            case FOLDER_LIMIT_REACHED:
                return FeedController.error(HttpStatus.BAD_REQUEST, "You have reached the folder limit.", "folder_limit_reached");
            default:
                return FeedController.error(HttpStatus.BAD_REQUEST, "Folder names must be 1 to 255 characters.", "invalid_name");
        }
    }
}
