package feed.reader.app.service;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.TreeSet;

/**
 * Computes a feed's effective folder set from its membership rows and the legacy single-folder
 * column. The result is trimmed, deduplicated and sorted, so resolving twice changes nothing.
 */
@Component
public class FolderMembershipResolver {

    public List<String> resolve(String legacyFolderId, Collection<String> membershipFolderIds) {
        List<String> candidates = new ArrayList<>();
        if (membershipFolderIds != null) {
            candidates.addAll(membershipFolderIds);
        }
        if (legacyFolderId != null) {
            candidates.add(legacyFolderId);
        }
        return normalize(candidates);
    }

    public List<String> normalize(Collection<String> folderIds) {
        TreeSet<String> unique = new TreeSet<>();
        if (folderIds != null) {
            for (String folderId : folderIds) {
                if (folderId == null) {
                    continue;
                }
                String trimmed = folderId.trim();
                if (!trimmed.isEmpty()) {
                    unique.add(trimmed);
                }
            }
        }
        return new ArrayList<>(unique);
    }
}
