package feed.reader.app.repository;

import feed.reader.app.entity.FeedFolderMembership;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.List;

@Repository
public interface FeedFolderMembershipRepository extends JpaRepository<FeedFolderMembership, String> {
    List<FeedFolderMembership> findByOwnerIdAndFeedId(String ownerId, String feedId);
    List<FeedFolderMembership> findByOwnerId(String ownerId);
    List<FeedFolderMembership> findByOwnerIdAndFolderId(String ownerId, String folderId);

    @Modifying
    @Transactional
    @Query("DELETE FROM FeedFolderMembership m WHERE m.ownerId = :ownerId AND m.feedId = :feedId AND m.folderId NOT IN :keep")
    int deleteStale(@Param("ownerId") String ownerId, @Param("feedId") String feedId, @Param("keep") Collection<String> keepFolderIds);

    @Modifying
    @Transactional
    @Query("DELETE FROM FeedFolderMembership m WHERE m.ownerId = :ownerId AND m.feedId = :feedId")
    int deleteAllForFeed(@Param("ownerId") String ownerId, @Param("feedId") String feedId);

    @Modifying
    @Transactional
    @Query("DELETE FROM FeedFolderMembership m WHERE m.ownerId = :ownerId AND m.folderId = :folderId")
    int deleteAllForFolder(@Param("ownerId") String ownerId, @Param("folderId") String folderId);
}
