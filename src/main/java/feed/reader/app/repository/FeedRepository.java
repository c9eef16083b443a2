package feed.reader.app.repository;

import feed.reader.app.entity.Feed;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

@Repository
public interface FeedRepository extends JpaRepository<Feed, String> {
    List<Feed> findByOwnerIdOrderByCreatedAtAsc(String ownerId);
    Optional<Feed> findByIdAndOwnerId(String id, String ownerId);
    Optional<Feed> findByOwnerIdAndUrl(String ownerId, String url);

    @Query("SELECT f.id FROM Feed f WHERE f.owner.id = :ownerId")
    List<String> findIdsByOwnerId(@Param("ownerId") String ownerId);

    @Modifying
    @Transactional
    @Query("UPDATE Feed f SET f.legacyFolderId = NULL WHERE f.owner.id = :ownerId AND f.legacyFolderId = :folderId")
    int clearLegacyFolder(@Param("ownerId") String ownerId, @Param("folderId") String folderId);
}
