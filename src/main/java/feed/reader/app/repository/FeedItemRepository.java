package feed.reader.app.repository;

import feed.reader.app.entity.FeedItem;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface FeedItemRepository extends JpaRepository<FeedItem, String> {

    // Newest first: published time, falling back to creation time, id as tie-breaker
    @Query("SELECT i.id FROM FeedItem i WHERE i.feed.id = :feedId AND i.feed.owner.id = :ownerId " +
           "ORDER BY COALESCE(i.publishedAt, i.createdAt) DESC, i.id DESC")
    List<String> findRankedIds(@Param("ownerId") String ownerId, @Param("feedId") String feedId);

    @Query("SELECT i FROM FeedItem i WHERE i.feed.id = :feedId AND i.feed.owner.id = :ownerId " +
           "ORDER BY COALESCE(i.publishedAt, i.createdAt) DESC, i.id DESC")
    List<FeedItem> findNewestFirst(@Param("ownerId") String ownerId, @Param("feedId") String feedId);

    @Query("SELECT i FROM FeedItem i JOIN FETCH i.feed f WHERE i.id = :id AND f.owner.id = :ownerId")
    Optional<FeedItem> findByIdAndOwnerId(@Param("id") String id, @Param("ownerId") String ownerId);

    long countByFeedId(String feedId);

    @Modifying
    @Transactional
    @Query("DELETE FROM FeedItem i WHERE i.id IN :ids")
    int deleteByIdIn(@Param("ids") Collection<String> ids);

    @Modifying
    @Transactional
    @Query("DELETE FROM FeedItem i WHERE i.feed.id = :feedId")
    int deleteAllByFeedId(@Param("feedId") String feedId);

    @Modifying
    @Transactional
    @Query("UPDATE FeedItem i SET i.readAt = :now, i.updatedAt = :now WHERE i.feed.id IN :feedIds AND i.readAt IS NULL")
    int markUnreadAsRead(@Param("feedIds") Collection<String> feedIds, @Param("now") Instant now);
}
