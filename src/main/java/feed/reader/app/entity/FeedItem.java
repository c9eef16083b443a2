package feed.reader.app.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * A stored entry of a feed. Rows are inserted through {@code FeedItemWriter}, so the two
 * unique constraints below are what keeps repeated refreshes from duplicating entries.
 */
@Entity
@Table(name = "feed_items", uniqueConstraints = {
        @UniqueConstraint(name = "uk_feed_items_feed_guid", columnNames = {"feed_id", "guid"}),
        @UniqueConstraint(name = "uk_feed_items_feed_fingerprint", columnNames = {"feed_id", "content_fingerprint"})
})
@Getter
@Setter
@ToString(exclude = {"feed", "content"})
@EqualsAndHashCode(exclude = "feed")
public class FeedItem {
    @Id
    private String id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "feed_id", nullable = false)
    private Feed feed;

    @Column(length = 2048)
    private String guid;

    @Column(name = "content_fingerprint", length = 64)
    private String contentFingerprint;

    @Column(columnDefinition = "TEXT")
    private String title;

    @Column(columnDefinition = "TEXT")
    private String link;

    @Column(columnDefinition = "TEXT")
    private String content;

    @Column(length = 512)
    private String author;

    private Instant publishedAt;
    private Instant readAt;

    @Column(nullable = false)
    private Instant createdAt;
    private Instant updatedAt;
}
