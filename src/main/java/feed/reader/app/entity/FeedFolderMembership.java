package feed.reader.app.entity;

import jakarta.persistence.*;
import lombok.Data;

import java.time.Instant;

@Entity
@Table(name = "feed_folder_memberships", uniqueConstraints = {
        @UniqueConstraint(name = "uk_memberships_owner_feed_folder", columnNames = {"owner_id", "feed_id", "folder_id"})
})
@Data
public class FeedFolderMembership {
    @Id
    private String id;

    @Column(name = "owner_id", nullable = false)
    private String ownerId;

    @Column(name = "feed_id", nullable = false)
    private String feedId;

    @Column(name = "folder_id", nullable = false)
    private String folderId;

    @Column(nullable = false)
    private Instant createdAt;
}
