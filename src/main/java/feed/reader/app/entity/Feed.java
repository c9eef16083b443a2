package feed.reader.app.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "feeds", uniqueConstraints = {
        @UniqueConstraint(name = "uk_feeds_owner_url", columnNames = {"owner_id", "url"})
})
@Getter
@Setter
@ToString(exclude = "owner")
@EqualsAndHashCode(exclude = "owner")
public class Feed {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "owner_id", nullable = false)
    private User owner;

    @Column(nullable = false, length = 2048)
    private String url;

    @Column(length = 1000)
    private String title;

    private String customTitle;

    @Column(columnDefinition = "TEXT")
    private String description;

    /**
     * Single-folder assignment written by older clients. Still read as one more membership
     * candidate; cleared once the feed's folders are replaced through membership rows.
     */
    @Column(name = "folder_id")
    private String legacyFolderId;

    // Last fetch attempt
    private Instant lastFetchedAt;
    @Enumerated(EnumType.STRING)
    private FetchStatus lastFetchStatus;
    private String lastFetchErrorCode;
    @Column(length = 1000)
    private String lastFetchErrorMessage;
    private Instant lastFetchErrorAt;

    // Cached HTTP validators for conditional requests
    @Column(length = 1000)
    private String httpEtag;
    private String httpLastModified;

    @Column(nullable = false)
    private Instant createdAt;
    private Instant updatedAt;

    public String getDisplayTitle() {
        if (customTitle != null && !customTitle.isBlank()) {
            return customTitle;
        }
        return title != null ? title : url;
    }
}
