package feed.reader.app.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Inserts parsed items with insert-or-ignore semantics. Each row is its own statement, so an
 * identity conflict only skips that row; uniqueness of (feed, guid) and (feed, fingerprint)
 * is left entirely to the database constraints. Must not run inside a surrounding transaction.
 */
@Slf4j
@Service
public class FeedItemWriter {
    private static final int MAX_AUTHOR_LENGTH = 512;

    private static final String INSERT_ITEM =
            "INSERT INTO feed_items (id, feed_id, guid, content_fingerprint, title, link, content, author, " +
            "published_at, created_at, updated_at) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";

    private final JdbcTemplate jdbcTemplate;
    private final ItemDeduplicator deduplicator;

    public FeedItemWriter(JdbcTemplate jdbcTemplate, ItemDeduplicator deduplicator) {
        this.jdbcTemplate = jdbcTemplate;
        this.deduplicator = deduplicator;
    }

    /**
     * @return Number of rows actually inserted
     */
    public int insertItems(String feedId, List<ParsedFeedItem> items) {
        if (items == null || items.isEmpty()) {
            return 0;
        }
        OffsetDateTime now = OffsetDateTime.now(ZoneOffset.UTC);
        int inserted = 0;
        int skipped = 0;
        for (ParsedFeedItem item : items) {
            Optional<ItemIdentity> identity = deduplicator.identify(item);
            if (identity.isEmpty()) {
                skipped++;
                continue;
            }
            if (insertIgnoringConflict(feedId, item, identity.get(), now)) {
                inserted++;
            }
        }
        if (skipped > 0) {
            log.debug("Skipped {} item(s) without identity for feed {}", skipped, feedId);
        }
        log.debug("Inserted {} of {} item(s) for feed {}", inserted, items.size(), feedId);
        return inserted;
    }

    private boolean insertIgnoringConflict(String feedId, ParsedFeedItem item, ItemIdentity identity, OffsetDateTime now) {
        try {
            int rows = jdbcTemplate.update(INSERT_ITEM,
                    UUID.randomUUID().toString(),
                    feedId,
                    identity.getGuid(),
                    identity.getFingerprint(),
                    item.getTitle(),
                    item.getLink(),
                    item.getContent(),
                    truncate(item.getAuthor(), MAX_AUTHOR_LENGTH),
                    toTimestamp(item.getPublishedAt()),
                    now,
                    now);
            return rows > 0;
        } catch (DuplicateKeyException e) {
            // Already stored by an earlier or concurrent refresh
            return false;
        }
    }

    private static OffsetDateTime toTimestamp(Instant instant) {
        return instant != null ? instant.atOffset(ZoneOffset.UTC) : null;
    }

    private static String truncate(String value, int maxLength) {
        if (value == null || value.length() <= maxLength) {
            return value;
        }
        return value.substring(0, maxLength);
    }
}
