package feed.reader.app.service;

import org.jsoup.Jsoup;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Optional;

/**
 * Decides the identity an item is stored under. A native id always wins; otherwise a SHA-256
 * fingerprint over (link, title, text content, author, published time) stands in, so the same
 * remote item maps to the same row on every refresh.
 */
@Component
public class ItemDeduplicator {
    static final int MAX_GUID_BYTES = 2048;

    /**
     * @return empty when the item carries neither a native id nor any field to fingerprint
     */
    public Optional<ItemIdentity> identify(ParsedFeedItem item) {
        String guid = item.getGuid() != null ? item.getGuid().trim() : "";
        if (!guid.isEmpty()) {
            // Oversized ids would not fit the unique index; hash them into a stable surrogate
            if (guid.getBytes(StandardCharsets.UTF_8).length > MAX_GUID_BYTES) {
                guid = "sha256:" + sha256Hex(guid);
            }
            return Optional.of(ItemIdentity.ofGuid(guid));
        }

        String link = normalizePart(item.getLink());
        String title = normalizePart(item.getTitle());
        String content = normalizePart(stripHtml(item.getContent()));
        String author = normalizePart(item.getAuthor());
        String published = item.getPublishedAt() != null ? item.getPublishedAt().toString() : "";

        if (link.isEmpty() && title.isEmpty() && content.isEmpty() && author.isEmpty() && published.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(ItemIdentity.ofFingerprint(fingerprint(link, title, content, author, published)));
    }

    static String fingerprint(String link, String title, String content, String author, String published) {
        String payload = String.join("|", link, title, content, author, published);
        return sha256Hex(payload);
    }

    static String normalizePart(String value) {
        if (value == null) {
            return "";
        }
        return value.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }

    static String stripHtml(String html) {
        if (html == null || html.isBlank()) {
            return "";
        }
        return Jsoup.parse(html).text();
    }

    private static String sha256Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
