package feed.reader.app.service;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ItemDeduplicatorTest {

    private final ItemDeduplicator deduplicator = new ItemDeduplicator();

    private ParsedFeedItem.ParsedFeedItemBuilder item() {
        return ParsedFeedItem.builder()
                .link("https://example.com/posts/1")
                .title("Hello World")
                .content("<p>Some <b>content</b></p>")
                .author("Ada")
                .publishedAt(Instant.parse("2024-03-01T10:00:00Z"));
    }

    @Test
    void identify_WithGuid_ShouldUseGuidAndSkipFingerprint() {
        ItemIdentity identity = deduplicator.identify(item().guid("  urn:post:1 ").build()).orElseThrow();

        assertTrue(identity.hasGuid());
        assertEquals("urn:post:1", identity.getGuid());
        assertNull(identity.getFingerprint());
    }

    @Test
    void identify_WithSameContentButDifferentGuids_ShouldYieldDifferentIdentities() {
        ItemIdentity first = deduplicator.identify(item().guid("a").build()).orElseThrow();
        ItemIdentity second = deduplicator.identify(item().guid("b").build()).orElseThrow();

        assertNotEquals(first, second);
    }

    @Test
    void identify_WithoutGuid_ShouldComputeStableFingerprint() {
        ItemIdentity first = deduplicator.identify(item().build()).orElseThrow();
        ItemIdentity second = deduplicator.identify(item().build()).orElseThrow();

        assertFalse(first.hasGuid());
        assertEquals(64, first.getFingerprint().length());
        assertEquals(first.getFingerprint(), second.getFingerprint());
    }

    @Test
    void identify_ShouldIgnoreWhitespaceCaseAndMarkupDifferences() {
        ItemIdentity plain = deduplicator.identify(item().build()).orElseThrow();
        ItemIdentity noisy = deduplicator.identify(item()
                .title("  hello   WORLD ")
                .content("<div>Some\n  <i>content</i></div>")
                .author("ADA")
                .build()).orElseThrow();

        assertEquals(plain.getFingerprint(), noisy.getFingerprint());
    }

    @Test
    void identify_WithDifferentPublishedTime_ShouldChangeFingerprint() {
        ItemIdentity original = deduplicator.identify(item().build()).orElseThrow();
        ItemIdentity republished = deduplicator.identify(item().publishedAt(Instant.parse("2024-03-02T10:00:00Z")).build()).orElseThrow();

        assertNotEquals(original.getFingerprint(), republished.getFingerprint());
    }

    @Test
    void identify_WithNothingToIdentify_ShouldReturnEmpty() {
        Optional<ItemIdentity> identity = deduplicator.identify(ParsedFeedItem.builder().title("   ").build());

        assertTrue(identity.isEmpty());
    }

    @Test
    void identify_WithOversizedGuid_ShouldHashIt() {
        String longGuid = "x".repeat(ItemDeduplicator.MAX_GUID_BYTES + 1);

        ItemIdentity identity = deduplicator.identify(ParsedFeedItem.builder().guid(longGuid).build()).orElseThrow();

        assertTrue(identity.getGuid().startsWith("sha256:"));
        assertTrue(identity.getGuid().length() <= ItemDeduplicator.MAX_GUID_BYTES);
    }

    @Test
    void identify_WithMultibyteGuidOverByteLimit_ShouldHashIt() {
        // 1000 chars but 3000 bytes in UTF-8
        String wideGuid = "\u20AC".repeat(1000);

        ItemIdentity identity = deduplicator.identify(ParsedFeedItem.builder().guid(wideGuid).build()).orElseThrow();

        assertTrue(identity.getGuid().startsWith("sha256:"));
    }

    @Test
    void identify_WithMultibyteGuidWithinByteLimit_ShouldKeepIt() {
        String guid = "\u00E9".repeat(1000);

        ItemIdentity identity = deduplicator.identify(ParsedFeedItem.builder().guid(guid).build()).orElseThrow();

        assertEquals(guid, identity.getGuid());
    }
}
