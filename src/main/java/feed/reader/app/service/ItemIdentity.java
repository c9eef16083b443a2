package feed.reader.app.service;

import lombok.Value;

/**
 * Exactly one of {@code guid} and {@code fingerprint} is set.
 */
@Value
public class ItemIdentity {
    String guid;
    String fingerprint;

    public static ItemIdentity ofGuid(String guid) {
        return new ItemIdentity(guid, null);
    }

    public static ItemIdentity ofFingerprint(String fingerprint) {
        return new ItemIdentity(null, fingerprint);
    }

    public boolean hasGuid() {
        return guid != null;
    }
}
