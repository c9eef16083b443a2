package feed.reader.app.service;

import lombok.Value;

/**
 * Stable error code plus a calm, user-facing message.
 */
@Value
public class FeedError {
    String code;
    String message;
}
