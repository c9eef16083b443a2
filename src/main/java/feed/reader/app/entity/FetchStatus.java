package feed.reader.app.entity;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Outcome of the most recent fetch attempt recorded on a feed.
 */
public enum FetchStatus {
    SUCCESS,
    ERROR;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
