package feed.reader.app.service;

/**
 * The document is not a recognizable RSS, Atom or JSON Feed.
 */
public class FeedParseException extends Exception {

    public FeedParseException(String message) {
        super(message);
    }

    public FeedParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
