package feed.reader.app.service;

import org.springframework.stereotype.Component;

/**
 * Maps fetch and parse failures onto the codes stored on feeds and returned to clients:
 * {@code invalid_url}, {@code invalid_xml}, {@code timeout}, {@code network}, {@code http_<status>}
 * and the {@code unreachable} catch-all.
 */
@Component
public class FeedErrorClassifier {

    public enum ErrorContext {
        CREATE,
        REFRESH
    }

    public static final String INVALID_URL = "invalid_url";
    public static final String INVALID_XML = "invalid_xml";
    public static final String TIMEOUT = "timeout";
    public static final String NETWORK = "network";
    public static final String UNREACHABLE = "unreachable";

    public FeedError classify(Throwable error, ErrorContext context) {
        String code = resolveCode(error);
        return new FeedError(code, resolveMessage(code, context));
    }

    String resolveCode(Throwable error) {
        if (error instanceof FeedParseException) {
            return INVALID_XML;
        }
        if (error instanceof FeedFetchException) {
            FeedFetchException fetchError = (FeedFetchException) error;
            switch (fetchError.getFailure()) {
                case TIMEOUT:
                    return TIMEOUT;
                case NETWORK:
                case TOO_MANY_REDIRECTS:
                    return NETWORK;
                case HTTP_STATUS:
                    return "http_" + fetchError.getStatusCode();
                case INVALID_URL:
                    return INVALID_URL;
                default:
                    return UNREACHABLE;
            }
        }
        return UNREACHABLE;
    }

    String resolveMessage(String code, ErrorContext context) {
        if (context == ErrorContext.CREATE) {
            switch (code) {
                case INVALID_URL:
                    return "This URL does not appear to be valid.";
                case "http_404":
                    return "This feed could not be reached. The server returned a 404, which usually means the feed URL changed.";
                case TIMEOUT:
                    return "This feed could not be added. The server did not respond in time. This is often temporary.";
                case INVALID_XML:
                    return "This URL does not appear to be a valid RSS or Atom feed.";
                default:
                    if (code.startsWith("http_")) {
                        return "This feed could not be reached. The server returned a " + code.substring(5) + " response.";
                    }
                    return "Could not reach this URL. Check the address and try again.";
            }
        }

        switch (code) {
            case INVALID_URL:
                return "This feed has an invalid URL.";
            case "http_404":
                return "This feed could not be reached. The server returned a 404, which usually means the feed URL changed or no longer exists.";
            case TIMEOUT:
                return "This feed could not be updated. The server did not respond in time. This is usually temporary.";
            case INVALID_XML:
                return "This feed returned content that is not valid RSS or Atom XML.";
            case NETWORK:
                return "This feed could not be updated because the network request failed.";
            default:
                if (code.startsWith("http_")) {
                    return "This feed could not be updated. The server returned a " + code.substring(5) + " response.";
                }
                return "This feed could not be updated right now.";
        }
    }
}
