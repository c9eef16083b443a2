package feed.reader.app.service;

import lombok.Value;
import okhttp3.MediaType;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

/**
 * Either a body ({@link #isNotModified()} false) or the origin's confirmation that the
 * cached validators are still current. The body is kept as raw bytes so XML parsing can
 * honour the document's own encoding declaration.
 */
@Value
public class FetchResult {
    boolean notModified;
    byte[] bodyBytes;
    String contentType;
    String etag;
    String lastModified;
    String finalUrl;

    public static FetchResult ok(byte[] bodyBytes, String contentType, String etag, String lastModified, String finalUrl) {
        return new FetchResult(false, bodyBytes, contentType, etag, lastModified, finalUrl);
    }

    public static FetchResult ok(String body, String etag, String lastModified, String finalUrl) {
        return ok(body.getBytes(StandardCharsets.UTF_8), null, etag, lastModified, finalUrl);
    }

    public static FetchResult notModified(String etag, String lastModified, String finalUrl) {
        return new FetchResult(true, null, null, etag, lastModified, finalUrl);
    }

    /**
     * The body decoded with the Content-Type charset, UTF-8 when none was sent.
     * Used for HTML and JSON; XML goes through {@link #getBodyBytes()}.
     */
    public String getBody() {
        if (bodyBytes == null) {
            return null;
        }
        return new String(bodyBytes, headerCharset());
    }

    private Charset headerCharset() {
        MediaType mediaType = contentType != null ? MediaType.parse(contentType) : null;
        // charset() falls back to the default for unknown names as well
        return mediaType != null ? mediaType.charset(StandardCharsets.UTF_8) : StandardCharsets.UTF_8;
    }
}
