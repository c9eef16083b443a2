package feed.reader.app.service;

import okhttp3.HttpUrl;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Canonicalizes user-entered strings into comparable absolute http(s) URLs.
 * <p>
 * Policy: surrounding whitespace is trimmed; a missing scheme defaults to {@code https};
 * scheme and host are lower-cased, IDN hosts are punycoded and default ports dropped;
 * embedded credentials and the fragment are removed; an empty path becomes {@code /}.
 * Path case, trailing slashes, {@code www.} prefixes and query order are kept as written,
 * since origins are free to serve different documents for each.
 */
@Component
public class FeedUrlNormalizer {

    private static final Pattern SCHEME = Pattern.compile("^[a-zA-Z][a-zA-Z0-9+.-]*://");

    public Optional<String> normalize(String input) {
        if (input == null) {
            return Optional.empty();
        }
        String trimmed = input.trim();
        if (trimmed.isEmpty()) {
            return Optional.empty();
        }

        String candidate = trimmed;
        if (!SCHEME.matcher(candidate).find()) {
            candidate = "https://" + candidate;
        } else {
            String scheme = candidate.substring(0, candidate.indexOf(':')).toLowerCase(Locale.ROOT);
            if (!scheme.equals("http") && !scheme.equals("https")) {
                return Optional.empty();
            }
        }

        HttpUrl url = HttpUrl.parse(candidate);
        if (url == null || url.host().isEmpty()) {
            return Optional.empty();
        }

        HttpUrl canonical = url.newBuilder()
                .username("")
                .password("")
                .fragment(null)
                .build();
        return Optional.of(canonical.toString());
    }

    public boolean isValid(String input) {
        return normalize(input).isPresent();
    }

    /**
     * Like {@link #normalize(String)} but for callers that treat a bad URL as an error.
     */
    public String normalizeOrThrow(String input) throws FeedFetchException {
        return normalize(input).orElseThrow(() -> new FeedFetchException(
                FeedFetchException.FetchFailure.INVALID_URL, "Invalid feed URL: " + input));
    }
}
