package feed.reader.app.service;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered feed candidates for a site, each tagged with how it was found.
 */
@Getter
public class FeedDiscoveryResult {

    public enum DiscoveryMethod {
        HTML_ALTERNATE,
        HEURISTIC_PATH;

        @JsonValue
        public String wireName() {
            return name().toLowerCase();
        }
    }

    private final List<String> candidates = new ArrayList<>();
    private final Map<String, DiscoveryMethod> methodByUrl = new LinkedHashMap<>();

    public static FeedDiscoveryResult empty() {
        return new FeedDiscoveryResult();
    }

    boolean contains(String url) {
        return methodByUrl.containsKey(url);
    }

    void add(String url, DiscoveryMethod method) {
        candidates.add(url);
        methodByUrl.put(url, method);
    }

    public List<String> getCandidates() {
        return Collections.unmodifiableList(candidates);
    }

    public Map<String, DiscoveryMethod> getMethodByUrl() {
        return Collections.unmodifiableMap(methodByUrl);
    }

    public DiscoveryMethod methodOf(String url) {
        return methodByUrl.getOrDefault(url, DiscoveryMethod.HEURISTIC_PATH);
    }
}
