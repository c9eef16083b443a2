package feed.reader.app.service;

import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Best-effort feed discovery for a site URL: one HTML fetch for alternate links plus a short
 * list of conventional feed paths. Never throws; an empty result means nothing was found.
 */
@Slf4j
@Service
public class FeedDiscoveryService {
    static final int MAX_CANDIDATES = 5;
    static final List<String> HEURISTIC_PATHS = List.of(
            "/feed", "/feed.xml", "/rss", "/rss.xml", "/atom.xml", "/?feed=rss2");

    private static final Pattern FEED_TYPE = Pattern.compile(
            "(application/(rss|atom)\\+xml|application/xml|text/xml)", Pattern.CASE_INSENSITIVE);
    private static final Pattern FEED_HINT = Pattern.compile("(rss|atom|feed|xml)", Pattern.CASE_INSENSITIVE);
    private static final Pattern COMMENT_FEED = Pattern.compile("(comment|comments|reply|replies)", Pattern.CASE_INSENSITIVE);

    private final FeedFetcher feedFetcher;
    private final FeedUrlNormalizer urlNormalizer;
    private final long timeoutMs;

    public FeedDiscoveryService(FeedFetcher feedFetcher,
                                FeedUrlNormalizer urlNormalizer,
                                @Value("${feeds.discovery.timeout-ms:7000}") long timeoutMs) {
        this.feedFetcher = feedFetcher;
        this.urlNormalizer = urlNormalizer;
        this.timeoutMs = timeoutMs;
    }

    public FeedDiscoveryResult discoverFeedCandidates(String siteUrl) {
        Optional<String> normalized = urlNormalizer.normalize(siteUrl);
        if (normalized.isEmpty()) {
            return FeedDiscoveryResult.empty();
        }
        String inputUrl = normalized.get();
        FeedDiscoveryResult result = new FeedDiscoveryResult();

        Optional<FetchedPage> page = fetchHtml(inputUrl);
        if (page.isPresent()) {
            extractAlternateLinks(page.get(), inputUrl, result);
        } else {
            buildWwwVariant(inputUrl).ifPresent(wwwUrl -> {
                log.debug("Discovery falling back to {}", wwwUrl);
                fetchHtml(wwwUrl).ifPresent(wwwPage -> extractAlternateLinks(wwwPage, inputUrl, result));
                addHeuristicCandidates(wwwUrl, inputUrl, result);
            });
        }
        addHeuristicCandidates(inputUrl, inputUrl, result);

        log.debug("Discovered {} candidate(s) for {}", result.getCandidates().size(), inputUrl);
        return result;
    }

    private Optional<FetchedPage> fetchHtml(String url) {
        FetchOptions options = FetchOptions.builder()
                .timeoutMs(timeoutMs)
                .retries(0)
                .maxRedirects(5)
                .acceptHeader(FetchOptions.HTML_ACCEPT)
                .build();
        try {
            FetchResult fetched = feedFetcher.fetch(url, options);
            if (fetched.isNotModified() || fetched.getBody() == null) {
                return Optional.empty();
            }
            return Optional.of(new FetchedPage(fetched.getBody(), fetched.getFinalUrl() != null ? fetched.getFinalUrl() : url));
        } catch (FeedFetchException e) {
            log.debug("Discovery fetch of {} failed: {}", url, e.getMessage());
            return Optional.empty();
        }
    }

    private void extractAlternateLinks(FetchedPage page, String inputUrl, FeedDiscoveryResult result) {
        Document document = Jsoup.parse(page.html, page.url);
        for (Element link : document.select("link[rel][href]")) {
            if (!isFeedAlternate(link)) {
                continue;
            }
            String resolved = link.absUrl("href");
            if (resolved.isEmpty()) {
                continue;
            }
            if (looksLikeCommentFeed(resolved) || looksLikeCommentFeed(link.attr("title"))) {
                log.debug("Skipping comment feed {}", resolved);
                continue;
            }
            addCandidate(result, resolved, FeedDiscoveryResult.DiscoveryMethod.HTML_ALTERNATE, inputUrl);
        }
    }

    static boolean isFeedAlternate(Element link) {
        String rel = link.attr("rel").toLowerCase(Locale.ROOT);
        boolean alternate = Arrays.stream(rel.split("\\s+")).anyMatch("alternate"::equals);
        if (!alternate) {
            return false;
        }
        String type = link.attr("type").trim();
        if (!type.isEmpty()) {
            return FEED_TYPE.matcher(type).find();
        }
        return FEED_HINT.matcher(link.attr("href")).find() || FEED_HINT.matcher(link.attr("title")).find();
    }

    private void addHeuristicCandidates(String baseUrl, String inputUrl, FeedDiscoveryResult result) {
        HttpUrl base = HttpUrl.parse(baseUrl);
        if (base == null) {
            return;
        }
        HttpUrl origin = new HttpUrl.Builder()
                .scheme(base.scheme())
                .host(base.host())
                .port(base.port())
                .build();
        for (String path : HEURISTIC_PATHS) {
            HttpUrl candidate = origin.resolve(path);
            if (candidate != null) {
                addCandidate(result, candidate.toString(), FeedDiscoveryResult.DiscoveryMethod.HEURISTIC_PATH, inputUrl);
            }
        }
    }

    private void addCandidate(FeedDiscoveryResult result, String rawCandidate,
                              FeedDiscoveryResult.DiscoveryMethod method, String inputUrl) {
        Optional<String> normalized = urlNormalizer.normalize(rawCandidate);
        if (normalized.isEmpty()) {
            return;
        }
        String candidate = normalized.get();
        if (candidate.equals(inputUrl) || looksLikeCommentFeed(candidate) || result.contains(candidate)) {
            return;
        }
        if (result.getCandidates().size() >= MAX_CANDIDATES) {
            return;
        }
        result.add(candidate, method);
    }

    static Optional<String> buildWwwVariant(String url) {
        HttpUrl parsed = HttpUrl.parse(url);
        if (parsed == null) {
            return Optional.empty();
        }
        String host = parsed.host().toLowerCase(Locale.ROOT);
        if (host.startsWith("www.") || host.equals("localhost") || host.endsWith(".localhost") || !host.contains(".")) {
            return Optional.empty();
        }
        return Optional.of(parsed.newBuilder().host("www." + host).build().toString());
    }

    private static boolean looksLikeCommentFeed(String value) {
        return value != null && COMMENT_FEED.matcher(value).find();
    }

    private static final class FetchedPage {
        private final String html;
        private final String url;

        private FetchedPage(String html, String url) {
            this.html = html;
            this.url = url;
        }
    }
}
