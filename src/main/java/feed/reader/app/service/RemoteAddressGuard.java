package feed.reader.app.service;

import lombok.extern.slf4j.Slf4j;
import okhttp3.Dns;
import okhttp3.HttpUrl;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.security.web.util.matcher.IpAddressMatcher;
import org.springframework.stereotype.Component;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Refuses outbound requests to loopback, private, link-local, metadata and other reserved
 * destinations.
 * <p>
 * {@link #check(HttpUrl)} runs before the first request and on every redirect hop and covers
 * credentials, hostnames and literal addresses. Resolved addresses are filtered in
 * {@link #lookup(String)}, which the HTTP client uses for the connection itself, so a host
 * cannot pass one resolution and connect to another.
 */
@Slf4j
@Component
public class RemoteAddressGuard implements Dns {

    private static final Set<String> METADATA_HOSTNAMES = Set.of(
            "metadata", "metadata.google.internal", "metadata.goog");

    private static final List<IpAddressMatcher> BLOCKED_RANGES = Stream.of(
                    "0.0.0.0/8",
                    "10.0.0.0/8",
                    "100.64.0.0/10",
                    "127.0.0.0/8",
                    "169.254.0.0/16",
                    "172.16.0.0/12",
                    "192.0.0.0/24",
                    "192.0.2.0/24",
                    "192.168.0.0/16",
                    "198.18.0.0/15",
                    "198.51.100.0/24",
                    "203.0.113.0/24",
                    "224.0.0.0/4",
                    "240.0.0.0/4",
                    "::/128",
                    "::1/128",
                    "fc00::/7",
                    "fe80::/10",
                    "ff00::/8",
                    "2001:db8::/32")
            .map(IpAddressMatcher::new)
            .collect(Collectors.toList());

    // Hosts the HTTP client connects to without a DNS lookup
    private static final Pattern IP_LITERAL = Pattern.compile("([0-9a-fA-F]*:[0-9a-fA-F:.]*)|([\\d.]+)");

    private final boolean enabled;

    public RemoteAddressGuard(@Value("${feeds.fetch.block-private-addresses:true}") boolean enabled) {
        this.enabled = enabled;
    }

    public void check(HttpUrl url) throws FeedFetchException {
        if (!url.username().isEmpty() || !url.password().isEmpty()) {
            throw new FeedFetchException(FeedFetchException.FetchFailure.INVALID_URL,
                    "URLs with credentials are not allowed");
        }
        if (!enabled) {
            return;
        }

        String host = url.host().toLowerCase(Locale.ROOT);
        if (host.endsWith(".")) {
            host = host.substring(0, host.length() - 1);
        }
        if (isBlockedHostname(host)) {
            log.warn("Blocked outbound fetch to host {}", host);
            throw new FeedFetchException(FeedFetchException.FetchFailure.BLOCKED_HOST, "Blocked host: " + host);
        }

        if (IP_LITERAL.matcher(host).matches()) {
            InetAddress address;
            try {
                address = InetAddress.getByName(host);
            } catch (UnknownHostException e) {
                throw new FeedFetchException(FeedFetchException.FetchFailure.INVALID_URL, "Invalid address: " + host, e);
            }
            if (isBlockedAddress(address)) {
                log.warn("Blocked outbound fetch to address {}", host);
                throw new FeedFetchException(FeedFetchException.FetchFailure.BLOCKED_HOST,
                        "Blocked private or reserved address: " + host);
            }
        }
    }

    @Override
    public List<InetAddress> lookup(String hostname) throws UnknownHostException {
        List<InetAddress> addresses = Dns.SYSTEM.lookup(hostname);
        if (!enabled) {
            return addresses;
        }
        for (InetAddress address : addresses) {
            if (isBlockedAddress(address)) {
                log.warn("Blocked outbound fetch to {} resolving to {}", hostname, address.getHostAddress());
                throw new BlockedAddressException(hostname);
            }
        }
        return addresses;
    }

    static boolean isBlockedHostname(String host) {
        if (host.equals("localhost") || host.endsWith(".localhost")) {
            return true;
        }
        if (host.endsWith(".metadata")) {
            return true;
        }
        return METADATA_HOSTNAMES.contains(host);
    }

    static boolean isBlockedAddress(InetAddress address) {
        String hostAddress = address.getHostAddress();
        int scope = hostAddress.indexOf('%');
        String literal = scope >= 0 ? hostAddress.substring(0, scope) : hostAddress;
        return BLOCKED_RANGES.stream().anyMatch(range -> range.matches(literal));
    }

    /**
     * Raised from {@link #lookup(String)} when a host resolves into a blocked range.
     */
    public static class BlockedAddressException extends UnknownHostException {
        public BlockedAddressException(String hostname) {
            super("Blocked private or reserved address for host: " + hostname);
        }
    }
}
