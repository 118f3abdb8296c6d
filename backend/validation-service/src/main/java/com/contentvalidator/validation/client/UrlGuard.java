package com.contentvalidator.validation.client;

import com.contentvalidator.validation.entity.ScanFailureReason;
import com.contentvalidator.validation.exception.PageFailureException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.net.Inet6Address;
import java.net.InetAddress;
import java.net.URI;
import java.net.UnknownHostException;
import java.util.Locale;
import java.util.Set;

/**
 * Refuses URLs that would make the service fetch from its own network:
 * loopback, private, link-local and unique-local addresses and cloud metadata hosts.
 * Hosts that do not resolve pass; the fetch itself reports them.
 */
@Component
@Slf4j
public class UrlGuard {

    private static final Set<String> BLOCKED_HOSTS = Set.of(
            "metadata.google.internal",
            "metadata",
            "169.254.169.254");

    @FunctionalInterface
    interface HostResolver {
        InetAddress[] resolve(String host) throws UnknownHostException;
    }

    private final boolean enabled;
    private final HostResolver resolver;

    @Autowired
    public UrlGuard(@Value("${scan.security.block-private-networks:true}") boolean enabled) {
        this(enabled, InetAddress::getAllByName);
    }

    UrlGuard(boolean enabled, HostResolver resolver) {
        this.enabled = enabled;
        this.resolver = resolver;
    }

    /**
     * @throws PageFailureException with {@link ScanFailureReason#URL_BLOCKED} when the URL may not be fetched
     */
    public void check(String url) {
        URI uri;
        try {
            uri = URI.create(url.trim());
        } catch (IllegalArgumentException e) {
            throw blocked(url, "malformed URL");
        }
        String scheme = uri.getScheme() != null ? uri.getScheme().toLowerCase(Locale.ROOT) : "";
        if (!scheme.equals("http") && !scheme.equals("https")) {
            throw blocked(url, "scheme '" + scheme + "' is not allowed");
        }
        String host = uri.getHost();
        if (host == null || host.isBlank()) {
            throw blocked(url, "no host");
        }
        if (!enabled) {
            return;
        }

        String bareHost = host.startsWith("[") && host.endsWith("]") ? host.substring(1, host.length() - 1) : host;
        if (BLOCKED_HOSTS.contains(bareHost.toLowerCase(Locale.ROOT))) {
            throw blocked(url, "host " + host + " is reserved");
        }

        InetAddress[] addresses;
        try {
            addresses = resolver.resolve(bareHost);
        } catch (UnknownHostException e) {
            log.debug("Host {} does not resolve: {}", host, e.getMessage());
            return;
        }
        for (InetAddress address : addresses) {
            if (isInternal(address)) {
                throw blocked(url, "host " + host + " resolves to internal address " + address.getHostAddress());
            }
        }
    }

    public boolean isAllowed(String url) {
        try {
            check(url);
            return true;
        } catch (PageFailureException e) {
            log.debug("Skipping {}: {}", url, e.getMessage());
            return false;
        }
    }

    static boolean isInternal(InetAddress address) {
        if (address.isLoopbackAddress() || address.isAnyLocalAddress()
                || address.isSiteLocalAddress() || address.isLinkLocalAddress()) {
            return true;
        }
        byte[] bytes = address.getAddress();
        if (address instanceof Inet6Address) {
            // fc00::/7
            return (bytes[0] & 0xfe) == 0xfc;
        }
        // 0.0.0.0/8
        return bytes[0] == 0;
    }

    private static PageFailureException blocked(String url, String detail) {
        return new PageFailureException(url, ScanFailureReason.URL_BLOCKED, "Refusing to fetch " + url + ": " + detail);
    }
}
