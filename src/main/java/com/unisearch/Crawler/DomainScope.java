package com.unisearch.Crawler;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

//Purpose: Decides which URLs the crawler may fetch.
//A scope is a host (with optional non-default port) plus a path prefix
//Prefix matching respects segment boundaries: /crawl matches /crawl/a but not /crawler

public class DomainScope {
    private final String host;
    private final int port;
    private final String pathPrefix;

    private DomainScope(String host, int port, String pathPrefix) {
        this.host = host;
        this.port = port;
        this.pathPrefix = pathPrefix;
    }

    /**
     * Parses a scope such as {@code vm009.rz.uos.de/crawl} or {@code https://vm009.rz.uos.de/crawl/}.
     * When the scope is blank the seed's host is used with the root path.
     */
    public static DomainScope of(String scope, String seedUrl) {
        String source = scope;
        if (source == null || source.isBlank()) {
            String seedHost = UrlNormalizer.extractDomain(seedUrl);
            if (seedHost == null) {
                throw new IllegalArgumentException("Cannot derive a domain scope from seed: " + seedUrl);
            }
            return new DomainScope(seedHost, portOf(UrlNormalizer.normalize(seedUrl)), "/");
        }
        source = source.trim();
        if (!source.contains("://")) {
            source = "http://" + source;
        }
        String normalized = UrlNormalizer.normalize(source);
        if (normalized == null) {
            throw new IllegalArgumentException("Invalid domain scope: " + scope);
        }
        try {
            URI uri = new URI(normalized);
            return new DomainScope(uri.getHost().toLowerCase(Locale.ROOT), uri.getPort(), uri.getRawPath());
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Invalid domain scope: " + scope, e);
        }
    }

    public boolean contains(String url) {
        String normalized = UrlNormalizer.normalize(url);
        if (normalized == null) {
            return false;
        }
        try {
            URI uri = new URI(normalized);
            if (!host.equals(uri.getHost()) || port != uri.getPort()) {
                return false;
            }
            String path = uri.getRawPath();
            if (pathPrefix.equals("/") || path.equals(pathPrefix)) {
                return true;
            }
            return path.startsWith(pathPrefix + "/");
        } catch (URISyntaxException e) {
            return false;
        }
    }

    public String getHost() {
        return host;
    }

    public String getPathPrefix() {
        return pathPrefix;
    }

    private static int portOf(String normalizedUrl) {
        try {
            return normalizedUrl == null ? -1 : new URI(normalizedUrl).getPort();
        } catch (URISyntaxException e) {
            return -1;
        }
    }

    @Override
    public String toString() {
        return host + (port != -1 ? ":" + port : "") + pathPrefix;
    }
}
