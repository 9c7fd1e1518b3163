package com.unisearch.Crawler;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

//Purpose: Standardizes URLs so every page has exactly one key.
//Lowercases scheme and host, strips default ports (:80 / :443)
//Resolves ./ and ../ segments, drops the fragment (#)
//Root path is "/", any other path loses its trailing slash
//Query strings are preserved; only http and https are accepted

public final class UrlNormalizer {

    private UrlNormalizer() {
    }

    public static String normalize(String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        try {
            URI uri = new URI(url.trim());
            String scheme = uri.getScheme();
            String host = uri.getHost();
            if (scheme == null || host == null) {
                return null;
            }
            scheme = scheme.toLowerCase(Locale.ROOT);
            if (!scheme.equals("http") && !scheme.equals("https")) {
                return null;
            }
            host = host.toLowerCase(Locale.ROOT);

            int port = uri.getPort();
            if ((scheme.equals("http") && port == 80) || (scheme.equals("https") && port == 443)) {
                port = -1;
            }

            String path = normalizePath(uri.normalize().getRawPath());

            StringBuilder result = new StringBuilder();
            result.append(scheme).append("://").append(host);
            if (port != -1) {
                result.append(':').append(port);
            }
            result.append(path);
            String query = uri.getRawQuery();
            if (query != null && !query.isEmpty()) {
                result.append('?').append(query);
            }
            return result.toString();
        } catch (URISyntaxException | IllegalArgumentException e) {
            return null;
        }
    }

    // Resolves href against an absolute base URL, then normalizes the result
    public static String resolve(String baseUrl, String href) {
        if (baseUrl == null || href == null || href.isBlank()) {
            return null;
        }
        try {
            URI base = new URI(baseUrl.trim());
            return normalize(base.resolve(new URI(href.trim())).toString());
        } catch (URISyntaxException | IllegalArgumentException e) {
            return null;
        }
    }

    public static String extractDomain(String url) {
        if (url == null) return null;
        try {
            String host = new URI(url.trim()).getHost();
            return host != null ? host.toLowerCase(Locale.ROOT) : null;
        } catch (URISyntaxException e) {
            return null;
        }
    }

    private static String normalizePath(String path) {
        if (path == null || path.isEmpty() || path.charAt(0) != '/') {
            path = "/" + (path == null ? "" : path);
        }
        // URI.normalize keeps ".." segments that climb above the root
        while (path.startsWith("/../")) {
            path = path.substring(3);
        }
        if (path.equals("/..")) {
            path = "/";
        }
        while (path.length() > 1 && path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
        return path;
    }
}
