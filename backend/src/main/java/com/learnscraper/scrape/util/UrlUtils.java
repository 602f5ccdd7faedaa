package com.learnscraper.scrape.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Objects;

public final class UrlUtils {
    private UrlUtils() {
    }

    public static URI safeUri(String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        try {
            return new URI(url.trim());
        } catch (URISyntaxException ignored) {
            return null;
        }
    }

    /**
     * Scheme, host and effective port all match. Either side unparseable means no match.
     */
    public static boolean sameOrigin(String first, String second) {
        URI a = safeUri(first);
        URI b = safeUri(second);
        if (a == null || b == null || a.getScheme() == null || b.getScheme() == null
            || a.getHost() == null || b.getHost() == null) {
            return false;
        }
        return a.getScheme().equalsIgnoreCase(b.getScheme())
            && a.getHost().equalsIgnoreCase(b.getHost())
            && effectivePort(a) == effectivePort(b);
    }

    /**
     * @throws IllegalArgumentException when the value is not an absolute http(s) URL with a host
     */
    public static String requireHttpUrl(String url) {
        URI uri = safeUri(url);
        if (uri == null || uri.getScheme() == null || uri.getHost() == null) {
            throw new IllegalArgumentException("url must be an absolute http(s) URL: " + url);
        }
        String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
        if (!scheme.equals("http") && !scheme.equals("https")) {
            throw new IllegalArgumentException("url must be an absolute http(s) URL: " + url);
        }
        return url.trim();
    }

    public static boolean isFragmentOnly(String href) {
        return href != null && href.trim().startsWith("#");
    }

    public static String host(String url) {
        URI uri = safeUri(url);
        if (uri == null || uri.getHost() == null) {
            return null;
        }
        return uri.getHost().toLowerCase(Locale.ROOT);
    }

    private static int effectivePort(URI uri) {
        if (uri.getPort() != -1) {
            return uri.getPort();
        }
        String scheme = Objects.requireNonNullElse(uri.getScheme(), "").toLowerCase(Locale.ROOT);
        return switch (scheme) {
            case "http" -> 80;
            case "https" -> 443;
            default -> -1;
        };
    }
}
