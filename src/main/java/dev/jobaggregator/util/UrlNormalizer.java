package dev.jobaggregator.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Canonical form of posting URLs used as the listing identity key.
 */
public final class UrlNormalizer {

    private static final Set<String> TRACKING_PARAMETERS = Set.of(
            "gclid", "fbclid", "msclkid", "mc_cid", "mc_eid",
            "ref", "refid", "trk", "trackingid", "src", "tk", "from");

    private UrlNormalizer() {
    }

    /**
     * Lowercases scheme and host, drops default ports, fragments and tracking parameters,
     * sorts the remaining query parameters and removes the trailing slash.
     * Unparseable input is returned trimmed and lowercased.
     */
    public static String normalize(String url) {
        if (url == null) {
            return "";
        }
        String trimmed = url.strip();
        if (trimmed.isEmpty()) {
            return "";
        }
        URI uri = safeUri(trimmed);
        if (uri == null || uri.getHost() == null) {
            return stripTrailingSlash(trimmed.toLowerCase(Locale.ROOT));
        }

        String scheme = uri.getScheme() == null ? "https" : uri.getScheme().toLowerCase(Locale.ROOT);
        String host = uri.getHost().toLowerCase(Locale.ROOT);
        if (host.startsWith("www.")) {
            host = host.substring(4);
        }
        int port = uri.getPort();
        boolean defaultPort = port == -1
                || ("http".equals(scheme) && port == 80)
                || ("https".equals(scheme) && port == 443);

        StringBuilder normalized = new StringBuilder()
                .append(scheme).append("://").append(host);
        if (!defaultPort) {
            normalized.append(':').append(port);
        }
        normalized.append(stripTrailingSlash(uri.getRawPath() == null ? "" : uri.getRawPath()));

        String query = filterQuery(uri.getRawQuery());
        if (!query.isEmpty()) {
            normalized.append('?').append(query);
        }
        return normalized.toString();
    }

    private static String filterQuery(String rawQuery) {
        if (rawQuery == null || rawQuery.isBlank()) {
            return "";
        }
        List<String> kept = new ArrayList<>();
        for (String pair : rawQuery.split("&")) {
            if (pair.isBlank()) {
                continue;
            }
            String name = pair.split("=", 2)[0].toLowerCase(Locale.ROOT);
            if (name.startsWith("utm_") || TRACKING_PARAMETERS.contains(name)) {
                continue;
            }
            kept.add(pair);
        }
        kept.sort(null);
        return String.join("&", kept);
    }

    private static String stripTrailingSlash(String value) {
        String result = value;
        while (result.endsWith("/")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }

    private static URI safeUri(String url) {
        try {
            return new URI(url);
        } catch (URISyntaxException ignored) {
            return null;
        }
    }
}
