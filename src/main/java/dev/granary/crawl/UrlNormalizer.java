package dev.granary.crawl;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Arrays;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Utility class that normalizes detail links so the same announcement reached from different
 * listing pages yields the same external identifier.
 * Removes fragments, tracking and paging query params, sorts the remaining params and
 * normalizes trailing slashes and host casing.
 */
public final class UrlNormalizer {

    private static final Logger log = LoggerFactory.getLogger(UrlNormalizer.class);

    private static final Set<String> TRACKING_PARAMS = Set.of(
            "utm_source", "utm_medium", "utm_campaign", "utm_term", "utm_content",
            "ref", "source"
    );

    /** Listing state carried into detail links by most board engines. */
    private static final Set<String> PAGING_PARAMS = Set.of(
            "page", "pageindex", "pageno", "page_no", "pagenum", "currentpage", "cpage",
            "curpage", "pageunit", "pagesize", "rowsperpage", "listcnt", "searchcnd",
            "searchwrd", "searchkeyword", "searchcondition", "sc", "sw"
    );

    private UrlNormalizer() {
        // utility class
    }

    /**
     * Normalize a URL:
     * - Remove fragments (#section)
     * - Remove tracking (utm_*, ref, source) and paging/search params
     * - Sort the remaining query params
     * - Remove trailing slash unless URL is just the domain root
     * - Lowercase scheme and host (path is case-sensitive)
     *
     * @param url the URL to normalize
     * @return normalized URL string, or the input unchanged if malformed
     */
    public static String normalize(String url) {
        if (url == null || url.isBlank()) {
            return url;
        }

        URI uri;
        try {
            uri = new URI(url.trim());
        } catch (URISyntaxException e) {
            log.warn("Malformed URL, returning unchanged: {}", url);
            return url;
        }

        if (uri.getScheme() == null || uri.getHost() == null) {
            log.warn("URL missing scheme or host, returning unchanged: {}", url);
            return url;
        }

        String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
        String host = uri.getHost().toLowerCase(Locale.ROOT);
        int port = uri.getPort();
        String path = uri.getRawPath();

        if (path == null || path.isEmpty()) {
            path = "/";
        }
        if (path.length() > 1 && path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }

        String filteredQuery = filterQueryParams(uri.getRawQuery());

        StringBuilder sb = new StringBuilder();
        sb.append(scheme).append("://").append(host);
        if (port != -1 && !isDefaultPort(scheme, port)) {
            sb.append(':').append(port);
        }
        sb.append(path);
        if (filteredQuery != null) {
            sb.append('?').append(filteredQuery);
        }
        return sb.toString();
    }

    private static String filterQueryParams(String query) {
        if (query == null || query.isEmpty()) {
            return null;
        }
        String filtered = Arrays.stream(query.split("&"))
                .filter(param -> !param.isEmpty())
                .filter(param -> {
                    int eq = param.indexOf('=');
                    String key = eq >= 0 ? param.substring(0, eq) : param;
                    String lower = key.toLowerCase(Locale.ROOT);
                    return !TRACKING_PARAMS.contains(lower) && !PAGING_PARAMS.contains(lower);
                })
                .sorted()
                .collect(Collectors.joining("&"));
        return filtered.isEmpty() ? null : filtered;
    }

    private static boolean isDefaultPort(String scheme, int port) {
        return ("http".equals(scheme) && port == 80)
                || ("https".equals(scheme) && port == 443);
    }
}
