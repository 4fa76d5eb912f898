package dk.trustworks.filebridge.graph.dto;

import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;

/**
 * Utility for Graph continuation links.
 *
 * <p>Graph returns the next page as a full {@code @odata.nextLink} URL. The REST client
 * re-issues the same request with the link's {@code $skiptoken} (or {@code $skip}), so only
 * the token travels as the continuation cursor.
 */
public final class GraphPaging {

    private static final String SKIP_TOKEN = "$skiptoken";

    private GraphPaging() {
        // Utility class - no instantiation
    }

    /**
     * Extracts the {@code $skiptoken} value from a next link.
     *
     * @param nextLink the {@code @odata.nextLink} of a page (may be null)
     * @return the decoded token, or null when the link is absent or carries no token
     */
    public static String skipToken(String nextLink) {
        if (nextLink == null || nextLink.isBlank()) {
            return null;
        }
        String query;
        try {
            query = URI.create(nextLink).getRawQuery();
        } catch (IllegalArgumentException e) {
            return null;
        }
        if (query == null) {
            return null;
        }
        for (String pair : query.split("&")) {
            int eq = pair.indexOf('=');
            if (eq <= 0) {
                continue;
            }
            String key = URLDecoder.decode(pair.substring(0, eq), StandardCharsets.UTF_8);
            if (SKIP_TOKEN.equalsIgnoreCase(key)) {
                return URLDecoder.decode(pair.substring(eq + 1), StandardCharsets.UTF_8);
            }
        }
        return null;
    }
}
