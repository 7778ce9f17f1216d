package io.multicurl.sdk.pagination;

import io.multicurl.sdk.internal.UrlUtil;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parsed {@code Link} response header ({@code <url>; rel="relation"} entries separated by commas).
 *
 * <p>
 * Only the {@code page} query parameter of each link matters for pagination. A numeric value is a page index; any
 * other value is an opaque bookmark token, except {@value #FIRST_TOKEN} on a {@code last} link, which the server uses
 * for a cursor-paginated result that fits on one page.
 * </p>
 */
public final class LinkHeader {

    public static final String NEXT = "next";
    public static final String LAST = "last";
    public static final String CURRENT = "current";
    public static final String FIRST_TOKEN = "first";

    private static final Pattern ENTRY = Pattern.compile("<([^>]+)>\\s*;\\s*rel=\"([^\"]+)\"");
    private static final LinkHeader EMPTY = new LinkHeader(Map.of());

    private final Map<String, String> links;

    private LinkHeader(Map<String, String> links) {
        this.links = links;
    }

    public static LinkHeader parse(String header) {
        if (header == null || header.isBlank()) {
            return EMPTY;
        }
        Map<String, String> links = new LinkedHashMap<>();
        Matcher matcher = ENTRY.matcher(header);
        while (matcher.find()) {
            links.putIfAbsent(matcher.group(2).trim(), matcher.group(1).trim());
        }
        return new LinkHeader(Collections.unmodifiableMap(links));
    }

    public boolean has(String rel) {
        return links.containsKey(rel);
    }

    public String url(String rel) {
        return links.get(rel);
    }

    /**
     * @return raw {@code page} parameter of the link, or {@code null}.
     */
    public String pageToken(String rel) {
        return UrlUtil.queryParameter(links.get(rel), "page");
    }

    /**
     * @return the numeric page index of the link, or {@code null} when absent or not numeric.
     */
    public Integer pageNumber(String rel) {
        String token = pageToken(rel);
        if (!UrlUtil.isNumeric(token)) {
            return null;
        }
        try {
            return Integer.parseInt(token);
        } catch (NumberFormatException ex) {
            return null;
        }
    }

    /**
     * @return {@code true} when the link exists and its page parameter is not a usable page index (an opaque token,
     *     or digits beyond the {@code int} range).
     */
    public boolean isBookmark(String rel) {
        return has(rel) && pageNumber(rel) == null;
    }

    public Map<String, String> asMap() {
        return links;
    }
}
