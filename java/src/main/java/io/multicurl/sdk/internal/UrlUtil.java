package io.multicurl.sdk.internal;

import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;

/**
 * Small helpers for working with page URLs.
 */
public final class UrlUtil {

    private UrlUtil() {
    }

    /**
     * Returns the decoded value of the first {@code name} query parameter in {@code url}, or {@code null} when the
     * parameter is absent.
     */
    public static String queryParameter(String url, String name) {
        if (url == null || name == null) {
            return null;
        }
        String query;
        try {
            query = URI.create(url).getRawQuery();
        } catch (IllegalArgumentException ex) {
            int idx = url.indexOf('?');
            query = idx < 0 ? null : url.substring(idx + 1);
        }
        if (query == null || query.isEmpty()) {
            return null;
        }
        for (String pair : query.split("&")) {
            int eq = pair.indexOf('=');
            String key = eq < 0 ? pair : pair.substring(0, eq);
            if (!name.equals(URLDecoder.decode(key, StandardCharsets.UTF_8))) {
                continue;
            }
            String value = eq < 0 ? "" : pair.substring(eq + 1);
            return URLDecoder.decode(value, StandardCharsets.UTF_8);
        }
        return null;
    }

    /**
     * Appends a query fragment using {@code ?} or {@code &} depending on whether the URL already carries a query.
     */
    public static String appendQuery(String url, String fragment, boolean hasQuery) {
        return url + (hasQuery ? '&' : '?') + fragment;
    }

    /**
     * Parses a request URL, percent-encoding the square brackets of array parameters ({@code ids[]=1}) that
     * {@link URI} does not accept unescaped.
     *
     * @throws IllegalArgumentException when the URL is still malformed.
     */
    public static URI toUri(String url) {
        int idx = url.indexOf('?');
        if (idx < 0) {
            return URI.create(url);
        }
        String query = url.substring(idx).replace("[", "%5B").replace("]", "%5D");
        return URI.create(url.substring(0, idx) + query);
    }

    public static boolean isNumeric(String value) {
        if (value == null || value.isEmpty()) {
            return false;
        }
        for (int i = 0; i < value.length(); i++) {
            if (!Character.isDigit(value.charAt(i))) {
                return false;
            }
        }
        return true;
    }
}
