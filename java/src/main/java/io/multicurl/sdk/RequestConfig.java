package io.multicurl.sdk;

import com.fasterxml.jackson.databind.JsonNode;
import io.multicurl.sdk.internal.Json;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable description of a single HTTP exchange. Retries resubmit the very same instance, so nothing in here may
 * change once constructed.
 *
 * @param url     absolute request URL.
 * @param method  upper-cased HTTP method.
 * @param headers request headers (bearer credential, content type, ...); unmodifiable.
 * @param body    optional payload, captured as a private JSON tree so later changes to the caller's object do not
 *                reach retries; {@code null} for requests without a body.
 */
public record RequestConfig(String url, String method, Map<String, String> headers, JsonNode body) {

    public RequestConfig {
        Objects.requireNonNull(url, "url");
        method = method == null || method.isBlank() ? "GET" : method.trim().toUpperCase(Locale.ROOT);
        headers = headers == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
    }

    /**
     * @param body any Jackson-serialisable payload, or {@code null}.
     * @throws IllegalArgumentException when the payload cannot be converted to JSON.
     */
    public RequestConfig(String url, String method, Map<String, String> headers, Object body) {
        this(url, method, headers, snapshot(body));
    }

    public static RequestConfig get(String url, Map<String, String> headers) {
        return new RequestConfig(url, "GET", headers, null);
    }

    public boolean hasBody() {
        return body != null;
    }

    private static JsonNode snapshot(Object body) {
        if (body == null) {
            return null;
        }
        if (body instanceof JsonNode) {
            return ((JsonNode) body).deepCopy();
        }
        return Json.mapper().valueToTree(body);
    }
}
