package io.multicurl.sdk;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Normalised result of one HTTP exchange. An envelope is always produced: transport faults are represented by
 * {@link #failure()}, which has no status, no headers and no data.
 *
 * @param status  HTTP status, or {@code null} when the exchange never completed.
 * @param headers response headers keyed by lower-cased name.
 * @param data    parsed body (JSON tree, or a text node for non-JSON bodies); {@code null} when empty or absent.
 */
public record ResponseEnvelope(Integer status, Map<String, String> headers, JsonNode data) {

    private static final ResponseEnvelope FAILURE = new ResponseEnvelope(null, Map.of(), null);

    public ResponseEnvelope {
        if (headers == null || headers.isEmpty()) {
            headers = Map.of();
        } else {
            Map<String, String> normalised = new HashMap<>();
            headers.forEach((name, value) -> {
                if (name != null) {
                    normalised.put(name.toLowerCase(Locale.ROOT), value);
                }
            });
            headers = Collections.unmodifiableMap(normalised);
        }
    }

    public static ResponseEnvelope failure() {
        return FAILURE;
    }

    public boolean isTransportFailure() {
        return status == null;
    }

    public boolean isSuccess() {
        return status != null && status >= 200 && status < 300;
    }

    /**
     * Case-insensitive header lookup.
     */
    public String header(String name) {
        return name == null ? null : headers.get(name.toLowerCase(Locale.ROOT));
    }
}
