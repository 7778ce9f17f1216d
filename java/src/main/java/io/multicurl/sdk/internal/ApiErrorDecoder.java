package io.multicurl.sdk.internal;

import com.fasterxml.jackson.databind.JsonNode;
import io.multicurl.sdk.MultiCurlApiException;

/**
 * Utility for decoding error payloads returned by the API.
 *
 * <p>
 * Handles both shapes the server emits: {@code {"errors":[{"message":"..."}]}} and {@code {"message":"..."}}. Plain
 * text bodies are used as the message verbatim.
 * </p>
 */
public final class ApiErrorDecoder {

    private ApiErrorDecoder() {
    }

    public static MultiCurlApiException decode(int statusCode, JsonNode body) {
        return new MultiCurlApiException(statusCode, message(body));
    }

    public static String message(JsonNode body) {
        if (body == null || body.isNull() || body.isMissingNode()) {
            return null;
        }
        if (body.isTextual()) {
            String text = body.asText();
            return text.isBlank() ? null : text;
        }
        JsonNode errors = body.path("errors");
        if (errors.isArray()) {
            for (JsonNode error : errors) {
                if (error.hasNonNull("message")) {
                    return error.get("message").asText();
                }
            }
        } else if (errors.isObject() && errors.hasNonNull("message")) {
            return errors.get("message").asText();
        }
        if (body.hasNonNull("message")) {
            return body.get("message").asText();
        }
        return null;
    }
}
