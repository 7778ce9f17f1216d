package io.multicurl.sdk.internal;

import io.multicurl.sdk.MultiCurlApiException;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class ApiErrorDecoderTest {

    @Test
    void readsMessageFromErrorsArray() throws Exception {
        MultiCurlApiException ex = ApiErrorDecoder.decode(401,
            Json.mapper().readTree("{\"errors\":[{\"message\":\"Invalid access token.\"}]}"));

        assertEquals(401, ex.getStatusCode());
        assertEquals("Invalid access token.", ex.getMessage());
    }

    @Test
    void readsTopLevelMessage() throws Exception {
        assertEquals("gone", ApiErrorDecoder.message(Json.mapper().readTree("{\"message\":\"gone\"}")));
    }

    @Test
    void usesTextBodiesVerbatim() {
        assertEquals("403 Forbidden (Rate Limit Exceeded)",
            ApiErrorDecoder.message(Json.parseLenient("403 Forbidden (Rate Limit Exceeded)".getBytes(StandardCharsets.UTF_8))));
    }

    @Test
    void fallsBackToStatusMessage() {
        MultiCurlApiException ex = ApiErrorDecoder.decode(502, null);

        assertEquals("request failed with status 502", ex.getMessage());
        assertNull(ApiErrorDecoder.message(Json.mapper().createObjectNode()));
    }
}
