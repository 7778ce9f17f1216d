package io.multicurl.sdk.transport;

import io.multicurl.sdk.RequestConfig;
import io.multicurl.sdk.ResponseEnvelope;
import io.multicurl.sdk.internal.Json;
import io.multicurl.sdk.internal.UrlUtil;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link Transport} backed by the JDK {@link HttpClient}. Payloads are serialised with the shared Jackson mapper and
 * response bodies are decoded leniently.
 */
public final class HttpTransport implements Transport {

    private static final Logger LOGGER = Logger.getLogger(HttpTransport.class.getName());

    private final HttpClient httpClient;
    private final Duration requestTimeout;

    public HttpTransport(HttpClient httpClient, Duration requestTimeout) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.requestTimeout = requestTimeout == null || requestTimeout.isZero() || requestTimeout.isNegative()
            ? Duration.ofSeconds(30) : requestTimeout;
    }

    @Override
    public ResponseEnvelope exchange(RequestConfig request) {
        HttpResponse<byte[]> response;
        try {
            response = httpClient.send(buildRequest(request), HttpResponse.BodyHandlers.ofByteArray());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            LOGGER.warning(() -> String.format(Locale.ROOT,
                "[multicurl] request to %s interrupted", request.url()));
            return ResponseEnvelope.failure();
        } catch (IOException | IllegalArgumentException ex) {
            LOGGER.log(Level.WARNING, ex, () -> String.format(Locale.ROOT,
                "[multicurl] error during request to %s: %s", request.url(), ex.getMessage()));
            return ResponseEnvelope.failure();
        }

        return new ResponseEnvelope(
            response.statusCode(),
            flattenHeaders(response.headers().map()),
            Json.parseLenient(response.body())
        );
    }

    private HttpRequest buildRequest(RequestConfig request) throws IOException {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
            .uri(UrlUtil.toUri(request.url()))
            .timeout(requestTimeout);

        if (request.hasBody()) {
            byte[] body = Json.mapper().writeValueAsBytes(request.body());
            builder.method(request.method(), HttpRequest.BodyPublishers.ofByteArray(body));
        } else {
            builder.method(request.method(), HttpRequest.BodyPublishers.noBody());
        }

        request.headers().forEach(builder::header);
        if (request.headers().keySet().stream().noneMatch("accept"::equalsIgnoreCase)) {
            builder.header("Accept", "application/json");
        }
        return builder.build();
    }

    private static Map<String, String> flattenHeaders(Map<String, List<String>> raw) {
        Map<String, String> headers = new HashMap<>();
        raw.forEach((name, values) -> {
            if (name == null || values == null || values.isEmpty()) {
                return;
            }
            headers.put(name.toLowerCase(Locale.ROOT), String.join(", ", values));
        });
        return headers;
    }
}
