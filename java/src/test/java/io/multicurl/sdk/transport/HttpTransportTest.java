package io.multicurl.sdk.transport;

import com.fasterxml.jackson.databind.JsonNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.multicurl.sdk.RequestConfig;
import io.multicurl.sdk.ResponseEnvelope;
import io.multicurl.sdk.internal.Json;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class HttpTransportTest {

    private HttpServer server;
    private String baseUrl;
    private HttpTransport transport;
    private volatile String lastMethod;
    private volatile String lastBody;
    private volatile String lastAuthorization;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress(0), 0);
        server.createContext("/items", exchange -> {
            capture(exchange);
            exchange.getResponseHeaders().add("Link", "<http://x/items?page=2>; rel=\"next\"");
            exchange.getResponseHeaders().add("X-Rate-Limit-Remaining", "512.5");
            respond(exchange, 200, "[{\"id\":1},{\"id\":2}]");
        });
        server.createContext("/echo", exchange -> {
            capture(exchange);
            respond(exchange, 201, lastBody);
        });
        server.createContext("/limited", exchange -> {
            capture(exchange);
            respond(exchange, 403, "403 Forbidden (Rate Limit Exceeded)");
        });
        server.createContext("/empty", exchange -> {
            capture(exchange);
            exchange.sendResponseHeaders(204, -1);
            exchange.close();
        });
        server.start();
        baseUrl = "http://localhost:" + server.getAddress().getPort();
        transport = new HttpTransport(
            HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(5)).build(), Duration.ofSeconds(5));
    }

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop(0);
        }
    }

    @Test
    void parsesJsonBodyAndLowerCasesHeaders() {
        ResponseEnvelope envelope = transport.exchange(
            RequestConfig.get(baseUrl + "/items", Map.of("Authorization", "Bearer abc")));

        assertEquals(200, envelope.status());
        assertTrue(envelope.data().isArray());
        assertEquals(2, envelope.data().size());
        assertEquals("<http://x/items?page=2>; rel=\"next\"", envelope.headers().get("link"));
        assertEquals("512.5", envelope.header("X-Rate-Limit-Remaining"));
        assertEquals("GET", lastMethod);
        assertEquals("Bearer abc", lastAuthorization);
    }

    @Test
    void serialisesBodyForPost() throws Exception {
        RequestConfig request = new RequestConfig(baseUrl + "/echo", "post",
            Map.of("Content-Type", "application/json"), Map.of("enrollment", Map.of("user_id", 7)));

        ResponseEnvelope envelope = transport.exchange(request);

        assertEquals(201, envelope.status());
        assertEquals("POST", lastMethod);
        JsonNode sent = Json.mapper().readTree(lastBody);
        assertEquals(7, sent.path("enrollment").path("user_id").asInt());
        assertEquals(7, envelope.data().path("enrollment").path("user_id").asInt());
    }

    @Test
    void keepsPlainTextBodyAsText() {
        ResponseEnvelope envelope = transport.exchange(RequestConfig.get(baseUrl + "/limited", Map.of()));

        assertEquals(403, envelope.status());
        assertTrue(envelope.data().isTextual());
        assertEquals("403 Forbidden (Rate Limit Exceeded)", envelope.data().asText());
    }

    @Test
    void emptyBodyHasNoData() {
        ResponseEnvelope envelope = transport.exchange(RequestConfig.get(baseUrl + "/empty", Map.of()));

        assertEquals(204, envelope.status());
        assertNull(envelope.data());
    }

    @Test
    void unreachableServerYieldsFailureEnvelope() {
        server.stop(0);
        server = null;

        ResponseEnvelope envelope = transport.exchange(RequestConfig.get(baseUrl + "/items", Map.of()));

        assertTrue(envelope.isTransportFailure());
        assertNull(envelope.status());
        assertTrue(envelope.headers().isEmpty());
        assertNull(envelope.data());
    }

    @Test
    void malformedUrlYieldsFailureEnvelope() {
        ResponseEnvelope envelope = transport.exchange(RequestConfig.get("http://local host/items", Map.of()));

        assertTrue(envelope.isTransportFailure());
    }

    private void capture(HttpExchange exchange) throws IOException {
        lastMethod = exchange.getRequestMethod();
        lastAuthorization = exchange.getRequestHeaders().getFirst("Authorization");
        lastBody = new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
    }

    private static void respond(HttpExchange exchange, int status, String body) throws IOException {
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }
}
