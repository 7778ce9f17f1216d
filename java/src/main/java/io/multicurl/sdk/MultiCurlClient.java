package io.multicurl.sdk;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.multicurl.sdk.internal.Futures;
import io.multicurl.sdk.internal.Json;
import io.multicurl.sdk.pagination.FieldAccumulator;
import io.multicurl.sdk.pagination.KeyedPaginator;
import io.multicurl.sdk.pagination.Paginator;
import io.multicurl.sdk.pagination.RecordAccumulator;
import io.multicurl.sdk.ratelimit.RequestScheduler;
import io.multicurl.sdk.ratelimit.RetryController;
import io.multicurl.sdk.ratelimit.RetryLedger;
import io.multicurl.sdk.transport.HttpTransport;
import io.multicurl.sdk.transport.Transport;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * <p>
 * Primary entry point for consuming a paginated, rate-limited REST API. Create one instance per access token and
 * reuse it: every request made through the client, whatever operation it belongs to, passes through the same
 * {@link RequestScheduler}, which is what keeps the process under the server's request budget.
 * </p>
 *
 * <h2>Key behaviours</h2>
 * <ul>
 *   <li>At most {@link Config#getMaxConcurrent()} requests in flight, starts spaced by at least
 *       {@link Config#getMinSpacing()}.</li>
 *   <li>Requests rejected with a rate-limit {@code 403} are retried with a delay derived from the rate-limit headers,
 *       at most {@link Config#getMaxRetries()} times per URL and operation.</li>
 *   <li>List operations discover the page count from {@code Link} headers, fetch numerically paginated resources in
 *       concurrent batches and cursor-paginated ones strictly in sequence.</li>
 *   <li>Failures of individual pages are logged and skipped; only a failed first page aborts a list fetch.</li>
 * </ul>
 */
public final class MultiCurlClient implements AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger(MultiCurlClient.class.getName());
    private static final Set<String> METHODS_WITH_BODY = Set.of("POST", "PUT");

    private final Config config;
    private final RequestScheduler scheduler;
    private final RetryController retries;
    private final Paginator paginator;
    private final KeyedPaginator keyedPaginator;

    /**
     * Constructs a new client using the supplied configuration.
     *
     * @param config caller-supplied configuration; only {@code baseUrl} and {@code accessToken} are mandatory. The
     *               constructor captures a copy with defaults applied.
     */
    public MultiCurlClient(Config config) {
        Objects.requireNonNull(config, "config");
        this.config = config.withDefaults();
        Transport transport = this.config.getTransport() != null
            ? this.config.getTransport()
            : new HttpTransport(this.config.getHttpClient(), this.config.getHttpTimeout());
        this.scheduler = new RequestScheduler(transport, this.config.getMaxConcurrent(), this.config.getMinSpacing());
        this.retries = new RetryController(scheduler, this.config.getMaxRetries());
        this.paginator = new Paginator(retries, url -> createRequestConfig(url, "GET", null, null));
        this.keyedPaginator = new KeyedPaginator(retries, url -> createRequestConfig(url, "GET", null, null));
    }

    /**
     * Builds a request carrying the bearer credential and a JSON content type.
     *
     * @param url    absolute URL.
     * @param method HTTP method, case-insensitive; defaults to {@code GET}.
     * @param body   payload, attached for {@code POST} and {@code PUT} only.
     * @param prefix when non-null the payload is wrapped as {@code {prefix: body}}, the shape the API expects for
     *               object creation (for example {@code enrollment}).
     */
    public RequestConfig createRequestConfig(String url, String method, Object body, String prefix) {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Authorization", "Bearer " + config.getAccessToken());
        headers.put("Content-Type", "application/json");

        String resolvedMethod = method == null || method.isBlank() ? "GET" : method.trim().toUpperCase(Locale.ROOT);
        Object payload = null;
        if (METHODS_WITH_BODY.contains(resolvedMethod) && body != null) {
            payload = prepareBody(body, prefix);
        }
        return new RequestConfig(url, resolvedMethod, headers, payload);
    }

    /**
     * @return the absolute URL of an API path, e.g. {@code courses/1/assignments}.
     */
    public String apiUrl(String path) {
        Objects.requireNonNull(path, "path");
        String trimmed = path.startsWith("/") ? path.substring(1) : path;
        return config.getBaseUrl() + config.getApiPrefix() + "/" + trimmed;
    }

    /**
     * Performs one request through the scheduler, without rate-limit retries.
     *
     * @return the raw envelope; {@link ResponseEnvelope#failure()} on a transport fault.
     * @throws MultiCurlException when the calling thread is interrupted.
     */
    public ResponseEnvelope request(String path, String method, Object body, String prefix) throws MultiCurlException {
        RequestConfig request = createRequestConfig(apiUrl(path), method, body, prefix);
        return Futures.await(scheduler.submit(request), request.method() + " " + request.url());
    }

    public ResponseEnvelope request(String path) throws MultiCurlException {
        return request(path, "GET", null, null);
    }

    /**
     * Fetches every record of a list endpoint.
     *
     * @param path API path, optionally with its own query string (e.g. {@code courses/1/users?enrollment_type[]=student}).
     * @throws MultiCurlApiException when the first page comes back with an error status.
     * @throws MultiCurlException    when the first page cannot be fetched at all.
     */
    public List<JsonNode> getList(String path) throws MultiCurlException {
        return getList(path, ListOptions.defaults());
    }

    public List<JsonNode> getList(String path, ListOptions options) throws MultiCurlException {
        return paginator.fetch(apiUrl(path), resolve(options), new RecordAccumulator());
    }

    /**
     * Fetches one attribute of every record of a list endpoint.
     *
     * @return record id → {@code {field: value}}; records without an id or the field are left out.
     */
    public Map<String, ObjectNode> getFieldMap(String path, String field) throws MultiCurlException {
        return getFieldMap(path, field, ListOptions.defaults());
    }

    public Map<String, ObjectNode> getFieldMap(String path, String field, ListOptions options)
        throws MultiCurlException {
        return paginator.fetch(apiUrl(path), resolve(options), new FieldAccumulator(field));
    }

    /**
     * Fetches every record of the same list endpoint for many keys at once.
     *
     * @param pathTemplate API path containing {@value KeyedPaginator#KEY_PLACEHOLDER}, e.g.
     *                     {@code courses/<key>/assignments}.
     * @return key → records, in key order. Pages that could not be fetched are missing from their key's list.
     */
    public Map<String, List<JsonNode>> getListsForKeys(String pathTemplate, Collection<?> keys)
        throws MultiCurlException {
        return getListsForKeys(pathTemplate, keys, ListOptions.defaults());
    }

    public Map<String, List<JsonNode>> getListsForKeys(String pathTemplate, Collection<?> keys, ListOptions options)
        throws MultiCurlException {
        return keyedPaginator.fetch(apiUrl(pathTemplate), keyStrings(keys), resolveForKeys(options),
            RecordAccumulator::new);
    }

    public Map<String, Map<String, ObjectNode>> getFieldMapsForKeys(String pathTemplate, Collection<?> keys, String field)
        throws MultiCurlException {
        return getFieldMapsForKeys(pathTemplate, keys, field, ListOptions.defaults());
    }

    public Map<String, Map<String, ObjectNode>> getFieldMapsForKeys(
        String pathTemplate,
        Collection<?> keys,
        String field,
        ListOptions options
    ) throws MultiCurlException {
        Objects.requireNonNull(field, "field");
        return keyedPaginator.fetch(apiUrl(pathTemplate), keyStrings(keys), resolveForKeys(options),
            () -> new FieldAccumulator(field));
    }

    /**
     * Runs unrelated requests concurrently, sharing one retry ledger.
     *
     * @return one entry per request, in input order; empty for requests that failed after retries.
     */
    public List<Optional<ResponseEnvelope>> executeAll(List<RequestConfig> requests) throws MultiCurlException {
        Objects.requireNonNull(requests, "requests");
        RetryLedger ledger = new RetryLedger();
        List<CompletableFuture<Optional<ResponseEnvelope>>> futures = new ArrayList<>(requests.size());
        for (RequestConfig request : requests) {
            futures.add(retries.process(request, ledger));
        }
        List<Optional<ResponseEnvelope>> results = Futures.awaitAll(futures, "concurrent requests");
        LOGGER.fine(() -> String.format(Locale.ROOT,
            "[multicurl] %d concurrent requests finished, %d failed",
            results.size(), results.stream().filter(Optional::isEmpty).count()));
        return results;
    }

    /**
     * Fetches the submissions of a course for the given assignments, optionally restricted to some students.
     */
    public List<JsonNode> getSubmissions(Object courseId, Collection<?> assignmentIds, Collection<?> studentIds)
        throws MultiCurlException {
        Objects.requireNonNull(courseId, "courseId");
        Objects.requireNonNull(assignmentIds, "assignmentIds");
        String query = assignmentIds.stream()
            .map(id -> "assignment_ids[]=" + id)
            .collect(Collectors.joining("&"));
        if (studentIds != null) {
            for (Object studentId : studentIds) {
                query += "&student_ids[]=" + studentId;
            }
        }
        return getList("courses/" + courseId + "/students/submissions?" + query);
    }

    public Config getConfig() {
        return config;
    }

    /**
     * Stops the scheduler's threads. Requests still queued complete as transport failures.
     */
    @Override
    public void close() {
        scheduler.close();
    }

    private ListOptions resolve(ListOptions options) {
        ListOptions requested = options == null ? ListOptions.defaults() : options;
        return requested.withDefaults(config.getPerPage(), config.getMaxBatchSize(), config.getBatchDelay());
    }

    // Keyed rounds idle for keyBatchDelay unless the call sets its own batchDelay.
    private ListOptions resolveForKeys(ListOptions options) {
        ListOptions requested = options == null ? ListOptions.defaults() : options;
        return requested.withDefaults(config.getPerPage(), config.getMaxBatchSize(), config.getKeyBatchDelay());
    }

    private static Object prepareBody(Object body, String prefix) {
        if (prefix == null || prefix.isBlank()) {
            return body;
        }
        ObjectNode wrapped = Json.mapper().createObjectNode();
        wrapped.set(prefix, Json.mapper().valueToTree(body));
        return wrapped;
    }

    private static List<String> keyStrings(Collection<?> keys) {
        Objects.requireNonNull(keys, "keys");
        return keys.stream()
            .filter(Objects::nonNull)
            .map(String::valueOf)
            .collect(Collectors.toList());
    }
}
