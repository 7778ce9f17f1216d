package io.multicurl.sdk.pagination;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.multicurl.sdk.ListOptions;
import io.multicurl.sdk.RequestConfig;
import io.multicurl.sdk.ResponseEnvelope;
import io.multicurl.sdk.internal.Json;
import io.multicurl.sdk.ratelimit.RequestScheduler;
import io.multicurl.sdk.ratelimit.RetryController;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class KeyedPaginatorTest {

    private static final String TEMPLATE = "https://lms.test/api/v1/courses/<key>/assignments";

    private PagedApi api;
    private RequestScheduler scheduler;
    private KeyedPaginator paginator;

    @BeforeEach
    void setUp() {
        api = new PagedApi();
        scheduler = new RequestScheduler(api, 10, Duration.ZERO);
        paginator = new KeyedPaginator(new RetryController(scheduler), url -> RequestConfig.get(url, Map.of()));
    }

    @AfterEach
    void tearDown() {
        scheduler.close();
    }

    @Test
    void collectsEveryPageOfEveryKey() throws Exception {
        api.resource(course(10), PagedApi.Style.LAST, 2, 2, "c10");
        api.resource(course(20), PagedApi.Style.LAST, 2, 6, "c20");

        Map<String, List<JsonNode>> results = fetch(List.of("10", "20"), 2, 40);

        assertEquals(List.of("10", "20"), List.copyOf(results.keySet()));
        assertEquals(List.of("c10-1", "c10-2"), ids(results.get("10")));
        assertEquals(List.of("c20-1", "c20-2", "c20-3", "c20-4", "c20-5", "c20-6"), ids(results.get("20")));
        assertEquals(1, api.requestsFor(course(10)));
        assertEquals(3, api.requestsFor(course(20)));
    }

    @Test
    void speculativeKeysAreCompleteWithoutDuplicates() throws Exception {
        api.resource(course(1), PagedApi.Style.NEXT_ONLY, 3, 31, "a");
        api.resource(course(2), PagedApi.Style.NEXT_ONLY, 3, 1, "b");
        api.resource(course(3), PagedApi.Style.NEXT_ONLY, 3, 9, "c");

        Map<String, List<JsonNode>> results = fetch(List.of("1", "2", "3"), 3, 4);

        assertEquals(31, results.get("1").size());
        assertEquals(31, ids(results.get("1")).stream().distinct().count());
        assertEquals("a-31", ids(results.get("1")).get(30));
        assertEquals(List.of("b-1"), ids(results.get("2")));
        assertEquals(9, results.get("3").size());
    }

    @Test
    void bookmarkKeysAreWalkedOnePageAtATime() throws Exception {
        api.resource(course(7), PagedApi.Style.BOOKMARK, 2, 9, "k");
        api.resource(course(8), PagedApi.Style.LAST, 2, 4, "m");

        Map<String, List<JsonNode>> results = fetch(List.of("7", "8"), 2, 40);

        assertEquals(List.of("k-1", "k-2", "k-3", "k-4", "k-5", "k-6", "k-7", "k-8", "k-9"), ids(results.get("7")));
        assertEquals(4, results.get("8").size());
        assertEquals(1, api.maxInFlight(course(7)));
        assertEquals(5, api.requestsFor(course(7)));
    }

    @Test
    void failedRequestDoesNotAbortSiblingKeys() throws Exception {
        api.resource(course(1), PagedApi.Style.LAST, 2, 4, "a");
        api.resource(course(2), PagedApi.Style.LAST, 2, 6, "b");
        api.script(course(1) + "?page=1&per_page=2", new ResponseEnvelope(500, Map.of(), null));
        api.script(course(2) + "?page=2&per_page=2", ResponseEnvelope.failure());

        Map<String, List<JsonNode>> results = fetch(List.of("1", "2", "404"), 2, 40);

        assertTrue(results.get("1").isEmpty());
        assertEquals(List.of("b-1", "b-2", "b-5", "b-6"), ids(results.get("2")));
        assertTrue(results.get("404").isEmpty());
    }

    @Test
    void extractsFieldPerKey() throws Exception {
        api.resource(course(5), PagedApi.Style.LAST, 2, 3, "x");

        Map<String, Map<String, ObjectNode>> results = paginator.fetch(TEMPLATE, List.of("5"), options(2, 40),
            () -> new FieldAccumulator("name"));

        Map<String, ObjectNode> names = results.get("5");
        assertEquals(3, names.size());
        assertEquals("item 3", names.get("x-3").path("name").asText());
    }

    @Test
    void moreKeysThanBatchSlotsAreAllFetched() throws Exception {
        for (int i = 1; i <= 9; i++) {
            api.resource(course(i), PagedApi.Style.NONE, 10, i, "k" + i);
        }

        Map<String, List<JsonNode>> results = fetch(
            List.of("1", "2", "3", "4", "5", "6", "7", "8", "9", "3"), 10, 2);

        assertEquals(9, results.size());
        for (int i = 1; i <= 9; i++) {
            assertEquals(i, results.get(String.valueOf(i)).size());
        }
        assertEquals(9, api.requests.size());
    }

    @Test
    void switchToBookmarkKeepsPagesAlreadyScheduled() throws Exception {
        String base = course(7);
        api.script(base + "?page=1&per_page=1", page("[{\"id\":\"p1\"}]",
            "<" + base + "?page=2&per_page=1>; rel=\"next\""));
        api.script(base + "?page=2&per_page=1", page("[{\"id\":\"p2\"}]",
            "<" + base + "?page=bookmark:B&per_page=1>; rel=\"next\""));
        api.script(base + "?page=3&per_page=1", page("[{\"id\":\"p3\"}]",
            "<" + base + "?page=4&per_page=1>; rel=\"next\""));
        api.script(base + "?page=bookmark:B&per_page=1", page("[{\"id\":\"bm\"}]", null));

        Map<String, List<JsonNode>> results = fetch(List.of("7"), 1, 40);

        assertEquals(List.of("p1", "p2", "p3", "bm"), ids(results.get("7")));
        assertEquals(4, api.requestsFor(base));
    }

    @Test
    void roundDelayComesFromOptions() throws Exception {
        for (int i = 1; i <= 4; i++) {
            api.resource(course(i), PagedApi.Style.NONE, 10, 1, "k" + i);
        }
        ListOptions slow = ListOptions.builder().perPage(10).maxBatchSize(1).batchDelay(Duration.ofMillis(150)).build();

        long started = System.nanoTime();
        paginator.fetch(TEMPLATE, List.of("1", "2", "3", "4"), slow, RecordAccumulator::new);
        long elapsedMillis = Duration.ofNanos(System.nanoTime() - started).toMillis();

        assertTrue(elapsedMillis >= 550, "elapsed " + elapsedMillis + " ms");
    }

    @Test
    void rejectsTemplateWithoutPlaceholder() {
        assertThrows(IllegalArgumentException.class, () -> paginator.fetch("https://lms.test/api/v1/courses",
            List.of("1"), options(2, 40), RecordAccumulator::new));
    }

    private Map<String, List<JsonNode>> fetch(List<String> keys, int perPage, int maxBatch) throws Exception {
        return paginator.fetch(TEMPLATE, keys, options(perPage, maxBatch), RecordAccumulator::new);
    }

    private static ResponseEnvelope page(String items, String link) throws Exception {
        Map<String, String> headers = link == null ? Map.of() : Map.of("Link", link);
        return new ResponseEnvelope(200, headers, Json.mapper().readTree(items));
    }

    private static String course(int id) {
        return TEMPLATE.replace("<key>", String.valueOf(id));
    }

    private static ListOptions options(int perPage, int maxBatch) {
        return ListOptions.builder()
            .perPage(perPage)
            .maxBatchSize(maxBatch)
            .batchDelay(Duration.ZERO)
            .build();
    }

    private static List<String> ids(List<JsonNode> items) {
        return items.stream().map(item -> item.path("id").asText()).toList();
    }
}
