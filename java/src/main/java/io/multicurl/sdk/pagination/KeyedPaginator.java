package io.multicurl.sdk.pagination;

import com.fasterxml.jackson.databind.JsonNode;
import io.multicurl.sdk.ListOptions;
import io.multicurl.sdk.MultiCurlException;
import io.multicurl.sdk.RequestConfig;
import io.multicurl.sdk.ResponseEnvelope;
import io.multicurl.sdk.internal.Futures;
import io.multicurl.sdk.ratelimit.RetryController;
import io.multicurl.sdk.ratelimit.RetryLedger;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Fetches every page of the same paginated resource for many keys at once (for example the assignments of many
 * courses), sharing one work queue between all keys.
 *
 * <p>
 * Each round tops the queue up with the first page of keys not started yet, sends at most {@code maxBatchSize} queued
 * requests, and queues whatever pages the responses reveal for their key instead of waiting on them. Page discovery
 * follows the same {@code Link} rules as {@link Paginator}; each key owns its own {@link PaginationCursor}. A request
 * that fails after retries is dropped with a warning: other pages of the key and every other key carry on.
 * </p>
 */
public final class KeyedPaginator {

    public static final String KEY_PLACEHOLDER = "<key>";

    private static final Logger LOGGER = Logger.getLogger(KeyedPaginator.class.getName());
    private static final int OK = 200;

    private final RetryController retries;
    private final Function<String, RequestConfig> requests;

    public KeyedPaginator(RetryController retries, Function<String, RequestConfig> requests) {
        this.retries = Objects.requireNonNull(retries, "retries");
        this.requests = Objects.requireNonNull(requests, "requests");
    }

    /**
     * @param template    absolute URL containing {@value #KEY_PLACEHOLDER}, without page parameters.
     * @param keys        keys substituted into the template; duplicates are fetched once.
     * @param options     resolved list options; {@code batchDelay} is the idle time after each drained batch.
     * @param accumulators creates the accumulator of each key.
     * @return one result per key, in key order. Keys whose requests all failed map to an empty result.
     * @throws MultiCurlException when the calling thread is interrupted or a batch fails unexpectedly.
     */
    public <R> Map<String, R> fetch(
        String template,
        List<String> keys,
        ListOptions options,
        Supplier<? extends PageAccumulator<R>> accumulators
    ) throws MultiCurlException {
        Objects.requireNonNull(template, "template");
        Objects.requireNonNull(keys, "keys");
        Objects.requireNonNull(options, "options");
        Objects.requireNonNull(accumulators, "accumulators");
        if (!template.contains(KEY_PLACEHOLDER)) {
            throw new IllegalArgumentException("template must contain " + KEY_PLACEHOLDER);
        }

        Map<String, KeyState<R>> states = new LinkedHashMap<>();
        Deque<WorkItem<R>> queue = new ArrayDeque<>();
        RetryLedger ledger = new RetryLedger();
        int maxBatch = options.getMaxBatchSize();
        int nextKey = 0;

        while (nextKey < keys.size() || !queue.isEmpty()) {
            while (queue.size() < maxBatch && nextKey < keys.size()) {
                String key = keys.get(nextKey++);
                if (key == null || states.containsKey(key)) {
                    continue;
                }
                String baseUrl = template.replace(KEY_PLACEHOLDER, key);
                KeyState<R> state = new KeyState<>(key, new Paginator.PageQuery(baseUrl, options), accumulators.get());
                states.put(key, state);
                state.highestScheduled = 1;
                queue.addLast(new WorkItem<>(state, state.query.page(1), 1));
            }
            if (queue.isEmpty()) {
                break;
            }

            List<WorkItem<R>> batch = new ArrayList<>();
            List<CompletableFuture<Optional<ResponseEnvelope>>> inFlight = new ArrayList<>();
            while (batch.size() < maxBatch && !queue.isEmpty()) {
                WorkItem<R> item = queue.pollFirst();
                batch.add(item);
                inFlight.add(retries.process(requests.apply(item.url()), ledger));
            }

            List<Optional<ResponseEnvelope>> responses = Futures.awaitAll(inFlight, "fetch " + template);
            for (int i = 0; i < batch.size(); i++) {
                absorb(batch.get(i), responses.get(i), queue, options.getPerPage());
            }

            Futures.pause(options.getBatchDelay(), "fetch " + template);
        }

        Map<String, R> results = new LinkedHashMap<>();
        states.forEach((key, state) -> results.put(key, state.accumulator.result()));
        return results;
    }

    private static <R> void absorb(
        WorkItem<R> item,
        Optional<ResponseEnvelope> response,
        Deque<WorkItem<R>> queue,
        int perPage
    ) {
        if (response.isEmpty() || response.get().status() == null || response.get().status() != OK) {
            Integer status = response.map(ResponseEnvelope::status).orElse(null);
            LOGGER.warning(() -> String.format(Locale.ROOT,
                "[multicurl] failed to fetch data for %s (status %s)", item.url(), status == null ? "none" : status));
            return;
        }

        KeyState<R> state = item.state();
        ResponseEnvelope envelope = response.get();
        JsonNode data = envelope.data();
        state.accumulator.accept(item.page(), data);

        LinkHeader links = LinkHeader.parse(envelope.header("link"));
        PaginationCursor cursor = state.cursor;

        if (cursor.isBookmark()) {
            if (!item.url().equals(cursor.nextUrl())) {
                // numeric page scheduled before the switch; only the cursor page may advance
                return;
            }
            String next = links.url(LinkHeader.NEXT);
            if (next != null && !next.equals(item.url())) {
                cursor.advance(next);
                queue.addLast(new WorkItem<>(state, next, ++state.highestScheduled));
            } else {
                cursor.advance(null);
            }
            return;
        }

        if (cursor.lastPageKnown()) {
            return;
        }

        int count = PageAccumulator.itemCount(data);
        Integer current = links.pageNumber(LinkHeader.CURRENT);
        int page = current == null ? item.page() : current;

        if (cursor.mode() == PaginationCursor.Mode.UNKNOWN) {
            Paginator.seed(cursor, links);
        } else {
            Paginator.refine(cursor, page, count, perPage, links);
        }

        if (cursor.isBookmark()) {
            // numbered after every numeric page already queued so no fetched page is replaced
            queue.addLast(new WorkItem<>(state, cursor.nextUrl(), ++state.highestScheduled));
            LOGGER.info(() -> String.format(Locale.ROOT,
                "[multicurl] key %s switched to bookmark pagination", state.key));
            return;
        }
        for (int p = state.highestScheduled + 1; p <= cursor.totalPages(); p++) {
            queue.addLast(new WorkItem<>(state, state.query.page(p), p));
        }
        state.highestScheduled = Math.max(state.highestScheduled, cursor.totalPages());
    }

    private static final class KeyState<R> {
        private final String key;
        private final Paginator.PageQuery query;
        private final PageAccumulator<R> accumulator;
        private final PaginationCursor cursor = new PaginationCursor();
        private int highestScheduled;

        private KeyState(String key, Paginator.PageQuery query, PageAccumulator<R> accumulator) {
            this.key = key;
            this.query = query;
            this.accumulator = accumulator;
        }
    }

    private record WorkItem<R>(KeyState<R> state, String url, int page) {
    }
}
