package io.multicurl.sdk.pagination;

import com.fasterxml.jackson.databind.JsonNode;
import io.multicurl.sdk.ListOptions;
import io.multicurl.sdk.MultiCurlException;
import io.multicurl.sdk.RequestConfig;
import io.multicurl.sdk.ResponseEnvelope;
import io.multicurl.sdk.internal.ApiErrorDecoder;
import io.multicurl.sdk.internal.Futures;
import io.multicurl.sdk.internal.UrlUtil;
import io.multicurl.sdk.ratelimit.RetryController;
import io.multicurl.sdk.ratelimit.RetryLedger;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;
import java.util.logging.Logger;

/**
 * Fetches every page of one paginated resource.
 *
 * <h2>Numeric pagination</h2>
 * <p>
 * Page 1 is fetched first; its failure is fatal. Its {@code Link} header seeds a {@link PaginationCursor}: a numeric
 * {@code last} link fixes the total, {@code last} pointing at {@value LinkHeader#FIRST_TOKEN} means a single page, and
 * a numeric {@code next} link seeds a deliberately low estimate of next + 1. Remaining pages are then requested in
 * batches of up to {@code maxBatchSize}, each batch awaited as a whole and followed by {@code batchDelay} of idle time.
 * Until the total is known, every full page (or page without a {@code next} link) is inspected again: a {@code last}
 * link fixes the total, a missing {@code next} link marks that page as the last one, a numeric {@code next} link
 * raises the estimate to at least that page + {@value #SPECULATIVE_STEP}. Pages requested past the real end come back
 * empty and are discarded.
 * </p>
 *
 * <h2>Bookmark pagination</h2>
 * <p>
 * When a {@code next} link carries a non-numeric token, each cursor is only discoverable from the previous page, so
 * pages are fetched strictly one at a time until a page has no {@code next} link. Numeric speculation is never
 * resumed for that resource.
 * </p>
 *
 * <p>
 * A page that still fails after the retry controller gave up is logged and skipped; sibling pages are unaffected.
 * </p>
 */
public final class Paginator {

    public static final int SPECULATIVE_STEP = 10;

    private static final Logger LOGGER = Logger.getLogger(Paginator.class.getName());

    private final RetryController retries;
    private final Function<String, RequestConfig> requests;

    /**
     * @param retries  retry controller all page requests go through.
     * @param requests builds the GET request (credentials included) for a page URL.
     */
    public Paginator(RetryController retries, Function<String, RequestConfig> requests) {
        this.retries = Objects.requireNonNull(retries, "retries");
        this.requests = Objects.requireNonNull(requests, "requests");
    }

    /**
     * Fetches every page of {@code baseUrl} into {@code accumulator}.
     *
     * @param baseUrl     absolute resource URL, without page parameters.
     * @param options     resolved list options (see {@link ListOptions#withDefaults}).
     * @param accumulator receives each page body.
     * @return the accumulator's result.
     * @throws MultiCurlException when the first page cannot be fetched, or the calling thread is interrupted.
     */
    public <R> R fetch(String baseUrl, ListOptions options, PageAccumulator<R> accumulator) throws MultiCurlException {
        Objects.requireNonNull(baseUrl, "baseUrl");
        Objects.requireNonNull(options, "options");
        Objects.requireNonNull(accumulator, "accumulator");

        PageQuery query = new PageQuery(baseUrl, options);
        RetryLedger ledger = new RetryLedger();

        ResponseEnvelope first = firstPage(query, ledger);
        accumulator.accept(1, first.data());

        PaginationCursor cursor = new PaginationCursor();
        seed(cursor, LinkHeader.parse(first.header("link")));
        LOGGER.info(() -> String.format(Locale.ROOT,
            "[multicurl] %s: first page returned %d items, pagination %s",
            baseUrl, PageAccumulator.itemCount(first.data()), cursor));

        if (cursor.isSinglePage()) {
            return accumulator.result();
        }

        int page = 2;
        while (!cursor.isBookmark() && page <= cursor.totalPages()) {
            List<Integer> pages = new ArrayList<>();
            List<CompletableFuture<Optional<ResponseEnvelope>>> batch = new ArrayList<>();
            for (int i = 0; i < options.getMaxBatchSize() && page <= cursor.totalPages(); i++, page++) {
                pages.add(page);
                batch.add(retries.process(requests.apply(query.page(page)), ledger));
            }

            List<Optional<ResponseEnvelope>> responses = Futures.awaitAll(batch, "fetch " + baseUrl);
            for (int i = 0; i < responses.size(); i++) {
                absorb(baseUrl, pages.get(i), responses.get(i), cursor, accumulator, options.getPerPage());
            }

            Futures.pause(options.getBatchDelay(), "fetch " + baseUrl);
        }

        if (cursor.isBookmark()) {
            walkBookmarks(baseUrl, cursor, page, ledger, accumulator, options);
        }
        return accumulator.result();
    }

    private ResponseEnvelope firstPage(PageQuery query, RetryLedger ledger) throws MultiCurlException {
        String url = query.page(1);
        Optional<ResponseEnvelope> response = Futures.await(
            retries.process(requests.apply(url), ledger), "fetch " + query.baseUrl());
        if (response.isEmpty()) {
            throw new MultiCurlException("failed to fetch initial data from " + url);
        }
        ResponseEnvelope envelope = response.get();
        if (!envelope.isSuccess()) {
            throw ApiErrorDecoder.decode(envelope.status(), envelope.data());
        }
        if (envelope.data() == null) {
            throw new MultiCurlException("failed to fetch initial data from " + url + ": empty body");
        }
        return envelope;
    }

    /**
     * Applies the first page's links to a fresh cursor.
     */
    static void seed(PaginationCursor cursor, LinkHeader links) {
        if (links.has(LinkHeader.LAST)) {
            Integer last = links.pageNumber(LinkHeader.LAST);
            if (last != null) {
                cursor.fix(last);
                return;
            }
            if (LinkHeader.FIRST_TOKEN.equals(links.pageToken(LinkHeader.LAST))) {
                cursor.fix(1);
                return;
            }
        }
        if (!links.has(LinkHeader.NEXT)) {
            cursor.fix(1);
            return;
        }
        if (links.isBookmark(LinkHeader.NEXT)) {
            cursor.enterBookmark(links.url(LinkHeader.NEXT));
            return;
        }
        cursor.estimate(links.pageNumber(LinkHeader.NEXT) + 1);
    }

    /**
     * Updates the cursor from a page fetched after the first one, if the page says anything new.
     */
    static void refine(PaginationCursor cursor, int page, int itemCount, int perPage, LinkHeader links) {
        if (cursor.lastPageKnown() || cursor.isBookmark()) {
            return;
        }
        boolean terminal = itemCount == 0 || !links.has(LinkHeader.NEXT);
        if (!terminal && itemCount < perPage) {
            return;
        }
        Integer last = links.pageNumber(LinkHeader.LAST);
        if (last != null) {
            cursor.fix(last);
        } else if (terminal) {
            cursor.fix(page);
        } else if (links.isBookmark(LinkHeader.NEXT)) {
            cursor.enterBookmark(links.url(LinkHeader.NEXT));
        } else {
            cursor.estimate(page + SPECULATIVE_STEP);
        }
    }

    private static <R> void absorb(
        String baseUrl,
        int page,
        Optional<ResponseEnvelope> response,
        PaginationCursor cursor,
        PageAccumulator<R> accumulator,
        int perPage
    ) {
        if (response.isEmpty() || !response.get().isSuccess()) {
            Integer status = response.map(ResponseEnvelope::status).orElse(null);
            LOGGER.warning(() -> String.format(Locale.ROOT,
                "[multicurl] %s: dropping page %d (status %s)", baseUrl, page, status == null ? "none" : status));
            return;
        }
        ResponseEnvelope envelope = response.get();
        JsonNode data = envelope.data();
        int count = PageAccumulator.itemCount(data);
        if (count > 0) {
            accumulator.accept(page, data);
        }

        PaginationCursor.Mode before = cursor.mode();
        int totalBefore = cursor.totalPages();
        refine(cursor, page, count, perPage, LinkHeader.parse(envelope.header("link")));
        if (cursor.mode() != before || cursor.totalPages() != totalBefore) {
            LOGGER.info(() -> String.format(Locale.ROOT,
                "[multicurl] %s: page %d moved pagination to %s", baseUrl, page, cursor));
        }
    }

    private <R> void walkBookmarks(
        String baseUrl,
        PaginationCursor cursor,
        int firstPage,
        RetryLedger ledger,
        PageAccumulator<R> accumulator,
        ListOptions options
    ) throws MultiCurlException {
        int page = firstPage;
        String url = cursor.nextUrl();
        while (url != null) {
            String current = url;
            Optional<ResponseEnvelope> response = Futures.await(
                retries.process(requests.apply(current), ledger), "fetch " + baseUrl);
            if (response.isEmpty() || !response.get().isSuccess()) {
                LOGGER.warning(() -> String.format(Locale.ROOT,
                    "[multicurl] %s: bookmark page %s failed; remaining pages are unreachable", baseUrl, current));
                return;
            }

            ResponseEnvelope envelope = response.get();
            accumulator.accept(page++, envelope.data());

            String next = LinkHeader.parse(envelope.header("link")).url(LinkHeader.NEXT);
            if (current.equals(next)) {
                LOGGER.warning(() -> String.format(Locale.ROOT,
                    "[multicurl] %s: bookmark %s points at itself; stopping", baseUrl, current));
                next = null;
            }
            cursor.advance(next);
            url = next;

            Futures.pause(options.getBatchDelay(), "fetch " + baseUrl);
        }
    }

    /**
     * Builds page URLs for one resource.
     */
    record PageQuery(String baseUrl, boolean hasQuery, int perPage) {

        PageQuery(String baseUrl, ListOptions options) {
            this(baseUrl, options.hasQuery(baseUrl), options.getPerPage());
        }

        String page(int page) {
            return UrlUtil.appendQuery(baseUrl, "page=" + page + "&per_page=" + perPage, hasQuery);
        }
    }
}
