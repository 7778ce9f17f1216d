package io.multicurl.sdk.ratelimit;

import io.multicurl.sdk.RequestConfig;
import io.multicurl.sdk.ResponseEnvelope;
import io.multicurl.sdk.internal.ApiErrorDecoder;
import io.multicurl.sdk.internal.Json;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.logging.Logger;

/**
 * Runs requests through the {@link RequestScheduler} and resubmits the ones the server rejected for exceeding its
 * rate limit.
 *
 * <p>
 * A rejection is a {@code 403} whose body contains {@value #RATE_LIMIT_MARKER}. Each rejection increments the
 * {@link RetryLedger} entry for the request URL; while the count stays within {@code maxRetries} the same
 * {@link RequestConfig} is requeued after the delay computed by {@link BackoffCalculator}. Beyond that the request is
 * abandoned with an empty result. Retries are requeued onto the scheduler rather than awaited on the calling stack.
 * </p>
 *
 * <p>
 * Other {@code 403}s and transport failures yield an empty result and are never retried. Every other envelope is
 * passed through unchanged.
 * </p>
 */
public final class RetryController {

    public static final String RATE_LIMIT_MARKER = "Rate Limit Exceeded";
    public static final int DEFAULT_MAX_RETRIES = 5;

    private static final Logger LOGGER = Logger.getLogger(RetryController.class.getName());
    private static final int FORBIDDEN = 403;

    private final RequestScheduler scheduler;
    private final int maxRetries;

    public RetryController(RequestScheduler scheduler) {
        this(scheduler, DEFAULT_MAX_RETRIES);
    }

    public RetryController(RequestScheduler scheduler, int maxRetries) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.maxRetries = maxRetries < 0 ? DEFAULT_MAX_RETRIES : maxRetries;
    }

    /**
     * @return a future that never completes exceptionally; empty when the request failed for good.
     */
    public CompletableFuture<Optional<ResponseEnvelope>> process(RequestConfig request, RetryLedger ledger) {
        Objects.requireNonNull(request, "request");
        Objects.requireNonNull(ledger, "ledger");
        return scheduler.submit(request).thenCompose(envelope -> handle(request, ledger, envelope));
    }

    /**
     * @return {@code true} for a 403 whose body, as text, contains the rate-limit marker.
     */
    public static boolean isRateLimited(ResponseEnvelope envelope) {
        if (envelope == null || envelope.status() == null || envelope.status() != FORBIDDEN) {
            return false;
        }
        return Json.asText(envelope.data()).contains(RATE_LIMIT_MARKER);
    }

    private CompletableFuture<Optional<ResponseEnvelope>> handle(
        RequestConfig request,
        RetryLedger ledger,
        ResponseEnvelope envelope
    ) {
        if (envelope.isTransportFailure()) {
            LOGGER.warning(() -> String.format(Locale.ROOT,
                "[multicurl] error during request to %s; not retrying", request.url()));
            return CompletableFuture.completedFuture(Optional.empty());
        }

        if (envelope.status() == FORBIDDEN) {
            if (!isRateLimited(envelope)) {
                String message = ApiErrorDecoder.message(envelope.data());
                LOGGER.warning(() -> String.format(Locale.ROOT,
                    "[multicurl] request to %s forbidden: %s", request.url(),
                    message == null ? "no message" : message));
                return CompletableFuture.completedFuture(Optional.empty());
            }

            int attempt = ledger.increment(request.url());
            if (attempt > maxRetries) {
                LOGGER.severe(() -> String.format(Locale.ROOT,
                    "[multicurl] exceeded retry limit for %s", request.url()));
                return CompletableFuture.completedFuture(Optional.empty());
            }

            long delay = BackoffCalculator.delayMillis(envelope.headers());
            LOGGER.warning(() -> String.format(Locale.ROOT,
                "[multicurl] rate limit reached, retrying %s in %d ms (attempt %d of %d)",
                request.url(), delay, attempt, maxRetries));
            return scheduler.delay(delay).thenCompose(ignored -> process(request, ledger));
        }

        return CompletableFuture.completedFuture(Optional.of(envelope));
    }
}
