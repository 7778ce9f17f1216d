package io.multicurl.sdk.internal;

import io.multicurl.sdk.MultiCurlException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * Blocking helpers used at the synchronous edges of the SDK.
 */
public final class Futures {

    private Futures() {
    }

    public static <T> T await(CompletableFuture<T> future, String operation) throws MultiCurlException {
        try {
            return future.get();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new MultiCurlException(operation + " interrupted", ex);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() == null ? ex : ex.getCause();
            throw new MultiCurlException(operation + ": " + cause.getMessage(), cause);
        }
    }

    /**
     * Waits for every future and returns their values in input order.
     */
    public static <T> List<T> awaitAll(List<CompletableFuture<T>> futures, String operation) throws MultiCurlException {
        await(CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0])), operation);
        List<T> results = new ArrayList<>(futures.size());
        for (CompletableFuture<T> future : futures) {
            results.add(future.join());
        }
        return results;
    }

    public static void pause(Duration delay, String operation) throws MultiCurlException {
        if (delay == null || delay.isZero() || delay.isNegative()) {
            return;
        }
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new MultiCurlException(operation + " interrupted", ex);
        }
    }
}
