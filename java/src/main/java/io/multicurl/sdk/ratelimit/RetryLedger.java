package io.multicurl.sdk.ratelimit;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Rate-limit retry counts keyed by request URL, scoped to one logical operation (one list fetch, one keyed
 * aggregation or one concurrent batch). Never shared between operations.
 *
 * <p>
 * Responses of a batch complete on pool threads, so the counters are kept in a concurrent map.
 * </p>
 */
public final class RetryLedger {

    private final Map<String, Integer> counts = new ConcurrentHashMap<>();

    /**
     * Records one more confirmed rate-limit rejection for {@code url}.
     *
     * @return the updated count.
     */
    public int increment(String url) {
        return counts.merge(url, 1, Integer::sum);
    }

    public int count(String url) {
        return counts.getOrDefault(url, 0);
    }
}
