package io.multicurl.sdk.ratelimit;

import java.util.Map;

/**
 * Computes how long to wait before resubmitting a request the server rejected for exceeding its rate limit.
 *
 * <p>
 * The delay is derived from the rate-limit headers of the rejected response:
 * </p>
 * <ul>
 *   <li>{@code x-rate-limit-remaining} below zero: the bucket is overdrawn, back off 150 ms per unit of overdraft.</li>
 *   <li>remaining above zero and a non-zero {@code x-request-cost}: {@code ceil((300 / remaining) * 500 * cost)} ms,
 *       so the delay grows as the remaining budget shrinks and scales with the cost of the request.</li>
 *   <li>otherwise one second.</li>
 * </ul>
 * The result is a heuristic. The retry loop re-checks every attempt regardless of the delay chosen.
 */
public final class BackoffCalculator {

    public static final String REMAINING_HEADER = "x-rate-limit-remaining";
    public static final String COST_HEADER = "x-request-cost";
    public static final long DEFAULT_DELAY_MILLIS = 1000L;

    static final double OVERDRAFT_MILLIS_PER_UNIT = 150d;
    static final double BUDGET_SCALE = 300d;
    static final double COST_SCALE_MILLIS = 500d;

    private BackoffCalculator() {
    }

    /**
     * @param headers response headers keyed by lower-cased name.
     * @return delay in milliseconds, never negative.
     */
    public static long delayMillis(Map<String, String> headers) {
        if (headers == null) {
            return DEFAULT_DELAY_MILLIS;
        }
        return delayMillis(parse(headers.get(REMAINING_HEADER)), parse(headers.get(COST_HEADER)));
    }

    /**
     * @param remaining parsed {@code x-rate-limit-remaining}, {@code null} when absent or unparseable.
     * @param cost      parsed {@code x-request-cost}, {@code null} when absent or unparseable.
     */
    public static long delayMillis(Double remaining, Double cost) {
        if (remaining != null && remaining < 0) {
            return (long) Math.ceil(Math.abs(remaining) * OVERDRAFT_MILLIS_PER_UNIT);
        }
        if (remaining != null && remaining > 0 && cost != null && cost != 0) {
            return (long) Math.ceil((BUDGET_SCALE / remaining) * COST_SCALE_MILLIS * Math.abs(cost));
        }
        return DEFAULT_DELAY_MILLIS;
    }

    private static Double parse(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            double parsed = Double.parseDouble(value.trim());
            return Double.isFinite(parsed) ? parsed : null;
        } catch (NumberFormatException ex) {
            return null;
        }
    }
}
