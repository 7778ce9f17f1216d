package io.multicurl.sdk;

import java.time.Duration;

/**
 * Per-call overrides for list fetches. Unset values fall back to the client's {@link Config}.
 */
public final class ListOptions {

    private final Integer perPage;
    private final Integer maxBatchSize;
    private final Duration batchDelay;
    private final Boolean hasQuery;

    private ListOptions(Builder builder) {
        this.perPage = builder.perPage;
        this.maxBatchSize = builder.maxBatchSize;
        this.batchDelay = builder.batchDelay;
        this.hasQuery = builder.hasQuery;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static ListOptions defaults() {
        return new Builder().build();
    }

    /**
     * Fills unset or invalid values from the supplied defaults.
     */
    public ListOptions withDefaults(int defaultPerPage, int defaultMaxBatchSize, Duration defaultBatchDelay) {
        int resolvedPerPage = perPage == null || perPage <= 0 ? defaultPerPage : perPage;
        int resolvedBatch = maxBatchSize == null || maxBatchSize <= 0 ? defaultMaxBatchSize : maxBatchSize;
        Duration resolvedDelay = batchDelay == null || batchDelay.isNegative() ? defaultBatchDelay : batchDelay;
        return new Builder()
            .perPage(resolvedPerPage)
            .maxBatchSize(resolvedBatch)
            .batchDelay(resolvedDelay)
            .hasQuery(hasQuery)
            .build();
    }

    public Integer getPerPage() {
        return perPage;
    }

    public Integer getMaxBatchSize() {
        return maxBatchSize;
    }

    public Duration getBatchDelay() {
        return batchDelay;
    }

    /**
     * @return whether page parameters must be joined to {@code url} with {@code &}. Derived from the URL unless set
     *     explicitly.
     */
    public boolean hasQuery(String url) {
        if (hasQuery != null) {
            return hasQuery;
        }
        return url != null && url.indexOf('?') >= 0;
    }

    public static final class Builder {
        private Integer perPage;
        private Integer maxBatchSize;
        private Duration batchDelay;
        private Boolean hasQuery;

        public Builder perPage(Integer perPage) {
            this.perPage = perPage;
            return this;
        }

        public Builder maxBatchSize(Integer maxBatchSize) {
            this.maxBatchSize = maxBatchSize;
            return this;
        }

        public Builder batchDelay(Duration batchDelay) {
            this.batchDelay = batchDelay;
            return this;
        }

        public Builder hasQuery(Boolean hasQuery) {
            this.hasQuery = hasQuery;
            return this;
        }

        public ListOptions build() {
            return new ListOptions(this);
        }
    }
}
