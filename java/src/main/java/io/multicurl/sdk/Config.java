package io.multicurl.sdk;

import io.multicurl.sdk.transport.Transport;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable configuration container used to bootstrap {@link MultiCurlClient} instances.
 */
public final class Config {

    public static final String DEFAULT_API_PREFIX = "/api/v1";
    public static final int DEFAULT_MAX_CONCURRENT = 10;
    public static final Duration DEFAULT_MIN_SPACING = Duration.ofMillis(200);
    public static final int DEFAULT_PER_PAGE = 100;
    public static final int DEFAULT_MAX_BATCH_SIZE = 40;
    public static final Duration DEFAULT_BATCH_DELAY = Duration.ofMillis(300);
    public static final Duration DEFAULT_KEY_BATCH_DELAY = Duration.ofMillis(500);
    public static final int DEFAULT_MAX_RETRIES = 5;
    public static final Duration DEFAULT_HTTP_TIMEOUT = Duration.ofSeconds(30);

    public static final String ENV_DOMAIN = "CANVAS_DOMAIN";
    public static final String ENV_ACCESS_TOKEN = "CANVAS_ACCESS_TOKEN";

    private final String baseUrl;
    private final String accessToken;
    private final String apiPrefix;
    private final int maxConcurrent;
    private final Duration minSpacing;
    private final int perPage;
    private final int maxBatchSize;
    private final Duration batchDelay;
    private final Duration keyBatchDelay;
    private final int maxRetries;
    private final Duration httpTimeout;
    private final HttpClient httpClient;
    private final Transport transport;

    private Config(Builder builder) {
        this.baseUrl = builder.baseUrl;
        this.accessToken = builder.accessToken;
        this.apiPrefix = builder.apiPrefix;
        this.maxConcurrent = builder.maxConcurrent;
        this.minSpacing = builder.minSpacing;
        this.perPage = builder.perPage;
        this.maxBatchSize = builder.maxBatchSize;
        this.batchDelay = builder.batchDelay;
        this.keyBatchDelay = builder.keyBatchDelay;
        this.maxRetries = builder.maxRetries;
        this.httpTimeout = builder.httpTimeout;
        this.httpClient = builder.httpClient;
        this.transport = builder.transport;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Config withDefaults() {
        String resolvedBaseUrl = sanitizeUrl(baseUrl);

        if (accessToken == null || accessToken.isBlank()) {
            throw new IllegalArgumentException("AccessToken is required");
        }

        String resolvedPrefix = sanitizePrefix(Optional.ofNullable(apiPrefix).orElse(DEFAULT_API_PREFIX));

        Duration resolvedTimeout = positiveOr(httpTimeout, DEFAULT_HTTP_TIMEOUT);

        HttpClient resolvedClient = httpClient;
        if (resolvedClient == null && transport == null) {
            resolvedClient = HttpClient.newBuilder()
                .connectTimeout(resolvedTimeout)
                .build();
        }

        return new Builder()
            .baseUrl(resolvedBaseUrl)
            .accessToken(accessToken.trim())
            .apiPrefix(resolvedPrefix)
            .maxConcurrent(maxConcurrent > 0 ? maxConcurrent : DEFAULT_MAX_CONCURRENT)
            .minSpacing(nonNegativeOr(minSpacing, DEFAULT_MIN_SPACING))
            .perPage(perPage > 0 ? perPage : DEFAULT_PER_PAGE)
            .maxBatchSize(maxBatchSize > 0 ? maxBatchSize : DEFAULT_MAX_BATCH_SIZE)
            .batchDelay(nonNegativeOr(batchDelay, DEFAULT_BATCH_DELAY))
            .keyBatchDelay(nonNegativeOr(keyBatchDelay, DEFAULT_KEY_BATCH_DELAY))
            .maxRetries(maxRetries >= 0 ? maxRetries : DEFAULT_MAX_RETRIES)
            .httpTimeout(resolvedTimeout)
            .httpClient(resolvedClient)
            .transport(transport)
            .buildInternal();
    }

    private static String sanitizeUrl(String url) {
        String trimmed = Optional.ofNullable(url).map(String::trim).orElse("");
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("BaseUrl is required");
        }
        try {
            URI uri = new URI(trimmed);
            if (uri.getScheme() == null || uri.getHost() == null) {
                throw new IllegalArgumentException("URL must include scheme and host");
            }
        } catch (URISyntaxException ex) {
            throw new IllegalArgumentException("Invalid URL: " + trimmed, ex);
        }
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }

    private static String sanitizePrefix(String prefix) {
        String trimmed = prefix.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        if (trimmed.isEmpty()) {
            return "";
        }
        return trimmed.startsWith("/") ? trimmed : "/" + trimmed;
    }

    private static Duration positiveOr(Duration value, Duration fallback) {
        if (value == null || value.isNegative() || value.isZero()) {
            return fallback;
        }
        return value;
    }

    private static Duration nonNegativeOr(Duration value, Duration fallback) {
        if (value == null || value.isNegative()) {
            return fallback;
        }
        return value;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public String getAccessToken() {
        return accessToken;
    }

    public String getApiPrefix() {
        return apiPrefix;
    }

    public int getMaxConcurrent() {
        return maxConcurrent;
    }

    public Duration getMinSpacing() {
        return minSpacing;
    }

    public int getPerPage() {
        return perPage;
    }

    public int getMaxBatchSize() {
        return maxBatchSize;
    }

    public Duration getBatchDelay() {
        return batchDelay;
    }

    public Duration getKeyBatchDelay() {
        return keyBatchDelay;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public Duration getHttpTimeout() {
        return httpTimeout;
    }

    public HttpClient getHttpClient() {
        return httpClient;
    }

    /**
     * @return a caller-supplied transport, or {@code null} when the client should talk HTTP through
     *     {@link #getHttpClient()}.
     */
    public Transport getTransport() {
        return transport;
    }

    public static final class Builder {
        private String baseUrl;
        private String accessToken;
        private String apiPrefix;
        private int maxConcurrent;
        private Duration minSpacing;
        private int perPage;
        private int maxBatchSize;
        private Duration batchDelay;
        private Duration keyBatchDelay;
        private int maxRetries = -1;
        private Duration httpTimeout;
        private HttpClient httpClient;
        private Transport transport;

        /**
         * Reads {@value #ENV_DOMAIN} and {@value #ENV_ACCESS_TOKEN}; missing variables leave the builder untouched.
         */
        public Builder fromEnvironment(Map<String, String> env) {
            if (env == null) {
                return this;
            }
            String domain = env.get(ENV_DOMAIN);
            if (domain != null && !domain.isBlank()) {
                this.baseUrl = domain;
            }
            String token = env.get(ENV_ACCESS_TOKEN);
            if (token != null && !token.isBlank()) {
                this.accessToken = token;
            }
            return this;
        }

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder accessToken(String accessToken) {
            this.accessToken = accessToken;
            return this;
        }

        public Builder apiPrefix(String apiPrefix) {
            this.apiPrefix = apiPrefix;
            return this;
        }

        public Builder maxConcurrent(int maxConcurrent) {
            this.maxConcurrent = maxConcurrent;
            return this;
        }

        public Builder minSpacing(Duration minSpacing) {
            this.minSpacing = minSpacing;
            return this;
        }

        public Builder perPage(int perPage) {
            this.perPage = perPage;
            return this;
        }

        public Builder maxBatchSize(int maxBatchSize) {
            this.maxBatchSize = maxBatchSize;
            return this;
        }

        public Builder batchDelay(Duration batchDelay) {
            this.batchDelay = batchDelay;
            return this;
        }

        public Builder keyBatchDelay(Duration keyBatchDelay) {
            this.keyBatchDelay = keyBatchDelay;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder httpTimeout(Duration httpTimeout) {
            this.httpTimeout = httpTimeout;
            return this;
        }

        public Builder httpClient(HttpClient httpClient) {
            this.httpClient = httpClient;
            return this;
        }

        public Builder transport(Transport transport) {
            this.transport = transport;
            return this;
        }

        public Config build() {
            return new Config(this).withDefaults();
        }

        private Config buildInternal() {
            return new Config(this);
        }
    }
}
