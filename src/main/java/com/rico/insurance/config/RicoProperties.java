package com.rico.insurance.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Typed view of the {@code rico.*} configuration.
 */
@Component
@ConfigurationProperties(prefix = "rico")
@Data
public class RicoProperties {

    private SearchCarriers searchcarriers = new SearchCarriers();
    private Enrichment enrichment = new Enrichment();

    @Data
    public static class SearchCarriers {
        private String baseUrl = "https://searchcarriers.com/api";
        private String apiToken;
        private int perPage = 100;
        /** Safety cap on pagination. */
        private int maxPages = 10;
        private int connectTimeoutMs = 5000;
        private int readTimeoutMs = 15000;
        /** Minimum spacing between two requests. */
        private long rateLimitDelayMs = 1000;
        /** Extra pause after a 429 before the retry kicks in. */
        private long tooManyRequestsBackoffMs = 5000;
    }

    @Data
    public static class Enrichment {
        private int batchSize = 10;
        private long interCarrierDelayMs = 1000;
        private long interBatchDelayMs = 5000;
        private int maxErrorDetails = 20;
        private int executorThreads = 2;
    }
}
