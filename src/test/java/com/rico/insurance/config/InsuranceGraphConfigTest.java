package com.rico.insurance.config;

import org.junit.jupiter.api.Test;

import java.time.ZoneOffset;
import java.util.concurrent.ExecutorService;

import static org.assertj.core.api.Assertions.assertThat;

class InsuranceGraphConfigTest {

    private final InsuranceGraphConfig config = new InsuranceGraphConfig();

    @Test
    void clockRunsInUtc() {
        assertThat(config.clock().getZone()).isEqualTo(ZoneOffset.UTC);
    }

    @Test
    void executorHasAtLeastOneThread() throws Exception {
        RicoProperties properties = new RicoProperties();
        properties.getEnrichment().setExecutorThreads(0);
        ExecutorService executor = config.enrichmentExecutor(properties);
        try {
            assertThat(executor.submit(() -> Thread.currentThread().getName()).get())
                    .startsWith("enrichment-");
        } finally {
            executor.shutdownNow();
        }
    }
}
