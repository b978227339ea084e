package com.rico.insurance.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Infrastructure beans: clock, HTTP client for the insurance-data provider and the enrichment executor.
 */
@Slf4j
@Configuration
public class InsuranceGraphConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RestTemplate searchCarriersRestTemplate(RicoProperties properties) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(properties.getSearchcarriers().getConnectTimeoutMs());
        factory.setReadTimeout(properties.getSearchcarriers().getReadTimeoutMs());
        return new RestTemplate(factory);
    }

    @Bean(name = "enrichmentExecutor", destroyMethod = "shutdown")
    public ExecutorService enrichmentExecutor(RicoProperties properties) {
        int threads = Math.max(1, properties.getEnrichment().getExecutorThreads());
        AtomicInteger counter = new AtomicInteger();
        log.info("Enrichment executor: threads={}", threads);
        return Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "enrichment-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }
}
