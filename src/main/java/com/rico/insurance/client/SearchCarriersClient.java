package com.rico.insurance.client;

import com.rico.insurance.config.RicoProperties;
import com.rico.insurance.exception.ExternalProviderException;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * SearchCarriers REST client for carrier insurance filings. Requests are spaced by a minimum delay,
 * 404 means "no filings", and 429/5xx responses are retried with backoff through the
 * {@code searchCarriers} retry instance.
 */
@Slf4j
@Component
public class SearchCarriersClient implements InsuranceDataProvider {

    static final String RETRY_INSTANCE = "searchCarriers";
    static final String SOURCE_NAME = "searchcarriers";
    private static final String INSURANCES_PATH = "/v2/company/{usdot}/insurances?page={page}&perPage={perPage}";
    private static final BigDecimal REQUIRED_MINIMUM = new BigDecimal("750000");
    private static final int COMPLIANCE_PAGE_SIZE = 10;

    private final RestTemplate restTemplate;
    private final RetryRegistry retryRegistry;
    private final RicoProperties.SearchCarriers config;
    private final Clock clock;

    private final Object rateLock = new Object();
    private long lastRequestAt;

    public SearchCarriersClient(RestTemplate restTemplate, RetryRegistry retryRegistry,
                                RicoProperties properties, Clock clock) {
        this.restTemplate = restTemplate;
        this.retryRegistry = retryRegistry;
        this.config = properties.getSearchcarriers();
        this.clock = clock;
    }

    @Override
    public String getSourceName() {
        return SOURCE_NAME;
    }

    @Override
    public List<RawInsuranceRecord> fetchInsuranceHistory(Long usdot) {
        log.info("Fetching insurance history: usdot={}", usdot);
        List<RawInsuranceRecord> all = new ArrayList<>();
        for (int page = 1; page <= config.getMaxPages(); page++) {
            List<RawInsuranceRecord> records = fetchPage(usdot, page, config.getPerPage());
            all.addAll(records);
            if (records.size() < config.getPerPage()) {
                break;
            }
        }
        log.info("Fetched insurance records: usdot={}, records={}", usdot, all.size());
        return all;
    }

    /**
     * Compliance from the most recent filings: no filings, no ACTIVE filing, or max active coverage below
     * the $750,000 general-freight minimum.
     */
    @Override
    public ComplianceCheck fetchComplianceCheck(Long usdot) {
        List<RawInsuranceRecord> records = fetchPage(usdot, 1, COMPLIANCE_PAGE_SIZE);
        List<ComplianceViolation> violations = new ArrayList<>();
        BigDecimal currentCoverage = null;

        if (records.isEmpty()) {
            violations.add(violation("NO_INSURANCE", "No active insurance found", "CRITICAL"));
        } else {
            for (RawInsuranceRecord record : records) {
                if (!"ACTIVE".equalsIgnoreCase(record.getFilingStatus())) {
                    continue;
                }
                BigDecimal amount;
                try {
                    amount = record.coverageDollars();
                } catch (NumberFormatException e) {
                    log.warn("Unreadable coverage amount in compliance check: usdot={}, value={}",
                            usdot, record.getMaxCovAmount());
                    amount = BigDecimal.ZERO;
                }
                if (currentCoverage == null || amount.compareTo(currentCoverage) > 0) {
                    currentCoverage = amount;
                }
            }
            if (currentCoverage == null) {
                violations.add(violation("NO_ACTIVE_INSURANCE", "No active insurance policies", "CRITICAL"));
            } else if (currentCoverage.compareTo(REQUIRED_MINIMUM) < 0) {
                violations.add(violation("UNDERINSURED",
                        String.format("Coverage $%,.0f below minimum $%,.0f", currentCoverage, REQUIRED_MINIMUM),
                        "HIGH"));
            }
        }

        return ComplianceCheck.builder()
                .carrierUsdot(usdot)
                .compliant(violations.isEmpty())
                .violations(violations)
                .currentCoverage(currentCoverage)
                .requiredMinimum(REQUIRED_MINIMUM)
                .checkedAt(Instant.now(clock))
                .build();
    }

    private List<RawInsuranceRecord> fetchPage(Long usdot, int page, int perPage) {
        Retry retry = retryRegistry.retry(RETRY_INSTANCE);
        Supplier<List<RawInsuranceRecord>> call = Retry.decorateSupplier(retry, () -> get(usdot, page, perPage));
        try {
            return call.get();
        } catch (RestClientException e) {
            log.error("Insurance provider request failed: usdot={}, page={}", usdot, page, e);
            throw new ExternalProviderException("SearchCarriers request failed for USDOT " + usdot, e);
        }
    }

    private List<RawInsuranceRecord> get(Long usdot, int page, int perPage) {
        applyRateLimit();
        HttpHeaders headers = new HttpHeaders();
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        if (config.getApiToken() != null && !config.getApiToken().isBlank()) {
            headers.setBearerAuth(config.getApiToken());
        }
        try {
            InsuranceRecordsResponse response = restTemplate.exchange(
                    config.getBaseUrl() + INSURANCES_PATH,
                    HttpMethod.GET,
                    new HttpEntity<>(headers),
                    InsuranceRecordsResponse.class,
                    usdot, page, perPage).getBody();
            return response != null ? response.records() : List.of();
        } catch (HttpClientErrorException.NotFound e) {
            log.warn("No insurance data at provider: usdot={}", usdot);
            return List.of();
        } catch (HttpClientErrorException.TooManyRequests e) {
            log.warn("Rate limited by provider, backing off {} ms: usdot={}", config.getTooManyRequestsBackoffMs(), usdot);
            sleep(config.getTooManyRequestsBackoffMs());
            throw e;
        }
    }

    private void applyRateLimit() {
        synchronized (rateLock) {
            long now = System.currentTimeMillis();
            long wait = lastRequestAt + config.getRateLimitDelayMs() - now;
            if (wait > 0) {
                log.debug("Rate limiting: sleeping {} ms", wait);
                sleep(wait);
            }
            lastRequestAt = System.currentTimeMillis();
        }
    }

    private static void sleep(long millis) {
        if (millis <= 0) {
            return;
        }
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExternalProviderException("Interrupted while waiting for the insurance provider", e);
        }
    }

    private static ComplianceViolation violation(String type, String description, String severity) {
        return ComplianceViolation.builder().type(type).description(description).severity(severity).build();
    }
}
