package com.rico.insurance.client;

import com.rico.insurance.config.RicoProperties;
import com.rico.insurance.exception.ExternalProviderException;
import com.rico.insurance.support.GraphTestConfig;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.ExpectedCount;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

/**
 * SearchCarriersClient against a mocked HTTP server: paging, 404 handling, retries and compliance.
 */
class SearchCarriersClientTest {

    private static final String BASE = "http://searchcarriers.test/api";

    private MockRestServiceServer server;
    private SearchCarriersClient client;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();

        RicoProperties properties = new RicoProperties();
        properties.getSearchcarriers().setBaseUrl(BASE);
        properties.getSearchcarriers().setApiToken("secret-token");
        properties.getSearchcarriers().setPerPage(2);
        properties.getSearchcarriers().setRateLimitDelayMs(0);
        properties.getSearchcarriers().setTooManyRequestsBackoffMs(0);

        RetryRegistry retryRegistry = RetryRegistry.of(RetryConfig.custom()
                .maxAttempts(3)
                .waitDuration(Duration.ofMillis(1))
                .retryExceptions(HttpServerErrorException.class)
                .build());
        client = new SearchCarriersClient(restTemplate, retryRegistry, properties, GraphTestConfig.fixedClock());
    }

    private static String url(long usdot, int page, int perPage) {
        return BASE + "/v2/company/" + usdot + "/insurances?page=" + page + "&perPage=" + perPage;
    }

    private static String record(String id, String company, String amount, String status) {
        return "{\"id\":\"" + id + "\",\"name_company\":\"" + company + "\",\"max_cov_amount\":\"" + amount
                + "\",\"ins_form_code\":\"91X\",\"effective_date\":\"2023-01-01 00:00:00\",\"filing_status\":\""
                + status + "\",\"unknown_field\":true}";
    }

    @Test
    void followsPagesUntilShortPage() {
        server.expect(requestTo(url(100L, 1, 2)))
                .andExpect(method(HttpMethod.GET))
                .andExpect(header("Authorization", "Bearer secret-token"))
                .andRespond(withSuccess("{\"data\":[" + record("1", "Acme", "00750", "ACTIVE") + ","
                        + record("2", "Beta", "01000", "ACTIVE") + "]}", MediaType.APPLICATION_JSON));
        server.expect(requestTo(url(100L, 2, 2)))
                .andRespond(withSuccess("{\"data\":[" + record("3", "Gamma", "00500", "ACTIVE") + "]}",
                        MediaType.APPLICATION_JSON));

        List<RawInsuranceRecord> records = client.fetchInsuranceHistory(100L);

        assertThat(records).extracting(RawInsuranceRecord::getNameCompany).containsExactly("Acme", "Beta", "Gamma");
        assertThat(records.get(1).coverageDollars()).isEqualByComparingTo("1000000");
        server.verify();
    }

    @Test
    void notFoundMeansNoFilings() {
        server.expect(requestTo(url(404L, 1, 2))).andRespond(withStatus(HttpStatus.NOT_FOUND));

        assertThat(client.fetchInsuranceHistory(404L)).isEmpty();
    }

    @Test
    void serverErrorsAreRetriedThenSurfaced() {
        server.expect(ExpectedCount.times(3), requestTo(url(100L, 1, 2))).andRespond(withServerError());

        assertThatThrownBy(() -> client.fetchInsuranceHistory(100L))
                .isInstanceOf(ExternalProviderException.class)
                .hasCauseInstanceOf(HttpServerErrorException.class);
        server.verify();
    }

    @Test
    void transientErrorRecovers() {
        server.expect(requestTo(url(100L, 1, 2))).andRespond(withServerError());
        server.expect(requestTo(url(100L, 1, 2)))
                .andRespond(withSuccess("{\"data\":[]}", MediaType.APPLICATION_JSON));

        assertThat(client.fetchInsuranceHistory(100L)).isEmpty();
        server.verify();
    }

    @Test
    void complianceFlagsUnderinsuredActiveCoverage() {
        server.expect(requestTo(url(100L, 1, 10)))
                .andRespond(withSuccess("{\"data\":[" + record("1", "Acme", "00500", "ACTIVE") + ","
                        + record("2", "Beta", "02000", "CANCELLED") + "]}", MediaType.APPLICATION_JSON));

        ComplianceCheck check = client.fetchComplianceCheck(100L);

        assertThat(check.isCompliant()).isFalse();
        assertThat(check.getCurrentCoverage()).isEqualByComparingTo("500000");
        assertThat(check.getViolations()).extracting(ComplianceViolation::getType).containsExactly("UNDERINSURED");
    }

    @Test
    void complianceWithoutFilings() {
        server.expect(requestTo(url(100L, 1, 10)))
                .andRespond(withSuccess("{\"data\":[]}", MediaType.APPLICATION_JSON));

        ComplianceCheck check = client.fetchComplianceCheck(100L);

        assertThat(check.getViolations()).extracting(ComplianceViolation::getType).containsExactly("NO_INSURANCE");
        assertThat(check.getCurrentCoverage()).isNull();
    }
}
