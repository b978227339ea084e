package com.rico.insurance.domain;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static com.rico.insurance.support.GraphFixtures.date;
import static com.rico.insurance.support.GraphFixtures.policy;
import static org.assertj.core.api.Assertions.assertThat;

class InsurancePolicyTest {

    @Test
    void endDatePrefersCancellation() {
        InsurancePolicy p = policy("P1", 100L, "Acme", "2023-01-01")
                .expirationDate(date("2024-01-01"))
                .cancellationDate(date("2023-05-01"))
                .build();

        assertThat(p.getEndDate()).isEqualTo(date("2023-05-01"));
        assertThat(p.isActiveOn(date("2023-04-30"))).isTrue();
        assertThat(p.isActiveOn(date("2023-05-01"))).isFalse();
    }

    @Test
    void federalComplianceUsesRequiredMinimum() {
        assertThat(policy("P1", 100L, "Acme", "2023-01-01").build().checkFederalCompliance()).isTrue();
        assertThat(policy("P2", 100L, "Acme", "2023-01-01").coverageAmount(new BigDecimal("749999"))
                .build().checkFederalCompliance()).isFalse();
        assertThat(policy("P3", 100L, "Acme", "2023-01-01").requiredMinimum(new BigDecimal("5000000"))
                .build().checkFederalCompliance()).isFalse();
    }
}
