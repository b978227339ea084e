package com.rico.insurance.support;

import com.rico.insurance.domain.FilingStatus;
import com.rico.insurance.domain.InsurancePolicy;
import com.rico.insurance.persistence.entity.CarrierEntity;

import java.math.BigDecimal;
import java.time.LocalDate;

public final class GraphFixtures {

    private GraphFixtures() {
    }

    public static CarrierEntity carrier(long usdot, String name) {
        return CarrierEntity.builder()
                .usdot(usdot)
                .carrierName(name)
                .dataSource("test")
                .build();
    }

    public static InsurancePolicy.InsurancePolicyBuilder policy(String id, long usdot, String provider, String effective) {
        return InsurancePolicy.builder()
                .policyId(id)
                .carrierUsdot(usdot)
                .providerName(provider)
                .policyType("BMC-91")
                .coverageAmount(new BigDecimal("750000"))
                .effectiveDate(LocalDate.parse(effective))
                .filingStatus(FilingStatus.ACTIVE)
                .dataSource("test");
    }

    public static LocalDate date(String iso) {
        return LocalDate.parse(iso);
    }
}
