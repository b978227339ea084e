package com.rico.insurance.domain;

import com.rico.insurance.temporal.TemporalIntervals;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

/**
 * One issued insurance policy. Immutable once created; the "ended" semantics are derived from
 * the cancellation and expiration dates.
 */
@Value
@Builder(toBuilder = true)
public class InsurancePolicy {

    @NotBlank
    String policyId;

    /** USDOT of the insured carrier. */
    @NotNull
    Long carrierUsdot;

    @NotBlank
    String providerName;

    /** Regulatory filing class, e.g. BMC-91. */
    @NotBlank
    String policyType;

    @NotNull
    @DecimalMin("0")
    BigDecimal coverageAmount;

    @DecimalMin("0")
    BigDecimal cargoCoverage;

    @NotNull
    LocalDate effectiveDate;

    LocalDate expirationDate;

    LocalDate cancellationDate;

    String cancellationReason;

    @NotNull
    FilingStatus filingStatus;

    Boolean compliant;

    Boolean meetsFederalMinimum;

    BigDecimal requiredMinimum;

    /** Provenance: where the record came from (e.g. searchcarriers, api). */
    String dataSource;

    /** Provenance: id of the record at the source. */
    String sourceRecordId;

    Instant createdAt;

    Instant updatedAt;

    /** Cancellation date if set, else expiration date, else null (open-ended). */
    public LocalDate getEndDate() {
        return TemporalIntervals.endDate(cancellationDate, expirationDate);
    }

    /** In force on {@code date}: effective on or before it and not yet ended. */
    public boolean isActiveOn(LocalDate date) {
        return TemporalIntervals.isActiveOn(this, date);
    }

    /** Coverage at or above the required minimum (general-freight minimum when unset). */
    public boolean checkFederalCompliance() {
        BigDecimal minimum = requiredMinimum != null ? requiredMinimum : CargoType.DEFAULT_MINIMUM;
        return coverageAmount != null && coverageAmount.compareTo(minimum) >= 0;
    }
}
