package com.rico.insurance.enrichment;

import com.rico.insurance.client.RawInsuranceRecord;
import com.rico.insurance.domain.FilingStatus;
import com.rico.insurance.domain.InsurancePolicy;
import com.rico.insurance.exception.DataQualityException;
import com.rico.insurance.support.GraphTestConfig;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InsuranceRecordMapperTest {

    private final InsuranceRecordMapper mapper = new InsuranceRecordMapper(GraphTestConfig.fixedClock());

    private static RawInsuranceRecord.RawInsuranceRecordBuilder record() {
        return RawInsuranceRecord.builder()
                .id("rec-1")
                .nameCompany("Progressive Casualty, Inc")
                .maxCovAmount("00750")
                .insFormCode("91X")
                .effectiveDate("2023-03-15 00:00:00");
    }

    @Test
    void mapsProviderRecord() {
        InsurancePolicy policy = mapper.toPolicy(100L, record().expirationDate("03/15/2025").build(), "searchcarriers");

        assertThat(policy.getPolicyId()).isEqualTo("POL-100-PROGRESSIV-20230315");
        assertThat(policy.getCoverageAmount()).isEqualByComparingTo("750000");
        assertThat(policy.getPolicyType()).isEqualTo("BMC-91X");
        assertThat(policy.getEffectiveDate()).isEqualTo(LocalDate.of(2023, 3, 15));
        assertThat(policy.getExpirationDate()).isEqualTo(LocalDate.of(2025, 3, 15));
        assertThat(policy.getFilingStatus()).isEqualTo(FilingStatus.ACTIVE);
        assertThat(policy.getMeetsFederalMinimum()).isTrue();
        assertThat(policy.getSourceRecordId()).isEqualTo("rec-1");
        assertThat(policy.getDataSource()).isEqualTo("searchcarriers");
    }

    @Test
    void cancellationThenExpiryDecideFilingStatus() {
        assertThat(mapper.toPolicy(100L, record().cancellationDate("2023-09-01").filingStatus("ACTIVE").build(), "s")
                .getFilingStatus()).isEqualTo(FilingStatus.CANCELLED);
        assertThat(mapper.toPolicy(100L, record().expirationDate("2024-03-15").build(), "s")
                .getFilingStatus()).isEqualTo(FilingStatus.LAPSED);
        assertThat(mapper.toPolicy(100L, record().filingStatus("pending").build(), "s")
                .getFilingStatus()).isEqualTo(FilingStatus.PENDING);
    }

    @Test
    void blankAmountIsZeroAndBelowMinimum() {
        InsurancePolicy policy = mapper.toPolicy(100L, record().maxCovAmount(" ").build(), "s");

        assertThat(policy.getCoverageAmount()).isEqualByComparingTo("0");
        assertThat(policy.getMeetsFederalMinimum()).isFalse();
    }

    @Test
    void badFieldsAreDataQualityErrors() {
        assertThatThrownBy(() -> mapper.toPolicy(100L, record().maxCovAmount("abc").build(), "s"))
                .isInstanceOf(DataQualityException.class);
        assertThatThrownBy(() -> mapper.toPolicy(100L, record().effectiveDate("15.03.2023").build(), "s"))
                .isInstanceOf(DataQualityException.class);
        assertThatThrownBy(() -> mapper.toPolicy(100L, record().effectiveDate("2023-02-30").build(), "s"))
                .isInstanceOf(DataQualityException.class);
        assertThatThrownBy(() -> mapper.toPolicy(100L, record().effectiveDate(null).build(), "s"))
                .isInstanceOf(DataQualityException.class);
        assertThatThrownBy(() -> mapper.toPolicy(100L, record().nameCompany("  ").build(), "s"))
                .isInstanceOf(DataQualityException.class);
    }

    @Test
    void formCodes() {
        assertThat(InsuranceRecordMapper.formType("34")).isEqualTo("BMC-34");
        assertThat(InsuranceRecordMapper.formType("")).isEqualTo("BMC-91");
        assertThatThrownBy(() -> InsuranceRecordMapper.formType("99")).isInstanceOf(DataQualityException.class);
    }

    @Test
    void dateFormats() {
        LocalDate expected = LocalDate.of(2023, 3, 15);
        assertThat(InsuranceRecordMapper.parseDate("2023-03-15", "d")).isEqualTo(expected);
        assertThat(InsuranceRecordMapper.parseDate("2023-03-15T10:20:30", "d")).isEqualTo(expected);
        assertThat(InsuranceRecordMapper.parseDate("3/15/2023", "d")).isEqualTo(expected);
        assertThat(InsuranceRecordMapper.parseDate("", "d")).isNull();
    }
}
