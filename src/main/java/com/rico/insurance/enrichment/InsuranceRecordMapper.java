package com.rico.insurance.enrichment;

import com.rico.insurance.client.RawInsuranceRecord;
import com.rico.insurance.domain.FilingStatus;
import com.rico.insurance.domain.InsurancePolicy;
import com.rico.insurance.exception.DataQualityException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Maps raw provider filings to policies: provider date formats, coverage in thousands, BMC form codes,
 * derived filing status and deterministic policy ids.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class InsuranceRecordMapper {

    static final BigDecimal FEDERAL_MINIMUM = new BigDecimal("750000");
    static final String DEFAULT_FORM = "BMC-91";

    private static final Map<String, String> FORM_CODES = Map.of(
            "34", "BMC-34",
            "84", "BMC-84",
            "91", "BMC-91",
            "91X", "BMC-91X",
            "32", "BMC-32");

    private static final Map<Pattern, DateTimeFormatter> DATE_FORMATS = new LinkedHashMap<>();

    static {
        DATE_FORMATS.put(Pattern.compile("\\d{4}-\\d{2}-\\d{2} \\d{2}:\\d{2}:\\d{2}"),
                DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss"));
        DATE_FORMATS.put(Pattern.compile("\\d{4}-\\d{2}-\\d{2}T.+"), DateTimeFormatter.ISO_DATE_TIME);
        DATE_FORMATS.put(Pattern.compile("\\d{4}-\\d{2}-\\d{2}"), DateTimeFormatter.ISO_LOCAL_DATE);
        DATE_FORMATS.put(Pattern.compile("\\d{1,2}/\\d{1,2}/\\d{4}"), DateTimeFormatter.ofPattern("M/d/yyyy"));
    }

    private static final DateTimeFormatter ID_DATE = DateTimeFormatter.BASIC_ISO_DATE;

    private final Clock clock;

    /**
     * @throws DataQualityException when a date, the amount or the form code cannot be read, or the
     *                              provider name or effective date is missing
     */
    public InsurancePolicy toPolicy(Long usdot, RawInsuranceRecord record, String dataSource) {
        String provider = record.getNameCompany() != null ? record.getNameCompany().trim() : "";
        if (provider.isEmpty()) {
            throw new DataQualityException("Record " + record.getId() + " has no provider name");
        }
        LocalDate effective = parseDate(record.getEffectiveDate(), "effective_date");
        if (effective == null) {
            throw new DataQualityException("Record " + record.getId() + " has no effective date");
        }
        LocalDate expiration = parseDate(record.getExpirationDate(), "expiration_date");
        LocalDate cancellation = parseDate(record.getCancellationDate(), "cancellation_date");

        BigDecimal coverage;
        try {
            coverage = record.coverageDollars();
        } catch (NumberFormatException e) {
            throw new DataQualityException("Unreadable max_cov_amount: " + record.getMaxCovAmount(), e);
        }

        InsurancePolicy policy = InsurancePolicy.builder()
                .policyId(policyId(usdot, provider, effective))
                .carrierUsdot(usdot)
                .providerName(provider)
                .policyType(formType(record.getInsFormCode()))
                .coverageAmount(coverage)
                .cargoCoverage(parseCargoCoverage(record))
                .effectiveDate(effective)
                .expirationDate(expiration)
                .cancellationDate(cancellation)
                .cancellationReason(record.getCancellationReason())
                .filingStatus(filingStatus(record.getFilingStatus(), cancellation, expiration))
                .requiredMinimum(FEDERAL_MINIMUM)
                .dataSource(dataSource)
                .sourceRecordId(record.getId() != null ? record.getId() : record.getPolicyNo())
                .build();
        boolean meetsMinimum = policy.checkFederalCompliance();
        return policy.toBuilder()
                .compliant(meetsMinimum)
                .meetsFederalMinimum(meetsMinimum)
                .build();
    }

    /** BMC form label for a provider form code; blank defaults to BMC-91. */
    public static String formType(String code) {
        if (code == null || code.isBlank()) {
            return DEFAULT_FORM;
        }
        String label = FORM_CODES.get(code.trim().toUpperCase(Locale.ROOT));
        if (label == null) {
            throw new DataQualityException("Unknown insurance form code: " + code);
        }
        return label;
    }

    /**
     * Accepts {@code yyyy-MM-dd HH:mm:ss}, ISO date-time, ISO date and {@code MM/dd/yyyy}. Blank is null.
     */
    public static LocalDate parseDate(String value, String field) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String text = value.trim();
        for (Map.Entry<Pattern, DateTimeFormatter> format : DATE_FORMATS.entrySet()) {
            if (!format.getKey().matcher(text).matches()) {
                continue;
            }
            try {
                return LocalDate.parse(text, format.getValue());
            } catch (DateTimeParseException e) {
                throw new DataQualityException("Unparseable " + field + ": " + value, e);
            }
        }
        throw new DataQualityException("Unparseable " + field + ": " + value);
    }

    /** POL-{usdot}-{PROVIDER, no spaces or commas, first 10}-{yyyyMMdd}. */
    public static String policyId(Long usdot, String providerName, LocalDate effectiveDate) {
        String compact = providerName.replace(" ", "").replace(",", "").toUpperCase(Locale.ROOT);
        String shortName = compact.substring(0, Math.min(10, compact.length()));
        return "POL-" + usdot + "-" + shortName + "-" + effectiveDate.format(ID_DATE);
    }

    private FilingStatus filingStatus(String raw, LocalDate cancellation, LocalDate expiration) {
        if (cancellation != null) {
            return FilingStatus.CANCELLED;
        }
        if (expiration != null && expiration.isBefore(LocalDate.now(clock))) {
            return FilingStatus.LAPSED;
        }
        if (raw == null || raw.isBlank()) {
            return FilingStatus.ACTIVE;
        }
        try {
            return FilingStatus.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            log.debug("Unknown filing status {}, treating as ACTIVE", raw);
            return FilingStatus.ACTIVE;
        }
    }

    private BigDecimal parseCargoCoverage(RawInsuranceRecord record) {
        String value = record.getCargoCoverage();
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return new BigDecimal(value.trim());
        } catch (NumberFormatException e) {
            throw new DataQualityException("Unreadable cargo_coverage: " + value, e);
        }
    }
}
