package com.rico.insurance.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * {@code {"data": [...]}} envelope of the insurances endpoint.
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class InsuranceRecordsResponse {

    List<RawInsuranceRecord> data;

    public List<RawInsuranceRecord> records() {
        return data != null ? data : List.of();
    }
}
