package com.rico.insurance.temporal;

import lombok.AllArgsConstructor;
import lombok.Value;

import java.time.LocalDate;

/**
 * A coverage period by date: {@code from} inclusive, {@code to} exclusive, null {@code to} meaning open-ended.
 */
@Value
@AllArgsConstructor(staticName = "of")
public class CoverageInterval {
    LocalDate from;
    LocalDate to;
}
