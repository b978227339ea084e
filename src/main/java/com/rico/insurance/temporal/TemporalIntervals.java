package com.rico.insurance.temporal;

import com.rico.insurance.domain.CoverageStatus;
import com.rico.insurance.domain.InsurancePolicy;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Pure date arithmetic over policy ranges: end dates, derived status, gaps, durations, overlaps and
 * covered-day accounting. No side effects; "today" is always passed in.
 */
public final class TemporalIntervals {

    /** Duration sentinel for a period that has not ended. */
    public static final int ONGOING = -1;

    private TemporalIntervals() {
    }

    public static LocalDate endDate(LocalDate cancellationDate, LocalDate expirationDate) {
        return cancellationDate != null ? cancellationDate : expirationDate;
    }

    public static LocalDate endDate(InsurancePolicy policy) {
        return endDate(policy.getCancellationDate(), policy.getExpirationDate());
    }

    public static CoverageStatus status(LocalDate cancellationDate, LocalDate expirationDate, LocalDate today) {
        if (cancellationDate != null) {
            return CoverageStatus.CANCELLED;
        }
        if (expirationDate != null && expirationDate.isBefore(today)) {
            return CoverageStatus.EXPIRED;
        }
        return CoverageStatus.ACTIVE;
    }

    public static CoverageStatus status(InsurancePolicy policy, LocalDate today) {
        return status(policy.getCancellationDate(), policy.getExpirationDate(), today);
    }

    /**
     * Days between the end of {@code earlier} and the start of {@code later}, clamped at zero.
     * Null when the earlier policy is still open: only a closed interval can leave a gap.
     */
    public static Integer gapDays(InsurancePolicy earlier, InsurancePolicy later) {
        return gapDays(endDate(earlier), later.getEffectiveDate());
    }

    public static Integer gapDays(LocalDate earlierEnd, LocalDate laterStart) {
        if (earlierEnd == null) {
            return null;
        }
        long days = ChronoUnit.DAYS.between(earlierEnd, laterStart);
        return (int) Math.max(0, days);
    }

    public static int durationDays(LocalDate from, LocalDate to) {
        if (to == null) {
            return ONGOING;
        }
        return (int) ChronoUnit.DAYS.between(from, to);
    }

    /**
     * True when {@code a} starts first and is still running when {@code b} starts. Periods starting on
     * the same day also overlap.
     */
    public static boolean overlaps(CoverageInterval a, CoverageInterval b) {
        if (a.getFrom().isAfter(b.getFrom())) {
            return false;
        }
        return a.getTo() == null || a.getTo().isAfter(b.getFrom());
    }

    /**
     * Length of the overlap of {@code a} (starting first) and {@code b}; open ends count up to {@code today}.
     */
    public static int overlapDays(CoverageInterval a, CoverageInterval b, LocalDate today) {
        LocalDate aEnd = a.getTo() != null ? a.getTo() : today;
        LocalDate bEnd = b.getTo() != null ? b.getTo() : today;
        LocalDate end = aEnd.isBefore(bEnd) ? aEnd : bEnd;
        return (int) Math.max(0, ChronoUnit.DAYS.between(b.getFrom(), end));
    }

    public static boolean isActiveOn(InsurancePolicy policy, LocalDate date) {
        if (policy.getEffectiveDate() == null || policy.getEffectiveDate().isAfter(date)) {
            return false;
        }
        LocalDate end = endDate(policy);
        return end == null || end.isAfter(date);
    }

    public static int windowLength(LocalDate windowStart, LocalDate windowEnd) {
        return (int) Math.max(0, ChronoUnit.DAYS.between(windowStart, windowEnd));
    }

    /**
     * Clamps each interval to {@code [windowStart, windowEnd)}, merges overlapping ones and returns the merged
     * list in start order. An open-ended interval runs to the end of the window.
     */
    public static List<CoverageInterval> clampAndMerge(List<CoverageInterval> intervals,
                                                       LocalDate windowStart, LocalDate windowEnd) {
        List<CoverageInterval> clamped = new ArrayList<>();
        for (CoverageInterval interval : intervals) {
            LocalDate from = interval.getFrom().isBefore(windowStart) ? windowStart : interval.getFrom();
            LocalDate to = interval.getTo() == null || interval.getTo().isAfter(windowEnd) ? windowEnd : interval.getTo();
            if (from.isBefore(to)) {
                clamped.add(CoverageInterval.of(from, to));
            }
        }
        clamped.sort(Comparator.comparing(CoverageInterval::getFrom));

        List<CoverageInterval> merged = new ArrayList<>();
        for (CoverageInterval interval : clamped) {
            if (!merged.isEmpty()) {
                CoverageInterval last = merged.get(merged.size() - 1);
                if (!interval.getFrom().isAfter(last.getTo())) {
                    LocalDate to = interval.getTo().isAfter(last.getTo()) ? interval.getTo() : last.getTo();
                    merged.set(merged.size() - 1, CoverageInterval.of(last.getFrom(), to));
                    continue;
                }
            }
            merged.add(interval);
        }
        return merged;
    }

    /** Days in {@code [windowStart, windowEnd)} covered by at least one interval. */
    public static int coveredDays(List<CoverageInterval> intervals, LocalDate windowStart, LocalDate windowEnd) {
        int covered = 0;
        for (CoverageInterval interval : clampAndMerge(intervals, windowStart, windowEnd)) {
            covered += (int) ChronoUnit.DAYS.between(interval.getFrom(), interval.getTo());
        }
        return covered;
    }
}
