package com.mpl.domain.service;

import com.mpl.domain.model.MaternityCase;
import com.mpl.domain.model.MaternityPeriod;
import com.mpl.domain.model.PayrollPeriod;
import com.mpl.domain.model.StaffClass;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.YearMonth;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.Predicate;

/**
 * Builds the ordered list of payroll periods spanned by a case's leave
 */
@Slf4j
public class PeriodGenerator {

    public static final int MAX_FALLBACK_PERIODS = 15;
    private static final int FALLBACK_PAY_DAY = 28;
    private static final DateTimeFormatter FALLBACK_NAME = DateTimeFormatter.ofPattern("MMM yyyy", Locale.UK);
    private static final DateTimeFormatter MONTH_KEY = DateTimeFormatter.ofPattern("yyyy-MM");

    /**
     * Generate skeleton periods (zero amounts, pending) for the case.
     * Alignment follows the SMP start date, not the leave start date.
     */
    public Generation generatePeriods(MaternityCase maternityCase, PayrollCalendarResolver resolver) {
        StaffClass staffClass = maternityCase.getStaffClass();
        LocalDate effectiveEnd = maternityCase.getEffectiveEndDate();

        Optional<PayrollPeriod> first = resolver.resolvePeriod(maternityCase.getSmpStartDate(), staffClass);
        if (first.isEmpty()) {
            log.warn("Case {}: no {} payroll period contains SMP start {}; using estimated monthly periods",
                    maternityCase.getCaseId(), staffClass != null ? staffClass.getValue() : "unknown",
                    maternityCase.getSmpStartDate());
            return new Generation(fallbackPeriods(maternityCase), true);
        }

        List<PayrollPeriod> calendar = resolver.periodsFor(staffClass);
        List<MaternityPeriod> periods = new ArrayList<>();
        int index = calendar.indexOf(first.get());
        for (int i = index; i < calendar.size(); i++) {
            PayrollPeriod payrollPeriod = calendar.get(i);
            if (payrollPeriod.getPeriodStart().isAfter(effectiveEnd)) {
                break;
            }
            periods.add(MaternityPeriod.skeleton(
                    maternityCase.getCaseId(),
                    periods.size() + 1,
                    payrollPeriod.getPeriodStart(),
                    payrollPeriod.getPeriodEnd(),
                    payrollPeriod.getPayDate(),
                    payrollPeriod.getPeriodName()
            ));
        }

        log.debug("Case {}: generated {} calendar periods from {} to {}",
                maternityCase.getCaseId(), periods.size(), first.get().getPeriodName(), effectiveEnd);
        return new Generation(periods, false);
    }

    /**
     * Synthetic monthly periods starting at the maternity start date
     */
    List<MaternityPeriod> fallbackPeriods(MaternityCase maternityCase) {
        LocalDate effectiveEnd = maternityCase.getEffectiveEndDate();
        List<MaternityPeriod> periods = new ArrayList<>();

        LocalDate start = maternityCase.getMaternityStartDate();
        while (!start.isAfter(effectiveEnd) && periods.size() < MAX_FALLBACK_PERIODS) {
            LocalDate end = start.plusMonths(1).minusDays(1);
            periods.add(MaternityPeriod.skeleton(
                    maternityCase.getCaseId(),
                    periods.size() + 1,
                    start,
                    end,
                    start.withDayOfMonth(FALLBACK_PAY_DAY),
                    start.format(FALLBACK_NAME) + " (estimated)"
            ));
            start = end.plusDays(1);
        }

        if (!start.isAfter(effectiveEnd)) {
            log.warn("Case {}: estimated periods capped at {} before reaching {}",
                    maternityCase.getCaseId(), MAX_FALLBACK_PERIODS, effectiveEnd);
        }
        return periods;
    }

    /**
     * Seed period SMP amounts from the monthly breakdown, keyed by the year-month of periodStart
     */
    public Seeding applyMonthlyBreakdown(MaternityCase maternityCase, String user, LocalDateTime now) {
        return applyMonthlyBreakdown(maternityCase, user, now, period -> true);
    }

    /**
     * Seed only the periods accepted by the filter. A month that starts more than one period seeds
     * each of them with the full monthly amount.
     */
    public Seeding applyMonthlyBreakdown(MaternityCase maternityCase, String user, LocalDateTime now,
                                         Predicate<MaternityPeriod> eligible) {
        Map<String, BigDecimal> breakdown = maternityCase.getMonthlySMPBreakdown();
        if (breakdown == null || breakdown.isEmpty() || maternityCase.getPeriods() == null) {
            return new Seeding(0, Set.of());
        }

        Map<String, Integer> seededPerMonth = new TreeMap<>();
        for (MaternityPeriod period : maternityCase.getPeriods()) {
            String month = monthKey(period.getPeriodStart());
            BigDecimal amount = breakdown.get(month);
            if (amount == null || !eligible.test(period)) {
                continue;
            }
            period.setSmpAmount(amount);
            period.amountsEntered();
            period.setEnteredBy(user);
            period.setEnteredAt(now);
            seededPerMonth.merge(month, 1, Integer::sum);
        }

        Set<String> sharedMonths = new TreeSet<>();
        seededPerMonth.forEach((month, count) -> {
            if (count > 1) {
                sharedMonths.add(month);
            }
        });
        if (!sharedMonths.isEmpty()) {
            log.warn("Case {}: monthly SMP for {} was copied into more than one period starting in that month",
                    maternityCase.getCaseId(), sharedMonths);
        }

        int seeded = seededPerMonth.values().stream().mapToInt(Integer::intValue).sum();
        log.debug("Case {}: seeded SMP for {} period(s) from monthly breakdown", maternityCase.getCaseId(), seeded);
        return new Seeding(seeded, sharedMonths);
    }

    public static String monthKey(LocalDate date) {
        return YearMonth.from(date).format(MONTH_KEY);
    }

    /**
     * Generated periods and whether they came from the estimated monthly fallback
     */
    public record Generation(List<MaternityPeriod> periods, boolean fallback) {}

    /**
     * Periods seeded from the breakdown and the months whose amount landed in several periods
     */
    public record Seeding(int periodsSeeded, Set<String> sharedMonths) {}
}
