package com.mpl.domain.service;

import com.mpl.domain.model.PayrollPeriod;
import com.mpl.domain.model.StaffClass;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Resolves the payroll period a date falls into.
 * Salaried: periodStart <= date <= periodEnd.
 * Hourly: cutoffDate < date <= periodEnd; a date on the cutoff belongs to the previous pay run.
 */
@Slf4j
public class PayrollCalendarResolver {

    private final Map<StaffClass, List<PayrollPeriod>> periodsByClass = new EnumMap<>(StaffClass.class);

    public PayrollCalendarResolver(List<PayrollPeriod> calendar) {
        Map<StaffClass, List<PayrollPeriod>> grouped = calendar.stream()
                .filter(p -> p.getStaffClass() != null && p.getPeriodStart() != null && p.getPeriodEnd() != null)
                .collect(Collectors.groupingBy(PayrollPeriod::getStaffClass));

        for (StaffClass staffClass : StaffClass.values()) {
            List<PayrollPeriod> sorted = grouped.getOrDefault(staffClass, List.of()).stream()
                    .sorted(Comparator.comparing(PayrollPeriod::getPeriodStart))
                    .toList();
            periodsByClass.put(staffClass, sorted);
        }

        long hourlyWithoutCutoff = periodsByClass.get(StaffClass.HOURLY).stream()
                .filter(p -> !p.hasCutoff())
                .count();
        if (hourlyWithoutCutoff > 0) {
            log.warn("Payroll calendar has {} hourly period(s) without a cutoff date; they will never match",
                    hourlyWithoutCutoff);
        }
    }

    /**
     * Periods for one staff class, sorted by periodStart
     */
    public List<PayrollPeriod> periodsFor(StaffClass staffClass) {
        return periodsByClass.getOrDefault(staffClass, List.of());
    }

    public Optional<PayrollPeriod> resolvePeriod(LocalDate date, StaffClass staffClass) {
        if (date == null || staffClass == null) {
            return Optional.empty();
        }

        List<PayrollPeriod> matches = periodsFor(staffClass).stream()
                .filter(p -> matches(p, date))
                .toList();

        if (matches.isEmpty()) {
            log.debug("No {} payroll period contains {}", staffClass.getValue(), date);
            return Optional.empty();
        }
        if (matches.size() > 1) {
            log.warn("{} payroll periods overlap on {} for {}; using {}",
                    matches.size(), date, staffClass.getValue(), matches.get(0).getPeriodName());
        }
        return Optional.of(matches.get(0));
    }

    private boolean matches(PayrollPeriod period, LocalDate date) {
        if (period.isHourly()) {
            if (!period.hasCutoff()) {
                log.warn("Hourly payroll period {} has no cutoff date and cannot be matched", period.getPeriodName());
                return false;
            }
            return date.isAfter(period.getCutoffDate()) && !date.isAfter(period.getPeriodEnd());
        }
        return !date.isBefore(period.getPeriodStart()) && !date.isAfter(period.getPeriodEnd());
    }
}
