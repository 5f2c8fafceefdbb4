package com.mpl.application.service;

import com.mpl.application.port.in.CalendarCheckUseCase;
import com.mpl.application.port.out.PayrollCalendarSource;
import com.mpl.domain.exception.ValidationException;
import com.mpl.domain.model.PayrollPeriod;
import com.mpl.domain.model.StaffClass;
import com.mpl.domain.service.PayrollCalendarResolver;
import io.vertx.core.Future;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Payroll calendar checks: SMP start date resolution and the calendar self-check
 */
@Slf4j
@RequiredArgsConstructor
public class CalendarCheckUseCaseImpl implements CalendarCheckUseCase {

    private final PayrollCalendarSource calendarSource;
    private final Clock clock;
    private final int horizonMonths;

    @Override
    public Future<SmpStartValidation> validateSmpStartDate(String smpStartDate, String staffClass) {
        List<String> errors = new ArrayList<>();
        LocalDate date = null;
        try {
            date = CaseValidator.toDate(smpStartDate);
            if (date == null) {
                errors.add("date is required");
            }
        } catch (DateTimeParseException e) {
            errors.add("date must be in ISO format (YYYY-MM-DD)");
        }
        if (staffClass == null || !StaffClass.isValid(staffClass)) {
            errors.add("staffClass must be either Salaried or Hourly");
        }
        if (!errors.isEmpty()) {
            return Future.failedFuture(new ValidationException(errors));
        }

        LocalDate smpStart = date;
        StaffClass resolvedClass = StaffClass.fromValue(staffClass);

        return calendarSource.loadCalendar()
                .map(calendar -> {
                    Optional<PayrollPeriod> period = new PayrollCalendarResolver(calendar)
                            .resolvePeriod(smpStart, resolvedClass);
                    if (period.isPresent()) {
                        return new SmpStartValidation(true, period.get(),
                                "SMP start " + smpStart + " falls in " + period.get().getPeriodName());
                    }
                    log.warn("SMP start {} does not resolve to a {} payroll period", smpStart, resolvedClass.getValue());
                    return new SmpStartValidation(false, null,
                            "No " + resolvedClass.getValue() + " payroll period contains " + smpStart
                                    + "; estimated monthly periods would be used");
                });
    }

    @Override
    public Future<SystemCheckReport> systemCheck() {
        LocalDate horizon = LocalDate.now(clock).plusMonths(horizonMonths);

        return calendarSource.loadCalendar()
                .map(calendar -> {
                    PayrollCalendarResolver resolver = new PayrollCalendarResolver(calendar);
                    List<StaffClassCoverage> coverage = new ArrayList<>();
                    List<String> issues = new ArrayList<>();

                    for (StaffClass staffClass : StaffClass.values()) {
                        List<PayrollPeriod> periods = resolver.periodsFor(staffClass);
                        int missingCutoff = staffClass == StaffClass.HOURLY
                                ? (int) periods.stream().filter(p -> !p.hasCutoff()).count()
                                : 0;
                        LocalDate lastCovered = periods.stream()
                                .map(PayrollPeriod::getPeriodEnd)
                                .max(LocalDate::compareTo)
                                .orElse(null);
                        boolean coversHorizon = lastCovered != null && !lastCovered.isBefore(horizon);

                        if (periods.isEmpty()) {
                            issues.add("No " + staffClass.getValue() + " payroll periods loaded");
                        }
                        if (missingCutoff > 0) {
                            issues.add(missingCutoff + " Hourly payroll period(s) have no cutoff date");
                        }
                        if (!periods.isEmpty() && !coversHorizon) {
                            issues.add(staffClass.getValue() + " calendar ends " + lastCovered
                                    + ", before the " + horizonMonths + "-month horizon " + horizon);
                        }
                        coverage.add(new StaffClassCoverage(staffClass.getValue(), periods.size(),
                                missingCutoff, lastCovered, coversHorizon));
                    }

                    if (!issues.isEmpty()) {
                        log.warn("Payroll calendar self-check found {} issue(s): {}", issues.size(), issues);
                    }
                    return new SystemCheckReport(issues.isEmpty(), horizon, coverage, issues);
                });
    }
}
