package com.mpl.application.port.in;

import com.mpl.domain.model.PayrollPeriod;
import io.vertx.core.Future;

import java.time.LocalDate;
import java.util.List;

/**
 * Input port for payroll calendar checks
 */
public interface CalendarCheckUseCase {

    /**
     * Check whether a proposed SMP start date resolves to a payroll period
     */
    Future<SmpStartValidation> validateSmpStartDate(String smpStartDate, String staffClass);

    /**
     * Report calendar completeness: periods present, hourly cutoff coverage, forward horizon
     */
    Future<SystemCheckReport> systemCheck();

    record SmpStartValidation(boolean valid, PayrollPeriod period, String message) {}

    record StaffClassCoverage(
            String staffClass,
            int periodCount,
            int periodsMissingCutoff,
            LocalDate lastCoveredDate,
            boolean coversHorizon
    ) {}

    record SystemCheckReport(
            boolean healthy,
            LocalDate horizonDate,
            List<StaffClassCoverage> coverage,
            List<String> issues
    ) {}
}
