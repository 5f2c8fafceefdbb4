package com.mpl.application.port.in;

import com.mpl.domain.model.DashboardBucket;
import com.mpl.domain.model.MaternityCase;
import com.mpl.domain.model.MaternityPeriod;
import io.vertx.core.Future;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Input port for read-only projections
 */
public interface CaseQueryUseCase {

    Future<MaternityCase> getCase(String caseId);

    Future<List<MaternityCase>> listCases(boolean includeArchived);

    /**
     * Active cases bucketed against today, with remaining pay totals
     */
    Future<Dashboard> dashboard();

    /**
     * Periods of one case grouped by the calendar month of periodStart
     */
    Future<PeriodDetail> periodDetail(String caseId);

    record DashboardRow(
            String caseId,
            String employeeId,
            String employeeName,
            String location,
            String staffClass,
            DashboardBucket bucket,
            LocalDate maternityStartDate,
            LocalDate expectedReturnDate,
            LocalDate actualReturnDate,
            BigDecimal totalCMP,
            BigDecimal remainingSmp,
            BigDecimal remainingCmp,
            boolean needsAttention
    ) {}

    record Dashboard(
            LocalDate asOf,
            List<DashboardRow> cases,
            Map<DashboardBucket, Long> bucketCounts,
            BigDecimal remainingSmp,
            BigDecimal remainingCmp
    ) {}

    record MonthGroup(
            String month,
            List<MaternityPeriod> periods,
            BigDecimal smpTotal,
            BigDecimal cmpTotal
    ) {}

    record PeriodDetail(
            String caseId,
            List<MonthGroup> months,
            BigDecimal smpTotal,
            BigDecimal cmpTotal
    ) {}
}
