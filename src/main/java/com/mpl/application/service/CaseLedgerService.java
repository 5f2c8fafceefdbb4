package com.mpl.application.service;

import com.mpl.application.port.out.CaseRepository;
import com.mpl.application.port.out.PayrollCalendarSource;
import com.mpl.domain.exception.NotFoundException;
import com.mpl.domain.model.CaseWarning;
import com.mpl.domain.model.MaternityCase;
import com.mpl.domain.model.PeriodStatus;
import com.mpl.domain.service.PayrollCalendarResolver;
import com.mpl.domain.service.PeriodGenerator;
import io.vertx.core.Future;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Steps shared by the case use cases: loading a case and rebuilding its period ledger
 */
@Slf4j
@RequiredArgsConstructor
public class CaseLedgerService {

    private final CaseRepository caseRepository;
    private final PayrollCalendarSource calendarSource;
    private final PeriodGenerator periodGenerator;

    public Future<MaternityCase> load(String caseId) {
        return caseRepository.findById(caseId)
                .compose(found -> found
                        .map(Future::succeededFuture)
                        .orElseGet(() -> Future.failedFuture(NotFoundException.maternityCase(caseId))));
    }

    /**
     * Load a case that may still be edited
     */
    public Future<MaternityCase> loadActive(String caseId) {
        return load(caseId).compose(maternityCase -> {
            if (maternityCase.isArchived()) {
                return Future.failedFuture(new IllegalStateException("Case " + caseId + " is archived"));
            }
            return Future.succeededFuture(maternityCase);
        });
    }

    /**
     * Replace the case's periods with freshly generated ones and seed SMP from the monthly breakdown.
     * Previously entered period amounts are discarded.
     */
    public Future<List<CaseWarning>> regeneratePeriods(MaternityCase maternityCase, String user, LocalDateTime now) {
        return calendarSource.loadCalendar()
                .map(calendar -> {
                    PayrollCalendarResolver resolver = new PayrollCalendarResolver(calendar);
                    PeriodGenerator.Generation generation = periodGenerator.generatePeriods(maternityCase, resolver);

                    maternityCase.setPeriods(new ArrayList<>(generation.periods()));
                    maternityCase.setFallbackPeriods(generation.fallback());
                    periodGenerator.applyMonthlyBreakdown(maternityCase, user, now);

                    List<CaseWarning> warnings = new ArrayList<>();
                    if (generation.fallback()) {
                        warnings.add(CaseWarning.of(CaseWarning.FALLBACK_PERIODS,
                                "SMP start date " + maternityCase.getSmpStartDate()
                                        + " has no payroll period; estimated monthly periods were generated"));
                    }
                    log.info("Case {}: {} period(s) generated{}", maternityCase.getCaseId(),
                            generation.periods().size(), generation.fallback() ? " (estimated)" : "");
                    return warnings;
                });
    }

    /**
     * Re-apply the monthly breakdown to periods whose amounts have not been entered yet
     */
    public int reseedPendingPeriods(MaternityCase maternityCase, String user, LocalDateTime now) {
        int seeded = periodGenerator.applyMonthlyBreakdown(maternityCase, user, now,
                period -> period.getStatus() == PeriodStatus.PENDING).periodsSeeded();
        log.info("Case {}: monthly breakdown re-applied to {} pending period(s)", maternityCase.getCaseId(), seeded);
        return seeded;
    }
}
