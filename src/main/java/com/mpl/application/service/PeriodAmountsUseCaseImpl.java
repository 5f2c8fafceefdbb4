package com.mpl.application.service;

import com.mpl.application.port.in.PeriodAmountsUseCase;
import com.mpl.application.port.out.CaseRepository;
import com.mpl.application.port.out.IdentityProvider;
import com.mpl.domain.exception.NotFoundException;
import com.mpl.domain.exception.ValidationException;
import com.mpl.domain.model.MaternityCase;
import com.mpl.domain.model.MaternityPeriod;
import com.mpl.domain.model.PeriodStatus;
import com.mpl.domain.service.CmpCalculator;
import io.vertx.core.Future;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Application service for per-period edits
 */
@Slf4j
@RequiredArgsConstructor
public class PeriodAmountsUseCaseImpl implements PeriodAmountsUseCase {

    private final CaseValidator validator;
    private final CaseRepository caseRepository;
    private final IdentityProvider identityProvider;
    private final CaseLedgerService ledgerService;
    private final CmpCalculator cmpCalculator;
    private final Clock clock;

    @Override
    public Future<MaternityCase> updatePeriodAmounts(String caseId, String periodId, PeriodAmountsCommand command) {
        log.info("Updating amounts of period {} on case {}", periodId, caseId);

        ValidationResult validation = validator.validate(command);
        if (!validation.isValid()) {
            log.warn("Validation failed for period {}: {}", periodId, validation.errors());
            return Future.failedFuture(new ValidationException(validation.errors()));
        }

        String user = identityProvider.currentUser();
        LocalDateTime now = LocalDateTime.now(clock);

        return ledgerService.loadActive(caseId)
                .compose(maternityCase -> findPeriod(maternityCase, periodId)
                        .map(period -> {
                            AppliedEdit edit = applyAmounts(period, command);
                            if (edit.amountsChanged()) {
                                period.amountsEntered();
                            } else {
                                period.refreshCompleteness();
                            }
                            period.setEnteredBy(user);
                            period.setEnteredAt(now);
                            maternityCase.setLastUpdatedBy(user);
                            maternityCase.setLastUpdatedAt(now);

                            if (edit.smpChanged()) {
                                // Later periods' remaining entitlement depends on this one
                                cmpCalculator.recalculate(maternityCase);
                            } else {
                                maternityCase.setTotalCMP(maternityCase.sumCompanyAmounts());
                            }
                            return maternityCase;
                        }))
                .compose(caseRepository::update)
                .onSuccess(updated -> log.info("Period {} on case {} updated, case CMP {}",
                        periodId, caseId, updated.getTotalCMP()))
                .onFailure(error -> log.error("Failed to update period {} on case {}: {}",
                        periodId, caseId, error.getMessage()));
    }

    @Override
    public Future<MaternityCase> setPeriodStatus(String caseId, String periodId, String status) {
        if (status == null || !PeriodStatus.isValid(status)) {
            return Future.failedFuture(new ValidationException("status must be one of: pending, amounts_entered"));
        }

        String user = identityProvider.currentUser();
        LocalDateTime now = LocalDateTime.now(clock);

        return ledgerService.loadActive(caseId)
                .compose(maternityCase -> findPeriod(maternityCase, periodId)
                        .map(period -> {
                            period.setStatus(PeriodStatus.fromValue(status));
                            maternityCase.setLastUpdatedBy(user);
                            maternityCase.setLastUpdatedAt(now);
                            return maternityCase;
                        }))
                .compose(caseRepository::update)
                .onSuccess(updated -> log.info("Period {} on case {} set to {}", periodId, caseId, status))
                .onFailure(error -> log.error("Failed to set status of period {} on case {}: {}",
                        periodId, caseId, error.getMessage()));
    }

    private Future<MaternityPeriod> findPeriod(MaternityCase maternityCase, String periodId) {
        return maternityCase.findPeriod(periodId)
                .map(Future::succeededFuture)
                .orElseGet(() -> Future.failedFuture(NotFoundException.period(periodId)));
    }

    private AppliedEdit applyAmounts(MaternityPeriod period, PeriodAmountsCommand command) {
        boolean smpChanged = false;
        boolean amountsChanged = false;
        if (command.smpAmount() != null) {
            smpChanged = changed(period.getSmpAmount(), command.smpAmount());
            amountsChanged = smpChanged;
            period.setSmpAmount(command.smpAmount());
        }
        if (command.companyAmount() != null) {
            amountsChanged |= changed(period.getCompanyAmount(), command.companyAmount());
            period.setCompanyAmount(command.companyAmount().setScale(2));
        }
        if (command.holidayAccrued() != null) {
            amountsChanged |= changed(period.getHolidayAccrued(), command.holidayAccrued());
            period.setHolidayAccrued(command.holidayAccrued());
        }
        if (command.smpNotes() != null) {
            period.setSmpNotes(command.smpNotes());
        }
        if (command.companyNotes() != null) {
            period.setCompanyNotes(command.companyNotes());
        }
        if (command.holidayNotes() != null) {
            period.setHolidayNotes(command.holidayNotes());
        }
        if (command.notes() != null) {
            period.setNotes(command.notes());
        }
        if (period.getHolidayAccrued() == null) {
            period.setHolidayAccrued(BigDecimal.ZERO);
        }
        return new AppliedEdit(smpChanged, amountsChanged);
    }

    private static boolean changed(BigDecimal current, BigDecimal update) {
        return current == null || update.compareTo(current) != 0;
    }

    /**
     * What an edit touched: the SMP amount drives recalculation, any amount moves the workflow status
     */
    private record AppliedEdit(boolean smpChanged, boolean amountsChanged) {}
}
