package com.mpl.application.service;

import com.mpl.application.port.in.MaternityCaseUseCase;
import com.mpl.application.port.out.CaseRepository;
import com.mpl.application.port.out.EmployeeDirectory;
import com.mpl.application.port.out.IdentityProvider;
import com.mpl.domain.exception.CalculationException;
import com.mpl.domain.exception.NotFoundException;
import com.mpl.domain.exception.ValidationException;
import com.mpl.domain.model.CaseResult;
import com.mpl.domain.model.CaseStatus;
import com.mpl.domain.model.CaseWarning;
import com.mpl.domain.model.CmpStatus;
import com.mpl.domain.model.EmployeeSnapshot;
import com.mpl.domain.model.MaternityCase;
import com.mpl.domain.model.MaternityPeriod;
import com.mpl.domain.service.CmpCalculator;
import io.vertx.core.Future;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Application service implementing the case lifecycle
 */
@Slf4j
public class MaternityCaseUseCaseImpl implements MaternityCaseUseCase {

    private final CaseValidator validator;
    private final CaseRepository caseRepository;
    private final EmployeeDirectory employeeDirectory;
    private final IdentityProvider identityProvider;
    private final CaseLedgerService ledgerService;
    private final CmpCalculator cmpCalculator;
    private final Clock clock;
    private final int defaultCmpWeeksEntitlement;

    public MaternityCaseUseCaseImpl(
            CaseValidator validator,
            CaseRepository caseRepository,
            EmployeeDirectory employeeDirectory,
            IdentityProvider identityProvider,
            CaseLedgerService ledgerService,
            CmpCalculator cmpCalculator,
            Clock clock,
            int defaultCmpWeeksEntitlement
    ) {
        this.validator = validator;
        this.caseRepository = caseRepository;
        this.employeeDirectory = employeeDirectory;
        this.identityProvider = identityProvider;
        this.ledgerService = ledgerService;
        this.cmpCalculator = cmpCalculator;
        this.clock = clock;
        this.defaultCmpWeeksEntitlement = defaultCmpWeeksEntitlement;
    }

    @Override
    public Future<CaseResult> createCase(CreateCaseCommand command) {
        log.info("Creating maternity case for employee {}", command.employeeId());

        ValidationResult validation = validator.validate(command);
        if (!validation.isValid()) {
            log.warn("Validation failed for new case of employee {}: {}", command.employeeId(), validation.errors());
            return Future.failedFuture(new ValidationException(validation.errors()));
        }

        String user = identityProvider.currentUser();
        LocalDateTime now = LocalDateTime.now(clock);
        List<CaseWarning> warnings = new ArrayList<>();

        return employeeDirectory.lookupByNumber(command.employeeId())
                .compose(found -> found
                        .map(Future::succeededFuture)
                        .orElseGet(() -> Future.failedFuture(NotFoundException.employee(command.employeeId()))))
                .map(employee -> newCase(command, employee, user, now))
                .compose(maternityCase -> ledgerService.regeneratePeriods(maternityCase, user, now)
                        .map(generationWarnings -> {
                            warnings.addAll(generationWarnings);
                            calculateTolerantly(maternityCase, warnings);
                            return maternityCase;
                        }))
                .compose(caseRepository::insert)
                .map(stored -> new CaseResult(stored, warnings))
                .onSuccess(result -> log.info("Created case {} for employee {} with {} period(s), CMP {}",
                        result.maternityCase().getCaseId(), command.employeeId(),
                        result.maternityCase().getPeriods().size(), result.maternityCase().getTotalCMP()))
                .onFailure(error -> log.error("Failed to create case for employee {}: {}",
                        command.employeeId(), error.getMessage()));
    }

    @Override
    public Future<CaseResult> updateCase(String caseId, UpdateCaseCommand command) {
        log.info("Updating case {}", caseId);

        ValidationResult validation = validator.validate(command);
        if (!validation.isValid()) {
            log.warn("Validation failed for update of case {}: {}", caseId, validation.errors());
            return Future.failedFuture(new ValidationException(validation.errors()));
        }

        String user = identityProvider.currentUser();
        LocalDateTime now = LocalDateTime.now(clock);
        List<CaseWarning> warnings = new ArrayList<>();

        return ledgerService.loadActive(caseId)
                .compose(maternityCase -> {
                    boolean datesChanged = mergeDates(maternityCase, command);
                    boolean breakdownChanged = mergeBreakdown(maternityCase, command);
                    boolean earningsChanged = mergeFigures(maternityCase, command);

                    ValidationResult merged = validator.validate(maternityCase);
                    if (!merged.isValid()) {
                        log.warn("Updated case {} is inconsistent: {}", caseId, merged.errors());
                        return Future.failedFuture(new ValidationException(merged.errors()));
                    }
                    stampUpdate(maternityCase, user, now);

                    if (datesChanged) {
                        log.info("Case {}: key dates changed, regenerating periods", caseId);
                        return ledgerService.regeneratePeriods(maternityCase, user, now)
                                .map(generationWarnings -> {
                                    warnings.addAll(generationWarnings);
                                    recalculateIfEarningsKnown(maternityCase, warnings);
                                    return maternityCase;
                                });
                    }
                    if (breakdownChanged) {
                        ledgerService.reseedPendingPeriods(maternityCase, user, now);
                    }
                    if (earningsChanged || breakdownChanged) {
                        cmpCalculator.recalculate(maternityCase);
                    }
                    return Future.succeededFuture(maternityCase);
                })
                .compose(caseRepository::update)
                .map(stored -> new CaseResult(stored, warnings))
                .onSuccess(result -> log.info("Updated case {}", caseId))
                .onFailure(error -> log.error("Failed to update case {}: {}", caseId, error.getMessage()));
    }

    @Override
    public Future<CaseResult> setActualReturnDate(String caseId, String actualReturnDate) {
        log.info("Setting actual return date {} on case {}", actualReturnDate, caseId);

        String user = identityProvider.currentUser();
        LocalDateTime now = LocalDateTime.now(clock);
        List<CaseWarning> warnings = new ArrayList<>();

        return ledgerService.loadActive(caseId)
                .compose(maternityCase -> {
                    ValidationResult validation = validator.validateActualReturnDate(actualReturnDate, maternityCase);
                    if (!validation.isValid()) {
                        return Future.failedFuture(new ValidationException(validation.errors()));
                    }

                    List<MaternityPeriod> previous = maternityCase.getPeriods();
                    maternityCase.setActualReturnDate(CaseValidator.toDate(actualReturnDate));
                    stampUpdate(maternityCase, user, now);

                    return ledgerService.regeneratePeriods(maternityCase, user, now)
                            .map(generationWarnings -> {
                                warnings.addAll(generationWarnings);
                                carryOverEnteredAmounts(previous, maternityCase.getPeriods());
                                recalculateIfEarningsKnown(maternityCase, warnings);
                                return maternityCase;
                            });
                })
                .compose(caseRepository::update)
                .map(stored -> new CaseResult(stored, warnings))
                .onFailure(error -> log.error("Failed to set actual return date on case {}: {}",
                        caseId, error.getMessage()));
    }

    @Override
    public Future<MaternityCase> archiveCase(String caseId, String reason) {
        log.info("Archiving case {}", caseId);

        ValidationResult validation = validator.validateArchiveReason(reason);
        if (!validation.isValid()) {
            return Future.failedFuture(new ValidationException(validation.errors()));
        }

        String user = identityProvider.currentUser();
        LocalDateTime now = LocalDateTime.now(clock);

        return ledgerService.loadActive(caseId)
                .map(maternityCase -> {
                    maternityCase.setStatus(CaseStatus.ARCHIVED);
                    maternityCase.setArchivedBy(user);
                    maternityCase.setArchivedAt(now);
                    maternityCase.setArchiveReason(reason.trim());
                    stampUpdate(maternityCase, user, now);
                    return maternityCase;
                })
                .compose(caseRepository::update)
                .onSuccess(archived -> log.info("Archived case {} by {}: {}", caseId, user, reason))
                .onFailure(error -> log.error("Failed to archive case {}: {}", caseId, error.getMessage()));
    }

    private MaternityCase newCase(CreateCaseCommand command, EmployeeSnapshot employee, String user, LocalDateTime now) {
        MaternityCase maternityCase = MaternityCase.builder()
                .caseId(newCaseId())
                .employeeId(command.employeeId())
                .employee(employee)
                .babyDueDate(CaseValidator.toDate(command.babyDueDate()))
                .maternityStartDate(CaseValidator.toDate(command.maternityStartDate()))
                .smpStartDate(CaseValidator.toDate(command.smpStartDate()))
                .expectedReturnDate(CaseValidator.toDate(command.expectedReturnDate()))
                .actualReturnDate(CaseValidator.toDate(command.actualReturnDate()))
                .totalSMP(command.totalSMP())
                .monthlySMPBreakdown(command.monthlySMPBreakdown() != null
                        ? new TreeMap<>(command.monthlySMPBreakdown())
                        : new TreeMap<>())
                .averageWeeklyEarnings(command.averageWeeklyEarnings())
                .cmpWeeksEntitlement(command.cmpWeeksEntitlement() != null
                        ? command.cmpWeeksEntitlement()
                        : defaultCmpWeeksEntitlement)
                .status(CaseStatus.ACTIVE)
                .createdBy(user)
                .createdAt(now)
                .lastUpdatedBy(user)
                .lastUpdatedAt(now)
                .periods(new ArrayList<>())
                .build();

        maternityCase.setContractedWeeklyEarnings(cmpCalculator.contractedWeeklyEarnings(employee));
        maternityCase.setTargetWeeklyAmount(cmpCalculator.targetWeeklyAmount(
                maternityCase.getAverageWeeklyEarnings(), maternityCase.getContractedWeeklyEarnings()));
        return maternityCase;
    }

    /**
     * Creation keeps the case even when CMP cannot be calculated
     */
    private void calculateTolerantly(MaternityCase maternityCase, List<CaseWarning> warnings) {
        try {
            cmpCalculator.recalculate(maternityCase);
        } catch (CalculationException e) {
            log.warn("Case {}: CMP calculation failed, storing with zero CMP: {}",
                    maternityCase.getCaseId(), e.getMessage());
            clearCmp(maternityCase, CmpStatus.FAILED);
            warnings.add(CaseWarning.of(CaseWarning.CMP_CALCULATION_FAILED,
                    "CMP could not be calculated and was set to 0: " + e.getMessage()));
        }
    }

    private void recalculateIfEarningsKnown(MaternityCase maternityCase, List<CaseWarning> warnings) {
        if (maternityCase.getAverageWeeklyEarnings() != null && maternityCase.getAverageWeeklyEarnings().signum() > 0) {
            cmpCalculator.recalculate(maternityCase);
            return;
        }
        clearCmp(maternityCase, CmpStatus.NOT_CALCULATED);
        warnings.add(CaseWarning.of(CaseWarning.CMP_NOT_CALCULATED,
                "averageWeeklyEarnings is 0; CMP was not recalculated"));
    }

    private void clearCmp(MaternityCase maternityCase, CmpStatus cmpStatus) {
        maternityCase.getPeriods().forEach(period -> {
            period.setCompanyAmount(BigDecimal.ZERO.setScale(2));
            period.setEntitlementWeeksApplied(0);
            period.setCmpAllocation(null);
            period.refreshCompleteness();
        });
        maternityCase.setTotalCMP(BigDecimal.ZERO.setScale(2));
        maternityCase.setCmpWeeksConsumed(0);
        maternityCase.setCmpStatus(cmpStatus);
    }

    /**
     * Periods that survive regeneration unchanged keep what payroll staff already entered
     */
    private void carryOverEnteredAmounts(List<MaternityPeriod> previous, List<MaternityPeriod> regenerated) {
        if (previous == null) {
            return;
        }
        for (MaternityPeriod period : regenerated) {
            previous.stream()
                    .filter(old -> old.isSameWindow(period) && (old.isDataComplete() || old.getEnteredBy() != null))
                    .findFirst()
                    .ifPresent(old -> {
                        period.setSmpAmount(old.getSmpAmount());
                        period.setHolidayAccrued(old.getHolidayAccrued());
                        period.setSmpNotes(old.getSmpNotes());
                        period.setCompanyNotes(old.getCompanyNotes());
                        period.setHolidayNotes(old.getHolidayNotes());
                        period.setNotes(old.getNotes());
                        period.setEnteredBy(old.getEnteredBy());
                        period.setEnteredAt(old.getEnteredAt());
                        period.setStatus(old.getStatus());
                        period.refreshCompleteness();
                    });
        }
    }

    private boolean mergeDates(MaternityCase maternityCase, UpdateCaseCommand command) {
        LocalDate babyDue = mergeDate(maternityCase.getBabyDueDate(), command.babyDueDate());
        LocalDate maternityStart = mergeDate(maternityCase.getMaternityStartDate(), command.maternityStartDate());
        LocalDate smpStart = mergeDate(maternityCase.getSmpStartDate(), command.smpStartDate());
        LocalDate expectedReturn = mergeDate(maternityCase.getExpectedReturnDate(), command.expectedReturnDate());

        boolean changed = !Objects.equals(babyDue, maternityCase.getBabyDueDate())
                || !Objects.equals(maternityStart, maternityCase.getMaternityStartDate())
                || !Objects.equals(smpStart, maternityCase.getSmpStartDate())
                || !Objects.equals(expectedReturn, maternityCase.getExpectedReturnDate());

        maternityCase.setBabyDueDate(babyDue);
        maternityCase.setMaternityStartDate(maternityStart);
        maternityCase.setSmpStartDate(smpStart);
        maternityCase.setExpectedReturnDate(expectedReturn);
        return changed;
    }

    /**
     * @return true when the monthly breakdown differs from the stored one
     */
    private boolean mergeBreakdown(MaternityCase maternityCase, UpdateCaseCommand command) {
        if (command.monthlySMPBreakdown() == null) {
            return false;
        }
        Map<String, BigDecimal> update = new TreeMap<>(command.monthlySMPBreakdown());
        Map<String, BigDecimal> current = maternityCase.getMonthlySMPBreakdown();
        boolean changed = current == null || !sameBreakdown(update, current);
        maternityCase.setMonthlySMPBreakdown(update);
        return changed;
    }

    private boolean sameBreakdown(Map<String, BigDecimal> update, Map<String, BigDecimal> current) {
        if (!update.keySet().equals(current.keySet())) {
            return false;
        }
        return update.entrySet().stream()
                .allMatch(entry -> sameAmount(entry.getValue(), current.get(entry.getKey())));
    }

    /**
     * @return true when a figure feeding the CMP calculation changed
     */
    private boolean mergeFigures(MaternityCase maternityCase, UpdateCaseCommand command) {
        boolean earningsChanged = false;

        if (command.totalSMP() != null) {
            maternityCase.setTotalSMP(command.totalSMP());
        }
        if (command.averageWeeklyEarnings() != null
                && !sameAmount(command.averageWeeklyEarnings(), maternityCase.getAverageWeeklyEarnings())) {
            maternityCase.setAverageWeeklyEarnings(command.averageWeeklyEarnings());
            earningsChanged = true;
        }
        if (command.cmpWeeksEntitlement() != null
                && command.cmpWeeksEntitlement() != maternityCase.getCmpWeeksEntitlement()) {
            maternityCase.setCmpWeeksEntitlement(command.cmpWeeksEntitlement());
            earningsChanged = true;
        }
        return earningsChanged;
    }

    private boolean sameAmount(BigDecimal update, BigDecimal current) {
        return current != null && update.compareTo(current) == 0;
    }

    private LocalDate mergeDate(LocalDate current, String update) {
        LocalDate parsed = CaseValidator.toDate(update);
        return parsed != null ? parsed : current;
    }

    private void stampUpdate(MaternityCase maternityCase, String user, LocalDateTime now) {
        maternityCase.setLastUpdatedBy(user);
        maternityCase.setLastUpdatedAt(now);
    }

    private String newCaseId() {
        return "MAT-" + UUID.randomUUID().toString().substring(0, 8).toUpperCase(Locale.ROOT);
    }
}
