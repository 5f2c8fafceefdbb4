package com.mpl.domain.service;

import com.mpl.domain.exception.CalculationException;
import com.mpl.domain.model.CmpAllocation;
import com.mpl.domain.model.CmpStatus;
import com.mpl.domain.model.EmployeeSnapshot;
import com.mpl.domain.model.MaternityCase;
import com.mpl.domain.model.MaternityPeriod;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Entitlement engine - computes the company maternity pay (CMP) top-up per period.
 *
 * <p>Periods are processed in periodNumber order. Each period can draw at most as many weeks as it
 * spans from the SMP start, and never more than what is left of the capped entitlement. Periods
 * without SMP get no top-up and consume nothing.
 */
@Slf4j
public class CmpCalculator {

    private static final BigDecimal WEEKS_PER_YEAR = new BigDecimal("52");
    private static final int MONEY_SCALE = 2;

    /**
     * annualSalary / 52 for salaried staff, hourlyRate * contractedHours for hourly staff.
     * Missing figures count as zero; zero-hours contracts are valid.
     */
    public BigDecimal contractedWeeklyEarnings(EmployeeSnapshot employee) {
        if (employee == null || employee.getStaffClass() == null) {
            return money(BigDecimal.ZERO);
        }
        if (employee.isSalaried()) {
            BigDecimal salary = orZero(employee.getAnnualSalary());
            return salary.divide(WEEKS_PER_YEAR, MONEY_SCALE, RoundingMode.HALF_UP);
        }
        return money(orZero(employee.getHourlyRate()).multiply(orZero(employee.getContractedHours())));
    }

    public BigDecimal targetWeeklyAmount(BigDecimal averageWeeklyEarnings, BigDecimal contractedWeeklyEarnings) {
        return money(orZero(averageWeeklyEarnings).max(orZero(contractedWeeklyEarnings)));
    }

    /**
     * Number of 7-day units between max(smpStart, periodStart) and periodEnd inclusive, floored at 0
     */
    public int weeksInPeriod(LocalDate smpStartDate, LocalDate periodStart, LocalDate periodEnd) {
        LocalDate effectiveStart = smpStartDate.isAfter(periodStart) ? smpStartDate : periodStart;
        long days = ChronoUnit.DAYS.between(effectiveStart, periodEnd) + 1;
        if (days <= 0) {
            return 0;
        }
        return (int) ((days + 6) / 7);
    }

    /**
     * Pure calculation; the case is not modified
     */
    public CmpCalculation calculate(MaternityCase maternityCase) {
        checkInputs(maternityCase);

        BigDecimal target = maternityCase.getTargetWeeklyAmount();
        int entitlement = maternityCase.getCmpWeeksEntitlement();
        List<MaternityPeriod> ordered = maternityCase.getPeriods().stream()
                .sorted(Comparator.comparingInt(MaternityPeriod::getPeriodNumber))
                .toList();

        List<PeriodAllocation> allocations = new ArrayList<>();
        int weeksConsumed = 0;
        BigDecimal total = BigDecimal.ZERO;

        for (MaternityPeriod period : ordered) {
            int weeks = weeksInPeriod(maternityCase.getSmpStartDate(), period.getPeriodStart(), period.getPeriodEnd());
            int available = Math.min(weeks, entitlement - weeksConsumed);

            if (available <= 0) {
                CmpAllocation reason = weeks <= 0 ? CmpAllocation.NO_SMP : CmpAllocation.BEYOND_ENTITLEMENT;
                allocations.add(new PeriodAllocation(period.getPeriodId(), weeks, 0, money(BigDecimal.ZERO), reason));
                continue;
            }
            if (!period.hasSmp()) {
                allocations.add(new PeriodAllocation(period.getPeriodId(), weeks, 0, money(BigDecimal.ZERO),
                        CmpAllocation.NO_SMP));
                continue;
            }

            BigDecimal periodTarget = target.multiply(BigDecimal.valueOf(available));
            BigDecimal companyAmount = money(periodTarget.subtract(period.getSmpAmount()).max(BigDecimal.ZERO));
            weeksConsumed += available;
            total = total.add(companyAmount);
            allocations.add(new PeriodAllocation(period.getPeriodId(), weeks, available, companyAmount,
                    CmpAllocation.ALLOCATED));
        }

        return new CmpCalculation(allocations, money(total), weeksConsumed);
    }

    /**
     * Refresh the derived weekly figures, run the allocation and write the result onto the case
     */
    public CmpCalculation recalculate(MaternityCase maternityCase) {
        try {
            maternityCase.setContractedWeeklyEarnings(contractedWeeklyEarnings(maternityCase.getEmployee()));
            maternityCase.setTargetWeeklyAmount(targetWeeklyAmount(
                    maternityCase.getAverageWeeklyEarnings(), maternityCase.getContractedWeeklyEarnings()));

            CmpCalculation calculation = calculate(maternityCase);
            apply(maternityCase, calculation);

            log.info("Case {}: CMP {} over {} of {} entitlement week(s)",
                    maternityCase.getCaseId(), calculation.totalCmp(), calculation.weeksConsumed(),
                    maternityCase.getCmpWeeksEntitlement());
            return calculation;
        } catch (CalculationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new CalculationException("CMP calculation failed for case " + maternityCase.getCaseId(), e);
        }
    }

    void apply(MaternityCase maternityCase, CmpCalculation calculation) {
        Map<String, PeriodAllocation> byPeriod = calculation.allocations().stream()
                .collect(Collectors.toMap(PeriodAllocation::periodId, Function.identity()));

        for (MaternityPeriod period : maternityCase.getPeriods()) {
            PeriodAllocation allocation = byPeriod.get(period.getPeriodId());
            period.setCompanyAmount(allocation.companyAmount());
            period.setWeeksInPeriod(allocation.weeksInPeriod());
            period.setEntitlementWeeksApplied(allocation.weeksApplied());
            period.setCmpAllocation(allocation.allocation());
            period.refreshCompleteness();
        }

        maternityCase.setTotalCMP(maternityCase.sumCompanyAmounts());
        maternityCase.setCmpWeeksConsumed(calculation.weeksConsumed());
        maternityCase.setCmpStatus(CmpStatus.CALCULATED);
    }

    private void checkInputs(MaternityCase maternityCase) {
        if (maternityCase.getSmpStartDate() == null) {
            throw new CalculationException("Case " + maternityCase.getCaseId() + " has no SMP start date");
        }
        if (maternityCase.getPeriods() == null) {
            throw new CalculationException("Case " + maternityCase.getCaseId() + " has no periods");
        }
        if (maternityCase.getTargetWeeklyAmount() == null) {
            throw new CalculationException("Case " + maternityCase.getCaseId() + " has no target weekly amount");
        }
        if (maternityCase.getCmpWeeksEntitlement() < 0) {
            throw new CalculationException("Case " + maternityCase.getCaseId() + " has a negative CMP entitlement");
        }
        for (MaternityPeriod period : maternityCase.getPeriods()) {
            if (period.getPeriodStart() == null || period.getPeriodEnd() == null) {
                throw new CalculationException("Period " + period.getPeriodId() + " has no date range");
            }
            if (period.getSmpAmount() == null) {
                period.setSmpAmount(BigDecimal.ZERO);
            }
        }
    }

    private static BigDecimal orZero(BigDecimal value) {
        return value != null ? value : BigDecimal.ZERO;
    }

    private static BigDecimal money(BigDecimal value) {
        return value.setScale(MONEY_SCALE, RoundingMode.HALF_UP);
    }

    /**
     * CMP outcome for one period
     */
    public record PeriodAllocation(
            String periodId,
            int weeksInPeriod,
            int weeksApplied,
            BigDecimal companyAmount,
            CmpAllocation allocation
    ) {}

    /**
     * CMP outcome for a whole case
     */
    public record CmpCalculation(List<PeriodAllocation> allocations, BigDecimal totalCmp, int weeksConsumed) {}
}
