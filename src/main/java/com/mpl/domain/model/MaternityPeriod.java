package com.mpl.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * One payroll period of a maternity case ledger
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MaternityPeriod {
    private String periodId;            // caseId + "_P" + periodNumber
    private int periodNumber;           // 1-based, canonical order
    private LocalDate periodStart;
    private LocalDate periodEnd;
    private LocalDate payDate;
    private String periodName;

    @Builder.Default
    private BigDecimal smpAmount = BigDecimal.ZERO;
    @Builder.Default
    private BigDecimal companyAmount = BigDecimal.ZERO;
    @Builder.Default
    private BigDecimal holidayAccrued = BigDecimal.ZERO;

    private String smpNotes;
    private String companyNotes;
    private String holidayNotes;
    private String notes;

    private String enteredBy;
    private LocalDateTime enteredAt;
    private boolean dataComplete;
    @Builder.Default
    private PeriodStatus status = PeriodStatus.PENDING;

    // Written by the entitlement engine
    private int weeksInPeriod;
    private int entitlementWeeksApplied;
    private CmpAllocation cmpAllocation;

    public static MaternityPeriod skeleton(String caseId, int periodNumber, LocalDate periodStart,
                                           LocalDate periodEnd, LocalDate payDate, String periodName) {
        return MaternityPeriod.builder()
                .periodId(periodId(caseId, periodNumber))
                .periodNumber(periodNumber)
                .periodStart(periodStart)
                .periodEnd(periodEnd)
                .payDate(payDate)
                .periodName(periodName)
                .build();
    }

    public static String periodId(String caseId, int periodNumber) {
        return caseId + "_P" + periodNumber;
    }

    @JsonIgnore
    public boolean hasSmp() {
        return smpAmount != null && smpAmount.signum() > 0;
    }

    /**
     * Recompute dataComplete from the amounts. The workflow status is only filled in when unset,
     * so an explicit status survives recalculation.
     */
    public void refreshCompleteness() {
        dataComplete = isPositive(smpAmount) || isPositive(companyAmount) || isPositive(holidayAccrued);
        if (status == null) {
            status = derivedStatus();
        }
    }

    /**
     * Amounts were entered: recompute dataComplete and move the status to match
     */
    public void amountsEntered() {
        dataComplete = isPositive(smpAmount) || isPositive(companyAmount) || isPositive(holidayAccrued);
        status = derivedStatus();
    }

    private PeriodStatus derivedStatus() {
        return dataComplete ? PeriodStatus.AMOUNTS_ENTERED : PeriodStatus.PENDING;
    }

    public boolean isSameWindow(MaternityPeriod other) {
        return other != null
                && periodStart.equals(other.getPeriodStart())
                && periodEnd.equals(other.getPeriodEnd());
    }

    private static boolean isPositive(BigDecimal amount) {
        return amount != null && amount.signum() > 0;
    }
}
