package com.mpl.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Maternity case aggregate - the employee snapshot, leave dates, pay inputs and the period ledger
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MaternityCase {
    public static final int DEFAULT_CMP_WEEKS_ENTITLEMENT = 8;

    private String caseId;
    private String employeeId;
    private EmployeeSnapshot employee;  // Frozen at creation

    private LocalDate babyDueDate;
    private LocalDate maternityStartDate;
    private LocalDate smpStartDate;
    private LocalDate expectedReturnDate;
    private LocalDate actualReturnDate;

    @Builder.Default
    private BigDecimal totalSMP = BigDecimal.ZERO;
    @Builder.Default
    private Map<String, BigDecimal> monthlySMPBreakdown = new TreeMap<>();   // yyyy-MM -> amount
    @Builder.Default
    private BigDecimal averageWeeklyEarnings = BigDecimal.ZERO;
    @Builder.Default
    private BigDecimal contractedWeeklyEarnings = BigDecimal.ZERO;
    @Builder.Default
    private BigDecimal targetWeeklyAmount = BigDecimal.ZERO;
    @Builder.Default
    private int cmpWeeksEntitlement = DEFAULT_CMP_WEEKS_ENTITLEMENT;
    @Builder.Default
    private BigDecimal totalCMP = BigDecimal.ZERO;
    private int cmpWeeksConsumed;
    @Builder.Default
    private CmpStatus cmpStatus = CmpStatus.NOT_CALCULATED;
    private boolean fallbackPeriods;

    @Builder.Default
    private CaseStatus status = CaseStatus.ACTIVE;
    private String createdBy;
    private LocalDateTime createdAt;
    private String lastUpdatedBy;
    private LocalDateTime lastUpdatedAt;
    private String archivedBy;
    private LocalDateTime archivedAt;
    private String archiveReason;

    private long version;               // Optimistic concurrency token, owned by the store

    @Builder.Default
    private List<MaternityPeriod> periods = new ArrayList<>();

    @JsonIgnore
    public boolean isActive() {
        return CaseStatus.ACTIVE.equals(status);
    }

    @JsonIgnore
    public boolean isArchived() {
        return CaseStatus.ARCHIVED.equals(status);
    }

    @JsonIgnore
    public StaffClass getStaffClass() {
        return employee != null ? employee.getStaffClass() : null;
    }

    /**
     * Leave ends on the actual return date when known, otherwise the expected one
     */
    @JsonIgnore
    public LocalDate getEffectiveEndDate() {
        return actualReturnDate != null ? actualReturnDate : expectedReturnDate;
    }

    public Optional<MaternityPeriod> findPeriod(String periodId) {
        if (periods == null) {
            return Optional.empty();
        }
        return periods.stream()
                .filter(p -> p.getPeriodId().equals(periodId))
                .findFirst();
    }

    public BigDecimal sumCompanyAmounts() {
        if (periods == null) {
            return BigDecimal.ZERO.setScale(2);
        }
        return periods.stream()
                .map(MaternityPeriod::getCompanyAmount)
                .reduce(BigDecimal.ZERO, BigDecimal::add)
                .setScale(2, RoundingMode.HALF_UP);
    }

    public BigDecimal sumSmpAmounts() {
        if (periods == null) {
            return BigDecimal.ZERO.setScale(2);
        }
        return periods.stream()
                .map(MaternityPeriod::getSmpAmount)
                .reduce(BigDecimal.ZERO, BigDecimal::add)
                .setScale(2, RoundingMode.HALF_UP);
    }
}
