package com.mpl.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;

/**
 * Payroll calendar entry - supplied externally, read-only to the engine.
 * cutoffDate is only meaningful for hourly periods and may be absent.
 */
@Value
@Builder
@Jacksonized
public class PayrollPeriod {
    StaffClass staffClass;
    LocalDate periodStart;
    LocalDate periodEnd;
    LocalDate payDate;
    LocalDate cutoffDate;
    String periodName;

    @JsonIgnore
    public boolean hasCutoff() {
        return cutoffDate != null;
    }

    @JsonIgnore
    public boolean isSalaried() {
        return StaffClass.SALARIED.equals(staffClass);
    }

    @JsonIgnore
    public boolean isHourly() {
        return StaffClass.HOURLY.equals(staffClass);
    }
}
