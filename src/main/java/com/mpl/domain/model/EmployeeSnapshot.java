package com.mpl.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

/**
 * Employee details frozen when a case is created.
 * Later salary or contract changes in the directory never reach a stored snapshot.
 */
@Value
@Builder
@Jacksonized
public class EmployeeSnapshot {
    String employeeId;
    String fullName;
    String location;
    StaffClass staffClass;
    BigDecimal annualSalary;      // Salaried only
    BigDecimal hourlyRate;        // Hourly only
    BigDecimal contractedHours;   // Hourly only, weekly hours

    @JsonIgnore
    public boolean isSalaried() {
        return StaffClass.SALARIED.equals(staffClass);
    }

    @JsonIgnore
    public boolean isHourly() {
        return StaffClass.HOURLY.equals(staffClass);
    }
}
