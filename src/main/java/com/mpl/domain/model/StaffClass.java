package com.mpl.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Staff classification - decides which payroll calendar and matching rule applies
 */
public enum StaffClass {
    SALARIED("Salaried"),
    HOURLY("Hourly");

    private final String value;

    StaffClass(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static StaffClass fromValue(String value) {
        for (StaffClass staffClass : values()) {
            if (staffClass.value.equalsIgnoreCase(value)) {
                return staffClass;
            }
        }
        throw new IllegalArgumentException("Unknown staff class: " + value);
    }

    /**
     * Map the employee directory pay type (Salary / Hourly) to a staff class
     */
    public static StaffClass fromPayType(String payType) {
        if ("Salary".equalsIgnoreCase(payType) || "Salaried".equalsIgnoreCase(payType)) {
            return SALARIED;
        }
        if ("Hourly".equalsIgnoreCase(payType)) {
            return HOURLY;
        }
        throw new IllegalArgumentException("Unknown pay type: " + payType);
    }

    public static boolean isValid(String value) {
        for (StaffClass staffClass : values()) {
            if (staffClass.value.equalsIgnoreCase(value)) {
                return true;
            }
        }
        return false;
    }
}
