package com.mpl.domain.model;

/**
 * How the entitlement engine treated a period on its last run
 */
public enum CmpAllocation {
    ALLOCATED("allocated"),
    NO_SMP("no SMP for period"),
    BEYOND_ENTITLEMENT("beyond entitlement");

    private final String description;

    CmpAllocation(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
