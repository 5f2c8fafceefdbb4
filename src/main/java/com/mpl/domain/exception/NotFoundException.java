package com.mpl.domain.exception;

/**
 * Unknown case, period or employee
 */
public class NotFoundException extends RuntimeException {

    private final String entityType;
    private final String entityId;

    public NotFoundException(String entityType, String entityId) {
        super(entityType + " not found: " + entityId);
        this.entityType = entityType;
        this.entityId = entityId;
    }

    public static NotFoundException maternityCase(String caseId) {
        return new NotFoundException("Case", caseId);
    }

    public static NotFoundException period(String periodId) {
        return new NotFoundException("Period", periodId);
    }

    public static NotFoundException employee(String employeeId) {
        return new NotFoundException("Employee", employeeId);
    }

    public String getEntityType() {
        return entityType;
    }

    public String getEntityId() {
        return entityId;
    }
}
