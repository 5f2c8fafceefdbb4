package com.mpl.domain.exception;

/**
 * Write rejected because the case changed since it was read
 */
public class StaleCaseException extends PersistenceException {

    private final String caseId;
    private final long expectedVersion;

    public StaleCaseException(String caseId, long expectedVersion) {
        super("Case " + caseId + " was modified concurrently (expected version " + expectedVersion + ")");
        this.caseId = caseId;
        this.expectedVersion = expectedVersion;
    }

    public String getCaseId() {
        return caseId;
    }

    public long getExpectedVersion() {
        return expectedVersion;
    }
}
