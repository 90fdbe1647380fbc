package com.salary.equity.core;

import java.util.Objects;

/**
 * Runtime exception raised by the equity engine.
 * Carries the {@link ErrorKind} and, for record-level failures, the id of the
 * employee whose record was rejected.
 */
public class EquityException extends RuntimeException {

    private final ErrorKind kind;
    private final String employeeId;

    public EquityException(ErrorKind kind, String message) {
        this(kind, null, message);
    }

    public EquityException(ErrorKind kind, String employeeId, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind is required");
        this.employeeId = employeeId;
    }

    public EquityException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind is required");
        this.employeeId = null;
    }

    public ErrorKind getKind() {
        return kind;
    }

    /**
     * Returns the failing employee id, or null for configuration errors.
     */
    public String getEmployeeId() {
        return employeeId;
    }

    /**
     * Converts this exception into a record error for batch reporting.
     */
    public RecordError toRecordError() {
        return new RecordError(employeeId, kind, getMessage());
    }
}
