package com.salary.equity.core;

import java.util.Objects;

/**
 * An employee record that was rejected during a run.
 *
 * @param employeeId the failing employee id (may be null when the id itself was missing)
 * @param kind       the failure kind
 * @param message    human readable detail
 */
public record RecordError(String employeeId, ErrorKind kind, String message) {

    public RecordError {
        Objects.requireNonNull(kind, "kind is required");
    }
}
