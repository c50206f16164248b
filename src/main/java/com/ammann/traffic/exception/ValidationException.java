/* (C)2026 */
package com.ammann.traffic.exception;

/**
 * Exception indicating that a client-supplied parameter or record does not meet
 * the required constraints for the requested operation.
 *
 * <p>Mapped to HTTP 400 (Bad Request) by {@link GlobalExceptionHandler}.
 * Always raised before any store read or aggregation starts.
 */
public class ValidationException extends ApiException {

    public ValidationException(String message) {
        super(message, null);
    }

    /**
     * Creates validation exception for invalid parameter.
     */
    public static ValidationException invalidParameter(String paramName, Object value, String expected) {
        return new ValidationException(
                String.format("Invalid parameter '%s': got '%s', expected %s",
                        paramName, value, expected));
    }

    /**
     * Creates validation exception for a record that cannot be appended to a store.
     */
    public static ValidationException rejectedRecord(String recordType, String reason) {
        return new ValidationException(
                String.format("Rejected %s: %s", recordType, reason));
    }
}
