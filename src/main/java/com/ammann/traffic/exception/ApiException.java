/* (C)2026 */
package com.ammann.traffic.exception;

/**
 * Base unchecked exception for all application-level errors in the traffic analytics API.
 *
 * <p>Subclasses represent specific error categories (invalid parameters, unavailable input,
 * view timeouts) and are mapped to appropriate HTTP status codes by
 * {@link GlobalExceptionHandler}.
 */
public class ApiException extends RuntimeException
{
    public ApiException(String message, Throwable cause) {
        super(message, cause);
    }

    public ApiException(String message) {
        super(message);
    }
}
