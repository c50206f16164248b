/* (C)2026 */
package com.ammann.traffic.exception;

import java.time.Duration;

/**
 * Raised when a view computation exceeds its caller-supplied deadline or is cancelled.
 *
 * <p>Mapped to HTTP 504 (Gateway Timeout) by {@link GlobalExceptionHandler}.
 */
public class ViewTimeoutException extends ApiException {

    public ViewTimeoutException(String view, Duration timeout) {
        super(String.format("View '%s' did not complete within %d ms", view, timeout.toMillis()));
    }

    public ViewTimeoutException(String message) {
        super(message);
    }
}
