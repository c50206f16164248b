/* (C)2026 */
package com.ammann.traffic.exception;

/**
 * Raised when a store read fails or times out.
 *
 * <p>A view that hits this error returns no result at all. An empty result would
 * read as "no activity" and mask the outage. Mapped to HTTP 503 by
 * {@link GlobalExceptionHandler}.
 */
public class InputUnavailableException extends ApiException {

    private final String store;

    public InputUnavailableException(String store, Throwable cause) {
        super(String.format("%s unavailable: %s", store,
                cause != null ? cause.getMessage() : "unknown cause"), cause);
        this.store = store;
    }

    public String getStore() {
        return store;
    }
}
