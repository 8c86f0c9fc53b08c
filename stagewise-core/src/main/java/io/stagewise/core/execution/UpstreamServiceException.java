package io.stagewise.core.execution;

import java.io.Serial;
import java.util.OptionalInt;

/// Failure reported by an external service (text generation or sandbox).
///
/// Carries the HTTP status when the service reported one, so the retry classifier can tell
/// server-side outages from rejected requests.
public class UpstreamServiceException extends RuntimeException {

    @Serial private static final long serialVersionUID = -6032186451937726404L;

    private final Integer statusCode;

    public UpstreamServiceException(String message, Integer statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public OptionalInt statusCode() {
        return statusCode != null ? OptionalInt.of(statusCode) : OptionalInt.empty();
    }
}
