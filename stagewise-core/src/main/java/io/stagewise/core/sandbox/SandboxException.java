package io.stagewise.core.sandbox;

import io.stagewise.core.execution.UpstreamServiceException;
import java.io.Serial;

/// The sandbox service failed, as opposed to the code it ran.
public class SandboxException extends UpstreamServiceException {

    @Serial private static final long serialVersionUID = -4410956623189120847L;

    public SandboxException(String message) {
        super(message, null, null);
    }

    public SandboxException(String message, Throwable cause) {
        super(message, null, cause);
    }

    public SandboxException(String message, Integer statusCode, Throwable cause) {
        super(message, statusCode, cause);
    }
}
