package io.stagewise.core.llm;

import io.stagewise.core.execution.UpstreamServiceException;
import java.io.Serial;

/// Text generation failed: the provider call errored or the output did not fit the schema.
public class GenerationException extends UpstreamServiceException {

    @Serial private static final long serialVersionUID = 5177263025012870412L;

    public GenerationException(String message) {
        super(message, null, null);
    }

    public GenerationException(String message, Throwable cause) {
        super(message, null, cause);
    }

    public GenerationException(String message, Integer statusCode, Throwable cause) {
        super(message, statusCode, cause);
    }
}
