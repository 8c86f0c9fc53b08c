package io.stagewise.core.sandbox;

/// Runtime error raised by code inside the sandbox.
///
/// @param name error type name, never null
/// @param message error message, never null
/// @param traceback full traceback text, never null
public record ExecutionError(String name, String message, String traceback) {

    public ExecutionError {
        name = name != null ? name : "Error";
        message = message != null ? message : "";
        traceback = traceback != null ? traceback : "";
    }
}
