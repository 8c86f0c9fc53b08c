package io.stagewise.server.validation;

/// Strips line breaks from user-supplied strings before they are logged, so a request cannot
/// forge log entries.
///
/// ```
/// LOG.infov("Input for session {0}", LogSanitizer.sanitize(sessionId));
/// ```
public final class LogSanitizer {

    private LogSanitizer() {}

    /// @param value the string to sanitize, may be null
    /// @return the value without `\r` and `\n`, or `"null"` for null input
    public static String sanitize(String value) {
        if (value == null) {
            return "null";
        }
        return value.replace("\r", "").replace("\n", "");
    }
}
