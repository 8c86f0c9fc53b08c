package io.stagewise.core.pipeline;

import java.util.Optional;

/// Classifies agent responses into code to run, a finished stage, or neither.
public final class CodeBlockParser {

    private static final String OPEN_FENCE = "```python";
    private static final String CLOSE_FENCE = "```";

    private CodeBlockParser() {}

    /// Extracts the first python block of a response.
    ///
    /// A response containing the done marker never yields code, even if it also has a block.
    /// Without a closing fence the rest of the response is taken.
    ///
    /// @param response agent response, not null
    /// @return trimmed code, empty when there is none or it is blank
    public static Optional<String> extractCode(String response) {
        if (isDone(response)) {
            return Optional.empty();
        }
        int open = response.indexOf(OPEN_FENCE);
        if (open < 0) {
            return Optional.empty();
        }
        String rest = response.substring(open + OPEN_FENCE.length());
        int close = rest.indexOf(CLOSE_FENCE);
        String code = (close < 0 ? rest : rest.substring(0, close)).strip();
        return code.isEmpty() ? Optional.empty() : Optional.of(code);
    }

    public static boolean isDone(String response) {
        return response.contains(Prompts.DONE_MARKER);
    }
}
