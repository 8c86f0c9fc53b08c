package io.stagewise.core.sandbox;

import java.util.List;

/// Captured result of one `runCode` call.
///
/// @param stdout standard output lines joined, never null
/// @param stderr standard error lines joined, never null
/// @param outputs rich results in emission order, never null
/// @param error runtime error, null when the code ran cleanly
public record CodeExecution(String stdout, String stderr, List<SandboxOutput> outputs, ExecutionError error) {

    public CodeExecution {
        stdout = stdout != null ? stdout : "";
        stderr = stderr != null ? stderr : "";
        outputs = outputs != null ? List.copyOf(outputs) : List.of();
    }

    public static CodeExecution failed(ExecutionError error) {
        return new CodeExecution("", "", List.of(), error);
    }

    public boolean hasError() {
        return error != null;
    }
}
