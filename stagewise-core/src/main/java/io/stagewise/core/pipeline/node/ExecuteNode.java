package io.stagewise.core.pipeline.node;

import io.stagewise.core.graph.Command;
import io.stagewise.core.graph.Node;
import io.stagewise.core.graph.NodeContext;
import io.stagewise.core.pipeline.ExecutionFormatter;
import io.stagewise.core.sandbox.CodeExecution;
import io.stagewise.core.sandbox.Sandbox;
import io.stagewise.core.state.ChatMessage;
import io.stagewise.core.state.PipelineState;
import io.stagewise.core.state.StatePatch;

/// Runs the pending code in the stage's sandbox session and hands the output back to the agent.
///
/// Not idempotent: register with {@link io.stagewise.core.execution.RetryPolicy#noRetry()}.
public class ExecuteNode implements Node {

    private final Sandbox sandbox;

    public ExecuteNode(Sandbox sandbox) {
        this.sandbox = sandbox;
    }

    @Override
    public Command execute(PipelineState state, NodeContext context) {
        String code = state.scratch().pendingCode();
        if (code == null) {
            throw new IllegalStateException("No pending code to execute in " + context.nodeId());
        }
        if (state.sessionHandle() == null) {
            throw new IllegalStateException("No sandbox session for " + context.nodeId());
        }
        context.progress("Running Python code...");
        CodeExecution execution = sandbox.runCode(state.sessionHandle(), code);
        context.progress(execution.hasError()
                ? "Code execution encountered an error"
                : "Code executed successfully");
        return Command.next(StatePatch.builder()
                .append(ChatMessage.user(ExecutionFormatter.format(execution)))
                .pendingCode(null)
                .build());
    }
}
