package io.stagewise.core.pipeline.node;

import io.stagewise.core.execution.FatalNodeException;
import io.stagewise.core.graph.Command;
import io.stagewise.core.graph.Node;
import io.stagewise.core.graph.NodeContext;
import io.stagewise.core.sandbox.CodeExecution;
import io.stagewise.core.sandbox.Sandbox;
import io.stagewise.core.sandbox.SandboxOutput;
import io.stagewise.core.state.Artifact;
import io.stagewise.core.state.ArtifactSelection;
import io.stagewise.core.state.PipelineState;
import io.stagewise.core.state.StatePatch;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/// Evaluates every selected variable in the sandbox session and stores the values as artifacts.
///
/// A selected name whose evaluation fails aborts the run. A name that evaluates to nothing
/// displayable is skipped.
public class MaterializeArtifactsNode implements Node {

    private static final Logger logger = Logger.getLogger(MaterializeArtifactsNode.class.getName());

    private final Sandbox sandbox;

    public MaterializeArtifactsNode(Sandbox sandbox) {
        this.sandbox = sandbox;
    }

    @Override
    public Command execute(PipelineState state, NodeContext context) {
        List<ArtifactSelection> selections = state.scratch().selections();
        if (selections.isEmpty()) {
            return Command.next(StatePatch.EMPTY);
        }
        if (state.sessionHandle() == null) {
            throw new IllegalStateException("No sandbox session to read selected variables from");
        }

        context.progress("Saving " + selections.size() + " variables...");
        List<Artifact> artifacts = new ArrayList<>();
        for (ArtifactSelection selection : selections) {
            CodeExecution execution = sandbox.runCode(state.sessionHandle(), selection.key());
            if (execution.hasError()) {
                throw new FatalNodeException("Error saving variable: " + execution.error().traceback());
            }
            if (execution.outputs().isEmpty()) {
                logger.warning("Variable '" + selection.key() + "' produced no value, not saved");
                continue;
            }
            SandboxOutput output = execution.outputs().get(0);
            artifacts.add(new Artifact(selection.key(), output.kind(), selection.description(), output.value()));
        }
        logger.fine("Materialized " + artifacts.size() + " of " + selections.size() + " selected variables");
        return Command.next(StatePatch.builder().artifacts(artifacts).build());
    }
}
