package io.stagewise.core.pipeline.node;

import io.stagewise.core.graph.Command;
import io.stagewise.core.graph.Node;
import io.stagewise.core.graph.NodeContext;
import io.stagewise.core.pipeline.PipelineDefinition;
import io.stagewise.core.state.PipelineState;
import io.stagewise.core.state.Stage;
import io.stagewise.core.state.StatePatch;
import java.util.Optional;
import java.util.logging.Logger;

/// Dispatches to the sub-graph of the first stage not yet completed, or ends the run when
/// every stage is done.
public class StageRouterNode implements Node {

    private static final Logger logger = Logger.getLogger(StageRouterNode.class.getName());

    private final PipelineDefinition definition;

    public StageRouterNode(PipelineDefinition definition) {
        this.definition = definition;
    }

    @Override
    public Command execute(PipelineState state, NodeContext context) {
        Optional<Stage> current = state.currentStage();
        if (current.isEmpty()) {
            logger.info("All stages completed for session " + context.sessionId());
            return Command.end(StatePatch.EMPTY);
        }
        String scope = definition.stage(current.get().order()).scope();
        logger.fine("Routing session " + context.sessionId() + " to " + scope);
        return Command.goTo(scope, StatePatch.EMPTY);
    }
}
