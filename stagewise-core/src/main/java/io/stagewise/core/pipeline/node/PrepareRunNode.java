package io.stagewise.core.pipeline.node;

import io.stagewise.core.graph.Command;
import io.stagewise.core.graph.Node;
import io.stagewise.core.graph.NodeContext;
import io.stagewise.core.state.PipelineState;
import io.stagewise.core.state.Stage;
import io.stagewise.core.state.StatePatch;

/// Applies run options before the first stage: with `skipFirstStage` the lowest-order stage is
/// marked completed without a report.
public class PrepareRunNode implements Node {

    @Override
    public Command execute(PipelineState state, NodeContext context) {
        if (!state.options().skipFirstStage() || state.stages().isEmpty()) {
            return Command.next(StatePatch.EMPTY);
        }
        Stage first = state.stages().get(0);
        if (first.completed()) {
            return Command.next(StatePatch.EMPTY);
        }
        return Command.next(StatePatch.builder().stage(first.complete("")).build());
    }
}
