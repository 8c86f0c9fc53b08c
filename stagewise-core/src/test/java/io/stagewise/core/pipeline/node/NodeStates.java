package io.stagewise.core.pipeline.node;

import io.stagewise.core.pipeline.PipelineDefinition;
import io.stagewise.core.state.ChatMessage;
import io.stagewise.core.state.PipelineState;
import io.stagewise.core.state.RunOptions;
import io.stagewise.core.state.StatePatch;
import java.util.List;

/// States for exercising single nodes.
final class NodeStates {

    private NodeStates() {}

    static PipelineState fresh(RunOptions options) {
        return PipelineState.initial(
                "Which suburb has the best price growth?",
                PipelineDefinition.defaults().initialStages(),
                List.of(),
                options);
    }

    static PipelineState fresh() {
        return fresh(RunOptions.defaults());
    }

    /// A state whose conversation holds the given number of messages.
    static PipelineState withMessages(PipelineState state, int count) {
        StatePatch.Builder patch = StatePatch.builder().append(ChatMessage.system("instructions"));
        for (int i = 1; i < count; i++) {
            patch.append(i % 2 == 1 ? ChatMessage.user("user " + i) : ChatMessage.assistant("agent " + i));
        }
        return state.apply(patch.build());
    }

    static PipelineState withMessages(int count) {
        return withMessages(fresh(), count);
    }
}
