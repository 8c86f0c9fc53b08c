package io.stagewise.core.pipeline.node;

import io.stagewise.core.graph.Command;
import io.stagewise.core.graph.Node;
import io.stagewise.core.graph.NodeContext;
import io.stagewise.core.llm.TextGenerator;
import io.stagewise.core.pipeline.Prompts;
import io.stagewise.core.pipeline.StructuredOutputs;
import io.stagewise.core.state.ArtifactSelection;
import io.stagewise.core.state.ChatMessage;
import io.stagewise.core.state.PipelineState;
import io.stagewise.core.state.StatePatch;
import java.util.ArrayList;
import java.util.List;

/// Selects the variables worth keeping, then fans out to both validators.
public class ValidateFanoutNode implements Node {

    private final TextGenerator selector;

    public ValidateFanoutNode(TextGenerator selector) {
        this.selector = selector;
    }

    @Override
    public Command execute(PipelineState state, NodeContext context) {
        List<ChatMessage> input = new ArrayList<>(state.conversation());
        input.add(ChatMessage.user(Prompts.SELECT_ARTIFACTS));
        List<ArtifactSelection> selections = selector.generate(input, StructuredOutputs.SELECTIONS);
        return Command.fanOut(
                StatePatch.builder().selections(selections).build(),
                StageNodes.CHECKLIST_VALIDATOR,
                StageNodes.CRITIC_VALIDATOR);
    }
}
