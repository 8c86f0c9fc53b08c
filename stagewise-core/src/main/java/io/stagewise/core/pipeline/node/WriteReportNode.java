package io.stagewise.core.pipeline.node;

import io.stagewise.core.graph.Command;
import io.stagewise.core.graph.Node;
import io.stagewise.core.graph.NodeContext;
import io.stagewise.core.llm.TextGenerator;
import io.stagewise.core.pipeline.Prompts;
import io.stagewise.core.pipeline.StageDefinition;
import io.stagewise.core.pipeline.StageKind;
import io.stagewise.core.state.ChatMessage;
import io.stagewise.core.state.PipelineState;
import io.stagewise.core.state.Stage;
import io.stagewise.core.state.StageScratch;
import io.stagewise.core.state.StatePatch;
import java.util.ArrayList;
import java.util.List;

/// Closes a stage: writes its report, marks it completed and drops the stage scratch.
///
/// ### Contracts
/// - **Precondition**: the checklist verdict is present; code stages also need critic verdicts
/// - **Postcondition**: the stage is completed exactly once
public class WriteReportNode implements Node {

    private final StageDefinition stage;
    private final TextGenerator reviewer;

    public WriteReportNode(StageDefinition stage, TextGenerator reviewer) {
        this.stage = stage;
        this.reviewer = reviewer;
    }

    @Override
    public Command execute(PipelineState state, NodeContext context) {
        StageScratch scratch = state.scratch();
        if (scratch.checklistResult() == null) {
            throw new IllegalStateException(stage.label() + " has no checklist validation result");
        }
        if (stage.kind() == StageKind.CODE && scratch.criticResults().isEmpty()) {
            throw new IllegalStateException(stage.label() + " has no critic validation results");
        }

        context.progress("Writing the " + stage.name() + " report...");
        List<ChatMessage> input = new ArrayList<>(state.conversation());
        input.add(ChatMessage.user(Prompts.WRITE_STAGE_REPORT));
        String report = reviewer.generate(input);

        Stage completed = state.stage(stage.order()).complete(report);
        return Command.end(StatePatch.builder()
                .stage(completed)
                .clearScratch()
                .build());
    }
}
