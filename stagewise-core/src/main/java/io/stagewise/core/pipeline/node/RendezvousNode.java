package io.stagewise.core.pipeline.node;

import io.stagewise.core.graph.Command;
import io.stagewise.core.graph.Node;
import io.stagewise.core.graph.NodeContext;
import io.stagewise.core.pipeline.Prompts;
import io.stagewise.core.pipeline.StageDefinition;
import io.stagewise.core.pipeline.StageKind;
import io.stagewise.core.pipeline.ValidationFormatter;
import io.stagewise.core.state.ChatMessage;
import io.stagewise.core.state.PipelineState;
import io.stagewise.core.state.StageScratch;
import io.stagewise.core.state.StatePatch;
import java.util.Locale;

/// Decides what happens after validation.
///
/// ### Objective stage
/// A passed checklist or a spent turn budget moves on to the report, anything else goes back
/// to the agent.
///
/// ### Code stages
/// With a human in the loop the node suspends with a summary of both validations and reads
/// the reply:
/// - empty or `pass`: advance when every validation passed, otherwise address the feedback
/// - `ignore`: advance regardless of the verdicts
/// - anything else: inserted into the conversation as a user turn, back to the agent
///
/// Without a human the node advances when every validation passed or the turn budget is spent,
/// otherwise it sends the agent back to address the feedback.
public class RendezvousNode implements Node {

    static final String PASS = "pass";
    static final String IGNORE = "ignore";

    private final StageDefinition stage;

    public RendezvousNode(StageDefinition stage) {
        this.stage = stage;
    }

    @Override
    public Command execute(PipelineState state, NodeContext context) {
        StageScratch scratch = state.scratch();
        if (stage.kind() == StageKind.OBJECTIVE) {
            return scratch.checklistPassed() || scratch.turnLimitReached()
                    ? Command.goTo(StageNodes.WRITE_REPORT, StatePatch.EMPTY)
                    : Command.goTo(StageNodes.AGENT, StatePatch.EMPTY);
        }

        boolean allPassed = scratch.checklistPassed() && scratch.allCriticsPassed();
        if (state.options().useHumanInTheLoop()) {
            String reply = context.suspend(ValidationFormatter.rendezvousQuestion(
                    stage.label(), scratch.checklistResult(), scratch.criticResults()));
            String answer = reply == null ? "" : reply.strip();
            String normalized = answer.toLowerCase(Locale.ROOT);
            if (normalized.equals(IGNORE)) {
                return Command.goTo(StageNodes.MATERIALIZE_ARTIFACTS, StatePatch.EMPTY);
            }
            if (normalized.isEmpty() || normalized.equals(PASS)) {
                return allPassed ? advance() : addressFeedback();
            }
            return Command.goTo(StageNodes.AGENT, StatePatch.builder()
                    .append(ChatMessage.user(answer))
                    .build());
        }

        if (allPassed || scratch.turnLimitReached()) {
            return advance();
        }
        return addressFeedback();
    }

    private static Command advance() {
        return Command.goTo(StageNodes.MATERIALIZE_ARTIFACTS, StatePatch.EMPTY);
    }

    private static Command addressFeedback() {
        return Command.goTo(StageNodes.AGENT, StatePatch.builder()
                .append(ChatMessage.user(Prompts.ADDRESS_FEEDBACK))
                .build());
    }
}
