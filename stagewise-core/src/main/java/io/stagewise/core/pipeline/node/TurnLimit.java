package io.stagewise.core.pipeline.node;

import io.stagewise.core.graph.Command;
import io.stagewise.core.graph.NodeContext;
import io.stagewise.core.pipeline.Prompts;
import io.stagewise.core.pipeline.StageDefinition;
import io.stagewise.core.pipeline.StageKind;
import io.stagewise.core.pipeline.TurnLimitPolicy;
import io.stagewise.core.state.ChatMessage;
import io.stagewise.core.state.PipelineState;
import io.stagewise.core.state.StatePatch;
import io.stagewise.core.template.TemplateResolver;
import java.util.Map;

/// Message budget shared by the agent nodes of every stage kind.
final class TurnLimit {

    private TurnLimit() {}

    /// Returns whether the stage conversation holds more than `2 x maxMessageTurns` messages.
    static boolean exhausted(PipelineState state, StageDefinition stage) {
        return state.conversation().size() > 2 * stage.maxMessageTurns();
    }

    /// Builds the command for an exhausted budget according to the stage's policy.
    static Command onExhausted(
            PipelineState state, StageDefinition stage, NodeContext context, TemplateResolver templates) {
        context.progress("Maximum iteration limit reached");
        if (stage.turnLimitPolicy() == TurnLimitPolicy.TERMINATE_RUN) {
            String report = templates.resolve(
                    Prompts.OBJECTIVE_STAGE_ABANDONED, Map.of("objective", state.objective()));
            return Command.terminate(StatePatch.builder()
                    .append(ChatMessage.user(Prompts.TURN_LIMIT_REACHED))
                    .turnLimitReached(true)
                    .finalReport(report)
                    .build());
        }
        String validation = stage.kind() == StageKind.OBJECTIVE
                ? StageNodes.CHECKLIST_VALIDATOR
                : StageNodes.VALIDATE_FANOUT;
        return Command.goTo(validation, StatePatch.builder()
                .append(ChatMessage.user(Prompts.TURN_LIMIT_REACHED))
                .turnLimitReached(true)
                .build());
    }
}
