package io.stagewise.core.pipeline.node;

import io.stagewise.core.graph.Command;
import io.stagewise.core.graph.Node;
import io.stagewise.core.graph.NodeContext;
import io.stagewise.core.pipeline.ArtifactFormatter;
import io.stagewise.core.pipeline.Prompts;
import io.stagewise.core.pipeline.StageDefinition;
import io.stagewise.core.pipeline.StageKind;
import io.stagewise.core.state.ChatMessage;
import io.stagewise.core.state.PipelineState;
import io.stagewise.core.state.StatePatch;
import io.stagewise.core.template.TemplateResolver;
import java.util.HashMap;
import java.util.Map;

/// Starts a stage conversation: clears stage scratch and seeds the conversation with the
/// stage instructions and the opening user turn.
///
/// Template variables: `objective`, `checklist`, `artifact_descriptions`, `table_profile`,
/// `previous_report` (report of the preceding stage), `code_guidance`, `done_examples`.
public class InitHistoryNode implements Node {

    private final StageDefinition stage;
    private final TemplateResolver templates;

    public InitHistoryNode(StageDefinition stage, TemplateResolver templates) {
        this.stage = stage;
        this.templates = templates;
    }

    @Override
    public Command execute(PipelineState state, NodeContext context) {
        context.stageStarted(stage.order());
        context.progress("Initializing " + stage.label() + "...");

        Map<String, Object> variables = new HashMap<>();
        variables.put("objective", state.objective());
        variables.put("checklist", stage.checklist());
        variables.put("artifact_descriptions", ArtifactFormatter.describe(state.artifacts().values(), true));
        variables.put("table_profile", ArtifactFormatter.tableProfile(state.artifacts().values()));
        variables.put("previous_report", previousReport(state));
        variables.put("code_guidance", Prompts.CODE_GUIDANCE);
        variables.put("done_examples", Prompts.DONE_EXAMPLES);

        String opening = stage.kind() == StageKind.OBJECTIVE ? Prompts.OBJECTIVE_REQUEST : Prompts.OPENING;
        return Command.next(StatePatch.builder()
                .clearScratch()
                .resetConversation()
                .append(
                        ChatMessage.system(templates.resolve(stage.instructions(), variables)),
                        ChatMessage.user(templates.resolve(opening, variables)))
                .build());
    }

    private String previousReport(PipelineState state) {
        return state.stages().stream()
                .filter(s -> s.order() < stage.order() && s.completed())
                .reduce((first, second) -> second)
                .map(s -> s.report())
                .orElse("");
    }
}
