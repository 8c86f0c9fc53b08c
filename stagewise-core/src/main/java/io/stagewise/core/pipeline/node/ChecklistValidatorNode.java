package io.stagewise.core.pipeline.node;

import io.stagewise.core.graph.Command;
import io.stagewise.core.graph.Node;
import io.stagewise.core.graph.NodeContext;
import io.stagewise.core.llm.TextGenerator;
import io.stagewise.core.pipeline.Prompts;
import io.stagewise.core.pipeline.StageDefinition;
import io.stagewise.core.pipeline.StructuredOutputs;
import io.stagewise.core.pipeline.ValidationFormatter;
import io.stagewise.core.state.ChatMessage;
import io.stagewise.core.state.PipelineState;
import io.stagewise.core.state.StatePatch;
import io.stagewise.core.state.ValidationResult;
import io.stagewise.core.template.TemplateResolver;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/// Reviews the stage transcript against the stage checklist.
public class ChecklistValidatorNode implements Node {

    private final StageDefinition stage;
    private final TextGenerator reviewer;
    private final TemplateResolver templates;

    public ChecklistValidatorNode(StageDefinition stage, TextGenerator reviewer, TemplateResolver templates) {
        this.stage = stage;
        this.reviewer = reviewer;
        this.templates = templates;
    }

    @Override
    public Command execute(PipelineState state, NodeContext context) {
        context.progress("Validating against the checklist...");
        List<ChatMessage> input = new ArrayList<>(state.conversation());
        input.add(ChatMessage.user(
                templates.resolve(Prompts.CHECKLIST_REVIEW, Map.of("checklist", stage.checklist()))));
        ValidationResult result = reviewer.generate(input, StructuredOutputs.VALIDATION);
        return Command.next(StatePatch.builder()
                .checklistResult(result)
                .append(ChatMessage.assistant(ValidationFormatter.checklistMessage(result)))
                .build());
    }
}
