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

/// Asks every critic identity, in order, whether the stage work has mistakes to fix.
///
/// All critics see the same transcript; each verdict is appended as its own message.
public class CriticValidatorNode implements Node {

    private final StageDefinition stage;
    private final List<TextGenerator> critics;
    private final TemplateResolver templates;

    public CriticValidatorNode(StageDefinition stage, List<TextGenerator> critics, TemplateResolver templates) {
        this.stage = stage;
        this.critics = List.copyOf(critics);
        this.templates = templates;
    }

    @Override
    public Command execute(PipelineState state, NodeContext context) {
        context.progress("Running critic review...");
        String rule = stage.criticGuide().isBlank()
                ? ""
                : templates.resolve(Prompts.CRITIC_RULE, Map.of("critic_guide", stage.criticGuide()));
        List<ChatMessage> input = new ArrayList<>(state.conversation());
        input.add(ChatMessage.user(templates.resolve(Prompts.CRITIC_REVIEW, Map.of("critic_rule", rule))));

        List<ValidationResult> results = new ArrayList<>();
        StatePatch.Builder patch = StatePatch.builder();
        for (TextGenerator critic : critics) {
            ValidationResult result = critic.generate(input, StructuredOutputs.VALIDATION);
            results.add(result);
            patch.append(ChatMessage.assistant(ValidationFormatter.criticMessage(result)));
        }
        return Command.next(patch.criticResults(results).build());
    }
}
