package io.stagewise.core.pipeline.node;

import io.stagewise.core.graph.Command;
import io.stagewise.core.graph.Node;
import io.stagewise.core.graph.NodeContext;
import io.stagewise.core.llm.TextGenerator;
import io.stagewise.core.pipeline.StageDefinition;
import io.stagewise.core.pipeline.StructuredOutputs;
import io.stagewise.core.state.ChatMessage;
import io.stagewise.core.state.ObjectiveAssessment;
import io.stagewise.core.state.PipelineState;
import io.stagewise.core.state.StatePatch;
import io.stagewise.core.template.TemplateResolver;

/// Agent turn of the objective stage: judges whether the objective can be worked on.
///
/// A ready objective goes to checklist validation; otherwise the user is asked for
/// clarification. The message budget is checked before the model is called.
public class ObjectiveAssessNode implements Node {

    private final StageDefinition stage;
    private final TextGenerator assessor;
    private final TemplateResolver templates;

    public ObjectiveAssessNode(StageDefinition stage, TextGenerator assessor, TemplateResolver templates) {
        this.stage = stage;
        this.assessor = assessor;
        this.templates = templates;
    }

    @Override
    public Command execute(PipelineState state, NodeContext context) {
        if (TurnLimit.exhausted(state, stage)) {
            return TurnLimit.onExhausted(state, stage, context, templates);
        }

        context.progress("Reviewing the objective...");
        ObjectiveAssessment assessment = assessor.generate(state.conversation(), StructuredOutputs.ASSESSMENT);
        if (assessment.ready()) {
            context.progress("Objective is clear, validating...");
            return Command.goTo(StageNodes.CHECKLIST_VALIDATOR, StatePatch.builder()
                    .assessment(assessment)
                    .append(ChatMessage.assistant(assessment.reasoning()))
                    .build());
        }
        return Command.goTo(StageNodes.CLARIFY, StatePatch.builder().assessment(assessment).build());
    }
}
