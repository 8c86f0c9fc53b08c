package io.stagewise.core.pipeline.node;

import io.stagewise.core.graph.Command;
import io.stagewise.core.graph.Node;
import io.stagewise.core.graph.NodeContext;
import io.stagewise.core.llm.TextGenerator;
import io.stagewise.core.pipeline.Prompts;
import io.stagewise.core.state.ChatMessage;
import io.stagewise.core.state.ObjectiveAssessment;
import io.stagewise.core.state.PipelineState;
import io.stagewise.core.state.StatePatch;
import io.stagewise.core.template.TemplateResolver;
import java.util.List;
import java.util.Map;

/// Asks the user to clarify the objective and rewrites it from the reply.
///
/// Kept apart from {@link ObjectiveAssessNode} so that a resumed run re-enters at the
/// question and does not repeat the assessment call.
public class ClarifyObjectiveNode implements Node {

    private final TextGenerator rewriter;
    private final TemplateResolver templates;

    public ClarifyObjectiveNode(TextGenerator rewriter, TemplateResolver templates) {
        this.rewriter = rewriter;
        this.templates = templates;
    }

    @Override
    public Command execute(PipelineState state, NodeContext context) {
        ObjectiveAssessment assessment = state.scratch().assessment();
        if (assessment == null) {
            throw new IllegalStateException("No objective assessment to clarify");
        }
        String question = assessment.messageToUser().isBlank() ? assessment.reasoning() : assessment.messageToUser();
        String reply = context.suspend(question);
        String answer = reply == null ? "" : reply.strip();

        context.progress("Updating the objective...");
        String rewritten = rewriter.generate(List.of(ChatMessage.user(templates.resolve(
                Prompts.REWRITE_OBJECTIVE,
                Map.of("objective", state.objective(), "agent_message", question, "user_reply", answer)))));
        String objective = rewritten.strip();

        return Command.goTo(StageNodes.AGENT, StatePatch.builder()
                .objective(objective)
                .append(
                        ChatMessage.assistant(question),
                        ChatMessage.user(templates.resolve(
                                Prompts.OBJECTIVE_UPDATED, Map.of("user_reply", answer, "objective", objective))))
                .build());
    }
}
