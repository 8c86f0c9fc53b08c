package io.stagewise.core.pipeline.node;

import io.stagewise.core.graph.Command;
import io.stagewise.core.graph.Node;
import io.stagewise.core.graph.NodeContext;
import io.stagewise.core.llm.TextGenerator;
import io.stagewise.core.pipeline.CodeBlockParser;
import io.stagewise.core.pipeline.Prompts;
import io.stagewise.core.pipeline.StageDefinition;
import io.stagewise.core.state.ChatMessage;
import io.stagewise.core.state.PipelineState;
import io.stagewise.core.state.StatePatch;
import io.stagewise.core.template.TemplateResolver;
import java.util.Optional;

/// One agent turn of a code stage.
///
/// Routing, checked in order:
/// 1. the conversation holds more than `2 x maxMessageTurns` messages: note the limit, flag it
///    and go to validation (or stop the run, per the stage's turn-limit policy)
/// 2. the response has a python block and no done marker: store the code, go to execution
/// 3. the response has the done marker: go to validation
/// 4. otherwise: append a corrective instruction and take another turn
public class CodeAgentNode implements Node {

    private final StageDefinition stage;
    private final TextGenerator agent;
    private final TemplateResolver templates;

    public CodeAgentNode(StageDefinition stage, TextGenerator agent, TemplateResolver templates) {
        this.stage = stage;
        this.agent = agent;
        this.templates = templates;
    }

    @Override
    public Command execute(PipelineState state, NodeContext context) {
        if (TurnLimit.exhausted(state, stage)) {
            return TurnLimit.onExhausted(state, stage, context, templates);
        }

        context.progress("Analyzing and planning next steps...");
        String response = agent.generate(state.conversation());
        ChatMessage reply = ChatMessage.assistant(response);

        Optional<String> code = CodeBlockParser.extractCode(response);
        if (code.isPresent()) {
            context.progress("Executing code...");
            return Command.goTo(StageNodes.EXECUTE, StatePatch.builder()
                    .append(reply)
                    .pendingCode(code.get())
                    .build());
        }
        if (CodeBlockParser.isDone(response)) {
            context.progress("Finalizing stage and saving variables...");
            return Command.goTo(StageNodes.VALIDATE_FANOUT, StatePatch.builder().append(reply).build());
        }
        context.progress("Clarifying response format...");
        return Command.goTo(StageNodes.AGENT, StatePatch.builder()
                .append(reply, ChatMessage.user(Prompts.CORRECTIVE))
                .build());
    }
}
