package io.stagewise.core.pipeline.node;

import io.stagewise.core.graph.Command;
import io.stagewise.core.graph.Node;
import io.stagewise.core.graph.NodeContext;
import io.stagewise.core.llm.TextGenerator;
import io.stagewise.core.pipeline.ArtifactFormatter;
import io.stagewise.core.pipeline.Prompts;
import io.stagewise.core.pipeline.StageDefinition;
import io.stagewise.core.state.ChatMessage;
import io.stagewise.core.state.PipelineState;
import io.stagewise.core.state.Stage;
import io.stagewise.core.state.StatePatch;
import io.stagewise.core.template.TemplateResolver;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/// Writes the final report from the objective, the stage reports and the final artifacts.
///
/// Stage reports of ten characters or fewer are left out; artifact samples are not truncated.
public class FinalReportNode implements Node {

    static final int MIN_REPORT_LENGTH = 10;

    private final StageDefinition stage;
    private final TextGenerator reviewer;
    private final TemplateResolver templates;

    public FinalReportNode(StageDefinition stage, TextGenerator reviewer, TemplateResolver templates) {
        this.stage = stage;
        this.reviewer = reviewer;
        this.templates = templates;
    }

    @Override
    public Command execute(PipelineState state, NodeContext context) {
        context.stageStarted(stage.order());
        context.progress("Preparing final report...");

        String system = templates.resolve(Prompts.FINAL_REPORT_INSTRUCTIONS, Map.of(
                "objective", state.objective(),
                "stage_reports", stageReports(state)));
        String request = templates.resolve(Prompts.FINAL_REPORT_REQUEST, Map.of(
                "final_artifacts", ArtifactFormatter.describe(state.artifacts().values(), false)));
        String report = reviewer.generate(List.of(ChatMessage.system(system), ChatMessage.user(request)));

        context.progress("Final report completed!");
        return Command.end(StatePatch.builder()
                .finalReport(report)
                .stage(state.stage(stage.order()).complete(report))
                .build());
    }

    static String stageReports(PipelineState state) {
        return state.stages().stream()
                .filter(s -> s.report().length() > MIN_REPORT_LENGTH)
                .map(FinalReportNode::tagged)
                .collect(Collectors.joining("\n\n"));
    }

    private static String tagged(Stage stage) {
        return "<stage_" + stage.order() + ">\n" + stage.report() + "\n</stage_" + stage.order() + ">";
    }
}
