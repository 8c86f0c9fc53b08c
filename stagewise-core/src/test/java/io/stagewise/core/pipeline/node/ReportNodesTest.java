package io.stagewise.core.pipeline.node;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

import io.stagewise.core.graph.Command;
import io.stagewise.core.graph.NodeContext;
import io.stagewise.core.graph.Route;
import io.stagewise.core.pipeline.PipelineDefinition;
import io.stagewise.core.pipeline.Prompts;
import io.stagewise.core.pipeline.ScriptedTextGenerator;
import io.stagewise.core.state.Artifact;
import io.stagewise.core.state.ChatMessage;
import io.stagewise.core.state.PipelineState;
import io.stagewise.core.state.StatePatch;
import io.stagewise.core.state.ValidationResult;
import io.stagewise.core.template.SimpleTemplateResolver;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ReportNodesTest {

    private final PipelineDefinition definition = PipelineDefinition.defaults();
    private NodeContext context;

    @BeforeEach
    void setUp() {
        context = mock(NodeContext.class);
    }

    @Nested
    class StageReport {

        @Test
        void shouldCompleteStageAndClearScratch() {
            ScriptedTextGenerator reviewer = new ScriptedTextGenerator("reviewer").text("Removed 12 duplicate rows.");
            PipelineState state = NodeStates.withMessages(5).apply(StatePatch.builder()
                    .pendingCode("x = 1")
                    .checklistResult(ValidationResult.pass("ok"))
                    .criticResults(List.of(ValidationResult.pass("ok")))
                    .build());

            Command command = new WriteReportNode(definition.stage(2), reviewer).execute(state, context);

            assertThat(command.route()).isEqualTo(new Route.End());
            PipelineState next = state.apply(command.patch());
            assertThat(next.stage(2).completed()).isTrue();
            assertThat(next.stage(2).report()).isEqualTo("Removed 12 duplicate rows.");
            assertThat(next.scratch().checklistResult()).isNull();
            assertThat(next.conversation()).isEmpty();
            assertThat(reviewer.calls().get(0)).last().isEqualTo(ChatMessage.user(Prompts.WRITE_STAGE_REPORT));
        }

        @Test
        void shouldNotNeedCriticsForObjectiveStage() {
            ScriptedTextGenerator reviewer = new ScriptedTextGenerator("reviewer").text("Objective settled.");
            PipelineState state = NodeStates.withMessages(3).apply(StatePatch.builder()
                    .checklistResult(ValidationResult.pass("ok"))
                    .build());

            Command command = new WriteReportNode(definition.stage(1), reviewer).execute(state, context);

            assertThat(state.apply(command.patch()).stage(1).completed()).isTrue();
        }

        @Test
        void shouldRefuseWithoutValidation() {
            WriteReportNode node = new WriteReportNode(definition.stage(2), new ScriptedTextGenerator("reviewer"));
            PipelineState checklistOnly = NodeStates.withMessages(3).apply(StatePatch.builder()
                    .checklistResult(ValidationResult.pass("ok"))
                    .build());

            assertThatThrownBy(() -> node.execute(NodeStates.withMessages(3), context))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("no checklist validation result");
            assertThatThrownBy(() -> node.execute(checklistOnly, context))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("no critic validation results");
        }
    }

    @Nested
    class FinalReport {

        private PipelineState finishedStages() {
            PipelineState state = NodeStates.fresh();
            return state.apply(StatePatch.builder()
                    .stage(state.stage(1).complete("Objective: rank suburbs by growth."))
                    .stage(state.stage(2).complete("short"))
                    .stage(state.stage(3).complete("Kew and Richmond lead growth."))
                    .artifact(Artifact.text("summary", "one-line summary", "Kew leads"))
                    .build());
        }

        @Test
        void shouldTagOnlySubstantialStageReports() {
            String reports = FinalReportNode.stageReports(finishedStages());

            assertThat(reports).isEqualTo("<stage_1>\nObjective: rank suburbs by growth.\n</stage_1>\n\n"
                    + "<stage_3>\nKew and Richmond lead growth.\n</stage_3>");
        }

        @Test
        void shouldWriteReportFromStagesAndArtifacts() {
            ScriptedTextGenerator reviewer = new ScriptedTextGenerator("reviewer").text("# Report");
            PipelineState state = finishedStages();

            Command command = new FinalReportNode(definition.stage(5), reviewer, new SimpleTemplateResolver())
                    .execute(state, context);

            assertThat(command.route()).isEqualTo(new Route.End());
            PipelineState next = state.apply(command.patch());
            assertThat(next.finalReport()).isEqualTo("# Report");
            assertThat(next.stage(5).completed()).isTrue();
            List<ChatMessage> input = reviewer.calls().get(0);
            assertThat(input.get(0).content())
                    .contains("# Original objective: Which suburb has the best price growth?")
                    .contains("<stage_3>");
            assertThat(input.get(1).content()).contains("summary");
            verify(context).stageStarted(5);
        }
    }
}
