package io.stagewise.core.pipeline.node;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.stagewise.core.graph.Command;
import io.stagewise.core.graph.NodeContext;
import io.stagewise.core.graph.Route;
import io.stagewise.core.pipeline.PipelineDefinition;
import io.stagewise.core.pipeline.Prompts;
import io.stagewise.core.state.Artifact;
import io.stagewise.core.state.ChatMessage;
import io.stagewise.core.state.PipelineState;
import io.stagewise.core.state.RunOptions;
import io.stagewise.core.state.StatePatch;
import io.stagewise.core.state.ValidationResult;
import io.stagewise.core.template.SimpleTemplateResolver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class RunFlowNodesTest {

    private final PipelineDefinition definition = PipelineDefinition.defaults();
    private NodeContext context;

    @BeforeEach
    void setUp() {
        context = mock(NodeContext.class);
        when(context.sessionId()).thenReturn("s-1");
    }

    @Nested
    class Prepare {

        @Test
        void shouldSkipObjectiveStageWhenAsked() {
            PipelineState state = NodeStates.fresh(new RunOptions(true, false));

            Command command = new PrepareRunNode().execute(state, context);

            PipelineState next = state.apply(command.patch());
            assertThat(next.stage(1).completed()).isTrue();
            assertThat(next.stage(1).report()).isEmpty();
            assertThat(next.currentStage()).map(s -> s.order()).contains(2);
        }

        @Test
        void shouldLeaveStagesAloneByDefault() {
            Command command = new PrepareRunNode().execute(NodeStates.fresh(), context);

            assertThat(command.patch().isEmpty()).isTrue();
        }
    }

    @Nested
    class Router {

        @Test
        void shouldRouteToFirstPendingStage() {
            PipelineState state = NodeStates.fresh();
            state = state.apply(StatePatch.builder().stage(state.stage(1).complete("done")).build());

            Command command = new StageRouterNode(definition).execute(state, context);

            assertThat(command.route()).isEqualTo(new Route.Goto("stage_2"));
        }

        @Test
        void shouldEndWhenEveryStageIsComplete() {
            PipelineState state = NodeStates.fresh();
            StatePatch.Builder patch = StatePatch.builder();
            state.stages().forEach(s -> patch.stage(s.complete("report " + s.order())));

            Command command = new StageRouterNode(definition).execute(state.apply(patch.build()), context);

            assertThat(command.route()).isEqualTo(new Route.End());
        }
    }

    @Nested
    class InitHistory {

        @Test
        void shouldStartCleanConversationForStage() {
            PipelineState state = NodeStates.withMessages(6).apply(StatePatch.builder()
                    .checklistResult(ValidationResult.pass("earlier"))
                    .artifact(Artifact.text("notes", "analyst notes", "check 2019"))
                    .build());

            Command command = new InitHistoryNode(definition.stage(3), new SimpleTemplateResolver())
                    .execute(state, context);

            PipelineState next = state.apply(command.patch());
            assertThat(next.conversation()).hasSize(2);
            assertThat(next.conversation().get(0).role()).isEqualTo(ChatMessage.Role.SYSTEM);
            assertThat(next.conversation().get(0).content()).contains("notes");
            assertThat(next.conversation().get(1)).isEqualTo(ChatMessage.user(Prompts.OPENING));
            assertThat(next.scratch().checklistResult()).isNull();
            verify(context).stageStarted(3);
        }

        @Test
        void shouldOpenObjectiveStageWithUserRequest() {
            Command command = new InitHistoryNode(definition.stage(1), new SimpleTemplateResolver())
                    .execute(NodeStates.fresh(), context);

            PipelineState next = NodeStates.fresh().apply(command.patch());
            assertThat(next.conversation().get(1))
                    .isEqualTo(ChatMessage.user("User request: Which suburb has the best price growth?"));
        }
    }
}
