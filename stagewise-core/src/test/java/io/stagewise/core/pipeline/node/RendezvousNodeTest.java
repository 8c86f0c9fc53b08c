package io.stagewise.core.pipeline.node;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.stagewise.core.graph.Command;
import io.stagewise.core.graph.NodeContext;
import io.stagewise.core.graph.Route;
import io.stagewise.core.pipeline.PipelineDefinition;
import io.stagewise.core.pipeline.Prompts;
import io.stagewise.core.state.ChatMessage;
import io.stagewise.core.state.PipelineState;
import io.stagewise.core.state.RunOptions;
import io.stagewise.core.state.StatePatch;
import io.stagewise.core.state.ValidationResult;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class RendezvousNodeTest {

    private static final Route TO_AGENT = new Route.Goto(StageNodes.AGENT);
    private static final Route TO_MATERIALIZE = new Route.Goto(StageNodes.MATERIALIZE_ARTIFACTS);

    private NodeContext context;

    @BeforeEach
    void setUp() {
        context = mock(NodeContext.class);
    }

    private static PipelineState validated(RunOptions options, boolean checklistPassed, boolean criticsPassed) {
        ValidationResult critic = criticsPassed
                ? ValidationResult.pass("fine")
                : ValidationResult.fail("outliers kept", "Remove outliers");
        return NodeStates.withMessages(NodeStates.fresh(options), 4).apply(StatePatch.builder()
                .checklistResult(checklistPassed ? ValidationResult.pass("ok") : ValidationResult.fail("no", "fix"))
                .criticResults(List.of(critic, ValidationResult.pass("fine")))
                .build());
    }

    @Nested
    class WithHuman {

        private final RendezvousNode node = new RendezvousNode(PipelineDefinition.defaults().stage(2));
        private final RunOptions options = new RunOptions(false, true);

        @Test
        void shouldAddressFeedbackOnPassWhenValidationFailed() {
            when(context.suspend(anyString())).thenReturn("pass");
            PipelineState state = validated(options, true, false);

            Command command = node.execute(state, context);

            assertThat(command.route()).isEqualTo(TO_AGENT);
            assertThat(state.apply(command.patch()).conversation())
                    .last()
                    .isEqualTo(ChatMessage.user(Prompts.ADDRESS_FEEDBACK));
        }

        @Test
        void shouldAdvanceOnIgnoreAfterEarlierPass() {
            PipelineState state = validated(options, false, false);

            when(context.suspend(anyString())).thenReturn("pass");
            assertThat(node.execute(state, context).route()).isEqualTo(TO_AGENT);

            when(context.suspend(anyString())).thenReturn("  IGNORE ");
            assertThat(node.execute(state, context).route()).isEqualTo(TO_MATERIALIZE);
        }

        @Test
        void shouldAdvanceOnEmptyReplyWhenEverythingPassed() {
            when(context.suspend(anyString())).thenReturn("");

            Command command = node.execute(validated(options, true, true), context);

            assertThat(command.route()).isEqualTo(TO_MATERIALIZE);
            assertThat(command.patch().isEmpty()).isTrue();
        }

        @Test
        void shouldInsertFreeTextIntoConversation() {
            when(context.suspend(anyString())).thenReturn(" Please keep the 2016 rows ");
            PipelineState state = validated(options, true, true);

            Command command = node.execute(state, context);

            assertThat(command.route()).isEqualTo(TO_AGENT);
            assertThat(state.apply(command.patch()).conversation())
                    .last()
                    .isEqualTo(ChatMessage.user("Please keep the 2016 rows"));
        }

        @Test
        void shouldAskWithValidationSummary() {
            when(context.suspend(anyString())).thenReturn("pass");

            node.execute(validated(options, true, false), context);

            verify(context).suspend(contains("Critic 1: Remove outliers"));
        }
    }

    @Nested
    class WithoutHuman {

        private final RendezvousNode node = new RendezvousNode(PipelineDefinition.defaults().stage(3));

        @Test
        void shouldAdvanceWhenEverythingPassed() {
            Command command = node.execute(validated(RunOptions.defaults(), true, true), context);

            assertThat(command.route()).isEqualTo(TO_MATERIALIZE);
            verify(context, never()).suspend(anyString());
        }

        @Test
        void shouldAddressFeedbackWhenAnyValidationFailed() {
            Command command = node.execute(validated(RunOptions.defaults(), true, false), context);

            assertThat(command.route()).isEqualTo(TO_AGENT);
        }

        @Test
        void shouldAdvanceWhenTurnBudgetIsSpent() {
            PipelineState state = validated(RunOptions.defaults(), false, false)
                    .apply(StatePatch.builder().turnLimitReached(true).build());

            assertThat(node.execute(state, context).route()).isEqualTo(TO_MATERIALIZE);
        }
    }

    @Nested
    class ObjectiveStage {

        private final RendezvousNode node = new RendezvousNode(PipelineDefinition.defaults().stage(1));

        @Test
        void shouldWriteReportWhenChecklistPassed() {
            Command command = node.execute(validated(new RunOptions(false, true), true, false), context);

            assertThat(command.route()).isEqualTo(new Route.Goto(StageNodes.WRITE_REPORT));
            verify(context, never()).suspend(anyString());
        }

        @Test
        void shouldReturnToAgentWhenChecklistFailed() {
            assertThat(node.execute(validated(RunOptions.defaults(), false, true), context).route())
                    .isEqualTo(TO_AGENT);
        }

        @Test
        void shouldWriteReportOnceBudgetIsSpent() {
            PipelineState state = validated(RunOptions.defaults(), false, true)
                    .apply(StatePatch.builder().turnLimitReached(true).build());

            assertThat(node.execute(state, context).route()).isEqualTo(new Route.Goto(StageNodes.WRITE_REPORT));
        }
    }
}
