package io.stagewise.core.pipeline.node;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

import io.stagewise.core.execution.FatalNodeException;
import io.stagewise.core.graph.Command;
import io.stagewise.core.graph.NodeContext;
import io.stagewise.core.graph.Route;
import io.stagewise.core.pipeline.FakeSandbox;
import io.stagewise.core.pipeline.SandboxBootstrap;
import io.stagewise.core.sandbox.CodeExecution;
import io.stagewise.core.sandbox.ExecutionError;
import io.stagewise.core.sandbox.SandboxOutput;
import io.stagewise.core.state.Artifact;
import io.stagewise.core.state.ArtifactKind;
import io.stagewise.core.state.ArtifactSelection;
import io.stagewise.core.state.ChatMessage;
import io.stagewise.core.state.PipelineState;
import io.stagewise.core.state.StatePatch;
import io.stagewise.core.state.Table;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class SandboxNodesTest {

    private FakeSandbox sandbox;
    private NodeContext context;

    @BeforeEach
    void setUp() {
        sandbox = new FakeSandbox();
        context = mock(NodeContext.class);
    }

    private PipelineState withSession(PipelineState state) {
        return state.apply(StatePatch.builder().sessionHandle(sandbox.acquireSession()).build());
    }

    @Nested
    class InitSession {

        private final SandboxBootstrap bootstrap = new SandboxBootstrap("/tmp");
        private InitSessionNode node;

        @BeforeEach
        void setUp() {
            node = new InitSessionNode(sandbox, bootstrap);
        }

        private PipelineState withTable() {
            Table table = new Table(List.of("price"), List.of(List.of(10)));
            return NodeStates.fresh().apply(StatePatch.builder()
                    .artifact(Artifact.table("houses", "Melbourne houses", table))
                    .build());
        }

        @Test
        void shouldAcquireSessionAndPreloadArtifacts() {
            PipelineState state = withTable();

            Command command = node.execute(state, context);

            assertThat(state.apply(command.patch()).sessionHandle()).isEqualTo("sbx-1");
            assertThat(sandbox.files()).containsOnlyKeys("/tmp/houses.csv");
            assertThat(sandbox.executed()).singleElement().asString()
                    .contains("houses = pd.read_csv('/tmp/houses.csv')");
        }

        @Test
        void shouldReuseLiveSession() {
            PipelineState state = withSession(withTable());

            Command command = node.execute(state, context);

            assertThat(command.patch().isEmpty()).isTrue();
            assertThat(sandbox.acquired()).isEqualTo(1);
            assertThat(sandbox.executed()).isEmpty();
        }

        @Test
        void shouldReplaceDeadSession() {
            PipelineState state = withSession(withTable());
            sandbox.kill(state.sessionHandle());

            Command command = node.execute(state, context);

            assertThat(state.apply(command.patch()).sessionHandle()).isEqualTo("sbx-2");
        }

        @Test
        void shouldFailWhenBootstrapRaises() {
            PipelineState state = withTable();
            String script = SandboxBootstrap.script(bootstrap.files(state.artifacts().values()));
            sandbox.respond(script, CodeExecution.failed(new ExecutionError("ImportError", "no pandas", "tb")));

            assertThatThrownBy(() -> node.execute(state, context))
                    .isInstanceOf(FatalNodeException.class)
                    .hasMessage("Error initializing sandbox: tb");
        }
    }

    @Nested
    class Execute {

        private ExecuteNode node;

        @BeforeEach
        void setUp() {
            node = new ExecuteNode(sandbox);
        }

        @Test
        void shouldRunPendingCodeAndReportOutput() {
            PipelineState state = withSession(NodeStates.withMessages(3))
                    .apply(StatePatch.builder().pendingCode("print('hi')").build());
            sandbox.respond("print('hi')", new CodeExecution("hi", "", List.of(), null));

            Command command = node.execute(state, context);

            assertThat(command.route()).isEqualTo(new Route.Next());
            PipelineState next = state.apply(command.patch());
            assertThat(next.conversation()).last().isEqualTo(ChatMessage.user("<stdout>\nhi\n</stdout>"));
            assertThat(next.scratch().pendingCode()).isNull();
        }

        @Test
        void shouldFeedTruncatedTracebackBackToAgent() {
            PipelineState state = withSession(NodeStates.withMessages(3))
                    .apply(StatePatch.builder().pendingCode("df['nope']").build());
            sandbox.respond("df['nope']", CodeExecution.failed(
                    new ExecutionError("KeyError", "'nope'", "y".repeat(5000))));

            Command command = node.execute(state, context);

            String message = state.apply(command.patch()).conversation().get(3).content();
            assertThat(message).startsWith("KeyError: 'nope'").contains("chars omitted");
            assertThat(message.length()).isLessThan(1100);
        }

        @Test
        void shouldRefuseWithoutPendingCode() {
            PipelineState state = withSession(NodeStates.withMessages(3));

            assertThatThrownBy(() -> node.execute(state, context)).isInstanceOf(IllegalStateException.class);
        }
    }

    @Nested
    class Materialize {

        private MaterializeArtifactsNode node;

        @BeforeEach
        void setUp() {
            node = new MaterializeArtifactsNode(sandbox);
        }

        private PipelineState selecting(ArtifactSelection... selections) {
            return withSession(NodeStates.fresh())
                    .apply(StatePatch.builder().selections(List.of(selections)).build());
        }

        @Test
        void shouldStoreEachSelectedValue() {
            Table table = new Table(List.of("suburb"), List.of(List.of("Kew")));
            sandbox.respond("df_clean", new CodeExecution("", "", List.of(new SandboxOutput(ArtifactKind.TABLE, table)), null));
            sandbox.respond("stats", new CodeExecution("", "", List.of(new SandboxOutput(ArtifactKind.JSON, Map.of("n", 1))), null));
            PipelineState state = selecting(
                    new ArtifactSelection("df_clean", "cleaned houses"), new ArtifactSelection("stats", "counts"));

            PipelineState next = state.apply(node.execute(state, context).patch());

            assertThat(next.artifacts()).containsOnlyKeys("df_clean", "stats");
            assertThat(next.artifacts().get("df_clean").description()).isEqualTo("cleaned houses");
            assertThat(next.artifacts().get("df_clean").asTable()).isEqualTo(table);
        }

        @Test
        void shouldSkipValuesWithoutOutput() {
            sandbox.respond("plt", new CodeExecution("", "", List.of(), null));
            PipelineState state = selecting(new ArtifactSelection("plt", "plot module"));

            PipelineState next = state.apply(node.execute(state, context).patch());

            assertThat(next.artifacts()).isEmpty();
        }

        @Test
        void shouldAbortWhenVariableIsMissing() {
            sandbox.respond("ghost", CodeExecution.failed(new ExecutionError("NameError", "ghost", "NameError: ghost")));
            PipelineState state = selecting(new ArtifactSelection("ghost", ""));

            assertThatThrownBy(() -> node.execute(state, context))
                    .isInstanceOf(FatalNodeException.class)
                    .hasMessage("Error saving variable: NameError: ghost");
        }

        @Test
        void shouldDoNothingWithoutSelections() {
            Command command = node.execute(NodeStates.fresh(), context);

            assertThat(command.patch().isEmpty()).isTrue();
            assertThat(sandbox.executed()).isEmpty();
        }
    }
}
